package my.exitwaterfall.app.service;

import my.exitwaterfall.app.model.CapTable;
import my.exitwaterfall.app.model.Investment;
import my.exitwaterfall.app.model.OptionGrant;
import my.exitwaterfall.app.model.Round;
import my.exitwaterfall.app.model.Shareholder;
import my.exitwaterfall.app.model.ShareholderRole;
import my.exitwaterfall.app.model.ShareholderSummary;
import my.exitwaterfall.app.service.util.Amounts;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derives per-shareholder holdings from a cap table: shares per round share class, options per
 * pool and cash invested. Entries referring to unknown shareholders are ignored.
 */
public class CapTableSummarizer {

	public Map<String, ShareholderSummary> summarize(CapTable capTable) {
		Map<String, Holdings> holdingsById = new LinkedHashMap<>();
		if (capTable == null) {
			return Map.of();
		}
		for (Shareholder shareholder : capTable.shareholders()) {
			if (shareholder == null || shareholder.id() == null) {
				continue;
			}
			holdingsById.putIfAbsent(shareholder.id(), new Holdings(shareholder));
		}
		for (Round round : capTable.rounds()) {
			if (round == null) {
				continue;
			}
			for (Investment investment : round.investments()) {
				Holdings holdings = investment == null ? null : holdingsById.get(investment.shareholderId());
				if (holdings == null) {
					continue;
				}
				long shares = resolveShares(investment, round);
				if (shares > 0 && round.shareClass() != null) {
					holdings.sharesByClass.merge(round.shareClass(), shares, Long::sum);
				}
				holdings.invested = holdings.invested.add(Amounts.safe(investment.amount()));
			}
		}
		for (OptionGrant grant : capTable.optionGrants()) {
			Holdings holdings = grant == null ? null : holdingsById.get(grant.shareholderId());
			if (holdings == null || grant.shares() == null || grant.shares() <= 0) {
				continue;
			}
			String pool = grant.roundId() == null ? "" : grant.roundId();
			holdings.optionsByPool.merge(pool, grant.shares(), Long::sum);
		}

		Map<String, ShareholderSummary> summaries = new LinkedHashMap<>();
		for (Holdings holdings : holdingsById.values()) {
			summaries.put(holdings.shareholder.id(), holdings.toSummary());
		}
		return summaries;
	}

	static long resolveShares(Investment investment, Round round) {
		if (investment.shares() != null && investment.shares() > 0) {
			return investment.shares();
		}
		BigDecimal pricePerShare = round.pricePerShare();
		BigDecimal amount = investment.amount();
		if (pricePerShare == null || pricePerShare.signum() <= 0 || amount == null || amount.signum() <= 0) {
			return 0L;
		}
		return amount.divide(pricePerShare, 0, RoundingMode.FLOOR).longValue();
	}

	private static final class Holdings {
		private final Shareholder shareholder;
		private final Map<String, Long> sharesByClass = new LinkedHashMap<>();
		private final Map<String, Long> optionsByPool = new LinkedHashMap<>();
		private BigDecimal invested = BigDecimal.ZERO;

		private Holdings(Shareholder shareholder) {
			this.shareholder = shareholder;
		}

		private ShareholderSummary toSummary() {
			long totalShares = sharesByClass.values().stream().mapToLong(Long::longValue).sum();
			long totalOptions = optionsByPool.values().stream().mapToLong(Long::longValue).sum();
			ShareholderRole role = shareholder.role() == null ? ShareholderRole.OTHER : shareholder.role();
			String name = shareholder.name() == null ? shareholder.id() : shareholder.name();
			return new ShareholderSummary(shareholder.id(), name, role, sharesByClass, optionsByPool,
					totalShares, totalOptions, invested);
		}
	}
}
