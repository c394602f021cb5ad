package my.exitwaterfall.app.service;

import my.exitwaterfall.app.model.ShareholderSummary;
import my.exitwaterfall.app.service.util.Amounts;
import my.exitwaterfall.app.service.util.ProRata;
import my.exitwaterfall.app.service.util.ShareClasses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Final catch-up: everything still undistributed goes pro-rata to participating shares and all
 * options. Classes held back by a non-participating preference are left out. Holdings under a
 * participation cap are clipped at their ceiling and the excess is re-shared among the others.
 */
public class ProRataDistributor {
	private static final Logger logger = LoggerFactory.getLogger(ProRataDistributor.class);
	private static final String LABEL = "Distribution (Pro-rata)";

	void distribute(WaterfallLedger ledger) {
		BigDecimal remaining = ledger.remaining();
		if (remaining.signum() <= 0) {
			return;
		}
		Map<Holding, BigDecimal> weights = new LinkedHashMap<>();
		for (ShareholderAccount account : ledger.accounts()) {
			ShareholderSummary summary = account.summary();
			summary.sharesByClass().forEach((shareClass, shares) -> {
				if (shares != null && shares > 0 && !ledger.isExcludedFromCatchUp(shareClass)) {
					weights.merge(new Holding(shareClass, account.shareholderId()), BigDecimal.valueOf(shares), BigDecimal::add);
				}
			});
			if (summary.totalOptions() > 0) {
				weights.merge(new Holding(ShareClasses.ORDINARY, account.shareholderId()),
						BigDecimal.valueOf(summary.totalOptions()), BigDecimal::add);
			}
		}
		Set<String> cappedClasses = new LinkedHashSet<>();
		Map<Holding, BigDecimal> allocations = allocateWithinCaps(ledger, weights, remaining, cappedClasses);
		BigDecimal distributed = Amounts.sum(allocations.values());
		if (distributed.signum() <= 0) {
			ledger.abandon(remaining);
			ledger.deduct(remaining);
			ledger.note("No participating shares left for the remaining " + Amounts.format(remaining)
					+ "; amount left unallocated");
			return;
		}

		Map<String, Map<String, BigDecimal>> byClass = new LinkedHashMap<>();
		for (Map.Entry<Holding, BigDecimal> entry : allocations.entrySet()) {
			Holding holding = entry.getKey();
			ledger.account(holding.shareholderId()).addParticipation(entry.getValue());
			byClass.computeIfAbsent(holding.shareClass(), key -> new LinkedHashMap<>())
					.merge(holding.shareholderId(), entry.getValue(), BigDecimal::add);
		}

		int stepNumber = ledger.nextStepNumber();
		BigDecimal running = remaining;
		List<String> classes = ShareClasses.displayOrder(byClass.keySet());
		for (String shareClass : classes) {
			Map<String, BigDecimal> recipients = byClass.get(shareClass);
			BigDecimal classTotal = Amounts.sum(recipients.values());
			if (classTotal.signum() <= 0) {
				continue;
			}
			running = running.subtract(classTotal);
			String description = shareClass + " shares" + (cappedClasses.contains(shareClass) ? " (capped)" : "");
			ledger.appendStep(stepNumber, LABEL, description, shareClass, classTotal,
					Amounts.floorAtZero(running), true, recipients);
		}
		ledger.deduct(remaining);
		BigDecimal stranded = Amounts.money(remaining.subtract(distributed));
		if (!cappedClasses.isEmpty() && stranded.signum() > 0) {
			ledger.abandon(stranded);
			ledger.note("Participation caps leave " + Amounts.format(stranded)
					+ " without an uncapped holder; amount left unallocated");
		}
		ledger.appendTotal(stepNumber, LABEL,
				"Total pro-rata distribution to " + String.join(", ", classes),
				distributed, ledger.remaining());
		logger.debug("Pro-rata distribution of {} over {} holdings, capped classes {}",
				distributed, allocations.size(), cappedClasses);
	}

	/**
	 * Pro-rata split where capped holdings never exceed their limit. A holding above its limit at
	 * the current rate stays above it once others are clipped, so all of them are fixed per round.
	 */
	private static Map<Holding, BigDecimal> allocateWithinCaps(WaterfallLedger ledger,
															   Map<Holding, BigDecimal> weights,
															   BigDecimal amount,
															   Set<String> cappedClasses) {
		Map<Holding, BigDecimal> open = new LinkedHashMap<>(weights);
		Map<Holding, BigDecimal> clipped = new LinkedHashMap<>();
		BigDecimal left = amount;
		Map<Holding, BigDecimal> shares = ProRata.allocate(open, left);
		boolean clippedAny = true;
		while (clippedAny && !shares.isEmpty()) {
			clippedAny = false;
			for (Map.Entry<Holding, BigDecimal> entry : shares.entrySet()) {
				Holding holding = entry.getKey();
				BigDecimal limit = ledger.participationLimit(holding.shareClass(), holding.shareholderId());
				if (limit != null && entry.getValue().compareTo(limit) > 0) {
					clipped.put(holding, limit);
					open.remove(holding);
					left = left.subtract(limit);
					cappedClasses.add(holding.shareClass());
					clippedAny = true;
				}
			}
			if (clippedAny) {
				shares = ProRata.allocate(open, left);
			}
		}
		Map<Holding, BigDecimal> allocations = new LinkedHashMap<>();
		for (Holding holding : weights.keySet()) {
			BigDecimal value = clipped.containsKey(holding) ? clipped.get(holding) : shares.get(holding);
			if (value != null) {
				allocations.put(holding, value);
			}
		}
		return allocations;
	}

	private record Holding(String shareClass, String shareholderId) {
	}
}
