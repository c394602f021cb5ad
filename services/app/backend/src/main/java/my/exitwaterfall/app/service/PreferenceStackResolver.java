package my.exitwaterfall.app.service;

import my.exitwaterfall.app.model.LiquidationPreference;
import my.exitwaterfall.app.model.Investment;
import my.exitwaterfall.app.model.PayoutStructure;
import my.exitwaterfall.app.model.PreferenceType;
import my.exitwaterfall.app.model.Round;
import my.exitwaterfall.app.model.WaterfallConfig;
import my.exitwaterfall.app.service.util.Amounts;
import my.exitwaterfall.app.service.util.ProRata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pays liquidation preference claims in seniority order. Ranks are handed one at a time to the
 * {@link PreferencePayoutStrategy} of the configured payout structure.
 */
public class PreferenceStackResolver {
	private static final Logger logger = LoggerFactory.getLogger(PreferenceStackResolver.class);

	private final PreferencePayoutStrategy standardStrategy;
	private final PreferencePayoutStrategy pariPassuStrategy;
	private final ConversionAnalyzer conversionAnalyzer;

	public PreferenceStackResolver() {
		this(new StandardPreferencePayoutStrategy(), new PariPassuPreferencePayoutStrategy(), new ConversionAnalyzer());
	}

	PreferenceStackResolver(PreferencePayoutStrategy standardStrategy,
							PreferencePayoutStrategy pariPassuStrategy,
							ConversionAnalyzer conversionAnalyzer) {
		this.standardStrategy = standardStrategy;
		this.pariPassuStrategy = pariPassuStrategy;
		this.conversionAnalyzer = conversionAnalyzer;
	}

	void resolve(WaterfallLedger ledger, List<LiquidationPreference> preferences, WaterfallConfig config) {
		PayoutStructure structure = config.payoutStructure() == null ? PayoutStructure.STANDARD : config.payoutStructure();
		List<PreferenceClaim> claims = buildClaims(ledger, preferences);
		if (structure == PayoutStructure.COMMON_ONLY) {
			if (!preferences.isEmpty()) {
				ledger.note("Common-only payout structure: " + preferences.size() + " liquidation preference(s) ignored");
			}
			ConversionAnalyzer.convertAll(ledger, claims).forEach(ledger::recordConversion);
			return;
		}
		PreferencePayoutStrategy strategy = structure == PayoutStructure.PARI_PASSU ? pariPassuStrategy : standardStrategy;

		List<PreferenceClaim> effective = claims;
		if (!Boolean.FALSE.equals(config.conversionAnalysis())) {
			ConversionAnalyzer.Outcome outcome = conversionAnalyzer.analyze(ledger, claims, this, strategy);
			outcome.decisions().forEach(ledger::recordConversion);
			if (!outcome.convertedClaims().isEmpty()) {
				effective = new ArrayList<>();
				for (PreferenceClaim claim : claims) {
					if (outcome.convertedClaims().contains(claim)) {
						logger.debug("Class {} converted to ordinary", claim.shareClass());
					} else {
						effective.add(claim);
					}
				}
			}
		}
		for (PreferenceClaim claim : effective) {
			if (claim.preference().type() == PreferenceType.NON_PARTICIPATING) {
				ledger.excludeFromCatchUp(claim.shareClass());
			}
		}

		Map<PreferenceClaim, Map<String, BigDecimal>> paidShares = new IdentityHashMap<>();
		if (structure == PayoutStructure.PARI_PASSU) {
			payPariPassu(ledger, effective, strategy, paidShares);
		} else {
			payStandard(ledger, effective, strategy, paidShares);
		}
		limitCappedParticipation(ledger, effective, paidShares);
	}

	/**
	 * Predicts the payout of every claim with the given strategy without touching the ledger.
	 */
	Map<PreferenceClaim, BigDecimal> predict(List<PreferenceClaim> claims,
											PreferencePayoutStrategy strategy,
											BigDecimal available) {
		Map<PreferenceClaim, BigDecimal> predicted = new IdentityHashMap<>();
		BigDecimal left = available;
		for (List<PreferenceClaim> rank : groupBySeniority(claims).values()) {
			List<BigDecimal> paid = strategy.resolve(totals(rank), left);
			for (int i = 0; i < rank.size(); i++) {
				predicted.put(rank.get(i), paid.get(i));
				left = left.subtract(paid.get(i));
			}
		}
		return predicted;
	}

	private void payStandard(WaterfallLedger ledger,
							 List<PreferenceClaim> claims,
							 PreferencePayoutStrategy strategy,
							 Map<PreferenceClaim, Map<String, BigDecimal>> paidShares) {
		for (List<PreferenceClaim> rank : groupBySeniority(claims).values()) {
			List<BigDecimal> paid = strategy.resolve(totals(rank), ledger.remaining());
			for (int i = 0; i < rank.size(); i++) {
				PreferenceClaim claim = rank.get(i);
				BigDecimal amount = paid.get(i);
				if (amount.signum() <= 0) {
					continue;
				}
				int stepNumber = ledger.nextStepNumber();
				String label = "Liqu Pref " + claim.shareClass();
				Map<String, BigDecimal> recipients = pay(ledger, claim, amount);
				paidShares.put(claim, recipients);
				ledger.appendStep(stepNumber, label, describe(claim), claim.shareClass(), amount, ledger.remaining(),
						claim.participating(), recipients);
				if (claim.participating()) {
					ledger.appendTotal(stepNumber, label,
							"Total " + claim.shareClass() + " preference, pro-rata participation follows",
							amount, ledger.remaining());
				}
			}
		}
	}

	private void payPariPassu(WaterfallLedger ledger,
							  List<PreferenceClaim> claims,
							  PreferencePayoutStrategy strategy,
							  Map<PreferenceClaim, Map<String, BigDecimal>> paidShares) {
		for (Map.Entry<Integer, List<PreferenceClaim>> entry : groupBySeniority(claims).entrySet()) {
			List<PreferenceClaim> rank = entry.getValue();
			List<BigDecimal> paid = strategy.resolve(totals(rank), ledger.remaining());
			BigDecimal rankTotal = Amounts.sum(paid);
			if (rankTotal.signum() <= 0) {
				continue;
			}
			int stepNumber = ledger.nextStepNumber();
			String label = "Liqu Pref (Pari Passu)";
			for (int i = 0; i < rank.size(); i++) {
				PreferenceClaim claim = rank.get(i);
				BigDecimal amount = paid.get(i);
				if (amount.signum() <= 0) {
					continue;
				}
				Map<String, BigDecimal> recipients = pay(ledger, claim, amount);
				paidShares.put(claim, recipients);
				ledger.appendStep(stepNumber, label, describe(claim), claim.shareClass(), amount, ledger.remaining(),
						claim.participating(), recipients);
			}
			ledger.appendTotal(stepNumber, label, "Total seniority " + entry.getKey(), rankTotal, ledger.remaining());
		}
	}

	/**
	 * Registers, per investor of a capped round, how much catch-up is left under the cap once the
	 * preference is paid.
	 */
	private void limitCappedParticipation(WaterfallLedger ledger,
										  List<PreferenceClaim> claims,
										  Map<PreferenceClaim, Map<String, BigDecimal>> paidShares) {
		for (PreferenceClaim claim : claims) {
			if (!claim.capped()) {
				continue;
			}
			Map<String, BigDecimal> paid = paidShares.getOrDefault(claim, Map.of());
			claim.investorInvestments().forEach((shareholderId, invested) -> {
				BigDecimal ceiling = invested.multiply(claim.preference().cap());
				BigDecimal limit = Amounts.floorAtZero(ceiling.subtract(paid.getOrDefault(shareholderId, BigDecimal.ZERO)));
				ledger.limitParticipation(claim.shareClass(), shareholderId, limit);
			});
		}
	}

	private static String describe(PreferenceClaim claim) {
		if (claim.capped()) {
			return claim.shareClass() + " shares (Participating, capped at "
					+ claim.preference().cap().stripTrailingZeros().toPlainString() + "x)";
		}
		return claim.shareClass() + " shares" + (claim.participating() ? " (Participating)" : "");
	}

	private Map<String, BigDecimal> pay(WaterfallLedger ledger, PreferenceClaim claim, BigDecimal amount) {
		Map<String, BigDecimal> recipients = ProRata.scale(claim.investorClaims(), amount, claim.totalClaim());
		recipients.forEach((shareholderId, share) -> ledger.account(shareholderId).addPreference(share));
		ledger.deduct(amount);
		logger.debug("Preference {} paid {} of claim {}, remaining {}",
				claim.shareClass(), amount, claim.totalClaim(), ledger.remaining());
		return recipients;
	}

	private List<PreferenceClaim> buildClaims(WaterfallLedger ledger, List<LiquidationPreference> preferences) {
		List<LiquidationPreference> sorted = new ArrayList<>();
		for (LiquidationPreference preference : preferences) {
			if (preference != null) {
				sorted.add(preference);
			}
		}
		sorted.sort(Comparator.comparing(preference ->
				preference.seniority() == null ? Integer.MAX_VALUE : preference.seniority()));

		List<PreferenceClaim> claims = new ArrayList<>();
		for (LiquidationPreference preference : sorted) {
			Round round = ledger.round(preference.roundId());
			if (round == null) {
				ledger.note("Liquidation preference references unknown round '" + preference.roundId() + "'; skipped");
				continue;
			}
			BigDecimal multiple = Amounts.safe(preference.multiple());
			Map<String, BigDecimal> investorInvestments = new LinkedHashMap<>();
			Map<String, BigDecimal> investorClaims = new LinkedHashMap<>();
			for (Investment investment : round.investments()) {
				if (investment == null) {
					continue;
				}
				if (ledger.account(investment.shareholderId()) == null) {
					ledger.note("Investment in round '" + round.id() + "' references unknown shareholder '"
							+ investment.shareholderId() + "'; left out of the preference claim");
					continue;
				}
				BigDecimal invested = Amounts.safe(investment.amount());
				if (invested.signum() > 0) {
					investorInvestments.merge(investment.shareholderId(), invested, BigDecimal::add);
				}
				BigDecimal claim = invested.multiply(multiple);
				if (claim.signum() > 0) {
					investorClaims.merge(investment.shareholderId(), claim, BigDecimal::add);
				}
			}
			claims.add(new PreferenceClaim(preference, round, investorInvestments, investorClaims,
					Amounts.sum(investorClaims.values())));
		}
		return claims;
	}

	private static Map<Integer, List<PreferenceClaim>> groupBySeniority(List<PreferenceClaim> claims) {
		Map<Integer, List<PreferenceClaim>> ranks = new LinkedHashMap<>();
		for (PreferenceClaim claim : claims) {
			ranks.computeIfAbsent(claim.seniority(), key -> new ArrayList<>()).add(claim);
		}
		return ranks;
	}

	private static List<BigDecimal> totals(List<PreferenceClaim> rank) {
		List<BigDecimal> totals = new ArrayList<>(rank.size());
		for (PreferenceClaim claim : rank) {
			totals.add(claim.totalClaim());
		}
		return totals;
	}
}
