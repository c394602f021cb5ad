package my.exitwaterfall.app.service;

import my.exitwaterfall.app.model.ConversionDecision;
import my.exitwaterfall.app.service.util.Amounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lets every non-participating class choose between its preference and converting to ordinary.
 * <p>
 * Both options are valued by replaying the preference stack: keeping pays the predicted
 * preference, converting drops the claim and pays the class its catch-up share of whatever the
 * remaining claims leave. Choices depend on each other, so classes re-decide until no choice
 * changes. Participation caps are ignored here; they only ever raise a converted class's share.
 */
public class ConversionAnalyzer {
	private static final Logger logger = LoggerFactory.getLogger(ConversionAnalyzer.class);
	private static final BigDecimal EPSILON = new BigDecimal("0.01");

	Outcome analyze(WaterfallLedger ledger,
					List<PreferenceClaim> claims,
					PreferenceStackResolver resolver,
					PreferencePayoutStrategy strategy) {
		BigDecimal available = ledger.remaining();
		Set<PreferenceClaim> converted = identitySet();
		boolean changed = true;
		int passes = 0;
		while (changed && passes <= claims.size()) {
			changed = false;
			passes++;
			for (PreferenceClaim claim : claims) {
				if (claim.participating()) {
					continue;
				}
				Options options = options(ledger, claims, converted, claim, resolver, strategy, available);
				boolean convert = options.asConverted().compareTo(options.asPreference().add(EPSILON)) > 0;
				if (convert != converted.contains(claim)) {
					if (convert) {
						converted.add(claim);
					} else {
						converted.remove(claim);
					}
					changed = true;
				}
			}
		}
		if (changed) {
			ledger.note("Conversion analysis did not settle after " + passes + " passes; last choices applied");
		}
		logger.debug("Conversion analysis settled after {} passes, {} of {} claims converted",
				passes, converted.size(), claims.size());

		List<ConversionDecision> decisions = new ArrayList<>();
		for (PreferenceClaim claim : claims) {
			Options options = options(ledger, claims, converted, claim, resolver, strategy, available);
			long classShares = ledger.classShares(claim.shareClass());
			ConversionDecision.Decision decision = converted.contains(claim)
					? ConversionDecision.Decision.CONVERT_TO_ORDINARY
					: ConversionDecision.Decision.KEEP_PREFERENCE;
			String reason;
			if (claim.participating()) {
				reason = "Participating preferred";
			} else if (decision == ConversionDecision.Decision.CONVERT_TO_ORDINARY) {
				reason = "Conversion (" + Amounts.format(options.asConverted()) + ") > Preference ("
						+ Amounts.format(options.asPreference()) + ")";
			} else {
				reason = "Preference (" + Amounts.format(options.asPreference()) + ") >= Conversion ("
						+ Amounts.format(options.asConverted()) + ")";
			}
			decisions.add(new ConversionDecision(claim.shareClass(), classShares, Amounts.money(options.asPreference()),
					Amounts.money(options.asConverted()), decision, reason));
		}
		return new Outcome(decisions, converted);
	}

	static List<ConversionDecision> convertAll(WaterfallLedger ledger, List<PreferenceClaim> claims) {
		List<ConversionDecision> decisions = new ArrayList<>();
		long eligible = ledger.catchUpShares(Set.of());
		for (PreferenceClaim claim : claims) {
			long classShares = ledger.classShares(claim.shareClass());
			decisions.add(new ConversionDecision(claim.shareClass(), classShares, Amounts.money(BigDecimal.ZERO),
					Amounts.money(shareOf(classShares, eligible, ledger.remaining())),
					ConversionDecision.Decision.CONVERT_TO_ORDINARY, "Common-only mode"));
		}
		return decisions;
	}

	private Options options(WaterfallLedger ledger,
							List<PreferenceClaim> claims,
							Set<PreferenceClaim> converted,
							PreferenceClaim claim,
							PreferenceStackResolver resolver,
							PreferencePayoutStrategy strategy,
							BigDecimal available) {
		Set<PreferenceClaim> ifKept = identitySet();
		ifKept.addAll(converted);
		ifKept.remove(claim);
		Set<PreferenceClaim> ifConverted = identitySet();
		ifConverted.addAll(converted);
		ifConverted.add(claim);
		return new Options(
				valueOf(ledger, claim, project(ledger, claims, ifKept, resolver, strategy, available)),
				valueOf(ledger, claim, project(ledger, claims, ifConverted, resolver, strategy, available)));
	}

	private Projection project(WaterfallLedger ledger,
							   List<PreferenceClaim> claims,
							   Set<PreferenceClaim> converted,
							   PreferenceStackResolver resolver,
							   PreferencePayoutStrategy strategy,
							   BigDecimal available) {
		List<PreferenceClaim> kept = new ArrayList<>();
		Set<String> heldBack = new HashSet<>();
		for (PreferenceClaim claim : claims) {
			if (converted.contains(claim)) {
				continue;
			}
			kept.add(claim);
			if (!claim.participating()) {
				heldBack.add(claim.shareClass());
			}
		}
		Map<PreferenceClaim, BigDecimal> paid = resolver.predict(kept, strategy, available);
		BigDecimal leftover = Amounts.floorAtZero(available.subtract(Amounts.sum(paid.values())));
		return new Projection(paid, leftover, heldBack, ledger.catchUpShares(heldBack));
	}

	private static BigDecimal valueOf(WaterfallLedger ledger, PreferenceClaim claim, Projection projection) {
		BigDecimal value = projection.paid().getOrDefault(claim, BigDecimal.ZERO);
		if (!projection.heldBack().contains(claim.shareClass())) {
			value = value.add(shareOf(ledger.classShares(claim.shareClass()), projection.catchUpShares(),
					projection.leftover()));
		}
		if (claim.capped() && projection.paid().containsKey(claim)) {
			value = Amounts.min(value, claim.capAmount());
		}
		return value;
	}

	private static BigDecimal shareOf(long shares, long totalShares, BigDecimal amount) {
		if (totalShares <= 0 || shares <= 0) {
			return BigDecimal.ZERO;
		}
		return BigDecimal.valueOf(shares).multiply(amount).divide(BigDecimal.valueOf(totalShares), Amounts.MATH);
	}

	private static Set<PreferenceClaim> identitySet() {
		return Collections.newSetFromMap(new IdentityHashMap<>());
	}

	private record Options(BigDecimal asPreference, BigDecimal asConverted) {
	}

	private record Projection(
			Map<PreferenceClaim, BigDecimal> paid,
			BigDecimal leftover,
			Set<String> heldBack,
			long catchUpShares
	) {
	}

	record Outcome(List<ConversionDecision> decisions, Set<PreferenceClaim> convertedClaims) {
	}
}
