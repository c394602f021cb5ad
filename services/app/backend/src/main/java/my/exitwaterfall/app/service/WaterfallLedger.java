package my.exitwaterfall.app.service;

import my.exitwaterfall.app.model.CapTable;
import my.exitwaterfall.app.model.ConversionDecision;
import my.exitwaterfall.app.model.Round;
import my.exitwaterfall.app.model.ShareholderSummary;
import my.exitwaterfall.app.model.StepRecipient;
import my.exitwaterfall.app.model.WaterfallStep;
import my.exitwaterfall.app.service.util.Amounts;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state shared by the phases of one waterfall calculation: remaining proceeds, the
 * per-shareholder accounts and the append-only step trace. Never shared between calculations.
 */
final class WaterfallLedger {
	private final Map<String, Round> roundsById = new LinkedHashMap<>();
	private final Map<String, ShareholderAccount> accounts = new LinkedHashMap<>();
	private final List<WaterfallStep> steps = new ArrayList<>();
	private final List<String> diagnostics = new ArrayList<>();
	private final List<ConversionDecision> conversionDecisions = new ArrayList<>();
	private final Set<String> excludedClasses = new LinkedHashSet<>();
	private final Map<String, Map<String, BigDecimal>> participationLimits = new LinkedHashMap<>();
	private final BigDecimal exitValuation;
	private BigDecimal remaining;
	private BigDecimal unallocated = BigDecimal.ZERO;
	private int stepNumber;

	WaterfallLedger(CapTable capTable, Map<String, ShareholderSummary> summaries, BigDecimal exitValuation) {
		for (Round round : capTable.rounds()) {
			if (round != null && round.id() != null) {
				roundsById.putIfAbsent(round.id(), round);
			}
		}
		for (ShareholderSummary summary : summaries.values()) {
			accounts.put(summary.shareholderId(), new ShareholderAccount(summary));
		}
		this.exitValuation = exitValuation;
		this.remaining = exitValuation;
	}

	BigDecimal exitValuation() {
		return exitValuation;
	}

	BigDecimal remaining() {
		return remaining;
	}

	void setRemaining(BigDecimal remaining) {
		this.remaining = remaining;
	}

	void deduct(BigDecimal amount) {
		remaining = remaining.subtract(amount);
	}

	BigDecimal unallocated() {
		return unallocated;
	}

	void abandon(BigDecimal amount) {
		unallocated = unallocated.add(amount);
	}

	Round round(String roundId) {
		return roundId == null ? null : roundsById.get(roundId);
	}

	ShareholderAccount account(String shareholderId) {
		return shareholderId == null ? null : accounts.get(shareholderId);
	}

	Collection<ShareholderAccount> accounts() {
		return accounts.values();
	}

	long totalFullyDilutedShares() {
		long total = 0;
		for (ShareholderAccount account : accounts.values()) {
			total += account.summary().fullyDilutedShares();
		}
		return total;
	}

	long classShares(String shareClass) {
		long total = 0;
		for (ShareholderAccount account : accounts.values()) {
			total += account.summary().sharesOf(shareClass);
		}
		return total;
	}

	/**
	 * Shares taking part in the catch-up when the given classes are held back: every share outside
	 * them plus all options.
	 */
	long catchUpShares(Set<String> heldBackClasses) {
		long total = 0;
		for (ShareholderAccount account : accounts.values()) {
			ShareholderSummary summary = account.summary();
			for (Map.Entry<String, Long> entry : summary.sharesByClass().entrySet()) {
				if (entry.getValue() != null && !heldBackClasses.contains(entry.getKey())) {
					total += entry.getValue();
				}
			}
			total += summary.totalOptions();
		}
		return total;
	}

	void excludeFromCatchUp(String shareClass) {
		excludedClasses.add(shareClass);
	}

	boolean isExcludedFromCatchUp(String shareClass) {
		return excludedClasses.contains(shareClass);
	}

	void limitParticipation(String shareClass, String shareholderId, BigDecimal limit) {
		participationLimits.computeIfAbsent(shareClass, key -> new LinkedHashMap<>())
				.merge(shareholderId, limit, BigDecimal::add);
	}

	/**
	 * Catch-up ceiling of one holding, or {@code null} when uncapped.
	 */
	BigDecimal participationLimit(String shareClass, String shareholderId) {
		Map<String, BigDecimal> limits = participationLimits.get(shareClass);
		return limits == null ? null : limits.get(shareholderId);
	}

	void note(String message) {
		diagnostics.add(message);
	}

	List<String> diagnostics() {
		return List.copyOf(diagnostics);
	}

	void recordConversion(ConversionDecision decision) {
		conversionDecisions.add(decision);
	}

	List<ConversionDecision> conversionDecisions() {
		return List.copyOf(conversionDecisions);
	}

	int nextStepNumber() {
		stepNumber += 1;
		return stepNumber;
	}

	void appendStep(int number,
					String label,
					String description,
					String shareClass,
					BigDecimal amount,
					BigDecimal remainingBalance,
					boolean participating,
					Map<String, BigDecimal> recipientAmounts) {
		steps.add(new WaterfallStep(
				steps.size() + 1,
				number,
				number + "/ " + label,
				description,
				shareClass,
				Amounts.money(amount),
				Amounts.money(remainingBalance),
				false,
				participating,
				toRecipients(recipientAmounts)
		));
	}

	void appendTotal(int number, String label, String description, BigDecimal amount, BigDecimal remainingBalance) {
		steps.add(new WaterfallStep(
				steps.size() + 1,
				number,
				number + "/ " + label,
				description,
				null,
				Amounts.money(amount),
				Amounts.money(remainingBalance),
				true,
				false,
				List.of()
		));
	}

	List<WaterfallStep> steps() {
		return List.copyOf(steps);
	}

	private List<StepRecipient> toRecipients(Map<String, BigDecimal> recipientAmounts) {
		if (recipientAmounts == null || recipientAmounts.isEmpty()) {
			return List.of();
		}
		List<StepRecipient> recipients = new ArrayList<>();
		for (Map.Entry<String, BigDecimal> entry : recipientAmounts.entrySet()) {
			BigDecimal amount = entry.getValue();
			if (amount == null || amount.signum() <= 0) {
				continue;
			}
			ShareholderAccount account = accounts.get(entry.getKey());
			String name = account == null ? "Unknown" : account.summary().shareholderName();
			recipients.add(new StepRecipient(entry.getKey(), name, Amounts.money(amount)));
		}
		recipients.sort(Comparator.comparing(StepRecipient::amount).reversed());
		return recipients;
	}
}
