package my.exitwaterfall.app.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * One row of the distribution trace. {@code sequence} is the position in the trace,
 * {@code stepNumber} groups the rows produced by the same phase.
 */
public record WaterfallStep(
		int sequence,
		int stepNumber,
		String label,
		String description,
		String shareClass,
		BigDecimal amount,
		BigDecimal remainingBalance,
		boolean total,
		boolean participating,
		List<StepRecipient> recipients
) {
	public WaterfallStep {
		recipients = recipients == null ? List.of() : List.copyOf(recipients);
	}
}
