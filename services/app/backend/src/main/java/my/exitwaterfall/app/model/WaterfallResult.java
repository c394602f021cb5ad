package my.exitwaterfall.app.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public record WaterfallResult(
		BigDecimal exitValuation,
		BigDecimal effectiveProceeds,
		List<WaterfallStep> steps,
		List<WaterfallPayout> payouts,
		List<ConversionDecision> conversionAnalysis,
		BigDecimal unallocatedProceeds,
		List<String> diagnostics
) {
	public WaterfallResult {
		steps = steps == null ? List.of() : List.copyOf(steps);
		payouts = payouts == null ? List.of() : List.copyOf(payouts);
		conversionAnalysis = conversionAnalysis == null ? List.of() : List.copyOf(conversionAnalysis);
		diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
	}

	public Optional<WaterfallPayout> payoutFor(String shareholderId) {
		return payouts.stream()
				.filter(payout -> payout.shareholderId().equals(shareholderId))
				.findFirst();
	}
}
