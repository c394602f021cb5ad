package my.exitwaterfall.app.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * A stored calculation input: cap table, exit value, preference stack and configuration.
 */
public record WaterfallScenario(
		String name,
		CapTable capTable,
		BigDecimal exitValuation,
		List<LiquidationPreference> preferences,
		WaterfallConfig config
) {
	public WaterfallScenario {
		preferences = preferences == null ? List.of() : List.copyOf(preferences);
	}
}
