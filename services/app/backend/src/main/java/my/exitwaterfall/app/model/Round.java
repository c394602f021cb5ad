package my.exitwaterfall.app.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * One financing event of the cap table.
 * <p>
 * {@code liquidationPreferenceMultiple} and {@code participating} are kept for compatibility with
 * older cap tables; the engine reads preference terms from {@link LiquidationPreference} only.
 */
public record Round(
		String id,
		String name,
		String shareClass,
		List<Investment> investments,
		BigDecimal preMoneyValuation,
		BigDecimal pricePerShare,
		BigDecimal strikePrice,
		BigDecimal liquidationPreferenceMultiple,
		Boolean participating
) {
	public Round {
		investments = investments == null ? List.of() : List.copyOf(investments);
	}
}
