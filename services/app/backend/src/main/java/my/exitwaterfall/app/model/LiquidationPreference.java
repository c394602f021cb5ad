package my.exitwaterfall.app.model;

import java.math.BigDecimal;

/**
 * Preference rule attached to a round. Lower seniority is paid first.
 * <p>
 * {@code cap} only applies to participating rules: preference plus participation of each
 * investor is limited to {@code cap} times the amount they invested. Missing or zero means
 * uncapped.
 */
public record LiquidationPreference(
		String roundId,
		BigDecimal multiple,
		PreferenceType type,
		Integer seniority,
		BigDecimal cap
) {
	public LiquidationPreference(String roundId, BigDecimal multiple, PreferenceType type, Integer seniority) {
		this(roundId, multiple, type, seniority, null);
	}

	public boolean isParticipating() {
		return type == PreferenceType.PARTICIPATING;
	}

	public boolean isCapped() {
		return isParticipating() && cap != null && cap.signum() > 0;
	}
}
