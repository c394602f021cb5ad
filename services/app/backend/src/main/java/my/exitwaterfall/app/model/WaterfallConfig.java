package my.exitwaterfall.app.model;

import java.math.BigDecimal;

public record WaterfallConfig(
		BigDecimal carveOutPercent,
		CarveOutBeneficiary carveOutBeneficiary,
		PayoutStructure payoutStructure,
		Escrow escrow,
		RwReserve rwReserve,
		NwcAdjustment nwcAdjustment,
		Boolean deductOptionStrike,
		Boolean conversionAnalysis
) {
	public static WaterfallConfig defaults() {
		return new WaterfallConfig(BigDecimal.ZERO, CarveOutBeneficiary.EVERYONE, PayoutStructure.STANDARD,
				null, null, null, true, true);
	}

	public static WaterfallConfig of(BigDecimal carveOutPercent,
									 CarveOutBeneficiary carveOutBeneficiary,
									 PayoutStructure payoutStructure) {
		return new WaterfallConfig(carveOutPercent, carveOutBeneficiary, payoutStructure, null, null, null, true, true);
	}

	public WaterfallConfig withConversionAnalysis(boolean enabled) {
		return new WaterfallConfig(carveOutPercent, carveOutBeneficiary, payoutStructure, escrow, rwReserve,
				nwcAdjustment, deductOptionStrike, enabled);
	}

	public WaterfallConfig withDeductOptionStrike(boolean enabled) {
		return new WaterfallConfig(carveOutPercent, carveOutBeneficiary, payoutStructure, escrow, rwReserve,
				nwcAdjustment, enabled, conversionAnalysis);
	}

	public WaterfallConfig withAdjustments(Escrow escrow, RwReserve rwReserve, NwcAdjustment nwcAdjustment) {
		return new WaterfallConfig(carveOutPercent, carveOutBeneficiary, payoutStructure, escrow, rwReserve,
				nwcAdjustment, deductOptionStrike, conversionAnalysis);
	}

	public record Escrow(
			Boolean enabled,
			BigDecimal percentage,
			Integer durationMonths
	) {
		public boolean active() {
			return Boolean.TRUE.equals(enabled) && percentage != null && percentage.signum() > 0;
		}
	}

	public record RwReserve(
			Boolean enabled,
			BigDecimal percentage,
			Integer durationMonths
	) {
		public boolean active() {
			return Boolean.TRUE.equals(enabled) && percentage != null && percentage.signum() > 0;
		}
	}

	/**
	 * Net working capital true-up: positive when actual exceeds target (seller bonus).
	 */
	public record NwcAdjustment(
			Boolean enabled,
			BigDecimal targetNwc,
			BigDecimal actualNwc
	) {
		public boolean active() {
			return Boolean.TRUE.equals(enabled);
		}
	}
}
