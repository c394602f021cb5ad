package my.exitwaterfall.app.service;

import my.exitwaterfall.app.model.WaterfallConfig;
import my.exitwaterfall.app.service.util.Amounts;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Applies escrow, R&amp;W reserve and net working capital adjustments to the headline exit value.
 */
public class ProceedsAdjustmentCalculator {
	private static final String LABEL = "M&A Adjustments";

	public Adjustments compute(BigDecimal exitValuation, WaterfallConfig config) {
		BigDecimal exit = Amounts.safe(exitValuation);
		BigDecimal nwc = BigDecimal.ZERO;
		if (config.nwcAdjustment() != null && config.nwcAdjustment().active()) {
			nwc = Amounts.safe(config.nwcAdjustment().actualNwc())
					.subtract(Amounts.safe(config.nwcAdjustment().targetNwc()));
		}
		BigDecimal escrow = config.escrow() != null && config.escrow().active()
				? Amounts.percentOf(exit, config.escrow().percentage())
				: BigDecimal.ZERO;
		BigDecimal rwReserve = config.rwReserve() != null && config.rwReserve().active()
				? Amounts.percentOf(exit, config.rwReserve().percentage())
				: BigDecimal.ZERO;
		BigDecimal effective = exit.subtract(escrow).subtract(rwReserve).add(nwc);
		return new Adjustments(exit, nwc, escrow, rwReserve, effective);
	}

	void apply(WaterfallLedger ledger, WaterfallConfig config) {
		Adjustments adjustments = compute(ledger.exitValuation(), config);
		if (!adjustments.any()) {
			return;
		}
		int stepNumber = ledger.nextStepNumber();
		BigDecimal running = adjustments.exitValuation();
		if (adjustments.nwc().signum() != 0) {
			running = running.add(adjustments.nwc());
			ledger.appendStep(stepNumber, "NWC Adjustment",
					adjustments.nwc().signum() > 0 ? "Seller bonus" : "Buyer credit",
					null, adjustments.nwc(), running, false, Map.of());
		}
		if (adjustments.escrow().signum() > 0) {
			running = running.subtract(adjustments.escrow());
			ledger.appendStep(stepNumber, "Escrow Hold",
					describeHold(config.escrow().percentage(), config.escrow().durationMonths(), "held in escrow"),
					null, adjustments.escrow().negate(), running, false, Map.of());
		}
		if (adjustments.rwReserve().signum() > 0) {
			running = running.subtract(adjustments.rwReserve());
			ledger.appendStep(stepNumber, "R&W Reserve",
					describeHold(config.rwReserve().percentage(), config.rwReserve().durationMonths(), "reserved for R&W claims"),
					null, adjustments.rwReserve().negate(), running, false, Map.of());
		}
		BigDecimal effective = adjustments.effectiveProceeds();
		if (effective.signum() < 0) {
			ledger.note("Adjustments exceed the exit valuation (" + Amounts.format(effective)
					+ "); distributable proceeds floored at zero");
			effective = BigDecimal.ZERO;
		}
		ledger.appendTotal(stepNumber, LABEL, "Distributable proceeds", effective, effective);
		ledger.setRemaining(effective);
	}

	private static String describeHold(BigDecimal percentage, Integer durationMonths, String purpose) {
		String text = percentage.stripTrailingZeros().toPlainString() + "% " + purpose;
		if (durationMonths != null && durationMonths > 0) {
			text += " for " + durationMonths + " months";
		}
		return text;
	}

	public record Adjustments(
			BigDecimal exitValuation,
			BigDecimal nwc,
			BigDecimal escrow,
			BigDecimal rwReserve,
			BigDecimal effectiveProceeds
	) {
		public boolean any() {
			return nwc.signum() != 0 || escrow.signum() > 0 || rwReserve.signum() > 0;
		}
	}
}
