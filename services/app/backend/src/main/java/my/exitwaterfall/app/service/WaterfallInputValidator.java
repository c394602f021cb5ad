package my.exitwaterfall.app.service;

import my.exitwaterfall.app.model.CapTable;
import my.exitwaterfall.app.model.LiquidationPreference;
import my.exitwaterfall.app.model.WaterfallConfig;
import my.exitwaterfall.app.service.util.Amounts;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

public class WaterfallInputValidator {

	public List<String> validate(CapTable capTable,
								 BigDecimal exitValuation,
								 List<LiquidationPreference> preferences,
								 WaterfallConfig config) {
		List<String> errors = new ArrayList<>();
		if (capTable == null) {
			errors.add("capTable is required");
		}
		if (exitValuation == null) {
			errors.add("exitValuation is required");
		} else if (exitValuation.signum() < 0) {
			errors.add("exitValuation must not be negative");
		}
		if (preferences != null) {
			for (int i = 0; i < preferences.size(); i++) {
				LiquidationPreference preference = preferences.get(i);
				String prefix = "preferences[" + i + "]";
				if (preference == null) {
					errors.add(prefix + " must not be null");
					continue;
				}
				if (preference.roundId() == null || preference.roundId().isBlank()) {
					errors.add(prefix + ".roundId is required");
				}
				if (preference.multiple() == null) {
					errors.add(prefix + ".multiple is required");
				} else if (preference.multiple().signum() < 0) {
					errors.add(prefix + ".multiple must not be negative");
				}
				if (preference.cap() != null && preference.cap().signum() < 0) {
					errors.add(prefix + ".cap must not be negative");
				}
				if (preference.type() == null) {
					errors.add(prefix + ".type is required");
				}
				if (preference.seniority() == null || preference.seniority() < 1) {
					errors.add(prefix + ".seniority must be a positive integer");
				}
			}
		}
		if (config != null) {
			BigDecimal carveOut = config.carveOutPercent();
			if (carveOut != null && (carveOut.signum() < 0 || carveOut.compareTo(Amounts.ONE_HUNDRED) > 0)) {
				errors.add("config.carveOutPercent must be between 0 and 100");
			}
			if (config.escrow() != null && isOutOfRange(config.escrow().percentage())) {
				errors.add("config.escrow.percentage must be between 0 and 100");
			}
			if (config.rwReserve() != null && isOutOfRange(config.rwReserve().percentage())) {
				errors.add("config.rwReserve.percentage must be between 0 and 100");
			}
		}
		return errors;
	}

	private static boolean isOutOfRange(BigDecimal percentage) {
		return percentage != null && (percentage.signum() < 0 || percentage.compareTo(Amounts.ONE_HUNDRED) > 0);
	}
}
