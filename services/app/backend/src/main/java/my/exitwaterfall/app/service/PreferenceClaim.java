package my.exitwaterfall.app.service;

import my.exitwaterfall.app.model.LiquidationPreference;
import my.exitwaterfall.app.model.Round;
import my.exitwaterfall.app.service.util.Amounts;

import java.math.BigDecimal;
import java.util.Map;

/**
 * A preference rule resolved against its round: cash invested and claim (investment x multiple)
 * per investor, and the round total.
 */
record PreferenceClaim(
		LiquidationPreference preference,
		Round round,
		Map<String, BigDecimal> investorInvestments,
		Map<String, BigDecimal> investorClaims,
		BigDecimal totalClaim
) {
	String shareClass() {
		return round.shareClass();
	}

	int seniority() {
		return preference.seniority() == null ? Integer.MAX_VALUE : preference.seniority();
	}

	boolean participating() {
		return preference.isParticipating();
	}

	boolean capped() {
		return preference.isCapped();
	}

	/**
	 * Most the round's investors may receive in total, preference and participation together.
	 */
	BigDecimal capAmount() {
		return Amounts.sum(investorInvestments.values()).multiply(preference.cap());
	}
}
