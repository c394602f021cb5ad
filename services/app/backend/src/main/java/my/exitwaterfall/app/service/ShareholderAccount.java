package my.exitwaterfall.app.service;

import my.exitwaterfall.app.model.ShareholderSummary;

import java.math.BigDecimal;

/**
 * Running payout components of one shareholder during a single calculation.
 */
final class ShareholderAccount {
	private final ShareholderSummary summary;
	private BigDecimal carveOut = BigDecimal.ZERO;
	private BigDecimal preference = BigDecimal.ZERO;
	private BigDecimal participation = BigDecimal.ZERO;

	ShareholderAccount(ShareholderSummary summary) {
		this.summary = summary;
	}

	ShareholderSummary summary() {
		return summary;
	}

	String shareholderId() {
		return summary.shareholderId();
	}

	BigDecimal carveOut() {
		return carveOut;
	}

	BigDecimal preference() {
		return preference;
	}

	BigDecimal participation() {
		return participation;
	}

	void addCarveOut(BigDecimal amount) {
		carveOut = carveOut.add(amount);
	}

	void addPreference(BigDecimal amount) {
		preference = preference.add(amount);
	}

	void addParticipation(BigDecimal amount) {
		participation = participation.add(amount);
	}

	BigDecimal gross() {
		return carveOut.add(preference).add(participation);
	}
}
