package my.exitwaterfall.app.model;

import java.math.BigDecimal;

public record ConversionDecision(
		String shareClass,
		long totalShares,
		BigDecimal valueAsPreference,
		BigDecimal valueAsConverted,
		Decision decision,
		String reason
) {
	public enum Decision {
		KEEP_PREFERENCE,
		CONVERT_TO_ORDINARY
	}
}
