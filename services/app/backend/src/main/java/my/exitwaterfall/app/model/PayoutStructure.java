package my.exitwaterfall.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How the preference stack is paid out.
 */
public enum PayoutStructure {
	/** Preferences paid one after the other in seniority order. */
	@JsonProperty("standard") STANDARD,
	/** Preferences sharing a seniority rank are paid proportionally to their claims. */
	@JsonProperty("pari-passu") PARI_PASSU,
	/** Preferences ignored, everything is distributed pro-rata. */
	@JsonProperty("common-only") COMMON_ONLY
}
