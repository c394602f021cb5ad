package my.exitwaterfall.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PreferenceType {
	@JsonProperty("Participating") PARTICIPATING,
	@JsonProperty("Non-Participating") NON_PARTICIPATING
}
