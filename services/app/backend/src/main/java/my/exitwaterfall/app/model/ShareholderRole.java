package my.exitwaterfall.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ShareholderRole {
	@JsonProperty("Founder") FOUNDER,
	@JsonProperty("Angel") ANGEL,
	@JsonProperty("VC") VC,
	@JsonProperty("Employee") EMPLOYEE,
	@JsonProperty("Advisor") ADVISOR,
	@JsonProperty("Other") OTHER
}
