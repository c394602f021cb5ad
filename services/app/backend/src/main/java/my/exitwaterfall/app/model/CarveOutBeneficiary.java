package my.exitwaterfall.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum CarveOutBeneficiary {
	@JsonProperty("everyone") EVERYONE,
	@JsonProperty("founders-only") FOUNDERS_ONLY,
	@JsonProperty("team") TEAM;

	public boolean includes(ShareholderRole role) {
		return switch (this) {
			case EVERYONE -> true;
			case FOUNDERS_ONLY -> role == ShareholderRole.FOUNDER;
			case TEAM -> role == ShareholderRole.FOUNDER || role == ShareholderRole.EMPLOYEE;
		};
	}
}
