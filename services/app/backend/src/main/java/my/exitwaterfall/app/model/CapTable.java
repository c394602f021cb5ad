package my.exitwaterfall.app.model;

import java.util.List;

public record CapTable(
		String startupName,
		List<Round> rounds,
		List<Shareholder> shareholders,
		List<OptionGrant> optionGrants
) {
	public CapTable {
		rounds = rounds == null ? List.of() : List.copyOf(rounds);
		shareholders = shareholders == null ? List.of() : List.copyOf(shareholders);
		optionGrants = optionGrants == null ? List.of() : List.copyOf(optionGrants);
	}
}
