package my.exitwaterfall.app.model;

public record Shareholder(
		String id,
		String name,
		ShareholderRole role
) {
}
