package my.exitwaterfall.app.model;

public record OptionGrant(
		String id,
		String shareholderId,
		String roundId,
		Long shares
) {
}
