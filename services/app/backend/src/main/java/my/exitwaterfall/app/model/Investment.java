package my.exitwaterfall.app.model;

import java.math.BigDecimal;

public record Investment(
		String shareholderId,
		BigDecimal amount,
		Long shares
) {
}
