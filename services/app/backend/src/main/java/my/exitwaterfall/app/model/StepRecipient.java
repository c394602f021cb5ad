package my.exitwaterfall.app.model;

import java.math.BigDecimal;

public record StepRecipient(
		String shareholderId,
		String shareholderName,
		BigDecimal amount
) {
}
