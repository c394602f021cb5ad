package my.exitwaterfall.app.model;

import java.math.BigDecimal;

public record WaterfallPayout(
		String shareholderId,
		String shareholderName,
		ShareholderRole role,
		BigDecimal carveOutPayout,
		BigDecimal preferencePayout,
		BigDecimal participationPayout,
		BigDecimal optionStrikeCost,
		BigDecimal totalPayout,
		BigDecimal totalInvested,
		BigDecimal multiple,
		BigDecimal equityPercentage
) {
	public BigDecimal grossPayout() {
		return carveOutPayout.add(preferencePayout).add(participationPayout);
	}
}
