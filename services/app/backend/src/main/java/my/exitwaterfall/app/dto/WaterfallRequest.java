package my.exitwaterfall.app.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import my.exitwaterfall.app.model.CapTable;
import my.exitwaterfall.app.model.LiquidationPreference;
import my.exitwaterfall.app.model.WaterfallConfig;

import java.math.BigDecimal;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Input of a waterfall calculation.")
public record WaterfallRequest(
		@Schema(description = "Shareholders, financing rounds and option grants.")
		@NotNull CapTable capTable,
		@Schema(description = "Exit value before M&A adjustments.")
		@NotNull @PositiveOrZero BigDecimal exitValuation,
		@Schema(description = "Liquidation preference stack, one rule per round.")
		List<LiquidationPreference> preferences,
		@Schema(description = "Carve-out, payout structure and adjustments. Missing fields use server defaults.")
		WaterfallConfig config
) {
}
