package my.exitwaterfall.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import my.exitwaterfall.app.model.PayoutStructure;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid @NotNull Waterfall waterfall,
		@Valid @NotNull Scenarios scenarios
) {
	public record Waterfall(
			@NotNull PayoutStructure defaultPayoutStructure,
			boolean conversionAnalysis,
			boolean deductOptionStrike,
			@Positive int maxShareholders,
			@Positive int maxRounds
	) {
	}

	public record Scenarios(
			@NotBlank String demoResource
	) {
	}
}
