package my.exitwaterfall.app.service;

import my.exitwaterfall.app.config.AppProperties;
import my.exitwaterfall.app.dto.WaterfallRequest;
import my.exitwaterfall.app.dto.WaterfallValidateResponse;
import my.exitwaterfall.app.model.CapTable;
import my.exitwaterfall.app.model.CarveOutBeneficiary;
import my.exitwaterfall.app.model.PayoutStructure;
import my.exitwaterfall.app.model.WaterfallConfig;
import my.exitwaterfall.app.model.WaterfallResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Service
public class WaterfallService {
	private static final Logger logger = LoggerFactory.getLogger(WaterfallService.class);

	private final WaterfallEngine engine;
	private final AppProperties properties;
	private final WaterfallInputValidator validator = new WaterfallInputValidator();

	public WaterfallService(WaterfallEngine engine, AppProperties properties) {
		this.engine = engine;
		this.properties = properties;
	}

	public WaterfallResult calculate(WaterfallRequest request) {
		if (request == null) {
			throw new IllegalArgumentException("Request body is required");
		}
		List<String> limitErrors = checkLimits(request.capTable());
		if (!limitErrors.isEmpty()) {
			throw new IllegalArgumentException(String.join("; ", limitErrors));
		}
		WaterfallConfig config = applyDefaults(request.config());
		WaterfallResult result = engine.calculate(request.capTable(), request.exitValuation(), request.preferences(), config);
		logger.info("Waterfall calculated: shareholders={}, rounds={}, structure={}, exit={}, effectiveProceeds={}, steps={}",
				request.capTable().shareholders().size(),
				request.capTable().rounds().size(),
				config.payoutStructure(),
				result.exitValuation(),
				result.effectiveProceeds(),
				result.steps().size());
		for (String diagnostic : result.diagnostics()) {
			logger.warn("Waterfall diagnostic: {}", diagnostic);
		}
		return result;
	}

	public WaterfallValidateResponse validate(WaterfallRequest request) {
		if (request == null) {
			return new WaterfallValidateResponse(false, List.of("Request body is required"));
		}
		List<String> errors = new ArrayList<>(checkLimits(request.capTable()));
		errors.addAll(validator.validate(request.capTable(), request.exitValuation(), request.preferences(), request.config()));
		return new WaterfallValidateResponse(errors.isEmpty(), List.copyOf(errors));
	}

	WaterfallConfig applyDefaults(WaterfallConfig config) {
		AppProperties.Waterfall defaults = properties.waterfall();
		if (config == null) {
			return new WaterfallConfig(BigDecimal.ZERO, CarveOutBeneficiary.EVERYONE, defaults.defaultPayoutStructure(),
					null, null, null, defaults.deductOptionStrike(), defaults.conversionAnalysis());
		}
		PayoutStructure structure = config.payoutStructure() == null
				? defaults.defaultPayoutStructure()
				: config.payoutStructure();
		return new WaterfallConfig(
				config.carveOutPercent() == null ? BigDecimal.ZERO : config.carveOutPercent(),
				config.carveOutBeneficiary() == null ? CarveOutBeneficiary.EVERYONE : config.carveOutBeneficiary(),
				structure,
				config.escrow(),
				config.rwReserve(),
				config.nwcAdjustment(),
				config.deductOptionStrike() == null ? defaults.deductOptionStrike() : config.deductOptionStrike(),
				config.conversionAnalysis() == null ? defaults.conversionAnalysis() : config.conversionAnalysis()
		);
	}

	private List<String> checkLimits(CapTable capTable) {
		if (capTable == null) {
			return List.of();
		}
		List<String> errors = new ArrayList<>();
		AppProperties.Waterfall limits = properties.waterfall();
		if (capTable.shareholders().size() > limits.maxShareholders()) {
			errors.add("capTable.shareholders exceeds the maximum of " + limits.maxShareholders());
		}
		if (capTable.rounds().size() > limits.maxRounds()) {
			errors.add("capTable.rounds exceeds the maximum of " + limits.maxRounds());
		}
		return errors;
	}
}
