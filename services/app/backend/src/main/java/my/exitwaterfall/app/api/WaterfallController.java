package my.exitwaterfall.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.exitwaterfall.app.dto.WaterfallRequest;
import my.exitwaterfall.app.dto.WaterfallValidateResponse;
import my.exitwaterfall.app.model.WaterfallResult;
import my.exitwaterfall.app.service.DemoScenarioService;
import my.exitwaterfall.app.service.WaterfallService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;

@RestController
@RequestMapping("/api/waterfall")
@Tag(name = "Waterfall")
public class WaterfallController {
	private final WaterfallService waterfallService;
	private final DemoScenarioService demoScenarioService;

	public WaterfallController(WaterfallService waterfallService, DemoScenarioService demoScenarioService) {
		this.waterfallService = waterfallService;
		this.demoScenarioService = demoScenarioService;
	}

	@PostMapping
	@Operation(summary = "Distribute exit proceeds over a cap table")
	public WaterfallResult calculate(@Valid @RequestBody WaterfallRequest request) {
		return waterfallService.calculate(request);
	}

	@PostMapping("/validate")
	@Operation(summary = "Validate a waterfall request without calculating")
	public WaterfallValidateResponse validate(@RequestBody WaterfallRequest request) {
		return waterfallService.validate(request);
	}

	@GetMapping("/demo")
	@Operation(summary = "Run the bundled demo scenario")
	public WaterfallResult demo(@RequestParam(required = false) BigDecimal exitValuation) {
		return demoScenarioService.runDemo(exitValuation);
	}
}
