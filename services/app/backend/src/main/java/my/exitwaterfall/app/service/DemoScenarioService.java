package my.exitwaterfall.app.service;

import my.exitwaterfall.app.config.AppProperties;
import my.exitwaterfall.app.dto.WaterfallRequest;
import my.exitwaterfall.app.model.WaterfallResult;
import my.exitwaterfall.app.model.WaterfallScenario;
import my.exitwaterfall.app.scenario.ScenarioParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

@Service
public class DemoScenarioService {
	private static final Logger logger = LoggerFactory.getLogger(DemoScenarioService.class);

	private final WaterfallService waterfallService;
	private final ResourceLoader resourceLoader;
	private final AppProperties properties;
	private final ScenarioParser parser = new ScenarioParser();

	public DemoScenarioService(WaterfallService waterfallService,
							   ResourceLoader resourceLoader,
							   AppProperties properties) {
		this.waterfallService = waterfallService;
		this.resourceLoader = resourceLoader;
		this.properties = properties;
	}

	public WaterfallResult runDemo(BigDecimal exitValuation) {
		WaterfallScenario scenario = loadDemoScenario();
		BigDecimal exit = exitValuation == null ? scenario.exitValuation() : exitValuation;
		return waterfallService.calculate(new WaterfallRequest(scenario.capTable(), exit, scenario.preferences(), scenario.config()));
	}

	public WaterfallScenario loadDemoScenario() {
		String location = properties.scenarios().demoResource();
		Resource resource = resourceLoader.getResource(location);
		if (!resource.exists()) {
			logger.warn("Demo scenario resource not found: {}", location);
			throw new IllegalStateException("Demo scenario not available");
		}
		try (InputStream inputStream = resource.getInputStream()) {
			String content = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
			return parser.parse(content);
		} catch (Exception ex) {
			logger.error("Failed to read demo scenario {}: {}", location, ex.getMessage());
			throw new IllegalStateException("Demo scenario could not be read", ex);
		}
	}
}
