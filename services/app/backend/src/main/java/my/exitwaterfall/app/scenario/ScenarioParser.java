package my.exitwaterfall.app.scenario;

import my.exitwaterfall.app.model.WaterfallScenario;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.dataformat.yaml.YAMLMapper;

/**
 * Reads a scenario document, trying JSON first and YAML second. When both fail, the YAML error is
 * thrown with the JSON error attached as suppressed.
 */
public class ScenarioParser {
	private final ObjectMapper jsonMapper;
	private final ObjectMapper yamlMapper;

	public ScenarioParser() {
		this.jsonMapper = JsonMapper.builder()
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();

		this.yamlMapper = YAMLMapper.builder()
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();
	}

	public WaterfallScenario parse(String content) throws Exception {
		if (content == null || content.isBlank()) {
			throw new IllegalArgumentException("Scenario document is empty");
		}
		try {
			return jsonMapper.readValue(content, WaterfallScenario.class);
		} catch (Exception jsonEx) {
			try {
				return yamlMapper.readValue(content, WaterfallScenario.class);
			} catch (Exception yamlEx) {
				yamlEx.addSuppressed(jsonEx);
				throw yamlEx;
			}
		}
	}
}
