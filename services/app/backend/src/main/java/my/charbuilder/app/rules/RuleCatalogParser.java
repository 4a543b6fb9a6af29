package my.charbuilder.app.rules;

import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.PropertyNamingStrategies;
import tools.jackson.databind.json.JsonMapper;

public class RuleCatalogParser {
	private final ObjectMapper jsonMapper;

	public RuleCatalogParser() {
		this.jsonMapper = JsonMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();
	}

	public RuleCatalogDefinition parse(String content) {
		return jsonMapper.readValue(content, RuleCatalogDefinition.class);
	}
}
