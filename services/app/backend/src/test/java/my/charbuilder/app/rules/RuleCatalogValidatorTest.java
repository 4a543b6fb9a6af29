package my.charbuilder.app.rules;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RuleCatalogValidatorTest {
	private final RuleCatalogParser parser = new RuleCatalogParser();
	private final RuleCatalogValidator validator = new RuleCatalogValidator();

	@Test
	void validCatalogHasNoErrors() {
		RuleCatalogDefinition definition = parser.parse("""
				{"schema_version":1,"name":"core","categories":{"LANGUAGE_TYPES":{"common":{"label":"Common"}}}}
				""");

		assertThat(validator.validate(definition)).isEmpty();
	}

	@Test
	void reportsSchemaUnknownCategoryAndMissingLabel() {
		RuleCatalogDefinition definition = parser.parse("""
				{
				  "schema_version": 2,
				  "categories": {
				    "SPELL_TYPES": { "fireball": { "label": "Fireball" } },
				    "DAMAGE_TYPES": { "fire": { } }
				  }
				}
				""");

		List<String> errors = validator.validate(definition);

		assertThat(errors).contains("schema_version must be 1", "DAMAGE_TYPES.fire.label is required");
		assertThat(errors).anyMatch(error -> error.startsWith("unknown category SPELL_TYPES"));
	}

	@Test
	void emptyCatalogIsRejected() {
		assertThat(validator.validate(null)).containsExactly("Rule catalog is empty");
		assertThat(validator.validate(parser.parse("{\"schema_version\":1}"))).containsExactly("categories must be provided");
	}
}
