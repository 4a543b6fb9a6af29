package my.charbuilder.app.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class RuleCatalogValidator {

	public List<String> validate(RuleCatalogDefinition definition) {
		List<String> errors = new ArrayList<>();
		if (definition == null) {
			errors.add("Rule catalog is empty");
			return errors;
		}
		if (definition.getSchemaVersion() != 1) {
			errors.add("schema_version must be 1");
		}
		if (definition.getCategories() == null || definition.getCategories().isEmpty()) {
			errors.add("categories must be provided");
			return errors;
		}
		for (Map.Entry<String, Map<String, RuleCatalogDefinition.EntryDefinition>> category : definition.getCategories().entrySet()) {
			if (RuleCategory.fromKey(category.getKey()).isEmpty()) {
				errors.add("unknown category " + category.getKey() + ", expected one of " + List.of(RuleCategory.values()));
				continue;
			}
			if (category.getValue() == null) {
				errors.add(category.getKey() + " must not be null");
				continue;
			}
			for (Map.Entry<String, RuleCatalogDefinition.EntryDefinition> entry : category.getValue().entrySet()) {
				if (entry.getKey() == null || entry.getKey().isBlank()) {
					errors.add(category.getKey() + " contains a blank key");
				}
				if (entry.getValue() == null || entry.getValue().getLabel() == null || entry.getValue().getLabel().isBlank()) {
					errors.add(category.getKey() + "." + entry.getKey() + ".label is required");
				}
			}
		}
		return errors;
	}
}
