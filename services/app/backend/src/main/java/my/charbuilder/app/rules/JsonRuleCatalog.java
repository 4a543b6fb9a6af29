package my.charbuilder.app.rules;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable rule catalog built from a validated {@link RuleCatalogDefinition}.
 */
public class JsonRuleCatalog implements RuleCatalog {
	private final Map<RuleCategory, Map<String, CatalogEntry>> tables;

	public JsonRuleCatalog(RuleCatalogDefinition definition) {
		List<String> errors = new RuleCatalogValidator().validate(definition);
		if (!errors.isEmpty()) {
			throw new IllegalStateException("Rule catalog invalid: " + String.join("; ", errors));
		}
		Map<RuleCategory, Map<String, CatalogEntry>> byCategory = new EnumMap<>(RuleCategory.class);
		definition.getCategories().forEach((categoryKey, entries) -> {
			RuleCategory category = RuleCategory.fromKey(categoryKey).orElseThrow();
			Map<String, CatalogEntry> table = new LinkedHashMap<>();
			entries.forEach((key, entry) -> table.put(key, new CatalogEntry(category, key, entry.getLabel())));
			byCategory.put(category, Collections.unmodifiableMap(table));
		});
		this.tables = byCategory;
	}

	@Override
	public Optional<CatalogEntry> lookup(RuleCategory category, String key) {
		if (category == null || key == null) {
			return Optional.empty();
		}
		Map<String, CatalogEntry> table = tables.get(category);
		return table == null ? Optional.empty() : Optional.ofNullable(table.get(key));
	}

	@Override
	public List<String> keys(RuleCategory category) {
		Map<String, CatalogEntry> table = tables.get(category);
		return table == null ? List.of() : List.copyOf(table.keySet());
	}

	@Override
	public boolean hasCategory(RuleCategory category) {
		return tables.containsKey(category);
	}
}
