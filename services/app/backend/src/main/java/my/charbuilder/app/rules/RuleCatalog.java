package my.charbuilder.app.rules;

import java.util.List;
import java.util.Optional;

/**
 * Static lookup tables mapping type keys to display entries, one table per {@link RuleCategory}.
 */
public interface RuleCatalog {
	Optional<CatalogEntry> lookup(RuleCategory category, String key);

	/**
	 * All keys of a category in declaration order; empty when the category has no table.
	 */
	List<String> keys(RuleCategory category);

	boolean hasCategory(RuleCategory category);
}
