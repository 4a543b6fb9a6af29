package my.charbuilder.app.content;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declarative description of the choices a trait asks the player to make.
 * <p>
 * Example:
 * <pre>
 * {
 *   "mode": "ALL",
 *   "options": {
 *     "additionalLanguage": { "amount": 1, "category": "LANGUAGE_TYPES", "values_type": "LANGUAGE_TYPES" }
 *   }
 * }
 * </pre>
 * Option order is preserved.
 */
public record BuilderInfo(String mode, Map<String, BuilderOption> options) {
	public BuilderInfo {
		options = options == null
				? Map.of()
				: Collections.unmodifiableMap(new LinkedHashMap<>(options));
	}

	public boolean hasOptions() {
		return !options.isEmpty();
	}
}
