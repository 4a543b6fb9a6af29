package my.charbuilder.app.rules;

import java.util.Locale;
import java.util.Optional;

public enum RuleCategory {
	PROFICIENCY_TYPES,
	DAMAGE_TYPES,
	LANGUAGE_TYPES,
	SAVE_TYPES,
	ABILITY_TYPES,
	SKILL_TYPES,
	CONDITION_TYPES;

	public static Optional<RuleCategory> fromKey(String key) {
		if (key == null || key.isBlank()) {
			return Optional.empty();
		}
		String normalized = key.trim().toUpperCase(Locale.ROOT);
		for (RuleCategory category : values()) {
			if (category.name().equals(normalized)) {
				return Optional.of(category);
			}
		}
		return Optional.empty();
	}
}
