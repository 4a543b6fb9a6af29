package my.charbuilder.app.model;

import my.charbuilder.app.rules.RuleCategory;

public enum AdvantageCategory {
	PROFICIENCIES(RuleCategory.PROFICIENCY_TYPES),
	RESISTANCES(RuleCategory.DAMAGE_TYPES),
	LANGUAGES(RuleCategory.LANGUAGE_TYPES),
	SAVE_ADVANTAGES(RuleCategory.SAVE_TYPES);

	private final RuleCategory ruleCategory;

	AdvantageCategory(RuleCategory ruleCategory) {
		this.ruleCategory = ruleCategory;
	}

	public RuleCategory ruleCategory() {
		return ruleCategory;
	}
}
