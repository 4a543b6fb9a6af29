package my.charbuilder.app.content;

import my.charbuilder.app.model.AdvantageCategory;

import java.util.List;

/**
 * Category keys a trait grants without any player decision.
 */
public record InnateGrants(List<String> proficiencies,
						   List<String> resistances,
						   List<String> languages,
						   List<String> saveAdvantages) {
	public InnateGrants {
		proficiencies = copy(proficiencies);
		resistances = copy(resistances);
		languages = copy(languages);
		saveAdvantages = copy(saveAdvantages);
	}

	public static InnateGrants empty() {
		return new InnateGrants(List.of(), List.of(), List.of(), List.of());
	}

	public List<String> forCategory(AdvantageCategory category) {
		return switch (category) {
			case PROFICIENCIES -> proficiencies;
			case RESISTANCES -> resistances;
			case LANGUAGES -> languages;
			case SAVE_ADVANTAGES -> saveAdvantages;
		};
	}

	private static List<String> copy(List<String> values) {
		if (values == null) {
			return List.of();
		}
		return values.stream().filter(v -> v != null && !v.isBlank()).toList();
	}
}
