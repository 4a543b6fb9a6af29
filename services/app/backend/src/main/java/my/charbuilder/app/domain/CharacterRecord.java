package my.charbuilder.app.domain;

import my.charbuilder.app.model.AdvantageCategory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stored state of a player character as read from the document store.
 */
public record CharacterRecord(String id,
							  String name,
							  Map<String, Integer> abilities,
							  String backgroundId,
							  String heritageId,
							  String lineageId,
							  String classId,
							  List<String> proficiencies,
							  List<String> resistances,
							  List<String> languages,
							  List<String> saveAdvantages,
							  List<TraitChoice> traitChoices) {
	public CharacterRecord {
		abilities = abilities == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(abilities));
		proficiencies = proficiencies == null ? List.of() : List.copyOf(proficiencies);
		resistances = resistances == null ? List.of() : List.copyOf(resistances);
		languages = languages == null ? List.of() : List.copyOf(languages);
		saveAdvantages = saveAdvantages == null ? List.of() : List.copyOf(saveAdvantages);
		traitChoices = traitChoices == null ? List.of() : List.copyOf(traitChoices);
	}

	public List<String> manualEntries(AdvantageCategory category) {
		return switch (category) {
			case PROFICIENCIES -> proficiencies;
			case RESISTANCES -> resistances;
			case LANGUAGES -> languages;
			case SAVE_ADVANTAGES -> saveAdvantages;
		};
	}
}
