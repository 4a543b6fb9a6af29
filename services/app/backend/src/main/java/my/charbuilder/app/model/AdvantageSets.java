package my.charbuilder.app.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * The four label-sorted advantage sets of a character.
 */
public record AdvantageSets(Set<Advantage> proficiencies,
							Set<Advantage> resistances,
							Set<Advantage> languages,
							Set<Advantage> saveAdvantages) {

	public static AdvantageSets of(Map<AdvantageCategory, Set<Advantage>> byCategory) {
		Map<AdvantageCategory, Set<Advantage>> sets = new EnumMap<>(AdvantageCategory.class);
		sets.putAll(byCategory);
		return new AdvantageSets(
				sets.getOrDefault(AdvantageCategory.PROFICIENCIES, Collections.emptySet()),
				sets.getOrDefault(AdvantageCategory.RESISTANCES, Collections.emptySet()),
				sets.getOrDefault(AdvantageCategory.LANGUAGES, Collections.emptySet()),
				sets.getOrDefault(AdvantageCategory.SAVE_ADVANTAGES, Collections.emptySet())
		);
	}
}
