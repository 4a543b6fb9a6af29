package my.charbuilder.app.model;

import my.charbuilder.app.domain.TraitChoice;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything one derivation pass computes for a character. Only {@link #traitChoices()} is meant to be
 * written back to the store.
 */
public record DerivedCharacter(String characterId,
							   Map<String, AbilityScore> abilities,
							   ResolvedReferences references,
							   List<Trait> traits,
							   List<TraitChoice> traitChoices,
							   AdvantageSets advantages,
							   List<String> diagnostics) {
	public DerivedCharacter {
		traits = traits == null ? List.of() : List.copyOf(traits);
		traitChoices = traitChoices == null ? List.of() : List.copyOf(traitChoices);
		diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
	}

	public Set<Advantage> proficiencies() {
		return advantages.proficiencies();
	}

	public Set<Advantage> resistances() {
		return advantages.resistances();
	}

	public Set<Advantage> languages() {
		return advantages.languages();
	}

	public Set<Advantage> saveAdvantages() {
		return advantages.saveAdvantages();
	}
}
