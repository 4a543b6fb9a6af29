package my.charbuilder.app.domain;

import my.charbuilder.app.content.BuilderInfo;
import my.charbuilder.app.model.Trait;

import java.util.List;
import java.util.Optional;

/**
 * The player's in-progress or completed decisions for one trait. Persisted with the character and
 * kept only while a trait with the same id is active.
 */
public record TraitChoice(String id,
						  String name,
						  String source,
						  String sourceId,
						  String color,
						  BuilderInfo builderInfo,
						  List<ChoiceSlot> choices,
						  boolean choicesFulfilled) {
	public TraitChoice {
		choices = choices == null ? List.of() : List.copyOf(choices);
	}

	public static TraitChoice fromTrait(Trait trait) {
		return new TraitChoice(trait.id(), trait.name(), trait.source(), trait.sourceId(), trait.color(),
				trait.builderInfo(), List.of(), false);
	}

	/**
	 * Copies the trait's descriptive fields and builder configuration, keeping the player's slots.
	 */
	public TraitChoice refreshedFrom(Trait trait) {
		return new TraitChoice(id, trait.name(), trait.source(), trait.sourceId(), trait.color(),
				trait.builderInfo(), choices, choicesFulfilled);
	}

	public TraitChoice withChoices(List<ChoiceSlot> slots, boolean fulfilled) {
		return new TraitChoice(id, name, source, sourceId, color, builderInfo, slots, fulfilled);
	}

	public Optional<ChoiceSlot> findChoice(String key) {
		return choices.stream().filter(c -> c.key() != null && c.key().equals(key)).findFirst();
	}

	public String displaySource() {
		return source + " (" + name + ")";
	}
}
