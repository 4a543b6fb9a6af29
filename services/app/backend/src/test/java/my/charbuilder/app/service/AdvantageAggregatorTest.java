package my.charbuilder.app.service;

import my.charbuilder.app.content.InnateGrants;
import my.charbuilder.app.domain.CharacterRecord;
import my.charbuilder.app.domain.ChoiceSlot;
import my.charbuilder.app.domain.TraitChoice;
import my.charbuilder.app.model.Advantage;
import my.charbuilder.app.model.AdvantageSets;
import my.charbuilder.app.model.AdvantageSourceType;
import my.charbuilder.app.model.Trait;
import my.charbuilder.app.rules.RuleCategory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static my.charbuilder.app.support.TestFixtures.properties;
import static my.charbuilder.app.support.TestFixtures.ruleCatalog;
import static org.assertj.core.api.Assertions.assertThat;

class AdvantageAggregatorTest {
	private final AdvantageAggregator aggregator =
			new AdvantageAggregator(ruleCatalog(), new AdvantageFactory(), properties());
	private final DerivationDiagnostics diagnostics = new DerivationDiagnostics("char-1");

	@Test
	void mergesAllTiersSortedByLabel() {
		CharacterRecord record = record(List.of("zithers"), List.of("common"));
		Trait trait = new Trait("drill", "Drill", "Soldier", "bg-soldier", "#202020",
				new InnateGrants(List.of("P1", "axes"), List.of("fire"), null, List.of("poison")), null);
		TraitChoice choice = new TraitChoice("tongues", "Tongues", "Cosmopolitan", "hr-cosmo", "#ffffff", null,
				List.of(slot("language", RuleCategory.LANGUAGE_TYPES, "elvish"),
						slot("weapon", RuleCategory.PROFICIENCY_TYPES, "bows")), true);

		AdvantageSets sets = aggregator.aggregateAdvantages(record, List.of(trait), List.of(choice), diagnostics);

		assertThat(sets.proficiencies())
				.extracting(Advantage::label)
				.containsExactly("Axes", "Bows", "Pike", "Zithers");
		assertThat(sets.proficiencies())
				.extracting(Advantage::sourceType)
				.containsExactly(AdvantageSourceType.INNATE, AdvantageSourceType.CHOICE,
						AdvantageSourceType.INNATE, AdvantageSourceType.MANUAL);
		assertThat(sets.languages())
				.containsExactly(
						new Advantage("Manual", null, AdvantageSourceType.MANUAL, "common", "Common", null),
						new Advantage("Cosmopolitan (Tongues)", "hr-cosmo", AdvantageSourceType.CHOICE, "elvish", "Elvish",
								"background-color: #ffffff;color: black;"));
		assertThat(sets.resistances()).extracting(Advantage::value).containsExactly("fire");
		assertThat(sets.saveAdvantages()).extracting(Advantage::value).containsExactly("poison");
		assertThat(diagnostics.messages()).isEmpty();
	}

	@Test
	void innateEntryCarriesSourceAndContrastStyle() {
		Trait trait = new Trait("drill", "T1", "B", "bg-b", "#202020",
				new InnateGrants(List.of("P1"), null, null, null), null);

		AdvantageSets sets = aggregator.aggregateAdvantages(record(List.of(), List.of()), List.of(trait), List.of(), diagnostics);

		assertThat(sets.proficiencies()).containsExactly(new Advantage("B (T1)", "bg-b", AdvantageSourceType.INNATE,
				"P1", "Pike", "background-color: #202020;color: white;"));
	}

	@Test
	void tiersAreNotMergedButIdenticalEntriesCollapse() {
		Trait first = new Trait("a", "Drill", "Soldier", "bg-soldier", null,
				new InnateGrants(List.of("axes"), null, null, null), null);
		Trait duplicate = new Trait("a", "Drill", "Soldier", "bg-soldier", null,
				new InnateGrants(List.of("axes"), null, null, null), null);

		AdvantageSets sets = aggregator.aggregateAdvantages(record(List.of("axes"), List.of()),
				List.of(first, duplicate), List.of(), diagnostics);

		assertThat(sets.proficiencies()).hasSize(2);
		assertThat(sets.proficiencies())
				.extracting(Advantage::source)
				.containsExactlyInAnyOrder("Manual", "Soldier (Drill)");
	}

	@Test
	void unknownKeysAreReportedAndSkipped() {
		Trait trait = new Trait("drill", "Drill", "Soldier", "bg-soldier", null,
				new InnateGrants(List.of("lances"), null, List.of("klingon"), null), null);
		TraitChoice choice = new TraitChoice("tongues", "Tongues", "Cosmopolitan", "hr-cosmo", null, null,
				List.of(slot("language", RuleCategory.LANGUAGE_TYPES, "sylvan")), true);

		AdvantageSets sets = aggregator.aggregateAdvantages(record(List.of("unknown-manual"), List.of()),
				List.of(trait), List.of(choice), diagnostics);

		assertThat(sets.proficiencies()).isEmpty();
		assertThat(sets.languages()).isEmpty();
		assertThat(diagnostics.messages()).containsExactlyInAnyOrder(
				"Unknown type unknown-manual in manual proficiencies",
				"Unknown type lances in Soldier (Drill)",
				"Unknown type klingon in Soldier (Drill)",
				"Unknown type sylvan in Cosmopolitan (Tongues)");
	}

	@Test
	void slotsOfOtherCategoriesDoNotLeakIntoASet() {
		TraitChoice choice = new TraitChoice("resist", "Resist", "Dwarf", "ln-dwarf", null, null,
				List.of(slot("element", RuleCategory.DAMAGE_TYPES, "cold")), true);

		AdvantageSets sets = aggregator.aggregateAdvantages(record(List.of(), List.of()), List.of(), List.of(choice), diagnostics);

		assertThat(sets.resistances()).extracting(Advantage::label).containsExactly("Cold");
		assertThat(sets.proficiencies()).isEmpty();
		assertThat(sets.languages()).isEmpty();
	}

	private ChoiceSlot slot(String key, RuleCategory category, String chosen) {
		return new ChoiceSlot(key, key, category, List.of(chosen), Set.of(chosen), 1);
	}

	private CharacterRecord record(List<String> proficiencies, List<String> languages) {
		return new CharacterRecord("char-1", "Test", Map.of(), null, null, null, null,
				proficiencies, List.of(), languages, List.of(), List.of());
	}
}
