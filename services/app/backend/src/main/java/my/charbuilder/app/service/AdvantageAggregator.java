package my.charbuilder.app.service;

import my.charbuilder.app.config.AppProperties;
import my.charbuilder.app.domain.CharacterRecord;
import my.charbuilder.app.domain.ChoiceSlot;
import my.charbuilder.app.domain.TraitChoice;
import my.charbuilder.app.model.Advantage;
import my.charbuilder.app.model.AdvantageCategory;
import my.charbuilder.app.model.AdvantageSets;
import my.charbuilder.app.model.Trait;
import my.charbuilder.app.rules.CatalogEntry;
import my.charbuilder.app.rules.RuleCatalog;
import my.charbuilder.app.rules.RuleCategory;
import org.springframework.stereotype.Service;

import java.text.Collator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Merges manual, innate and chosen entries into the four advantage sets.
 * <p>
 * Entries from different tiers are never merged with each other, so a language that is both stored
 * manually and granted by a trait shows up twice with different sources.
 */
@Service
public class AdvantageAggregator {
	private final RuleCatalog ruleCatalog;
	private final AdvantageFactory advantageFactory;
	private final Locale sortLocale;

	public AdvantageAggregator(RuleCatalog ruleCatalog, AdvantageFactory advantageFactory, AppProperties properties) {
		this.ruleCatalog = ruleCatalog;
		this.advantageFactory = advantageFactory;
		this.sortLocale = Locale.forLanguageTag(properties.derivation().sortLocale());
	}

	public AdvantageSets aggregateAdvantages(CharacterRecord record,
											 List<Trait> traits,
											 List<TraitChoice> traitChoices,
											 DerivationDiagnostics diagnostics) {
		Map<AdvantageCategory, Set<Advantage>> sets = new EnumMap<>(AdvantageCategory.class);
		for (AdvantageCategory category : AdvantageCategory.values()) {
			List<Advantage> merged = new ArrayList<>();
			addManual(merged, record, category, diagnostics);
			addInnate(merged, traits, category, diagnostics);
			addChosen(merged, traitChoices, category, diagnostics);
			sets.put(category, sortByLabel(merged));
		}
		return AdvantageSets.of(sets);
	}

	private void addManual(List<Advantage> merged,
						   CharacterRecord record,
						   AdvantageCategory category,
						   DerivationDiagnostics diagnostics) {
		for (String value : record.manualEntries(category)) {
			lookup(category.ruleCategory(), value, "manual " + category.name().toLowerCase(Locale.ROOT), diagnostics)
					.map(advantageFactory::manual)
					.ifPresent(merged::add);
		}
	}

	private void addInnate(List<Advantage> merged,
						   List<Trait> traits,
						   AdvantageCategory category,
						   DerivationDiagnostics diagnostics) {
		for (Trait trait : traits) {
			for (String value : trait.innate().forCategory(category)) {
				lookup(category.ruleCategory(), value, trait.displaySource(), diagnostics)
						.map(entry -> advantageFactory.innate(trait, entry))
						.ifPresent(merged::add);
			}
		}
	}

	private void addChosen(List<Advantage> merged,
						   List<TraitChoice> traitChoices,
						   AdvantageCategory category,
						   DerivationDiagnostics diagnostics) {
		for (TraitChoice traitChoice : traitChoices) {
			for (ChoiceSlot slot : traitChoice.choices()) {
				if (slot.category() != category.ruleCategory()) {
					continue;
				}
				for (String value : slot.chosenValues()) {
					lookup(category.ruleCategory(), value, traitChoice.displaySource(), diagnostics)
							.map(entry -> advantageFactory.chosen(traitChoice, entry))
							.ifPresent(merged::add);
				}
			}
		}
	}

	private Optional<CatalogEntry> lookup(RuleCategory category,
										  String value,
										  String context,
										  DerivationDiagnostics diagnostics) {
		Optional<CatalogEntry> entry = ruleCatalog.lookup(category, value);
		if (entry.isEmpty()) {
			diagnostics.warn("Unknown type " + value + " in " + context);
		}
		return entry;
	}

	private Set<Advantage> sortByLabel(List<Advantage> advantages) {
		Collator collator = Collator.getInstance(sortLocale);
		List<Advantage> sorted = new ArrayList<>(advantages);
		sorted.sort(Comparator.comparing((Advantage a) -> a.label() == null ? "" : a.label(), collator));
		return Collections.unmodifiableSet(new LinkedHashSet<>(sorted));
	}
}
