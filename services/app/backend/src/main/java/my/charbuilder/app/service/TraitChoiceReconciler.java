package my.charbuilder.app.service;

import my.charbuilder.app.content.SourceDocument;
import my.charbuilder.app.content.TraitTemplate;
import my.charbuilder.app.domain.TraitChoice;
import my.charbuilder.app.model.ResolvedReferences;
import my.charbuilder.app.model.Trait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the active traits from the resolved documents and keeps exactly one trait choice per active
 * trait id.
 */
@Service
public class TraitChoiceReconciler {
	private static final Logger logger = LoggerFactory.getLogger(TraitChoiceReconciler.class);

	private final TraitFactory traitFactory;

	public TraitChoiceReconciler(TraitFactory traitFactory) {
		this.traitFactory = traitFactory;
	}

	public Reconciliation reconcileTraits(ResolvedReferences references, List<TraitChoice> storedChoices) {
		List<Trait> traits = buildTraits(references);

		Map<String, Trait> activeById = new LinkedHashMap<>();
		for (Trait trait : traits) {
			if (trait.hasId()) {
				activeById.putIfAbsent(trait.id(), trait);
			}
		}

		List<TraitChoice> choices = new ArrayList<>();
		Map<String, TraitChoice> kept = new LinkedHashMap<>();
		int pruned = 0;
		for (TraitChoice stored : storedChoices == null ? List.<TraitChoice>of() : storedChoices) {
			Trait active = stored.id() == null ? null : activeById.get(stored.id());
			if (active == null || kept.containsKey(stored.id())) {
				pruned++;
				continue;
			}
			TraitChoice refreshed = stored.refreshedFrom(active);
			kept.put(stored.id(), refreshed);
			choices.add(refreshed);
		}
		int created = 0;
		for (Trait trait : activeById.values()) {
			if (!kept.containsKey(trait.id())) {
				choices.add(TraitChoice.fromTrait(trait));
				created++;
			}
		}
		if (created > 0 || pruned > 0) {
			logger.debug("Reconciled trait choices (created={}, pruned={}, total={})", created, pruned, choices.size());
		}
		return new Reconciliation(traits, choices);
	}

	private List<Trait> buildTraits(ResolvedReferences references) {
		List<Trait> traits = new ArrayList<>();
		for (SourceDocument document : references.traitSources()) {
			for (TraitTemplate template : document.traits()) {
				traits.add(traitFactory.fromTemplate(template, document));
			}
		}
		return traits;
	}

	public record Reconciliation(List<Trait> traits, List<TraitChoice> traitChoices) {
		public Reconciliation {
			traits = List.copyOf(traits);
			traitChoices = List.copyOf(traitChoices);
		}
	}
}
