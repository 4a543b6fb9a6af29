package my.charbuilder.app.service;

import my.charbuilder.app.config.AppProperties;
import my.charbuilder.app.content.DocumentCatalog;
import my.charbuilder.app.domain.CharacterRecord;
import my.charbuilder.app.domain.TraitChoice;
import my.charbuilder.app.model.AbilityScore;
import my.charbuilder.app.model.AdvantageSets;
import my.charbuilder.app.model.DerivedCharacter;
import my.charbuilder.app.model.ResolvedReferences;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a full derivation pass: abilities, foreign documents, traits and trait choices, choice
 * fulfillment and advantages. The stored record is never modified; the returned view carries the
 * reconciled trait choices for the caller to persist.
 */
@Service
public class CharacterDerivationService {
	private static final Logger logger = LoggerFactory.getLogger(CharacterDerivationService.class);

	private final ForeignDocumentCatalogService catalogService;
	private final AbilityModifierDeriver abilityModifierDeriver;
	private final ForeignDocumentResolver documentResolver;
	private final TraitChoiceReconciler traitChoiceReconciler;
	private final ChoiceFulfillmentEvaluator fulfillmentEvaluator;
	private final AdvantageAggregator advantageAggregator;
	private final Duration catalogTimeout;

	public CharacterDerivationService(ForeignDocumentCatalogService catalogService,
									  AbilityModifierDeriver abilityModifierDeriver,
									  ForeignDocumentResolver documentResolver,
									  TraitChoiceReconciler traitChoiceReconciler,
									  ChoiceFulfillmentEvaluator fulfillmentEvaluator,
									  AdvantageAggregator advantageAggregator,
									  AppProperties properties) {
		this.catalogService = catalogService;
		this.abilityModifierDeriver = abilityModifierDeriver;
		this.documentResolver = documentResolver;
		this.traitChoiceReconciler = traitChoiceReconciler;
		this.fulfillmentEvaluator = fulfillmentEvaluator;
		this.advantageAggregator = advantageAggregator;
		this.catalogTimeout = Duration.ofSeconds(properties.catalog().loadTimeoutSeconds());
	}

	/**
	 * Waits for the document catalog, then derives synchronously.
	 *
	 * @throws CatalogUnavailableException when the catalog cannot be loaded in time; deriving without it
	 *                                     would discard the character's trait choices
	 */
	public DerivedCharacter derive(CharacterRecord record) {
		return deriveWith(record, awaitCatalog());
	}

	public CompletableFuture<DerivedCharacter> deriveAsync(CharacterRecord record) {
		return catalogService.ensureLoaded().thenApply(catalog -> deriveWith(record, catalog));
	}

	DerivedCharacter deriveWith(CharacterRecord record, DocumentCatalog catalog) {
		logger.debug("Preparing derived data for character {}", record.id());
		DerivationDiagnostics diagnostics = new DerivationDiagnostics(record.id());

		Map<String, AbilityScore> abilities = abilityModifierDeriver.deriveAbilities(record.abilities());
		ResolvedReferences references = documentResolver.resolveReferences(record, catalog);
		TraitChoiceReconciler.Reconciliation reconciliation =
				traitChoiceReconciler.reconcileTraits(references, record.traitChoices());
		List<TraitChoice> traitChoices =
				fulfillmentEvaluator.evaluateAll(reconciliation.traitChoices(), diagnostics);
		AdvantageSets advantages = advantageAggregator.aggregateAdvantages(
				record, reconciliation.traits(), traitChoices, diagnostics);

		return new DerivedCharacter(
				record.id(),
				abilities,
				references,
				reconciliation.traits(),
				traitChoices,
				advantages,
				diagnostics.messages()
		);
	}

	private DocumentCatalog awaitCatalog() {
		try {
			return catalogService.ensureLoaded().get(catalogTimeout.toMillis(), TimeUnit.MILLISECONDS);
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			throw new CatalogUnavailableException("Interrupted while loading the document catalog", ex);
		} catch (ExecutionException ex) {
			Throwable cause = ex.getCause() == null ? ex : ex.getCause();
			throw new CatalogUnavailableException("Document catalog failed to load: " + cause.getMessage(), cause);
		} catch (TimeoutException ex) {
			throw new CatalogUnavailableException("Document catalog not ready after " + catalogTimeout.toSeconds() + "s", ex);
		}
	}
}
