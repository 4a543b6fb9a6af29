package my.charbuilder.app.service;

import my.charbuilder.app.config.AppProperties;
import my.charbuilder.app.content.BuilderInfo;
import my.charbuilder.app.content.BuilderOption;
import my.charbuilder.app.domain.ChoiceSlot;
import my.charbuilder.app.domain.TraitChoice;
import my.charbuilder.app.rules.FulfillmentMode;
import my.charbuilder.app.rules.RuleCatalog;
import my.charbuilder.app.rules.RuleCategory;
import my.charbuilder.app.rules.UnknownModePolicy;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Expands a trait choice's builder configuration into choice slots and decides whether the player has
 * completed it.
 * <p>
 * Slots are matched to options by key. A matched slot takes the current label, category, options and
 * amount and keeps its chosen values; slots for options that are no longer configured are dropped.
 */
@Service
public class ChoiceFulfillmentEvaluator {
	private final RuleCatalog ruleCatalog;
	private final UnknownModePolicy unknownModePolicy;

	public ChoiceFulfillmentEvaluator(RuleCatalog ruleCatalog, AppProperties properties) {
		this.ruleCatalog = ruleCatalog;
		this.unknownModePolicy = properties.derivation().unknownModePolicy();
	}

	public List<TraitChoice> evaluateAll(List<TraitChoice> traitChoices, DerivationDiagnostics diagnostics) {
		return traitChoices.stream()
				.map(choice -> evaluateFulfillment(choice, diagnostics))
				.toList();
	}

	public TraitChoice evaluateFulfillment(TraitChoice traitChoice, DerivationDiagnostics diagnostics) {
		BuilderInfo builderInfo = traitChoice.builderInfo();
		if (builderInfo == null || !builderInfo.hasOptions()) {
			return traitChoice.withChoices(traitChoice.choices(), true);
		}

		List<ChoiceSlot> slots = new ArrayList<>();
		int choicesMade = 0;
		for (Map.Entry<String, BuilderOption> entry : builderInfo.options().entrySet()) {
			String key = entry.getKey();
			BuilderOption option = entry.getValue();
			Optional<ChoiceSlot> current = traitChoice.findChoice(key);

			Optional<List<String>> candidates = resolveCandidates(traitChoice, key, option, diagnostics);
			if (candidates.isEmpty()) {
				current.ifPresent(slots::add);
				continue;
			}

			String label = option.resolvedLabel(key);
			RuleCategory category = RuleCategory.fromKey(option.category()).orElse(null);
			if (category == null && option.category() != null) {
				diagnostics.warn("Unknown choice category " + option.category() + " in " + traitChoice.displaySource());
			}
			ChoiceSlot slot = current
					.map(existing -> existing.refresh(label, category, candidates.get(), option.resolvedAmount()))
					.orElseGet(() -> ChoiceSlot.open(key, label, category, candidates.get(), option.resolvedAmount()));
			if (slot.isMade()) {
				choicesMade++;
			}
			slots.add(slot);
		}

		int optionCount = builderInfo.options().size();
		FulfillmentMode mode = FulfillmentMode.parse(builderInfo.mode()).orElse(null);
		boolean fulfilled;
		if (mode != null) {
			fulfilled = mode.isFulfilled(choicesMade, optionCount);
		} else {
			diagnostics.warn("Unknown choice mode " + builderInfo.mode() + " in " + traitChoice.displaySource());
			fulfilled = unknownModePolicy == UnknownModePolicy.TREAT_AS_ALL
					&& FulfillmentMode.ALL.isFulfilled(choicesMade, optionCount);
		}
		return traitChoice.withChoices(slots, fulfilled);
	}

	private Optional<List<String>> resolveCandidates(TraitChoice traitChoice,
													 String key,
													 BuilderOption option,
													 DerivationDiagnostics diagnostics) {
		if (!option.values().isEmpty()) {
			return Optional.of(option.values());
		}
		if (option.valuesType() == null || option.valuesType().isBlank()) {
			return Optional.of(List.of());
		}
		Optional<RuleCategory> category = RuleCategory.fromKey(option.valuesType())
				.filter(ruleCatalog::hasCategory);
		if (category.isEmpty()) {
			diagnostics.warn("Unknown values type " + option.valuesType() + " for option " + key
					+ " in " + traitChoice.displaySource());
			return Optional.empty();
		}
		return Optional.of(ruleCatalog.keys(category.get()));
	}
}
