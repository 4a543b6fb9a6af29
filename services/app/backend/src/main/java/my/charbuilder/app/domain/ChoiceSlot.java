package my.charbuilder.app.domain;

import my.charbuilder.app.rules.RuleCategory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One concrete decision inside a trait choice: pick {@code amount} values out of {@code options}.
 */
public record ChoiceSlot(String key,
						 String label,
						 RuleCategory category,
						 List<String> options,
						 Set<String> chosenValues,
						 int amount) {
	public ChoiceSlot {
		options = options == null ? List.of() : List.copyOf(options);
		chosenValues = chosenValues == null
				? Set.of()
				: Collections.unmodifiableSet(new LinkedHashSet<>(chosenValues));
		amount = Math.max(1, amount);
	}

	public static ChoiceSlot open(String key, String label, RuleCategory category, List<String> options, int amount) {
		return new ChoiceSlot(key, label, category, options, Set.of(), amount);
	}

	public boolean isMade() {
		return chosenValues.size() == amount;
	}

	public ChoiceSlot refresh(String label, RuleCategory category, List<String> options, int amount) {
		return new ChoiceSlot(key, label, category, options, chosenValues, amount);
	}

	public ChoiceSlot withChosenValues(Set<String> values) {
		return new ChoiceSlot(key, label, category, options, values, amount);
	}
}
