package my.charbuilder.app.rules;

import java.util.Locale;
import java.util.Optional;

/**
 * How many of a trait's builder options must be completed for the trait to count as fulfilled.
 */
public enum FulfillmentMode {
	ALL,
	ANY,
	CHOOSE_ONE;

	/**
	 * Blank modes default to {@link #ALL}; an unrecognized mode yields empty.
	 */
	public static Optional<FulfillmentMode> parse(String mode) {
		if (mode == null || mode.isBlank()) {
			return Optional.of(ALL);
		}
		String normalized = mode.trim().toUpperCase(Locale.ROOT);
		for (FulfillmentMode candidate : values()) {
			if (candidate.name().equals(normalized)) {
				return Optional.of(candidate);
			}
		}
		return Optional.empty();
	}

	public boolean isFulfilled(int choicesMade, int optionCount) {
		return switch (this) {
			case ALL -> choicesMade == optionCount;
			case ANY -> choicesMade > 0;
			case CHOOSE_ONE -> choicesMade == 1;
		};
	}
}
