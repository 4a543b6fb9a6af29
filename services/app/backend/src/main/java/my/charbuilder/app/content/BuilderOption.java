package my.charbuilder.app.content;

import java.util.List;

public record BuilderOption(Integer amount,
							String category,
							List<String> values,
							String valuesType,
							String label) {
	public BuilderOption {
		values = values == null ? List.of() : List.copyOf(values);
	}

	public int resolvedAmount() {
		return amount == null || amount < 1 ? 1 : amount;
	}

	public String resolvedLabel(String key) {
		return label == null || label.isBlank() ? key : label;
	}
}
