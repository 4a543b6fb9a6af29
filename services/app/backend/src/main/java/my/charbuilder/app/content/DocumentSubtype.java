package my.charbuilder.app.content;

import java.util.Locale;

/**
 * Item subtypes whose documents are collected into the foreign document catalog.
 */
public enum DocumentSubtype {
	LINEAGE("lineage"),
	HERITAGE("heritage"),
	BACKGROUND("background"),
	TALENT("talent"),
	CLASS("class");

	private final String key;

	DocumentSubtype(String key) {
		this.key = key;
	}

	public String key() {
		return key;
	}

	public boolean matches(String type) {
		return type != null && key.equals(type.trim().toLowerCase(Locale.ROOT));
	}
}
