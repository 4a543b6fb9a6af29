package my.charbuilder.app.rules;

import java.util.Map;

public class RuleCatalogDefinition {
	private int schemaVersion;
	private String name;
	private Map<String, Map<String, EntryDefinition>> categories;

	public int getSchemaVersion() {
		return schemaVersion;
	}

	public void setSchemaVersion(int schemaVersion) {
		this.schemaVersion = schemaVersion;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public Map<String, Map<String, EntryDefinition>> getCategories() {
		return categories;
	}

	public void setCategories(Map<String, Map<String, EntryDefinition>> categories) {
		this.categories = categories;
	}

	public static class EntryDefinition {
		private String label;

		public String getLabel() {
			return label;
		}

		public void setLabel(String label) {
			this.label = label;
		}
	}
}
