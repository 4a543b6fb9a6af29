package my.charbuilder.app.rules;

public record CatalogEntry(RuleCategory category, String key, String label) {
}
