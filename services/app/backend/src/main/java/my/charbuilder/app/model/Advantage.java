package my.charbuilder.app.model;

/**
 * A sourced, displayable gameplay modifier. Equality is structural over every field.
 */
public record Advantage(String source,
						String sourceId,
						AdvantageSourceType sourceType,
						String value,
						String label,
						String style) {
}
