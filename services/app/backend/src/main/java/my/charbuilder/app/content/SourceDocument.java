package my.charbuilder.app.content;

import java.util.List;

/**
 * Character-building content record (background, heritage, lineage, talent or class).
 * Owned by the document store; read-only here.
 */
public record SourceDocument(String id,
							 String name,
							 String type,
							 String color,
							 List<TraitTemplate> traits) {
	public SourceDocument {
		traits = traits == null ? List.of() : List.copyOf(traits);
	}
}
