package my.charbuilder.app.content;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Snapshot of the warm foreign document catalog, one collection per tracked subtype.
 */
public record DocumentCatalog(Map<DocumentSubtype, DocumentCollection> collections) {
	public DocumentCatalog {
		Map<DocumentSubtype, DocumentCollection> copy = new EnumMap<>(DocumentSubtype.class);
		if (collections != null) {
			copy.putAll(collections);
		}
		collections = Collections.unmodifiableMap(copy);
	}

	public DocumentCollection collection(DocumentSubtype subtype) {
		return collections.getOrDefault(subtype, DocumentCollection.empty());
	}

	public int totalDocuments() {
		return collections.values().stream().mapToInt(DocumentCollection::size).sum();
	}
}
