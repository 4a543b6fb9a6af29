package my.charbuilder.app.content;

import java.util.List;
import java.util.Map;

/**
 * Locally loaded documents grouped by document type.
 */
public record LocalCollectionsDefinition(Map<String, List<SourceDocument>> collections) {
	public LocalCollectionsDefinition {
		collections = collections == null ? Map.of() : Map.copyOf(collections);
	}

	public List<SourceDocument> collection(String documentType) {
		List<SourceDocument> documents = collections.get(documentType);
		return documents == null ? List.of() : documents;
	}
}
