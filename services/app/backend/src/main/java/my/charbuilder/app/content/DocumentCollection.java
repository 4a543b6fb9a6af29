package my.charbuilder.app.content;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Documents of one subtype keyed by id, in display order.
 */
public final class DocumentCollection {
	private static final DocumentCollection EMPTY = new DocumentCollection(List.of());

	private final Map<String, SourceDocument> documents;

	public DocumentCollection(List<SourceDocument> ordered) {
		Map<String, SourceDocument> byId = new LinkedHashMap<>();
		for (SourceDocument document : ordered) {
			byId.putIfAbsent(document.id(), document);
		}
		this.documents = Collections.unmodifiableMap(byId);
	}

	public static DocumentCollection empty() {
		return EMPTY;
	}

	public Optional<SourceDocument> get(String id) {
		if (id == null || id.isBlank()) {
			return Optional.empty();
		}
		return Optional.ofNullable(documents.get(id));
	}

	public List<SourceDocument> documents() {
		return List.copyOf(documents.values());
	}

	public int size() {
		return documents.size();
	}

	public boolean isEmpty() {
		return documents.isEmpty();
	}
}
