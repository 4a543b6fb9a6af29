package my.charbuilder.app.content;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Content package backed by a parsed JSON pack file.
 */
public class JsonContentPackage implements ContentPackage {
	private final String id;
	private final String documentType;
	private final Map<String, SourceDocument> documents;

	public JsonContentPackage(ContentPackDefinition definition) {
		this.id = definition.id();
		this.documentType = definition.type() == null || definition.type().isBlank()
				? DocumentProvider.ITEM_TYPE
				: definition.type();
		Map<String, SourceDocument> byId = new LinkedHashMap<>();
		for (SourceDocument document : definition.documents()) {
			if (document.id() == null || document.id().isBlank()) {
				continue;
			}
			byId.putIfAbsent(document.id(), document);
		}
		this.documents = byId;
	}

	@Override
	public String id() {
		return id;
	}

	@Override
	public String documentType() {
		return documentType;
	}

	@Override
	public List<PackageIndexEntry> indexEntries(DocumentSubtype subtype) {
		return documents.values().stream()
				.filter(d -> subtype.matches(d.type()))
				.map(d -> new PackageIndexEntry(d.id(), d.name(), d.type()))
				.toList();
	}

	@Override
	public Optional<SourceDocument> fetchById(String documentId) {
		if (documentId == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(documents.get(documentId));
	}
}
