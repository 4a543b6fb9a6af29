package my.charbuilder.app.content;

import java.util.List;

public record ContentPackDefinition(String id,
									String label,
									String type,
									List<SourceDocument> documents) {
	public ContentPackDefinition {
		documents = documents == null ? List.of() : List.copyOf(documents);
	}
}
