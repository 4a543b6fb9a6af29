package my.charbuilder.app.content;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.PropertyNamingStrategies;
import tools.jackson.databind.json.JsonMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses content files document by document. A document that does not bind is logged and left out;
 * only a file that is not JSON at all, or a pack without an id, fails as a whole.
 */
public class ContentParser {
	private static final Logger logger = LoggerFactory.getLogger(ContentParser.class);

	private final ObjectMapper jsonMapper;

	public ContentParser() {
		this.jsonMapper = JsonMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();
	}

	public ContentPackDefinition parsePack(String content, String origin) {
		JsonNode root = readRoot(content, origin, "content pack");
		PackHeader header;
		try {
			header = jsonMapper.treeToValue(root, PackHeader.class);
		} catch (JacksonException ex) {
			throw new ContentFetchException("Invalid content pack header in " + origin + ": " + ex.getMessage(), origin, ex);
		}
		if (header == null || header.id() == null || header.id().isBlank()) {
			throw new ContentFetchException("Content pack without id: " + origin, origin, null);
		}
		List<SourceDocument> documents = parseDocuments(root.path("documents"), origin);
		return new ContentPackDefinition(header.id(), header.label(), header.type(), documents);
	}

	public LocalCollectionsDefinition parseLocalCollections(String content, String origin) {
		JsonNode root = readRoot(content, origin, "local collection");
		JsonNode collectionsNode = root.path("collections");
		Map<String, List<SourceDocument>> collections = new LinkedHashMap<>();
		if (collectionsNode.isObject()) {
			collectionsNode.properties().forEach(entry ->
					collections.put(entry.getKey(), parseDocuments(entry.getValue(), origin + " [" + entry.getKey() + "]")));
		} else if (!collectionsNode.isMissingNode() && !collectionsNode.isNull()) {
			logger.warn("Ignoring collections of {}: expected an object", origin);
		}
		return new LocalCollectionsDefinition(collections);
	}

	private JsonNode readRoot(String content, String origin, String kind) {
		JsonNode root;
		try {
			root = jsonMapper.readTree(content);
		} catch (JacksonException ex) {
			throw new ContentFetchException("Invalid " + kind + " JSON in " + origin + ": " + ex.getMessage(), null, ex);
		}
		if (root == null || !root.isObject()) {
			throw new ContentFetchException("Invalid " + kind + " JSON in " + origin + ": expected an object", null, null);
		}
		return root;
	}

	private List<SourceDocument> parseDocuments(JsonNode node, String origin) {
		if (node == null || node.isMissingNode() || node.isNull()) {
			return List.of();
		}
		if (!node.isArray()) {
			logger.warn("Ignoring documents of {}: expected an array", origin);
			return List.of();
		}
		List<SourceDocument> documents = new ArrayList<>();
		for (int i = 0; i < node.size(); i++) {
			try {
				SourceDocument document = jsonMapper.treeToValue(node.get(i), SourceDocument.class);
				if (document != null) {
					documents.add(document);
				}
			} catch (JacksonException ex) {
				logger.warn("Skipping document #{} of {}: {}", i, origin, ex.getOriginalMessage());
			}
		}
		return documents;
	}

	record PackHeader(String id, String label, String type) {
	}
}
