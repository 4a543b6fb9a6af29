package my.charbuilder.app.content;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the local document collection and the content packs from JSON resources.
 * Resources are re-read on every call; the catalog service caches the result.
 */
public class ClasspathDocumentProvider implements DocumentProvider {
	private static final Logger logger = LoggerFactory.getLogger(ClasspathDocumentProvider.class);

	private final ResourcePatternResolver resourceResolver;
	private final ContentParser parser;
	private final String localDocumentsLocation;
	private final String packagesPattern;

	public ClasspathDocumentProvider(ResourcePatternResolver resourceResolver,
									 ContentParser parser,
									 String localDocumentsLocation,
									 String packagesPattern) {
		this.resourceResolver = resourceResolver;
		this.parser = parser;
		this.localDocumentsLocation = localDocumentsLocation;
		this.packagesPattern = packagesPattern;
	}

	@Override
	public List<SourceDocument> getLocalCollection(String documentType) {
		if (localDocumentsLocation == null || localDocumentsLocation.isBlank()) {
			return List.of();
		}
		Resource resource = resourceResolver.getResource(localDocumentsLocation);
		if (!resource.exists()) {
			logger.warn("Local document resource not found: {}", localDocumentsLocation);
			return List.of();
		}
		try {
			return parser.parseLocalCollections(read(resource), localDocumentsLocation).collection(documentType);
		} catch (IOException ex) {
			throw new ContentFetchException("Failed to read local documents from " + localDocumentsLocation, null, ex);
		}
	}

	@Override
	public List<ContentPackage> listPackages() {
		if (packagesPattern == null || packagesPattern.isBlank()) {
			return List.of();
		}
		Resource[] resources;
		try {
			resources = resourceResolver.getResources(packagesPattern);
		} catch (IOException ex) {
			logger.warn("Failed to list content packs for {}: {}", packagesPattern, ex.getMessage());
			return List.of();
		}
		List<ContentPackage> packages = new ArrayList<>();
		for (Resource resource : resources) {
			String origin = resource.getDescription();
			try {
				ContentPackDefinition definition = parser.parsePack(read(resource), origin);
				packages.add(new JsonContentPackage(definition));
			} catch (IOException | ContentFetchException ex) {
				logger.warn("Skipping content pack {}: {}", origin, ex.getMessage());
			}
		}
		logger.debug("Loaded {} content pack(s) from {}", packages.size(), packagesPattern);
		return packages;
	}

	private String read(Resource resource) throws IOException {
		try (InputStream inputStream = resource.getInputStream()) {
			return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
		}
	}
}
