package my.charbuilder.app.content;

import java.util.List;
import java.util.Optional;

/**
 * A compendium of documents that is indexed up front and fetched by id on demand.
 */
public interface ContentPackage {
	String id();

	/**
	 * Document type every entry of this package shares, e.g. {@code Item}.
	 */
	String documentType();

	List<PackageIndexEntry> indexEntries(DocumentSubtype subtype);

	/**
	 * @throws ContentFetchException when the entry exists but cannot be read
	 */
	Optional<SourceDocument> fetchById(String id);
}
