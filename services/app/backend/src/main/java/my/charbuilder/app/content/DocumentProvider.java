package my.charbuilder.app.content;

import java.util.List;

/**
 * Read access to the document store: the locally loaded collections and the installed content packages.
 */
public interface DocumentProvider {
	String ITEM_TYPE = "Item";

	List<SourceDocument> getLocalCollection(String documentType);

	List<ContentPackage> listPackages();
}
