package my.charbuilder.app.model;

import my.charbuilder.app.content.SourceDocument;

import java.util.ArrayList;
import java.util.List;

/**
 * Stored reference ids next to the documents they resolved to. A document is {@code null} when its id is
 * unset or no longer exists.
 */
public record ResolvedReferences(String backgroundId,
								 SourceDocument background,
								 String heritageId,
								 SourceDocument heritage,
								 String lineageId,
								 SourceDocument lineage,
								 String classId,
								 SourceDocument characterClass) {

	public static ResolvedReferences none() {
		return new ResolvedReferences(null, null, null, null, null, null, null, null);
	}

	/**
	 * Documents that grant traits, in display order: background, heritage, lineage.
	 */
	public List<SourceDocument> traitSources() {
		List<SourceDocument> sources = new ArrayList<>(3);
		if (background != null) {
			sources.add(background);
		}
		if (heritage != null) {
			sources.add(heritage);
		}
		if (lineage != null) {
			sources.add(lineage);
		}
		return sources;
	}
}
