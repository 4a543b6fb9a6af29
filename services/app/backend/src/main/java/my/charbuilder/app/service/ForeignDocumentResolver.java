package my.charbuilder.app.service;

import my.charbuilder.app.content.DocumentCatalog;
import my.charbuilder.app.content.DocumentSubtype;
import my.charbuilder.app.content.SourceDocument;
import my.charbuilder.app.domain.CharacterRecord;
import my.charbuilder.app.model.ResolvedReferences;
import org.springframework.stereotype.Service;

@Service
public class ForeignDocumentResolver {

	/**
	 * Resolves the stored background, heritage, lineage and class ids. Unknown ids resolve to
	 * {@code null}; they are an ordinary state, not an error.
	 */
	public ResolvedReferences resolveReferences(CharacterRecord record, DocumentCatalog catalog) {
		return new ResolvedReferences(
				record.backgroundId(), resolve(catalog, DocumentSubtype.BACKGROUND, record.backgroundId()),
				record.heritageId(), resolve(catalog, DocumentSubtype.HERITAGE, record.heritageId()),
				record.lineageId(), resolve(catalog, DocumentSubtype.LINEAGE, record.lineageId()),
				record.classId(), resolve(catalog, DocumentSubtype.CLASS, record.classId())
		);
	}

	private SourceDocument resolve(DocumentCatalog catalog, DocumentSubtype subtype, String id) {
		return catalog.collection(subtype).get(id).orElse(null);
	}
}
