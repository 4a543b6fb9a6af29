package my.charbuilder.app.service;

import my.charbuilder.app.content.SourceDocument;
import my.charbuilder.app.content.TraitTemplate;
import my.charbuilder.app.model.Trait;
import org.springframework.stereotype.Component;

@Component
public class TraitFactory {

	/**
	 * Stamps a template with its owning document. The document's color wins over the template's own.
	 */
	public Trait fromTemplate(TraitTemplate template, SourceDocument owner) {
		String color = owner.color() != null && !owner.color().isBlank() ? owner.color() : template.color();
		return new Trait(
				template.id(),
				template.name(),
				owner.name(),
				owner.id(),
				color,
				template.innate(),
				template.builderInfo()
		);
	}
}
