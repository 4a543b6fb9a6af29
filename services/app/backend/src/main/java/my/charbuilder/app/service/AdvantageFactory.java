package my.charbuilder.app.service;

import my.charbuilder.app.domain.TraitChoice;
import my.charbuilder.app.model.Advantage;
import my.charbuilder.app.model.AdvantageSourceType;
import my.charbuilder.app.model.Trait;
import my.charbuilder.app.rules.CatalogEntry;
import my.charbuilder.app.service.util.ContrastStyleUtil;
import org.springframework.stereotype.Component;

@Component
public class AdvantageFactory {
	public static final String MANUAL_SOURCE = "Manual";

	public Advantage manual(CatalogEntry entry) {
		return new Advantage(MANUAL_SOURCE, null, AdvantageSourceType.MANUAL, entry.key(), entry.label(), null);
	}

	public Advantage innate(Trait trait, CatalogEntry entry) {
		return new Advantage(trait.displaySource(), trait.sourceId(), AdvantageSourceType.INNATE,
				entry.key(), entry.label(), ContrastStyleUtil.styleFor(trait.color()));
	}

	public Advantage chosen(TraitChoice traitChoice, CatalogEntry entry) {
		return new Advantage(traitChoice.displaySource(), traitChoice.sourceId(), AdvantageSourceType.CHOICE,
				entry.key(), entry.label(), ContrastStyleUtil.styleFor(traitChoice.color()));
	}
}
