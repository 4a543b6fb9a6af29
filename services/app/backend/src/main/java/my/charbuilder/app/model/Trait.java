package my.charbuilder.app.model;

import my.charbuilder.app.content.BuilderInfo;
import my.charbuilder.app.content.InnateGrants;

/**
 * A trait template attached to a character, stamped with the document it came from.
 */
public record Trait(String id,
					String name,
					String source,
					String sourceId,
					String color,
					InnateGrants innate,
					BuilderInfo builderInfo) {
	public Trait {
		innate = innate == null ? InnateGrants.empty() : innate;
	}

	public boolean hasId() {
		return id != null && !id.isBlank();
	}

	public String displaySource() {
		return source + " (" + name + ")";
	}
}
