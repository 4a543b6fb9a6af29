package my.charbuilder.app.content;

public record TraitTemplate(String id,
							String name,
							String color,
							InnateGrants innate,
							BuilderInfo builderInfo) {
	public TraitTemplate {
		innate = innate == null ? InnateGrants.empty() : innate;
	}

	public boolean hasId() {
		return id != null && !id.isBlank();
	}
}
