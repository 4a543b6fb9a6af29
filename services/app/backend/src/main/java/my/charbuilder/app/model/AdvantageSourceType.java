package my.charbuilder.app.model;

public enum AdvantageSourceType {
	MANUAL,
	INNATE,
	CHOICE
}
