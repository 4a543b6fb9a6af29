package my.charbuilder.app.rules;

public enum UnknownModePolicy {
	TREAT_AS_ALL,
	UNFULFILLED
}
