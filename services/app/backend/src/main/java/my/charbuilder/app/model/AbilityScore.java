package my.charbuilder.app.model;

public record AbilityScore(int value, int modifier) {

	public static AbilityScore of(int value) {
		return new AbilityScore(value, Math.floorDiv(value - 10, 2));
	}
}
