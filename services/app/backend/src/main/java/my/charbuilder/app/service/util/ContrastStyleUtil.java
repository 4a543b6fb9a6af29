package my.charbuilder.app.service.util;

import java.util.Locale;
import java.util.regex.Pattern;

public final class ContrastStyleUtil {
	public static final int BRIGHTNESS_THRESHOLD = 125;
	private static final Pattern HEX_COLOR = Pattern.compile("^#([0-9a-fA-F]{3}|[0-9a-fA-F]{6})$");

	private ContrastStyleUtil() {
	}

	/**
	 * Inline style for a chip colored {@code color}: the background plus black or white text, whichever
	 * contrasts. Returns {@code null} without a color; an unreadable color keeps only the background.
	 */
	public static String styleFor(String color) {
		if (color == null || color.isBlank()) {
			return null;
		}
		String trimmed = color.trim();
		StringBuilder style = new StringBuilder("background-color: ").append(trimmed).append(';');
		Integer brightness = brightness(trimmed);
		if (brightness != null) {
			style.append("color: ").append(brightness > BRIGHTNESS_THRESHOLD ? "black" : "white").append(';');
		}
		return style.toString();
	}

	/**
	 * Perceived brightness {@code round((R*299 + G*587 + B*114) / 1000)} of a {@code #RRGGBB} or
	 * {@code #RGB} color, {@code null} when the value is not a hex color.
	 */
	public static Integer brightness(String color) {
		if (color == null || !HEX_COLOR.matcher(color.trim()).matches()) {
			return null;
		}
		String hex = color.trim().substring(1).toLowerCase(Locale.ROOT);
		if (hex.length() == 3) {
			hex = "" + hex.charAt(0) + hex.charAt(0) + hex.charAt(1) + hex.charAt(1) + hex.charAt(2) + hex.charAt(2);
		}
		int r = Integer.parseInt(hex.substring(0, 2), 16);
		int g = Integer.parseInt(hex.substring(2, 4), 16);
		int b = Integer.parseInt(hex.substring(4, 6), 16);
		return (int) Math.round((r * 299 + g * 587 + b * 114) / 1000.0d);
	}
}
