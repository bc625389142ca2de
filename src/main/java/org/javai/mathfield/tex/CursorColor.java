package org.javai.mathfield.tex;

/**
 * Color of the rendered cursor. Only the RGB part of {@code argb} is emitted.
 *
 * @param argb the color as a packed ARGB (or plain RGB) integer
 */
public record CursorColor(int argb) {

	/**
	 * Creates a color from a packed ARGB or RGB integer.
	 */
	public static CursorColor of(int argb) {
		return new CursorColor(argb);
	}

	/**
	 * Parses {@code #rrggbb} or {@code rrggbb}.
	 *
	 * @param hex six hexadecimal digits, optionally prefixed with {@code #}
	 * @return the color
	 * @throws IllegalArgumentException if the text is not six hexadecimal digits
	 */
	public static CursorColor parse(String hex) {
		if (hex == null) {
			throw new IllegalArgumentException("hex must not be null");
		}
		String digits = hex.startsWith("#") ? hex.substring(1) : hex;
		if (!digits.matches("[0-9a-fA-F]{6}")) {
			throw new IllegalArgumentException("Not a #rrggbb color: " + hex);
		}
		return new CursorColor(Integer.parseInt(digits, 16));
	}

	/**
	 * The color as {@code #rrggbb} with lowercase digits.
	 */
	public String hex() {
		return String.format("#%06x", argb & 0xFFFFFF);
	}
}
