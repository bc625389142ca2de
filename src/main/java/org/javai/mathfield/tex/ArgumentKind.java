package org.javai.mathfield.tex;

import java.util.Optional;

/**
 * How an argument of a {@link TexFunction} is delimited when rendered.
 *
 * <p>Each kind carries the text emitted before and after the argument content and the
 * name under which it is written to the interchange format.</p>
 */
public enum ArgumentKind {

	/**
	 * <code>{ }</code>. Used by most functions, e.g. both arguments of a fraction.
	 */
	BRACES("{", "}", "braces"),

	/**
	 * <code>[ ]</code>. Used for the index of an n-th root.
	 */
	BRACKETS("[", "]", "brackets"),

	/**
	 * <code>| |</code>. Absolute value.
	 */
	VERTICAL_BARS("|", "|", "verticalBars"),

	/**
	 * <code>( )</code>. Base-n logarithm and named functions.
	 */
	PARENTHESES("(", ")", "parentheses"),

	/**
	 * A bare <code>^</code> separator between two other slots.
	 *
	 * <p>The argument paired with this kind is never rendered: the slot contributes only
	 * the caret. {@code [BRACES, POWER, BRACES]} renders as <code>{A}^{B}</code>.</p>
	 */
	POWER("", "^", "power");

	private final String opening;
	private final String closing;
	private final String wireName;

	ArgumentKind(String opening, String closing, String wireName) {
		this.opening = opening;
		this.closing = closing;
		this.wireName = wireName;
	}

	public String opening() {
		return opening;
	}

	public String closing() {
		return closing;
	}

	/**
	 * Name used in the JSON interchange format.
	 */
	public String wireName() {
		return wireName;
	}

	/**
	 * Whether the argument content is emitted between {@link #opening()} and {@link #closing()}.
	 */
	public boolean rendersContent() {
		return this != POWER;
	}

	/**
	 * Resolves a wire name. Qualified names such as {@code TeXArg.braces} resolve by their
	 * last segment.
	 *
	 * @param name the wire name
	 * @return the matching kind, or empty if the name is unknown
	 */
	public static Optional<ArgumentKind> fromWireName(String name) {
		if (name == null) {
			return Optional.empty();
		}
		String simpleName = name.substring(name.lastIndexOf('.') + 1);
		for (ArgumentKind kind : values()) {
			if (kind.wireName.equals(simpleName)) {
				return Optional.of(kind);
			}
		}
		return Optional.empty();
	}
}
