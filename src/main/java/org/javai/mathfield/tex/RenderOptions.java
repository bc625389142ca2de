package org.javai.mathfield.tex;

import java.util.Optional;

/**
 * Options for rendering a {@link TexNode} to a TeX string.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // No cursor color, placeholder for an empty root
 * RenderOptions options = RenderOptions.defaults();
 *
 * // Custom configuration
 * RenderOptions options = RenderOptions.builder()
 *         .cursorColor(CursorColor.parse("#2196f3"))
 *         .placeholderWhenEmpty(false)
 *         .build();
 * }</pre>
 *
 * @param cursorColor color of the cursor token; may be {@code null}, in which case rendering a
 *        cursor marker fails
 * @param placeholderWhenEmpty whether an empty node passed to {@code render} produces the
 *        placeholder (otherwise the empty string); nested empty arguments always do
 * @param placeholder the token standing in for an empty node
 */
public record RenderOptions(
		CursorColor cursorColor,
		boolean placeholderWhenEmpty,
		String placeholder
) {

	/**
	 * Default token for an empty node.
	 */
	public static final String DEFAULT_PLACEHOLDER = "\\Box";

	public RenderOptions {
		if (placeholder == null) {
			throw new IllegalArgumentException("placeholder must not be null");
		}
	}

	/**
	 * Creates options without a cursor color, with the default placeholder enabled.
	 *
	 * @return default options
	 */
	public static RenderOptions defaults() {
		return new RenderOptions(null, true, DEFAULT_PLACEHOLDER);
	}

	/**
	 * Creates default options with the given cursor color.
	 *
	 * @param cursorColor the cursor color
	 * @return options rendering the cursor in that color
	 */
	public static RenderOptions withCursor(CursorColor cursorColor) {
		return new RenderOptions(cursorColor, true, DEFAULT_PLACEHOLDER);
	}

	/**
	 * The cursor color, if one is configured.
	 */
	public Optional<CursorColor> cursorColorIfPresent() {
		return Optional.ofNullable(cursorColor);
	}

	/**
	 * Creates a new builder for custom configuration.
	 *
	 * @return a new builder
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link RenderOptions}.
	 */
	public static class Builder {
		private CursorColor cursorColor;
		private boolean placeholderWhenEmpty = true;
		private String placeholder = DEFAULT_PLACEHOLDER;

		private Builder() {}

		public Builder cursorColor(CursorColor cursorColor) {
			this.cursorColor = cursorColor;
			return this;
		}

		public Builder placeholderWhenEmpty(boolean placeholderWhenEmpty) {
			this.placeholderWhenEmpty = placeholderWhenEmpty;
			return this;
		}

		/**
		 * Sets the token standing in for empty nodes, e.g. {@code \square}.
		 *
		 * @param placeholder the token (must not be null)
		 * @return this builder
		 */
		public Builder placeholder(String placeholder) {
			this.placeholder = placeholder;
			return this;
		}

		public RenderOptions build() {
			return new RenderOptions(cursorColor, placeholderWhenEmpty, placeholder);
		}
	}
}
