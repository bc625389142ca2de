package org.javai.mathfield.tex;

import java.util.Objects;

/**
 * Anything a {@link TexNode} can hold. Sealed so that every consumer handling elements
 * through a {@link TexElementVisitor} covers all variants.
 * <p>
 * Elements are:
 * <ul>
 *   <li>{@link Leaf} - a terminal fragment such as a digit or an operator</li>
 *   <li>{@link TexFunction} - a fragment with nested argument nodes, e.g. <code>\frac</code></li>
 *   <li>{@link CursorMarker} - the transient edit position of the active node</li>
 * </ul>
 */
public sealed interface TexElement permits TexElement.Leaf, TexElement.CursorMarker, TexFunction {

	/**
	 * The TeX fragment this element stands for. Empty for the cursor marker.
	 */
	String expression();

	/**
	 * Dispatches to the visitor method matching this variant.
	 *
	 * @param <R> the visitor's result type
	 * @param visitor the visitor to accept
	 * @return the visitor's result
	 */
	<R> R accept(TexElementVisitor<R> visitor);

	/**
	 * A single immutable TeX fragment.
	 *
	 * @param expression the literal text, e.g. {@code 7} or {@code \cdot}
	 */
	record Leaf(String expression) implements TexElement {

		public Leaf {
			Objects.requireNonNull(expression, "expression must not be null");
		}

		@Override
		public <R> R accept(TexElementVisitor<R> visitor) {
			return visitor.visitLeaf(this);
		}
	}

	/**
	 * Sentinel marking the edit position inside the active node. Never persisted.
	 */
	record CursorMarker() implements TexElement {

		public static final CursorMarker INSTANCE = new CursorMarker();

		@Override
		public String expression() {
			return "";
		}

		@Override
		public <R> R accept(TexElementVisitor<R> visitor) {
			return visitor.visitCursor(this);
		}
	}
}
