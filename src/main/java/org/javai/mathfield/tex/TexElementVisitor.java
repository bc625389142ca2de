package org.javai.mathfield.tex;

/**
 * Visitor over the {@link TexElement} variants.
 *
 * <p>Rendering and encoding are written as visitors so that the rules for every variant
 * live in one place per concern.</p>
 *
 * @param <R> the return type of the visitor operations
 */
public interface TexElementVisitor<R> {

	/**
	 * Visits a terminal fragment.
	 *
	 * @param leaf the leaf
	 * @return the result of visiting this element
	 */
	R visitLeaf(TexElement.Leaf leaf);

	/**
	 * Visits a function with nested argument nodes.
	 *
	 * @param function the function
	 * @return the result of visiting this element
	 */
	R visitFunction(TexFunction function);

	/**
	 * Visits the cursor marker of the active node.
	 *
	 * @param cursor the marker
	 * @return the result of visiting this element
	 */
	R visitCursor(TexElement.CursorMarker cursor);
}
