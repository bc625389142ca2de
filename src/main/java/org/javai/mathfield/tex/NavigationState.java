package org.javai.mathfield.tex;

/**
 * Outcome of a cursor move or a backward delete on a single {@link TexNode}.
 *
 * <p>None of these is an error. The caller driving the tree decides which node becomes
 * active next based on the returned state.</p>
 */
public enum NavigationState {

	/**
	 * The element in the direction of travel is a function. The node has released its
	 * cursor marker and the caller should continue inside one of the function's arguments.
	 */
	DESCEND,

	/**
	 * The cursor already sits at the edge of the node in the direction of travel. Nothing
	 * was changed; the caller should continue in the enclosing node, if any.
	 */
	BOUNDARY,

	/**
	 * The operation completed inside this node.
	 */
	MOVED
}
