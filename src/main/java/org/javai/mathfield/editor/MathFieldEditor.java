package org.javai.mathfield.editor;

import java.util.List;
import java.util.Optional;
import org.javai.mathfield.serialization.TexNodeSerializer;
import org.javai.mathfield.tex.ArgumentKind;
import org.javai.mathfield.tex.NavigationState;
import org.javai.mathfield.tex.RenderOptions;
import org.javai.mathfield.tex.TexElement;
import org.javai.mathfield.tex.TexFunction;
import org.javai.mathfield.tex.TexNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives editing of one document: owns the root node and the single active node, and turns
 * the {@link NavigationState} signals of {@link TexNode} into moves between nodes.
 *
 * <h2>Navigable arguments</h2>
 * <p>The cursor only enters argument slots whose content is rendered. {@link ArgumentKind#POWER}
 * slots are stepped over; a function with no other slot is passed like a single symbol.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * MathFieldEditor editor = new MathFieldEditor();
 * editor.addLeaf("1");
 * editor.addFunction(TexFunctions.fraction());   // cursor now in the numerator
 * editor.addLeaf("2");
 * editor.goRight();                              // into the denominator
 * editor.addLeaf("3");
 * String tex = editor.render(RenderOptions.withCursor(CursorColor.parse("#000000")));
 * // 1\frac{2}{3\textcolor{#000000}{\cursor}}
 * }</pre>
 *
 * <p>Not thread-safe: one editor serves one input source.</p>
 */
public class MathFieldEditor {

	private static final Logger logger = LoggerFactory.getLogger(MathFieldEditor.class);

	private final TexNode root;
	private TexNode activeNode;

	/**
	 * Creates an editor for a new, empty document.
	 */
	public MathFieldEditor() {
		this(new TexNode());
	}

	/**
	 * Creates an editor for an existing document. The cursor is placed in the root node at its
	 * stored position; a cursor marker held by any other node of the tree is removed.
	 *
	 * @param root the root node of the document
	 * @throws IllegalArgumentException if the node is an argument of a function
	 */
	public MathFieldEditor(TexNode root) {
		if (root == null) {
			throw new IllegalArgumentException("root must not be null");
		}
		if (root.owner().isPresent()) {
			throw new IllegalArgumentException("The root node must not be a function argument");
		}
		this.root = root;
		this.activeNode = root;
		deactivateArguments(root);
		root.activate();
	}

	/**
	 * Reads a document and opens an editor on it.
	 *
	 * @param document the serialized document
	 * @param serializer the serializer that wrote it
	 * @return an editor with the cursor in the root node
	 * @throws TexNodeSerializer.FormatException if the document is malformed
	 */
	public static MathFieldEditor load(String document, TexNodeSerializer serializer) {
		return new MathFieldEditor(serializer.deserialize(document));
	}

	/**
	 * Serializes the document. The cursor marker is not written and the editor stays usable.
	 *
	 * @param serializer the serializer to use
	 * @return the document
	 */
	public String save(TexNodeSerializer serializer) {
		return serializer.serialize(root);
	}

	public TexNode root() {
		return root;
	}

	/**
	 * The node currently holding the cursor marker.
	 */
	public TexNode activeNode() {
		return activeNode;
	}

	/**
	 * Inserts a symbol at the cursor.
	 *
	 * @param expression the TeX fragment, e.g. {@code 7} or {@code \pi}
	 */
	public void addLeaf(String expression) {
		activeNode.insert(new TexElement.Leaf(expression));
	}

	/**
	 * Inserts a new function at the cursor and moves into its first navigable argument.
	 *
	 * @param expression the TeX fragment emitted before the arguments
	 * @param kinds the argument kinds
	 */
	public void addFunction(String expression, List<ArgumentKind> kinds) {
		addFunction(new TexFunction(expression, kinds));
	}

	/**
	 * Inserts a function at the cursor and moves to the start of its first navigable argument.
	 *
	 * @param function a function not yet held by any node
	 */
	public void addFunction(TexFunction function) {
		activeNode.insert(function);
		firstNavigable(function).ifPresent(argument -> switchTo(argument, 0));
	}

	/**
	 * Moves the cursor one step to the left, entering or leaving functions as needed.
	 */
	public void goLeft() {
		NavigationState state = activeNode.moveLeft();
		logger.debug("Move left returned {}", state);
		switch (state) {
			case MOVED:
				break;
			case DESCEND:
				TexFunction function = functionAt(activeNode.cursorPosition());
				Optional<TexNode> last = lastNavigable(function);
				if (last.isPresent()) {
					switchTo(last.get(), last.get().size());
				} else {
					activeNode.activate();
				}
				break;
			case BOUNDARY:
				activeNode.owner().ifPresent(owner -> {
					Optional<TexNode> previous = navigableFrom(owner, owner.indexOf(activeNode) - 1, -1);
					if (previous.isPresent()) {
						switchTo(previous.get(), previous.get().size());
					} else {
						leave(owner, 0);
					}
				});
				break;
		}
	}

	/**
	 * Moves the cursor one step to the right, entering or leaving functions as needed.
	 */
	public void goRight() {
		NavigationState state = activeNode.moveRight();
		logger.debug("Move right returned {}", state);
		switch (state) {
			case MOVED:
				break;
			case DESCEND:
				TexFunction function = functionAt(activeNode.cursorPosition() - 1);
				Optional<TexNode> first = firstNavigable(function);
				if (first.isPresent()) {
					switchTo(first.get(), 0);
				} else {
					activeNode.activate();
				}
				break;
			case BOUNDARY:
				activeNode.owner().ifPresent(owner -> {
					Optional<TexNode> next = navigableFrom(owner, owner.indexOf(activeNode) + 1, 1);
					if (next.isPresent()) {
						switchTo(next.get(), 0);
					} else {
						leave(owner, 1);
					}
				});
				break;
		}
	}

	/**
	 * Deletes backwards from the cursor.
	 *
	 * <p>A function before the cursor is entered and the delete continues in its last
	 * navigable argument. At the start of a non-first argument the cursor moves to the end of
	 * the previous one. At the start of the first argument the function is removed if all its
	 * navigable arguments are empty; otherwise the cursor moves to just before it.</p>
	 */
	public void deleteBackward() {
		NavigationState state = activeNode.deleteBackward();
		logger.debug("Delete returned {}", state);
		switch (state) {
			case MOVED:
				break;
			case DESCEND:
				TexFunction function = functionAt(activeNode.cursorPosition());
				Optional<TexNode> last = lastNavigable(function);
				if (last.isPresent()) {
					switchTo(last.get(), last.get().size());
					deleteBackward();
				} else {
					activeNode.remove(function);
					activeNode.activate();
				}
				break;
			case BOUNDARY:
				activeNode.owner().ifPresent(owner -> {
					Optional<TexNode> previous = navigableFrom(owner, owner.indexOf(activeNode) - 1, -1);
					if (previous.isPresent()) {
						switchTo(previous.get(), previous.get().size());
						return;
					}
					boolean blank = isBlank(owner);
					leave(owner, 0);
					if (blank) {
						logger.debug("Removing empty function {}", owner);
						activeNode.remove(owner);
					}
				});
				break;
		}
	}

	/**
	 * Removes all content and puts the cursor back into the root node.
	 */
	public void clear() {
		activeNode.deactivate();
		root.clear();
		activeNode = root;
		root.activate();
	}

	/**
	 * Whether the document has no content.
	 */
	public boolean isEmpty() {
		return root.isEmpty();
	}

	/**
	 * Whether the cursor is the last element of the root node.
	 */
	public boolean isCursorAtEnd() {
		return root.isCursorAtEnd();
	}

	/**
	 * Renders the whole document.
	 *
	 * @param options render options; a cursor color is required since the cursor is always
	 *        materialized somewhere in the document
	 * @return the TeX string
	 */
	public String render(RenderOptions options) {
		return root.render(options);
	}

	private TexFunction functionAt(int index) {
		return (TexFunction) activeNode.children().get(index);
	}

	private void switchTo(TexNode node, int cursorPosition) {
		activeNode.deactivate();
		activeNode = node;
		node.setCursorPosition(cursorPosition);
		node.activate();
	}

	/**
	 * Leaves the function's argument for the node holding the function, landing just before
	 * it ({@code offset} 0) or just after it ({@code offset} 1).
	 */
	private void leave(TexFunction function, int offset) {
		TexNode parent = function.parent()
				.orElseThrow(() -> new IllegalStateException(function + " is not held by any node"));
		switchTo(parent, parent.indexOf(function) + offset);
	}

	private static void deactivateArguments(TexNode node) {
		for (TexElement child : node.children()) {
			if (child instanceof TexFunction function) {
				for (TexNode argument : function.arguments()) {
					if (argument.isActive()) {
						logger.debug("Removing stray cursor marker from an argument of {}", function);
						argument.deactivate();
					}
					deactivateArguments(argument);
				}
			}
		}
	}

	private static boolean isBlank(TexFunction function) {
		for (int i = 0; i < function.argumentCount(); i++) {
			if (function.kind(i).rendersContent() && !function.argument(i).isEmpty()) {
				return false;
			}
		}
		return true;
	}

	private static Optional<TexNode> firstNavigable(TexFunction function) {
		return navigableFrom(function, 0, 1);
	}

	private static Optional<TexNode> lastNavigable(TexFunction function) {
		return navigableFrom(function, function.argumentCount() - 1, -1);
	}

	private static Optional<TexNode> navigableFrom(TexFunction function, int start, int step) {
		for (int i = start; i >= 0 && i < function.argumentCount(); i += step) {
			if (function.kind(i).rendersContent()) {
				return Optional.of(function.argument(i));
			}
		}
		return Optional.empty();
	}
}
