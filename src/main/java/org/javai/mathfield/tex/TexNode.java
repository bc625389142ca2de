package org.javai.mathfield.tex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An ordered, editable sequence of {@link TexElement}s with a persistent edit position.
 *
 * <p>A node is either the root of a document or one argument of a {@link TexFunction}.
 * Navigation and deletion act only on this node's own children and report through a
 * {@link NavigationState} when the caller has to continue in a nested or enclosing node.</p>
 *
 * <h2>Cursor marker</h2>
 * <p>While the node is <em>active</em> its children contain exactly one
 * {@link TexElement.CursorMarker} at index {@link #cursorPosition()}. An inactive node holds
 * no marker. {@link #activate()} and {@link #deactivate()} switch between the two states;
 * only one node of a document should be active at a time.</p>
 *
 * <h2>Ownership</h2>
 * <p>The node owns its children. {@link #owner()} refers back to the function whose
 * argument this node is; that reference is only used for upward navigation.</p>
 *
 * <p>Not thread-safe.</p>
 */
public final class TexNode {

	private final List<TexElement> children = new ArrayList<>();
	private int cursorPosition;
	private boolean active;
	private TexFunction owner;

	/**
	 * Creates an empty, inactive node with the cursor position at 0.
	 */
	public TexNode() {
	}

	/**
	 * All children, including the cursor marker when the node is active.
	 *
	 * @return an unmodifiable view of the children
	 */
	public List<TexElement> children() {
		return Collections.unmodifiableList(children);
	}

	/**
	 * The children without the cursor marker, i.e. the content that is persisted.
	 *
	 * @return a snapshot of the persistent children
	 */
	public List<TexElement> persistentChildren() {
		if (!active) {
			return List.copyOf(children);
		}
		List<TexElement> persistent = new ArrayList<>(children);
		persistent.remove(cursorPosition);
		return Collections.unmodifiableList(persistent);
	}

	/**
	 * Number of persistent children.
	 */
	public int size() {
		return active ? children.size() - 1 : children.size();
	}

	/**
	 * Whether the node has no persistent content. An active node holding only its cursor
	 * marker is empty.
	 */
	public boolean isEmpty() {
		return size() == 0;
	}

	/**
	 * The edit position, between 0 and {@link #size()} inclusive.
	 */
	public int cursorPosition() {
		return cursorPosition;
	}

	/**
	 * Places the edit position. The cursor marker follows if the node is active.
	 *
	 * @param position the new position, between 0 and {@link #size()} inclusive
	 * @throws IllegalArgumentException if the position is out of range
	 */
	public void setCursorPosition(int position) {
		if (position < 0 || position > size()) {
			throw new IllegalArgumentException(
					"Cursor position " + position + " is outside [0, " + size() + "]");
		}
		boolean wasActive = active;
		deactivate();
		cursorPosition = position;
		if (wasActive) {
			activate();
		}
	}

	/**
	 * The function whose argument this node is. Empty for a root node.
	 */
	public Optional<TexFunction> owner() {
		return Optional.ofNullable(owner);
	}

	void adoptBy(TexFunction function) {
		this.owner = function;
	}

	/**
	 * Whether this node currently holds the cursor marker.
	 */
	public boolean isActive() {
		return active;
	}

	/**
	 * Materializes the cursor marker at the edit position. Does nothing if already active.
	 */
	public void activate() {
		if (!active) {
			children.add(cursorPosition, TexElement.CursorMarker.INSTANCE);
			active = true;
		}
	}

	/**
	 * Removes the cursor marker. Does nothing if the node is not active.
	 */
	public void deactivate() {
		if (active) {
			children.remove(cursorPosition);
			active = false;
		}
	}

	/**
	 * Inserts an element at the edit position and moves the edit position past it.
	 *
	 * @param element a leaf or a function that is not yet held by any node
	 * @throws IllegalArgumentException for a cursor marker, an already inserted function or a
	 *         function that holds this node somewhere in its arguments
	 */
	public void insert(TexElement element) {
		Objects.requireNonNull(element, "element must not be null");
		if (element instanceof TexElement.CursorMarker) {
			throw new IllegalArgumentException("The cursor marker is managed by activate()/deactivate()");
		}
		if (element instanceof TexFunction function) {
			if (function.parent().isPresent()) {
				throw new IllegalArgumentException(function + " is already held by another node");
			}
			if (isInside(function)) {
				throw new IllegalArgumentException(function + " cannot be inserted into its own argument");
			}
			function.attachTo(this);
		}
		children.add(cursorPosition, element);
		cursorPosition++;
	}

	private boolean isInside(TexFunction function) {
		TexFunction ancestor = owner;
		while (ancestor != null) {
			if (ancestor == function) {
				return true;
			}
			ancestor = ancestor.parent().flatMap(TexNode::owner).orElse(null);
		}
		return false;
	}

	/**
	 * Moves the edit position one element to the left.
	 *
	 * @return {@link NavigationState#BOUNDARY} at position 0 (nothing changes),
	 *         {@link NavigationState#DESCEND} when the element passed over is a function
	 *         (the position now indexes that function and the marker is released),
	 *         {@link NavigationState#MOVED} otherwise
	 */
	public NavigationState moveLeft() {
		if (cursorPosition == 0) {
			return NavigationState.BOUNDARY;
		}
		deactivate();
		cursorPosition--;
		if (children.get(cursorPosition) instanceof TexFunction) {
			return NavigationState.DESCEND;
		}
		activate();
		return NavigationState.MOVED;
	}

	/**
	 * Moves the edit position one element to the right.
	 *
	 * @return {@link NavigationState#BOUNDARY} at the end (nothing changes),
	 *         {@link NavigationState#DESCEND} when the element passed over is a function
	 *         (the position now sits just after it and the marker is released),
	 *         {@link NavigationState#MOVED} otherwise
	 */
	public NavigationState moveRight() {
		if (cursorPosition >= size()) {
			return NavigationState.BOUNDARY;
		}
		deactivate();
		cursorPosition++;
		if (children.get(cursorPosition - 1) instanceof TexFunction) {
			return NavigationState.DESCEND;
		}
		activate();
		return NavigationState.MOVED;
	}

	/**
	 * Deletes the element before the edit position.
	 *
	 * <p>A function is never deleted here: the position moves onto it, the marker is
	 * released and {@link NavigationState#DESCEND} tells the caller to continue the delete
	 * inside the function's trailing argument.</p>
	 *
	 * @return {@link NavigationState#BOUNDARY} at position 0, {@link NavigationState#DESCEND}
	 *         for a function, {@link NavigationState#MOVED} once an element was removed
	 */
	public NavigationState deleteBackward() {
		if (cursorPosition == 0) {
			return NavigationState.BOUNDARY;
		}
		deactivate();
		cursorPosition--;
		if (children.get(cursorPosition) instanceof TexFunction) {
			return NavigationState.DESCEND;
		}
		children.remove(cursorPosition);
		activate();
		return NavigationState.MOVED;
	}

	/**
	 * Whether the last child is the cursor marker.
	 *
	 * <p>Only this node is considered; the last glyph of a function may sit deep inside a
	 * nested argument while this returns {@code false}.</p>
	 */
	public boolean isCursorAtEnd() {
		return !children.isEmpty() && children.get(children.size() - 1) instanceof TexElement.CursorMarker;
	}

	/**
	 * Position of a persistent child, compared by identity.
	 *
	 * @param element the element to look for
	 * @return its index among {@link #persistentChildren()}, or -1
	 */
	public int indexOf(TexElement element) {
		int index = 0;
		for (TexElement child : children) {
			if (child instanceof TexElement.CursorMarker) {
				continue;
			}
			if (child == element) {
				return index;
			}
			index++;
		}
		return -1;
	}

	/**
	 * Removes a persistent child. The edit position keeps pointing at the same gap.
	 *
	 * @param element the element to remove, compared by identity
	 * @return whether the element was found
	 */
	public boolean remove(TexElement element) {
		int index = indexOf(element);
		if (index < 0) {
			return false;
		}
		boolean wasActive = active;
		deactivate();
		children.remove(index);
		if (index < cursorPosition) {
			cursorPosition--;
		}
		if (element instanceof TexFunction function) {
			function.attachTo(null);
		}
		if (wasActive) {
			activate();
		}
		return true;
	}

	/**
	 * Removes all content and resets the edit position. An active node stays active.
	 */
	public void clear() {
		boolean wasActive = active;
		for (TexElement child : children) {
			if (child instanceof TexFunction function) {
				function.attachTo(null);
			}
		}
		children.clear();
		active = false;
		cursorPosition = 0;
		if (wasActive) {
			activate();
		}
	}

	/**
	 * Renders this node with the given options.
	 *
	 * @param options cursor color and placeholder settings
	 * @return the TeX string
	 * @throws IllegalStateException if the node tree holds a cursor marker and no cursor
	 *         color is configured
	 */
	public String render(RenderOptions options) {
		return new TexRenderer(options).render(this);
	}

	/**
	 * Renders this node with {@link RenderOptions#defaults()}, i.e. without a cursor color.
	 */
	public String render() {
		return render(RenderOptions.defaults());
	}

	@Override
	public String toString() {
		return "TexNode[cursorPosition=" + cursorPosition + ", children=" + persistentChildren() + "]";
	}
}
