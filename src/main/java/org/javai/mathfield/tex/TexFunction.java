package org.javai.mathfield.tex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A TeX fragment followed by one or more argument slots, such as <code>\frac{..}{..}</code>.
 *
 * <p>The function owns one {@link TexNode} per declared {@link ArgumentKind}. It also keeps a
 * non-owning reference to the node that currently holds it, which is only used to walk
 * upwards when the cursor leaves an argument.</p>
 *
 * <p>Functions are mutable through their argument nodes and therefore compare by identity.</p>
 */
public final class TexFunction implements TexElement {

	private static final Logger logger = LoggerFactory.getLogger(TexFunction.class);

	private final String expression;
	private final List<ArgumentKind> kinds;
	private final List<TexNode> arguments;
	private TexNode parent;

	/**
	 * Creates a function with one fresh, empty argument node per kind.
	 *
	 * @param expression the TeX fragment emitted before the arguments, e.g. {@code \frac}
	 * @param kinds the argument kinds, at least one
	 * @throws IllegalArgumentException if {@code kinds} is empty
	 */
	public TexFunction(String expression, List<ArgumentKind> kinds) {
		this(expression, kinds, null);
	}

	/**
	 * Creates a function around pre-built argument nodes.
	 *
	 * <p>The nodes are adopted: their owner is set to this function. Passing {@code null}
	 * creates empty nodes as in {@link #TexFunction(String, List)}.</p>
	 *
	 * @param expression the TeX fragment emitted before the arguments
	 * @param kinds the argument kinds, at least one
	 * @param arguments one node per kind, or {@code null}
	 * @throws IllegalArgumentException if {@code kinds} is empty, the sizes differ, or a node
	 *         already belongs to a function or is listed twice
	 */
	public TexFunction(String expression, List<ArgumentKind> kinds, List<TexNode> arguments) {
		if (expression == null) {
			throw new IllegalArgumentException("expression must not be null");
		}
		if (kinds == null || kinds.isEmpty()) {
			throw new IllegalArgumentException("A function needs at least one argument");
		}
		if (kinds.stream().anyMatch(Objects::isNull)) {
			throw new IllegalArgumentException("Argument kinds must not contain null");
		}
		if (arguments != null && arguments.size() != kinds.size()) {
			throw new IllegalArgumentException(
					"Expected " + kinds.size() + " argument nodes but got " + arguments.size());
		}
		if (arguments != null) {
			checkAdoptable(arguments);
		}
		this.expression = expression;
		this.kinds = List.copyOf(kinds);

		List<TexNode> nodes = new ArrayList<>(kinds.size());
		for (int i = 0; i < kinds.size(); i++) {
			TexNode node = arguments != null ? arguments.get(i) : new TexNode();
			node.adoptBy(this);
			if (!kinds.get(i).rendersContent() && !node.isEmpty()) {
				logger.warn("Argument {} of '{}' is a {} slot; its content is kept but never rendered",
						i, expression, kinds.get(i));
			}
			nodes.add(node);
		}
		this.arguments = Collections.unmodifiableList(nodes);
	}

	private static void checkAdoptable(List<TexNode> arguments) {
		Map<TexNode, Integer> seen = new IdentityHashMap<>();
		for (int i = 0; i < arguments.size(); i++) {
			TexNode node = arguments.get(i);
			if (node == null) {
				throw new IllegalArgumentException("Argument node " + i + " must not be null");
			}
			if (node.owner().isPresent()) {
				throw new IllegalArgumentException(
						"Argument node " + i + " already belongs to " + node.owner().get());
			}
			Integer previous = seen.put(node, i);
			if (previous != null) {
				throw new IllegalArgumentException(
						"Argument node " + i + " is the same node as argument " + previous);
			}
		}
	}

	@Override
	public String expression() {
		return expression;
	}

	/**
	 * The argument kinds in declaration order.
	 */
	public List<ArgumentKind> kinds() {
		return kinds;
	}

	/**
	 * The argument nodes, parallel to {@link #kinds()}.
	 */
	public List<TexNode> arguments() {
		return arguments;
	}

	public int argumentCount() {
		return arguments.size();
	}

	public TexNode argument(int index) {
		return arguments.get(index);
	}

	public ArgumentKind kind(int index) {
		return kinds.get(index);
	}

	/**
	 * Position of the given node among this function's arguments, compared by identity.
	 *
	 * @param node an argument node
	 * @return its index, or -1 if the node is not an argument of this function
	 */
	public int indexOf(TexNode node) {
		for (int i = 0; i < arguments.size(); i++) {
			if (arguments.get(i) == node) {
				return i;
			}
		}
		return -1;
	}

	/**
	 * The node holding this function, if it has been inserted into one.
	 */
	public Optional<TexNode> parent() {
		return Optional.ofNullable(parent);
	}

	void attachTo(TexNode node) {
		this.parent = node;
	}

	@Override
	public <R> R accept(TexElementVisitor<R> visitor) {
		return visitor.visitFunction(this);
	}

	@Override
	public String toString() {
		return "TexFunction[" + expression + ", " + kinds + "]";
	}
}
