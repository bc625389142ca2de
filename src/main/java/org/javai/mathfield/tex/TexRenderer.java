package org.javai.mathfield.tex;

/**
 * Builds the TeX string for a {@link TexNode} and everything it owns.
 *
 * <p>Leaves render their text. A function renders its expression followed by its argument
 * slots, each delimited according to its {@link ArgumentKind}; a {@link ArgumentKind#POWER}
 * slot contributes only its caret. The cursor marker renders as
 * <code>\textcolor{#rrggbb}{\cursor}</code>.</p>
 */
public final class TexRenderer implements TexElementVisitor<String> {

	private final RenderOptions options;

	public TexRenderer(RenderOptions options) {
		if (options == null) {
			throw new IllegalArgumentException("options must not be null");
		}
		this.options = options;
	}

	/**
	 * Renders a node. The {@code placeholderWhenEmpty} option applies to this node only;
	 * empty argument nodes below it always render the placeholder.
	 *
	 * @param node the node to render
	 * @return the TeX string
	 * @throws IllegalStateException if a cursor marker is reached and no color is configured
	 */
	public String render(TexNode node) {
		return render(node, options.placeholderWhenEmpty());
	}

	private String render(TexNode node, boolean placeholderWhenEmpty) {
		if (node.children().isEmpty()) {
			return placeholderWhenEmpty ? options.placeholder() : "";
		}
		StringBuilder sb = new StringBuilder();
		for (TexElement child : node.children()) {
			sb.append(child.accept(this));
		}
		return sb.toString();
	}

	@Override
	public String visitLeaf(TexElement.Leaf leaf) {
		return leaf.expression();
	}

	@Override
	public String visitFunction(TexFunction function) {
		StringBuilder sb = new StringBuilder(function.expression());
		for (int i = 0; i < function.argumentCount(); i++) {
			ArgumentKind kind = function.kind(i);
			if (kind.rendersContent()) {
				sb.append(kind.opening());
				sb.append(render(function.argument(i), true));
			}
			sb.append(kind.closing());
		}
		return sb.toString();
	}

	@Override
	public String visitCursor(TexElement.CursorMarker cursor) {
		CursorColor color = options.cursorColorIfPresent()
				.orElseThrow(() -> new IllegalStateException("Cursor rendered without a cursor color"));
		return "\\textcolor{" + color.hex() + "}{\\cursor}";
	}
}
