package org.javai.mathfield.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.javai.mathfield.tex.ArgumentKind;
import org.javai.mathfield.tex.TexElement;
import org.javai.mathfield.tex.TexElementVisitor;
import org.javai.mathfield.tex.TexFunction;
import org.javai.mathfield.tex.TexNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON implementation of {@link TexNodeSerializer}.
 *
 * <p>Document shape:</p>
 * <pre>
 * {
 *   "cursorPosition": 1,
 *   "children": [
 *     { "type": "Leaf", "expression": "2" },
 *     {
 *       "type": "Function",
 *       "expression": "\\frac",
 *       "args": ["braces", "braces"],
 *       "argNodes": [
 *         { "cursorPosition": 1, "children": [{ "type": "Leaf", "expression": "1" }] },
 *         { "cursorPosition": 0, "children": [] }
 *       ]
 *     }
 *   ]
 * }
 * </pre>
 *
 * <h2>Older documents</h2>
 * <p>Documents written by the original math field widget are also read: type tags
 * {@code TeXLeaf}/{@code TeXFunction}, qualified kind names such as {@code TeXArg.braces}
 * and the position key {@code courserPosition}. Writing always uses the shape above.</p>
 *
 * <p>Stateless apart from its {@link ObjectMapper}; an instance may be shared.</p>
 */
public class JsonTexNodeSerializer implements TexNodeSerializer {

	private static final Logger logger = LoggerFactory.getLogger(JsonTexNodeSerializer.class);

	static final String CURSOR_POSITION = "cursorPosition";
	static final String LEGACY_CURSOR_POSITION = "courserPosition";
	static final String CHILDREN = "children";
	static final String TYPE = "type";
	static final String EXPRESSION = "expression";
	static final String ARGS = "args";
	static final String ARG_NODES = "argNodes";

	static final String LEAF_TYPE = "Leaf";
	static final String FUNCTION_TYPE = "Function";
	static final String CURSOR_TYPE = "Cursor";
	private static final String LEGACY_LEAF_TYPE = "TeXLeaf";
	private static final String LEGACY_FUNCTION_TYPE = "TeXFunction";

	private final ObjectMapper mapper;
	private final ElementEncoder encoder = new ElementEncoder();

	/**
	 * Creates a serializer with a default {@link ObjectMapper}.
	 */
	public JsonTexNodeSerializer() {
		this(new ObjectMapper());
	}

	/**
	 * Creates a serializer using the given mapper.
	 *
	 * @param mapper the mapper used to read and write JSON text
	 */
	public JsonTexNodeSerializer(ObjectMapper mapper) {
		if (mapper == null) {
			throw new IllegalArgumentException("mapper must not be null");
		}
		this.mapper = mapper;
	}

	@Override
	public String serialize(TexNode root) {
		try {
			return mapper.writeValueAsString(toJson(root));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to write TeX document", e);
		}
	}

	@Override
	public TexNode deserialize(String document) {
		if (document == null) {
			throw new FormatException("Document must not be null");
		}
		JsonNode json;
		try {
			json = mapper.readTree(document);
		} catch (JsonProcessingException e) {
			throw new FormatException("Document is not valid JSON", e);
		}
		return fromJson(json);
	}

	/**
	 * Pretty-printed form of {@link #serialize(TexNode)}, for diagnostics.
	 *
	 * @param root the root node
	 * @return indented JSON
	 */
	public String toReadableJson(TexNode root) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(root));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to write TeX document", e);
		}
	}

	/**
	 * Encodes a node and everything it owns. Cursor markers are skipped and the tree is
	 * left untouched.
	 *
	 * @param node the node to encode
	 * @return the JSON object
	 */
	public ObjectNode toJson(TexNode node) {
		if (node == null) {
			throw new IllegalArgumentException("node must not be null");
		}
		ObjectNode json = mapper.createObjectNode();
		json.put(CURSOR_POSITION, node.cursorPosition());
		ArrayNode children = json.putArray(CHILDREN);
		for (TexElement child : node.children()) {
			child.accept(encoder).ifPresent(children::add);
		}
		return json;
	}

	/**
	 * Decodes a node and everything it owns into a fresh, inactive tree.
	 *
	 * @param json the JSON object
	 * @return the decoded node
	 * @throws FormatException if the JSON does not describe a valid node
	 */
	public TexNode fromJson(JsonNode json) {
		TexNode root = decodeNode(json, "$");
		logger.debug("Decoded TeX document with {} top-level elements", root.size());
		return root;
	}

	private TexNode decodeNode(JsonNode json, String path) {
		if (json == null || !json.isObject()) {
			throw formatError(path, "expected a node object");
		}
		JsonNode position = json.has(CURSOR_POSITION) ? json.get(CURSOR_POSITION) : json.get(LEGACY_CURSOR_POSITION);
		if (position == null || !position.isInt()) {
			throw formatError(path, "missing integer '" + CURSOR_POSITION + "'");
		}
		JsonNode children = json.get(CHILDREN);
		if (children == null || !children.isArray()) {
			throw formatError(path, "missing array '" + CHILDREN + "'");
		}

		int cursorPosition = position.intValue();
		int droppedBeforeCursor = 0;
		TexNode node = new TexNode();
		for (int i = 0; i < children.size(); i++) {
			Optional<TexElement> element = decodeElement(children.get(i), path + "." + CHILDREN + "[" + i + "]");
			if (element.isPresent()) {
				node.insert(element.get());
			} else if (i < cursorPosition) {
				droppedBeforeCursor++;
			}
		}

		int effectivePosition = cursorPosition - droppedBeforeCursor;
		if (effectivePosition < 0 || effectivePosition > node.size()) {
			throw formatError(path, "'" + CURSOR_POSITION + "' " + cursorPosition
					+ " is outside [0, " + node.size() + "]");
		}
		node.setCursorPosition(effectivePosition);
		return node;
	}

	private Optional<TexElement> decodeElement(JsonNode json, String path) {
		if (json == null || !json.isObject()) {
			throw formatError(path, "expected an element object");
		}
		JsonNode type = json.get(TYPE);
		if (type == null) {
			JsonNode expression = json.get(EXPRESSION);
			if (expression != null && expression.isTextual() && expression.textValue().isEmpty()) {
				logger.warn("Dropping untyped empty element at {}; it is a persisted cursor marker", path);
				return Optional.empty();
			}
			throw formatError(path, "missing string '" + TYPE + "'");
		}
		if (!type.isTextual()) {
			throw formatError(path, "missing string '" + TYPE + "'");
		}

		switch (type.textValue()) {
			case LEAF_TYPE:
			case LEGACY_LEAF_TYPE:
				return Optional.of(new TexElement.Leaf(requireText(json, EXPRESSION, path)));
			case FUNCTION_TYPE:
			case LEGACY_FUNCTION_TYPE:
				return Optional.of(decodeFunction(json, path));
			case CURSOR_TYPE:
				logger.warn("Dropping cursor marker persisted at {}", path);
				return Optional.empty();
			default:
				throw formatError(path, "unknown element type '" + type.textValue() + "'");
		}
	}

	private TexFunction decodeFunction(JsonNode json, String path) {
		String expression = requireText(json, EXPRESSION, path);
		JsonNode args = json.get(ARGS);
		if (args == null || !args.isArray()) {
			throw formatError(path, "missing array '" + ARGS + "'");
		}
		JsonNode argNodes = json.get(ARG_NODES);
		if (argNodes == null || !argNodes.isArray()) {
			throw formatError(path, "missing array '" + ARG_NODES + "'");
		}
		if (args.size() != argNodes.size()) {
			throw formatError(path, "'" + ARGS + "' has " + args.size() + " entries but '"
					+ ARG_NODES + "' has " + argNodes.size());
		}
		if (args.isEmpty()) {
			throw formatError(path, "a function needs at least one argument");
		}

		List<ArgumentKind> kinds = new ArrayList<>(args.size());
		for (int i = 0; i < args.size(); i++) {
			JsonNode name = args.get(i);
			String kindPath = path + "." + ARGS + "[" + i + "]";
			if (!name.isTextual()) {
				throw formatError(kindPath, "expected an argument kind name");
			}
			kinds.add(ArgumentKind.fromWireName(name.textValue())
					.orElseThrow(() -> formatError(kindPath, "unknown argument kind '" + name.textValue() + "'")));
		}

		List<TexNode> nodes = new ArrayList<>(argNodes.size());
		for (int i = 0; i < argNodes.size(); i++) {
			nodes.add(decodeNode(argNodes.get(i), path + "." + ARG_NODES + "[" + i + "]"));
		}
		return new TexFunction(expression, kinds, nodes);
	}

	private String requireText(JsonNode json, String field, String path) {
		JsonNode value = json.get(field);
		if (value == null || !value.isTextual()) {
			throw formatError(path, "missing string '" + field + "'");
		}
		return value.textValue();
	}

	private static FormatException formatError(String path, String problem) {
		return new FormatException("Invalid TeX document at " + path + ": " + problem);
	}

	/**
	 * Encodes one element; the cursor marker encodes to nothing.
	 */
	private final class ElementEncoder implements TexElementVisitor<Optional<ObjectNode>> {

		@Override
		public Optional<ObjectNode> visitLeaf(TexElement.Leaf leaf) {
			ObjectNode json = mapper.createObjectNode();
			json.put(TYPE, LEAF_TYPE);
			json.put(EXPRESSION, leaf.expression());
			return Optional.of(json);
		}

		@Override
		public Optional<ObjectNode> visitFunction(TexFunction function) {
			ObjectNode json = mapper.createObjectNode();
			json.put(TYPE, FUNCTION_TYPE);
			json.put(EXPRESSION, function.expression());
			ArrayNode args = json.putArray(ARGS);
			for (ArgumentKind kind : function.kinds()) {
				args.add(kind.wireName());
			}
			ArrayNode argNodes = json.putArray(ARG_NODES);
			for (TexNode argument : function.arguments()) {
				argNodes.add(toJson(argument));
			}
			return Optional.of(json);
		}

		@Override
		public Optional<ObjectNode> visitCursor(TexElement.CursorMarker cursor) {
			return Optional.empty();
		}
	}
}
