package org.javai.mathfield.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.apache.logging.log4j.Level;
import org.javai.mathfield.tex.ArgumentKind;
import org.javai.mathfield.tex.TexElement;
import org.javai.mathfield.tex.TexFunction;
import org.javai.mathfield.tex.TexNode;
import org.javai.mathfield.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("JsonTexNodeSerializer")
class JsonTexNodeSerializerTest {

	private final ObjectMapper mapper = new ObjectMapper();
	private JsonTexNodeSerializer serializer;

	@BeforeEach
	void setUp() {
		serializer = new JsonTexNodeSerializer(mapper);
	}

	/**
	 * {@code 2\frac{1}{x}} with the root position after the fraction and the numerator
	 * position after its leaf.
	 */
	private static TexNode sampleTree() {
		TexNode numerator = new TexNode();
		numerator.insert(new TexElement.Leaf("1"));
		TexNode denominator = new TexNode();
		denominator.insert(new TexElement.Leaf("x"));
		denominator.setCursorPosition(0);

		TexNode root = new TexNode();
		root.insert(new TexElement.Leaf("2"));
		root.insert(new TexFunction("\\frac", List.of(ArgumentKind.BRACES, ArgumentKind.BRACES),
				List.of(numerator, denominator)));
		return root;
	}

	private JsonNode read(String json) throws Exception {
		return mapper.readTree(json);
	}

	@Nested
	@DisplayName("writing")
	class WritingTests {

		@Test
		@DisplayName("writes positions, leaves and functions")
		void writesDocumentShape() throws Exception {
			JsonNode json = read(serializer.serialize(sampleTree()));

			assertThat(json.get("cursorPosition").intValue()).isEqualTo(2);
			JsonNode children = json.get("children");
			assertThat(children).hasSize(2);
			assertThat(children.get(0).get("type").textValue()).isEqualTo("Leaf");
			assertThat(children.get(0).get("expression").textValue()).isEqualTo("2");

			JsonNode fraction = children.get(1);
			assertThat(fraction.get("type").textValue()).isEqualTo("Function");
			assertThat(fraction.get("expression").textValue()).isEqualTo("\\frac");
			assertThat(fraction.get("args").get(0).textValue()).isEqualTo("braces");
			assertThat(fraction.get("argNodes").get(0).get("cursorPosition").intValue()).isEqualTo(1);
			assertThat(fraction.get("argNodes").get(1).get("cursorPosition").intValue()).isEqualTo(0);
		}

		@Test
		@DisplayName("writes an empty node")
		void writesEmptyNode() throws Exception {
			assertThat(read(serializer.serialize(new TexNode())))
					.isEqualTo(read("{\"cursorPosition\":0,\"children\":[]}"));
		}

		@Test
		@DisplayName("omits the cursor marker and leaves the tree untouched")
		void omitsCursorMarker() throws Exception {
			TexNode root = sampleTree();
			TexNode numerator = ((TexFunction) root.children().get(1)).argument(0);
			numerator.setCursorPosition(0);
			numerator.activate();
			List<TexElement> before = List.copyOf(numerator.children());

			JsonNode json = read(serializer.serialize(root));

			JsonNode numeratorJson = json.get("children").get(1).get("argNodes").get(0);
			assertThat(numeratorJson.get("children")).hasSize(1);
			assertThat(numeratorJson.get("cursorPosition").intValue()).isZero();
			assertThat(numerator.isActive()).isTrue();
			assertThat(numerator.children()).containsExactlyElementsOf(before);
		}

		@Test
		@DisplayName("writes the power kind by name")
		void writesPowerKind() throws Exception {
			TexNode root = new TexNode();
			root.insert(new TexFunction("\\int _", List.of(ArgumentKind.BRACES, ArgumentKind.POWER, ArgumentKind.BRACES)));

			JsonNode args = read(serializer.serialize(root)).get("children").get(0).get("args");

			assertThat(args.get(0).textValue()).isEqualTo("braces");
			assertThat(args.get(1).textValue()).isEqualTo("power");
			assertThat(args.get(2).textValue()).isEqualTo("braces");
		}

		@Test
		@DisplayName("pretty-prints the same document")
		void readableJson() throws Exception {
			TexNode root = sampleTree();
			String readable = serializer.toReadableJson(root);

			assertThat(readable).contains("\n");
			assertThat(read(readable)).isEqualTo(read(serializer.serialize(root)));
		}
	}

	@Nested
	@DisplayName("reading")
	class ReadingTests {

		@Test
		@DisplayName("restores content and every position")
		void roundTrip() {
			TexNode original = sampleTree();

			TexNode restored = serializer.deserialize(serializer.serialize(original));

			assertThat(restored.render()).isEqualTo("2\\frac{1}{x}");
			assertThat(restored.cursorPosition()).isEqualTo(2);
			TexFunction fraction = (TexFunction) restored.children().get(1);
			assertThat(fraction.argument(0).cursorPosition()).isEqualTo(1);
			assertThat(fraction.argument(1).cursorPosition()).isZero();
			assertThat(serializer.serialize(restored)).isEqualTo(serializer.serialize(original));
		}

		@Test
		@DisplayName("produces an inactive tree with wired parents and owners")
		void inactiveAndWired() {
			TexNode restored = serializer.deserialize(serializer.serialize(sampleTree()));

			TexFunction fraction = (TexFunction) restored.children().get(1);
			assertThat(restored.isActive()).isFalse();
			assertThat(fraction.parent()).containsSame(restored);
			assertThat(fraction.arguments()).allMatch(node -> !node.isActive());
			assertThat(fraction.argument(1).owner()).containsSame(fraction);
			assertThat(restored.owner()).isEmpty();
		}

		@Test
		@DisplayName("reads documents of the original widget")
		void readsLegacyDocument() {
			String document = """
					{
					  "courserPosition": 1,
					  "children": [
					    {
					      "type": "TeXFunction",
					      "expression": "\\\\frac",
					      "args": ["TeXArg.braces", "TeXArg.braces"],
					      "argNodes": [
					        { "courserPosition": 1, "children": [{ "type": "TeXLeaf", "expression": "1" }] },
					        { "courserPosition": 0, "children": [] }
					      ]
					    }
					  ]
					}
					""";

			TexNode root = serializer.deserialize(document);

			assertThat(root.render()).isEqualTo("\\frac{1}{\\Box}");
			assertThat(root.cursorPosition()).isEqualTo(1);
			assertThat(serializer.toJson(root).has("courserPosition")).isFalse();
		}

		@Test
		@DisplayName("drops an untyped empty element and shifts the position")
		void dropsUntypedCursorArtifact() {
			String document = """
					{
					  "cursorPosition": 2,
					  "children": [
					    { "type": "Leaf", "expression": "a" },
					    { "expression": "" },
					    { "type": "Leaf", "expression": "b" }
					  ]
					}
					""";

			try (LogCaptorAppender captor = LogCaptorAppender.capture(JsonTexNodeSerializer.class, Level.WARN)) {
				TexNode root = serializer.deserialize(document);

				assertThat(root.size()).isEqualTo(2);
				assertThat(root.cursorPosition()).isEqualTo(1);
				assertThat(root.render()).isEqualTo("ab");
				assertThat(captor.messages(Level.WARN)).anyMatch(message -> message.contains("$.children[1]"));
			}
		}

		@Test
		@DisplayName("drops a persisted cursor element with a warning")
		void dropsCursorElement() {
			String document = """
					{ "cursorPosition": 1, "children": [ { "type": "Cursor" } ] }
					""";

			try (LogCaptorAppender captor = LogCaptorAppender.capture(JsonTexNodeSerializer.class, Level.WARN)) {
				TexNode root = serializer.deserialize(document);

				assertThat(root.isEmpty()).isTrue();
				assertThat(root.cursorPosition()).isZero();
				assertThat(captor.messages(Level.WARN))
						.anyMatch(message -> message.contains("Dropping cursor marker"));
			}
		}

		@Test
		@DisplayName("reads a subtree with fromJson")
		void fromJsonNode() {
			ObjectNode json = serializer.toJson(sampleTree());

			assertThat(serializer.fromJson(json.get("children").get(1).get("argNodes").get(1)).render())
					.isEqualTo("x");
		}
	}

	@Nested
	@DisplayName("malformed documents")
	class MalformedDocumentTests {

		@Test
		@DisplayName("rejects an unknown argument kind")
		void unknownArgumentKind() {
			String document = """
					{ "cursorPosition": 0, "children": [
					  { "type": "Function", "expression": "f", "args": ["not-a-real-kind"],
					    "argNodes": [ { "cursorPosition": 0, "children": [] } ] } ] }
					""";

			assertThatThrownBy(() -> serializer.deserialize(document))
					.isInstanceOf(TexNodeSerializer.FormatException.class)
					.hasMessageContaining("$.children[0].args[0]")
					.hasMessageContaining("not-a-real-kind");
		}

		@Test
		@DisplayName("rejects a kind and node count mismatch")
		void countMismatch() {
			String document = """
					{ "cursorPosition": 0, "children": [
					  { "type": "Function", "expression": "\\\\frac", "args": ["braces", "braces"],
					    "argNodes": [ { "cursorPosition": 0, "children": [] } ] } ] }
					""";

			assertThatThrownBy(() -> serializer.deserialize(document))
					.isInstanceOf(TexNodeSerializer.FormatException.class)
					.hasMessageContaining("has 2 entries");
		}

		@Test
		@DisplayName("rejects a function without arguments")
		void functionWithoutArguments() {
			String document = """
					{ "cursorPosition": 0, "children": [
					  { "type": "Function", "expression": "\\\\pi", "args": [], "argNodes": [] } ] }
					""";

			assertThatThrownBy(() -> serializer.deserialize(document))
					.isInstanceOf(TexNodeSerializer.FormatException.class)
					.hasMessageContaining("at least one argument");
		}

		@Test
		@DisplayName("rejects a node without children")
		void missingChildren() {
			assertThatThrownBy(() -> serializer.deserialize("{\"cursorPosition\":0}"))
					.isInstanceOf(TexNodeSerializer.FormatException.class)
					.hasMessageContaining("'children'");
		}

		@Test
		@DisplayName("rejects a node without a position")
		void missingPosition() {
			assertThatThrownBy(() -> serializer.deserialize("{\"children\":[]}"))
					.isInstanceOf(TexNodeSerializer.FormatException.class)
					.hasMessageContaining("'cursorPosition'");
		}

		@Test
		@DisplayName("rejects out of range positions")
		void positionOutOfRange() {
			assertThatThrownBy(() -> serializer.deserialize(
					"{\"cursorPosition\":2,\"children\":[{\"type\":\"Leaf\",\"expression\":\"a\"}]}"))
					.isInstanceOf(TexNodeSerializer.FormatException.class)
					.hasMessageContaining("is outside [0, 1]");
			assertThatThrownBy(() -> serializer.deserialize("{\"cursorPosition\":-1,\"children\":[]}"))
					.isInstanceOf(TexNodeSerializer.FormatException.class);
		}

		@Test
		@DisplayName("reports the path of a nested problem")
		void nestedPath() {
			String document = """
					{ "cursorPosition": 0, "children": [
					  { "type": "Function", "expression": "\\\\sqrt", "args": ["braces"],
					    "argNodes": [ { "cursorPosition": 5, "children": [] } ] } ] }
					""";

			assertThatThrownBy(() -> serializer.deserialize(document))
					.isInstanceOf(TexNodeSerializer.FormatException.class)
					.hasMessageStartingWith("Invalid TeX document at $.children[0].argNodes[0]");
		}

		@Test
		@DisplayName("rejects missing and unknown element types")
		void badElementTypes() {
			assertThatThrownBy(() -> serializer.deserialize(
					"{\"cursorPosition\":0,\"children\":[{\"expression\":\"a\"}]}"))
					.isInstanceOf(TexNodeSerializer.FormatException.class)
					.hasMessageContaining("'type'");
			assertThatThrownBy(() -> serializer.deserialize(
					"{\"cursorPosition\":0,\"children\":[{\"type\":\"Matrix\",\"expression\":\"a\"}]}"))
					.isInstanceOf(TexNodeSerializer.FormatException.class)
					.hasMessageContaining("unknown element type 'Matrix'");
		}

		@Test
		@DisplayName("rejects text that is not JSON")
		void invalidJson() {
			assertThatThrownBy(() -> serializer.deserialize("{not json"))
					.isInstanceOf(TexNodeSerializer.FormatException.class)
					.hasMessage("Document is not valid JSON")
					.hasCauseInstanceOf(com.fasterxml.jackson.core.JsonProcessingException.class);
			assertThatThrownBy(() -> serializer.deserialize(null))
					.isInstanceOf(TexNodeSerializer.FormatException.class);
			assertThatThrownBy(() -> serializer.deserialize("[]"))
					.isInstanceOf(TexNodeSerializer.FormatException.class)
					.hasMessageContaining("expected a node object");
		}
	}
}
