package works.spoke.schema;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SchemaDefinitionsTest {
	static final SName NODE = new SName("test.Node");
	static final SName LEAF = new SName("test.Leaf");

	// Node(value: int, children: List<Node>)
	static final Schema NODE_SCHEMA = Schema.product(NODE, List.of(
		SProductField.of("value", Schema.int32()),
		SProductField.of("children", Schema.ref(NODE).asArray())));

	@Test
	void recursiveReference_resolvesToDefinition() {
		var definitions = SchemaDefinitions.collect(NODE_SCHEMA);
		assertEquals(Set.of(NODE), definitions.names());
		assertEquals(Set.of(), definitions.unresolvedReferences());
		SArray children = (SArray) NODE_SCHEMA.schemaType().children().get(1).schemaType();
		assertSame(NODE_SCHEMA, definitions.resolve(children.element()));
	}

	@Test
	void firstOccurrenceWins() {
		Schema leaf = Schema.product(LEAF, List.of()).withDescription("first");
		Schema root = Schema.product(List.of(
			SProductField.of("a", leaf),
			SProductField.of("b", leaf.withDescription("second"))));
		assertEquals("first", SchemaDefinitions.collect(root).get(LEAF).orElseThrow().description());
	}

	@Test
	void depthFirstOccurrenceWins_evenWhenDeeper() {
		Schema leaf = Schema.product(LEAF, List.of());
		Schema root = Schema.product(List.of(
			SProductField.of("deep", Schema.product(List.of(SProductField.of("inner", leaf.withDescription("deep"))))),
			SProductField.of("shallow", leaf.withDescription("shallow"))));
		assertEquals("deep", SchemaDefinitions.collect(root).get(LEAF).orElseThrow().description());
	}

	@Test
	void danglingReference_reported() {
		Schema root = Schema.product(List.of(SProductField.of("x", Schema.ref(LEAF))));
		var definitions = SchemaDefinitions.collect(root);
		assertEquals(Set.of(LEAF), definitions.unresolvedReferences());
		assertThrows(IllegalArgumentException.class, () -> definitions.resolve(Schema.ref(LEAF)));
	}

	@Test
	void nonReference_resolvesToItself() {
		Schema s = Schema.string();
		assertSame(s, SchemaDefinitions.collect(NODE_SCHEMA).resolve(s));
	}
}
