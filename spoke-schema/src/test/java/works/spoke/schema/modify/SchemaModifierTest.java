package works.spoke.schema.modify;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.junit.jupiter.api.Test;
import works.spoke.schema.SArray;
import works.spoke.schema.SName;
import works.spoke.schema.SOpenProduct;
import works.spoke.schema.SOption;
import works.spoke.schema.SProduct;
import works.spoke.schema.SProductField;
import works.spoke.schema.Schema;
import works.spoke.schema.derivation.ProductDescriptor;
import works.spoke.schema.derivation.SchemaDeriver;
import works.spoke.schema.derivation.TypeDescriptor;
import works.spoke.schema.derivation.TypeDescriptors;
import works.spoke.schema.exceptions.PathNotFoundException;
import works.spoke.schema.validation.Validator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaModifierTest {
	static final SName FRUIT_AMOUNT = new SName("test.FruitAmount");
	static final SName BASKET = new SName("test.Basket");

	static final ProductDescriptor FRUIT_AMOUNT_TYPE = TypeDescriptors.product(FRUIT_AMOUNT)
		.field("fruit", TypeDescriptors.STRING)
		.field("amount", TypeDescriptors.INT)
		.build();

	static final ProductDescriptor BASKET_TYPE = TypeDescriptors.product(BASKET)
		.field("fruits", TypeDescriptors.listOf(FRUIT_AMOUNT_TYPE))
		.field("label", TypeDescriptors.optionOf(TypeDescriptors.STRING))
		.build();

	final Schema basket = SchemaDeriver.standard().derive(BASKET_TYPE);

	@Test
	void basketExample_modifiesOnlyTarget() {
		Schema modified = basket.modify(FieldPath.root().field("fruits").each().field("amount"),
			s -> s.withDescription("How many fruits?"));

		Schema amount = fruitAmount(modified).field("amount").orElseThrow().schema();
		assertEquals("How many fruits?", amount.description());
		assertEquals(Schema.int32(), amount.withDescription(null));

		// Everything else is as it was
		assertNull(fruitAmount(modified).field("fruit").orElseThrow().schema().description());
		assertEquals(field(basket, "label"), field(modified, "label"));
		assertEquals(basket.name(), modified.name());
		assertEquals(basket, modified.modify(FieldPath.unsafe("fruits", "each", "amount"), s -> s.withDescription(null)));
	}

	@Test
	void readBack_equalsTransformedOriginal() {
		FieldPath path = FieldPath.unsafe("fruits", "each");
		UnaryOperator<Schema> f = s -> s.withDescription("One kind of fruit").withValidator(Validator.custom("ripe", v -> true, "must be ripe"));
		Schema original = SchemaModifier.standard().modify(basket, path).get();
		Schema modified = basket.modify(path, f);
		assertEquals(f.apply(original), SchemaModifier.standard().modify(modified, path).get());
	}

	@Test
	void rootPath_transformsWholeSchema() {
		Schema modified = basket.modify(FieldPath.root(), s -> s.withDescription("A basket"));
		assertEquals(basket.withDescription("A basket"), modified);
	}

	@Test
	void eachOnOption() {
		Schema modified = basket.modify(FieldPath.root().field("label").each(), s -> s.withValidator(Validator.maxLength(10)));
		Schema label = field(modified, "label");
		assertTrue(label.isOptional());
		assertEquals(List.of(Validator.maxLength(10)), ((SOption) label.schemaType()).element().validator().asPrimitiveValidators());
		assertTrue(label.validator().isPass());
	}

	@Test
	void eachOnOpenProduct() {
		Schema counts = Schema.openProduct(Schema.int32());
		Schema modified = counts.modify(FieldPath.root().each(), s -> s.withValidator(Validator.nonNegative()));
		assertEquals(List.of(Validator.min(0)), ((SOpenProduct) modified.schemaType()).valueSchema().validator().asPrimitiveValidators());
	}

	@Test
	void unknownField_failsWithoutModifying() {
		var path = FieldPath.unsafe("fruits", "each", "weight");
		var e = assertThrows(PathNotFoundException.class, () -> basket.modify(path, s -> {
			throw new AssertionError("Transformation should not run");
		}));
		assertEquals(path, e.path());
		assertEquals(2, e.segmentIndex());
	}

	@Test
	void eachOnNonContainer_fails() {
		var e = assertThrows(PathNotFoundException.class, () ->
			basket.modify(FieldPath.unsafe("fruits", "each", "amount", "each"), s -> s));
		assertEquals(3, e.segmentIndex());
	}

	@Test
	void fieldOnNonProduct_fails() {
		var e = assertThrows(PathNotFoundException.class, () ->
			basket.modify(FieldPath.unsafe("fruits", "amount"), s -> s));
		assertEquals(1, e.segmentIndex());
	}

	@Test
	void referencesAreNotFollowed() {
		Schema node = Schema.product(new SName("test.Node"), List.of(
			SProductField.of("next", Schema.ref(new SName("test.Node")))));
		var e = assertThrows(PathNotFoundException.class, () ->
			node.modify(FieldPath.unsafe("next", "next"), s -> s));
		assertEquals(1, e.segmentIndex());
	}

	@Test
	void fieldsAreMatchedBySourceName() {
		Schema product = Schema.product(List.of(new SProductField("fruitName", "fruit_name", Schema.string())));
		product.modify(FieldPath.root().field("fruitName"), s -> s);
		assertThrows(PathNotFoundException.class, () -> product.modify(FieldPath.root().field("fruit_name"), s -> s));
	}

	@Test
	void modification_getAndSet() {
		var modification = SchemaModifier.standard().modify(basket, FieldPath.root().field("fruits").each());
		assertEquals(FRUIT_AMOUNT, modification.get().name());
		Schema replaced = modification.set(Schema.string());
		assertEquals(Schema.string(), ((SArray) field(replaced, "fruits").schemaType()).element());
	}

	@Test
	void modification_isReusable() {
		var modification = SchemaModifier.standard().modify(basket, FieldPath.root().field("label"));
		Schema a = modification.apply(s -> s.withDescription("a"));
		Schema b = modification.apply(s -> s.withDescription("b"));
		assertEquals("a", field(a, "label").description());
		assertEquals("b", field(b, "label").description());
		assertNull(field(basket, "label").description());
	}

	//
	// Custom containers
	//

	static final SName NON_EMPTY_FRUITS = new SName("test.NonEmptyList", List.of("FruitAmount"));

	/**
	 * Encoded as {@code {"head": T, "tail": [T]}}.
	 */
	static final ContainerUnwrapper NON_EMPTY_LIST = new ContainerUnwrapper() {
		@Override
		public Schema element(Schema container) {
			return ((SProduct) container.schemaType()).field("head").orElseThrow().schema();
		}

		@Override
		public Schema withElement(Schema container, Schema element) {
			SProduct product = (SProduct) container.schemaType();
			return container.withSchemaType(product
				.withField(0, product.fields().get(0).withSchema(element))
				.withField(1, product.fields().get(1).withSchema(element.asArray())));
		}

		@Override
		public Optional<TypeDescriptor> elementType(TypeDescriptor container) {
			return Optional.of(((ProductDescriptor) container).field("head").type());
		}
	};

	static Schema nonEmptyList(Schema element) {
		return Schema.product(NON_EMPTY_FRUITS, List.of(
			SProductField.of("head", element),
			SProductField.of("tail", element.asArray())));
	}

	@Test
	void customContainer_unwrapped() {
		Schema fruitAmount = SchemaDeriver.standard().derive(FRUIT_AMOUNT_TYPE);
		Schema schema = nonEmptyList(fruitAmount);
		var modifier = SchemaModifier.standard().withUnwrapper(NON_EMPTY_FRUITS, NON_EMPTY_LIST);

		Schema modified = modifier.modify(schema, FieldPath.root().each().field("amount"))
			.apply(s -> s.withValidator(Validator.positive()));

		Schema expectedElement = fruitAmount.modify(FieldPath.root().field("amount"), s -> s.withValidator(Validator.positive()));
		assertEquals(nonEmptyList(expectedElement), modified);
	}

	@Test
	void customContainer_unknownToStandardModifier() {
		Schema schema = nonEmptyList(Schema.int32());
		assertThrows(PathNotFoundException.class, () -> schema.modify(FieldPath.root().each(), s -> s));
		assertNull(SchemaModifier.standard().unwrapperFor(NON_EMPTY_FRUITS));
	}

	@Test
	void withUnwrapper_leavesOriginalModifierAlone() {
		var modifier = SchemaModifier.standard().withUnwrapper(NON_EMPTY_FRUITS, NON_EMPTY_LIST);
		assertSame(NON_EMPTY_LIST, modifier.unwrapperFor(NON_EMPTY_FRUITS));
		assertNull(SchemaModifier.standard().unwrapperFor(NON_EMPTY_FRUITS));
	}

	@Test
	void checkedPath_throughCustomContainer() {
		var containerType = TypeDescriptors.product(NON_EMPTY_FRUITS)
			.field("head", FRUIT_AMOUNT_TYPE)
			.field("tail", TypeDescriptors.listOf(FRUIT_AMOUNT_TYPE))
			.build();
		var modifier = SchemaModifier.standard().withUnwrapper(NON_EMPTY_FRUITS, NON_EMPTY_LIST);
		FieldPath path = FieldPath.checked(containerType, modifier).each().field("amount").build();
		assertEquals(FieldPath.unsafe("each", "amount"), path);
	}

	private static SProduct fruitAmount(Schema basket) {
		return (SProduct) ((SArray) field(basket, "fruits").schemaType()).element().schemaType();
	}

	private static Schema field(Schema product, String name) {
		return ((SProduct) product.schemaType()).field(name).orElseThrow().schema();
	}
}
