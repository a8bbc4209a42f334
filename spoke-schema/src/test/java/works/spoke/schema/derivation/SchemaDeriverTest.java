package works.spoke.schema.derivation;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import works.spoke.schema.Discriminator;
import works.spoke.schema.SArray;
import works.spoke.schema.SCoproduct;
import works.spoke.schema.SName;
import works.spoke.schema.SOpenProduct;
import works.spoke.schema.SOption;
import works.spoke.schema.SProduct;
import works.spoke.schema.SProductField;
import works.spoke.schema.Schema;
import works.spoke.schema.SchemaDefinitions;
import works.spoke.schema.Variant;
import works.spoke.schema.exceptions.DerivationUnavailableException;
import works.spoke.schema.validation.Validator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.spoke.schema.derivation.TypeDescriptors.INT;
import static works.spoke.schema.derivation.TypeDescriptors.STRING;
import static works.spoke.schema.derivation.TypeDescriptors.listOf;
import static works.spoke.schema.derivation.TypeDescriptors.optionOf;

class SchemaDeriverTest {
	static final SName FRUIT_AMOUNT = new SName("test.FruitAmount");
	static final SName BASKET = new SName("test.Basket");
	static final SName ENTITY = new SName("test.Entity");
	static final SName PERSON = new SName("test.Person");
	static final SName ORGANIZATION = new SName("test.Organization");
	static final SName NODE = new SName("test.Node");

	static final ProductDescriptor FRUIT_AMOUNT_TYPE = TypeDescriptors.product(FRUIT_AMOUNT)
		.field("fruitName", STRING)
		.field("amount", INT)
		.build();

	static final ProductDescriptor BASKET_TYPE = TypeDescriptors.product(BASKET)
		.field("fruits", listOf(FRUIT_AMOUNT_TYPE))
		.field("owner", optionOf(STRING))
		.build();

	static final ProductDescriptor PERSON_TYPE = TypeDescriptors.product(PERSON)
		.field("name", STRING)
		.field("age", INT)
		.build();

	static final ProductDescriptor ORGANIZATION_TYPE = TypeDescriptors.product(ORGANIZATION)
		.field("name", STRING)
		.build();

	static final CoproductDescriptor ENTITY_TYPE = TypeDescriptors.coproduct(ENTITY)
		.variant(PERSON_TYPE)
		.variant(ORGANIZATION_TYPE)
		.build();

	@Test
	void product_fieldsInDeclaredOrder() {
		Schema schema = SchemaDeriver.standard().derive(FRUIT_AMOUNT_TYPE);
		assertEquals(Schema.product(FRUIT_AMOUNT, List.of(
			SProductField.of("fruitName", Schema.string()),
			SProductField.of("amount", Schema.int32())
		)), schema);
	}

	@Test
	void derivationIsDeterministic() {
		var deriver = new SchemaDeriver(Configuration.DEFAULT.withSnakeCaseMemberNames());
		assertEquals(deriver.derive(BASKET_TYPE), deriver.derive(BASKET_TYPE));
		assertEquals(deriver.derive(ENTITY_TYPE), new SchemaDeriver(deriver.configuration()).derive(ENTITY_TYPE));
	}

	@Test
	void collectionsAndOptions() {
		Schema basket = SchemaDeriver.standard().derive(BASKET_TYPE);
		SProduct product = (SProduct) basket.schemaType();

		Schema fruits = product.field("fruits").orElseThrow().schema();
		assertTrue(fruits.schemaType() instanceof SArray);
		assertEquals(FRUIT_AMOUNT, ((SArray) fruits.schemaType()).element().name());

		Schema owner = product.field("owner").orElseThrow().schema();
		assertTrue(owner.isOptional());
		assertEquals(Schema.string(), ((SOption) owner.schemaType()).element());
	}

	@Test
	void map_becomesOpenProduct() {
		var type = TypeDescriptors.mapOf(INT);
		Schema schema = SchemaDeriver.standard().derive(type);
		assertEquals(new SOpenProduct(Schema.int32()), schema.schemaType());
		assertEquals(type.name(), schema.name());
	}

	@Test
	void snakeCaseNaming() {
		var deriver = new SchemaDeriver(Configuration.DEFAULT.withSnakeCaseMemberNames());
		SProduct product = (SProduct) deriver.derive(FRUIT_AMOUNT_TYPE).schemaType();
		SProductField field = product.field("fruitName").orElseThrow();
		assertEquals("fruit_name", field.encodedName());
		assertEquals("fruitName", field.name());
	}

	@Test
	void encodedName_overridesNaming() {
		var type = TypeDescriptors.product(FRUIT_AMOUNT)
			.field("fruitName", STRING, FieldMetadata.NONE.withEncodedName("f"))
			.field("amount", INT)
			.build();
		var deriver = new SchemaDeriver(Configuration.DEFAULT.withKebabCaseMemberNames());
		SProduct product = (SProduct) deriver.derive(type).schemaType();
		assertEquals(List.of("f", "amount"), product.fields().stream().map(SProductField::encodedName).toList());
	}

	@Test
	void fieldMetadata_appliedToFieldSchema() {
		var type = TypeDescriptors.product(FRUIT_AMOUNT)
			.field("fruitName", STRING, FieldMetadata.NONE.withDescription("Which fruit").plusValidator(Validator.minLength(1)))
			.fieldWithDefault("amount", INT, 1)
			.build();
		SProduct product = (SProduct) SchemaDeriver.standard().derive(type).schemaType();
		Schema fruitName = product.field("fruitName").orElseThrow().schema();
		assertEquals("Which fruit", fruitName.description());
		assertEquals(List.of(Validator.minLength(1)), fruitName.validator().asPrimitiveValidators());
		assertEquals(1, product.field("amount").orElseThrow().schema().defaultValue());
	}

	@Test
	void typeMetadata_appliedToTypeSchema() {
		var type = FRUIT_AMOUNT_TYPE.toBuilder()
			.metadata(FieldMetadata.NONE.withDescription("Some fruit").withDeprecated(true))
			.build();
		Schema schema = SchemaDeriver.standard().derive(type);
		assertEquals("Some fruit", schema.description());
		assertTrue(schema.deprecated());
	}

	@Test
	void enumeration() {
		var type = TypeDescriptors.enumeration(new SName("test.Color"), "RED", "GREEN");
		Schema schema = SchemaDeriver.standard().derive(type);
		assertEquals(Schema.string().withName(type.name()).withValidator(Validator.enumeration("RED", "GREEN")), schema);
	}

	@Test
	void registeredSchema_overridesDerivation() {
		var registry = new SchemaRegistry().specify(FRUIT_AMOUNT, Schema.string().withDescription("opaque fruit"));
		var deriver = new SchemaDeriver(Configuration.DEFAULT, registry);
		Schema basket = deriver.derive(BASKET_TYPE);
		Schema element = ((SArray) ((SProduct) basket.schemaType()).field("fruits").orElseThrow().schema().schemaType()).element();
		assertEquals(Schema.string().withDescription("opaque fruit"), element);
	}

	@Test
	void registeredSchema_latestWins() {
		var registry = new SchemaRegistry()
			.specify(INT.name(), Schema.int64())
			.specify(INT.name(), Schema.string());
		var deriver = new SchemaDeriver(Configuration.DEFAULT, registry);
		assertEquals(Schema.string(), deriver.derive(INT));
	}

	@Test
	void opaqueType_unavailable() {
		var money = TypeDescriptors.opaque(new SName("test.Money"));
		var type = TypeDescriptors.product(BASKET)
			.field("price", money)
			.build();
		var e = assertThrows(DerivationUnavailableException.class, () -> SchemaDeriver.standard().derive(type));
		assertEquals(money.name(), e.type());
		assertEquals(List.of(BASKET), e.derivationChain());
	}

	@Test
	void opaqueType_registered() {
		var money = TypeDescriptors.opaque(new SName("test.Money"));
		var type = TypeDescriptors.product(BASKET)
			.field("price", money)
			.build();
		var deriver = new SchemaDeriver(Configuration.DEFAULT, new SchemaRegistry().specify(money.name(), Schema.decimal()));
		SProduct product = (SProduct) deriver.derive(type).schemaType();
		assertEquals(Schema.decimal(), product.field("price").orElseThrow().schema());
	}

	@Test
	void coproduct_noDiscriminator() {
		Schema schema = SchemaDeriver.standard().derive(ENTITY_TYPE);
		SCoproduct coproduct = (SCoproduct) schema.schemaType();
		assertNull(coproduct.discriminator());
		assertEquals(List.of(PERSON, ORGANIZATION), coproduct.variants().stream().map(v -> v.schema().name()).toList());
		assertEquals(List.of(), coproduct.variants().stream().filter(v -> v.label() != null).toList());
	}

	@Test
	void coproduct_withDiscriminator() {
		var deriver = new SchemaDeriver(Configuration.DEFAULT.withDiscriminator("kind"));
		Schema schema = deriver.derive(ENTITY_TYPE);
		SCoproduct coproduct = (SCoproduct) schema.schemaType();
		assertEquals(List.of("Person", "Organization"), coproduct.variants().stream().map(Variant::label).toList());
		Discriminator discriminator = coproduct.discriminator();
		assertEquals("kind", discriminator.fieldName());
		assertEquals(List.of(Validator.enumeration("Person", "Organization")),
			discriminator.valueSchema().validator().asPrimitiveValidators());
	}

	@Test
	void coproduct_discriminatorValueFunction() {
		var configuration = Configuration.builder()
			.discriminator("type")
			.discriminatorValue(name -> name.shortName().toLowerCase())
			.build();
		var type = ENTITY_TYPE.toBuilder()
			.clearVariants()
			.variant(PERSON_TYPE)
			.variant("org", ORGANIZATION_TYPE)
			.build();
		SCoproduct coproduct = (SCoproduct) new SchemaDeriver(configuration).derive(type).schemaType();
		assertEquals(List.of("person", "org"), coproduct.variants().stream().map(Variant::label).toList());
	}

	@Test
	void descriptorBuilders_overloadsAgree() {
		var byParts = TypeDescriptors.product(FRUIT_AMOUNT)
			.field("fruitName", STRING)
			.field("amount", INT)
			.build();
		var byDescriptor = TypeDescriptors.product(FRUIT_AMOUNT)
			.field(FieldDescriptor.of("fruitName", STRING))
			.fieldDescriptor(FieldDescriptor.of("amount", INT))
			.build();
		assertEquals(FRUIT_AMOUNT_TYPE, byParts);
		assertEquals(FRUIT_AMOUNT_TYPE, byDescriptor);

		var rebuilt = ENTITY_TYPE.toBuilder()
			.clearVariants()
			.variant(VariantDescriptor.of(PERSON_TYPE))
			.variantDescriptor(VariantDescriptor.of(ORGANIZATION_TYPE))
			.build();
		assertEquals(ENTITY_TYPE, rebuilt);
		assertEquals(List.of("fruitName", "amount", "extra"), FRUIT_AMOUNT_TYPE.toBuilder()
			.field("extra", STRING)
			.build()
			.fields().stream().map(FieldDescriptor::name).toList());
	}

	@Test
	void coproduct_discriminatorUsesFieldNaming() {
		var configuration = Configuration.DEFAULT
			.withDiscriminator("kind")
			.withSnakeCaseMemberNames();
		var type = TypeDescriptors.coproduct(ENTITY)
			.variant(TypeDescriptors.product(new SName("test.LimitedCompany")).build())
			.build();
		SCoproduct coproduct = (SCoproduct) new SchemaDeriver(configuration).derive(type).schemaType();
		assertEquals("limited_company", coproduct.variants().get(0).label());
	}

	@Test
	void recursiveType_usesReference() {
		// Node(value: int, children: List<Node>)
		AtomicReference<ProductDescriptor> node = new AtomicReference<>();
		node.set(TypeDescriptors.product(NODE)
			.field("value", INT)
			.field("children", listOf(TypeDescriptors.deferred(NODE, node::get)))
			.build());

		Schema schema = SchemaDeriver.standard().derive(node.get());

		assertEquals(Schema.product(NODE, List.of(
			SProductField.of("value", Schema.int32()),
			SProductField.of("children", Schema.ref(NODE).asArray())
		)), schema);
		var definitions = SchemaDefinitions.collect(schema);
		assertEquals(schema, definitions.resolve(Schema.ref(NODE)));
	}

	@Test
	void mutuallyRecursiveTypes() {
		// Tree = Leaf(int) | Branch(left: Tree, right: Tree)
		SName tree = new SName("test.Tree");
		SName branch = new SName("test.Branch");
		AtomicReference<CoproductDescriptor> treeType = new AtomicReference<>();
		var deferredTree = TypeDescriptors.deferred(tree, treeType::get);
		var branchType = TypeDescriptors.product(branch)
			.field("left", deferredTree)
			.field("right", deferredTree)
			.build();
		var leafType = TypeDescriptors.product(new SName("test.Leaf")).field("value", INT).build();
		treeType.set(TypeDescriptors.coproduct(tree).variant(leafType).variant(branchType).build());

		Schema schema = SchemaDeriver.standard().derive(treeType.get());
		var definitions = SchemaDefinitions.collect(schema);
		Schema branchSchema = definitions.get(branch).orElseThrow();
		assertEquals(Schema.ref(tree), ((SProduct) branchSchema.schemaType()).field("left").orElseThrow().schema());
		assertTrue(definitions.unresolvedReferences().isEmpty());
	}

	@Test
	void deferredCycleWithoutProduct_throws() {
		// A map whose values are the map itself, with no product in between to break the cycle
		SName loop = new SName("test.Loop");
		AtomicReference<TypeDescriptor> loopType = new AtomicReference<>();
		var deferredLoop = TypeDescriptors.deferred(loop, loopType::get);
		loopType.set(new MapDescriptor(loop, deferredLoop));
		assertThrows(IllegalArgumentException.class, () -> SchemaDeriver.standard().derive(deferredLoop));
	}

	@Test
	void unboundDeferred_throws() {
		var unbound = TypeDescriptors.deferred(NODE, () -> null);
		assertThrows(IllegalStateException.class, () -> SchemaDeriver.standard().derive(unbound));
	}
}
