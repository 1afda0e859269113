package com.convkit.model;

import com.convkit.codec.EnumValue;
import com.convkit.codec.JsonCodec;
import com.convkit.codec.RecordSchema;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/** One fully populated instance per schema, encoded and decoded back. */
class SchemaRoundTripTest {

    private static final String CREATED = "2017-05-26T10:00:00.000Z";
    private static final String UPDATED = "2017-06-01T08:30:00.000Z";

    record Case<T>(T value, RecordSchema<T> schema) {

        void assertRoundTrip() {
            byte[] json = JsonCodec.toBytes(value, schema);
            T restored = JsonCodec.decode(json, schema);
            assertThat(restored).isEqualTo(value);
            assertThat(JsonCodec.encode(restored, schema)).isEqualTo(JsonCodec.readTree(json));
        }

        @Override
        public String toString() {
            return schema.name();
        }
    }

    private static <T> Case<T> of(T value, RecordSchema<T> schema) {
        return new Case<>(value, schema);
    }

    private static Map<String, JsonNode> meta() {
        var nested = JsonNodeFactory.instance.objectNode().put("depth", 2);
        nested.putArray("tags").add("a").addNull();
        return Map.of("owner", TextNode.valueOf("ops"), "nested", nested);
    }

    private static Map<String, JsonNode> extras() {
        return Map.of("x_flag", BooleanNode.TRUE, "x_score", DoubleNode.valueOf(0.125),
                "x_null", NullNode.getInstance());
    }

    private static Pagination pagination() {
        return new Pagination("/v1/workspaces?page_limit=1", "/v1/workspaces?cursor=b2", 12L, 3L, "a1", "b2");
    }

    private static Example example() {
        return new Example("one large please", CREATED, UPDATED);
    }

    private static IntentExport intentExport() {
        return new IntentExport("order", CREATED, UPDATED, "wants pizza", List.of(example()));
    }

    private static ValueExport valueExport() {
        return new ValueExport("cheese", meta(), CREATED, UPDATED, List.of("mozzarella", "cheddar"));
    }

    private static EntityExport entityExport() {
        return new EntityExport("topping", CREATED, UPDATED, "pizza toppings", meta(), true, List.of(valueExport()));
    }

    private static Counterexample counterexample() {
        return new Counterexample("order a taxi", CREATED, UPDATED);
    }

    private static DialogNodeAction action() {
        return new DialogNodeAction("lookup", EnumValue.of(ActionType.SERVER), meta(), "result");
    }

    private static DialogNodeNextStep nextStep() {
        return DialogNodeNextStep.jumpTo("confirm", NextStepSelector.USER_INPUT);
    }

    private static DialogNode dialogNode() {
        return new DialogNode("size", "asks for size", "@size", "root", "greeting",
                Map.of("text", TextNode.valueOf("Which size?")), Map.of("size", NullNode.getInstance()), meta(),
                nextStep(), CREATED, UPDATED, List.of(action()), "Size",
                EnumValue.of(NodeType.SLOT), EnumValue.of(EventName.FILLED), "$size");
    }

    private static CreateDialogNode createDialogNode() {
        return new CreateDialogNode("size", "asks for size", "@size", "root", "greeting",
                Map.of("text", TextNode.valueOf("Which size?")), Map.of("turn", IntNode.valueOf(1)), meta(),
                nextStep(), List.of(action()), "Size",
                EnumValue.of(NodeType.FRAME), EnumValue.parse(EventName.class, "digression_return"), "$size");
    }

    private static CreateValue createValue() {
        return new CreateValue("cheese", meta(), List.of("mozzarella"));
    }

    private static CreateIntent createIntent() {
        return new CreateIntent("order", "wants pizza", List.of(new CreateExample("one large please")));
    }

    private static CreateEntity createEntity() {
        return new CreateEntity("topping", "pizza toppings", meta(), List.of(createValue()), false);
    }

    private static SystemResponse system() {
        return new SystemResponse(Map.of("dialog_turn_counter", IntNode.valueOf(2),
                "dialog_stack", JsonNodeFactory.instance.arrayNode().add("root")));
    }

    private static Context context() {
        return new Context("conv-1", system(), Map.of("room", TextNode.valueOf("kitchen")));
    }

    private static LogMessage logMessage() {
        return new LogMessage(EnumValue.of(LogLevel.WARN), "slot skipped", extras());
    }

    private static OutputData output() {
        return new OutputData(List.of(logMessage()), List.of("Which size?"), List.of("root", "size"), extras());
    }

    private static RuntimeIntent runtimeIntent() {
        return new RuntimeIntent("order", 0.9412345678901234, extras());
    }

    private static RuntimeEntity runtimeEntity() {
        return new RuntimeEntity("topping", List.of(4, 10), "cheese", 1.0, meta(), extras());
    }

    private static InputData input() {
        return new InputData("one large cheese", extras());
    }

    private static MessageRequest messageRequest() {
        return new MessageRequest(input(), true, context(), List.of(runtimeEntity()), List.of(runtimeIntent()),
                output());
    }

    private static MessageResponse messageResponse() {
        return new MessageResponse(new MessageInput("one large cheese"), List.of(runtimeIntent()),
                List.of(runtimeEntity()), false, context(), output(), extras());
    }

    private static Workspace workspace() {
        return new Workspace("pizza", "en", CREATED, UPDATED, "ws-1", "orders pizza", meta(), false);
    }

    static Stream<Case<?>> cases() {
        return Stream.of(
                // workspaces
                of(workspace(), Workspace.SCHEMA),
                of(new WorkspaceExport("pizza", "en", CREATED, UPDATED, "ws-1", "orders pizza", meta(), true,
                        EnumValue.of(WorkspaceStatus.AVAILABLE), List.of(intentExport()), List.of(entityExport()),
                        List.of(counterexample()), List.of(dialogNode())), WorkspaceExport.SCHEMA),
                of(new WorkspaceCollection(List.of(workspace()), pagination()), WorkspaceCollection.SCHEMA),
                of(new CreateWorkspace("pizza", "orders pizza", "en", List.of(createIntent()),
                        List.of(createEntity()), List.of(createDialogNode()),
                        List.of(new CreateCounterexample("order a taxi")), meta(), true), CreateWorkspace.SCHEMA),
                of(new UpdateWorkspace("pizza2", "orders more pizza", "fr", List.of(createIntent()),
                        List.of(createEntity()), List.of(createDialogNode()),
                        List.of(new CreateCounterexample("call a cab")), meta(), false), UpdateWorkspace.SCHEMA),
                // intents and examples
                of(new Intent("order", CREATED, UPDATED, "wants pizza"), Intent.SCHEMA),
                of(intentExport(), IntentExport.SCHEMA),
                of(new IntentCollection(List.of(intentExport()), pagination()), IntentCollection.SCHEMA),
                of(createIntent(), CreateIntent.SCHEMA),
                of(new UpdateIntent("order_pizza", "renamed", List.of(new CreateExample("two small"))),
                        UpdateIntent.SCHEMA),
                of(example(), Example.SCHEMA),
                of(new ExampleCollection(List.of(example()), pagination()), ExampleCollection.SCHEMA),
                of(new CreateExample("one large please"), CreateExample.SCHEMA),
                of(new UpdateExample("one medium please"), UpdateExample.SCHEMA),
                // entities, values and synonyms
                of(new Entity("topping", CREATED, UPDATED, "pizza toppings", meta(), true), Entity.SCHEMA),
                of(entityExport(), EntityExport.SCHEMA),
                of(new EntityCollection(List.of(entityExport()), pagination()), EntityCollection.SCHEMA),
                of(createEntity(), CreateEntity.SCHEMA),
                of(new UpdateEntity("toppings", "renamed", meta(), true, List.of(createValue())),
                        UpdateEntity.SCHEMA),
                of(new Value("cheese", meta(), CREATED, UPDATED), Value.SCHEMA),
                of(valueExport(), ValueExport.SCHEMA),
                of(new ValueCollection(List.of(valueExport()), pagination()), ValueCollection.SCHEMA),
                of(createValue(), CreateValue.SCHEMA),
                of(new UpdateValue("cheeses", meta(), List.of("gouda")), UpdateValue.SCHEMA),
                of(new Synonym("mozzarella", CREATED, UPDATED), Synonym.SCHEMA),
                of(new SynonymCollection(List.of(new Synonym("mozz", CREATED, UPDATED)), pagination()),
                        SynonymCollection.SCHEMA),
                of(new CreateSynonym("mozz"), CreateSynonym.SCHEMA),
                of(new UpdateSynonym("mozza"), UpdateSynonym.SCHEMA),
                // counterexamples
                of(counterexample(), Counterexample.SCHEMA),
                of(new CounterexampleCollection(List.of(counterexample()), pagination()),
                        CounterexampleCollection.SCHEMA),
                of(new CreateCounterexample("order a taxi"), CreateCounterexample.SCHEMA),
                of(new UpdateCounterexample("book a taxi"), UpdateCounterexample.SCHEMA),
                // dialog
                of(dialogNode(), DialogNode.SCHEMA),
                of(new DialogNodeCollection(List.of(dialogNode()), pagination()), DialogNodeCollection.SCHEMA),
                of(createDialogNode(), CreateDialogNode.SCHEMA),
                of(new UpdateDialogNode("size2", "renamed", "@size", "root", "greeting",
                        Map.of("text", TextNode.valueOf("Size?")), Map.of("turn", IntNode.valueOf(2)), meta(),
                        nextStep(), List.of(action()), "Size 2", EnumValue.of(NodeType.STANDARD),
                        EnumValue.of(EventName.INPUT), "$size2"), UpdateDialogNode.SCHEMA),
                of(nextStep(), DialogNodeNextStep.SCHEMA),
                of(action(), DialogNodeAction.SCHEMA),
                // message exchange
                of(messageRequest(), MessageRequest.SCHEMA),
                of(input(), InputData.SCHEMA),
                of(new MessageInput("one large cheese"), MessageInput.SCHEMA),
                of(messageResponse(), MessageResponse.SCHEMA),
                of(context(), Context.SCHEMA),
                of(system(), SystemResponse.SCHEMA),
                of(output(), OutputData.SCHEMA),
                of(logMessage(), LogMessage.SCHEMA),
                of(runtimeIntent(), RuntimeIntent.SCHEMA),
                of(runtimeEntity(), RuntimeEntity.SCHEMA),
                // logs and paging
                of(new LogExport(messageRequest(), messageResponse(), "log-1", CREATED, UPDATED, "ws-1", "en"),
                        LogExport.SCHEMA),
                of(new LogCollection(List.of(new LogExport(messageRequest(), messageResponse(), "log-1", CREATED,
                        UPDATED, "ws-1", "en")), new LogPagination("/v1/workspaces/ws-1/logs?cursor=c2", 40L, "c2")),
                        LogCollection.SCHEMA),
                of(new LogPagination("/v1/workspaces/ws-1/logs?cursor=c2", 40L, "c2"), LogPagination.SCHEMA),
                of(pagination(), Pagination.SCHEMA));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("cases")
    void encodeThenDecodeGivesEqualRecord(Case<?> c) {
        c.assertRoundTrip();
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("cases")
    void openRecordsCarryTheirBagOnTheWire(Case<?> c) {
        var json = encodeUnchecked(c);
        if (c.schema().isOpen()) {
            var bagKeys = Stream.of("x_flag", "x_score", "x_null", "room", "dialog_turn_counter")
                    .filter(json::has)
                    .collect(Collectors.toList());
            assertThat(bagKeys).isNotEmpty();
        }
        c.schema().knownKeys().forEach(key -> assertThat(json.has(key)).as(c + "." + key).isTrue());
    }

    @Test
    void everySchemaIsCovered() {
        var names = cases().map(Case::toString).collect(Collectors.toSet());
        assertThat(names).hasSize(52);
    }

    private static <T> JsonNode encodeUnchecked(Case<T> c) {
        return c.schema().encode(c.value());
    }
}
