package com.convkit.model;

import com.convkit.codec.EnumValue;
import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

public record CreateDialogNode(
        String dialogNode,
        String description,
        String conditions,
        String parent,
        String previousSibling,
        Map<String, JsonNode> output,
        Map<String, JsonNode> context,
        Map<String, JsonNode> metadata,
        DialogNodeNextStep nextStep,
        List<DialogNodeAction> actions,
        String title,
        EnumValue<NodeType> nodeType,
        EnumValue<EventName> eventName,
        String variable
) {

    private static final Field<CreateDialogNode, String> DIALOG_NODE =
            Field.required("dialog_node", FieldTypes.STRING, CreateDialogNode::dialogNode);
    private static final Field<CreateDialogNode, String> DESCRIPTION =
            Field.optional("description", FieldTypes.STRING, CreateDialogNode::description);
    private static final Field<CreateDialogNode, String> CONDITIONS =
            Field.optional("conditions", FieldTypes.STRING, CreateDialogNode::conditions);
    private static final Field<CreateDialogNode, String> PARENT =
            Field.optional("parent", FieldTypes.STRING, CreateDialogNode::parent);
    private static final Field<CreateDialogNode, String> PREVIOUS_SIBLING =
            Field.optional("previous_sibling", FieldTypes.STRING, CreateDialogNode::previousSibling);
    private static final Field<CreateDialogNode, Map<String, JsonNode>> OUTPUT =
            Field.optional("output", FieldTypes.JSON_OBJECT, CreateDialogNode::output);
    private static final Field<CreateDialogNode, Map<String, JsonNode>> CONTEXT =
            Field.optional("context", FieldTypes.JSON_OBJECT, CreateDialogNode::context);
    private static final Field<CreateDialogNode, Map<String, JsonNode>> METADATA =
            Field.optional("metadata", FieldTypes.JSON_OBJECT, CreateDialogNode::metadata);
    private static final Field<CreateDialogNode, DialogNodeNextStep> NEXT_STEP =
            Field.optional("next_step", DialogNodeNextStep.SCHEMA, CreateDialogNode::nextStep);
    private static final Field<CreateDialogNode, List<DialogNodeAction>> ACTIONS =
            Field.optional("actions", FieldTypes.listOf(DialogNodeAction.SCHEMA), CreateDialogNode::actions);
    private static final Field<CreateDialogNode, String> TITLE =
            Field.optional("title", FieldTypes.STRING, CreateDialogNode::title);
    private static final Field<CreateDialogNode, EnumValue<NodeType>> NODE_TYPE =
            Field.optional("type", FieldTypes.enumOf(NodeType.class), CreateDialogNode::nodeType);
    private static final Field<CreateDialogNode, EnumValue<EventName>> EVENT_NAME =
            Field.optional("event_name", FieldTypes.enumOf(EventName.class), CreateDialogNode::eventName);
    private static final Field<CreateDialogNode, String> VARIABLE =
            Field.optional("variable", FieldTypes.STRING, CreateDialogNode::variable);

    public static final RecordSchema<CreateDialogNode> SCHEMA = RecordSchema.builder(CreateDialogNode.class)
            .field(DIALOG_NODE)
            .field(DESCRIPTION)
            .field(CONDITIONS)
            .field(PARENT)
            .field(PREVIOUS_SIBLING)
            .field(OUTPUT)
            .field(CONTEXT)
            .field(METADATA)
            .field(NEXT_STEP)
            .field(ACTIONS)
            .field(TITLE)
            .field(NODE_TYPE)
            .field(EVENT_NAME)
            .field(VARIABLE)
            .build(v -> new CreateDialogNode(
                    v.get(DIALOG_NODE),
                    v.get(DESCRIPTION),
                    v.get(CONDITIONS),
                    v.get(PARENT),
                    v.get(PREVIOUS_SIBLING),
                    v.get(OUTPUT),
                    v.get(CONTEXT),
                    v.get(METADATA),
                    v.get(NEXT_STEP),
                    v.get(ACTIONS),
                    v.get(TITLE),
                    v.get(NODE_TYPE),
                    v.get(EVENT_NAME),
                    v.get(VARIABLE)));

    public CreateDialogNode {
        output = ModelSupport.json(output);
        context = ModelSupport.json(context);
        metadata = ModelSupport.json(metadata);
        actions = ModelSupport.list(actions);
    }

    public CreateDialogNode(String dialogNode, String conditions, Map<String, JsonNode> output) {
        this(dialogNode, null, conditions, null, null, output, null, null, null, null, null, null, null, null);
    }
}
