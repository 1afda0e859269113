package com.convkit.model;

import com.convkit.codec.EnumValue;
import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/** New state of a dialog node; {@code dialog_node} may rename the node. */
public record UpdateDialogNode(
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

    private static final Field<UpdateDialogNode, String> DIALOG_NODE =
            Field.required("dialog_node", FieldTypes.STRING, UpdateDialogNode::dialogNode);
    private static final Field<UpdateDialogNode, String> DESCRIPTION =
            Field.optional("description", FieldTypes.STRING, UpdateDialogNode::description);
    private static final Field<UpdateDialogNode, String> CONDITIONS =
            Field.optional("conditions", FieldTypes.STRING, UpdateDialogNode::conditions);
    private static final Field<UpdateDialogNode, String> PARENT =
            Field.optional("parent", FieldTypes.STRING, UpdateDialogNode::parent);
    private static final Field<UpdateDialogNode, String> PREVIOUS_SIBLING =
            Field.optional("previous_sibling", FieldTypes.STRING, UpdateDialogNode::previousSibling);
    private static final Field<UpdateDialogNode, Map<String, JsonNode>> OUTPUT =
            Field.optional("output", FieldTypes.JSON_OBJECT, UpdateDialogNode::output);
    private static final Field<UpdateDialogNode, Map<String, JsonNode>> CONTEXT =
            Field.optional("context", FieldTypes.JSON_OBJECT, UpdateDialogNode::context);
    private static final Field<UpdateDialogNode, Map<String, JsonNode>> METADATA =
            Field.optional("metadata", FieldTypes.JSON_OBJECT, UpdateDialogNode::metadata);
    private static final Field<UpdateDialogNode, DialogNodeNextStep> NEXT_STEP =
            Field.optional("next_step", DialogNodeNextStep.SCHEMA, UpdateDialogNode::nextStep);
    private static final Field<UpdateDialogNode, List<DialogNodeAction>> ACTIONS =
            Field.optional("actions", FieldTypes.listOf(DialogNodeAction.SCHEMA), UpdateDialogNode::actions);
    private static final Field<UpdateDialogNode, String> TITLE =
            Field.optional("title", FieldTypes.STRING, UpdateDialogNode::title);
    private static final Field<UpdateDialogNode, EnumValue<NodeType>> NODE_TYPE =
            Field.optional("type", FieldTypes.enumOf(NodeType.class), UpdateDialogNode::nodeType);
    private static final Field<UpdateDialogNode, EnumValue<EventName>> EVENT_NAME =
            Field.optional("event_name", FieldTypes.enumOf(EventName.class), UpdateDialogNode::eventName);
    private static final Field<UpdateDialogNode, String> VARIABLE =
            Field.optional("variable", FieldTypes.STRING, UpdateDialogNode::variable);

    public static final RecordSchema<UpdateDialogNode> SCHEMA = RecordSchema.builder(UpdateDialogNode.class)
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
            .build(v -> new UpdateDialogNode(
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

    public UpdateDialogNode {
        output = ModelSupport.json(output);
        context = ModelSupport.json(context);
        metadata = ModelSupport.json(metadata);
        actions = ModelSupport.list(actions);
    }
}
