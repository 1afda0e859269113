package com.convkit.model;

import com.convkit.codec.EnumValue;
import com.convkit.codec.Field;
import com.convkit.codec.FieldTypes;
import com.convkit.codec.RecordSchema;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * One node of the dialog flow. Root nodes carry no {@code parent} and first children no
 * {@code previous_sibling}; the service sends {@code null} for both, so they are optional here.
 */
public record DialogNode(
        String dialogNode,
        String description,
        String conditions,
        String parent,
        String previousSibling,
        Map<String, JsonNode> output,
        Map<String, JsonNode> context,
        Map<String, JsonNode> metadata,
        DialogNodeNextStep nextStep,
        String created,
        String updated,
        List<DialogNodeAction> actions,
        String title,
        EnumValue<NodeType> nodeType,
        EnumValue<EventName> eventName,
        String variable
) {

    private static final Field<DialogNode, String> DIALOG_NODE =
            Field.required("dialog_node", FieldTypes.STRING, DialogNode::dialogNode);
    private static final Field<DialogNode, String> DESCRIPTION =
            Field.optional("description", FieldTypes.STRING, DialogNode::description);
    private static final Field<DialogNode, String> CONDITIONS =
            Field.optional("conditions", FieldTypes.STRING, DialogNode::conditions);
    private static final Field<DialogNode, String> PARENT =
            Field.optional("parent", FieldTypes.STRING, DialogNode::parent);
    private static final Field<DialogNode, String> PREVIOUS_SIBLING =
            Field.optional("previous_sibling", FieldTypes.STRING, DialogNode::previousSibling);
    private static final Field<DialogNode, Map<String, JsonNode>> OUTPUT =
            Field.optional("output", FieldTypes.JSON_OBJECT, DialogNode::output);
    private static final Field<DialogNode, Map<String, JsonNode>> CONTEXT =
            Field.optional("context", FieldTypes.JSON_OBJECT, DialogNode::context);
    private static final Field<DialogNode, Map<String, JsonNode>> METADATA =
            Field.optional("metadata", FieldTypes.JSON_OBJECT, DialogNode::metadata);
    private static final Field<DialogNode, DialogNodeNextStep> NEXT_STEP =
            Field.optional("next_step", DialogNodeNextStep.SCHEMA, DialogNode::nextStep);
    private static final Field<DialogNode, String> CREATED =
            Field.required("created", FieldTypes.STRING, DialogNode::created);
    private static final Field<DialogNode, String> UPDATED =
            Field.optional("updated", FieldTypes.STRING, DialogNode::updated);
    private static final Field<DialogNode, List<DialogNodeAction>> ACTIONS =
            Field.optional("actions", FieldTypes.listOf(DialogNodeAction.SCHEMA), DialogNode::actions);
    private static final Field<DialogNode, String> TITLE =
            Field.optional("title", FieldTypes.STRING, DialogNode::title);
    private static final Field<DialogNode, EnumValue<NodeType>> NODE_TYPE =
            Field.optional("type", FieldTypes.enumOf(NodeType.class), DialogNode::nodeType);
    private static final Field<DialogNode, EnumValue<EventName>> EVENT_NAME =
            Field.optional("event_name", FieldTypes.enumOf(EventName.class), DialogNode::eventName);
    private static final Field<DialogNode, String> VARIABLE =
            Field.optional("variable", FieldTypes.STRING, DialogNode::variable);

    public static final RecordSchema<DialogNode> SCHEMA = RecordSchema.builder(DialogNode.class)
            .field(DIALOG_NODE)
            .field(DESCRIPTION)
            .field(CONDITIONS)
            .field(PARENT)
            .field(PREVIOUS_SIBLING)
            .field(OUTPUT)
            .field(CONTEXT)
            .field(METADATA)
            .field(NEXT_STEP)
            .field(CREATED)
            .field(UPDATED)
            .field(ACTIONS)
            .field(TITLE)
            .field(NODE_TYPE)
            .field(EVENT_NAME)
            .field(VARIABLE)
            .build(v -> new DialogNode(
                    v.get(DIALOG_NODE),
                    v.get(DESCRIPTION),
                    v.get(CONDITIONS),
                    v.get(PARENT),
                    v.get(PREVIOUS_SIBLING),
                    v.get(OUTPUT),
                    v.get(CONTEXT),
                    v.get(METADATA),
                    v.get(NEXT_STEP),
                    v.get(CREATED),
                    v.get(UPDATED),
                    v.get(ACTIONS),
                    v.get(TITLE),
                    v.get(NODE_TYPE),
                    v.get(EVENT_NAME),
                    v.get(VARIABLE)));

    public DialogNode {
        output = ModelSupport.json(output);
        context = ModelSupport.json(context);
        metadata = ModelSupport.json(metadata);
        actions = ModelSupport.list(actions);
    }
}
