package com.myinfra.deployments.ownership.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * Reads an application owner that is either a JSON string or a
 * {@code {"kind", "namespace", "name"}} object.
 */
public class OwnerFieldDeserializer extends StdDeserializer<OwnerField> {

    public OwnerFieldDeserializer() {
        super(OwnerField.class);
    }

    @Override
    public OwnerField deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.readValueAsTree();

        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return new RawOwner(node.asText());
        }
        if (node.isObject()) {
            return new StructuredOwner(
                    text(node, "kind"),
                    text(node, "namespace"),
                    text(node, "name"));
        }

        return context.reportInputMismatch(OwnerField.class,
                "Application owner must be a string or an object, got %s", node.getNodeType());
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return (value == null || value.isNull()) ? null : value.asText();
    }
}
