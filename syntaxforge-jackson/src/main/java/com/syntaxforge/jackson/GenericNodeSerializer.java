package com.syntaxforge.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.syntaxforge.ast.GenericNode;

import java.io.IOException;
import java.util.Map;
import java.util.Set;

/**
 * Writes a {@link GenericNode} with its attributes flattened into the object:
 * {@code type}, {@code loc}, {@code range}, {@code raw}, then each attribute, then {@code children}.
 */
public class GenericNodeSerializer extends StdSerializer<GenericNode> {

    private static final Set<String> RESERVED = Set.of("type", "loc", "range", "raw", "children");

    public GenericNodeSerializer() {
        super(GenericNode.class);
    }

    @Override
    public void serialize(GenericNode node, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", node.type());
        if (node.loc() != null) {
            provider.defaultSerializeField("loc", node.loc(), gen);
        }
        if (node.range() != null) {
            provider.defaultSerializeField("range", node.range(), gen);
        }
        if (node.raw() != null) {
            gen.writeStringField("raw", node.raw());
        }
        for (Map.Entry<String, Object> attribute : node.attributes().entrySet()) {
            // an attribute never shadows a structural field
            if (RESERVED.contains(attribute.getKey()) || attribute.getValue() == null) {
                continue;
            }
            provider.defaultSerializeField(attribute.getKey(), attribute.getValue(), gen);
        }
        if (!node.children().isEmpty()) {
            provider.defaultSerializeField("children", node.children(), gen);
        }
        gen.writeEndObject();
    }
}
