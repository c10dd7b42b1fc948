package io.rubix.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.rubix.core.context.ArrayAttribute;
import io.rubix.core.context.Component;
import io.rubix.core.context.Context;
import java.io.IOException;
import java.io.Serial;
import java.util.Iterator;
import java.util.Map;

/// Reads a context written by {@link ContextSerializer}.
///
/// Attribute values may be JSON numbers or the strings `"NaN"`, `"Infinity"` and
/// `"-Infinity"`. Missing `attributes` or `scalars` objects read as empty.
///
/// @see ContextSerializer for the inverse operation
class ContextDeserializer extends StdDeserializer<Context> {

    @Serial private static final long serialVersionUID = -6951120482293807712L;

    ContextDeserializer() {
        super(Context.class);
    }

    @Override
    public Context deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (!root.isObject()) {
            throw new IOException("Context must be a JSON object, got " + root.getNodeType());
        }

        Context.Builder builder = Context.builder();
        Iterator<Map.Entry<String, JsonNode>> components = root.fields();
        while (components.hasNext()) {
            Map.Entry<String, JsonNode> entry = components.next();
            builder.component(readComponent(entry.getKey(), entry.getValue()));
        }
        return builder.build();
    }

    private static Component readComponent(String name, JsonNode node) throws IOException {
        Component component = new Component(name);

        JsonNode attributes = node.path("attributes");
        Iterator<Map.Entry<String, JsonNode>> fields = attributes.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            component.put(entry.getKey(), readAttribute(name, entry.getKey(), entry.getValue()));
        }

        Iterator<Map.Entry<String, JsonNode>> scalars = node.path("scalars").fields();
        while (scalars.hasNext()) {
            Map.Entry<String, JsonNode> entry = scalars.next();
            component.putScalar(entry.getKey(), readDouble(entry.getValue()));
        }
        return component;
    }

    private static ArrayAttribute readAttribute(String component, String name, JsonNode node)
            throws IOException {
        JsonNode values = node.path("values");
        if (!values.isArray()) {
            throw new IOException("Attribute " + component + "." + name + " has no values array");
        }
        int width = node.path("width").asInt(1);
        double[] data = new double[values.size()];
        for (int i = 0; i < data.length; i++) {
            data[i] = readDouble(values.get(i));
        }
        try {
            return ArrayAttribute.ofRows(width, data);
        } catch (IllegalArgumentException e) {
            throw new IOException(
                    "Attribute " + component + "." + name + " is malformed: " + e.getMessage(), e);
        }
    }

    private static double readDouble(JsonNode node) throws IOException {
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText());
            } catch (NumberFormatException e) {
                throw new IOException("Not a number: '" + node.asText() + "'", e);
            }
        }
        throw new IOException("Expected a number, got " + node.getNodeType());
    }
}
