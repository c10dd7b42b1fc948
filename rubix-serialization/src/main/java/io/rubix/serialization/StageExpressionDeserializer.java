package io.rubix.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.rubix.core.config.RubixConfig;
import io.rubix.core.transformer.StageExpression;
import java.io.IOException;
import java.io.Serial;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/// Reads a stage expression written by {@link StageExpressionSerializer}.
///
/// The configuration is normalized through {@link RubixConfig}, so a deserialized
/// expression compares equal to one derived from a stage bound with the same values.
///
/// @see StageExpressionSerializer for the inverse operation
class StageExpressionDeserializer extends StdDeserializer<StageExpression> {

    @Serial private static final long serialVersionUID = -3075627930134491582L;

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    StageExpressionDeserializer() {
        super(StageExpression.class);
    }

    @Override
    public StageExpression deserialize(JsonParser p, DeserializationContext ctx)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        return read(mapper, mapper.readTree(p));
    }

    static StageExpression read(ObjectMapper mapper, JsonNode node) throws IOException {
        JsonNode name = node.get("name");
        if (name == null || !name.isTextual()) {
            throw new IOException("Stage expression requires a string 'name'");
        }
        JsonNode config = node.path("config");
        Map<String, Object> values =
                config.isObject() ? mapper.convertValue(config, MAP_TYPE) : Map.of();
        try {
            return new StageExpression(
                    name.asText(),
                    RubixConfig.of(values).asMap(),
                    node.path("index").asInt(0),
                    readContract(node.path("reads")),
                    readContract(node.path("writes")));
        } catch (IllegalArgumentException e) {
            throw new IOException("Malformed stage expression: " + e.getMessage(), e);
        }
    }

    private static Map<String, Set<String>> readContract(JsonNode node) {
        Map<String, Set<String>> contract = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            Set<String> attributes = new LinkedHashSet<>();
            for (JsonNode attribute : entry.getValue()) {
                attributes.add(attribute.asText());
            }
            contract.put(entry.getKey(), Set.copyOf(attributes));
        }
        return contract;
    }
}
