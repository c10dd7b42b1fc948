package io.rubix.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.rubix.core.config.RubixConfig;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Reads a configuration from any JSON object. Nested objects become sections, arrays
/// become lists, and numbers keep the type Jackson assigns (`Integer`, `Long`, `Double`).
///
/// @see RubixConfigSerializer for the inverse operation
class RubixConfigDeserializer extends StdDeserializer<RubixConfig> {

    @Serial private static final long serialVersionUID = -1713845290671152028L;

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    RubixConfigDeserializer() {
        super(RubixConfig.class);
    }

    @Override
    public RubixConfig deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (!root.isObject()) {
            throw new IOException("Configuration must be a JSON object, got " + root.getNodeType());
        }
        return RubixConfig.of(mapper.convertValue(root, MAP_TYPE));
    }
}
