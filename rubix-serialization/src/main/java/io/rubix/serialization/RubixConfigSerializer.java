package io.rubix.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.rubix.core.config.RubixConfig;
import java.io.IOException;
import java.io.Serial;

/// Writes a configuration as its plain nested JSON object.
///
/// @implNote Package-private. Registered by {@link RubixJacksonModule}.
/// @see RubixConfigDeserializer for the inverse operation
class RubixConfigSerializer extends StdSerializer<RubixConfig> {

    @Serial private static final long serialVersionUID = 8826614024758130932L;

    RubixConfigSerializer() {
        super(RubixConfig.class);
    }

    @Override
    public void serialize(RubixConfig config, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        provider.defaultSerializeValue(config.asMap(), gen);
    }
}
