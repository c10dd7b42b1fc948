package io.rubix.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.rubix.core.context.Component;
import io.rubix.core.context.Context;
import java.io.IOException;
import java.io.Serial;

/// Writes a context as an object keyed by component name, in sorted order:
///
/// ```json
/// {
///   "gas":   {"attributes": {"mass": {"width": 1, "values": [0.5]}}, "scalars": {}},
///   "stars": {"attributes": {...}, "scalars": {"halfmassrad_stars": 3.5}}
/// }
/// ```
///
/// @implNote Package-private. Registered by {@link RubixJacksonModule}.
/// @see ContextDeserializer for the inverse operation
class ContextSerializer extends StdSerializer<Context> {

    @Serial private static final long serialVersionUID = 1480342718092566359L;

    ContextSerializer() {
        super(Context.class);
    }

    @Override
    public void serialize(Context context, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        for (Component component : context.components()) {
            gen.writeFieldName(component.name());
            provider.defaultSerializeValue(component, gen);
        }
        gen.writeEndObject();
    }
}
