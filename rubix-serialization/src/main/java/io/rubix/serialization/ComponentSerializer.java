package io.rubix.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.rubix.core.context.ArrayAttribute;
import io.rubix.core.context.Component;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Writes a component as `{"attributes":{...},"scalars":{...}}`.
///
/// The component name is not part of the object; inside a context it is the key the
/// object is written under.
///
/// @implNote Package-private. Registered by {@link RubixJacksonModule}.
class ComponentSerializer extends StdSerializer<Component> {

    @Serial private static final long serialVersionUID = -2287401905516843720L;

    ComponentSerializer() {
        super(Component.class);
    }

    @Override
    public void serialize(Component component, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();

        gen.writeObjectFieldStart("attributes");
        for (Map.Entry<String, ArrayAttribute> entry : component.attributes().entrySet()) {
            gen.writeFieldName(entry.getKey());
            provider.defaultSerializeValue(entry.getValue(), gen);
        }
        gen.writeEndObject();

        gen.writeObjectFieldStart("scalars");
        for (Map.Entry<String, Double> entry : component.scalars().entrySet()) {
            gen.writeNumberField(entry.getKey(), entry.getValue());
        }
        gen.writeEndObject();

        gen.writeEndObject();
    }
}
