package io.rubix.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.rubix.core.context.ArrayAttribute;
import java.io.IOException;
import java.io.Serial;

/// Writes an attribute as `{"width":W,"values":[...]}` with values in row-major order.
///
/// Non-finite values follow the generator's settings; with Jackson defaults they are
/// written as the strings `"NaN"`, `"Infinity"` and `"-Infinity"`.
///
/// @implNote Package-private. Registered by {@link RubixJacksonModule}.
class ArrayAttributeSerializer extends StdSerializer<ArrayAttribute> {

    @Serial private static final long serialVersionUID = 6103729455810284617L;

    ArrayAttributeSerializer() {
        super(ArrayAttribute.class);
    }

    @Override
    public void serialize(ArrayAttribute attribute, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeNumberField("width", attribute.width());
        gen.writeFieldName("values");
        double[] values = attribute.toArray();
        gen.writeArray(values, 0, values.length);
        gen.writeEndObject();
    }
}
