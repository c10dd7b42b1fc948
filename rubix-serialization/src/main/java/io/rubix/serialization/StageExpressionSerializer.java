package io.rubix.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.rubix.core.transformer.StageExpression;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;
import java.util.Set;

/// Writes a stage expression as
/// `{"name":..,"index":N,"config":{..},"reads":{comp:[..]},"writes":{comp:[..]}}`.
///
/// @implNote Package-private. Registered by {@link RubixJacksonModule}.
/// @see StageExpressionDeserializer for the inverse operation
class StageExpressionSerializer extends StdSerializer<StageExpression> {

    @Serial private static final long serialVersionUID = 4419050376310728154L;

    StageExpressionSerializer() {
        super(StageExpression.class);
    }

    @Override
    public void serialize(StageExpression stage, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("name", stage.name());
        gen.writeNumberField("index", stage.index());
        gen.writeFieldName("config");
        provider.defaultSerializeValue(stage.config(), gen);
        writeContract(gen, "reads", stage.reads());
        writeContract(gen, "writes", stage.writes());
        gen.writeEndObject();
    }

    private static void writeContract(
            JsonGenerator gen, String field, Map<String, Set<String>> contract) throws IOException {
        gen.writeObjectFieldStart(field);
        for (Map.Entry<String, Set<String>> entry : contract.entrySet()) {
            gen.writeArrayFieldStart(entry.getKey());
            for (String attribute : entry.getValue()) {
                gen.writeString(attribute);
            }
            gen.writeEndArray();
        }
        gen.writeEndObject();
    }
}
