package io.rubix.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.rubix.core.transformer.PipelineExpression;
import io.rubix.core.transformer.StageExpression;
import java.io.IOException;
import java.io.Serial;

/// Writes a pipeline expression as `{"sequenceId":"seq-..","stages":[..]}`.
///
/// `sequenceId` is informational; it is recomputed from the stages when read back.
///
/// @implNote Package-private. Registered by {@link RubixJacksonModule}.
/// @see PipelineExpressionDeserializer for the inverse operation
class PipelineExpressionSerializer extends StdSerializer<PipelineExpression> {

    @Serial private static final long serialVersionUID = -5302281674991530067L;

    PipelineExpressionSerializer() {
        super(PipelineExpression.class);
    }

    @Override
    public void serialize(
            PipelineExpression expression, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("sequenceId", expression.sequenceId());
        gen.writeArrayFieldStart("stages");
        for (StageExpression stage : expression.stages()) {
            provider.defaultSerializeValue(stage, gen);
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }
}
