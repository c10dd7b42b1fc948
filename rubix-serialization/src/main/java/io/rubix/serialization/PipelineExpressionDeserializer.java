package io.rubix.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.rubix.core.transformer.PipelineExpression;
import io.rubix.core.transformer.StageExpression;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

/// Reads a pipeline expression written by {@link PipelineExpressionSerializer}.
///
/// Stage indexes must match their array positions. A stored `sequenceId` that differs
/// from the one recomputed from the stages is rejected, which catches hand-edited
/// descriptions that no longer match their identifier.
///
/// @see PipelineExpressionSerializer for the inverse operation
class PipelineExpressionDeserializer extends StdDeserializer<PipelineExpression> {

    @Serial private static final long serialVersionUID = 2251809817364440326L;

    PipelineExpressionDeserializer() {
        super(PipelineExpression.class);
    }

    @Override
    public PipelineExpression deserialize(JsonParser p, DeserializationContext ctx)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        JsonNode stagesNode = root.path("stages");
        if (!stagesNode.isArray()) {
            throw new IOException("Pipeline expression requires a 'stages' array");
        }
        List<StageExpression> stages = new ArrayList<>();
        for (JsonNode stage : stagesNode) {
            stages.add(StageExpressionDeserializer.read(mapper, stage));
        }

        PipelineExpression expression;
        try {
            expression = new PipelineExpression(stages);
        } catch (IllegalArgumentException e) {
            throw new IOException("Malformed pipeline expression: " + e.getMessage(), e);
        }

        JsonNode sequenceId = root.get("sequenceId");
        if (sequenceId != null
                && !sequenceId.isNull()
                && !sequenceId.asText().equals(expression.sequenceId())) {
            throw new IOException(
                    "Stored sequenceId "
                            + sequenceId.asText()
                            + " does not match stages ("
                            + expression.sequenceId()
                            + ")");
        }
        return expression;
    }
}
