package io.rubix.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.rubix.core.config.RubixConfig;
import io.rubix.core.context.Context;
import io.rubix.core.transformer.PipelineExpression;

/// Utility class for converting Rubix contexts, configurations and pipeline
/// expressions to and from JSON.
///
/// ### Usage
/// {@snippet :
/// // Describe a pipeline without running it
/// String json = RubixSerializer.toJson(pipeline.describe());
/// PipelineExpression restored = RubixSerializer.expressionFromJson(json);
///
/// // Load configuration
/// RubixConfig config = RubixSerializer.configFromJson(Files.readString(path));
///
/// // Custom ObjectMapper
/// ObjectMapper mapper = RubixSerializer.createMapper();
/// }
///
/// @implNote Thread-safe. The ObjectMapper is created per call via `createMapper()`.
/// For high-throughput scenarios, cache the mapper.
///
/// @see RubixJacksonModule for the registered type handlers
public final class RubixSerializer {

    private RubixSerializer() {}

    /// Serializes a pipeline expression to pretty-printed JSON.
    ///
    /// @param expression the expression to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(PipelineExpression expression) {
        return write(expression, "pipeline expression");
    }

    /// Deserializes a pipeline expression from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized expression, never null
    /// @throws IllegalArgumentException if the JSON is malformed, stage indexes are out of
    ///     order, or the stored sequence identifier does not match the stages
    public static PipelineExpression expressionFromJson(String json) {
        return read(json, PipelineExpression.class, "pipeline expression");
    }

    /// Serializes a context to pretty-printed JSON.
    ///
    /// @param context the context to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Context context) {
        return write(context, "context");
    }

    /// Deserializes a context from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized context, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static Context contextFromJson(String json) {
        return read(json, Context.class, "context");
    }

    /// Serializes a configuration to pretty-printed JSON.
    ///
    /// @param config the configuration to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(RubixConfig config) {
        return write(config, "configuration");
    }

    /// Deserializes a configuration from a JSON object.
    ///
    /// @param json JSON string, not null
    /// @return immutable configuration, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static RubixConfig configFromJson(String json) {
        return read(json, RubixConfig.class, "configuration");
    }

    /// Creates an ObjectMapper configured for Rubix serialization.
    ///
    /// Registers:
    /// - `RubixJacksonModule` for contexts, configurations and expressions
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Indented output
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new RubixJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static String write(Object value, String what) {
        try {
            return createMapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize " + what + ": " + e.getMessage(), e);
        }
    }

    private static <T> T read(String json, Class<T> type, String what) {
        try {
            return createMapper().readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize " + what + ": " + e.getMessage(), e);
        }
    }
}
