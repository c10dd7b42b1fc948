package io.rubix.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.rubix.core.config.RubixConfig;
import io.rubix.core.context.ArrayAttribute;
import io.rubix.core.context.Component;
import io.rubix.core.context.Context;
import io.rubix.core.transformer.PipelineExpression;
import io.rubix.core.transformer.StageExpression;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Rubix serialization handlers in one place.
///
/// **Serializer/deserializer pairs** (explicit tree handling, no reflection):
/// - `Context` - `ContextSerializer` / `ContextDeserializer`, components keyed by name
/// - `StageExpression` - `StageExpressionSerializer` / `StageExpressionDeserializer`
/// - `PipelineExpression` - `PipelineExpressionSerializer` / `PipelineExpressionDeserializer`
/// - `RubixConfig` - `RubixConfigSerializer` / `RubixConfigDeserializer`, plain nested JSON
///
/// **Serializers only**, for values written as part of a context or on their own:
/// - `Component`, `ArrayAttribute`
///
/// @implNote All registrations are explicit. No classpath scanning.
/// @see RubixSerializer for the convenience factory API
public class RubixJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3958217740146263841L;

    public RubixJacksonModule() {
        super("RubixJacksonModule");

        addSerializer(ArrayAttribute.class, new ArrayAttributeSerializer());
        addSerializer(Component.class, new ComponentSerializer());

        addSerializer(Context.class, new ContextSerializer());
        addDeserializer(Context.class, new ContextDeserializer());

        addSerializer(RubixConfig.class, new RubixConfigSerializer());
        addDeserializer(RubixConfig.class, new RubixConfigDeserializer());

        addSerializer(StageExpression.class, new StageExpressionSerializer());
        addDeserializer(StageExpression.class, new StageExpressionDeserializer());

        addSerializer(PipelineExpression.class, new PipelineExpressionSerializer());
        addDeserializer(PipelineExpression.class, new PipelineExpressionDeserializer());
    }
}
