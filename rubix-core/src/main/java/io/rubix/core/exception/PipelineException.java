package io.rubix.core.exception;

import java.io.Serial;

/// Base type of every checked exception raised by the pipeline engine.
///
/// - {@link ConfigurationException}: bind, register and assembly time
/// - {@link StageExecutionException}: run time
/// - {@link ContractViolationException}: run time, attribute contract broken between stages
public abstract class PipelineException extends Exception {

    @Serial private static final long serialVersionUID = 3118246093514526170L;

    protected PipelineException(String message) {
        super(message);
    }

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
