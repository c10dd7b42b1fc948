package io.rubix.core.stage;

import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Logging handle given to a stage factory when the stage is bound.
///
/// Each bound stage gets its own handle on the `io.rubix.stage.<stageName>` logger
/// category, so kernels never reach for a process-wide logger and log output can
/// be filtered per stage.
///
/// @implNote Thread-safe. Delegates to {@link java.util.logging.Logger}.
public final class StageLogger {

    static final String CATEGORY_PREFIX = "io.rubix.stage.";

    private final String stageName;
    private final Logger logger;

    private StageLogger(String stageName, Logger logger) {
        this.stageName = stageName;
        this.logger = logger;
    }

    /// Creates a handle for the named stage.
    ///
    /// @param stageName stage name, not null
    /// @return logging handle, never null
    public static StageLogger forStage(String stageName) {
        Objects.requireNonNull(stageName, "stageName must not be null");
        return new StageLogger(stageName, Logger.getLogger(CATEGORY_PREFIX + stageName));
    }

    public String stageName() {
        return stageName;
    }

    public void info(String message) {
        logger.info(message);
    }

    public void info(Supplier<String> message) {
        logger.info(message);
    }

    public void debug(String message) {
        logger.fine(message);
    }

    public void debug(Supplier<String> message) {
        logger.fine(message);
    }

    public void warn(String message) {
        logger.warning(message);
    }

    public boolean isDebugEnabled() {
        return logger.isLoggable(Level.FINE);
    }

    /// @return the underlying logger, never null
    public Logger logger() {
        return logger;
    }
}
