package io.github.flameyossnowy.linkage.api.utils;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Lightweight logging facade used across Linkage.
 * <p>
 * {@link #ENABLED} gates ordinary info output, {@link #DEEP} gates per-statement tracing.
 * Messages are passed as suppliers so nothing is formatted while logging is off.
 */
public final class Logging {
    private static final Logger LOGGER = LoggerFactory.getLogger("Linkage");

    public static volatile boolean ENABLED = false;
    public static volatile boolean DEEP = false;

    private Logging() {}

    public static void info(@NotNull Supplier<String> message) {
        if (ENABLED && LOGGER.isInfoEnabled()) {
            LOGGER.info(message.get());
        }
    }

    public static void info(String message) {
        if (ENABLED) LOGGER.info(message);
    }

    public static void deepInfo(@NotNull Supplier<String> message) {
        if (ENABLED && DEEP && LOGGER.isDebugEnabled()) {
            LOGGER.debug(message.get());
        } else if (ENABLED && DEEP) {
            LOGGER.info(message.get());
        }
    }

    public static void warn(String message) {
        LOGGER.warn(message);
    }

    public static void error(String message) {
        LOGGER.error(message);
    }

    public static void error(String message, Throwable throwable) {
        LOGGER.error(message, throwable);
    }
}
