package io.github.flameyossnowy.filetx.api.utils;

import org.jetbrains.annotations.ApiStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.NOPLogger;

/**
 * Logging facade for filetx. Uses SLF4J when a binding is present and
 * {@code java.util.logging} otherwise.
 * <p>
 * Errors and warnings are always emitted. Commit lifecycle messages need {@link #ENABLED};
 * per-entry staging and compensation detail needs {@link #DEEP}.
 */
@ApiStatus.Internal
public final class Logging {
    public static boolean ENABLED = false;
    public static boolean DEEP = false;

    private static final Logger LOGGER;
    private static final java.util.logging.Logger FALLBACK;

    static {
        Logger detected;
        try {
            Logger logger = LoggerFactory.getLogger("filetx");
            detected = logger instanceof NOPLogger ? null : logger;
        } catch (NoClassDefFoundError e) {
            detected = null;
        }
        LOGGER = detected;

        if (LOGGER == null) {
            FALLBACK = java.util.logging.Logger.getLogger("filetx");
        } else {
            FALLBACK = null;
        }
    }

    private Logging() {
    }

    /**
     * Logs an error message, regardless of {@link #ENABLED}.
     * @param string the message
     */
    public static void error(String string) {
        if (LOGGER != null) LOGGER.error(string);
        else FALLBACK.severe(string);
    }

    /**
     * Logs an error message, regardless of {@link #ENABLED}.
     * @param string the message
     * @param throwable the throwable that caused the error
     */
    public static void error(String string, Throwable throwable) {
        if (LOGGER != null) LOGGER.error(string, throwable);
        else FALLBACK.log(java.util.logging.Level.SEVERE, string, throwable);
    }

    /**
     * Logs a warning, regardless of {@link #ENABLED}.
     * @param string the message
     */
    public static void warn(String string) {
        if (LOGGER != null) LOGGER.warn(string);
        else FALLBACK.warning(string);
    }

    /**
     * Logs an info message only if {@link #ENABLED} is set.
     * @param string the message
     */
    public static void info(String string) {
        if (ENABLED) {
            if (LOGGER != null) LOGGER.info(string);
            else FALLBACK.info(string);
        }
    }

    /**
     * Logs an info message only if {@link #DEEP} is set.
     * @param string the message
     */
    public static void deepInfo(String string) {
        if (DEEP) {
            if (LOGGER != null) LOGGER.info(string);
            else FALLBACK.info(string);
        }
    }
}
