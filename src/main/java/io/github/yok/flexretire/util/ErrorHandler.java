package io.github.yok.flexretire.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that reports a fatal run failure and echoes a concise message to
 * {@code System.err}.
 *
 * <p>
 * A fatal failure is one that stops the whole run (catalog unreadable, log unwritable, unknown
 * store alias). Per-job failures never reach this class; they end up in the execution log.
 * </p>
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>Logs the error using SLF4J.</li>
 * <li>Writes a concise message to {@code System.err}.</li>
 * <li>Returns {@link #EXIT_FATAL} so the caller can hand it to the scheduler as the process exit
 * status; it never terminates the JVM by itself.</li>
 * <li>In tests, callers can switch behavior to throwing an exception via a thread-local flag.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    /**
     * Exit status reported to the scheduler when the run failed fatally.
     */
    public static final int EXIT_FATAL = 1;

    private static final ThreadLocal<Boolean> THROW_ENABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    private ErrorHandler() {
        throw new AssertionError("ErrorHandler must not be instantiated.");
    }

    /**
     * Switch to "throw instead of report" for the current thread (useful for tests).
     */
    public static void throwOnFatalForCurrentThread() {
        THROW_ENABLED.set(Boolean.TRUE);
    }

    /**
     * Restore normal behavior for the current thread.
     */
    public static void restoreForCurrentThread() {
        THROW_ENABLED.remove();
    }

    /**
     * Logs the given message and root cause at error level and prints a concise message to
     * {@code System.err}.
     *
     * @param message message to log
     * @param cause root cause
     * @return {@link #EXIT_FATAL}
     * @throws IllegalStateException if throwing is enabled for the current thread
     */
    public static int reportFatal(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(THROW_ENABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("FATAL: " + message + "\n" + ExceptionUtils.getRootCauseMessage(cause));
        return EXIT_FATAL;
    }
}
