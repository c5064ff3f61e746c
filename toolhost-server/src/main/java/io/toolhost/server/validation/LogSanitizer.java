package io.toolhost.server.validation;

/// Makes provider- and caller-supplied text safe to log.
///
/// Tool providers write arbitrary bytes to stdout and stderr, and server ids
/// and tool names arrive from callers. Before such a value reaches a logger,
/// carriage returns and newlines are removed so one value can never forge a
/// second log entry, and very long values are cut.
///
/// ```
/// LOG.debugv("[{0}] stderr: {1}", serverId, LogSanitizer.sanitize(line));
/// ```
public final class LogSanitizer {

    /// Longest value written to the log before it is cut.
    public static final int MAX_LENGTH = 500;

    private LogSanitizer() {}

    /// Removes carriage-return and newline characters and truncates to {@link #MAX_LENGTH}.
    ///
    /// @param value the string to sanitize, may be null
    /// @return sanitized string, or {@code "null"} if input is null
    public static String sanitize(String value) {
        return abbreviate(value, MAX_LENGTH);
    }

    /// Removes carriage-return and newline characters and truncates to `maxLength`.
    ///
    /// Truncated values end with `...(N more chars)` so the log still shows
    /// how much was dropped.
    ///
    /// @param value the string to sanitize, may be null
    /// @param maxLength maximum number of kept characters, must be positive
    /// @return sanitized string, or {@code "null"} if input is null
    public static String abbreviate(String value, int maxLength) {
        if (value == null) {
            return "null";
        }
        String flat = value.replace("\r", "").replace("\n", "");
        if (flat.length() <= maxLength) {
            return flat;
        }
        return flat.substring(0, maxLength) + "...(" + (flat.length() - maxLength) + " more chars)";
    }
}
