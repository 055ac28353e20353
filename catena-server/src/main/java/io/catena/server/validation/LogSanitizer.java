package io.catena.server.validation;

/// Strips control characters from strings to prevent log injection.
///
/// Log injection occurs when user-controlled input containing newline
/// characters ({@code \r}, {@code \n}) is written to log output,
/// allowing attackers to forge log entries.
///
/// Apply to any user-derived value before passing it to a logger:
/// ```
/// LOG.infov("Trigger: chain={0}", LogSanitizer.sanitize(chainId));
/// ```
public final class LogSanitizer {

    private LogSanitizer() {}

    /// Removes ISO control characters, including carriage return and newline.
    ///
    /// @param value the string to sanitize, may be null
    /// @return sanitized string, or {@code "null"} if input is null
    public static String sanitize(String value) {
        if (value == null) {
            return "null";
        }
        StringBuilder sb = new StringBuilder(value.length());
        value.codePoints()
                .filter(cp -> !Character.isISOControl(cp))
                .forEach(sb::appendCodePoint);
        return sb.toString();
    }
}
