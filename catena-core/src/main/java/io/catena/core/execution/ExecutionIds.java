package io.catena.core.execution;

import io.catena.core.exception.ValidationException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import java.util.regex.Pattern;

/// Generation and allow-list validation of execution identifiers.
///
/// Generated ids look like `exec-lx2k9a1c-3f9a0b1e`: base-36 epoch millis followed by
/// eight random hex characters. Anything used to derive storage keys or file names
/// must pass {@link #sanitize(String)} first.
public final class ExecutionIds {

    private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9_-]{1,64}");
    private static final SecureRandom RANDOM = new SecureRandom();

    private ExecutionIds() {}

    public static String generate() {
        return generate(Clock.systemUTC());
    }

    public static String generate(Clock clock) {
        byte[] suffix = new byte[4];
        RANDOM.nextBytes(suffix);
        return "exec-" + Long.toString(clock.millis(), 36) + "-" + HexFormat.of().formatHex(suffix);
    }

    /// Validates an execution id against the allow-list `[A-Za-z0-9_-]{1,64}`.
    ///
    /// Ids are rejected rather than rewritten, so two distinct ids can never map to the
    /// same storage key.
    ///
    /// @param executionId candidate id, may be null
    /// @return the same id, never null
    /// @throws ValidationException if the id is null or contains anything outside the allow-list
    public static String sanitize(String executionId) {
        if (executionId == null || !ALLOWED.matcher(executionId).matches()) {
            throw new ValidationException("Invalid execution id: " + printable(executionId));
        }
        return executionId;
    }

    public static boolean isValid(String executionId) {
        return executionId != null && ALLOWED.matcher(executionId).matches();
    }

    private static String printable(String value) {
        if (value == null) {
            return "null";
        }
        String cleaned = value.replaceAll("[^\\x20-\\x7E]", "?");
        return cleaned.length() > 80 ? cleaned.substring(0, 80) + "..." : cleaned;
    }
}
