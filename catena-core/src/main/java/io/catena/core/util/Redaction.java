package io.catena.core.util;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// Masks values of sensitive keys before parameters reach a log line.
///
/// A key is sensitive when its lower-cased form contains one of `password`, `token`,
/// `secret`, `apikey`, `api_key`, `authorization`, `credential` or `private_key`.
/// Nested maps are masked recursively.
public final class Redaction {

    public static final String MASK = "***REDACTED***";

    private static final List<String> SENSITIVE_FRAGMENTS =
            List.of(
                    "password",
                    "token",
                    "secret",
                    "apikey",
                    "api_key",
                    "authorization",
                    "credential",
                    "private_key");

    private Redaction() {}

    public static boolean isSensitiveKey(String key) {
        if (key == null) {
            return false;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        for (String fragment : SENSITIVE_FRAGMENTS) {
            if (lower.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    /// Returns a copy of the map with sensitive values masked.
    ///
    /// @param values map to mask, may be null
    /// @return masked copy, empty when the input is null
    public static Map<String, Object> redact(Map<String, ?> values) {
        Map<String, Object> masked = new LinkedHashMap<>();
        if (values == null) {
            return masked;
        }
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            Object value = entry.getValue();
            if (isSensitiveKey(entry.getKey())) {
                masked.put(entry.getKey(), MASK);
            } else if (value instanceof Map<?, ?> nested) {
                masked.put(entry.getKey(), redact(stringKeys(nested)));
            } else {
                masked.put(entry.getKey(), value);
            }
        }
        return masked;
    }

    private static Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }
}
