package io.catena.core.routing;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Dotted-path lookup into nested maps and lists.
///
/// `step_a_output.items.0.name` walks map keys and, for list segments, numeric
/// indexes. A `null` value anywhere along the path is reported as absent.
public final class FieldPaths {

    private FieldPaths() {}

    /// Resolves a dotted path.
    ///
    /// @param root variables to start from, not null
    /// @param path dotted path, not null
    /// @return the value at the path, or empty if any segment is missing or null
    public static Optional<Object> resolve(Map<String, ?> root, String path) {
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        // Whole-key hit first so keys containing dots still resolve.
        if (root.containsKey(path)) {
            return Optional.ofNullable(root.get(path));
        }

        Object current = root;
        for (String segment : path.split("\\.", -1)) {
            current = step(current, segment);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    private static Object step(Object current, String segment) {
        if (current instanceof Map<?, ?> map) {
            return map.get(segment);
        }
        if (current instanceof List<?> list) {
            int index = parseIndex(segment);
            return index >= 0 && index < list.size() ? list.get(index) : null;
        }
        return null;
    }

    private static int parseIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return -1;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return -1;
            }
        }
        return Integer.parseInt(segment);
    }
}
