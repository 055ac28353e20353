package io.catena.core.template;

import io.catena.core.routing.FieldPaths;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Template resolver whose placeholders are dotted paths.
///
/// `{step_fetch_output.items.0}` reads through nested maps and lists exactly like
/// routing conditions do. Unresolved placeholders become empty text.
public class PathTemplateResolver implements TemplateResolver {

    private static final Pattern TEMPLATE_PATTERN = Pattern.compile("\\{([^{}]+)}");

    @Override
    public String resolve(String template, Map<String, ?> scope) {
        if (template == null) {
            return "";
        }

        Matcher matcher = TEMPLATE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String path = matcher.group(1).trim();
            Optional<Object> value = FieldPaths.resolve(scope, path);
            String replacement = value.map(String::valueOf).orElse("");
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }

        matcher.appendTail(result);
        return result.toString();
    }

    @Override
    public Object resolveValue(String template, Map<String, ?> scope) {
        if (template == null) {
            return null;
        }
        Matcher matcher = TEMPLATE_PATTERN.matcher(template);
        if (matcher.matches()) {
            return FieldPaths.resolve(scope, matcher.group(1).trim()).orElse(null);
        }
        return resolve(template, scope);
    }
}
