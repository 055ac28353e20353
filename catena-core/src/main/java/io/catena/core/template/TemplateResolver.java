package io.catena.core.template;

import java.util.Map;

/// Resolves `{path}` placeholders against a variable scope.
public interface TemplateResolver {

    /// Replaces every placeholder with the string form of the value it names.
    ///
    /// @param template text containing placeholders, may be null
    /// @param scope variables to resolve from, not null
    /// @return resolved text, empty when the template is null
    String resolve(String template, Map<String, ?> scope);

    /// Resolves a template that may consist of a single placeholder.
    ///
    /// A template that is exactly one placeholder yields the raw value it names, so
    /// maps, lists and numbers keep their type. Any other template resolves to text.
    ///
    /// @param template template, may be null
    /// @param scope variables to resolve from, not null
    /// @return raw value, resolved text, or null when a single placeholder is unresolved
    Object resolveValue(String template, Map<String, ?> scope);
}
