package com.record.linkage.rules;

import com.record.linkage.core.model.RecordField;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One regex rewrite in a standardization pipeline.
 *
 * @param name        unique name, used for tracing
 * @param field       the field the rewrite belongs to, or {@code null} for every field
 * @param priority    position in the pipeline, lower runs first
 * @param pattern     case-insensitive pattern to replace
 * @param replacement replacement text, may reference groups
 */
public record NormalizationRule(
        String name,
        RecordField field,
        int priority,
        Pattern pattern,
        String replacement
) {
    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
    }

    /**
     * A rewrite shared by names and addresses.
     */
    public static NormalizationRule everyField(String name, int priority, String regex, String replacement) {
        return new NormalizationRule(name, null, priority, compile(regex), replacement);
    }

    public static NormalizationRule forField(RecordField field, String name, int priority,
                                             String regex, String replacement) {
        return new NormalizationRule(name, Objects.requireNonNull(field, "field is required"), priority,
                compile(regex), replacement);
    }

    public boolean isShared() {
        return field == null;
    }

    public boolean appliesTo(RecordField target) {
        return field == null || field == target;
    }

    public String rewrite(String text) {
        return pattern.matcher(text).replaceAll(replacement);
    }

    private static Pattern compile(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    @Override
    public String toString() {
        return name + "[" + (field == null ? "*" : field) + "@" + priority + "]";
    }
}
