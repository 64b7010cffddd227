package com.record.linkage.rules;

import com.record.linkage.core.model.RecordField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Runs normalization rules over record text.
 *
 * <p>The rules are split once, at construction, into a shared pipeline and one pipeline per
 * {@link RecordField}; each pipeline is ordered by priority, ties keeping their given order.
 * Text is uppercased before the rules run and whitespace-collapsed after.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<NormalizationRule> shared;
    private final Map<RecordField, List<NormalizationRule>> byField = new EnumMap<>(RecordField.class);

    public NormalizationEngine(List<NormalizationRule> rules) {
        List<NormalizationRule> ordered = new ArrayList<>(rules);
        ordered.sort(Comparator.comparingInt(NormalizationRule::priority));

        this.shared = ordered.stream().filter(NormalizationRule::isShared).toList();
        for (RecordField field : RecordField.values()) {
            byField.put(field, ordered.stream().filter(rule -> rule.appliesTo(field)).toList());
        }
    }

    /**
     * The pipeline for text that belongs to no particular field.
     */
    public List<NormalizationRule> sharedRules() {
        return shared;
    }

    public List<NormalizationRule> rulesFor(RecordField field) {
        return byField.get(field);
    }

    /**
     * Normalizes text with the shared pipeline only.
     */
    public String normalize(String text) {
        return run(text, shared);
    }

    public String normalize(String text, RecordField field) {
        return run(text, field == null ? shared : byField.get(field));
    }

    private String run(String text, List<NormalizationRule> pipeline) {
        if (text == null || text.isBlank()) {
            return "";
        }

        String result = text.toUpperCase(Locale.ROOT);
        for (NormalizationRule rule : pipeline) {
            String rewritten = rule.rewrite(result);
            if (log.isTraceEnabled() && !rewritten.equals(result)) {
                log.trace("rule.applied rule={} before='{}' after='{}'", rule.name(), result, rewritten);
            }
            result = rewritten;
        }
        return WHITESPACE.matcher(result).replaceAll(" ").trim();
    }
}
