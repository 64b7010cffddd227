package com.record.linkage.core.model;

/**
 * The text fields of a company record that take part in matching.
 * Normalization rules can be scoped to one or more fields.
 */
public enum RecordField {
    NAME("Company Name"),
    ADDRESS("Address");

    private final String label;

    RecordField(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
