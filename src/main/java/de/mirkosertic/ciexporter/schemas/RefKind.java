package de.mirkosertic.ciexporter.schemas;

/**
 * The kind of a tracked ref. The label value is what ends up in the {@code kind} metric label.
 */
public enum RefKind {

    BRANCH("branch"),
    TAG("tag"),
    MERGE_REQUEST("merge-request");

    private final String labelValue;

    RefKind(final String labelValue) {
        this.labelValue = labelValue;
    }

    public String labelValue() {
        return labelValue;
    }

    /**
     * Parse a configuration value such as {@code branch} or {@code merge-request}.
     *
     * @throws IllegalArgumentException if the value is unknown
     */
    public static RefKind fromLabelValue(final String value) {
        for (final RefKind kind : values()) {
            if (kind.labelValue.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown ref kind: " + value);
    }
}
