package io.github.searchaggregates.model;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The closed set of search-type buckets a search count entry falls into.
 *
 * <p>Declaration order is the classification priority: the first constant whose
 * {@link #getSourcePrefix() source prefix} matches wins, and {@link #SAP} (which has no prefix)
 * catches everything else. The {@link #getLabel() labels} double as the pivoted output
 * column names, so adding a constant here adds an output column.</p>
 */
public enum SearchType {

    /** Partner-tagged search started from a search access point. */
    TAGGED_SAP("tagged-sap", "sap:"),

    /** Partner-tagged follow-on query issued from a results page. */
    TAGGED_FOLLOW_ON("tagged-follow-on", "follow-on:"),

    /** Untagged search started directly from the browser UI. */
    SAP("sap", null);

    private final String label;
    private final String sourcePrefix;

    SearchType(String label, String sourcePrefix) {
        this.label = label;
        this.sourcePrefix = sourcePrefix;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Returns the case-sensitive prefix of {@code source} that selects this type,
     * or null for the fallback type.
     */
    public String getSourcePrefix() {
        return sourcePrefix;
    }

    public boolean isTagged() {
        return sourcePrefix != null;
    }

    /**
     * Classifies a search count source. Total: a null or unprefixed source is {@link #SAP}.
     */
    public static SearchType classify(String source) {
        if (source != null) {
            for (SearchType type : values()) {
                if (type.isTagged() && source.startsWith(type.sourcePrefix)) {
                    return type;
                }
            }
        }
        return SAP;
    }

    public static SearchType fromLabel(String label) {
        for (SearchType type : values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown search type: " + label);
    }

    /**
     * Output column names in pivot order.
     */
    public static List<String> labels() {
        return Arrays.stream(values()).map(SearchType::getLabel).collect(Collectors.toList());
    }
}
