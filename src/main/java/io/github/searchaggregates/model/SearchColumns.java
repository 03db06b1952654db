package io.github.searchaggregates.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Column names read and produced by the search aggregation.
 */
public final class SearchColumns {

    // main_summary input
    public static final String SEARCH_COUNTS = "search_counts";
    public static final String ACTIVE_ADDONS = "active_addons";

    // exploded search count entry
    public static final String ENGINE = "engine";
    public static final String SOURCE = "source";
    public static final String COUNT = "count";

    // derived
    public static final String TYPE = "type";
    public static final String ADDON_VERSION = "addon_version";

    public static final String APP_VERSION = "app_version";
    public static final String COUNTRY = "country";
    public static final String DISTRIBUTION_ID = "distribution_id";
    public static final String LOCALE = "locale";
    public static final String SEARCH_COHORT = "search_cohort";
    public static final String SUBMISSION_DATE = "submission_date";

    /**
     * Dimensions of the search dashboard rollup.
     */
    public static final List<String> DEFAULT_GROUPING_COLUMNS = Collections.unmodifiableList(Arrays.asList(
            ADDON_VERSION,
            APP_VERSION,
            COUNTRY,
            DISTRIBUTION_ID,
            ENGINE,
            LOCALE,
            SEARCH_COHORT,
            SOURCE,
            SUBMISSION_DATE
    ));

    private SearchColumns() {
    }
}
