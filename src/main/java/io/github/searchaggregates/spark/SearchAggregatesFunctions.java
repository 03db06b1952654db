package io.github.searchaggregates.spark;

import io.github.searchaggregates.model.ActiveAddon;
import io.github.searchaggregates.model.SearchType;
import org.apache.spark.sql.Column;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SparkSession;
import org.apache.spark.sql.api.java.UDF1;
import org.apache.spark.sql.expressions.UserDefinedFunction;
import org.apache.spark.sql.types.DataTypes;
import scala.collection.Iterator;
import scala.collection.Seq;

import java.util.ArrayList;
import java.util.List;

import static org.apache.spark.sql.functions.*;

/**
 * SearchAggregatesFunctions - Spark SQL functions that derive the search aggregation columns.
 *
 * Example usage:
 * <pre>
 * Dataset&lt;Row&gt; classified = exploded
 *     .withColumn("type", SearchAggregatesFunctions.searchType(col("source")))
 *     .withColumn("addon_version", SearchAggregatesFunctions.addonVersion(col("active_addons")));
 *
 * // or from SQL
 * SearchAggregatesFunctions.registerAll(spark);
 * spark.sql("SELECT search_type(source), search_addon_version(active_addons) FROM exploded");
 * </pre>
 */
public class SearchAggregatesFunctions {

    public static final String SEARCH_TYPE_FUNCTION = "search_type";
    public static final String ADDON_VERSION_FUNCTION = "search_addon_version";


    public static UserDefinedFunction searchTypeUdf = udf(
            (String source) -> SearchType.classify(source).getLabel(),
            DataTypes.StringType
    );

    public static UserDefinedFunction followOnSearchVersion = udf(
            (UDF1<Seq<Row>, String>) descriptors ->
                    ActiveAddon.findVersion(toActiveAddons(descriptors), ActiveAddon.FOLLOW_ON_SEARCH_ADDON_ID),
            DataTypes.StringType
    );


    /**
     * Search type label for a source column, as a native column expression.
     * The {@code when} chain follows {@link SearchType} declaration order, so the first matching
     * prefix wins.
     */
    public static Column searchType(Column source) {
        Column expression = null;
        for (SearchType type : SearchType.values()) {
            if (!type.isTagged()) {
                continue;
            }
            Column matches = source.startsWith(type.getSourcePrefix());
            expression = expression == null
                    ? when(matches, lit(type.getLabel()))
                    : expression.when(matches, lit(type.getLabel()));
        }
        Column fallback = lit(SearchType.SAP.getLabel());
        return expression == null ? fallback : expression.otherwise(fallback);
    }

    /**
     * Version of the follow-on search add-on within an {@code active_addons} column, or null.
     */
    public static Column addonVersion(Column activeAddons) {
        return followOnSearchVersion.apply(activeAddons);
    }

    static List<ActiveAddon> toActiveAddons(Seq<Row> descriptors) {
        List<ActiveAddon> addons = new ArrayList<>();
        if (descriptors == null) {
            return addons;
        }
        Iterator<Row> it = descriptors.iterator();
        while (it.hasNext()) {
            ActiveAddon addon = ActiveAddon.fromRow(it.next());
            if (addon != null) {
                addons.add(addon);
            }
        }
        return addons;
    }


    public static void registerAll(SparkSession spark) {
        spark.udf().register(SEARCH_TYPE_FUNCTION, searchTypeUdf);
        spark.udf().register(ADDON_VERSION_FUNCTION, followOnSearchVersion);
    }
}
