package io.github.searchaggregates.model;

import org.apache.spark.sql.Row;

import java.io.Serializable;
import java.util.Objects;

/**
 * Named view of one {@code active_addons} descriptor.
 *
 * <p>The telemetry schema stores descriptors as structs whose meaning is positional: the add-on
 * identifier sits at position 0 and its version at position 5. {@link #fromRow(Row)} is the only
 * place those positions are read.</p>
 */
public final class ActiveAddon implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String FOLLOW_ON_SEARCH_ADDON_ID = "followonsearch@mozilla.com";

    static final int ADDON_ID_POSITION = 0;
    static final int VERSION_POSITION = 5;

    private final String addonId;
    private final String version;

    public ActiveAddon(String addonId, String version) {
        this.addonId = addonId;
        this.version = version;
    }

    public static ActiveAddon fromRow(Row descriptor) {
        if (descriptor == null) {
            return null;
        }
        return new ActiveAddon(stringAt(descriptor, ADDON_ID_POSITION), stringAt(descriptor, VERSION_POSITION));
    }

    private static String stringAt(Row row, int position) {
        if (row.length() <= position || row.isNullAt(position)) {
            return null;
        }
        return row.getString(position);
    }

    /**
     * Scans descriptors in order and returns the version of the first one carrying {@code addonId},
     * or null when there is none.
     */
    public static String findVersion(Iterable<ActiveAddon> addons, String addonId) {
        if (addons == null) {
            return null;
        }
        for (ActiveAddon addon : addons) {
            if (addon != null && Objects.equals(addonId, addon.addonId)) {
                return addon.version;
            }
        }
        return null;
    }

    public String getAddonId() {
        return addonId;
    }

    public String getVersion() {
        return version;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActiveAddon)) return false;
        ActiveAddon that = (ActiveAddon) o;
        return Objects.equals(addonId, that.addonId) && Objects.equals(version, that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(addonId, version);
    }

    @Override
    public String toString() {
        return "ActiveAddon[" + addonId + "@" + version + "]";
    }
}
