package net.modshub.service;

import net.modshub.domain.ModCategory;
import net.modshub.domain.ModStatus;
import net.modshub.domain.ModVisibility;

/**
 * Exact-value filters plus paging for mod listings. Null filters match everything;
 * null paging values take the configured defaults.
 *
 * @param page 1-based page number
 * @param featuredOnly when true only featured mods match; false applies no featured filter
 */
public record ModListQuery(Integer page,
                           Integer pageSize,
                           ModCategory category,
                           String authorId,
                           ModVisibility visibility,
                           String tag,
                           ModStatus status,
                           boolean featuredOnly,
                           ModSort sort) {

    public static ModListQuery defaults() {
        return new ModListQuery(null, null, null, null, null, null, null, false, null);
    }
}
