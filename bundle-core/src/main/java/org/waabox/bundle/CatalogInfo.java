package org.waabox.bundle;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Holds a summary of a catalog: how many members it tracks, how many of
 * them have a cached handle, and how many members there are of each kind.
 *
 * @param memberCount   the number of rows in the member table
 * @param cachedCount   the number of cached handles
 * @param membersByKind the member count per kind, in first-seen order,
 *                      never null, unmodifiable
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CatalogInfo(int memberCount, int cachedCount,
    Map<String, Integer> membersByKind) {

  /**
   * Creates a new CatalogInfo instance.
   *
   * @param memberCount   the number of rows in the member table
   * @param cachedCount   the number of cached handles
   * @param membersByKind the member count per kind, never null
   *
   * @throws NullPointerException if membersByKind is null
   */
  public CatalogInfo {
    Objects.requireNonNull(membersByKind, "membersByKind must not be null");
    membersByKind = Collections.unmodifiableMap(
        new LinkedHashMap<>(membersByKind));
  }

  /**
   * Returns the fraction of members that have a cached handle.
   *
   * @return a value between 0 and 1, 0 for an empty catalog
   */
  public double cacheRatio() {
    if (memberCount == 0) {
      return 0.0;
    }
    return (double) cachedCount / memberCount;
  }
}
