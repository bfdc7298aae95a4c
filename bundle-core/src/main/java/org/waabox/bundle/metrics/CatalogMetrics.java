package org.waabox.bundle.metrics;

/**
 * An abstraction for recording operational metrics of catalogs.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer, Prometheus, or Datadog. Use {@link NoopCatalogMetrics}
 * when metrics collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface CatalogMetrics {

  /**
   * Records the members served straight from the cache while
   * materializing a catalog.
   *
   * @param hits the number of cache hits
   */
  void cacheHits(int hits);

  /**
   * Records a call to the resolution client.
   *
   * @param requested the number of ids the client was asked for
   * @param found     the number of ids the client found
   */
  void membersResolved(int requested, int found);

  /**
   * Records a member whose recorded location was corrected after it was
   * found somewhere else.
   *
   * @param memberId     the member id, never null
   * @param fromLocation the previously recorded location, never null
   * @param toLocation   the location the member was found at, never null
   */
  void locationHealed(String memberId, String fromLocation,
      String toLocation);

  /**
   * Records a completed map over a catalog.
   *
   * @param memberCount the number of members the function was applied to
   * @param concurrency the requested concurrency
   * @param durationMs  the wall clock duration in milliseconds
   */
  void mapCompleted(int memberCount, int concurrency, long durationMs);
}
