package org.waabox.bundle.metrics;

/**
 * A no-operation implementation of {@link CatalogMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required or during
 * testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopCatalogMetrics implements CatalogMetrics {

  /** {@inheritDoc} */
  @Override
  public void cacheHits(final int hits) {
  }

  /** {@inheritDoc} */
  @Override
  public void membersResolved(final int requested, final int found) {
  }

  /** {@inheritDoc} */
  @Override
  public void locationHealed(final String memberId,
      final String fromLocation, final String toLocation) {
  }

  /** {@inheritDoc} */
  @Override
  public void mapCompleted(final int memberCount, final int concurrency,
      final long durationMs) {
  }
}
