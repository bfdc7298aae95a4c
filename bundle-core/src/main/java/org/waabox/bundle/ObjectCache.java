package org.waabox.bundle;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An id keyed cache of live member handles.
 *
 * <p>Entries are only added after a member was successfully resolved, and
 * only removed when the member is removed from its catalog. The cache may
 * be stale or empty at any time: the {@link MemberTable} is the source of
 * truth for membership.
 *
 * <p>Not thread-safe; owned by exactly one catalog.
 *
 * @param <T> the member type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ObjectCache<T extends Member> {

  /** The cached handles, keyed by member id. */
  private final Map<String, T> handles = new HashMap<>();

  /**
   * Returns the cached handle of the given member.
   *
   * @param id the member id, never null
   *
   * @return the handle, or empty on a cache miss
   */
  public Optional<T> get(final String id) {
    return Optional.ofNullable(handles.get(id));
  }

  /**
   * Caches the given handle under its id, replacing any previous entry.
   *
   * @param handle the handle, never null
   */
  public void put(final T handle) {
    Objects.requireNonNull(handle, "handle must not be null");
    handles.put(handle.id(), handle);
  }

  /**
   * Drops the entries of the given ids. Unknown ids are ignored.
   *
   * @param ids the ids to evict, never null
   */
  public void evict(final Collection<String> ids) {
    for (final String id : ids) {
      handles.remove(id);
    }
  }

  /** Drops every entry. */
  public void clear() {
    handles.clear();
  }

  /**
   * Returns the number of cached handles.
   *
   * @return the cache size
   */
  public int size() {
    return handles.size();
  }
}
