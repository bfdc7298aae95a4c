package org.waabox.bundle;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns member ids and location hints into live handles.
 *
 * <p>Implementations own the knowledge of how entities are laid out on
 * disk. The catalog only asks them to find members it does not have a
 * cached handle for, and to expand raw locations into members when a
 * location is added instead of a handle.
 *
 * @param <T> the member type this client produces
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ResolutionClient<T extends Member> {

  /**
   * Locates the given members.
   *
   * <p>For every id the hinted location must be tried first; if the member
   * is not there, a broader search may be used to find where it moved to.
   * The returned map must contain an entry for every requested id, empty
   * when the member could not be found. A missing entry is treated as not
   * found.
   *
   * @param pendingIds    the ids to locate, never null
   * @param locationHints the last known location of each id, never null
   *
   * @return the handle found for each id, never null
   */
  Map<String, Optional<T>> resolve(Set<String> pendingIds,
      Map<String, String> locationHints);

  /**
   * Expands a raw location into the members found there.
   *
   * <p>A single location may denote zero, one or many members, for
   * example a directory holding the state of several entities.
   *
   * @param location the location to expand, never null
   *
   * @return the members at the location, in a stable order, never null
   */
  List<T> expand(String location);
}
