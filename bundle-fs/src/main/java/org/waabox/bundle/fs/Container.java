package org.waabox.bundle.fs;

import java.nio.file.Path;
import java.util.Objects;

import org.waabox.bundle.Member;

/**
 * A live handle to an entity stored on the local filesystem.
 *
 * <p>An entity lives in a base directory that holds its statefile. The
 * statefile name carries the entity kind and id; the base directory is
 * the entity location, and its name is the entity name.
 *
 * @param id        the entity id, never null
 * @param kind      the entity kind, never null
 * @param location  the absolute base directory, never null
 * @param stateFile the absolute path of the statefile, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Container(String id, String kind, String location,
    Path stateFile) implements Member {

  /**
   * Creates a new Container.
   *
   * @throws NullPointerException if any component is null
   */
  public Container {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(location, "location must not be null");
    Objects.requireNonNull(stateFile, "stateFile must not be null");
  }

  /**
   * Creates the handle of the entity owning the given statefile.
   *
   * @param kind      the entity kind, never null
   * @param id        the entity id, never null
   * @param stateFile the statefile, never null
   *
   * @return the handle, never null
   */
  static Container of(final String kind, final String id,
      final Path stateFile) {
    final Path absolute = stateFile.toAbsolutePath().normalize();
    return new Container(id, kind, absolute.getParent().toString(),
        absolute);
  }
}
