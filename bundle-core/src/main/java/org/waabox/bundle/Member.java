package org.waabox.bundle;

import java.nio.file.Path;
import java.util.Optional;

/**
 * The capability set of an entity that a {@link Catalog} can track.
 *
 * <p>A member is a live handle to a persistent entity. It exposes a stable
 * id, an immutable kind and the location the entity currently lives at.
 * The catalog never mutates a member; it only replaces cached handles
 * wholesale when a member is resolved again.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface Member {

  /**
   * Returns the stable identifier of this member.
   *
   * @return the id, never null
   */
  String id();

  /**
   * Returns the type tag of this member. The kind never changes once the
   * member is tracked.
   *
   * @return the kind, never null
   */
  String kind();

  /**
   * Returns the current location of this member in the filesystem.
   *
   * @return the location, never null
   */
  String location();

  /**
   * Returns the display name of this member.
   *
   * <p>Defaults to the last segment of {@link #location()}.
   *
   * @return the display name, empty if the location has no name segment
   */
  default Optional<String> name() {
    final Path fileName = Path.of(location()).getFileName();
    if (fileName == null) {
      return Optional.empty();
    }
    return Optional.of(fileName.toString());
  }
}
