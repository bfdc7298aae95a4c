package org.waabox.bundle.fs;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The statefile naming convention: {@code <Kind>.<uuid>.<extension>}.
 *
 * <p>For example {@code Sim.3f2a4b1c-5d6e-4f70-8192-a3b4c5d6e7f8.json}
 * is the statefile of a Sim whose id is the given UUID.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class StateFileNaming {

  /** The kind group of a statefile name. */
  private static final String KIND = "[A-Za-z][A-Za-z0-9_]*";

  /** The id group of a statefile name: a textual UUID. */
  private static final String ID =
      "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}"
          + "-[0-9a-fA-F]{12}";

  /** The statefile extension, without the dot. */
  private final String extension;

  /** The compiled statefile name pattern. */
  private final Pattern pattern;

  /**
   * Creates the naming convention for the given extension.
   *
   * @param extension the statefile extension, without the dot, never null
   */
  StateFileNaming(final String extension) {
    this.extension = Objects.requireNonNull(extension,
        "extension must not be null");
    this.pattern = Pattern.compile("^(" + KIND + ")\\.(" + ID + ")\\."
        + Pattern.quote(extension) + "$");
  }

  /**
   * Returns the statefile name of an entity.
   *
   * @param kind the entity kind, never null
   * @param id   the entity id, never null
   *
   * @return the file name, never null
   */
  String fileName(final String kind, final String id) {
    return kind + "." + id + "." + extension;
  }

  /**
   * Reads the entity handle out of a statefile path.
   *
   * @param file the candidate file, never null
   *
   * @return the handle, or empty if the file is not a statefile
   */
  Optional<Container> parse(final Path file) {
    final Path name = file.getFileName();
    if (name == null) {
      return Optional.empty();
    }
    final Matcher matcher = pattern.matcher(name.toString());
    if (!matcher.matches()) {
      return Optional.empty();
    }
    return Optional.of(Container.of(matcher.group(1), matcher.group(2),
        file));
  }
}
