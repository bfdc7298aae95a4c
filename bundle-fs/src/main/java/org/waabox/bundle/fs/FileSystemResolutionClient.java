package org.waabox.bundle.fs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.bundle.ResolutionClient;

/**
 * A {@link ResolutionClient} that finds {@link Container}s on the local
 * filesystem.
 *
 * <p>Each entity lives in its own base directory holding a statefile
 * named {@code <Kind>.<uuid>.<extension>}:
 * <pre>
 * {searchRoot}/
 *   lysozyme/
 *     Sim.3f2a4b1c-5d6e-4f70-8192-a3b4c5d6e7f8.json
 *   barnase/
 *     Sim.9a8b7c6d-5e4f-4a3b-9c2d-1e0f9a8b7c6d.json
 * </pre>
 *
 * <p>A member is first looked up in its hinted directory. Members that are
 * not there are searched for, all at once, in the parent of their hinted
 * directory and then in every configured search root, down to the
 * configured depth. Directories that cannot be read are skipped.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileSystemResolutionClient
    implements ResolutionClient<Container> {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      FileSystemResolutionClient.class);

  /** The configuration, never null. */
  private final FileSystemResolutionConfig config;

  /** The statefile naming convention, never null. */
  private final StateFileNaming naming;

  /** Creates a client with the default configuration. */
  public FileSystemResolutionClient() {
    this(FileSystemResolutionConfig.create());
  }

  /**
   * Creates a client with the given configuration.
   *
   * @param theConfig the configuration, never null
   */
  public FileSystemResolutionClient(
      final FileSystemResolutionConfig theConfig) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    naming = new StateFileNaming(config.stateFileExtension());
  }

  /** {@inheritDoc} */
  @Override
  public Map<String, Optional<Container>> resolve(
      final Set<String> pendingIds,
      final Map<String, String> locationHints) {
    Objects.requireNonNull(pendingIds, "pendingIds must not be null");
    Objects.requireNonNull(locationHints, "locationHints must not be null");

    final Map<String, Optional<Container>> result = new LinkedHashMap<>();
    final Set<String> missing = new LinkedHashSet<>();

    for (final String id : pendingIds) {
      final String hint = locationHints.get(id);
      final Optional<Container> found = hint == null
          ? Optional.empty()
          : lookIn(Path.of(hint), id);
      result.put(id, found);
      if (found.isEmpty()) {
        missing.add(id);
      }
    }

    if (!missing.isEmpty()) {
      final Set<Path> roots = new LinkedHashSet<>();
      for (final String id : missing) {
        final String hint = locationHints.get(id);
        if (hint != null) {
          final Path parent = Path.of(hint).toAbsolutePath().normalize()
              .getParent();
          if (parent != null) {
            roots.add(parent);
          }
        }
      }
      roots.addAll(config.searchRoots());

      log.debug("Searching {} moved member(s) in {}", missing.size(), roots);
      for (final Path root : roots) {
        if (missing.isEmpty()) {
          break;
        }
        search(root, missing, result);
      }
      if (!missing.isEmpty()) {
        log.debug("Could not find members {}", missing);
      }
    }
    return result;
  }

  /** {@inheritDoc} */
  @Override
  public List<Container> expand(final String location) {
    Objects.requireNonNull(location, "location must not be null");
    final Path path = Path.of(location);

    if (Files.isRegularFile(path)) {
      return naming.parse(path).map(List::of).orElse(List.of());
    }
    if (!Files.isDirectory(path)) {
      log.debug("Nothing to expand at {}", path);
      return List.of();
    }
    try (Stream<Path> entries = Files.list(path)) {
      return entries
          .filter(Files::isRegularFile)
          .sorted(Comparator.comparing(p -> p.getFileName().toString()))
          .map(naming::parse)
          .flatMap(Optional::stream)
          .collect(Collectors.toList());
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to list " + path, e);
    }
  }

  /**
   * Looks for the statefile of a member directly inside a directory.
   *
   * @param dir the directory, never null
   * @param id  the member id, never null
   *
   * @return the member, or empty if it is not there
   */
  private Optional<Container> lookIn(final Path dir, final String id) {
    if (!Files.isDirectory(dir)) {
      return Optional.empty();
    }
    try (Stream<Path> entries = Files.list(dir)) {
      return entries
          .map(naming::parse)
          .flatMap(Optional::stream)
          .filter(container -> container.id().equals(id))
          .findFirst();
    } catch (final AccessDeniedException e) {
      log.debug("Skipping unreadable directory {}", dir);
      return Optional.empty();
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to list " + dir, e);
    }
  }

  /**
   * Walks a directory tree once, collecting every missing member found.
   *
   * <p>Found ids are removed from {@code missing}; the walk stops as soon
   * as nothing is left to find.
   *
   * @param root    the directory to walk, never null
   * @param missing the ids still to find, never null
   * @param result  where found members are written, never null
   */
  private void search(final Path root, final Set<String> missing,
      final Map<String, Optional<Container>> result) {
    if (!Files.isDirectory(root)) {
      log.debug("Skipping missing search root {}", root);
      return;
    }
    try {
      Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class),
          config.maxDepth(), new SimpleFileVisitor<>() {

            /** Claims the member of a statefile still being looked for. */
            @Override
            public FileVisitResult visitFile(final Path file,
                final BasicFileAttributes attrs) {
              final Optional<Container> found = naming.parse(file);
              if (found.isPresent() && missing.remove(found.get().id())) {
                result.put(found.get().id(), found);
                if (missing.isEmpty()) {
                  return FileVisitResult.TERMINATE;
                }
              }
              return FileVisitResult.CONTINUE;
            }

            /** Skips paths that cannot be read. */
            @Override
            public FileVisitResult visitFileFailed(final Path file,
                final IOException e) {
              log.debug("Skipping unreadable path {}: {}", file,
                  e.getMessage());
              return FileVisitResult.CONTINUE;
            }
          });
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to search " + root, e);
    }
  }

  /**
   * Returns the statefile name this client recognizes for an entity.
   *
   * @param kind the entity kind, never null
   * @param id   the entity id, never null
   *
   * @return the file name, never null
   */
  public String stateFileName(final String kind, final String id) {
    return naming.fileName(kind, id);
  }
}
