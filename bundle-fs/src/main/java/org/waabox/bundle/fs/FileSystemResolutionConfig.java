package org.waabox.bundle.fs;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Configuration holder for the {@link FileSystemResolutionClient}.
 *
 * <p>Holds the directories searched for members that moved away from
 * their recorded location, how deep those searches go, and the statefile
 * extension.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileSystemResolutionConfig {

  /** The default search depth. */
  private static final int DEFAULT_MAX_DEPTH = 4;

  /** The default statefile extension. */
  private static final String DEFAULT_EXTENSION = "json";

  /** The directories searched after the hinted location. */
  private final List<Path> searchRoots;

  /** The maximum directory depth of a search. */
  private final int maxDepth;

  /** The statefile extension, without the dot. */
  private final String stateFileExtension;

  /** Private constructor; use {@link #create()} or {@link #builder()}. */
  private FileSystemResolutionConfig(final List<Path> searchRoots,
      final int maxDepth, final String stateFileExtension) {
    this.searchRoots = List.copyOf(searchRoots);
    this.maxDepth = maxDepth;
    this.stateFileExtension = stateFileExtension;
  }

  /**
   * Creates a configuration without extra search roots, a search depth of
   * {@value #DEFAULT_MAX_DEPTH} and the {@value #DEFAULT_EXTENSION}
   * statefile extension.
   *
   * @return a new configuration, never null
   */
  public static FileSystemResolutionConfig create() {
    return builder().build();
  }

  /**
   * Starts a configuration builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the directories searched after the hinted location.
   *
   * @return an unmodifiable list of directories, never null
   */
  public List<Path> searchRoots() {
    return searchRoots;
  }

  /**
   * Returns the maximum directory depth of a search.
   *
   * @return the depth, at least 1
   */
  public int maxDepth() {
    return maxDepth;
  }

  /**
   * Returns the statefile extension, without the dot.
   *
   * @return the extension, never null
   */
  public String stateFileExtension() {
    return stateFileExtension;
  }

  /** A fluent builder for {@link FileSystemResolutionConfig}. */
  public static final class Builder {

    /** The search roots. */
    private final List<Path> searchRoots = new ArrayList<>();

    /** The search depth. */
    private int maxDepth = DEFAULT_MAX_DEPTH;

    /** The statefile extension. */
    private String stateFileExtension = DEFAULT_EXTENSION;

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Adds a directory to search for moved members.
     *
     * @param root the directory, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder searchRoot(final Path root) {
      Objects.requireNonNull(root, "root must not be null");
      searchRoots.add(root.toAbsolutePath().normalize());
      return this;
    }

    /**
     * Adds directories to search for moved members.
     *
     * @param roots the directories, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder searchRoots(final Collection<Path> roots) {
      Objects.requireNonNull(roots, "roots must not be null");
      roots.forEach(this::searchRoot);
      return this;
    }

    /**
     * Sets how many directory levels a search descends.
     *
     * @param theMaxDepth the depth, must be greater than zero
     *
     * @return this builder for chaining, never null
     *
     * @throws IllegalArgumentException if theMaxDepth is not positive
     */
    public Builder maxDepth(final int theMaxDepth) {
      if (theMaxDepth <= 0) {
        throw new IllegalArgumentException(
            "maxDepth must be greater than 0, got: " + theMaxDepth);
      }
      this.maxDepth = theMaxDepth;
      return this;
    }

    /**
     * Sets the statefile extension.
     *
     * @param extension the extension without the dot, never null or empty
     *
     * @return this builder for chaining, never null
     *
     * @throws IllegalArgumentException if extension is empty
     */
    public Builder stateFileExtension(final String extension) {
      Objects.requireNonNull(extension, "extension must not be null");
      if (extension.isEmpty()) {
        throw new IllegalArgumentException("extension must not be empty");
      }
      this.stateFileExtension = extension;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return a new configuration, never null
     */
    public FileSystemResolutionConfig build() {
      return new FileSystemResolutionConfig(searchRoots, maxDepth,
          stateFileExtension);
    }
  }
}
