package org.waabox.bundle;

/**
 * Base exception for catalog operations that fail as a whole.
 *
 * <p>This is an unchecked exception. It wraps failures of caller supplied
 * code (for example a function applied through
 * {@link Catalog#map(java.util.function.Function, int)}) so the original
 * cause stays reachable through {@link #getCause()}.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CatalogException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public CatalogException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
