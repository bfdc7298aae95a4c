package org.waabox.bundle;

/**
 * Thrown when a member record column is longer than the configured
 * {@link RecordLimits}. Values are never truncated.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RecordLimitExceededException
    extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception for the given column.
   *
   * @param column    the column name (id, kind or location), cannot be null.
   * @param length    the actual length of the value.
   * @param maxLength the configured maximum length.
   */
  public RecordLimitExceededException(final String column, final int length,
      final int maxLength) {
    super("Member " + column + " is " + length
        + " characters long, maximum is " + maxLength);
  }
}
