package org.waabox.bundle;

/**
 * Maximum lengths of the {@link MemberRecord} columns.
 *
 * <p>The defaults match the member table schema of the statefiles that
 * usually back a catalog: 36 characters for ids (a textual UUID), 55 for
 * kinds and 511 for locations.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RecordLimits {

  /** The default maximum id length. */
  private static final int DEFAULT_ID_LENGTH = 36;

  /** The default maximum kind length. */
  private static final int DEFAULT_KIND_LENGTH = 55;

  /** The default maximum location length. */
  private static final int DEFAULT_LOCATION_LENGTH = 511;

  /** The maximum id length. */
  private final int maxIdLength;

  /** The maximum kind length. */
  private final int maxKindLength;

  /** The maximum location length. */
  private final int maxLocationLength;

  /**
   * Creates a new RecordLimits.
   *
   * @param maxIdLength       the maximum id length
   * @param maxKindLength     the maximum kind length
   * @param maxLocationLength the maximum location length
   */
  private RecordLimits(final int maxIdLength, final int maxKindLength,
      final int maxLocationLength) {
    this.maxIdLength = maxIdLength;
    this.maxKindLength = maxKindLength;
    this.maxLocationLength = maxLocationLength;
  }

  /**
   * Creates limits with the given maximum lengths.
   *
   * @param maxIdLength       the maximum id length, must be positive
   * @param maxKindLength     the maximum kind length, must be positive
   * @param maxLocationLength the maximum location length, must be positive
   *
   * @return the limits, never null
   *
   * @throws IllegalArgumentException if any length is not positive
   */
  public static RecordLimits of(final int maxIdLength,
      final int maxKindLength, final int maxLocationLength) {
    if (maxIdLength <= 0 || maxKindLength <= 0 || maxLocationLength <= 0) {
      throw new IllegalArgumentException(
          "Record limits must be greater than 0, got: " + maxIdLength + ", "
              + maxKindLength + ", " + maxLocationLength);
    }
    return new RecordLimits(maxIdLength, maxKindLength, maxLocationLength);
  }

  /**
   * Returns the default limits (36, 55, 511).
   *
   * @return the default limits, never null
   */
  public static RecordLimits defaultLimits() {
    return new RecordLimits(DEFAULT_ID_LENGTH, DEFAULT_KIND_LENGTH,
        DEFAULT_LOCATION_LENGTH);
  }

  /**
   * Checks every column of the given record against these limits.
   *
   * @param memberRecord the record to check, never null
   *
   * @throws RecordLimitExceededException if a column is too long
   */
  public void validate(final MemberRecord memberRecord) {
    check("id", memberRecord.id(), maxIdLength);
    check("kind", memberRecord.kind(), maxKindLength);
    check("location", memberRecord.location(), maxLocationLength);
  }

  /**
   * Returns the maximum id length.
   *
   * @return the maximum id length
   */
  public int maxIdLength() {
    return maxIdLength;
  }

  /**
   * Returns the maximum kind length.
   *
   * @return the maximum kind length
   */
  public int maxKindLength() {
    return maxKindLength;
  }

  /**
   * Returns the maximum location length.
   *
   * @return the maximum location length
   */
  public int maxLocationLength() {
    return maxLocationLength;
  }

  private static void check(final String column, final String value,
      final int max) {
    if (value.length() > max) {
      throw new RecordLimitExceededException(column, value.length(), max);
    }
  }
}
