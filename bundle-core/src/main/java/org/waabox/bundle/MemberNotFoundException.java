package org.waabox.bundle;

import java.util.Objects;

/**
 * Thrown when a member recorded in the catalog cannot be located by the
 * {@link ResolutionClient}, neither at its recorded location nor through
 * the client's fallback search.
 *
 * <p>The catalog never returns holes when it materializes its members: the
 * caller has to either re-add the member from its new location or remove
 * it.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MemberNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** The ordinal position of the member in the catalog. */
  private final int position;

  /** The id of the member that could not be found. */
  private final String memberId;

  /**
   * Creates a new exception for the member at the given position.
   *
   * @param position the ordinal position of the member, zero based.
   * @param memberId the id of the missing member, cannot be null.
   */
  public MemberNotFoundException(final int position, final String memberId) {
    super("Could not find member " + position + " (id: "
        + Objects.requireNonNull(memberId, "memberId") + ");"
        + " re-add or remove it.");
    this.position = position;
    this.memberId = memberId;
  }

  /**
   * Returns the ordinal position of the missing member.
   *
   * @return the zero based position
   */
  public int position() {
    return position;
  }

  /**
   * Returns the id of the missing member.
   *
   * @return the member id, never null
   */
  public String memberId() {
    return memberId;
  }
}
