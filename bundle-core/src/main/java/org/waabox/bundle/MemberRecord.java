package org.waabox.bundle;

import java.util.Objects;

/**
 * A row of the {@link MemberTable}: what the catalog durably knows about a
 * member.
 *
 * @param id       the unique member id, never null
 * @param kind     the member type tag, never null
 * @param location the last known absolute location, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record MemberRecord(String id, String kind, String location) {

  /**
   * Creates a new MemberRecord.
   *
   * @throws NullPointerException if any column is null
   */
  public MemberRecord {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(location, "location must not be null");
  }

  /**
   * Returns a copy of this record pointing at the given location.
   *
   * @param newLocation the new location, never null
   *
   * @return a record with the same id and kind, never null
   */
  public MemberRecord withLocation(final String newLocation) {
    return new MemberRecord(id, kind, newLocation);
  }
}
