package org.waabox.bundle.store;

import java.util.Set;

import org.waabox.bundle.MemberRecord;

/**
 * A durable mirror of a catalog's member table.
 *
 * <p>Implementations decide where member rows are kept (a statefile, a
 * database table, ...). The catalog writes through to the store on every
 * table change; the in-memory table stays authoritative for the lifetime
 * of the catalog.
 *
 * <p>Failures are reported as unchecked exceptions, typically
 * {@link java.io.UncheckedIOException}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface MemberStore {

  /**
   * Saves a member row, replacing the row with the same id if any.
   *
   * @param memberRecord the row to save, never null
   */
  void upsert(MemberRecord memberRecord);

  /**
   * Deletes the rows with the given ids. Unknown ids are ignored.
   *
   * @param ids the ids to delete, never null
   */
  void delete(Set<String> ids);

  /** Deletes every row. */
  void deleteAll();
}
