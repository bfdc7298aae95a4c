package org.waabox.bundle;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * The in-memory membership table of a {@link Catalog}.
 *
 * <p>Holds one {@link MemberRecord} per member id, in insertion order.
 * Adding an id that is already present only updates its location: the kind
 * of a member is fixed the first time it is added. Lookups, upserts and
 * deletes are constant time on average.
 *
 * <p>The table does no I/O and is never persisted by itself. It is not
 * thread-safe; it is owned by exactly one catalog.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MemberTable {

  /** The rows, keyed by member id, in insertion order. */
  private final Map<String, MemberRecord> rows;

  /** The column limits every row is checked against. */
  private final RecordLimits limits;

  /** Creates an empty table with the {@link RecordLimits#defaultLimits()}. */
  public MemberTable() {
    this(RecordLimits.defaultLimits());
  }

  /**
   * Creates an empty table.
   *
   * @param limits the column limits, never null
   */
  public MemberTable(final RecordLimits limits) {
    this.limits = Objects.requireNonNull(limits, "limits must not be null");
    this.rows = new LinkedHashMap<>();
  }

  /**
   * Adds a member, or updates the location of an existing one.
   *
   * <p>The location is stored as an absolute, normalized path. When the id
   * is already present the given kind is ignored.
   *
   * @param id       the member id, never null
   * @param kind     the member kind, never null
   * @param location the member location, never null
   *
   * @throws RecordLimitExceededException if a column is too long
   */
  public void upsert(final String id, final String kind,
      final String location) {
    final MemberRecord row = rowFor(id, kind, location);
    rows.put(id, row);
  }

  /**
   * Checks that {@link #upsert} would accept the given member, without
   * changing the table.
   *
   * @param id       the member id, never null
   * @param kind     the member kind, never null
   * @param location the member location, never null
   *
   * @throws RecordLimitExceededException if a column is too long
   */
  public void check(final String id, final String kind,
      final String location) {
    rowFor(id, kind, location);
  }

  /**
   * Removes the rows with the given ids. Unknown ids are ignored.
   *
   * @param ids the ids to remove, never null
   */
  public void delete(final Collection<String> ids) {
    Objects.requireNonNull(ids, "ids must not be null");
    for (final String id : ids) {
      rows.remove(id);
    }
  }

  /**
   * Removes the rows with the given ids. Unknown ids are ignored.
   *
   * @param ids the ids to remove, never null
   */
  public void delete(final String... ids) {
    delete(List.of(ids));
  }

  /** Removes every row. */
  public void deleteAll() {
    rows.clear();
  }

  /**
   * Returns the row of the given member.
   *
   * @param id the member id, never null
   *
   * @return the row, or empty if the id is not in the table
   */
  public Optional<MemberRecord> get(final String id) {
    Objects.requireNonNull(id, "id must not be null");
    return Optional.ofNullable(rows.get(id));
  }

  /**
   * Whether the table holds a row for the given id.
   *
   * @param id the member id, never null
   *
   * @return true if the id is in the table
   */
  public boolean contains(final String id) {
    return rows.containsKey(id);
  }

  /**
   * Returns the number of rows.
   *
   * @return the row count
   */
  public int size() {
    return rows.size();
  }

  /**
   * Whether the table has no rows.
   *
   * @return true if empty
   */
  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /**
   * Returns the rows in table order.
   *
   * @return an unmodifiable copy of the rows, never null
   */
  public List<MemberRecord> snapshot() {
    return Collections.unmodifiableList(new ArrayList<>(rows.values()));
  }

  /**
   * Returns the member ids in table order.
   *
   * @return an unmodifiable list of ids, never null
   */
  public List<String> ids() {
    return column(MemberRecord::id);
  }

  /**
   * Returns the member kinds in table order.
   *
   * @return an unmodifiable list of kinds, never null
   */
  public List<String> kinds() {
    return column(MemberRecord::kind);
  }

  /**
   * Returns the member locations in table order.
   *
   * @return an unmodifiable list of locations, never null
   */
  public List<String> locations() {
    return column(MemberRecord::location);
  }

  /**
   * Builds the row an upsert of the given member would store, checked
   * against the limits.
   *
   * @param id       the member id, never null
   * @param kind     the member kind, never null
   * @param location the member location, never null
   *
   * @return the validated row, never null
   *
   * @throws RecordLimitExceededException if a column is too long
   */
  private MemberRecord rowFor(final String id, final String kind,
      final String location) {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(location, "location must not be null");

    final String absolute = absolute(location);
    final MemberRecord existing = rows.get(id);
    final MemberRecord row;
    if (existing == null) {
      row = new MemberRecord(id, kind, absolute);
    } else {
      row = existing.withLocation(absolute);
    }
    limits.validate(row);
    return row;
  }

  /**
   * Projects one column of every row, in table order.
   *
   * @param getter reads the column out of a row, never null
   *
   * @return an unmodifiable list of values, never null
   */
  private List<String> column(final Function<MemberRecord, String> getter) {
    final List<String> values = new ArrayList<>(rows.size());
    for (final MemberRecord row : rows.values()) {
      values.add(getter.apply(row));
    }
    return Collections.unmodifiableList(values);
  }

  /** Turns a location into an absolute, normalized path string. */
  private static String absolute(final String location) {
    return Path.of(location).toAbsolutePath().normalize().toString();
  }
}
