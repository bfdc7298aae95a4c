package org.waabox.bundle;

import java.nio.file.AccessDeniedException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.bundle.metrics.CatalogMetrics;
import org.waabox.bundle.metrics.NoopCatalogMetrics;
import org.waabox.bundle.store.MemberStore;

/**
 * An ordered, indexable collection of persistent members.
 *
 * <p>A Catalog keeps a {@link MemberTable} with the id, kind and last known
 * location of every member, and an {@link ObjectCache} of live handles.
 * Handles are resolved lazily: whenever members are materialized, cache
 * misses are handed to the {@link ResolutionClient} in a single call. Every
 * member found is cached and its recorded location is corrected if it
 * moved. A member that cannot be found fails the whole materialization
 * with a {@link MemberNotFoundException}.
 *
 * <p>Instances are created through the fluent builder starting with
 * {@link #of(Class)}:
 * <pre>{@code
 * Catalog<Container> catalog = Catalog.of(Container.class)
 *     .resolveWith(new FileSystemResolutionClient(config))
 *     .members("/data/sims", simA, groupB)
 *     .build();
 *
 * catalog.remove(0);
 * List<Path> statefiles = catalog.map(Container::stateFile, 4);
 * }</pre>
 *
 * <p>A Catalog is not thread-safe. It exclusively owns its table and cache;
 * the only parallel operation is {@link #map(Function, int)}, whose
 * workers never touch either of them.
 *
 * @param <T> the type of members held in this catalog
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Catalog<T extends Member> implements Iterable<T> {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(Catalog.class);

  /** The member type, used to recognize handles among add arguments. */
  private final Class<T> type;

  /** The client that locates members that are not cached. */
  private final ResolutionClient<T> resolutionClient;

  /** The membership table, authoritative for membership and order. */
  private final MemberTable table;

  /** The cache of resolved handles. */
  private final ObjectCache<T> cache;

  /** The column limits, shared with slices. */
  private final RecordLimits limits;

  /** The optional durable mirror of the table, null if not configured. */
  private final MemberStore memberStore;

  /** The metrics reporter. */
  private final CatalogMetrics metrics;

  /** Applies functions to the members. */
  private final ParallelMapper mapper;

  /**
   * Creates a new, empty Catalog.
   *
   * @param type             the member type, never null
   * @param resolutionClient the resolution client, never null
   * @param limits           the record limits, never null
   * @param memberStore      the optional member store, may be null
   * @param metrics          the metrics reporter, never null
   */
  private Catalog(final Class<T> type,
      final ResolutionClient<T> resolutionClient,
      final RecordLimits limits,
      final MemberStore memberStore,
      final CatalogMetrics metrics) {
    this.type = type;
    this.resolutionClient = resolutionClient;
    this.limits = limits;
    this.memberStore = memberStore;
    this.metrics = metrics;
    this.table = new MemberTable(limits);
    this.cache = new ObjectCache<>();
    this.mapper = new ParallelMapper();
  }

  /**
   * Starts the fluent builder for a new Catalog of the given member type.
   *
   * @param type the class of the members, never null
   * @param <T>  the type of members
   *
   * @return the first step of the builder chain, never null
   *
   * @throws NullPointerException if type is null
   */
  public static <T extends Member> ResolverStep<T> of(final Class<T> type) {
    Objects.requireNonNull(type, "type must not be null");
    return new ResolverStep<>(type);
  }

  /**
   * Adds members to this catalog.
   *
   * <p>Each item may be a member handle, a location ({@link CharSequence}
   * or {@link java.nio.file.Path}) that is expanded into the members found
   * there, or a collection of items (another Catalog, any
   * {@link Iterable}, an array), which is flattened. {@code null} items
   * are ignored. Adding a member that is already present only updates its
   * recorded location.
   *
   * @param items the items to add, may be null
   *
   * @throws InvalidMemberArgumentException if an item is of no accepted
   *                                        type; nothing is added then
   * @throws RecordLimitExceededException   if a member does not fit the
   *                                        record limits; nothing is added
   *                                        then
   */
  public void add(final Object... items) {
    if (items == null) {
      return;
    }
    final List<MemberSource<T>> sources = new ArrayList<>(items.length);
    for (final Object item : items) {
      sources.add(MemberSource.parse(item, type));
    }

    final List<T> members = new ArrayList<>();
    for (final MemberSource<T> source : sources) {
      source.collect(resolutionClient, members);
    }
    for (final T member : members) {
      table.check(member.id(), member.kind(), member.location());
    }
    for (final T member : members) {
      register(member);
    }
    log.debug("Added {} member(s), catalog holds {}", members.size(),
        table.size());
  }

  /**
   * Removes members from this catalog.
   *
   * <p>Each member is given either as its {@link Integer} position in
   * {@link #ids()} order or as a handle. Members given as handles that are
   * not in the catalog are ignored. All arguments are checked before
   * anything is removed.
   *
   * @param members the positions or handles of the members to remove,
   *                never null
   *
   * @throws InvalidMemberArgumentException if an argument is neither an
   *                                        Integer nor a member handle
   * @throws IndexOutOfBoundsException      if a position is out of range
   */
  public void remove(final Object... members) {
    Objects.requireNonNull(members, "members must not be null");
    final List<String> ids = table.ids();
    final Set<String> doomed = new LinkedHashSet<>();
    for (final Object member : members) {
      if (member instanceof Integer position) {
        doomed.add(ids.get(Objects.checkIndex(position, ids.size())));
      } else if (type.isInstance(member)) {
        doomed.add(type.cast(member).id());
      } else {
        throw new InvalidMemberArgumentException("remove",
            "an integer position or a " + type.getSimpleName(), member);
      }
    }

    table.delete(doomed);
    cache.evict(doomed);
    if (memberStore != null) {
      memberStore.delete(Collections.unmodifiableSet(doomed));
    }
    log.debug("Removed {} member(s), catalog holds {}", doomed.size(),
        table.size());
  }

  /** Removes every member from this catalog. */
  public void removeAll() {
    table.deleteAll();
    cache.clear();
    if (memberStore != null) {
      memberStore.deleteAll();
    }
  }

  /**
   * Returns the member at the given position, resolving only that member.
   *
   * @param index the position of the member, zero based
   *
   * @return the member, never null
   *
   * @throws IndexOutOfBoundsException if index is out of range
   * @throws MemberNotFoundException   if the member cannot be found
   */
  public T get(final int index) {
    Objects.checkIndex(index, table.size());
    return materialize(index, index + 1).get(0);
  }

  /**
   * Returns a new Catalog with the members in the given range.
   *
   * <p>The new catalog shares this catalog's resolution client, record
   * limits and metrics but not its member store. This catalog is left
   * untouched.
   *
   * @param fromIndex the first position, inclusive
   * @param toIndex   the last position, exclusive
   *
   * @return the new catalog, never null
   *
   * @throws IndexOutOfBoundsException if the range is out of bounds
   * @throws MemberNotFoundException   if a member in the range cannot be
   *                                   found
   */
  public Catalog<T> slice(final int fromIndex, final int toIndex) {
    Objects.checkFromToIndex(fromIndex, toIndex, table.size());
    final Catalog<T> slice = new Catalog<>(type, resolutionClient, limits,
        null, metrics);
    for (final T member : materialize(fromIndex, toIndex)) {
      slice.register(member);
      slice.cache.put(member);
    }
    return slice;
  }

  /**
   * Returns every member, in catalog order.
   *
   * <p>Modifying the returned list does not modify the catalog.
   *
   * @return the members, never null
   *
   * @throws MemberNotFoundException      if any member cannot be found
   * @throws RecordLimitExceededException if a member moved to a location
   *                                      that does not fit the limits
   */
  public List<T> list() {
    return materialize(0, table.size());
  }

  /**
   * Iterates over the members as returned by {@link #list()}.
   *
   * @return an iterator over the resolved members, never null
   *
   * @throws MemberNotFoundException if any member cannot be found
   */
  @Override
  public Iterator<T> iterator() {
    return list().iterator();
  }

  /**
   * Returns the number of members, without resolving any of them.
   *
   * @return the member count
   */
  public int size() {
    return table.size();
  }

  /**
   * Whether this catalog has no members.
   *
   * @return true if empty
   */
  public boolean isEmpty() {
    return table.isEmpty();
  }

  /**
   * Returns the member ids, in catalog order.
   *
   * @return an unmodifiable list of ids, never null
   */
  public List<String> ids() {
    return table.ids();
  }

  /**
   * Returns the member kinds, in catalog order.
   *
   * @return an unmodifiable list of kinds, never null
   */
  public List<String> kinds() {
    return table.kinds();
  }

  /**
   * Returns the recorded member locations, in catalog order.
   *
   * @return an unmodifiable list of locations, never null
   */
  public List<String> locations() {
    return table.locations();
  }

  /**
   * Returns the member names, in catalog order.
   *
   * <p>Unlike {@link #list()}, members that cannot be found do not fail
   * the call: their name is empty. Missing members are looked for again on
   * every call.
   *
   * @return an unmodifiable list of names, never null
   */
  public List<Optional<String>> names() {
    final List<Optional<String>> names = new ArrayList<>(table.size());
    for (final Optional<T> member : resolve(0, table.size(), false)) {
      names.add(member.flatMap(Member::name));
    }
    return Collections.unmodifiableList(names);
  }

  /**
   * Applies a function to every member, in member order.
   *
   * @param function the function to apply, never null
   * @param <R>      the result type
   *
   * @return one result per member, in member order, never null
   *
   * @throws MemberNotFoundException if any member cannot be found
   * @throws CatalogException        if the function fails for any member
   */
  public <R> List<R> map(final Function<? super T, ? extends R> function) {
    return map(function, 1);
  }

  /**
   * Applies a function to every member, using up to {@code concurrency}
   * worker threads.
   *
   * <p>The result order always matches the member order, whatever the
   * concurrency. The first failure fails the whole call; no partial
   * results are returned.
   *
   * @param function    the function to apply, never null
   * @param concurrency the number of workers; 1 applies the function on
   *                    the calling thread
   * @param <R>         the result type
   *
   * @return one result per member, in member order, never null
   *
   * @throws IllegalArgumentException if concurrency is less than 1
   * @throws MemberNotFoundException  if any member cannot be found
   * @throws CatalogException         if the function fails for any member
   */
  public <R> List<R> map(final Function<? super T, ? extends R> function,
      final int concurrency) {
    Objects.requireNonNull(function, "function must not be null");
    ParallelMapper.checkConcurrency(concurrency);

    final long start = System.nanoTime();
    final List<T> members = list();
    final List<R> results = mapper.map(members, function, concurrency);
    metrics.mapCompleted(members.size(), concurrency,
        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    return results;
  }

  /**
   * Returns a summary of this catalog. Nothing is resolved.
   *
   * @return the catalog info, never null
   */
  public CatalogInfo info() {
    final Map<String, Integer> byKind = new LinkedHashMap<>();
    for (final String kind : table.kinds()) {
      byKind.merge(kind, 1, Integer::sum);
    }
    return new CatalogInfo(table.size(), cache.size(), byKind);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "Catalog" + table.ids();
  }

  /**
   * Records a member in the table and the member store.
   *
   * @param member the member, never null
   */
  private void register(final T member) {
    table.upsert(member.id(), member.kind(), member.location());
    if (memberStore != null) {
      memberStore.upsert(table.get(member.id()).orElseThrow());
    }
  }

  /**
   * Resolves the members in the given range, failing on the first one
   * that cannot be found.
   *
   * @param fromIndex the first position, inclusive
   * @param toIndex   the last position, exclusive
   *
   * @return the members, never null
   */
  private List<T> materialize(final int fromIndex, final int toIndex) {
    final List<T> members = new ArrayList<>(toIndex - fromIndex);
    for (final Optional<T> member : resolve(fromIndex, toIndex, true)) {
      members.add(member.orElseThrow());
    }
    return members;
  }

  /**
   * Resolves the members in the given range.
   *
   * <p>Cached handles are used as is. All misses are handed to the
   * resolution client in one call. In strict mode any member the client
   * could not find fails the call before the cache or table is touched;
   * otherwise it is returned as empty. Every member found is cached and
   * its recorded location refreshed, once all the new locations fit the
   * record limits.
   *
   * @param fromIndex the first position, inclusive
   * @param toIndex   the last position, exclusive
   * @param strict    whether a missing member fails the call
   *
   * @return one entry per position in the range, never null
   *
   * @throws RecordLimitExceededException if a member moved to a location
   *                                      that does not fit; the cache and
   *                                      table are left untouched
   */
  private List<Optional<T>> resolve(final int fromIndex, final int toIndex,
      final boolean strict) {
    final List<MemberRecord> rows = table.snapshot().subList(fromIndex,
        toIndex);
    final List<Optional<T>> members = new ArrayList<>(rows.size());
    final Map<String, String> hints = new LinkedHashMap<>();
    final Map<String, Integer> offsets = new HashMap<>();

    for (int i = 0; i < rows.size(); i++) {
      final MemberRecord row = rows.get(i);
      final Optional<T> cached = cache.get(row.id());
      members.add(cached);
      if (cached.isEmpty()) {
        hints.put(row.id(), row.location());
        offsets.put(row.id(), i);
      }
    }
    metrics.cacheHits(rows.size() - hints.size());

    if (hints.isEmpty()) {
      return members;
    }

    final Map<String, Optional<T>> found = Objects.requireNonNull(
        resolutionClient.resolve(
            Collections.unmodifiableSet(new LinkedHashSet<>(hints.keySet())),
            Collections.unmodifiableMap(hints)),
        "ResolutionClient.resolve() must not return null");

    final Map<String, T> resolved = new LinkedHashMap<>();
    for (final String id : hints.keySet()) {
      final Optional<T> handle = found.get(id);
      if (handle != null && handle.isPresent()) {
        if (!id.equals(handle.get().id())) {
          throw new IllegalStateException("ResolutionClient returned member '"
              + handle.get().id() + "' for id '" + id + "'");
        }
        resolved.put(id, handle.get());
      }
    }
    metrics.membersResolved(hints.size(), resolved.size());
    log.debug("Resolved {} of {} uncached member(s)", resolved.size(),
        hints.size());

    if (strict) {
      for (final String id : hints.keySet()) {
        if (!resolved.containsKey(id)) {
          throw new MemberNotFoundException(fromIndex + offsets.get(id), id);
        }
      }
    }

    for (final T handle : resolved.values()) {
      table.check(handle.id(), handle.kind(), handle.location());
    }
    for (final T handle : resolved.values()) {
      refreshLocation(handle);
      cache.put(handle);
      members.set(offsets.get(handle.id()), Optional.of(handle));
    }
    return members;
  }

  /**
   * Records the current location of a freshly resolved member.
   *
   * <p>Permission failures of the member store are logged and ignored:
   * the handle is valid whether or not its new location could be
   * persisted.
   *
   * @param handle the resolved member, never null
   */
  private void refreshLocation(final T handle) {
    final String previous = table.get(handle.id())
        .map(MemberRecord::location)
        .orElse(null);
    table.upsert(handle.id(), handle.kind(), handle.location());
    final MemberRecord current = table.get(handle.id()).orElseThrow();

    if (current.location().equals(previous)) {
      return;
    }
    log.info("Member '{}' moved from {} to {}", handle.id(), previous,
        current.location());
    metrics.locationHealed(handle.id(), String.valueOf(previous),
        current.location());

    if (memberStore == null) {
      return;
    }
    try {
      memberStore.upsert(current);
    } catch (final RuntimeException e) {
      if (!isPermissionFailure(e)) {
        throw e;
      }
      log.warn("Could not store new location of member '{}': {}",
          handle.id(), e.getMessage());
    }
  }

  /**
   * Whether the given failure, or any of its causes, is a permission
   * failure.
   *
   * @param failure the failure to inspect, never null
   *
   * @return true if access was denied
   */
  private static boolean isPermissionFailure(final Throwable failure) {
    for (Throwable t = failure; t != null; t = t.getCause()) {
      if (t instanceof SecurityException
          || t instanceof AccessDeniedException) {
        return true;
      }
    }
    return false;
  }

  /**
   * First step of the Catalog builder: collects the resolution client.
   *
   * @param <T> the type of members
   */
  public static final class ResolverStep<T extends Member> {

    /** The member type. */
    private final Class<T> type;

    /**
     * Creates a new ResolverStep.
     *
     * @param type the member type, never null
     */
    private ResolverStep(final Class<T> type) {
      this.type = type;
    }

    /**
     * Sets the client used to locate and expand members.
     *
     * @param client the resolution client, never null
     *
     * @return the next step in the builder chain, never null
     *
     * @throws NullPointerException if client is null
     */
    public BuildStep<T> resolveWith(final ResolutionClient<T> client) {
      Objects.requireNonNull(client, "client must not be null");
      return new BuildStep<>(type, client);
    }
  }

  /**
   * Final step of the Catalog builder: collects optional configuration
   * and the initial members, then builds the Catalog.
   *
   * @param <T> the type of members
   */
  public static final class BuildStep<T extends Member> {

    /** The member type. */
    private final Class<T> type;

    /** The resolution client. */
    private final ResolutionClient<T> client;

    /** The initial members, in the form accepted by add. */
    private final List<Object> initialMembers;

    /** The record limits. */
    private RecordLimits limits;

    /** The optional member store. */
    private MemberStore memberStore;

    /** The optional metrics reporter. */
    private CatalogMetrics metrics;

    /**
     * Creates a new BuildStep.
     *
     * @param type   the member type, never null
     * @param client the resolution client, never null
     */
    private BuildStep(final Class<T> type, final ResolutionClient<T> client) {
      this.type = type;
      this.client = client;
      this.initialMembers = new ArrayList<>();
    }

    /**
     * Sets the record limits. Defaults to
     * {@link RecordLimits#defaultLimits()}.
     *
     * @param theLimits the record limits, never null
     *
     * @return this builder step for chaining, never null
     *
     * @throws NullPointerException if theLimits is null
     */
    public BuildStep<T> limits(final RecordLimits theLimits) {
      Objects.requireNonNull(theLimits, "limits must not be null");
      this.limits = theLimits;
      return this;
    }

    /**
     * Sets a durable mirror that receives every change of the member
     * table.
     *
     * @param theMemberStore the member store, never null
     *
     * @return this builder step for chaining, never null
     *
     * @throws NullPointerException if theMemberStore is null
     */
    public BuildStep<T> mirrorTo(final MemberStore theMemberStore) {
      Objects.requireNonNull(theMemberStore, "memberStore must not be null");
      this.memberStore = theMemberStore;
      return this;
    }

    /**
     * Sets the metrics reporter. Defaults to {@link NoopCatalogMetrics}.
     *
     * @param theMetrics the metrics reporter, never null
     *
     * @return this builder step for chaining, never null
     *
     * @throws NullPointerException if theMetrics is null
     */
    public BuildStep<T> metrics(final CatalogMetrics theMetrics) {
      Objects.requireNonNull(theMetrics, "metrics must not be null");
      this.metrics = theMetrics;
      return this;
    }

    /**
     * Adds initial members, accepting everything {@link Catalog#add}
     * accepts.
     *
     * @param items the initial members, may be null
     *
     * @return this builder step for chaining, never null
     */
    public BuildStep<T> members(final Object... items) {
      if (items != null) {
        initialMembers.addAll(Arrays.asList(items));
      }
      return this;
    }

    /**
     * Builds the Catalog and adds the initial members.
     *
     * @return a new Catalog instance, never null
     *
     * @throws InvalidMemberArgumentException if an initial member is of no
     *                                        accepted type
     */
    public Catalog<T> build() {
      final RecordLimits resolvedLimits = limits != null
          ? limits : RecordLimits.defaultLimits();
      final CatalogMetrics resolvedMetrics = metrics != null
          ? metrics : new NoopCatalogMetrics();

      final Catalog<T> catalog = new Catalog<>(type, client, resolvedLimits,
          memberStore, resolvedMetrics);
      catalog.add(initialMembers.toArray());
      return catalog;
    }
  }
}
