package org.waabox.bundle;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One argument of {@link Catalog#add(Object...)}, classified once at the
 * boundary.
 *
 * <p>Every argument is either a member handle, a raw location that the
 * {@link ResolutionClient} expands into handles, or a collection of further
 * arguments. Parsing happens before the catalog is touched, so an invalid
 * argument anywhere in the call leaves the catalog unchanged.
 *
 * @param <T> the member type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
interface MemberSource<T extends Member> {

  /**
   * Appends the members this source stands for to the given list.
   *
   * @param client the client used to expand locations, never null
   * @param out    the list to append to, never null
   */
  void collect(ResolutionClient<T> client, List<T> out);

  /**
   * Classifies an argument given to {@link Catalog#add(Object...)}.
   *
   * <p>{@code null} is accepted and stands for no members. Paths are
   * checked before iterables, since {@link Path} is itself iterable.
   *
   * @param item the argument, may be null
   * @param type the member type of the catalog, never null
   * @param <T>  the member type
   *
   * @return the classified source, never null
   *
   * @throws InvalidMemberArgumentException if the argument is of no
   *                                        accepted type
   */
  static <T extends Member> MemberSource<T> parse(final Object item,
      final Class<T> type) {
    if (item == null) {
      return new Nested<>(List.of());
    }
    if (type.isInstance(item)) {
      return new Handle<>(type.cast(item));
    }
    if (item instanceof CharSequence location) {
      return new Location<>(location.toString());
    }
    if (item instanceof Path path) {
      return new Location<>(path.toString());
    }
    if (item instanceof Iterable<?> items) {
      final List<MemberSource<T>> children = new ArrayList<>();
      for (final Object child : items) {
        children.add(parse(child, type));
      }
      return new Nested<>(children);
    }
    if (item instanceof Object[] array) {
      return parse(Arrays.asList(array), type);
    }
    throw new InvalidMemberArgumentException("add",
        type.getSimpleName() + " instances, locations or collections of them",
        item);
  }

  /**
   * A live handle, registered as is.
   *
   * @param member the handle, never null
   * @param <T>    the member type
   */
  record Handle<T extends Member>(T member) implements MemberSource<T> {

    @Override
    public void collect(final ResolutionClient<T> client, final List<T> out) {
      out.add(member);
    }
  }

  /**
   * A raw location, expanded through the resolution client.
   *
   * @param location the location, never null
   * @param <T>      the member type
   */
  record Location<T extends Member>(String location)
      implements MemberSource<T> {

    @Override
    public void collect(final ResolutionClient<T> client, final List<T> out) {
      final List<T> expanded = Objects.requireNonNull(
          client.expand(location),
          "ResolutionClient.expand() must not return null");
      out.addAll(expanded);
    }
  }

  /**
   * A collection of further sources, flattened in order.
   *
   * @param children the nested sources, never null
   * @param <T>      the member type
   */
  record Nested<T extends Member>(List<MemberSource<T>> children)
      implements MemberSource<T> {

    @Override
    public void collect(final ResolutionClient<T> client, final List<T> out) {
      for (final MemberSource<T> child : children) {
        child.collect(client, out);
      }
    }
  }
}
