package org.waabox.bundle;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.waabox.bundle.metrics.CatalogMetrics;
import org.waabox.bundle.store.MemberStore;

/**
 * Tests for {@link Catalog}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class CatalogTest {

  /** A simulation member. */
  private final TestMember a = new TestMember("a", "Sim", "/data/sims/a");

  /** Another simulation member. */
  private final TestMember b = new TestMember("b", "Sim", "/data/sims/b");

  /** A group member. */
  private final TestMember c = new TestMember("c", "Group", "/data/groups/c");

  private Catalog<TestMember> catalogOf(final FakeResolutionClient client,
      final Object... members) {
    return Catalog.of(TestMember.class)
        .resolveWith(client)
        .members(members)
        .build();
  }

  @Test
  void whenBuilding_givenMembers_shouldTrackThemInOrder() {
    final Catalog<TestMember> catalog = catalogOf(
        new FakeResolutionClient(), c, a, b);

    assertEquals(3, catalog.size());
    assertEquals(List.of("c", "a", "b"), catalog.ids());
    assertEquals(List.of("Group", "Sim", "Sim"), catalog.kinds());
    assertEquals(List.of("/data/groups/c", "/data/sims/a", "/data/sims/b"),
        catalog.locations());
  }

  @Test
  void whenAdding_givenSameMemberTwice_shouldRefreshLocationOnly() {
    final Catalog<TestMember> catalog = catalogOf(
        new FakeResolutionClient(), a);

    catalog.add(a.movedTo("/data/elsewhere/a"));

    assertEquals(1, catalog.size());
    assertEquals(List.of("/data/elsewhere/a"), catalog.locations());
  }

  @Test
  void whenAdding_givenLocationWithTwoMembers_shouldGrowByTwo() {
    final FakeResolutionClient client = new FakeResolutionClient()
        .place(a, b, c);
    final Catalog<TestMember> catalog = catalogOf(client, c);

    catalog.add("/data/sims");

    assertEquals(3, catalog.size());
    assertEquals(List.of("c", "a", "b"), catalog.ids());
  }

  @Test
  void whenAdding_givenPathOfMissingLocation_shouldAddNothing() {
    final Catalog<TestMember> catalog = catalogOf(
        new FakeResolutionClient());

    catalog.add(Path.of("/nowhere"));

    assertTrue(catalog.isEmpty());
  }

  @Test
  void whenAdding_givenNestedCollectionsAndNulls_shouldFlattenThem() {
    final FakeResolutionClient client = new FakeResolutionClient()
        .place(a, b, c);
    final Catalog<TestMember> other = catalogOf(client, b);
    final Catalog<TestMember> catalog = catalogOf(client);

    catalog.add(null, List.of(a, List.of(other)), new Object[] {c, null});
    catalog.add((Object[]) null);

    assertEquals(List.of("a", "b", "c"), catalog.ids());
  }

  @Test
  void whenAdding_givenUnsupportedType_shouldThrowAndAddNothing() {
    final Catalog<TestMember> catalog = catalogOf(
        new FakeResolutionClient());

    assertThrows(InvalidMemberArgumentException.class,
        () -> catalog.add(a, 42));

    assertTrue(catalog.isEmpty());
  }

  @Test
  void whenAdding_givenTooLongLocation_shouldThrow() {
    final Catalog<TestMember> catalog = Catalog.of(TestMember.class)
        .resolveWith(new FakeResolutionClient())
        .limits(RecordLimits.of(36, 55, 10))
        .build();

    assertThrows(RecordLimitExceededException.class, () -> catalog.add(a));
  }

  @Test
  void whenAdding_givenOneTooLongMemberAmongValidOnes_shouldAddNothing() {
    final TestMember far = new TestMember("far", "Sim",
        "/data/sims/very/far/away");
    final Catalog<TestMember> catalog = Catalog.of(TestMember.class)
        .resolveWith(new FakeResolutionClient())
        .limits(RecordLimits.of(36, 55, 14))
        .build();

    assertThrows(RecordLimitExceededException.class,
        () -> catalog.add(a, far));

    assertTrue(catalog.isEmpty());
  }

  @Test
  void whenListing_givenMoveBeyondLimits_shouldLeaveCatalogUntouched() {
    final FakeResolutionClient client = new FakeResolutionClient()
        .place(a, b);
    final Catalog<TestMember> catalog = catalogOf(client, a, b);
    client.move("a", "/moved/a");
    client.move("b", "/moved/" + "y".repeat(600));

    assertThrows(RecordLimitExceededException.class, catalog::list);

    assertEquals(List.of("/data/sims/a", "/data/sims/b"),
        catalog.locations());
    assertEquals(0, catalog.info().cachedCount());
    assertThrows(RecordLimitExceededException.class, catalog::list);
    assertEquals(2, client.requests().size());
  }

  @Test
  void whenRemoving_givenOrdinal_shouldRemoveMemberAtThatPosition() {
    final Catalog<TestMember> catalog = catalogOf(
        new FakeResolutionClient(), a, b, c);

    catalog.remove(1);

    assertEquals(2, catalog.size());
    assertEquals(List.of("a", "c"), catalog.ids());
  }

  @Test
  void whenRemoving_givenHandlesAndOrdinals_shouldRemoveAll() {
    final Catalog<TestMember> catalog = catalogOf(
        new FakeResolutionClient(), a, b, c);

    catalog.remove(c, 0, new TestMember("zzz", "Sim", "/zzz"));

    assertEquals(List.of("b"), catalog.ids());
  }

  @Test
  void whenRemoving_givenUnsupportedType_shouldThrowAndRemoveNothing() {
    final Catalog<TestMember> catalog = catalogOf(
        new FakeResolutionClient(), a, b);

    assertThrows(InvalidMemberArgumentException.class,
        () -> catalog.remove(0, "a"));
    assertThrows(InvalidMemberArgumentException.class,
        () -> catalog.remove(1L));

    assertEquals(2, catalog.size());
  }

  @Test
  void whenRemoving_givenOrdinalOutOfRange_shouldThrow() {
    final Catalog<TestMember> catalog = catalogOf(
        new FakeResolutionClient(), a);

    assertThrows(IndexOutOfBoundsException.class, () -> catalog.remove(1));
    assertThrows(IndexOutOfBoundsException.class, () -> catalog.remove(-1));
  }

  @Test
  void whenRemovingAll_shouldLeaveEmptyCatalog() {
    final FakeResolutionClient client = new FakeResolutionClient()
        .place(a, b);
    final Catalog<TestMember> catalog = catalogOf(client, a, b);
    catalog.list();

    catalog.removeAll();

    assertEquals(0, catalog.size());
    assertTrue(catalog.list().isEmpty());
    assertEquals(0, catalog.info().cachedCount());
  }

  @Test
  void whenListing_givenAllMembersFound_shouldAlignWithIds() {
    final FakeResolutionClient client = new FakeResolutionClient()
        .place(a, b, c);
    final Catalog<TestMember> catalog = catalogOf(client, b, c, a);

    final List<TestMember> members = catalog.list();

    assertEquals(catalog.size(), members.size());
    for (int i = 0; i < members.size(); i++) {
      assertEquals(catalog.ids().get(i), members.get(i).id());
    }
    assertEquals(1, client.requests().size());
    assertEquals(Set.of("a", "b", "c"), client.requests().get(0));
    assertEquals("/data/sims/b", client.hints().get(0).get("b"));
  }

  @Test
  void whenListing_givenCachedMembers_shouldOnlyResolveMisses() {
    final FakeResolutionClient client = new FakeResolutionClient()
        .place(a, b, c);
    final Catalog<TestMember> catalog = catalogOf(client, a, b);

    final TestMember first = catalog.list().get(0);
    catalog.add(c);
    final List<TestMember> members = catalog.list();

    assertSame(first, members.get(0));
    assertEquals(List.of("a", "b", "c"),
        members.stream().map(TestMember::id).toList());
    assertEquals(2, client.requests().size());
    assertEquals(Set.of("c"), client.requests().get(1));
  }

  @SuppressWarnings("unchecked")
  @Test
  void whenListing_givenFullyCachedCatalog_shouldNotCallResolutionClient() {
    final ResolutionClient<TestMember> client =
        createMock(ResolutionClient.class);
    expect(client.resolve(anyObject(), anyObject()))
        .andReturn(Map.of("a", Optional.of(a), "b", Optional.of(b)))
        .once();
    replay(client);

    final Catalog<TestMember> catalog = Catalog.of(TestMember.class)
        .resolveWith(client)
        .members(a, b)
        .build();

    catalog.list();
    catalog.list();
    catalog.get(1);
    for (final TestMember member : catalog) {
      assertTrue(member.id().equals("a") || member.id().equals("b"));
    }

    verify(client);
  }

  @Test
  void whenListing_givenMissingMember_shouldFailWithPositionAndId() {
    final FakeResolutionClient client = new FakeResolutionClient()
        .place(a, b, c);
    final Catalog<TestMember> catalog = catalogOf(client, a, b, c);
    client.vanish("b");
    client.move("c", "/data/moved/c");

    final MemberNotFoundException e = assertThrows(
        MemberNotFoundException.class, catalog::list);

    assertEquals(1, e.position());
    assertEquals("b", e.memberId());
    assertEquals(List.of("/data/sims/a", "/data/sims/b", "/data/groups/c"),
        catalog.locations());
    assertEquals(0, catalog.info().cachedCount());
  }

  @Test
  void whenListing_givenClientOmittingAnId_shouldTreatItAsMissing() {
    final ResolutionClient<TestMember> client =
        new ResolutionClient<TestMember>() {
          @Override
          public Map<String, Optional<TestMember>> resolve(
              final Set<String> pendingIds, final Map<String, String> hints) {
            return Map.of("a", Optional.of(a));
          }

          @Override
          public List<TestMember> expand(final String location) {
            return List.of();
          }
        };
    final Catalog<TestMember> catalog = Catalog.of(TestMember.class)
        .resolveWith(client)
        .members(a, b)
        .build();

    final MemberNotFoundException e = assertThrows(
        MemberNotFoundException.class, catalog::list);

    assertEquals("b", e.memberId());
  }

  @Test
  void whenListing_givenMovedMember_shouldHealRecordedLocation() {
    final FakeResolutionClient client = new FakeResolutionClient()
        .place(a, b);
    final Catalog<TestMember> catalog = catalogOf(client, a, b);
    final TestMember moved = client.move("a", "/archive/a");

    final List<TestMember> members = catalog.list();

    assertSame(moved, members.get(0));
    assertEquals(List.of("/archive/a", "/data/sims/b"), catalog.locations());
    assertEquals(List.of("a", "b"), catalog.ids());
  }

  @Test
  void whenGettingByIndex_shouldResolveOnlyThatMember() {
    final FakeResolutionClient client = new FakeResolutionClient()
        .place(a, b, c);
    final Catalog<TestMember> catalog = catalogOf(client, a, b, c);

    final TestMember member = catalog.get(2);

    assertEquals(c, member);
    assertEquals(List.of(Set.of("c")), client.requests());
    assertThrows(IndexOutOfBoundsException.class, () -> catalog.get(3));
  }

  @Test
  void whenGettingByIndex_givenMissingMember_shouldReportItsPosition() {
    final FakeResolutionClient client = new FakeResolutionClient()
        .place(a, b);
    final Catalog<TestMember> catalog = catalogOf(client, a, b, c);

    final MemberNotFoundException e = assertThrows(
        MemberNotFoundException.class, () -> catalog.get(2));

    assertEquals(2, e.position());
    assertEquals("c", e.memberId());
  }

  @Test
  void whenSlicing_shouldBuildNewCatalogAndLeaveSourceUntouched() {
    final FakeResolutionClient client = new FakeResolutionClient()
        .place(a, b, c);
    final Catalog<TestMember> catalog = catalogOf(client, a, b, c);

    final Catalog<TestMember> slice = catalog.slice(1, 3);
    assertEquals(2, slice.info().cachedCount());
    slice.remove(0);

    assertEquals(List.of("c"), slice.ids());
    assertEquals(List.of("a", "b", "c"), catalog.ids());
    assertEquals(c, slice.get(0));
  }

  @Test
  void whenSlicing_givenRangeOutOfBounds_shouldThrow() {
    final Catalog<TestMember> catalog = catalogOf(
        new FakeResolutionClient(), a);

    assertThrows(IndexOutOfBoundsException.class, () -> catalog.slice(0, 2));
    assertThrows(IndexOutOfBoundsException.class, () -> catalog.slice(1, 0));
  }

  @Test
  void whenGettingNames_givenMissingMember_shouldReturnEmptyForIt() {
    final FakeResolutionClient client = new FakeResolutionClient()
        .place(a, c);
    final Catalog<TestMember> catalog = catalogOf(client, a, b, c);

    final List<Optional<String>> names = catalog.names();

    assertEquals(List.of(Optional.of("a"), Optional.empty(),
        Optional.of("c")), names);
    assertEquals(2, catalog.info().cachedCount());
  }

  @Test
  void whenGettingNames_givenMemberReappears_shouldFindItOnNextCall() {
    final FakeResolutionClient client = new FakeResolutionClient();
    final Catalog<TestMember> catalog = catalogOf(client, a);

    assertEquals(List.of(Optional.empty()), catalog.names());

    client.place(a);

    assertEquals(List.of(Optional.of("a")), catalog.names());
  }

  @Test
  void whenMapping_givenConcurrencyOneAndFour_shouldKeepMemberOrder() {
    final FakeResolutionClient client = new FakeResolutionClient();
    final Catalog<TestMember> catalog = catalogOf(client);
    for (int i = 0; i < 20; i++) {
      final TestMember member = new TestMember("m" + i, "Sim",
          "/data/sims/m" + i);
      client.place(member);
      catalog.add(member);
    }

    final List<String> expected = catalog.list().stream()
        .map(m -> m.id() + "@" + m.location())
        .toList();

    assertEquals(expected, catalog.map(m -> m.id() + "@" + m.location()));
    assertEquals(expected, catalog.map(m -> m.id() + "@" + m.location(), 4));
  }

  @Test
  void whenMapping_givenFailingFunction_shouldFailWholeCall() {
    final FakeResolutionClient client = new FakeResolutionClient()
        .place(a, b);
    final Catalog<TestMember> catalog = catalogOf(client, a, b);

    final CatalogException e = assertThrows(CatalogException.class,
        () -> catalog.map(m -> {
          if (m.id().equals("b")) {
            throw new IllegalStateException("boom");
          }
          return m.id();
        }, 2));

    assertTrue(e.getMessage().contains("'b'"));
    assertEquals("boom", e.getCause().getMessage());
  }

  @Test
  void whenMapping_givenZeroConcurrency_shouldThrow() {
    final Catalog<TestMember> catalog = catalogOf(
        new FakeResolutionClient(), a);

    assertThrows(IllegalArgumentException.class,
        () -> catalog.map(TestMember::id, 0));
  }

  @Test
  void whenGettingInfo_shouldCountMembersByKind() {
    final FakeResolutionClient client = new FakeResolutionClient()
        .place(a);
    final Catalog<TestMember> catalog = catalogOf(client, a, b, c);
    catalog.get(0);

    final CatalogInfo info = catalog.info();

    assertEquals(3, info.memberCount());
    assertEquals(1, info.cachedCount());
    assertEquals(Map.of("Sim", 2, "Group", 1), info.membersByKind());
    assertEquals("Catalog[a, b, c]", catalog.toString());
  }

  @Test
  void whenGettingCacheRatio_givenEmptyCatalog_shouldBeZero() {
    final Catalog<TestMember> catalog = catalogOf(new FakeResolutionClient());

    assertEquals(0.0, catalog.info().cacheRatio());
  }

  @Test
  void whenGettingCacheRatio_givenHalfResolvedCatalog_shouldBeOneHalf() {
    final FakeResolutionClient client = new FakeResolutionClient()
        .place(a, b);
    final Catalog<TestMember> catalog = catalogOf(client, a, b);
    catalog.get(1);

    assertEquals(0.5, catalog.info().cacheRatio());
  }

  @Test
  void whenMirroring_shouldWriteEveryTableChangeToTheStore() {
    final MemberStore store = createMock(MemberStore.class);
    store.upsert(new MemberRecord("a", "Sim", "/data/sims/a"));
    expectLastCall().once();
    store.upsert(new MemberRecord("b", "Sim", "/data/sims/b"));
    expectLastCall().once();
    store.delete(Set.of("a"));
    expectLastCall().once();
    store.deleteAll();
    expectLastCall().once();
    replay(store);

    final Catalog<TestMember> catalog = Catalog.of(TestMember.class)
        .resolveWith(new FakeResolutionClient())
        .mirrorTo(store)
        .members(a, b)
        .build();
    catalog.remove(a);
    catalog.removeAll();

    verify(store);
  }

  @Test
  void whenHealing_givenStoreDeniesAccess_shouldStillReturnMember() {
    final FakeResolutionClient client = new FakeResolutionClient()
        .place(a);
    final MemberStore store = createMock(MemberStore.class);
    store.upsert(new MemberRecord("a", "Sim", "/data/sims/a"));
    expectLastCall().once();
    store.upsert(new MemberRecord("a", "Sim", "/archive/a"));
    expectLastCall().andThrow(new UncheckedIOException(
        new AccessDeniedException("/statefile"))).once();
    replay(store);

    final Catalog<TestMember> catalog = Catalog.of(TestMember.class)
        .resolveWith(client)
        .mirrorTo(store)
        .members(a)
        .build();
    final TestMember moved = client.move("a", "/archive/a");

    assertEquals(List.of(moved), catalog.list());
    assertEquals(List.of("/archive/a"), catalog.locations());

    verify(store);
  }

  @Test
  void whenHealing_givenStoreFailsOtherwise_shouldPropagate() {
    final FakeResolutionClient client = new FakeResolutionClient()
        .place(a);
    final MemberStore store = createMock(MemberStore.class);
    store.upsert(eq(new MemberRecord("a", "Sim", "/data/sims/a")));
    expectLastCall().once();
    store.upsert(eq(new MemberRecord("a", "Sim", "/archive/a")));
    expectLastCall().andThrow(new UncheckedIOException(
        new IOException("disk full"))).once();
    replay(store);

    final Catalog<TestMember> catalog = Catalog.of(TestMember.class)
        .resolveWith(client)
        .mirrorTo(store)
        .members(a)
        .build();
    client.move("a", "/archive/a");

    assertThrows(UncheckedIOException.class, catalog::list);

    verify(store);
  }

  @Test
  void whenResolving_shouldReportMetrics() {
    final FakeResolutionClient client = new FakeResolutionClient()
        .place(a, b);
    final CatalogMetrics metrics = createMock(CatalogMetrics.class);
    metrics.cacheHits(0);
    expectLastCall().once();
    metrics.membersResolved(2, 2);
    expectLastCall().once();
    metrics.locationHealed("b", "/data/sims/b", "/archive/b");
    expectLastCall().once();
    metrics.cacheHits(2);
    expectLastCall().once();
    replay(metrics);

    final Catalog<TestMember> catalog = Catalog.of(TestMember.class)
        .resolveWith(client)
        .metrics(metrics)
        .members(a, b)
        .build();
    client.move("b", "/archive/b");

    catalog.list();
    catalog.list();

    verify(metrics);
  }
}
