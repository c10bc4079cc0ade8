package com.excsn.livestore.core;

import com.excsn.livestore.core.telemetry.Logger;
import com.excsn.livestore.core.telemetry.StatsRecorder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

public class LiveStoreActorTest {

  private static final Duration WAIT = Duration.ofSeconds(2);

  private Logger _logger;
  private StatsRecorder _statsRecorder;
  private final List<LiveStore> _stores = new ArrayList<>();

  @BeforeEach
  public void setup() {
    _logger = Mockito.mock(Logger.class);
    _statsRecorder = Mockito.mock(StatsRecorder.class);
  }

  @AfterEach
  public void teardown() throws Exception {

    for (var store : _stores) {
      store.stop();
      store.awaitTermination(WAIT);
    }
  }

  @Test
  public void getReturnsInitialValue() {

    var store = _create(Map.of("name", "Elixir"));

    Assertions.assertEquals("Elixir", store.get("name"));
  }

  @Test
  public void getReturnsDefaultForMissingKey() {

    var store = _create(Map.of("name", "Elixir"));

    Assertions.assertEquals("fallback", store.get("missing", "fallback"));
    Assertions.assertNull(store.get("missing"));
  }

  @Test
  public void getReturnsStoredNullRatherThanDefault() {

    var store = _create(Map.of());
    store.assign("nothing", null);

    Assertions.assertNull(store.get("nothing", "fallback"));
  }

  @Test
  public void takeOmitsUnknownKeys() {

    var store = _create(Map.of("a", 1));

    var taken = store.take(List.of("a", "missing"));

    Assertions.assertEquals(Map.of("a", 1), taken);
  }

  @Test
  public void takeOfOnlyUnknownKeysIsEmpty() {

    var store = _create(Map.of("a", 1));

    Assertions.assertTrue(store.take(List.of("b", "c")).isEmpty());
  }

  @Test
  public void assignIsVisibleToLaterReads() {

    var store = _create(Map.of());

    store.assign("name", "Elixir").assign(Map.of("logo", "drop"));

    Assertions.assertEquals(Map.of("name", "Elixir", "logo", "drop"), store.take(List.of("name", "logo")));
  }

  @Test
  public void assignOfSameValueDoesNotNotify() throws Exception {

    var store = _create(Map.of("x", List.of(1, 2)));
    var inbox = new Inbox();
    store.subscribe(inbox, List.of("x"));

    store.assign("x", List.of(1, 2));
    store.get("x");

    Assertions.assertNull(inbox.poll());
    Mockito.verify(_statsRecorder).recordCounterIncrement(Mockito.anyMap(), Mockito.eq("assign_unchanged"));
  }

  @Test
  public void assignOfNewValueNotifiesEachSubscriberOnce() throws Exception {

    var store = _create(Map.of("x", 1));
    var first = new Inbox();
    var second = new Inbox();
    store.subscribe(first, List.of("x")).subscribe(second, List.of("x"));

    store.assign("x", 2);
    store.get("x");

    Assertions.assertEquals(new StoreChange("x", 2), first.poll());
    Assertions.assertEquals(new StoreChange("x", 2), second.poll());
    Assertions.assertNull(first.poll());
    Assertions.assertNull(second.poll());
  }

  @Test
  public void assignOfPreviouslyAbsentKeyNotifies() throws Exception {

    var store = _create(Map.of());
    var inbox = new Inbox();
    store.subscribe(inbox, List.of("fresh"));

    store.assign("fresh", "value");

    Assertions.assertEquals(new StoreChange("fresh", "value"), inbox.receive(WAIT));
  }

  @Test
  public void assignManyOnlyNotifiesChangedKeys() throws Exception {

    var store = _create(Map.of("same", 1, "changed", 1));
    var inbox = new Inbox();
    store.subscribe(inbox, List.of("same", "changed"));

    store.assign(LiveStoreUtils.pairs("same", 1, "changed", 2));
    store.get("same");

    Assertions.assertEquals(List.of(new StoreChange("changed", 2)), inbox.drain());
  }

  @Test
  public void assignManyAppliesPairsInOrder() throws Exception {

    var store = _create(Map.of());
    var inbox = new Inbox();
    store.subscribe(inbox, List.of("k"));

    store.assign(LiveStoreUtils.pairs("k", 1, "k", 2, "k", 2));
    store.get("k");

    Assertions.assertEquals(List.of(new StoreChange("k", 1), new StoreChange("k", 2)), inbox.drain());
    Assertions.assertEquals(2, (int) store.get("k"));
  }

  @Test
  public void updatesCompose() {

    var store = _create(Map.of());
    store.assign("count", 0);

    for (int idx = 0; idx < 3; idx++) {
      store.<Integer>update("count", count -> count + 1);
    }

    Assertions.assertEquals(3, (int) store.get("count"));
  }

  @Test
  public void updateOfMissingKeyReceivesNull() {

    var store = _create(Map.of());

    store.<String>update("greeting", current -> current == null ? "hello" : current + "!");

    Assertions.assertEquals("hello", store.get("greeting"));
  }

  @Test
  public void updateToSameValueDoesNotNotify() throws Exception {

    var store = _create(Map.of("x", 5));
    var inbox = new Inbox();
    store.subscribe(inbox, List.of("x"));

    store.<Integer>update("x", x -> x);
    store.get("x");

    Assertions.assertNull(inbox.poll());
  }

  @Test
  public void deadSubscriberIsPrunedOnNextChange() throws Exception {

    var store = _create(Map.of("x", 0));
    var alive = new Inbox();
    var dead = Mockito.mock(Observer.class);
    Mockito.when(dead.isAlive()).thenReturn(false);

    store.subscribe(dead, List.of("x")).subscribe(alive, List.of("x"));
    store.assign("x", 1);
    store.assign("x", 2);
    store.get("x");

    Mockito.verify(dead, Mockito.never()).deliver(Mockito.any());
    Mockito.verify(dead, Mockito.times(1)).isAlive();
    Assertions.assertEquals(2, alive.drain().size());
    Assertions.assertEquals(List.of(alive), _subscribersOf(store, "x"));
  }

  @Test
  public void deadSubscriberOfUnchangedKeyIsKept() {

    var store = _create(Map.of("x", 0, "y", 0));
    var inbox = new Inbox();
    store.subscribe(inbox, List.of("x", "y"));
    inbox.close();

    store.assign("x", 1);
    store.get("x");

    Assertions.assertTrue(_subscribersOf(store, "x").isEmpty());
    Assertions.assertEquals(List.of(inbox), _subscribersOf(store, "y"));
  }

  @Test
  public void fanOutIsInReverseSubscriptionOrder() throws Exception {

    var store = _create(Map.of("y", 0));
    var order = new ArrayList<String>();
    var first = ListenerObserver.direct((key, value) -> order.add("first"));
    var second = ListenerObserver.direct((key, value) -> order.add("second"));

    store.subscribe(first, List.of("y")).subscribe(second, List.of("y"));
    store.assign("y", 1);
    store.get("y");

    Assertions.assertEquals(List.of("second", "first"), order);
  }

  @Test
  public void duplicateSubscriptionDeliversTwice() throws Exception {

    var store = _create(Map.of("x", 0));
    var inbox = new Inbox();

    store.subscribe(inbox, List.of("x")).subscribe(inbox, List.of("x"));
    store.assign("x", 1);
    store.get("x");

    Assertions.assertEquals(List.of(new StoreChange("x", 1), new StoreChange("x", 1)), inbox.drain());
  }

  @Test
  public void subscribingToNeverWrittenKeyIsAllowed() throws Exception {

    var store = _create(Map.of());
    var inbox = new Inbox();

    store.subscribe(inbox, List.of("later"));
    Assertions.assertNull(store.get("later"));

    store.assign("later", true);
    Assertions.assertEquals(new StoreChange("later", true), inbox.receive(WAIT));
  }

  @Test
  public void counterScenario() {

    var store = _create(Map.of("val", 0));
    var deliveries = new ArrayList<String>();
    var observerA = ListenerObserver.direct((key, value) -> deliveries.add("A:" + key + "=" + value));
    var observerB = ListenerObserver.direct((key, value) -> deliveries.add("B:" + key + "=" + value));

    store.subscribe(observerA, List.of("val"));
    store.<Integer>update("val", val -> val + 1);
    store.get("val");

    Assertions.assertEquals(List.of("A:val=1"), deliveries);
    deliveries.clear();

    store.subscribe(observerB, List.of("val"));
    store.assign("val", 1);
    store.get("val");

    Assertions.assertTrue(deliveries.isEmpty());

    store.assign("val", 5);
    store.get("val");

    Assertions.assertEquals(List.of("B:val=5", "A:val=5"), deliveries);
  }

  @Test
  public void operationsFromOneCallerApplyInOrder() {

    var store = _create(Map.of());

    for (int idx = 0; idx < 1000; idx++) {
      store.assign("seq", idx);
    }

    Assertions.assertEquals(999, (int) store.get("seq"));
  }

  @Test
  public void concurrentUpdatesAreSerialized() throws Exception {

    var store = _create(Map.of("count", 0));
    var threads = 8;
    var perThread = 250;
    var executor = Executors.newFixedThreadPool(threads);
    var done = new CountDownLatch(threads);

    try {
      for (int idx = 0; idx < threads; idx++) {
        executor.execute(() -> {
          for (int count = 0; count < perThread; count++) {
            store.<Integer>update("count", value -> value + 1);
          }
          done.countDown();
        });
      }

      Assertions.assertTrue(done.await(WAIT.toMillis(), TimeUnit.MILLISECONDS));
    } finally {
      executor.shutdownNow();
    }

    Assertions.assertEquals(threads * perThread, (int) store.get("count"));
  }

  @Test
  public void throwingObserverDoesNotStopFanOut() throws Exception {

    var store = _create(Map.of("x", 0));
    var inbox = new Inbox();
    var broken = Mockito.mock(Observer.class);
    Mockito.when(broken.isAlive()).thenReturn(true);
    Mockito.doThrow(new IllegalStateException("full")).when(broken).deliver(Mockito.any());

    store.subscribe(inbox, List.of("x")).subscribe(broken, List.of("x"));
    store.assign("x", 1);

    Assertions.assertEquals(new StoreChange("x", 1), inbox.receive(WAIT));
    Assertions.assertTrue(store.isAlive());
    Mockito.verify(_statsRecorder, Mockito.timeout(1000))
      .recordCounterIncrement(Mockito.anyMap(), Mockito.eq("notify_errors"));
  }

  @Test
  public void assignOverNullHoldingCollectionsNotifies() throws Exception {

    var mapWithNullKey = new HashMap<String, Object>();
    mapWithNullKey.put(null, 1);
    var store = _create(Map.of("s", new HashSet<>(Arrays.asList("a", null)), "m", mapWithNullKey));
    var inbox = new Inbox();
    store.subscribe(inbox, List.of("s", "m"));

    store.assign("s", Set.of("a", "b")).assign("m", Map.of("a", 1));

    Assertions.assertEquals(Set.of("a", "b"), store.get("s"));
    Assertions.assertEquals(Map.of("a", 1), store.get("m"));
    Assertions.assertTrue(store.isAlive());
    Assertions.assertEquals(List.of(new StoreChange("s", Set.of("a", "b")), new StoreChange("m", Map.of("a", 1))),
      inbox.drain());
  }

  @Test
  public void changedSetOfArraysNotifies() throws Exception {

    var store = _create(Map.of("arrays", new HashSet<>(Arrays.asList(new int[]{1}, new int[]{1}))));
    var inbox = new Inbox();
    store.subscribe(inbox, List.of("arrays"));

    var changed = new HashSet<>(Arrays.asList(new int[]{1}, new int[]{2}));
    store.assign("arrays", changed);

    Assertions.assertSame(changed, store.get("arrays"));
    Assertions.assertEquals(List.of(new StoreChange("arrays", changed)), inbox.drain());
  }

  @Test
  public void observerWithFailingLivenessCheckIsPruned() throws Exception {

    var store = _create(Map.of("x", 0));
    var inbox = new Inbox();
    var broken = Mockito.mock(Observer.class);
    Mockito.when(broken.isAlive()).thenThrow(new IllegalStateException("gone"));

    store.subscribe(inbox, List.of("x")).subscribe(broken, List.of("x"));
    store.assign("x", 1);

    Assertions.assertEquals(new StoreChange("x", 1), inbox.receive(WAIT));
    store.get("x");
    Assertions.assertTrue(store.isAlive());
    Assertions.assertEquals(List.of(inbox), _subscribersOf(store, "x"));
    Mockito.verify(broken, Mockito.never()).deliver(Mockito.any());
    Mockito.verify(_statsRecorder).recordCounterIncrement(Mockito.anyMap(), Mockito.eq("liveness_errors"));
  }

  @Test
  public void recordsAttemptCounters() {

    var store = _create(Map.of());

    store.assign("a", 1);
    store.get("a");
    store.take(List.of("a"));

    Mockito.verify(_statsRecorder).recordCounterIncrement(Mockito.anyMap(), Mockito.eq("assign_attempts"));
    Mockito.verify(_statsRecorder).recordCounterIncrement(Mockito.anyMap(), Mockito.eq("get_attempts"));
    Mockito.verify(_statsRecorder).recordCounterIncrement(Mockito.anyMap(), Mockito.eq("take_attempts"));
  }

  @Test
  public void rejectsNullArguments() {

    var store = _create(Map.of());

    Assertions.assertThrows(NullPointerException.class, () -> store.subscribe(null, List.of("x")));
    Assertions.assertThrows(NullPointerException.class, () -> store.subscribe(new Inbox(), null));
    Assertions.assertThrows(NullPointerException.class, () -> store.take(null));
    Assertions.assertThrows(NullPointerException.class, () -> store.assign((Map<String, ?>) null));
    Assertions.assertThrows(NullPointerException.class, () -> store.update("x", null));
  }

  private LiveStore _create(Map<String, ?> initialAssigns) {

    var store = LiveStoreBuilder.builder()
      .setName("test")
      .setTelemetry(_logger, _statsRecorder)
      .setInitialAssigns(initialAssigns)
      .build();

    _stores.add(store);
    return store;
  }

  private static List<Observer> _subscribersOf(LiveStore store, String key) {
    return ((LiveStoreActor) store).state().subscriptions().getSubscribers(key);
  }
}
