package com.excsn.livestore.example;

import com.excsn.livestore.core.ListenerObserver;
import com.excsn.livestore.core.LiveStoreBuilder;
import com.excsn.livestore.core.LiveStoreUtils;
import com.excsn.livestore.core.telemetry.Slf4jLogger;
import com.excsn.livestore.core.telemetry.StatsRecorder;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

public class Main {
  public static void main(String[] args) throws Exception {

    var changeCount = new AtomicInteger();

    var statsRecorder = new StatsRecorder() {
      @Override
      public void recordCounterIncrement(Map<String, Object> tags, String name) {

        if ("notifications_sent".equals(name)) {
          changeCount.incrementAndGet();
        }
      }

      @Override
      public void recordTimer(Map<String, Object> tags, String name, Duration value) {

      }

      @Override
      public void recordGauge(Map<String, Object> tags, String name, Number value) {

      }
    };

    var seedDir = Paths.get("src", "main", "resources", "seeds").toAbsolutePath();
    var seedFilePaths = LiveStoreUtils.defaultSeedFilePaths(seedDir.toString(), "local");
    System.out.println("Seed file paths: " + seedFilePaths.stream().map(Path::toString).collect(Collectors.joining(", ")));

    var store = LiveStoreBuilder.builder()
      .setName("counter")
      .setTelemetry(Slf4jLogger.forClass(Main.class), statsRecorder)
      .setSeedFilePaths(seedFilePaths)
      .setInitialAssigns(Map.of("val", 0))
      .build();

    var keys = List.of("val", "title");

    try (var root = new CounterView("root", store, keys);
         var child = new CounterView("child", store, keys);
         var audit = ListenerObserver.direct((key, value) -> System.out.println("audit: " + key + " -> " + value))) {

      store.subscribe(audit, List.of("val"));

      child.increment();
      child.increment();
      root.handleChanges(Duration.ofMillis(200));
      child.handleChanges(Duration.ofMillis(200));

      // same value again, nobody hears about it
      store.assign("val", 2);
      root.handleChanges(Duration.ofMillis(200));

      System.out.println(root.render());
      System.out.println(child.render());

      int val = store.get("val");
      if (val != 2) {
        throw new IllegalStateException("FAILURE: expected val == 2 but was " + val);
      }
    }

    System.out.println("Notifications sent: " + changeCount.get());
    System.out.println("Example program ran successfully");

    store.stop();
    store.awaitTermination(Duration.ofSeconds(1));
  }
}
