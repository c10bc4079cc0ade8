package com.excsn.livestore.core;

import com.excsn.livestore.core.serializers.JsonSeedDeserializer;
import com.excsn.livestore.core.serializers.SeedDeserializer;
import com.excsn.livestore.core.serializers.YamlSeedDeserializer;
import com.excsn.livestore.core.telemetry.Logger;
import com.excsn.livestore.core.telemetry.NoopStatsRecorder;
import com.excsn.livestore.core.telemetry.Slf4jLogger;
import com.excsn.livestore.core.telemetry.StatsRecorder;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

public class LiveStoreBuilder {

  public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(5);

  private static final AtomicLong STORE_IDS = new AtomicLong();

  private String _name = "store";
  private Map<String, Object> _initialAssigns = Collections.emptyMap();
  private Collection<Path> _seedFilePaths = Collections.emptyList();
  private final Map<String, SeedDeserializer<String>> _deserializers = new HashMap<>();
  private Duration _callTimeout = DEFAULT_CALL_TIMEOUT;
  private Logger _logger;
  private StatsRecorder _statsRecorder;

  private LiveStoreBuilder() {

    var yamlDeserializer = new YamlSeedDeserializer();
    _deserializers.put("yaml", yamlDeserializer);
    _deserializers.put("yml", yamlDeserializer);
    _deserializers.put("json", JsonSeedDeserializer.create());
  }

  public static LiveStoreBuilder builder() {
    return new LiveStoreBuilder();
  }

  /**
   * @param name Shows up in the actor thread's name and in log messages
   */
  public LiveStoreBuilder setName(String name) {

    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("name is null or empty");
    }

    _name = name;
    return this;
  }

  public LiveStoreBuilder setInitialAssigns(Map<String, ?> initialAssigns) {

    Preconditions.checkNotNull(initialAssigns, "initialAssigns");
    _initialAssigns = new LinkedHashMap<>(initialAssigns);
    return this;
  }

  /**
   * @param pairs Ordered key/value pairs; a repeated key keeps its last value
   */
  public LiveStoreBuilder setInitialAssigns(Iterable<? extends Map.Entry<String, ?>> pairs) {

    Preconditions.checkNotNull(pairs, "pairs");
    _initialAssigns = LiveStoreUtils.toAssigns(pairs);
    return this;
  }

  /**
   * @param paths YAML or JSON files merged in order into the initial assigns. Missing files are skipped. Values set
   *              with {@link #setInitialAssigns} override them.
   */
  public LiveStoreBuilder setSeedFilePaths(Collection<Path> paths) {

    Preconditions.checkNotNull(paths, "paths");
    _seedFilePaths = paths;
    return this;
  }

  /**
   * @param extension File extension, without the dot, handled by {@code deserializer}
   */
  public LiveStoreBuilder setDeserializer(String extension, SeedDeserializer<String> deserializer) {

    if (Strings.isNullOrEmpty(extension)) {
      throw new IllegalArgumentException("extension is null or empty");
    }

    _deserializers.put(extension, Preconditions.checkNotNull(deserializer, "deserializer"));
    return this;
  }

  /**
   * @param callTimeout How long {@code get} and {@code take} wait for a reply unless given their own timeout
   */
  public LiveStoreBuilder setCallTimeout(Duration callTimeout) {

    Preconditions.checkNotNull(callTimeout, "callTimeout");
    Preconditions.checkArgument(!callTimeout.isNegative() && !callTimeout.isZero(),
      "callTimeout must be positive: %s", callTimeout);

    _callTimeout = callTimeout;
    return this;
  }

  public LiveStoreBuilder setTelemetry(Logger logger, StatsRecorder statsRecorder) {
    _logger = logger;
    _statsRecorder = statsRecorder;
    return this;
  }

  public LiveStore build() {

    var logger = _logger != null ? _logger : Slf4jLogger.forClass(LiveStore.class);
    var statsRecorder = _statsRecorder != null ? _statsRecorder : NoopStatsRecorder.INSTANCE;

    var assigns = _loadSeedFiles(logger);
    assigns.putAll(_initialAssigns);

    var threadFactory = new ThreadFactoryBuilder()
      .setNameFormat("live-store-" + _name.replace("%", "%%") + "-" + STORE_IDS.incrementAndGet())
      .setDaemon(true)
      .build();

    var store = new LiveStoreActor(_name, assigns, _callTimeout, threadFactory, logger, statsRecorder);
    store.start();

    logger.debug("Created store `" + _name + "` with " + assigns.size() + " key(s)");

    return store;
  }

  private Map<String, Object> _loadSeedFiles(Logger logger) {

    var seedData = new LinkedHashMap<String, Object>();

    for (var seedFilePath : _seedFilePaths) {

      if (!Files.exists(seedFilePath)) {
        logger.debug("Seed file `" + seedFilePath + "` does not exist, skipping");
        continue;
      }

      var fileExt = com.google.common.io.Files.getFileExtension(seedFilePath.getFileName().toString());
      var deserializer = _deserializers.get(fileExt);

      if (deserializer == null) {
        logger.warn("Seed file `" + seedFilePath + "` cannot be deserialized since no deserializer handles `"
          + fileExt + "`");
        continue;
      }

      try {
        var fileContents = Files.readString(seedFilePath);
        LiveStoreUtils.deepMerge(seedData, deserializer.deserialize(fileContents));
      } catch (IOException e) {
        logger.error("Error while loading seed file `" + seedFilePath + "`", e);
      }
    }

    return seedData;
  }
}
