package com.excsn.livestore.core.serializers;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

public class YamlSeedDeserializer implements SeedDeserializer<String> {

  private final Yaml _yaml;

  public YamlSeedDeserializer() {
    _yaml = new Yaml();
  }

  @Override
  public Map<String, Object> deserialize(String data) throws IOException {

    Object loaded;
    try {
      loaded = _yaml.load(data);
    } catch (YAMLException e) {
      throw new IOException("Malformed YAML seed", e);
    }

    if (loaded == null) {
      return new LinkedHashMap<>();
    }

    if (!(loaded instanceof Map)) {
      throw new IOException("YAML seed must be a mapping at the top level, got " + loaded.getClass().getSimpleName());
    }

    var result = new LinkedHashMap<String, Object>();
    for (var entry : ((Map<?, ?>) loaded).entrySet()) {
      result.put(String.valueOf(entry.getKey()), entry.getValue());
    }

    return result;
  }
}
