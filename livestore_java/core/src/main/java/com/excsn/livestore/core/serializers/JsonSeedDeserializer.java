package com.excsn.livestore.core.serializers;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

public class JsonSeedDeserializer implements SeedDeserializer<String> {

  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final ObjectMapper _objectMapper;

  public JsonSeedDeserializer(ObjectMapper objectMapper) {
    _objectMapper = objectMapper;
  }

  public static JsonSeedDeserializer create() {

    var objectMapper = new ObjectMapper();

    return new JsonSeedDeserializer(objectMapper);
  }

  @Override
  public Map<String, Object> deserialize(String data) throws IOException {

    Map<String, Object> value = _objectMapper.readValue(data, MAP_TYPE);
    return value == null ? new LinkedHashMap<>() : value;
  }
}
