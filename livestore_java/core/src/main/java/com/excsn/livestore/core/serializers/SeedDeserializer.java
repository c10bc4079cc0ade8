package com.excsn.livestore.core.serializers;

import java.io.IOException;
import java.util.Map;

/**
 * Turns the contents of a seed file into the key/value mapping a store starts with.
 */
public interface SeedDeserializer<Input> {

  Map<String, Object> deserialize(Input data) throws IOException;
}
