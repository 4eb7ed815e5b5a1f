/*
 * Copyright (C) 2025 Isima, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.sentinelmesh.utils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Class used for serializing/deserializing Sentinel enum values.
 *
 * <p>The alerting layer exchanges enum values in lower snake case (such as resource_usage)
 * while Java enum names are upper snake case (such as RESOURCE_USAGE). This class converts
 * Java enum names to/from the wire names for JSON serialization/deserialization.
 *
 * @param <E> Enum class to stringify
 */
public class EnumStringifier<E extends Enum<E>> {
  private final Map<String, E> jsonToEntry;
  private final List<String> entryToJson;

  /**
   * The constructor.
   *
   * <p>The constructor builds the conversion table from JSON (lower snake name) to enum entry and
   * the table from enum entry to JSON.
   *
   * @param values Enum values. Values would be available by method <code>E.values()</code>
   */
  public EnumStringifier(E[] values) {
    jsonToEntry = new HashMap<>();
    entryToJson = new ArrayList<>();

    for (E entry : values) {
      final String stringified = entry.name().toLowerCase();
      jsonToEntry.put(stringified, entry);
      entryToJson.add(stringified);
    }
  }

  /**
   * Method to deserialize an enum value.
   *
   * @param value Serialized enum value
   * @return Resolved enum value
   * @throws NullPointerException when the parameter is null.
   * @throws IllegalArgumentException when the input value is invalid.
   */
  public E destringify(String value) {
    if (value == null) {
      throw new NullPointerException("'value' must not be null");
    }
    final E entry = jsonToEntry.get(value.trim().toLowerCase());
    if (entry == null) {
      throw new IllegalArgumentException("Unknown value: " + value);
    }
    return entry;
  }

  /**
   * Method to serialize an enum entry.
   *
   * @param entry Enum entry
   * @return serialized enum value
   */
  public String stringify(E entry) {
    return entryToJson.get(entry.ordinal());
  }
}
