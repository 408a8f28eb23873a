package io.nusantara.tradenet.roster;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nusantara.tradenet.model.IslandDefinition;
import io.nusantara.tradenet.model.IslandType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Reads island rosters from YAML.
///
/// A roster is a map with a single `islands` list; each entry names an `id`, a `type`
/// (`port_city`, `trading`, `cultural` or `agricultural`), and its `navigation`, `trade`
/// and `culture` values:
/// ```yaml
/// islands:
///   - { id: malacca, type: port_city, navigation: 0.9, trade: 150, culture: 0.8 }
/// ```
public class IslandRosterLoader {
  private static final Logger logger = LogManager.getLogger(IslandRosterLoader.class);

  /// classpath location of the built-in roster
  public static final String DEFAULT_ROSTER = "/islands.yaml";

  private IslandRosterLoader() {
  }

  /// @return the ten historical ports shipped with the simulation
  /// @throws RuntimeException if the built-in roster is missing from the classpath
  public static List<IslandDefinition> loadDefault() {
    try (InputStream in = IslandRosterLoader.class.getResourceAsStream(DEFAULT_ROSTER)) {
      if (in == null) {
        throw new RuntimeException("default roster " + DEFAULT_ROSTER + " is not on the classpath");
      }
      return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), DEFAULT_ROSTER);
    } catch (IOException e) {
      throw new RuntimeException("Failed to read default roster " + DEFAULT_ROSTER, e);
    }
  }

  /// @param path a roster file
  /// @return its island definitions, in file order
  /// @throws IllegalArgumentException if the roster is malformed
  /// @throws RuntimeException if the file does not exist or cannot be read
  public static List<IslandDefinition> load(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new RuntimeException("roster file not found: " + path);
    }
    try {
      return parse(Files.readString(path), path.toString());
    } catch (IOException e) {
      throw new RuntimeException("Failed to read roster file: " + path, e);
    }
  }

  /// @param yaml roster text
  /// @param source where the text came from, for error messages
  /// @return its island definitions, in document order
  /// @throws IllegalArgumentException if the roster is malformed
  public static List<IslandDefinition> parse(String yaml, String source) {
    Object document;
    try {
      document = new Load(LoadSettings.builder().build()).loadFromString(yaml);
    } catch (YamlEngineException e) {
      throw new IllegalArgumentException("roster " + source + " is not valid YAML: " + e.getMessage(), e);
    }

    if (!(document instanceof Map<?, ?> root) || !(root.get("islands") instanceof List<?> entries)) {
      throw new IllegalArgumentException("roster " + source + " must be a map with an 'islands' list");
    }

    List<IslandDefinition> definitions = new ArrayList<>(entries.size());
    for (int i = 0; i < entries.size(); i++) {
      if (!(entries.get(i) instanceof Map<?, ?> entry)) {
        throw new IllegalArgumentException("roster " + source + " entry " + i + " is not a map");
      }
      String where = "roster " + source + " entry " + i;
      definitions.add(new IslandDefinition(
          text(entry, "id", where),
          IslandType.fromLabel(text(entry, "type", where)),
          number(entry, "navigation", where).doubleValue(),
          integer(entry, "trade", where),
          number(entry, "culture", where).doubleValue()
      ));
    }
    logger.debug("loaded {} islands from {}", definitions.size(), source);
    return definitions;
  }

  private static Object required(Map<?, ?> entry, String key, String where) {
    Object value = entry.get(key);
    if (value == null) {
      throw new IllegalArgumentException(where + " is missing '" + key + "'");
    }
    return value;
  }

  private static String text(Map<?, ?> entry, String key, String where) {
    return String.valueOf(required(entry, key, where));
  }

  private static Number number(Map<?, ?> entry, String key, String where) {
    Object value = required(entry, key, where);
    if (value instanceof Number n) {
      return n;
    }
    throw new IllegalArgumentException(where + " has non-numeric '" + key + "': " + value);
  }

  private static int integer(Map<?, ?> entry, String key, String where) {
    Number value = number(entry, key, where);
    if (value.doubleValue() != Math.rint(value.doubleValue())) {
      throw new IllegalArgumentException(where + " has fractional '" + key + "': " + value);
    }
    if (value.doubleValue() > Integer.MAX_VALUE || value.doubleValue() < Integer.MIN_VALUE) {
      throw new IllegalArgumentException(where + " has out of range '" + key + "': " + value);
    }
    return value.intValue();
  }
}
