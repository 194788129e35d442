/*
 *
 *  Copyright [ 2020 - 2024 ] Matthew Buckton
 *  Copyright [ 2024 - 2026 ] MapsMessaging B.V.
 *
 *  Licensed under the Apache License, Version 2.0 with the Commons Clause
 *  (the "License"); you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at:
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *      https://commonsclause.com/
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package io.mapsmessaging.dbc.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of parsing one DBC document. Messages are held in last-write order, at most one per CAN
 * id.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class DbcDatabase {

  private final List<DbcMessage> messages;
  private final List<String> ecus;
  private final String version;

  /**
   * Global {@code VAL_TABLE_} enumerations by table name. They are kept for reference only and are
   * never linked to a signal.
   */
  private final Map<String, Map<Long, String>> valueTables;

  @Builder
  private DbcDatabase(
      List<DbcMessage> messages,
      List<String> ecus,
      String version,
      Map<String, Map<Long, String>> valueTables
  ) {
    this.messages = messages == null ? List.of() : List.copyOf(messages);
    this.ecus = ecus == null ? List.of() : List.copyOf(ecus);
    this.version = version == null ? "" : version;
    this.valueTables = copyTables(valueTables);
  }

  public static DbcDatabase empty() {
    return DbcDatabase.builder().build();
  }

  public Optional<DbcMessage> findMessage(long canId) {
    for (DbcMessage message : messages) {
      if (message.getCanId() == canId) {
        return Optional.of(message);
      }
    }
    return Optional.empty();
  }

  public Optional<DbcMessage> findMessageByName(String name) {
    for (DbcMessage message : messages) {
      if (message.getName().equals(name)) {
        return Optional.of(message);
      }
    }
    return Optional.empty();
  }

  public int getSignalCount() {
    int count = 0;
    for (DbcMessage message : messages) {
      count += message.getSignals().size();
    }
    return count;
  }

  /**
   * Case-insensitive filter on the hex id, signal names and signal comments. A blank term matches
   * every message.
   */
  public List<DbcMessage> search(String term) {
    if (term == null || term.isBlank()) {
      return messages;
    }
    String needle = term.trim().toLowerCase(Locale.ROOT);
    List<DbcMessage> results = new ArrayList<>();
    for (DbcMessage message : messages) {
      if (matches(message, needle)) {
        results.add(message);
      }
    }
    return List.copyOf(results);
  }

  private static boolean matches(DbcMessage message, String needle) {
    if (message.getHexId().toLowerCase(Locale.ROOT).contains(needle)) {
      return true;
    }
    for (DbcSignal signal : message.getSignals()) {
      if (signal.getName().toLowerCase(Locale.ROOT).contains(needle)) {
        return true;
      }
      if (signal.getComment().toLowerCase(Locale.ROOT).contains(needle)) {
        return true;
      }
    }
    return false;
  }

  private static Map<String, Map<Long, String>> copyTables(Map<String, Map<Long, String>> tables) {
    if (tables == null || tables.isEmpty()) {
      return Map.of();
    }
    LinkedHashMap<String, Map<Long, String>> copy = new LinkedHashMap<>();
    for (Map.Entry<String, Map<Long, String>> entry : tables.entrySet()) {
      copy.put(entry.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(entry.getValue())));
    }
    return Collections.unmodifiableMap(copy);
  }
}
