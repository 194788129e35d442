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

package io.mapsmessaging.dbc.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Mutable state for a single parse. One instance is created per {@link DbcParser} call and passed
 * to every extractor; it is not thread safe and is never reused.
 */
@Getter
class DbcDatabaseBuilder {

  private final LinkedHashMap<Long, MessageDraft> messages = new LinkedHashMap<>();
  private final List<String> ecus = new ArrayList<>();
  private final Map<String, Map<Long, String>> valueTables = new LinkedHashMap<>();
  private final Map<CommentKey, String> comments = new LinkedHashMap<>();

  /**
   * Replaces any message already stored under the same id. The new entry moves to the end so the
   * iteration order follows the last declaration.
   */
  void putMessage(MessageDraft message) {
    messages.remove(message.getCanId());
    messages.put(message.getCanId(), message);
  }

  MessageDraft getMessage(long canId) {
    return messages.get(canId);
  }

  void setEcus(List<String> nodeNames) {
    ecus.clear();
    ecus.addAll(nodeNames);
  }

  void putValueTable(String tableName, Map<Long, String> values) {
    valueTables.put(tableName, values);
  }

  void putComment(CommentKey key, String text) {
    comments.put(key, text);
  }
}
