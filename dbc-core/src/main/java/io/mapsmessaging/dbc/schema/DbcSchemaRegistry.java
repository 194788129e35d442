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

package io.mapsmessaging.dbc.schema;

import com.google.gson.JsonObject;
import io.mapsmessaging.dbc.model.DbcDatabase;
import io.mapsmessaging.dbc.model.DbcMessage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;

/**
 * Per-message schemas for one database, built on first use.
 */
@RequiredArgsConstructor
public class DbcSchemaRegistry {

  private final DbcDatabase database;

  private volatile Map<Long, JsonObject> schemasByCanId;

  public JsonObject getSchema(long canId) {
    JsonObject schema = schemas().get(canId);
    if (schema == null) {
      throw new IllegalArgumentException("Unknown CAN id: " + canId);
    }
    return schema;
  }

  /**
   * Schemas in the database's message order.
   */
  public List<JsonObject> getSchemas() {
    return List.copyOf(schemas().values());
  }

  public List<Long> listCanIds() {
    List<Long> canIds = new ArrayList<>(schemas().keySet());
    canIds.sort(Long::compare);
    return List.copyOf(canIds);
  }

  private Map<Long, JsonObject> schemas() {
    Map<Long, JsonObject> local = schemasByCanId;
    if (local == null) {
      local = buildSchemas();
      schemasByCanId = local;
    }
    return local;
  }

  private Map<Long, JsonObject> buildSchemas() {
    LinkedHashMap<Long, JsonObject> out = new LinkedHashMap<>();
    for (DbcMessage message : database.getMessages()) {
      out.put(message.getCanId(), DbcJsonSchemaGenerator.generateSchema(message));
    }
    return Collections.unmodifiableMap(out);
  }
}
