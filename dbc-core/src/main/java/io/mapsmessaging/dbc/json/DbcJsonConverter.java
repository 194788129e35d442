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

package io.mapsmessaging.dbc.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.mapsmessaging.dbc.model.DbcDatabase;
import io.mapsmessaging.dbc.model.DbcMessage;
import io.mapsmessaging.dbc.model.DbcSignal;
import java.util.List;
import java.util.Map;
import lombok.experimental.UtilityClass;

/**
 * Plain JSON view of a {@link DbcDatabase}, as served to API clients.
 */
@UtilityClass
public class DbcJsonConverter {

  private static final Gson PRETTY = new GsonBuilder()
      .setPrettyPrinting()
      .disableHtmlEscaping()
      .create();

  public static JsonObject toJson(DbcDatabase database) {
    return toJson(database, database.getMessages());
  }

  /**
   * Same shape as {@link #toJson(DbcDatabase)} but listing only the given messages, for example the
   * result of {@link DbcDatabase#search(String)}.
   */
  public static JsonObject toJson(DbcDatabase database, List<DbcMessage> messages) {
    JsonArray messageArray = new JsonArray();
    for (DbcMessage message : messages) {
      messageArray.add(messageToJson(message));
    }

    JsonObject root = new JsonObject();
    root.add("messages", messageArray);
    root.add("ecus", toArray(database.getEcus()));
    root.addProperty("version", database.getVersion());
    return root;
  }

  public static String toJsonString(DbcDatabase database) {
    return PRETTY.toJson(toJson(database));
  }

  public static String toJsonString(JsonObject json) {
    return PRETTY.toJson(json);
  }

  public static JsonObject messageToJson(DbcMessage message) {
    JsonArray signals = new JsonArray();
    for (DbcSignal signal : message.getSignals()) {
      signals.add(signalToJson(signal));
    }

    JsonObject json = new JsonObject();
    json.addProperty("id", message.getHexId());
    json.addProperty("name", message.getName());
    json.addProperty("dlc", message.getDlc());
    json.addProperty("sender", message.getSender());
    json.addProperty("comment", message.getComment());
    json.add("signals", signals);
    return json;
  }

  public static JsonObject signalToJson(DbcSignal signal) {
    JsonObject json = new JsonObject();
    json.addProperty("name", signal.getName());
    json.addProperty("start_bit", signal.getBitStart());
    json.addProperty("bit_length", signal.getBitLength());
    json.addProperty("byte_order", signal.getByteOrder().getLabel());
    json.addProperty("value_type", signal.getValueType().getLabel());
    json.addProperty("factor", signal.getFactor());
    json.addProperty("offset", signal.getOffset());
    json.addProperty("min", signal.getMinimum());
    json.addProperty("max", signal.getMaximum());
    json.addProperty("unit", signal.getUnit());
    json.add("receivers", toArray(signal.getReceivers()));
    json.addProperty("comment", signal.getComment());
    json.add("value_table", valueTableToJson(signal.getValueTable().orElse(Map.of())));
    return json;
  }

  public static JsonObject valueTableToJson(Map<Long, String> values) {
    JsonObject json = new JsonObject();
    for (Map.Entry<Long, String> entry : values.entrySet()) {
      json.addProperty(Long.toString(entry.getKey()), entry.getValue());
    }
    return json;
  }

  private static JsonArray toArray(List<String> values) {
    JsonArray array = new JsonArray();
    for (String value : values) {
      array.add(value);
    }
    return array;
  }
}
