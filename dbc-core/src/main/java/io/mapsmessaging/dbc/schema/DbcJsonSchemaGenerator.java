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

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.mapsmessaging.dbc.json.DbcJsonConverter;
import io.mapsmessaging.dbc.model.DbcMessage;
import io.mapsmessaging.dbc.model.DbcSignal;
import lombok.experimental.UtilityClass;

/**
 * JSON Schema (draft 2020-12) describing the decoded form of one message: its hex id plus one
 * numeric property per signal.
 */
@UtilityClass
public class DbcJsonSchemaGenerator {

  public static JsonObject generateSchema(DbcMessage message) {
    JsonObject schema = new JsonObject();

    schema.addProperty("$schema", "https://json-schema.org/draft/2020-12/schema");
    schema.addProperty("$id", "dbc/message/" + message.getHexId() + ".schema.json");
    schema.addProperty("title", buildTitle(message));
    if (!message.getComment().isBlank()) {
      schema.addProperty("description", message.getComment());
    }
    schema.addProperty("type", "object");

    JsonObject properties = new JsonObject();

    JsonObject id = new JsonObject();
    id.addProperty("type", "string");
    id.addProperty("const", message.getHexId());
    properties.add("id", id);

    JsonObject decoded = new JsonObject();
    decoded.addProperty("type", "object");

    JsonObject decodedProperties = new JsonObject();
    for (DbcSignal signal : message.getSignals()) {
      decodedProperties.add(signal.getName(), buildSignalProperty(signal));
    }

    decoded.add("properties", decodedProperties);
    decoded.addProperty("additionalProperties", false);
    properties.add("decoded", decoded);

    schema.add("properties", properties);

    JsonArray required = new JsonArray();
    required.add("id");
    required.add("decoded");
    schema.add("required", required);

    schema.addProperty("additionalProperties", false);
    return schema;
  }

  private static JsonObject buildSignalProperty(DbcSignal signal) {
    JsonObject prop = new JsonObject();
    prop.addProperty("type", "number");

    String description = buildSignalDescription(signal);
    if (description != null) {
      prop.addProperty("description", description);
    }

    // [0|0] and similar degenerate ranges mean "unspecified" in most DBC files
    if (signal.getMinimum() < signal.getMaximum()) {
      prop.addProperty("minimum", signal.getMinimum());
      prop.addProperty("maximum", signal.getMaximum());
    }

    if (signal.getFactor() > 0.0 && signal.getOffset() == 0.0) {
      prop.addProperty("multipleOf", signal.getFactor());
    }

    prop.addProperty("x-startBit", signal.getBitStart());
    prop.addProperty("x-bitLength", signal.getBitLength());
    prop.addProperty("x-byteOrder", signal.getByteOrder().getLabel());
    prop.addProperty("x-signed", signal.isSigned());
    prop.addProperty("x-factor", signal.getFactor());
    prop.addProperty("x-offset", signal.getOffset());

    if (!signal.getUnit().isBlank()) {
      prop.addProperty("x-unit", signal.getUnit());
    }
    if (!signal.getComment().isBlank()) {
      prop.addProperty("x-comment", signal.getComment());
    }
    if (!signal.getReceivers().isEmpty()) {
      JsonArray receivers = new JsonArray();
      for (String receiver : signal.getReceivers()) {
        receivers.add(receiver);
      }
      prop.add("x-receivers", receivers);
    }
    signal.getValueTable().ifPresent(values -> prop.add("x-valueTable", DbcJsonConverter.valueTableToJson(values)));
    return prop;
  }

  private static String buildTitle(DbcMessage message) {
    StringBuilder sb = new StringBuilder();
    sb.append("DBC message ").append(message.getHexId());

    String name = message.getName();
    if (name != null && !name.isBlank()) {
      sb.append(" ").append(name);
    }
    String sender = message.getSender();
    if (sender != null && !sender.isBlank()) {
      sb.append(" from ").append(sender);
    }
    return sb.toString();
  }

  private static String buildSignalDescription(DbcSignal signal) {
    String name = signal.getName();
    String unit = signal.getUnit();

    if (unit.isBlank()) {
      return name;
    }
    return name + " (" + unit + ")";
  }
}
