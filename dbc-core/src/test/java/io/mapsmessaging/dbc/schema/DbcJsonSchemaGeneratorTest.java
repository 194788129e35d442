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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.mapsmessaging.dbc.model.ByteOrder;
import io.mapsmessaging.dbc.model.DbcMessage;
import io.mapsmessaging.dbc.model.DbcSignal;
import io.mapsmessaging.dbc.model.ValueType;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DbcJsonSchemaGeneratorTest {

  @Test
  void generateSchema_basics_includesSchemaTitleIdConstAndNoAdditionalProperties() {
    DbcMessage message = mock(DbcMessage.class);
    when(message.getHexId()).thenReturn("1F4");
    when(message.getName()).thenReturn("SpeedData");
    when(message.getSender()).thenReturn("ECU1");
    when(message.getComment()).thenReturn("");
    when(message.getSignals()).thenReturn(List.of());

    JsonObject schema = DbcJsonSchemaGenerator.generateSchema(message);

    assertEquals("https://json-schema.org/draft/2020-12/schema", schema.get("$schema").getAsString());
    assertEquals("dbc/message/1F4.schema.json", schema.get("$id").getAsString());
    assertEquals("DBC message 1F4 SpeedData from ECU1", schema.get("title").getAsString());
    assertFalse(schema.has("description"));
    assertEquals("object", schema.get("type").getAsString());
    assertFalse(schema.get("additionalProperties").getAsBoolean());

    JsonArray required = schema.getAsJsonArray("required");
    assertEquals(2, required.size());
    assertEquals("id", required.get(0).getAsString());
    assertEquals("decoded", required.get(1).getAsString());

    JsonObject id = schema.getAsJsonObject("properties").getAsJsonObject("id");
    assertEquals("string", id.get("type").getAsString());
    assertEquals("1F4", id.get("const").getAsString());

    JsonObject decoded = schema.getAsJsonObject("properties").getAsJsonObject("decoded");
    assertFalse(decoded.get("additionalProperties").getAsBoolean());
    assertTrue(decoded.getAsJsonObject("properties").entrySet().isEmpty());
  }

  @Test
  void generateSchema_numericSignal_hasRangeMultipleOfAndLayoutMetadata() {
    DbcSignal speed = DbcSignal.builder()
        .name("Speed")
        .bitStart(0)
        .bitLength(16)
        .byteOrder(ByteOrder.LITTLE)
        .valueType(ValueType.UNSIGNED)
        .factor(0.01)
        .offset(0)
        .minimum(0)
        .maximum(655.35)
        .unit("km/h")
        .receivers(List.of("ECU2"))
        .comment("vehicle speed")
        .valueTable(Map.of(0L, "Stopped"))
        .build();

    JsonObject prop = signalProperty(message(speed), "Speed");

    assertEquals("number", prop.get("type").getAsString());
    assertEquals("Speed (km/h)", prop.get("description").getAsString());
    assertEquals(0.0, prop.get("minimum").getAsDouble(), 0.0000001);
    assertEquals(655.35, prop.get("maximum").getAsDouble(), 0.0000001);
    assertEquals(0.01, prop.get("multipleOf").getAsDouble(), 0.0000001);

    assertEquals(0, prop.get("x-startBit").getAsInt());
    assertEquals(16, prop.get("x-bitLength").getAsInt());
    assertEquals("little", prop.get("x-byteOrder").getAsString());
    assertFalse(prop.get("x-signed").getAsBoolean());
    assertEquals("km/h", prop.get("x-unit").getAsString());
    assertEquals("vehicle speed", prop.get("x-comment").getAsString());
    assertEquals("ECU2", prop.getAsJsonArray("x-receivers").get(0).getAsString());
    assertEquals("Stopped", prop.getAsJsonObject("x-valueTable").get("0").getAsString());
  }

  @Test
  void generateSchema_degenerateRangeAndOffset_omitConstraints() {
    DbcSignal temp = DbcSignal.builder()
        .name("Temp")
        .bitLength(8)
        .valueType(ValueType.SIGNED)
        .factor(1)
        .offset(-40)
        .minimum(0)
        .maximum(0)
        .build();

    JsonObject prop = signalProperty(message(temp), "Temp");

    assertEquals("Temp", prop.get("description").getAsString());
    assertFalse(prop.has("minimum"));
    assertFalse(prop.has("maximum"));
    assertFalse(prop.has("multipleOf"));
    assertTrue(prop.get("x-signed").getAsBoolean());
    assertFalse(prop.has("x-unit"));
    assertFalse(prop.has("x-valueTable"));
    assertFalse(prop.has("x-receivers"));
  }

  @Test
  void generateSchema_keepsSignalDeclarationOrder() {
    DbcSignal later = DbcSignal.builder().name("Later").bitStart(8).bitLength(8).factor(1).build();
    DbcSignal earlier = DbcSignal.builder().name("Earlier").bitStart(0).bitLength(8).factor(1).build();

    JsonObject decodedProperties = DbcJsonSchemaGenerator.generateSchema(message(later, earlier))
        .getAsJsonObject("properties")
        .getAsJsonObject("decoded")
        .getAsJsonObject("properties");

    Iterator<Map.Entry<String, JsonElement>> iterator = decodedProperties.entrySet().iterator();
    assertEquals("Later", iterator.next().getKey());
    assertEquals("Earlier", iterator.next().getKey());
    assertFalse(iterator.hasNext());
  }

  @Test
  void generateSchema_messageComment_becomesDescription() {
    DbcMessage message = DbcMessage.builder().canId(1).name("M").dlc(8).sender("A").comment("Status").build();

    assertEquals("Status", DbcJsonSchemaGenerator.generateSchema(message).get("description").getAsString());
  }

  private static DbcMessage message(DbcSignal... signals) {
    return DbcMessage.builder().canId(500).name("SpeedData").dlc(8).sender("ECU1").signals(List.of(signals)).build();
  }

  private static JsonObject signalProperty(DbcMessage message, String signalName) {
    JsonObject prop = DbcJsonSchemaGenerator.generateSchema(message)
        .getAsJsonObject("properties")
        .getAsJsonObject("decoded")
        .getAsJsonObject("properties")
        .getAsJsonObject(signalName);
    assertNotNull(prop);
    return prop;
  }
}
