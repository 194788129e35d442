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

import static org.junit.jupiter.api.Assertions.*;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.mapsmessaging.dbc.model.DbcDatabase;
import io.mapsmessaging.dbc.model.DbcMessage;
import io.mapsmessaging.dbc.parser.DbcParser;
import java.util.List;
import org.junit.jupiter.api.Test;

class DbcJsonConverterTest {

  private static final String SPEED_EXAMPLE = String.join("\n",
      "BU_: ECU1 ECU2",
      "BO_ 500 SpeedData: 8 ECU1",
      "SG_ Speed : 0|16@1+ (0.01,0) [0|655.35] \"km/h\" ECU2,ECU3",
      "SG_ Raw : 16|8@0- (1,0) [-128|127] \"\"",
      "CM_ SG_ 500 Speed \"vehicle speed\";",
      "VAL_ 500 Speed 0 \"Stopped\" 1 \"Moving\" ;"
  );

  @Test
  void toJson_speedExample_matchesPublicShape() {
    JsonObject json = DbcJsonConverter.toJson(DbcParser.parse(SPEED_EXAMPLE));

    assertEquals("", json.get("version").getAsString());
    JsonArray ecus = json.getAsJsonArray("ecus");
    assertEquals(2, ecus.size());
    assertEquals("ECU1", ecus.get(0).getAsString());

    JsonObject message = json.getAsJsonArray("messages").get(0).getAsJsonObject();
    assertEquals("1F4", message.get("id").getAsString());
    assertEquals("SpeedData", message.get("name").getAsString());
    assertEquals(8, message.get("dlc").getAsInt());
    assertEquals("ECU1", message.get("sender").getAsString());
    assertEquals("", message.get("comment").getAsString());

    JsonObject speed = message.getAsJsonArray("signals").get(0).getAsJsonObject();
    assertEquals("Speed", speed.get("name").getAsString());
    assertEquals(0, speed.get("start_bit").getAsInt());
    assertEquals(16, speed.get("bit_length").getAsInt());
    assertEquals("little", speed.get("byte_order").getAsString());
    assertEquals("unsigned", speed.get("value_type").getAsString());
    assertEquals(0.01, speed.get("factor").getAsDouble(), 0.0);
    assertEquals(0.0, speed.get("offset").getAsDouble(), 0.0);
    assertEquals(0.0, speed.get("min").getAsDouble(), 0.0);
    assertEquals(655.35, speed.get("max").getAsDouble(), 0.0);
    assertEquals("km/h", speed.get("unit").getAsString());
    assertEquals(2, speed.getAsJsonArray("receivers").size());
    assertEquals("ECU3", speed.getAsJsonArray("receivers").get(1).getAsString());
    assertEquals("vehicle speed", speed.get("comment").getAsString());

    JsonObject valueTable = speed.getAsJsonObject("value_table");
    assertEquals(2, valueTable.size());
    assertEquals("Stopped", valueTable.get("0").getAsString());
    assertEquals("Moving", valueTable.get("1").getAsString());
  }

  @Test
  void toJson_signalWithoutTable_emitsEmptyObjectAndBigSignedLabels() {
    JsonObject json = DbcJsonConverter.toJson(DbcParser.parse(SPEED_EXAMPLE));

    JsonObject raw = json.getAsJsonArray("messages").get(0).getAsJsonObject()
        .getAsJsonArray("signals").get(1).getAsJsonObject();
    assertEquals("big", raw.get("byte_order").getAsString());
    assertEquals("signed", raw.get("value_type").getAsString());
    assertTrue(raw.getAsJsonObject("value_table").entrySet().isEmpty());
    assertEquals(0, raw.getAsJsonArray("receivers").size());
  }

  @Test
  void toJson_emptyDatabase_hasAllTopLevelKeys() {
    JsonObject json = DbcJsonConverter.toJson(DbcDatabase.empty());

    assertEquals(3, json.size());
    assertEquals(0, json.getAsJsonArray("messages").size());
    assertEquals(0, json.getAsJsonArray("ecus").size());
    assertEquals("", json.get("version").getAsString());
  }

  @Test
  void toJson_subsetOfMessages_keepsDatabaseEcusAndVersion() {
    DbcDatabase database = DbcParser.parse("VERSION \"v\"\nBU_: A\nBO_ 1 One: 8 A\nBO_ 2 Two: 8 A");
    List<DbcMessage> subset = List.of(database.findMessage(2).orElseThrow());

    JsonObject json = DbcJsonConverter.toJson(database, subset);

    assertEquals(1, json.getAsJsonArray("messages").size());
    assertEquals("002", json.getAsJsonArray("messages").get(0).getAsJsonObject().get("id").getAsString());
    assertEquals("v", json.get("version").getAsString());
  }

  @Test
  void toJsonString_isParseableAndKeepsUnitCharacters() {
    DbcDatabase database = DbcParser.parse("BO_ 1 M: 8 A\n SG_ T : 0|8@1+ (1,0) [0|1] \"<°C>\" B");

    String text = DbcJsonConverter.toJsonString(database);

    assertTrue(text.contains("<°C>"));
    JsonObject reparsed = JsonParser.parseString(text).getAsJsonObject();
    assertEquals(DbcJsonConverter.toJson(database), reparsed);
  }
}
