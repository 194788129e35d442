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

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DbcDatabaseTest {

  @Test
  void hexId_padsToThreeDigitsWithoutTruncating() {
    assertEquals("001", message(1, "A").getHexId());
    assertEquals("1F4", message(500, "A").getHexId());
    assertEquals("7FF", message(0x7FF, "A").getHexId());
    assertEquals("18FEF100", message(0x18FEF100L, "A").getHexId());
  }

  @Test
  void message_negativeId_isRejected() {
    assertThrows(IllegalArgumentException.class, () -> message(-1, "A"));
  }

  @Test
  void signal_emptyName_isRejected() {
    assertThrows(IllegalArgumentException.class, () -> DbcSignal.builder().name("").build());
  }

  @Test
  void signal_defaults_areEmptyNotNull() {
    DbcSignal signal = DbcSignal.builder().name("S").bitLength(8).build();

    assertEquals("", signal.getUnit());
    assertEquals("", signal.getComment());
    assertTrue(signal.getReceivers().isEmpty());
    assertTrue(signal.getValueTable().isEmpty());
  }

  @Test
  void signal_emptyValueTable_differsFromAbsent() {
    DbcSignal absent = DbcSignal.builder().name("S").build();
    DbcSignal empty = DbcSignal.builder().name("S").valueTable(Map.of()).build();

    assertTrue(empty.getValueTable().isPresent());
    assertNotEquals(absent, empty);
  }

  @Test
  void signal_copiesMutableInputs() {
    Map<Long, String> values = new HashMap<>();
    values.put(0L, "Off");
    DbcSignal signal = DbcSignal.builder().name("S").valueTable(values).build();

    values.put(1L, "On");

    assertEquals(1, signal.getValueTable().orElseThrow().size());
    assertThrows(UnsupportedOperationException.class, () -> signal.getValueTable().orElseThrow().put(2L, "x"));
  }

  @Test
  void search_matchesHexIdSignalNameAndComment_caseInsensitive() {
    DbcMessage engine = DbcMessage.builder().canId(256).name("Engine").dlc(8).sender("E")
        .signals(List.of(DbcSignal.builder().name("EngineSpeed").comment("Crankshaft speed").build()))
        .build();
    DbcMessage brake = DbcMessage.builder().canId(1024).name("Brake").dlc(4).sender("G")
        .signals(List.of(DbcSignal.builder().name("Pressure").build()))
        .build();
    DbcDatabase database = DbcDatabase.builder().messages(List.of(engine, brake)).build();

    assertEquals(List.of(engine), database.search("crank"));
    assertEquals(List.of(engine), database.search("ENGINESPEED"));
    assertEquals(List.of(brake), database.search("400"));
    assertEquals(List.of(engine, brake), database.search(""));
    assertEquals(List.of(engine, brake), database.search(null));
    assertTrue(database.search("nothing").isEmpty());
  }

  @Test
  void search_doesNotMatchMessageName() {
    DbcDatabase database = DbcDatabase.builder().messages(List.of(message(1, "OnlyInName"))).build();

    assertTrue(database.search("onlyinname").isEmpty());
  }

  @Test
  void lookups_findByIdAndName() {
    DbcMessage first = message(10, "First");
    DbcMessage second = message(20, "Second");
    DbcDatabase database = DbcDatabase.builder().messages(List.of(first, second)).build();

    assertEquals(second, database.findMessage(20).orElseThrow());
    assertEquals(first, database.findMessageByName("First").orElseThrow());
    assertTrue(database.findMessage(30).isEmpty());
    assertTrue(database.findMessageByName("first").isEmpty());
  }

  private static DbcMessage message(long canId, String name) {
    return DbcMessage.builder().canId(canId).name(name).dlc(8).sender("N").build();
  }
}
