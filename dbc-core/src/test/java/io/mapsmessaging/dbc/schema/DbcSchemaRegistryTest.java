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

import com.google.gson.JsonObject;
import io.mapsmessaging.dbc.model.DbcDatabase;
import io.mapsmessaging.dbc.parser.DbcParser;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;

class DbcSchemaRegistryTest {

  @Test
  void registry_buildsOneSchemaPerMessage() throws IOException {
    DbcDatabase database = DbcParser.parseFromClasspath("dbc/vehicle.dbc");
    DbcSchemaRegistry registry = new DbcSchemaRegistry(database);

    assertEquals(List.of(256L, 1024L, 2566844926L), registry.listCanIds());
    assertEquals(3, registry.getSchemas().size());

    JsonObject brake = registry.getSchema(1024);
    assertEquals("400", brake.getAsJsonObject("properties").getAsJsonObject("id").get("const").getAsString());
    assertTrue(brake.getAsJsonObject("properties").getAsJsonObject("decoded")
        .getAsJsonObject("properties").has("BrakePressure"));
  }

  @Test
  void registry_cachesSchemas() throws IOException {
    DbcSchemaRegistry registry = new DbcSchemaRegistry(DbcParser.parseFromClasspath("dbc/vehicle.dbc"));

    assertSame(registry.getSchema(256), registry.getSchema(256));
  }

  @Test
  void registry_unknownId_throws() {
    DbcSchemaRegistry registry = new DbcSchemaRegistry(DbcDatabase.empty());

    assertThrows(IllegalArgumentException.class, () -> registry.getSchema(1));
    assertTrue(registry.listCanIds().isEmpty());
  }
}
