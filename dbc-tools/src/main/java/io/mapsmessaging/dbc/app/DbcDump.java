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

package io.mapsmessaging.dbc.app;

import com.google.gson.JsonObject;
import io.mapsmessaging.dbc.export.DbcWriter;
import io.mapsmessaging.dbc.json.DbcJsonConverter;
import io.mapsmessaging.dbc.model.DbcDatabase;
import io.mapsmessaging.dbc.model.DbcMessage;
import io.mapsmessaging.dbc.parser.DbcParser;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a DBC file and prints it as JSON, or as regenerated DBC text with {@code --export}.
 *
 * <pre>
 *   DbcDump &lt;file.dbc&gt; [--search &lt;term&gt;] [--export]
 * </pre>
 */
public final class DbcDump {

  private static final Logger logger = LoggerFactory.getLogger(DbcDump.class);

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  private static final String USAGE = "Usage: DbcDump <file.dbc> [--search <term>] [--export]";

  private DbcDump() {
  }

  public static void main(String[] args) {
    int status = run(args, System.out, System.err);
    if (status != EXIT_OK) {
      System.exit(status);
    }
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    Path filePath = null;
    String searchTerm = null;
    boolean export = false;

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (arg.equals("--export")) {
        export = true;
      }
      else if (arg.equals("--search")) {
        if (i + 1 >= args.length) {
          err.println(USAGE);
          return EXIT_USAGE;
        }
        searchTerm = args[++i];
      }
      else if (arg.startsWith("--") || filePath != null) {
        err.println(USAGE);
        return EXIT_USAGE;
      }
      else {
        filePath = Path.of(arg);
      }
    }

    if (filePath == null) {
      err.println(USAGE);
      return EXIT_USAGE;
    }
    if (export && searchTerm != null) {
      err.println("--search cannot be combined with --export");
      return EXIT_USAGE;
    }
    if (!Files.isRegularFile(filePath)) {
      logger.error("DBC file not found: {}", filePath);
      return EXIT_FAILURE;
    }

    DbcDatabase database;
    try {
      database = DbcParser.parseFromFile(filePath);
    }
    catch (IOException exception) {
      logger.error("Unable to read {}", filePath, exception);
      return EXIT_FAILURE;
    }
    catch (IllegalArgumentException exception) {
      logger.error("Unable to parse {}: {}", filePath, exception.getMessage());
      return EXIT_FAILURE;
    }

    if (export) {
      out.print(DbcWriter.write(database));
      return EXIT_OK;
    }

    List<DbcMessage> messages = database.search(searchTerm);
    JsonObject json = DbcJsonConverter.toJson(database, messages);
    out.println(DbcJsonConverter.toJsonString(json));
    logger.info("{}: {} of {} messages, {} signals", filePath.getFileName(), messages.size(),
        database.getMessages().size(), database.getSignalCount());
    return EXIT_OK;
  }
}
