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

package io.mapsmessaging.dbc.export;

import io.mapsmessaging.dbc.model.DbcDatabase;
import io.mapsmessaging.dbc.model.DbcMessage;
import io.mapsmessaging.dbc.model.DbcSignal;
import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import lombok.experimental.UtilityClass;

/**
 * Renders a {@link DbcDatabase} back to DBC text. The output only uses the directives the parser
 * reads, so parsing it yields an equal database.
 */
@UtilityClass
public class DbcWriter {

  private static final String NEW_LINE = "\n";

  public static String write(DbcDatabase database) {
    StringBuilder sb = new StringBuilder(1024);

    sb.append("VERSION \"").append(quoteSafe(database.getVersion())).append('"').append(NEW_LINE);
    sb.append(NEW_LINE);

    sb.append("BU_:");
    for (String ecu : database.getEcus()) {
      sb.append(' ').append(ecu);
    }
    sb.append(NEW_LINE);
    sb.append(NEW_LINE);

    for (Map.Entry<String, Map<Long, String>> table : database.getValueTables().entrySet()) {
      sb.append("VAL_TABLE_ ").append(table.getKey());
      appendValuePairs(sb, table.getValue());
      sb.append(NEW_LINE);
    }
    if (!database.getValueTables().isEmpty()) {
      sb.append(NEW_LINE);
    }

    for (DbcMessage message : database.getMessages()) {
      appendMessage(sb, message);
      sb.append(NEW_LINE);
    }

    for (DbcMessage message : database.getMessages()) {
      if (!message.getComment().isEmpty()) {
        sb.append("CM_ BO_ ").append(message.getCanId())
            .append(" \"").append(quoteSafe(message.getComment())).append("\";").append(NEW_LINE);
      }
      for (DbcSignal signal : message.getSignals()) {
        if (!signal.getComment().isEmpty()) {
          sb.append("CM_ SG_ ").append(message.getCanId()).append(' ').append(signal.getName())
              .append(" \"").append(quoteSafe(signal.getComment())).append("\";").append(NEW_LINE);
        }
      }
    }

    for (DbcMessage message : database.getMessages()) {
      for (DbcSignal signal : message.getSignals()) {
        signal.getValueTable().ifPresent(values -> {
          sb.append("VAL_ ").append(message.getCanId()).append(' ').append(signal.getName());
          appendValuePairs(sb, values);
          sb.append(NEW_LINE);
        });
      }
    }

    return sb.toString();
  }

  public static void writeToFile(DbcDatabase database, Path filePath) throws IOException {
    try (Writer writer = Files.newBufferedWriter(filePath, StandardCharsets.UTF_8)) {
      writer.write(write(database));
    }
  }

  private static void appendMessage(StringBuilder sb, DbcMessage message) {
    sb.append("BO_ ").append(message.getCanId()).append(' ').append(message.getName())
        .append(": ").append(message.getDlc()).append(' ').append(message.getSender()).append(NEW_LINE);

    for (DbcSignal signal : message.getSignals()) {
      sb.append(" SG_ ").append(signal.getName()).append(" : ")
          .append(signal.getBitStart()).append('|').append(signal.getBitLength())
          .append('@').append(signal.getByteOrder().getWireCode()).append(signal.getValueType().getWireCode())
          .append(" (").append(formatNumber(signal.getFactor())).append(',').append(formatNumber(signal.getOffset()))
          .append(") [").append(formatNumber(signal.getMinimum())).append('|').append(formatNumber(signal.getMaximum()))
          .append("] \"").append(quoteSafe(signal.getUnit())).append('"');
      if (!signal.getReceivers().isEmpty()) {
        sb.append(' ').append(String.join(",", signal.getReceivers()));
      }
      sb.append(NEW_LINE);
    }
  }

  private static void appendValuePairs(StringBuilder sb, Map<Long, String> values) {
    for (Map.Entry<Long, String> entry : values.entrySet()) {
      sb.append(' ').append(entry.getKey()).append(" \"").append(quoteSafe(entry.getValue())).append('"');
    }
    sb.append(" ;");
  }

  /**
   * Shortest decimal text that reads back to the same double.
   */
  static String formatNumber(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new IllegalArgumentException("Cannot write non-finite value " + value + " to DBC");
    }
    if (value == 0.0) {
      return Double.doubleToRawLongBits(value) == 0L ? "0" : "-0";
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }

  // Free text is single-line and unescaped in this format.
  private static String quoteSafe(String text) {
    if (text == null) {
      return "";
    }
    return text.replace('"', '\'').replace('\r', ' ').replace('\n', ' ');
  }
}
