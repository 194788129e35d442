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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.experimental.UtilityClass;

/**
 * Numeric field conversion for matched directives. The directive patterns only guarantee the
 * character class of a field, so every conversion here can still fail.
 */
@UtilityClass
class DirectiveFields {

  private static final Pattern DECIMAL_LITERAL =
      Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

  private static final Pattern VALUE_PAIR = Pattern.compile("(-?\\d+)\\s+\"([^\"]*)\"");

  static long parseLong(ClassifiedLine line, int group, String field) {
    String text = line.group(group).trim();
    try {
      return Long.parseLong(text);
    }
    catch (NumberFormatException exception) {
      throw new DbcParseException(line, field, text, exception);
    }
  }

  static int parseInt(ClassifiedLine line, int group, String field) {
    String text = line.group(group).trim();
    try {
      return Integer.parseInt(text);
    }
    catch (NumberFormatException exception) {
      throw new DbcParseException(line, field, text, exception);
    }
  }

  static double parseDouble(ClassifiedLine line, int group, String field) {
    String text = line.group(group).trim();
    if (!DECIMAL_LITERAL.matcher(text).matches()) {
      throw new DbcParseException(line, field, text, new NumberFormatException("Not a decimal literal: " + text));
    }
    try {
      return Double.parseDouble(text);
    }
    catch (NumberFormatException exception) {
      throw new DbcParseException(line, field, text, exception);
    }
  }

  /**
   * Reads {@code <integer> "<label>"} pairs, skipping anything between them. A repeated key keeps
   * the last label.
   */
  static Map<Long, String> parseValuePairs(ClassifiedLine line, int group) {
    Map<Long, String> values = new LinkedHashMap<>();
    Matcher matcher = VALUE_PAIR.matcher(line.group(group));
    while (matcher.find()) {
      String key = matcher.group(1);
      try {
        values.put(Long.parseLong(key), matcher.group(2));
      }
      catch (NumberFormatException exception) {
        throw new DbcParseException(line, "value key", key, exception);
      }
    }
    return values;
  }
}
