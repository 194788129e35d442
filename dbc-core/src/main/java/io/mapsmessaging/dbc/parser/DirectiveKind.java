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

import java.util.regex.Pattern;
import lombok.Getter;

/**
 * Line shapes recognized in a DBC document. Patterns are applied to the trimmed line and anchored
 * at its start; trailing text after a match is ignored.
 */
public enum DirectiveKind {

  VERSION("^VERSION\\s+\"([^\"]*)\""),

  NODES("^BU_:\\s*(.*)"),

  VALUE_TABLE("^VAL_TABLE_\\s+(\\w+)\\s+(.*?)\\s*;"),

  MESSAGE("^BO_\\s+(\\d+)\\s+(\\w+):\\s+(\\d+)\\s+(\\w+)"),

  SIGNAL("^SG_\\s+(\\w+)\\s*:\\s*(\\d+)\\|(\\d+)@([01])([+-])\\s*"
      + "\\(([^,]+),([^)]+)\\)\\s*\\[([^|]+)\\|([^\\]]+)\\]\\s*\"([^\"]*)\"\\s*(.*)"),

  MESSAGE_COMMENT("^CM_\\s+BO_\\s+(\\d+)\\s+\"([^\"]*)\"\\s*;"),

  SIGNAL_COMMENT("^CM_\\s+SG_\\s+(\\d+)\\s+(\\w+)\\s+\"([^\"]*)\"\\s*;"),

  SIGNAL_VALUES("^VAL_\\s+(\\d+)\\s+(\\w+)\\s+(.*?)\\s*;"),

  UNRECOGNIZED(null);

  @Getter
  private final Pattern pattern;

  DirectiveKind(String regex) {
    this.pattern = regex == null ? null : Pattern.compile(regex);
  }
}
