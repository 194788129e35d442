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

import lombok.Getter;

/**
 * A recognized directive carried a field that could not be read as a number. The whole parse is
 * abandoned; no partial database is produced.
 */
@Getter
public class DbcParseException extends IllegalArgumentException {

  private final int lineNumber;
  private final DirectiveKind directiveKind;
  private final String lineText;

  public DbcParseException(ClassifiedLine line, String field, String value, Throwable cause) {
    super("Invalid " + field + " '" + value + "' in " + line.kind() + " directive at line "
        + line.lineNumber() + ": " + line.text(), cause);
    this.lineNumber = line.lineNumber();
    this.directiveKind = line.kind();
    this.lineText = line.text();
  }
}
