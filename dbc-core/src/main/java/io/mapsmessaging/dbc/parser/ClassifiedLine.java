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

import java.util.List;

/**
 * One input line with the directive it matched and the captured groups of that match.
 *
 * @param lineNumber 1-based position in the source text
 * @param text the trimmed line
 * @param kind matched directive, {@link DirectiveKind#UNRECOGNIZED} when none did
 * @param groups capture groups, index 0 holding group 1
 */
public record ClassifiedLine(int lineNumber, String text, DirectiveKind kind, List<String> groups) {

  public ClassifiedLine {
    groups = groups == null ? List.of() : List.copyOf(groups);
  }

  public boolean is(DirectiveKind directiveKind) {
    return kind == directiveKind;
  }

  /**
   * Capture group by its regex number, starting at 1. Groups that did not participate read as
   * empty strings.
   */
  public String group(int index) {
    if (index < 1 || index > groups.size()) {
      throw new IndexOutOfBoundsException("No group " + index + " for " + kind + " at line " + lineNumber);
    }
    return groups.get(index - 1);
  }
}
