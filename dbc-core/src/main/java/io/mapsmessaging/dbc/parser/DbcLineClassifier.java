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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import lombok.experimental.UtilityClass;

@UtilityClass
public class DbcLineClassifier {

  public static ClassifiedLine classify(int lineNumber, String rawLine) {
    String text = rawLine == null ? "" : rawLine.strip();

    for (DirectiveKind kind : DirectiveKind.values()) {
      if (kind.getPattern() == null) {
        continue;
      }
      Matcher matcher = kind.getPattern().matcher(text);
      if (matcher.lookingAt()) {
        return new ClassifiedLine(lineNumber, text, kind, captureGroups(matcher));
      }
    }
    return new ClassifiedLine(lineNumber, text, DirectiveKind.UNRECOGNIZED, List.of());
  }

  private static List<String> captureGroups(Matcher matcher) {
    List<String> groups = new ArrayList<>(matcher.groupCount());
    for (int i = 1; i <= matcher.groupCount(); i++) {
      String group = matcher.group(i);
      groups.add(group == null ? "" : group);
    }
    return groups;
  }
}
