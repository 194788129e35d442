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

/**
 * {@code BU_: ECU1 ECU2}. Only the first such line is used.
 */
class NodeListExtractor implements DirectiveExtractor {

  @Override
  public void extract(LineCorpus corpus, DbcDatabaseBuilder builder) {
    corpus.firstOf(DirectiveKind.NODES)
        .ifPresent(line -> builder.setEcus(splitNodes(line.group(1))));
  }

  private static List<String> splitNodes(String text) {
    List<String> nodes = new ArrayList<>();
    String trimmed = text.trim();
    if (trimmed.isEmpty()) {
      return nodes;
    }
    for (String token : trimmed.split("\\s+")) {
      nodes.add(token);
    }
    return nodes;
  }
}
