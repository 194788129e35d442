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
import java.util.Optional;

/**
 * The document split into lines, each classified once. Extractors walk this and never re-split the
 * source text.
 */
public final class LineCorpus {

  private final List<ClassifiedLine> lines;

  private LineCorpus(List<ClassifiedLine> lines) {
    this.lines = List.copyOf(lines);
  }

  public static LineCorpus of(String content) {
    String text = content == null ? "" : content;
    String[] rawLines = text.split("\n", -1);
    List<ClassifiedLine> classified = new ArrayList<>(rawLines.length);
    for (int i = 0; i < rawLines.length; i++) {
      classified.add(DbcLineClassifier.classify(i + 1, rawLines[i]));
    }
    return new LineCorpus(classified);
  }

  public int size() {
    return lines.size();
  }

  public ClassifiedLine get(int index) {
    return lines.get(index);
  }

  public List<ClassifiedLine> lines() {
    return lines;
  }

  public List<ClassifiedLine> linesOf(DirectiveKind kind) {
    List<ClassifiedLine> matching = new ArrayList<>();
    for (ClassifiedLine line : lines) {
      if (line.is(kind)) {
        matching.add(line);
      }
    }
    return matching;
  }

  public Optional<ClassifiedLine> firstOf(DirectiveKind kind) {
    for (ClassifiedLine line : lines) {
      if (line.is(kind)) {
        return Optional.of(line);
      }
    }
    return Optional.empty();
  }
}
