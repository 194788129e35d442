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

/**
 * {@code CM_ BO_ <id> "<text>";} and {@code CM_ SG_ <id> <signal> "<text>";}. Comments are only
 * collected here and attached by the assembler.
 */
class CommentExtractor implements DirectiveExtractor {

  @Override
  public void extract(LineCorpus corpus, DbcDatabaseBuilder builder) {
    for (ClassifiedLine line : corpus.lines()) {
      switch (line.kind()) {
        case SIGNAL_COMMENT -> {
          long canId = DirectiveFields.parseLong(line, 1, "message id");
          builder.putComment(CommentKey.forSignal(canId, line.group(2)), line.group(3));
        }
        case MESSAGE_COMMENT -> {
          long canId = DirectiveFields.parseLong(line, 1, "message id");
          builder.putComment(CommentKey.forMessage(canId), line.group(2));
        }
        default -> {
          // not a comment
        }
      }
    }
  }
}
