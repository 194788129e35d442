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

import io.mapsmessaging.dbc.model.DbcDatabase;
import io.mapsmessaging.dbc.model.DbcMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Final pass: attaches collected comments, reads the version and freezes the builder.
 */
class DatabaseAssembler {

  private static final Logger logger = LoggerFactory.getLogger(DatabaseAssembler.class);

  DbcDatabase assemble(LineCorpus corpus, DbcDatabaseBuilder builder) {
    applyComments(builder);

    List<DbcMessage> messages = new ArrayList<>(builder.getMessages().size());
    for (MessageDraft draft : builder.getMessages().values()) {
      messages.add(draft.freeze());
    }

    return DbcDatabase.builder()
        .messages(messages)
        .ecus(builder.getEcus())
        .version(extractVersion(corpus))
        .valueTables(builder.getValueTables())
        .build();
  }

  private static void applyComments(DbcDatabaseBuilder builder) {
    for (Map.Entry<CommentKey, String> entry : builder.getComments().entrySet()) {
      CommentKey key = entry.getKey();
      String text = entry.getValue();
      switch (key.kind()) {
        case MESSAGE -> applyMessageComment(builder, key, text);
        case SIGNAL -> applySignalComment(builder, key, text);
        default -> throw new IllegalStateException("Unknown comment kind " + key.kind());
      }
    }
  }

  private static void applyMessageComment(DbcDatabaseBuilder builder, CommentKey key, String text) {
    MessageDraft message = builder.getMessage(Long.parseLong(key.identifier()));
    if (message == null) {
      logger.debug("Dropping comment for unknown message {}", key.identifier());
      return;
    }
    message.setComment(text);
  }

  private static void applySignalComment(DbcDatabaseBuilder builder, CommentKey key, String text) {
    String identifier = key.identifier();
    int separator = identifier.indexOf(CommentKey.SIGNAL_SEPARATOR);
    long canId = Long.parseLong(identifier.substring(0, separator));
    String signalName = identifier.substring(separator + 1);

    MessageDraft message = builder.getMessage(canId);
    List<SignalDraft> signals = message == null ? List.of() : message.signalsNamed(signalName);
    if (signals.isEmpty()) {
      logger.debug("Dropping comment for unknown signal {}", identifier);
      return;
    }
    for (SignalDraft signal : signals) {
      signal.setComment(text);
    }
  }

  private static String extractVersion(LineCorpus corpus) {
    return corpus.firstOf(DirectiveKind.VERSION)
        .map(line -> line.group(1))
        .orElse("");
  }
}
