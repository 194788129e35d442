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

import io.mapsmessaging.dbc.model.ByteOrder;
import io.mapsmessaging.dbc.model.ValueType;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds messages from {@code BO_} lines and the {@code SG_} lines directly below them.
 *
 * <p>A block ends at the first line that is not a signal. That line is not consumed: it goes back
 * to the scanning state, since it is frequently the next {@code BO_} declaration. Signal lines met
 * outside a block are ignored.
 */
class MessageBlockParser implements DirectiveExtractor {

  @Override
  public void extract(LineCorpus corpus, DbcDatabaseBuilder builder) {
    BlockState state = BlockState.SCANNING;
    MessageDraft current = null;
    int index = 0;

    while (index < corpus.size()) {
      ClassifiedLine line = corpus.get(index);
      switch (state) {
        case SCANNING -> {
          if (line.is(DirectiveKind.MESSAGE)) {
            current = openMessage(line);
            builder.putMessage(current);
            state = BlockState.IN_BLOCK;
          }
          index++;
        }
        case IN_BLOCK -> {
          if (line.is(DirectiveKind.SIGNAL)) {
            current.addSignal(parseSignal(line));
            index++;
          }
          else {
            state = BlockState.SCANNING;
          }
        }
        default -> throw new IllegalStateException("Unknown block state " + state);
      }
    }
  }

  private static MessageDraft openMessage(ClassifiedLine line) {
    long canId = DirectiveFields.parseLong(line, 1, "message id");
    String name = line.group(2);
    int dlc = DirectiveFields.parseInt(line, 3, "dlc");
    String sender = line.group(4);
    return new MessageDraft(canId, name, dlc, sender);
  }

  private static SignalDraft parseSignal(ClassifiedLine line) {
    String name = line.group(1);
    int bitStart = DirectiveFields.parseInt(line, 2, "start bit");
    int bitLength = DirectiveFields.parseInt(line, 3, "bit length");
    ByteOrder byteOrder = ByteOrder.fromWireCode(line.group(4).charAt(0));
    ValueType valueType = ValueType.fromWireCode(line.group(5).charAt(0));
    double factor = DirectiveFields.parseDouble(line, 6, "factor");
    double offset = DirectiveFields.parseDouble(line, 7, "offset");
    double minimum = DirectiveFields.parseDouble(line, 8, "minimum");
    double maximum = DirectiveFields.parseDouble(line, 9, "maximum");
    String unit = line.group(10);
    List<String> receivers = splitReceivers(line.group(11));

    return new SignalDraft(
        name,
        bitStart,
        bitLength,
        byteOrder,
        valueType,
        factor,
        offset,
        minimum,
        maximum,
        unit,
        receivers
    );
  }

  private static List<String> splitReceivers(String text) {
    Set<String> receivers = new LinkedHashSet<>();
    for (String token : text.split(",")) {
      String trimmed = token.trim();
      if (!trimmed.isEmpty()) {
        receivers.add(trimmed);
      }
    }
    return new ArrayList<>(receivers);
  }
}
