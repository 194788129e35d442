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

import io.mapsmessaging.dbc.model.DbcMessage;
import io.mapsmessaging.dbc.model.DbcSignal;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Setter;

@Getter
@RequiredArgsConstructor
class MessageDraft {

  private final long canId;
  private final String name;
  private final int dlc;
  private final String sender;
  private final List<SignalDraft> signals = new ArrayList<>();

  @Setter
  private String comment = "";

  void addSignal(SignalDraft signal) {
    signals.add(signal);
  }

  List<SignalDraft> signalsNamed(String signalName) {
    List<SignalDraft> matching = new ArrayList<>();
    for (SignalDraft signal : signals) {
      if (signal.getName().equals(signalName)) {
        matching.add(signal);
      }
    }
    return matching;
  }

  DbcMessage freeze() {
    List<DbcSignal> frozen = new ArrayList<>(signals.size());
    for (SignalDraft signal : signals) {
      frozen.add(signal.freeze());
    }
    return DbcMessage.builder()
        .canId(canId)
        .name(name)
        .dlc(dlc)
        .sender(sender)
        .signals(frozen)
        .comment(comment)
        .build();
  }
}
