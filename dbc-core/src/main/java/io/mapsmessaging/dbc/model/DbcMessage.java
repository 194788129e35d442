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

package io.mapsmessaging.dbc.model;

import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One CAN frame definition and its signals, in declaration order.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class DbcMessage {

  private final long canId;
  private final String name;
  private final int dlc;
  private final String sender;
  private final List<DbcSignal> signals;
  private final String comment;

  @Builder
  private DbcMessage(long canId, String name, int dlc, String sender, List<DbcSignal> signals, String comment) {
    if (canId < 0) {
      throw new IllegalArgumentException("CAN id must not be negative, got " + canId);
    }
    this.canId = canId;
    this.name = name;
    this.dlc = dlc;
    this.sender = sender;
    this.signals = signals == null ? List.of() : List.copyOf(signals);
    this.comment = comment == null ? "" : comment;
  }

  /**
   * Upper case hex, at least three digits, never truncated.
   */
  public String getHexId() {
    return String.format("%03X", canId);
  }

  public Optional<DbcSignal> findSignal(String signalName) {
    for (DbcSignal signal : signals) {
      if (signal.getName().equals(signalName)) {
        return Optional.of(signal);
      }
    }
    return Optional.empty();
  }
}
