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
 * Target of a {@code CM_} directive. The identifier is the bare CAN id for a message, or
 * {@code <id>_<signal>} for a signal.
 */
public record CommentKey(CommentKind kind, String identifier) {

  static final char SIGNAL_SEPARATOR = '_';

  public static CommentKey forMessage(long canId) {
    return new CommentKey(CommentKind.MESSAGE, Long.toString(canId));
  }

  public static CommentKey forSignal(long canId, String signalName) {
    return new CommentKey(CommentKind.SIGNAL, canId + String.valueOf(SIGNAL_SEPARATOR) + signalName);
  }
}
