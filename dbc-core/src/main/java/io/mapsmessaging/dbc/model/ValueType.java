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

import lombok.Getter;

@Getter
public enum ValueType {
  SIGNED("signed", '-'),
  UNSIGNED("unsigned", '+');

  private final String label;
  private final char wireCode;

  ValueType(String label, char wireCode) {
    this.label = label;
    this.wireCode = wireCode;
  }

  public static ValueType fromWireCode(char code) {
    return code == '-' ? SIGNED : UNSIGNED;
  }
}
