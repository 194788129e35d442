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
import io.mapsmessaging.dbc.model.DbcSignal;
import io.mapsmessaging.dbc.model.ValueType;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Setter;

/**
 * Signal under construction. Layout fields are fixed once the {@code SG_} line is read; the comment
 * and value table are filled in by later passes.
 */
@Getter
@RequiredArgsConstructor
class SignalDraft {

  private final String name;
  private final int bitStart;
  private final int bitLength;
  private final ByteOrder byteOrder;
  private final ValueType valueType;
  private final double factor;
  private final double offset;
  private final double minimum;
  private final double maximum;
  private final String unit;
  private final List<String> receivers;

  @Setter
  private String comment = "";

  @Setter
  private Map<Long, String> valueTable;

  DbcSignal freeze() {
    return DbcSignal.builder()
        .name(name)
        .bitStart(bitStart)
        .bitLength(bitLength)
        .byteOrder(byteOrder)
        .valueType(valueType)
        .factor(factor)
        .offset(offset)
        .minimum(minimum)
        .maximum(maximum)
        .unit(unit)
        .receivers(receivers)
        .comment(comment)
        .valueTable(valueTable)
        .build();
  }
}
