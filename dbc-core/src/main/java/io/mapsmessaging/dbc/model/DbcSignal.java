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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A bit field inside a CAN frame, mapped to a physical value as {@code raw * factor + offset}.
 *
 * <p>The layout fields are carried as declared. Whether {@code bitStart + bitLength} fits the
 * frame is left to whoever decodes frames against this definition.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class DbcSignal {

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
  private final String comment;

  @Getter(AccessLevel.NONE)
  private final Map<Long, String> valueTable;

  @Builder
  private DbcSignal(
      String name,
      int bitStart,
      int bitLength,
      ByteOrder byteOrder,
      ValueType valueType,
      double factor,
      double offset,
      double minimum,
      double maximum,
      String unit,
      List<String> receivers,
      String comment,
      Map<Long, String> valueTable
  ) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Signal name must not be empty");
    }
    this.name = name;
    this.bitStart = bitStart;
    this.bitLength = bitLength;
    this.byteOrder = byteOrder == null ? ByteOrder.LITTLE : byteOrder;
    this.valueType = valueType == null ? ValueType.UNSIGNED : valueType;
    this.factor = factor;
    this.offset = offset;
    this.minimum = minimum;
    this.maximum = maximum;
    this.unit = unit == null ? "" : unit;
    this.receivers = receivers == null ? List.of() : List.copyOf(receivers);
    this.comment = comment == null ? "" : comment;
    this.valueTable = valueTable == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(valueTable));
  }

  /**
   * Per-signal enumeration from a {@code VAL_} directive. Empty when none was declared, which is
   * not the same as a declared table with no entries.
   */
  public Optional<Map<Long, String>> getValueTable() {
    return Optional.ofNullable(valueTable);
  }

  public boolean isSigned() {
    return valueType == ValueType.SIGNED;
  }
}
