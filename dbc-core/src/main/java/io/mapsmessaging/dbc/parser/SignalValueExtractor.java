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

import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code VAL_ <id> <signal> <pairs> ;}. Must run after the message pass, since tables are attached
 * straight onto the signal drafts.
 */
class SignalValueExtractor implements DirectiveExtractor {

  private static final Logger logger = LoggerFactory.getLogger(SignalValueExtractor.class);

  @Override
  public void extract(LineCorpus corpus, DbcDatabaseBuilder builder) {
    for (ClassifiedLine line : corpus.linesOf(DirectiveKind.SIGNAL_VALUES)) {
      long canId = DirectiveFields.parseLong(line, 1, "message id");
      String signalName = line.group(2);
      Map<Long, String> values = DirectiveFields.parseValuePairs(line, 3);

      MessageDraft message = builder.getMessage(canId);
      if (message == null) {
        logger.debug("Dropping value table for unknown message {} at line {}", canId, line.lineNumber());
        continue;
      }
      List<SignalDraft> signals = message.signalsNamed(signalName);
      if (signals.isEmpty()) {
        logger.debug("Dropping value table for unknown signal {}.{} at line {}", canId, signalName, line.lineNumber());
        continue;
      }
      for (SignalDraft signal : signals) {
        signal.setValueTable(values);
      }
    }
  }
}
