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
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for reading Vector DBC documents.
 *
 * <p>Every call works on its own {@link DbcDatabaseBuilder}, so concurrent parses do not interact.
 * Unrecognized lines and references to unknown messages or signals are skipped. A malformed number
 * inside a recognized directive fails the whole parse with a {@link DbcParseException}.
 */
@UtilityClass
public class DbcParser {

  private static final Logger logger = LoggerFactory.getLogger(DbcParser.class);

  // Order matters only in that the value pass needs the messages in place.
  private static final List<DirectiveExtractor> EXTRACTORS = List.of(
      new NodeListExtractor(),
      new ValueTableExtractor(),
      new MessageBlockParser(),
      new CommentExtractor(),
      new SignalValueExtractor()
  );

  private static final DatabaseAssembler ASSEMBLER = new DatabaseAssembler();

  public static DbcDatabase parse(String content) {
    LineCorpus corpus = LineCorpus.of(content);
    DbcDatabaseBuilder builder = new DbcDatabaseBuilder();

    for (DirectiveExtractor extractor : EXTRACTORS) {
      extractor.extract(corpus, builder);
    }

    DbcDatabase database = ASSEMBLER.assemble(corpus, builder);
    logger.debug("Parsed DBC with {} messages, {} signals and {} ECUs from {} lines",
        database.getMessages().size(), database.getSignalCount(), database.getEcus().size(), corpus.size());
    return database;
  }

  public static DbcDatabase parse(InputStream inputStream) throws IOException {
    return parse(readText(inputStream));
  }

  public static DbcDatabase parseFromFile(Path filePath) throws IOException {
    try (InputStream inputStream = Files.newInputStream(filePath)) {
      return parse(inputStream);
    }
  }

  public static DbcDatabase parseFromClasspath(String resourcePath) throws IOException {
    String normalizedPath = normalizeResourcePath(resourcePath);
    ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
    if (classLoader == null) {
      classLoader = DbcParser.class.getClassLoader();
    }
    try (InputStream inputStream = classLoader.getResourceAsStream(normalizedPath)) {
      if (inputStream == null) {
        throw new IllegalArgumentException("DBC resource not found on classpath: " + normalizedPath);
      }
      return parse(inputStream);
    }
  }

  /**
   * Decodes as UTF-8, dropping byte sequences that are not valid UTF-8 rather than failing.
   */
  static String readText(InputStream inputStream) throws IOException {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    inputStream.transferTo(buffer);

    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      return decoder.decode(ByteBuffer.wrap(buffer.toByteArray())).toString();
    }
    catch (CharacterCodingException exception) {
      throw new IOException("Unable to decode DBC text", exception);
    }
  }

  private static String normalizeResourcePath(String resourcePath) {
    if (resourcePath == null || resourcePath.isBlank()) {
      throw new IllegalArgumentException("Resource path must not be blank");
    }
    String trimmed = resourcePath.trim();
    if (trimmed.startsWith("/")) {
      return trimmed.substring(1);
    }
    return trimmed;
  }
}
