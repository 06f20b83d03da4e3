/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.bel.parser;

import com.twentyn.bel.exceptions.BelException;
import com.twentyn.bel.exceptions.InvalidNamespaceException;
import com.twentyn.bel.exceptions.LegacySyntaxWarning;
import com.twentyn.bel.exceptions.MalformedTermException;
import com.twentyn.bel.exceptions.MissingMetadataException;
import com.twentyn.bel.exceptions.UnsupportedTermException;
import com.twentyn.bel.graph.BelGraph;
import com.twentyn.bel.language.BelConstants;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles a whole BEL document into a graph.
 *
 * A document has three sections: the document metadata (up to the last SET DOCUMENT line), the namespace and
 * annotation definitions (up to the last DEFINE line), and the statements. A failure in either of the first two
 * sections aborts the parse. Statements are compiled one by one; a statement that fails is recorded as a
 * {@link ParseWarning} and the rest of the document is still read.
 */
public class BelDocumentParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BelDocumentParser.class);

  private static final String COMMENT_PREFIX = "#";

  private final BelParserConfiguration configuration;

  public BelDocumentParser(BelParserConfiguration configuration) {
    this.configuration = configuration;
  }

  public BelParseResult parseDocument(File file) throws IOException, BelException {
    LOGGER.info("Reading BEL document %s", file.getAbsolutePath());
    return parseDocument(Files.readAllLines(file.toPath(), StandardCharsets.UTF_8));
  }

  public BelParseResult parseDocument(Iterable<String> lines) throws BelException {
    List<Pair<Integer, String>> content = sanitize(lines);

    int endOfDocument = 0;
    int endOfDefinitions = 0;
    for (int i = 0; i < content.size(); i++) {
      String line = content.get(i).getRight();
      if (MetadataParser.isDocumentLine(line)) {
        endOfDocument = i + 1;
      }
      if (MetadataParser.isHeaderLine(line)) {
        endOfDefinitions = i + 1;
      }
    }
    LOGGER.info("Document has %d content lines, %d of them in the preamble", content.size(), endOfDefinitions);

    BelParserSession session = createSession();
    BelGraph graph = session.getGraph();
    List<ParseWarning> warnings = new ArrayList<>();

    parsePreamble(session, content.subList(0, endOfDefinitions));

    for (MissingMetadataException e : session.getMetadataParser()
        .checkRequiredMetadata(configuration.getRequiredDocumentKeys())) {
      LOGGER.warn("%s", e.getMessage());
      warnings.add(new ParseWarning(0, "", e));
    }

    if (!graph.getNamespaceUrl().isEmpty() || !graph.getNamespaceList().isEmpty()) {
      session.setNamespaceValidator(session.getMetadataParser().getNamespaceValidator());
    }

    for (Pair<Integer, String> numbered : content.subList(endOfDefinitions, content.size())) {
      parseStatementLine(session, numbered.getLeft(), numbered.getRight(), warnings);
    }

    LOGGER.info("Compiled document \"%s\": %d nodes, %d edges, %d warnings",
        graph.getDocument().getOrDefault(BelConstants.DOCUMENT_NAME, ""), graph.numberOfNodes(),
        graph.numberOfEdges(), warnings.size());
    return new BelParseResult(graph, warnings);
  }

  protected BelParserSession createSession() {
    return new BelParserSession(configuration);
  }

  private void parsePreamble(BelParserSession session, List<Pair<Integer, String>> preamble) throws BelException {
    for (Pair<Integer, String> numbered : preamble) {
      try {
        session.getMetadataParser().parseLine(numbered.getRight());
      } catch (BelException e) {
        LOGGER.error("Failed to read document header on line %d: %s", numbered.getLeft(), e.getMessage());
        throw new BelException(String.format("Invalid document header on line %d: %s",
            numbered.getLeft(), numbered.getRight()), e);
      }
    }
  }

  private void parseStatementLine(BelParserSession session, int lineNumber, String line,
                                  List<ParseWarning> warnings) {
    try {
      if (ControlParser.isControlStatement(line)) {
        session.getControlParser().parseLine(line);
        return;
      }
      int legacyBefore = session.getLegacyWarnings().size();
      session.parseStatement(line);
      List<LegacySyntaxWarning> legacy = session.getLegacyWarnings();
      for (LegacySyntaxWarning warning : legacy.subList(legacyBefore, legacy.size())) {
        LOGGER.info("Line %d uses legacy syntax: %s", lineNumber, warning.getMessage());
        warnings.add(new ParseWarning(lineNumber, line, warning));
      }
    } catch (InvalidNamespaceException e) {
      LOGGER.warn("Namespace problem on line %d: %s", lineNumber, e.getMessage());
      warnings.add(new ParseWarning(lineNumber, line, e));
    } catch (MalformedTermException | UnsupportedTermException e) {
      LOGGER.error("Could not add line %d to the graph: %s", lineNumber, e.getMessage());
      warnings.add(new ParseWarning(lineNumber, line, e));
    } catch (BelException e) {
      LOGGER.warn("Skipping line %d (%s): %s", lineNumber, e.getClass().getSimpleName(), e.getMessage());
      warnings.add(new ParseWarning(lineNumber, line, e));
    } catch (RuntimeException e) {
      LOGGER.error(String.format("Unexpected failure on line %d, skipping it", lineNumber), e);
      warnings.add(new ParseWarning(lineNumber, line,
          new BelException(String.format("Unexpected failure: %s", e.getMessage()), e)));
    }
  }

  /**
   * Trims every line and drops blank lines and comments, keeping 1-based line numbers.
   */
  static List<Pair<Integer, String>> sanitize(Iterable<String> lines) {
    List<Pair<Integer, String>> content = new ArrayList<>();
    int lineNumber = 0;
    for (String raw : lines) {
      lineNumber++;
      String line = raw.trim();
      if (line.isEmpty() || line.startsWith(COMMENT_PREFIX)) {
        continue;
      }
      content.add(Pair.of(lineNumber, line));
    }
    return content;
  }
}
