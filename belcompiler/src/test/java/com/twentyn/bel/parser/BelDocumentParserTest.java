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
import com.twentyn.bel.exceptions.BelSyntaxException;
import com.twentyn.bel.exceptions.InvalidNamespaceException;
import com.twentyn.bel.exceptions.LegacySyntaxWarning;
import com.twentyn.bel.exceptions.MissingMetadataException;
import com.twentyn.bel.graph.BelEdge;
import com.twentyn.bel.graph.BelGraph;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

public class BelDocumentParserTest {
  private static final List<String> DOCUMENT_WITH_ERRORS = Arrays.asList(
      "SET DOCUMENT Name = \"Errors\"",
      "DEFINE NAMESPACE HGNC AS LIST {\"AKT1\", \"BAD\"}",
      "p(HGNC:AKT1) -> p(HGNC:BAD)",
      "p(HGNC:NOTREAL) -> p(HGNC:AKT1)",
      "p(HGNC:AKT1 -> p(HGNC:BAD)",
      "p(HGNC:AKT1, pmod(P)) -> p(HGNC:BAD)"
  );

  private BelDocumentParser parser;

  @Before
  public void setUp() {
    parser = new BelDocumentParser(new BelParserConfiguration());
  }

  private static int countQualified(BelGraph graph) {
    int count = 0;
    for (BelEdge edge : graph.getEdges()) {
      if (edge.isQualified()) {
        count++;
      }
    }
    return count;
  }

  @Test
  public void testBadLinesBecomeWarnings() throws Exception {
    // Act
    BelParseResult result = parser.parseDocument(DOCUMENT_WITH_ERRORS);

    // Assert
    assertEquals("Four required document keys are missing", 4,
        result.getWarnings(MissingMetadataException.class).size());
    assertEquals("Missing metadata refers to the whole document", 0,
        result.getWarnings(MissingMetadataException.class).get(0).getLineNumber());

    List<ParseWarning> namespace = result.getWarnings(InvalidNamespaceException.class);
    assertEquals("One namespace problem", 1, namespace.size());
    assertEquals("On line 4", 4, namespace.get(0).getLineNumber());

    List<ParseWarning> syntax = result.getWarnings(BelSyntaxException.class);
    assertEquals("One syntax error", 1, syntax.size());
    assertEquals("On line 5", 5, syntax.get(0).getLineNumber());

    List<ParseWarning> legacy = result.getWarnings(LegacySyntaxWarning.class);
    assertEquals("One legacy notice", 1, legacy.size());
    assertEquals("On line 6", 6, legacy.get(0).getLineNumber());

    assertEquals("Lines 3 and 6 made it into the graph", 2, countQualified(result.getGraph()));
  }

  @Test
  public void testCommentsAndBlankLinesKeepLineNumbers() throws Exception {
    BelParseResult result = parser.parseDocument(Arrays.asList(
        "# A comment",
        "",
        "SET DOCUMENT Name = \"Numbers\"",
        "   ",
        "p(HGNC:AKT1) -> "));

    List<ParseWarning> syntax = result.getWarnings(BelSyntaxException.class);
    assertEquals("One syntax error", 1, syntax.size());
    assertEquals("Raw line numbers are reported", 5, syntax.get(0).getLineNumber());
  }

  @Test
  public void testWithoutDefinitionsEverythingIsAccepted() throws Exception {
    BelParseResult result = parser.parseDocument(Arrays.asList(
        "SET Citation = {\"PubMed\", \"J\", \"1\"}",
        "p(ANYTHING:AKT1) -> bp(GOBP:apoptosis)"));
    assertTrue("No namespace problems", result.getWarnings(InvalidNamespaceException.class).isEmpty());
    assertEquals("One statement", 1, countQualified(result.getGraph()));
  }

  @Test
  public void testUnexpectedFailureOnOneLineDoesNotAbort() throws Exception {
    // Arrange
    BelDocumentParser failingParser = new BelDocumentParser(new BelParserConfiguration()) {
      @Override
      protected BelParserSession createSession() {
        return new BelParserSession(new BelParserConfiguration()) {
          @Override
          public List<BelEdge> parseStatement(String line) throws BelException {
            if (line.contains("HGNC:BROKEN")) {
              throw new IllegalStateException("index corrupted");
            }
            return super.parseStatement(line);
          }
        };
      }
    };

    // Act
    BelParseResult result = failingParser.parseDocument(Arrays.asList(
        "p(HGNC:AKT1) -> bp(GOBP:apoptosis)",
        "p(HGNC:BROKEN) -> bp(GOBP:apoptosis)",
        "p(HGNC:BAD) -| bp(GOBP:apoptosis)"));

    // Assert
    assertEquals("Lines before and after the failure are compiled", 2, countQualified(result.getGraph()));
    ParseWarning failure = null;
    for (ParseWarning warning : result.getWarnings()) {
      if (warning.getException().getCause() instanceof IllegalStateException) {
        failure = warning;
      }
    }
    assertNotNull("Failure is recorded as a warning", failure);
    assertEquals("On line 2", 2, failure.getLineNumber());
  }

  @Test(expected = BelException.class)
  public void testBrokenPreambleFails() throws Exception {
    parser.parseDocument(Arrays.asList(
        "SET DOCUMENT Name = \"Broken\"",
        "DEFINE NAMESPACE HGNC AS LIST {}",
        "p(HGNC:AKT1)"));
  }
}
