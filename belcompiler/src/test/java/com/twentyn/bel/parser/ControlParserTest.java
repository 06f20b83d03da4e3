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

import com.twentyn.bel.exceptions.InvalidControlStatementException;
import com.twentyn.bel.language.BelConstants;
import org.junit.Before;
import org.junit.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ControlParserTest {
  private ControlParser parser;

  @Before
  public void setUp() {
    Map<String, Set<String>> listAnnotations = new HashMap<String, Set<String>>() {{
      put("Species", new HashSet<String>() {{
        add("9606");
        add("10090");
      }});
    }};
    Map<String, String> urlAnnotations = Collections.singletonMap("CellLine", "http://example.org/cellline.belanno");
    parser = new ControlParser(listAnnotations, urlAnnotations);
  }

  @Test
  public void testRecognizesControlStatements() {
    assertTrue("SET is a control statement", ControlParser.isControlStatement("SET Species = \"9606\""));
    assertTrue("UNSET is a control statement", ControlParser.isControlStatement("UNSET Species"));
    assertFalse("Statements are not", ControlParser.isControlStatement("p(HGNC:AKT1) -> p(HGNC:BAD)"));
  }

  @Test
  public void testShortCitation() throws Exception {
    parser.parseLine("SET Citation = {\"PubMed\", \"Some Journal\", \"12345\"}");

    Map<String, String> citation = parser.getCurrentCitation();
    assertEquals("Citation type", "PubMed", citation.get(BelConstants.CITATION_TYPE));
    assertEquals("Citation reference", "12345", citation.get(BelConstants.CITATION_REFERENCE));
    assertEquals("Three fields", 3, citation.size());
  }

  @Test
  public void testFullCitation() throws Exception {
    parser.parseLine("SET Citation = {\"PubMed\",\"J Biol\",\"1\",\"2001-01-01\",\"Smith J|Doe J\",\"\"}");
    assertEquals("Authors", "Smith J|Doe J", parser.getCurrentCitation().get(BelConstants.CITATION_AUTHORS));
  }

  @Test(expected = InvalidControlStatementException.class)
  public void testCitationWithWrongArity() throws Exception {
    parser.parseLine("SET Citation = {\"PubMed\", \"12345\"}");
  }

  @Test
  public void testNewCitationClearsContext() throws Exception {
    // Arrange
    parser.parseLine("SET Citation = {\"PubMed\", \"A\", \"1\"}");
    parser.parseLine("SET Evidence = \"Some text\"");
    parser.parseLine("SET Species = \"9606\"");

    // Act
    parser.parseLine("SET Citation = {\"PubMed\", \"B\", \"2\"}");

    // Assert
    assertFalse("Evidence is cleared", parser.getCurrentEvidence().isPresent());
    assertTrue("Annotations are cleared", parser.getCurrentAnnotations().isEmpty());
    assertEquals("New reference", "2", parser.getCurrentCitation().get(BelConstants.CITATION_REFERENCE));
  }

  @Test
  public void testSupportingTextIsEvidence() throws Exception {
    parser.parseLine("SET SupportingText = \"He said \\\"yes\\\"\"");
    assertEquals("Escapes are removed", Optional.of("He said \"yes\""), parser.getCurrentEvidence());
    parser.parseLine("UNSET Evidence");
    assertFalse("Unset removes evidence", parser.getCurrentEvidence().isPresent());
  }

  @Test
  public void testAnnotations() throws Exception {
    parser.parseLine("SET Species = \"9606\"");
    parser.parseLine("SET CellLine = \"HeLa cell\"");
    assertEquals("Both annotations are active", 2, parser.getCurrentAnnotations().size());
    parser.parseLine("UNSET Species");
    assertEquals("One annotation left", Collections.singletonMap("CellLine", "HeLa cell"),
        parser.getCurrentAnnotations());
  }

  @Test(expected = InvalidControlStatementException.class)
  public void testIllegalListValue() throws Exception {
    parser.parseLine("SET Species = \"7227\"");
  }

  @Test(expected = InvalidControlStatementException.class)
  public void testUndefinedAnnotation() throws Exception {
    parser.parseLine("SET Disease = \"cancer\"");
  }

  @Test(expected = InvalidControlStatementException.class)
  public void testUnsetOfUnsetAnnotation() throws Exception {
    parser.parseLine("UNSET Species");
  }

  @Test
  public void testStatementGroupAndReset() throws Exception {
    parser.parseLine("SET STATEMENT_GROUP = \"Group 1\"");
    assertEquals("Statement group", Optional.of("Group 1"), parser.getStatementGroup());
    parser.reset();
    assertFalse("Reset clears the group", parser.getStatementGroup().isPresent());
  }

  @Test
  public void testUnsetListOfAnnotations() throws Exception {
    // Arrange
    parser.parseLine("SET Citation = {\"PubMed\", \"A\", \"1\"}");
    parser.parseLine("SET Species = \"9606\"");
    parser.parseLine("SET CellLine = \"HeLa cell\"");

    // Act
    assertTrue("Braced UNSET is a control statement", ControlParser.isControlStatement("UNSET {Species, CellLine}"));
    parser.parseLine("UNSET {Species, \"CellLine\"}");

    // Assert
    assertTrue("Both annotations are gone", parser.getCurrentAnnotations().isEmpty());
    assertEquals("Citation is kept", "1", parser.getCurrentCitation().get(BelConstants.CITATION_REFERENCE));
  }

  @Test
  public void testUnsetAll() throws Exception {
    // Arrange
    parser.parseLine("SET Citation = {\"PubMed\", \"A\", \"1\"}");
    parser.parseLine("SET Evidence = \"Some text\"");
    parser.parseLine("SET Species = \"9606\"");
    parser.parseLine("SET STATEMENT_GROUP = \"Group 1\"");

    // Act
    parser.parseLine("UNSET ALL");

    // Assert
    assertTrue("Citation is cleared", parser.getCurrentCitation().isEmpty());
    assertFalse("Evidence is cleared", parser.getCurrentEvidence().isPresent());
    assertTrue("Annotations are cleared", parser.getCurrentAnnotations().isEmpty());
    assertFalse("Statement group is cleared", parser.getStatementGroup().isPresent());
  }
}
