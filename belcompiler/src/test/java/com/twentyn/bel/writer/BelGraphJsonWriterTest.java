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

package com.twentyn.bel.writer;

import com.twentyn.bel.graph.BelGraph;
import com.twentyn.bel.parser.BelParserConfiguration;
import com.twentyn.bel.parser.BelParserSession;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class BelGraphJsonWriterTest {
  @Rule
  public TemporaryFolder temporaryFolder = new TemporaryFolder();

  private BelGraph graph;
  private BelGraphJsonWriter jsonWriter;

  @Before
  public void setUp() throws Exception {
    BelParserSession session = new BelParserSession(new BelParserConfiguration());
    session.getMetadataParser().parseLine("SET DOCUMENT Name = \"JSON\"");
    session.parseStatement("act(p(HGNC:AKT1), ma(kin)) -> p(HGNC:BAD, pmod(Ph, Ser, 136))");
    session.parseStatement("p(HGNC:TMPRSS2) -> r(fus(HGNC:TMPRSS2, r.1_79, HGNC:ERG, ?))");
    graph = session.getGraph();
    jsonWriter = new BelGraphJsonWriter();
  }

  @Test
  public void testNodeLinkShape() {
    // Act
    BelGraphJsonWriter.NodeLinkGraph nodeLink = jsonWriter.toNodeLink(graph);

    // Assert
    assertEquals("One entry per node", graph.numberOfNodes(), nodeLink.getNodes().size());
    assertEquals("One entry per edge", graph.numberOfEdges(), nodeLink.getLinks().size());
    assertEquals("Document metadata is carried", "JSON",
        ((Map<?, ?>) nodeLink.getGraph().get("document")).get("name"));

    BelGraphJsonWriter.JsonNode variant = null;
    for (BelGraphJsonWriter.JsonNode node : nodeLink.getNodes()) {
      if (node.getData().containsKey("variants")) {
        variant = node;
      }
    }
    List<?> variants = (List<?>) variant.getData().get("variants");
    assertEquals("Variant kind", "pmod", ((Map<?, ?>) variants.get(0)).get("kind"));
    assertEquals("Variant position", 136, ((Map<?, ?>) variants.get(0)).get("pos"));
  }

  @Test
  public void testFileRoundTrip() throws Exception {
    // Arrange
    File output = temporaryFolder.newFile("graph.json");

    // Act
    jsonWriter.writeToJsonFile(graph, output);
    BelGraphJsonWriter.NodeLinkGraph read = BelGraphJsonWriter.readFromJsonFile(output);

    // Assert
    assertEquals("Nodes survive", graph.numberOfNodes(), read.getNodes().size());
    assertEquals("Links survive", graph.numberOfEdges(), read.getLinks().size());
    assertTrue("Fusion data is written as a map",
        jsonWriter.writeToJsonString(graph).contains("\"partner_5p\""));
  }

  @Test
  public void testFileIsUtf8() throws Exception {
    // Arrange
    BelParserSession session = new BelParserSession(new BelParserConfiguration());
    session.parseStatement("a(CHEBI:\"\u03b1-tocopherol\")");
    File output = temporaryFolder.newFile("unicode.json");

    // Act
    jsonWriter.writeToJsonFile(session.getGraph(), output);

    // Assert
    String written = new String(Files.readAllBytes(output.toPath()), StandardCharsets.UTF_8);
    assertTrue("Greek letter is encoded as UTF-8", written.contains("\u03b1-tocopherol"));
  }
}
