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

package com.twentyn.bel.graph;

import com.twentyn.bel.exceptions.MalformedTermException;
import com.twentyn.bel.exceptions.UnsupportedTermException;
import com.twentyn.bel.language.AminoAcid;
import com.twentyn.bel.language.BelConstants;
import com.twentyn.bel.language.BelFunction;
import com.twentyn.bel.language.BelRelation;
import com.twentyn.bel.language.MolecularActivity;
import com.twentyn.bel.model.AbundanceList;
import com.twentyn.bel.model.SimpleAbundance;
import com.twentyn.bel.model.Statement;
import com.twentyn.bel.model.Term;
import com.twentyn.bel.model.Transformation;
import com.twentyn.bel.language.ModifierKind;
import com.twentyn.bel.parser.NamespaceValidator;
import com.twentyn.bel.parser.StatementParser;
import com.twentyn.bel.parser.TermParser;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.twentyn.bel.model.BelTerms.activity;
import static com.twentyn.bel.model.BelTerms.biologicalProcess;
import static com.twentyn.bel.model.BelTerms.complex;
import static com.twentyn.bel.model.BelTerms.composite;
import static com.twentyn.bel.model.BelTerms.gene;
import static com.twentyn.bel.model.BelTerms.hgvs;
import static com.twentyn.bel.model.BelTerms.pmod;
import static com.twentyn.bel.model.BelTerms.protein;
import static com.twentyn.bel.model.BelTerms.reaction;
import static com.twentyn.bel.model.BelTerms.abundance;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.when;

public class BelGraphBuilderTest {
  private static final NodeKey AKT1 = NodeKey.of("Protein", "HGNC", "AKT1");

  private BelGraph graph;
  private BelGraphBuilder builder;
  private StatementParser statementParser;

  @Before
  public void setUp() {
    graph = new BelGraph();
    builder = new BelGraphBuilder(graph, new NodeInterner(), CitationContext.EMPTY, false);
    statementParser = new StatementParser(new TermParser(NamespaceValidator.PERMISSIVE), true);
  }

  private List<BelEdge> add(String statement) throws Exception {
    return builder.addStatement(statementParser.parseStatement(statement));
  }

  @Test
  public void testEnsureNodeIsIdempotent() throws Exception {
    NodeKey first = builder.ensureNode(protein("HGNC", "AKT1"));
    NodeKey second = builder.ensureNode(protein("HGNC", "AKT1"));

    assertEquals("Same term gives the same key", first, second);
    assertEquals("Key is type, namespace and name", AKT1, first);
    assertEquals("Only one node", 1, graph.numberOfNodes());
    assertEquals("Node data carries the type", "Protein", graph.getNodeData(first).get().get(BelConstants.TYPE));
  }

  @Test
  public void testRepeatedGeneStatementsMakeOneNode() throws Exception {
    add("g(HGNC:AKT1)");
    add("g(HGNC:AKT1)");
    add("geneAbundance(HGNC:AKT1)");
    assertEquals("Bare terms collapse onto one node", 1, graph.numberOfNodes());
    assertEquals("Bare terms add no edges", 0, graph.numberOfEdges());
  }

  @Test
  public void testCentralDogmaCompletion() throws Exception {
    // Arrange
    BelGraphBuilder completing = new BelGraphBuilder(graph, new NodeInterner(), CitationContext.EMPTY, true);

    // Act
    completing.ensureNode(protein("HGNC", "AKT1"));

    // Assert
    assertEquals("Protein, RNA and gene", 3, graph.numberOfNodes());
    assertEquals("transcribedTo and translatedTo", 2, graph.numberOfEdges());
    assertTrue("RNA translates to the protein",
        graph.hasEdge(NodeKey.of("RNA", "HGNC", "AKT1"), AKT1, BelRelation.TRANSLATED_TO.getName()));
    assertTrue("Gene transcribes to the RNA", graph.hasEdge(NodeKey.of("Gene", "HGNC", "AKT1"),
        NodeKey.of("RNA", "HGNC", "AKT1"), BelRelation.TRANSCRIBED_TO.getName()));
  }

  @Test
  public void testNoCompletionByDefault() throws Exception {
    builder.ensureNode(protein("HGNC", "AKT1"));
    assertEquals("Only the protein", 1, graph.numberOfNodes());
  }

  @Test
  public void testVariantLinksToParent() throws Exception {
    // Act
    NodeKey variant = builder.ensureNode(protein("HGNC", "AKT1", pmod("Ph", AminoAcid.SER, 473)));

    // Assert
    assertEquals("Variant and parent", 2, graph.numberOfNodes());
    assertTrue("Parent has the variant", graph.hasEdge(AKT1, variant, BelRelation.HAS_VARIANT.getName()));
    assertEquals("Variant key lists the modification", Arrays.asList("pmod", "bel", "Ph", "Ser", 473),
        variant.getParts().get(3));
  }

  @Test
  public void testVariantOrderDoesNotMatter() throws Exception {
    NodeKey first = builder.ensureNode(protein("HGNC", "AKT1", pmod("Ph"), hgvs("p.Ala1Gly")));
    NodeKey second = builder.ensureNode(protein("HGNC", "AKT1", hgvs("p.Ala1Gly"), pmod("Ph")));
    assertEquals("Variants are sorted into a canonical order", first, second);
  }

  @Test
  public void testInterningOrder() throws Exception {
    // Act
    NodeKey complex = builder.ensureNode(complex(protein("HGNC", "FOS"), protein("HGNC", "JUN")));
    NodeKey composite = builder.ensureNode(composite(abundance("CHEBI", "lipid"), protein("HGNC", "IL6")));
    NodeKey reordered = builder.ensureNode(complex(protein("HGNC", "JUN"), protein("HGNC", "FOS")));

    // Assert
    assertEquals("First aggregate is 1", NodeKey.of("Complex", 1), complex);
    assertEquals("Second aggregate is 2", NodeKey.of("Composite", 2), composite);
    assertEquals("Member order does not matter", complex, reordered);
    assertEquals("Components are linked", 2, graph.getOutEdges(complex).size());
  }

  @Test
  public void testReactionSidesDiffer() throws Exception {
    NodeKey forward = builder.ensureNode(reaction(Collections.singletonList(abundance("CHEBI", "a")),
        Collections.singletonList(abundance("CHEBI", "b"))));
    NodeKey backward = builder.ensureNode(reaction(Collections.singletonList(abundance("CHEBI", "b")),
        Collections.singletonList(abundance("CHEBI", "a"))));
    assertFalse("Swapping sides is a different reaction", forward.equals(backward));
  }

  @Test
  public void testReactionStatement() throws Exception {
    // Act
    List<BelEdge> added = add(
        "rxn(reactants(a(CHEBI:superoxide)), products(a(CHEBI:\"hydrogen peroxide\"), a(CHEBI:oxygen)))"
            + " increases bp(GOBP:\"response to oxidative stress\")");

    // Assert
    assertEquals("One qualified edge", 1, added.size());
    assertEquals("Reaction, three chemicals and the process", 5, graph.numberOfNodes());
    assertEquals("One reactant, two products and the statement", 4, graph.numberOfEdges());
  }

  @Test(expected = MalformedTermException.class)
  public void testMissingIdentifierIsMalformed() throws Exception {
    builder.ensureNode(new SimpleAbundance(BelFunction.PROTEIN, null));
  }

  @Test(expected = MalformedTermException.class)
  public void testEmptyComplexIsMalformed() throws Exception {
    builder.ensureNode(complex());
  }

  @Test(expected = UnsupportedTermException.class)
  public void testListIsUnsupported() throws Exception {
    builder.ensureNode(new AbundanceList(Collections.singletonList(protein("HGNC", "AKT1"))));
  }

  @Test
  public void testFailingStatementLeavesGraphUntouched() {
    // Arrange
    Statement statement = Statement.ofRelation(protein("HGNC", "AKT1"), BelRelation.INCREASES,
        new SimpleAbundance(BelFunction.PROTEIN, null));

    // Act
    try {
      builder.addStatement(statement);
      fail("Statement has a malformed object");
    } catch (Exception e) {
      assertTrue("Should be a malformed term", e instanceof MalformedTermException);
    }

    // Assert
    assertEquals("Subject was not inserted", 0, graph.numberOfNodes());
  }

  @Test
  public void testHasMembersDistributes() throws Exception {
    // Arrange
    CitationContext context = Mockito.mock(CitationContext.class);
    when(context.getCurrentCitation()).thenReturn(Collections.singletonMap(BelConstants.CITATION_REFERENCE, "1"));
    when(context.getCurrentEvidence()).thenReturn(Optional.of("AKT family members"));
    when(context.getCurrentAnnotations()).thenReturn(Collections.singletonMap("Species", "9606"));
    BelGraphBuilder stamping = new BelGraphBuilder(graph, new NodeInterner(), context, false);
    String statement = "p(SFAM:\"AKT Family\") hasMembers list(p(HGNC:AKT1), p(HGNC:AKT2))";

    // Act
    List<BelEdge> first = stamping.addStatement(statementParser.parseStatement(statement));
    List<BelEdge> second = stamping.addStatement(statementParser.parseStatement(statement));

    // Assert
    assertTrue("No statement edges are reported", first.isEmpty() && second.isEmpty());
    assertEquals("Family and two members", 3, graph.numberOfNodes());
    assertEquals("One structural edge per member, however often the statement repeats", 2, graph.numberOfEdges());
    for (BelEdge edge : graph.getEdges()) {
      assertFalse("Membership is structural", edge.isQualified());
      assertEquals("Each edge is hasMember", BelRelation.HAS_MEMBER.getName(), edge.getRelation());
      assertEquals("Family is the source", NodeKey.of("Protein", "SFAM", "AKT Family"), edge.getSource());
      assertFalse("No citation", edge.getAttributes().containsKey(BelConstants.CITATION));
      assertFalse("No annotations", edge.getAttributes().containsKey(BelConstants.ANNOTATIONS));
    }
  }

  @Test
  public void testVariantNodeCarriesNoLeafAttributes() throws Exception {
    // Act
    NodeKey variant = builder.ensureNode(protein("HGNC", "MAPT", pmod("Ph")));

    // Assert
    Map<String, Object> data = graph.getNodeData(variant).get();
    assertEquals("Type", "Protein", data.get(BelConstants.TYPE));
    assertTrue("Variants", data.containsKey(BelConstants.VARIANTS));
    assertFalse("No namespace", data.containsKey(BelConstants.NAMESPACE));
    assertFalse("No name", data.containsKey(BelConstants.NAME));
    Map<String, Object> filter = new HashMap<String, Object>() {{
      put(BelConstants.TYPE, "Protein");
      put(BelConstants.NAMESPACE, "HGNC");
      put(BelConstants.NAME, "MAPT");
    }};
    assertEquals("Only the unmodified protein matches its name", Collections.singletonList(
        NodeKey.of("Protein", "HGNC", "MAPT")), graph.getNodes(filter));
  }

  @Test
  public void testActivityModifierDictionary() throws Exception {
    // Act
    BelEdge edge = builder.addStatement(Statement.ofRelation(
        activity(protein("HGNC", "AKT1"), MolecularActivity.KINASE), BelRelation.INCREASES,
        biologicalProcess("GOBP", "apoptosis"))).get(0);

    // Assert
    Map<String, Object> expected = new HashMap<String, Object>() {{
      put(BelConstants.MODIFIER, "Activity");
      put(BelConstants.EFFECT, new HashMap<String, Object>() {{
        put(BelConstants.NAMESPACE, "bel");
        put(BelConstants.NAME, "kin");
      }});
    }};
    assertEquals("Subject modifier", expected, edge.getAttributes().get(BelConstants.SUBJECT));
    assertFalse("Object has no modifier", edge.getAttributes().containsKey(BelConstants.OBJECT));
    assertEquals("Activity resolves to its target", AKT1, edge.getSource());
  }

  @Test
  public void testSecretionImpliesLocations() throws Exception {
    Term secretion = new Transformation(ModifierKind.CELL_SECRETION, protein("HGNC", "IL6"));
    BelEdge edge = builder.addStatement(Statement.ofRelation(protein("HGNC", "TNF"), BelRelation.INCREASES,
        secretion)).get(0);

    @SuppressWarnings("unchecked")
    Map<String, Object> object = (Map<String, Object>) edge.getAttributes().get(BelConstants.OBJECT);
    @SuppressWarnings("unchecked")
    Map<String, Object> effect = (Map<String, Object>) object.get(BelConstants.EFFECT);
    assertEquals("Secretion", "CellSecretion", object.get(BelConstants.MODIFIER));
    assertEquals("Secreted into the extracellular space", BelConstants.EXTRACELLULAR_SPACE,
        ((Map<?, ?>) effect.get(BelConstants.TO_LOC)).get(BelConstants.NAME));
  }

  @Test
  public void testNestedStatementMakesTwoEdges() throws Exception {
    List<BelEdge> added = add("p(HGNC:A) -> (p(HGNC:B) -| act(p(HGNC:C), ma(kin)))");
    assertEquals("Outer and inner edges", 2, added.size());
    assertEquals("Outer edge points at the inner subject", NodeKey.of("Protein", "HGNC", "B"),
        added.get(0).getTarget());
    assertEquals("Inner edge keeps its relation", "decreases", added.get(1).getRelation());
  }

  @Test
  public void testCitationContextIsStamped() throws Exception {
    // Arrange
    CitationContext context = Mockito.mock(CitationContext.class);
    when(context.getCurrentCitation()).thenReturn(new HashMap<String, String>() {{
      put(BelConstants.CITATION_TYPE, "PubMed");
      put(BelConstants.CITATION_NAME, "Some Journal");
      put(BelConstants.CITATION_REFERENCE, "12345");
    }});
    when(context.getCurrentEvidence()).thenReturn(Optional.of("AKT1 increases apoptosis"));
    when(context.getCurrentAnnotations()).thenReturn(Collections.singletonMap("Species", "9606"));
    BelGraphBuilder stamping = new BelGraphBuilder(graph, new NodeInterner(), context, false);

    // Act
    BelEdge edge = stamping.addStatement(statementParser.parseStatement("p(HGNC:AKT1) -> bp(GOBP:apoptosis)"))
        .get(0);

    // Assert
    assertEquals("Evidence", "AKT1 increases apoptosis", edge.getAttributes().get(BelConstants.EVIDENCE));
    assertEquals("Annotations", Collections.singletonMap("Species", "9606"),
        edge.getAttributes().get(BelConstants.ANNOTATIONS));
    assertEquals("Citation reference", "12345",
        ((Map<?, ?>) edge.getAttributes().get(BelConstants.CITATION)).get(BelConstants.CITATION_REFERENCE));
  }

  @Test
  public void testGeneVariantKey() throws Exception {
    NodeKey key = builder.ensureNode(gene("HGNC", "CFTR", hgvs("c.1521_1523delCTT")));
    assertEquals("Variant tuple", Arrays.asList("var", "c.1521_1523delCTT"), key.getParts().get(3));
  }
}
