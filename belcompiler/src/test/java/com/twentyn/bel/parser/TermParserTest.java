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

import com.twentyn.bel.exceptions.BelSyntaxException;
import com.twentyn.bel.exceptions.InvalidNamespaceException;
import com.twentyn.bel.language.BelFunction;
import com.twentyn.bel.language.ModifierKind;
import com.twentyn.bel.model.AbundanceList;
import com.twentyn.bel.model.Activity;
import com.twentyn.bel.model.ComplexList;
import com.twentyn.bel.model.CompositeAbundance;
import com.twentyn.bel.model.FusedAbundance;
import com.twentyn.bel.model.ModifiedAbundance;
import com.twentyn.bel.model.NamedComplex;
import com.twentyn.bel.model.NamespaceValue;
import com.twentyn.bel.model.Reaction;
import com.twentyn.bel.model.SimpleAbundance;
import com.twentyn.bel.model.Term;
import com.twentyn.bel.model.Transformation;
import com.twentyn.bel.model.variant.Fragment;
import com.twentyn.bel.model.variant.ProteinModification;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.when;

public class TermParserTest {
  private TermParser parser;

  @Before
  public void setUp() {
    parser = new TermParser(NamespaceValidator.PERMISSIVE);
  }

  @Test
  public void testSimpleProtein() throws Exception {
    Term term = parser.parseTerm("proteinAbundance(HGNC:AKT1)");
    assertTrue("Should be a plain abundance", term instanceof SimpleAbundance);
    SimpleAbundance protein = (SimpleAbundance) term;
    assertEquals("Long tags map to the same function", BelFunction.PROTEIN, protein.getFunction());
    assertEquals("Identifier", new NamespaceValue("HGNC", "AKT1"), protein.getIdentifier());
  }

  @Test
  public void testSimpleAbundanceWithLocation() throws Exception {
    SimpleAbundance abundance = (SimpleAbundance) parser.parseTerm("a(CHEBI:calcium, loc(GOCC:cytoplasm))");
    assertEquals("Location should be attached", Optional.of(new NamespaceValue("GOCC", "cytoplasm")),
        abundance.getLocation());
  }

  @Test
  public void testModifiedProteinWithLocation() throws Exception {
    // Arrange
    String text = "p(HGNC:AKT1, pmod(Ph, Ser, 473), frag(5_20), loc(GOCC:nucleus))";

    // Act
    Term term = parser.parseTerm(text);

    // Assert
    assertTrue("Variants make a modified abundance", term instanceof ModifiedAbundance);
    ModifiedAbundance modified = (ModifiedAbundance) term;
    assertEquals("Two variants", 2, modified.getVariants().size());
    assertTrue("First variant is the modification", modified.getVariants().get(0) instanceof ProteinModification);
    assertTrue("Second variant is the fragment", modified.getVariants().get(1) instanceof Fragment);
    assertEquals("Location is the trailing argument", Optional.of(new NamespaceValue("GOCC", "nucleus")),
        modified.getLocation());
  }

  @Test(expected = BelSyntaxException.class)
  public void testProteinOnlyVariantOnGeneFails() throws Exception {
    parser.parseTerm("g(HGNC:AKT1, pmod(Ph))");
  }

  @Test
  public void testFusion() throws Exception {
    Term term = parser.parseTerm("r(fus(HGNC:TMPRSS2, r.1_79, HGNC:ERG, r.312_5034))");
    assertTrue("Should be a fusion", term instanceof FusedAbundance);
    assertEquals("Fusion keeps its function", BelFunction.RNA, ((FusedAbundance) term).getFunction());
  }

  @Test
  public void testComplexListAndNamedComplex() throws Exception {
    Term list = parser.parseTerm("complex(p(HGNC:FOS), p(HGNC:JUN))");
    Term named = parser.parseTerm("complexAbundance(SCOMP:\"AP-1 Complex\")");
    assertTrue("Members make a complex list", list instanceof ComplexList);
    assertEquals("Two members", 2, ((ComplexList) list).getMembers().size());
    assertTrue("An identifier makes a named complex", named instanceof NamedComplex);
  }

  @Test
  public void testComposite() throws Exception {
    CompositeAbundance composite =
        (CompositeAbundance) parser.parseTerm("composite(a(CHEBI:lipopolysaccharide), p(HGNC:IL6))");
    assertEquals("Two members", 2, composite.getMembers().size());
  }

  @Test
  public void testReaction() throws Exception {
    Reaction reaction = (Reaction) parser.parseTerm(
        "rxn(reactants(a(CHEBI:superoxide)), products(a(CHEBI:\"hydrogen peroxide\"), a(CHEBI:oxygen)))");
    assertEquals("One reactant", 1, reaction.getReactants().size());
    assertEquals("Two products", 2, reaction.getProducts().size());
  }

  @Test
  public void testActivityWithMolecularActivity() throws Exception {
    Activity activity = (Activity) parser.parseTerm("act(p(HGNC:AKT1), ma(kin))");
    assertEquals("Molecular activity", Optional.of(new NamespaceValue("bel", "kin")),
        activity.getMolecularActivity());
  }

  @Test
  public void testLegacyActivityBecomesActivity() throws Exception {
    // Arrange
    BelScanner scanner = new BelScanner("kin(p(HGNC:AKT1))");

    // Act
    Term term = parser.parse(scanner);

    // Assert
    assertTrue("Legacy activities are activities", term instanceof Activity);
    assertEquals("Legacy tag becomes the molecular activity", Optional.of(new NamespaceValue("bel", "kin")),
        ((Activity) term).getMolecularActivity());
    assertEquals("Legacy syntax should be noted", 1, scanner.getLegacyWarnings().size());
  }

  @Test
  public void testTranslocationForms() throws Exception {
    Transformation standard = (Transformation) parser.parseTerm(
        "tloc(p(HGNC:EGFR), fromLoc(GOCC:\"cell surface\"), toLoc(GOCC:endosome))");
    assertEquals("Kind", ModifierKind.TRANSLOCATION, standard.getKind());
    assertEquals("Destination", Optional.of(new NamespaceValue("GOCC", "endosome")), standard.getToLocation());

    BelScanner scanner = new BelScanner("tloc(p(HGNC:EGFR), GOCC:\"cell surface\", GOCC:endosome)");
    Transformation legacy = (Transformation) parser.parse(scanner);
    assertEquals("Legacy form has the same origin", standard.getFromLocation(), legacy.getFromLocation());
    assertEquals("Legacy form is noted", 1, scanner.getLegacyWarnings().size());
  }

  @Test
  public void testDegradationAndSecretion() throws Exception {
    assertEquals("Degradation", ModifierKind.DEGRADATION,
        ((Transformation) parser.parseTerm("deg(r(HGNC:MYC))")).getKind());
    assertEquals("Secretion", ModifierKind.CELL_SECRETION,
        ((Transformation) parser.parseTerm("sec(p(HGNC:IL6))")).getKind());
  }

  @Test
  public void testList() throws Exception {
    AbundanceList list = (AbundanceList) parser.parseTerm("list(p(HGNC:A), p(HGNC:B), composite(a(X:y), a(X:z)))");
    assertEquals("Three members", 3, list.getMembers().size());
  }

  @Test(expected = BelSyntaxException.class)
  public void testUnknownFunctionFails() throws Exception {
    parser.parseTerm("q(HGNC:AKT1)");
  }

  @Test(expected = BelSyntaxException.class)
  public void testTrailingTextFails() throws Exception {
    parser.parseTerm("p(HGNC:AKT1) extra");
  }

  @Test(expected = BelSyntaxException.class)
  public void testUnbalancedParenthesesFail() throws Exception {
    parser.parseTerm("p(HGNC:AKT1");
  }

  @Test(expected = InvalidNamespaceException.class)
  public void testNamespaceValidatorIsConsulted() throws Exception {
    // Arrange
    NamespaceValidator validator = Mockito.mock(NamespaceValidator.class);
    when(validator.isDefined("HGNC")).thenReturn(true);
    when(validator.isMember("HGNC", "NOTREAL")).thenReturn(false);
    TermParser strictParser = new TermParser(validator);

    // Act
    strictParser.parseTerm("p(HGNC:NOTREAL, pmod(Ph))");
  }

  @Test
  public void testUnresolvableIdentifierFails() throws Exception {
    // Arrange
    NamespaceValidator validator = Mockito.mock(NamespaceValidator.class);
    when(validator.isDefined("HGNC")).thenReturn(true);
    when(validator.isMember("HGNC", "PKB")).thenReturn(true);
    when(validator.resolve("HGNC", "PKB")).thenThrow(
        new InvalidNamespaceException("PKB maps to more than one symbol", "HGNC", "PKB"));
    TermParser strictParser = new TermParser(validator);

    // Act
    try {
      strictParser.parseTerm("p(HGNC:PKB)");
      fail("Resolution failure should surface");
    } catch (InvalidNamespaceException e) {
      // Assert
      assertEquals("Failing name is reported", "PKB", e.getName());
    }
  }

  @Test
  public void testValidatorMapsSynonyms() throws Exception {
    // Arrange
    NamespaceValidator synonyms = new NamespaceValidator() {
      @Override
      public boolean isDefined(String namespace) {
        return true;
      }

      @Override
      public boolean isMember(String namespace, String name) {
        return true;
      }

      @Override
      public NamespaceValue resolve(String namespace, String name) throws InvalidNamespaceException {
        return "PKB".equals(name) ? new NamespaceValue(namespace, "AKT1") : new NamespaceValue(namespace, name);
      }
    };
    TermParser mappingParser = new TermParser(synonyms);

    // Act
    SimpleAbundance protein = (SimpleAbundance) mappingParser.parseTerm("p(HGNC:PKB)");

    // Assert
    assertEquals("Synonym is replaced by its preferred name", new NamespaceValue("HGNC", "AKT1"),
        protein.getIdentifier());
  }
}
