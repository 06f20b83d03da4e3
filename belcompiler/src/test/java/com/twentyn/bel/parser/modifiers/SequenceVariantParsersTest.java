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

package com.twentyn.bel.parser.modifiers;

import com.twentyn.bel.exceptions.BelSyntaxException;
import com.twentyn.bel.model.NamespaceValue;
import com.twentyn.bel.model.variant.Substitution;
import com.twentyn.bel.parser.BelScanner;
import com.twentyn.bel.parser.IdentifierParser;
import com.twentyn.bel.parser.NamespaceValidator;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

/**
 * Tests for the variant, substitution, truncation, location and molecular activity grammars.
 */
public class SequenceVariantParsersTest {

  @Test
  public void testHgvsForms() throws Exception {
    VariantParser parser = new VariantParser();
    assertEquals("Protein HGVS", "p.Phe508del", parser.parse("var(\"p.Phe508del\")").getDescription());
    assertEquals("Reference allele", "=", parser.parse("variant(\"=\")").getDescription());
    assertEquals("Bare deletion", "delCTT", parser.parse("var(delCTT)").getDescription());
  }

  @Test(expected = BelSyntaxException.class)
  public void testHgvsWithoutSequenceTypeFails() throws Exception {
    new VariantParser().parse("var(\"Phe508del\")");
  }

  @Test
  public void testProteinSubstitutionNormalizesResidues() throws Exception {
    BelScanner scanner = new BelScanner("sub(G, 12, V)");
    Substitution substitution = new SubstitutionParser(SubstitutionParser.SequenceType.PROTEIN).parse(scanner);
    assertEquals("Reference residue", "Gly", substitution.getReference());
    assertEquals("Position", 12, substitution.getPosition());
    assertEquals("Variant residue", "Val", substitution.getVariant());
    assertEquals("Substitutions are legacy syntax", 1, scanner.getLegacyWarnings().size());
  }

  @Test
  public void testGeneSubstitutionTakesNucleotides() throws Exception {
    Substitution substitution = new SubstitutionParser(SubstitutionParser.SequenceType.GENE).parse("sub(c, 308, a)");
    assertEquals("Nucleotides should be upper case", "C", substitution.getReference());
    assertEquals("Nucleotides should be upper case", "A", substitution.getVariant());
  }

  @Test(expected = BelSyntaxException.class)
  public void testGeneSubstitutionRejectsAminoAcids() throws Exception {
    new SubstitutionParser(SubstitutionParser.SequenceType.GENE).parse("sub(Gly, 12, Val)");
  }

  @Test
  public void testTruncation() throws Exception {
    BelScanner scanner = new BelScanner("trunc(40)");
    assertEquals("Truncation position", 40, new TruncationParser().parse(scanner).getPosition());
    assertEquals("Truncations are legacy syntax", 1, scanner.getLegacyWarnings().size());
  }

  @Test
  public void testLocation() throws Exception {
    LocationParser parser = new LocationParser(new IdentifierParser(NamespaceValidator.PERMISSIVE));
    assertEquals("Location identifier", new NamespaceValue("GOCC", "cell surface"),
        parser.parse("loc(GOCC:\"cell surface\")"));
  }

  @Test
  public void testMolecularActivity() throws Exception {
    MolecularActivityParser parser = new MolecularActivityParser(new IdentifierParser(NamespaceValidator.PERMISSIVE));
    assertEquals("Long names map to the short code", new NamespaceValue("bel", "kin"),
        parser.parse("molecularActivity(kinaseActivity)"));
    assertEquals("Namespaced activities are kept", new NamespaceValue("GOMF", "kinase activity"),
        parser.parse("ma(GOMF:\"kinase activity\")"));
  }

  @Test(expected = BelSyntaxException.class)
  public void testUnknownMolecularActivityFails() throws Exception {
    new MolecularActivityParser(new IdentifierParser(NamespaceValidator.PERMISSIVE)).parse("ma(dance)");
  }
}
