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
import com.twentyn.bel.language.AminoAcid;
import com.twentyn.bel.model.NamespaceValue;
import com.twentyn.bel.model.variant.ProteinModification;
import com.twentyn.bel.parser.BelScanner;
import com.twentyn.bel.parser.IdentifierParser;
import com.twentyn.bel.parser.NamespaceValidator;
import org.junit.Before;
import org.junit.Test;

import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ProteinModificationParserTest {
  private ProteinModificationParser parser;

  @Before
  public void setUp() {
    parser = new ProteinModificationParser(new IdentifierParser(NamespaceValidator.PERMISSIVE));
  }

  @Test
  public void testLongNameNormalizesToCode() throws Exception {
    ProteinModification modification = parser.parse("proteinModification(phosphorylation)");
    assertEquals("Long names should map to the BEL code", new NamespaceValue("bel", "Ph"),
        modification.getModification());
    assertFalse("No residue was given", modification.getAminoAcid().isPresent());
  }

  @Test
  public void testOneLetterResidueNormalizesToThreeLetters() throws Exception {
    ProteinModification modification = parser.parse("pmod(Ph, S, 473)");
    assertEquals("Residue should be normalized", Optional.of(AminoAcid.SER), modification.getAminoAcid());
    assertEquals("Position should be kept", Optional.of(473), modification.getPosition());
  }

  @Test
  public void testNamespacedModification() throws Exception {
    ProteinModification modification = parser.parse("pmod(MOD:\"sulfated residue\")");
    assertEquals("Namespaced modifications keep their namespace", new NamespaceValue("MOD", "sulfated residue"),
        modification.getModification());
  }

  @Test
  public void testLegacyLetterIsNotedAndMapped() throws Exception {
    // Arrange
    BelScanner scanner = new BelScanner("pmod(P, Y, 1234)");

    // Act
    ProteinModification modification = parser.parse(scanner);

    // Assert
    assertEquals("Legacy P means phosphorylation", "Ph", modification.getModification().getName());
    assertEquals("Legacy syntax should be noted once", 1, scanner.getLegacyWarnings().size());
  }

  @Test
  public void testLegacyOtherIsKept() throws Exception {
    BelScanner scanner = new BelScanner("pmod(O)");
    ProteinModification modification = parser.parse(scanner);
    assertEquals("The legacy catch-all has no replacement", "O", modification.getModification().getName());
    assertTrue("Legacy syntax should be noted", !scanner.getLegacyWarnings().isEmpty());
  }

  @Test(expected = BelSyntaxException.class)
  public void testUnknownModificationFails() throws Exception {
    parser.parse("pmod(Zz)");
  }

  @Test(expected = BelSyntaxException.class)
  public void testUnknownResidueFails() throws Exception {
    parser.parse("pmod(Ph, Xyz, 12)");
  }
}
