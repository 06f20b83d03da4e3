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
import com.twentyn.bel.model.Coordinate;
import com.twentyn.bel.model.Fusion;
import com.twentyn.bel.model.NamespaceValue;
import com.twentyn.bel.parser.IdentifierParser;
import com.twentyn.bel.parser.NamespaceValidator;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class FusionParserTest {
  private final FusionParser parser = new FusionParser(new IdentifierParser(NamespaceValidator.PERMISSIVE));

  @Test
  public void testFullFusion() throws Exception {
    Fusion fusion = parser.parse("fus(HGNC:TMPRSS2, r.1_79, HGNC:ERG, r.312_5034)");
    assertEquals("5' partner", new NamespaceValue("HGNC", "TMPRSS2"), fusion.getPartner5p());
    assertEquals("5' range reference", 'r', fusion.getRange5p().getReference());
    assertEquals("5' range stop", Coordinate.of(79), fusion.getRange5p().getStop());
    assertEquals("3' partner", new NamespaceValue("HGNC", "ERG"), fusion.getPartner3p());
    assertEquals("3' range start", Coordinate.of(312), fusion.getRange3p().getStart());
  }

  @Test
  public void testMissingRangesAndUnknownCoordinates() throws Exception {
    Fusion fusion = parser.parse("fusion(HGNC:BCR, \"?\", HGNC:JAK2, p.?_1000)");
    assertTrue("A bare ? range is missing", fusion.getRange5p().isMissing());
    assertTrue("? coordinates are unknown", fusion.getRange3p().getStart().isUnknown());
  }

  @Test(expected = BelSyntaxException.class)
  public void testInvalidReferenceFails() throws Exception {
    parser.parse("fus(HGNC:BCR, x.1_2, HGNC:JAK2, r.3_4)");
  }
}
