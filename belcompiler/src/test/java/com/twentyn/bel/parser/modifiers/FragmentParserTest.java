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
import com.twentyn.bel.model.variant.Fragment;
import org.junit.Test;

import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class FragmentParserTest {
  private final FragmentParser parser = new FragmentParser();

  @Test
  public void testKnownRange() throws Exception {
    Fragment fragment = parser.parse("frag(5_20)");
    assertEquals("Start should be 5", Coordinate.of(5), fragment.getStart());
    assertEquals("Stop should be 20", Coordinate.of(20), fragment.getStop());
    assertFalse("No description was given", fragment.getDescription().isPresent());
  }

  @Test
  public void testQuotedRangeWithUnknownsAndDescription() throws Exception {
    Fragment fragment = parser.parse("fragment(\"?_*\", \"55kD\")");
    assertTrue("Unknown start should be explicit", fragment.getStart().isUnknown());
    assertTrue("Star means the end of the sequence", fragment.getStop().isEnd());
    assertEquals("Description should be kept", Optional.of("55kD"), fragment.getDescription());
  }

  @Test
  public void testMissingRange() throws Exception {
    Fragment fragment = parser.parse("frag(?)");
    assertTrue("A bare question mark means no range at all", fragment.isMissing());
  }

  @Test(expected = BelSyntaxException.class)
  public void testMalformedRangeFails() throws Exception {
    parser.parse("frag(5-20)");
  }
}
