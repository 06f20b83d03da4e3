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

import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;

public class NodeInternerTest {
  private static final NodeKey FOS = NodeKey.of("Protein", "HGNC", "FOS");
  private static final NodeKey JUN = NodeKey.of("Protein", "HGNC", "JUN");

  private NodeInterner interner;

  @Before
  public void setUp() {
    interner = new NodeInterner();
  }

  @Test
  public void testIdsStartAtOneAndAreStable() {
    int first = interner.intern(NodeInterner.memberTuple("Complex", Arrays.asList(FOS, JUN)));
    int again = interner.intern(NodeInterner.memberTuple("Complex", Arrays.asList(JUN, FOS)));
    int composite = interner.intern(NodeInterner.memberTuple("Composite", Arrays.asList(FOS, JUN)));

    assertEquals("First id should be 1", 1, first);
    assertEquals("Member order should not matter", first, again);
    assertEquals("A different type gets the next id", 2, composite);
    assertEquals("Two distinct tuples", 2, interner.getNodeCount());
  }

  @Test
  public void testReactionSidesMatter() {
    List<Object> forward = NodeInterner.reactionTuple("Reaction", Arrays.asList(FOS), Arrays.asList(JUN));
    List<Object> backward = NodeInterner.reactionTuple("Reaction", Arrays.asList(JUN), Arrays.asList(FOS));
    assertNotEquals("Swapping sides is a different reaction", interner.intern(forward), interner.intern(backward));
  }

  @Test
  public void testLookupAndReset() {
    List<Object> tuple = NodeInterner.memberTuple("Complex", Arrays.asList(FOS));
    interner.intern(tuple);

    assertEquals("Lookup finds interned tuples", Optional.of(1), interner.lookup(tuple));
    assertEquals("Id maps back to the tuple", Optional.of(tuple), interner.getMembers(1));

    interner.reset();
    assertFalse("Reset forgets everything", interner.lookup(tuple).isPresent());
    assertEquals("Ids restart after reset", 1, interner.intern(tuple));
  }
}
