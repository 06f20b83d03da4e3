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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Allocates stable integer ids to structural aggregates (complex lists, composites and reactions). The same member
 * tuple always maps to the same id; ids are handed out in first-seen order starting from 1.
 */
public class NodeInterner {
  private static final Logger LOGGER = LogManager.getFormatterLogger(NodeInterner.class);

  private int nodeCount = 0;
  private final Map<List<Object>, Integer> nodeToId = new HashMap<>();
  private final Map<Integer, List<Object>> idToNode = new HashMap<>();

  /**
   * Key for complex lists and composites. Member order does not matter.
   */
  public static List<Object> memberTuple(String type, List<NodeKey> members) {
    List<Object> tuple = new ArrayList<>();
    tuple.add(type);
    tuple.add(sortedParts(members));
    return tuple;
  }

  /**
   * Key for reactions, which differ by which side of the reaction a member is on.
   */
  public static List<Object> reactionTuple(String type, List<NodeKey> reactants, List<NodeKey> products) {
    List<Object> tuple = new ArrayList<>();
    tuple.add(type);
    tuple.add(sortedParts(reactants));
    tuple.add(sortedParts(products));
    return tuple;
  }

  private static List<Object> sortedParts(List<NodeKey> keys) {
    List<NodeKey> sorted = new ArrayList<>(keys);
    Collections.sort(sorted);
    List<Object> parts = new ArrayList<>(sorted.size());
    for (NodeKey key : sorted) {
      parts.add(key.getParts());
    }
    return Collections.unmodifiableList(parts);
  }

  public int intern(List<Object> memberTuple) {
    Integer id = nodeToId.get(memberTuple);
    if (id != null) {
      return id;
    }
    nodeCount++;
    List<Object> copy = Collections.unmodifiableList(new ArrayList<>(memberTuple));
    nodeToId.put(copy, nodeCount);
    idToNode.put(nodeCount, copy);
    LOGGER.debug("Interned %s as %d", copy, nodeCount);
    return nodeCount;
  }

  public Optional<Integer> lookup(List<Object> memberTuple) {
    return Optional.ofNullable(nodeToId.get(memberTuple));
  }

  public Optional<List<Object>> getMembers(int id) {
    return Optional.ofNullable(idToNode.get(id));
  }

  public int getNodeCount() {
    return nodeCount;
  }

  public void reset() {
    nodeCount = 0;
    nodeToId.clear();
    idToNode.clear();
  }
}
