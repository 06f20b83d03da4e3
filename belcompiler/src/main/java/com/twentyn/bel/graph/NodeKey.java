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

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The canonical identity of a graph node: an immutable tuple derived only from the structure of the term it was
 * built from. Parts are strings, integers or nested lists of the same.
 */
public final class NodeKey implements Comparable<NodeKey> {
  private final List<Object> parts;

  private NodeKey(List<Object> parts) {
    this.parts = Collections.unmodifiableList(new ArrayList<>(parts));
  }

  public static NodeKey of(Object... parts) {
    return of(Arrays.asList(parts));
  }

  public static NodeKey of(List<?> parts) {
    if (parts == null || parts.isEmpty()) {
      throw new IllegalArgumentException("A node key needs at least a type.");
    }
    return new NodeKey(new ArrayList<Object>(parts));
  }

  public List<Object> getParts() {
    return parts;
  }

  /**
   * The node type this key was built for, e.g. Protein or Complex.
   */
  public String getType() {
    return parts.get(0).toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return parts.equals(((NodeKey) o).parts);
  }

  @Override
  public int hashCode() {
    return parts.hashCode();
  }

  /**
   * Orders keys part by part: numbers before strings before nested lists, numbers by value, strings
   * lexicographically, lists element-wise with a shorter prefix first. Consistent with {@link #equals}.
   */
  @Override
  public int compareTo(NodeKey o) {
    return compareLists(parts, o.parts);
  }

  private static int compareLists(List<?> left, List<?> right) {
    int shared = Math.min(left.size(), right.size());
    for (int i = 0; i < shared; i++) {
      int result = compareParts(left.get(i), right.get(i));
      if (result != 0) {
        return result;
      }
    }
    return Integer.compare(left.size(), right.size());
  }

  private static int compareParts(Object left, Object right) {
    int rank = Integer.compare(rank(left), rank(right));
    if (rank != 0) {
      return rank;
    }
    if (left instanceof Number) {
      return Long.compare(((Number) left).longValue(), ((Number) right).longValue());
    }
    if (left instanceof List) {
      return compareLists((List<?>) left, (List<?>) right);
    }
    return left.toString().compareTo(right.toString());
  }

  private static int rank(Object part) {
    if (part instanceof Number) {
      return 0;
    }
    if (part instanceof List) {
      return 2;
    }
    return 1;
  }

  @Override
  public String toString() {
    return String.format("(%s)", StringUtils.join(parts, ", "));
  }
}
