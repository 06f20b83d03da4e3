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

import com.twentyn.bel.language.BelConstants;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A directed, keyed edge. Unqualified edges are keyed by their relation name so that repeats collapse; qualified
 * edges get a fresh integer key per asserted statement.
 */
public class BelEdge {
  private final NodeKey source;
  private final NodeKey target;
  private final Object key;
  private final Map<String, Object> attributes;
  private final boolean qualified;

  BelEdge(NodeKey source, NodeKey target, Object key, Map<String, Object> attributes, boolean qualified) {
    this.source = source;
    this.target = target;
    this.key = key;
    this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    this.qualified = qualified;
  }

  public NodeKey getSource() {
    return source;
  }

  public NodeKey getTarget() {
    return target;
  }

  public Object getKey() {
    return key;
  }

  public Map<String, Object> getAttributes() {
    return attributes;
  }

  public boolean isQualified() {
    return qualified;
  }

  public String getRelation() {
    return (String) attributes.get(BelConstants.RELATION);
  }

  @Override
  public String toString() {
    return String.format("%s -[%s %s]-> %s", source, key, getRelation(), target);
  }
}
