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

package com.twentyn.bel.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * list(...), only meaningful as the object of hasMembers. It never becomes a node; the members are linked to the
 * subject one by one.
 */
public class AbundanceList extends Term {
  private final List<AbundanceTerm> members;

  public AbundanceList(List<? extends AbundanceTerm> members) {
    this.members = members == null ? new ArrayList<>() : new ArrayList<>(members);
  }

  public List<AbundanceTerm> getMembers() {
    return Collections.unmodifiableList(members);
  }

  @Override
  public <R, E extends Exception> R accept(TermVisitor<R, E> visitor) throws E {
    return visitor.visitAbundanceList(this);
  }
}
