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

import com.twentyn.bel.language.BelFunction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A complex described by its members, complex(p(HGNC:FOS), p(HGNC:JUN)).
 */
public class ComplexList extends AbundanceTerm {
  private final List<AbundanceTerm> members;

  public ComplexList(List<? extends AbundanceTerm> members) {
    this(members, null);
  }

  public ComplexList(List<? extends AbundanceTerm> members, NamespaceValue location) {
    super(location);
    this.members = members == null ? new ArrayList<>() : new ArrayList<>(members);
  }

  @Override
  public BelFunction getFunction() {
    return BelFunction.COMPLEX;
  }

  public List<AbundanceTerm> getMembers() {
    return Collections.unmodifiableList(members);
  }

  @Override
  public <R, E extends Exception> R accept(TermVisitor<R, E> visitor) throws E {
    return visitor.visitComplexList(this);
  }
}
