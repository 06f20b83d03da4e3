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

/**
 * A complex referenced by name from a namespace, complex(SCOMP:"AP-1 Complex"). Unlike {@link ComplexList} it is
 * keyed by its identifier, not by its members.
 */
public class NamedComplex extends AbundanceTerm {
  private final NamespaceValue identifier;

  public NamedComplex(NamespaceValue identifier) {
    this(identifier, null);
  }

  public NamedComplex(NamespaceValue identifier, NamespaceValue location) {
    super(location);
    this.identifier = identifier;
  }

  @Override
  public BelFunction getFunction() {
    return BelFunction.COMPLEX;
  }

  public NamespaceValue getIdentifier() {
    return identifier;
  }

  @Override
  public <R, E extends Exception> R accept(TermVisitor<R, E> visitor) throws E {
    return visitor.visitNamedComplex(this);
  }
}
