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
 * A biological process, bp(GO:apoptosis), or a pathology, path(MESH:Psoriasis).
 */
public class ProcessTerm extends Term {
  private final BelFunction function;
  private final NamespaceValue identifier;

  public ProcessTerm(BelFunction function, NamespaceValue identifier) {
    if (function != BelFunction.BIOLOGICAL_PROCESS && function != BelFunction.PATHOLOGY) {
      throw new IllegalArgumentException(String.format("%s is not a process function", function));
    }
    this.function = function;
    this.identifier = identifier;
  }

  public BelFunction getFunction() {
    return function;
  }

  public NamespaceValue getIdentifier() {
    return identifier;
  }

  @Override
  public <R, E extends Exception> R accept(TermVisitor<R, E> visitor) throws E {
    return visitor.visitProcess(this);
  }
}
