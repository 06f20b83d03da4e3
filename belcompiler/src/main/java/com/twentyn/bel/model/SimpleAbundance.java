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

import java.util.EnumSet;
import java.util.Set;

/**
 * An abundance named by a single identifier: a(CHEBI:water), g(HGNC:AKT1), p(HGNC:AKT1), ...
 */
public class SimpleAbundance extends AbundanceTerm {
  private static final Set<BelFunction> FUNCTIONS =
      EnumSet.of(BelFunction.ABUNDANCE, BelFunction.GENE, BelFunction.MIRNA, BelFunction.PROTEIN, BelFunction.RNA);

  private final BelFunction function;
  private final NamespaceValue identifier;

  public SimpleAbundance(BelFunction function, NamespaceValue identifier) {
    this(function, identifier, null);
  }

  public SimpleAbundance(BelFunction function, NamespaceValue identifier, NamespaceValue location) {
    super(location);
    if (!FUNCTIONS.contains(function)) {
      throw new IllegalArgumentException(String.format("%s is not a single abundance function", function));
    }
    this.function = function;
    this.identifier = identifier;
  }

  @Override
  public BelFunction getFunction() {
    return function;
  }

  public NamespaceValue getIdentifier() {
    return identifier;
  }

  @Override
  public <R, E extends Exception> R accept(TermVisitor<R, E> visitor) throws E {
    return visitor.visitSimpleAbundance(this);
  }
}
