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

public class FusedAbundance extends AbundanceTerm {
  private final BelFunction function;
  private final Fusion fusion;

  public FusedAbundance(BelFunction function, Fusion fusion) {
    this(function, fusion, null);
  }

  public FusedAbundance(BelFunction function, Fusion fusion, NamespaceValue location) {
    super(location);
    if (function != BelFunction.GENE && function != BelFunction.RNA && function != BelFunction.PROTEIN) {
      throw new IllegalArgumentException(String.format("%s abundances cannot be fused", function));
    }
    this.function = function;
    this.fusion = fusion;
  }

  @Override
  public BelFunction getFunction() {
    return function;
  }

  public Fusion getFusion() {
    return fusion;
  }

  @Override
  public <R, E extends Exception> R accept(TermVisitor<R, E> visitor) throws E {
    return visitor.visitFusedAbundance(this);
  }
}
