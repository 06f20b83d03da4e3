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
import com.twentyn.bel.model.variant.Variant;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A gene, RNA, miRNA or protein with one or more variants, e.g. p(HGNC:AKT1, pmod(Ph, Ser, 473)). Variants keep
 * the order they were written in.
 */
public class ModifiedAbundance extends AbundanceTerm {
  private final BelFunction function;
  private final NamespaceValue identifier;
  private final List<Variant> variants;

  public ModifiedAbundance(BelFunction function, NamespaceValue identifier, List<Variant> variants) {
    this(function, identifier, variants, null);
  }

  public ModifiedAbundance(BelFunction function, NamespaceValue identifier, List<Variant> variants,
                           NamespaceValue location) {
    super(location);
    if (function == null || !function.isCentralDogma()) {
      throw new IllegalArgumentException(String.format("%s abundances cannot carry variants", function));
    }
    this.function = function;
    this.identifier = identifier;
    this.variants = variants == null ? new ArrayList<>() : new ArrayList<>(variants);
  }

  @Override
  public BelFunction getFunction() {
    return function;
  }

  public NamespaceValue getIdentifier() {
    return identifier;
  }

  public List<Variant> getVariants() {
    return Collections.unmodifiableList(variants);
  }

  /**
   * @return The same abundance without its variants or location.
   */
  public SimpleAbundance getParent() {
    return new SimpleAbundance(function, identifier);
  }

  @Override
  public <R, E extends Exception> R accept(TermVisitor<R, E> visitor) throws E {
    return visitor.visitModifiedAbundance(this);
  }
}
