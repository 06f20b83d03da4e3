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

package com.twentyn.bel.model.variant;

import java.util.Objects;

/**
 * BEL 1.0 substitution, sub(reference, position, variant). Protein substitutions carry three-letter amino acid
 * codes, gene substitutions carry nucleotides.
 */
public class Substitution extends Variant {
  private final String reference;
  private final int position;
  private final String variant;

  public Substitution(String reference, int position, String variant) {
    if (reference == null || variant == null) {
      throw new IllegalArgumentException("Substitutions need both a reference and a variant.");
    }
    this.reference = reference;
    this.position = position;
    this.variant = variant;
  }

  public String getReference() {
    return reference;
  }

  public int getPosition() {
    return position;
  }

  public String getVariant() {
    return variant;
  }

  @Override
  public <R> R accept(VariantVisitor<R> visitor) {
    return visitor.visitSubstitution(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Substitution)) {
      return false;
    }
    Substitution that = (Substitution) o;
    return position == that.position && reference.equals(that.reference) && variant.equals(that.variant);
  }

  @Override
  public int hashCode() {
    return Objects.hash(reference, position, variant);
  }
}
