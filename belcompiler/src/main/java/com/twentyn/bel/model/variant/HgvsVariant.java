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

/**
 * A sequence variant in (a subset of) HGVS notation, e.g. p.Gly576Ala or c.1521_1523delCTT.
 */
public class HgvsVariant extends Variant {
  private final String description;

  public HgvsVariant(String description) {
    if (description == null || description.isEmpty()) {
      throw new IllegalArgumentException("Variants need a description.");
    }
    this.description = description;
  }

  public String getDescription() {
    return description;
  }

  @Override
  public <R> R accept(VariantVisitor<R> visitor) {
    return visitor.visitHgvsVariant(this);
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof HgvsVariant && description.equals(((HgvsVariant) o).description));
  }

  @Override
  public int hashCode() {
    return description.hashCode();
  }
}
