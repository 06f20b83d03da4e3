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

import java.util.Objects;

/**
 * The two partners of a gene, RNA or protein fusion and the range each partner contributes.
 */
public class Fusion {
  private final NamespaceValue partner5p;
  private final FusionRange range5p;
  private final NamespaceValue partner3p;
  private final FusionRange range3p;

  public Fusion(NamespaceValue partner5p, FusionRange range5p, NamespaceValue partner3p, FusionRange range3p) {
    this.partner5p = partner5p;
    this.range5p = range5p;
    this.partner3p = partner3p;
    this.range3p = range3p;
  }

  public NamespaceValue getPartner5p() {
    return partner5p;
  }

  public FusionRange getRange5p() {
    return range5p;
  }

  public NamespaceValue getPartner3p() {
    return partner3p;
  }

  public FusionRange getRange3p() {
    return range3p;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Fusion)) {
      return false;
    }
    Fusion fusion = (Fusion) o;
    return Objects.equals(partner5p, fusion.partner5p) && Objects.equals(range5p, fusion.range5p)
        && Objects.equals(partner3p, fusion.partner3p) && Objects.equals(range3p, fusion.range3p);
  }

  @Override
  public int hashCode() {
    return Objects.hash(partner5p, range5p, partner3p, range3p);
  }
}
