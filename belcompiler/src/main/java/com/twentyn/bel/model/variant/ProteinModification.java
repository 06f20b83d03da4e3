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

import com.twentyn.bel.language.AminoAcid;
import com.twentyn.bel.model.NamespaceValue;

import java.util.Objects;
import java.util.Optional;

/**
 * A post-translational modification, optionally pinned to a residue and a position: pmod(Ph, Ser, 473).
 * Modifications from the default BEL vocabulary use the "bel" namespace.
 */
public class ProteinModification extends Variant {
  private final NamespaceValue modification;
  private final AminoAcid aminoAcid;
  private final Integer position;

  public ProteinModification(NamespaceValue modification, AminoAcid aminoAcid, Integer position) {
    if (modification == null) {
      throw new IllegalArgumentException("Protein modifications need a modification name.");
    }
    if (position != null && aminoAcid == null) {
      throw new IllegalArgumentException("A modification position needs an amino acid.");
    }
    this.modification = modification;
    this.aminoAcid = aminoAcid;
    this.position = position;
  }

  public NamespaceValue getModification() {
    return modification;
  }

  public Optional<AminoAcid> getAminoAcid() {
    return Optional.ofNullable(aminoAcid);
  }

  public Optional<Integer> getPosition() {
    return Optional.ofNullable(position);
  }

  @Override
  public <R> R accept(VariantVisitor<R> visitor) {
    return visitor.visitProteinModification(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ProteinModification)) {
      return false;
    }
    ProteinModification that = (ProteinModification) o;
    return modification.equals(that.modification) && aminoAcid == that.aminoAcid
        && Objects.equals(position, that.position);
  }

  @Override
  public int hashCode() {
    return Objects.hash(modification, aminoAcid, position);
  }
}
