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

import com.twentyn.bel.language.ModifierKind;

import java.util.Optional;

/**
 * Degradation, translocation, cell secretion or cell surface expression of an abundance. Only translocations carry
 * explicit locations; the legacy single-argument translocation carries none.
 */
public class Transformation extends Term {
  private final ModifierKind kind;
  private final AbundanceTerm target;
  private final NamespaceValue fromLocation;
  private final NamespaceValue toLocation;

  public Transformation(ModifierKind kind, AbundanceTerm target) {
    this(kind, target, null, null);
  }

  public Transformation(ModifierKind kind, AbundanceTerm target, NamespaceValue fromLocation,
                        NamespaceValue toLocation) {
    if (kind == null || kind == ModifierKind.ACTIVITY) {
      throw new IllegalArgumentException(String.format("%s is not a transformation", kind));
    }
    if (target == null) {
      throw new IllegalArgumentException("Transformations need a target abundance.");
    }
    if ((fromLocation == null) != (toLocation == null)) {
      throw new IllegalArgumentException("Translocations need both or neither of their locations.");
    }
    if (fromLocation != null && kind != ModifierKind.TRANSLOCATION) {
      throw new IllegalArgumentException(String.format("%s does not take locations", kind));
    }
    this.kind = kind;
    this.target = target;
    this.fromLocation = fromLocation;
    this.toLocation = toLocation;
  }

  public ModifierKind getKind() {
    return kind;
  }

  public AbundanceTerm getTarget() {
    return target;
  }

  public Optional<NamespaceValue> getFromLocation() {
    return Optional.ofNullable(fromLocation);
  }

  public Optional<NamespaceValue> getToLocation() {
    return Optional.ofNullable(toLocation);
  }

  @Override
  public <R, E extends Exception> R accept(TermVisitor<R, E> visitor) throws E {
    return visitor.visitTransformation(this);
  }
}
