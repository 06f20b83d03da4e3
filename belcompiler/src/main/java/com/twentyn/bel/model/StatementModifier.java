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
 * What a statement says about one of its terms beyond the node it resolves to: an activity or transformation
 * wrapped around the abundance, and the abundance's location.
 */
public class StatementModifier {
  private final ModifierKind kind;
  private final NamespaceValue molecularActivity;
  private final NamespaceValue fromLocation;
  private final NamespaceValue toLocation;
  private final NamespaceValue location;

  public StatementModifier(ModifierKind kind, NamespaceValue molecularActivity, NamespaceValue fromLocation,
                           NamespaceValue toLocation, NamespaceValue location) {
    this.kind = kind;
    this.molecularActivity = molecularActivity;
    this.fromLocation = fromLocation;
    this.toLocation = toLocation;
    this.location = location;
  }

  /**
   * Extracts the modifier of a statement's subject or object, if it has one.
   */
  public static Optional<StatementModifier> fromTerm(Term term) {
    if (term instanceof Activity) {
      Activity activity = (Activity) term;
      return Optional.of(new StatementModifier(ModifierKind.ACTIVITY, activity.getMolecularActivity().orElse(null),
          null, null, activity.getTarget().getLocation().orElse(null)));
    }
    if (term instanceof Transformation) {
      Transformation transformation = (Transformation) term;
      return Optional.of(new StatementModifier(transformation.getKind(), null,
          transformation.getFromLocation().orElse(null), transformation.getToLocation().orElse(null),
          transformation.getTarget().getLocation().orElse(null)));
    }
    if (term instanceof AbundanceTerm) {
      return ((AbundanceTerm) term).getLocation()
          .map(location -> new StatementModifier(null, null, null, null, location));
    }
    return Optional.empty();
  }

  public Optional<ModifierKind> getKind() {
    return Optional.ofNullable(kind);
  }

  public Optional<NamespaceValue> getMolecularActivity() {
    return Optional.ofNullable(molecularActivity);
  }

  public Optional<NamespaceValue> getFromLocation() {
    return Optional.ofNullable(fromLocation);
  }

  public Optional<NamespaceValue> getToLocation() {
    return Optional.ofNullable(toLocation);
  }

  public Optional<NamespaceValue> getLocation() {
    return Optional.ofNullable(location);
  }
}
