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

import java.util.Optional;

/**
 * act(target) or act(target, ma(...)). The activity is a property of the statement, not of the target node.
 */
public class Activity extends Term {
  private final AbundanceTerm target;
  private final NamespaceValue molecularActivity;

  public Activity(AbundanceTerm target, NamespaceValue molecularActivity) {
    if (target == null) {
      throw new IllegalArgumentException("Activities need a target abundance.");
    }
    this.target = target;
    this.molecularActivity = molecularActivity;
  }

  public AbundanceTerm getTarget() {
    return target;
  }

  public Optional<NamespaceValue> getMolecularActivity() {
    return Optional.ofNullable(molecularActivity);
  }

  @Override
  public <R, E extends Exception> R accept(TermVisitor<R, E> visitor) throws E {
    return visitor.visitActivity(this);
  }
}
