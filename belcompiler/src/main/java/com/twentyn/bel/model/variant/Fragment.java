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

import com.twentyn.bel.model.Coordinate;

import java.util.Objects;
import java.util.Optional;

/**
 * A proteolytic fragment. A fragment whose range was written as a bare "?" is missing its range entirely, which
 * is different from a range with unknown endpoints such as ?_*.
 */
public class Fragment extends Variant {
  private final Coordinate start;
  private final Coordinate stop;
  private final String description;

  private Fragment(Coordinate start, Coordinate stop, String description) {
    this.start = start;
    this.stop = stop;
    this.description = description;
  }

  public static Fragment missing(String description) {
    return new Fragment(null, null, description);
  }

  public static Fragment of(Coordinate start, Coordinate stop, String description) {
    if (start == null || stop == null) {
      throw new IllegalArgumentException("Fragment ranges need start and stop coordinates.");
    }
    if (start.isEnd()) {
      throw new IllegalArgumentException("A fragment cannot start at the end of the sequence.");
    }
    return new Fragment(start, stop, description);
  }

  public boolean isMissing() {
    return start == null;
  }

  public Coordinate getStart() {
    return start;
  }

  public Coordinate getStop() {
    return stop;
  }

  public Optional<String> getDescription() {
    return Optional.ofNullable(description);
  }

  @Override
  public <R> R accept(VariantVisitor<R> visitor) {
    return visitor.visitFragment(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Fragment)) {
      return false;
    }
    Fragment fragment = (Fragment) o;
    return Objects.equals(start, fragment.start) && Objects.equals(stop, fragment.stop)
        && Objects.equals(description, fragment.description);
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, stop, description);
  }
}
