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
 * The breakpoint range of one fusion partner, either "?" or a reference sequence type (r, p or c) with start and
 * stop coordinates.
 */
public class FusionRange {
  private static final FusionRange MISSING = new FusionRange(null, null, null);

  private final Character reference;
  private final Coordinate start;
  private final Coordinate stop;

  private FusionRange(Character reference, Coordinate start, Coordinate stop) {
    this.reference = reference;
    this.start = start;
    this.stop = stop;
  }

  public static FusionRange missing() {
    return MISSING;
  }

  public static FusionRange of(char reference, Coordinate start, Coordinate stop) {
    if ("rpc".indexOf(reference) < 0) {
      throw new IllegalArgumentException(String.format("Invalid fusion reference sequence type: %s", reference));
    }
    if (start == null || stop == null) {
      throw new IllegalArgumentException("Fusion ranges need start and stop coordinates.");
    }
    return new FusionRange(reference, start, stop);
  }

  public boolean isMissing() {
    return reference == null;
  }

  public char getReference() {
    return reference;
  }

  public Coordinate getStart() {
    return start;
  }

  public Coordinate getStop() {
    return stop;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FusionRange)) {
      return false;
    }
    FusionRange that = (FusionRange) o;
    return Objects.equals(reference, that.reference) && Objects.equals(start, that.start)
        && Objects.equals(stop, that.stop);
  }

  @Override
  public int hashCode() {
    return Objects.hash(reference, start, stop);
  }

  @Override
  public String toString() {
    if (isMissing()) {
      return "?";
    }
    return String.format("%s.%s_%s", reference, start, stop);
  }
}
