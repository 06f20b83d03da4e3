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

/**
 * A sequence position. Besides known integers, BEL allows "?" for an unknown position and "*" for the end of the
 * sequence; both are explicit values rather than nulls.
 */
public final class Coordinate {
  public static final Coordinate UNKNOWN = new Coordinate(null, "?");
  public static final Coordinate END = new Coordinate(null, "*");

  private final Integer value;
  private final String symbol;

  private Coordinate(Integer value, String symbol) {
    this.value = value;
    this.symbol = symbol;
  }

  public static Coordinate of(int value) {
    return new Coordinate(value, null);
  }

  /**
   * Parses an integer, "?" or "*".
   */
  public static Coordinate fromToken(String token) {
    if (UNKNOWN.symbol.equals(token)) {
      return UNKNOWN;
    }
    if (END.symbol.equals(token)) {
      return END;
    }
    try {
      return of(Integer.parseInt(token));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(String.format("Not a sequence coordinate: %s", token), e);
    }
  }

  public boolean isKnown() {
    return value != null;
  }

  public boolean isUnknown() {
    return this == UNKNOWN;
  }

  public boolean isEnd() {
    return this == END;
  }

  public int getValue() {
    if (value == null) {
      throw new IllegalStateException(String.format("Coordinate %s has no numeric value", symbol));
    }
    return value;
  }

  /**
   * @return The integer for known positions, otherwise the placeholder symbol.
   */
  public Object toKeyPart() {
    return value != null ? value : symbol;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Coordinate)) {
      return false;
    }
    Coordinate that = (Coordinate) o;
    return value != null ? value.equals(that.value) : symbol.equals(that.symbol);
  }

  @Override
  public int hashCode() {
    return toKeyPart().hashCode();
  }

  @Override
  public String toString() {
    return value != null ? value.toString() : symbol;
  }
}
