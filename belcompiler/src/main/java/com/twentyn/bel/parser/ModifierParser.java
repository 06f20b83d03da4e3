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

package com.twentyn.bel.parser;

import com.twentyn.bel.exceptions.BelException;

/**
 * Base for the small function-shaped sub-languages (pmod, var, frag, loc, fus, ...). Each is written with a short
 * and a long tag around a parenthesized argument list; subclasses parse only the arguments.
 *
 * @param <T> The descriptor the function produces.
 */
public abstract class ModifierParser<T> implements GrammarRule<T> {
  private final String shortTag;
  private final String longTag;

  protected ModifierParser(String shortTag, String longTag) {
    this.shortTag = shortTag;
    this.longTag = longTag;
  }

  public boolean acceptsTag(String tag) {
    return shortTag.equals(tag) || longTag.equals(tag);
  }

  public String getShortTag() {
    return shortTag;
  }

  @Override
  public T parse(BelScanner scanner) throws BelException {
    scanner.openFunction(shortTag, longTag);
    T result = parseArguments(scanner);
    scanner.expect(')');
    return result;
  }

  /**
   * Parses a standalone modifier, e.g. "pmod(Ph, Ser, 473)". The whole text must be consumed.
   */
  public T parse(String text) throws BelException {
    BelScanner scanner = new BelScanner(text);
    T result = parse(scanner);
    scanner.expectEnd();
    return result;
  }

  protected abstract T parseArguments(BelScanner scanner) throws BelException;
}
