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

package com.twentyn.bel.parser.modifiers;

import com.twentyn.bel.exceptions.BelException;
import com.twentyn.bel.exceptions.BelSyntaxException;
import com.twentyn.bel.model.Coordinate;
import com.twentyn.bel.model.variant.Fragment;
import com.twentyn.bel.parser.BelScanner;
import com.twentyn.bel.parser.ModifierParser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses frag(?), frag(?, DESCRIPTION), frag(START_STOP) and frag(START_STOP, DESCRIPTION). Either endpoint may be
 * "?" and the stop may be "*".
 */
public class FragmentParser extends ModifierParser<Fragment> {
  private static final String MISSING = "?";
  private static final Pattern RANGE_PATTERN = Pattern.compile("^(\\d+|\\?)_(\\d+|\\?|\\*)$");

  public FragmentParser() {
    super("frag", "fragment");
  }

  @Override
  protected Fragment parseArguments(BelScanner scanner) throws BelException {
    int start = scanner.getPosition();
    String range = scanner.readValue();

    if (MISSING.equals(range)) {
      return Fragment.missing(parseDescription(scanner));
    }

    Matcher matcher = RANGE_PATTERN.matcher(range);
    if (!matcher.matches()) {
      throw new BelSyntaxException(String.format("Invalid fragment range %s", range), start);
    }
    return Fragment.of(Coordinate.fromToken(matcher.group(1)), Coordinate.fromToken(matcher.group(2)),
        parseDescription(scanner));
  }

  private String parseDescription(BelScanner scanner) throws BelException {
    return scanner.tryConsume(',') ? scanner.readValue() : null;
  }
}
