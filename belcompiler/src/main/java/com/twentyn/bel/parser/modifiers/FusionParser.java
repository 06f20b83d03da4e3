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
import com.twentyn.bel.model.Fusion;
import com.twentyn.bel.model.FusionRange;
import com.twentyn.bel.model.NamespaceValue;
import com.twentyn.bel.parser.BelScanner;
import com.twentyn.bel.parser.IdentifierParser;
import com.twentyn.bel.parser.ModifierParser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses fus(NS:5P, RANGE, NS:3P, RANGE), e.g. fus(HGNC:TMPRSS2, r.1_79, HGNC:ERG, r.312_5034). A range is "?" or
 * a reference sequence type followed by start and stop coordinates, either of which may be "?".
 */
public class FusionParser extends ModifierParser<Fusion> {
  private static final String MISSING = "?";
  private static final Pattern RANGE_PATTERN = Pattern.compile("^([rpc])\\.(\\d+|\\?)_(\\d+|\\?)$");

  private final IdentifierParser identifierParser;

  public FusionParser(IdentifierParser identifierParser) {
    super("fus", "fusion");
    this.identifierParser = identifierParser;
  }

  @Override
  protected Fusion parseArguments(BelScanner scanner) throws BelException {
    NamespaceValue partner5p = identifierParser.parse(scanner);
    scanner.expect(',');
    FusionRange range5p = parseRange(scanner);
    scanner.expect(',');
    NamespaceValue partner3p = identifierParser.parse(scanner);
    scanner.expect(',');
    FusionRange range3p = parseRange(scanner);
    return new Fusion(partner5p, range5p, partner3p, range3p);
  }

  private FusionRange parseRange(BelScanner scanner) throws BelException {
    int start = scanner.getPosition();
    String range = scanner.readValue();
    if (MISSING.equals(range)) {
      return FusionRange.missing();
    }
    Matcher matcher = RANGE_PATTERN.matcher(range);
    if (!matcher.matches()) {
      throw new BelSyntaxException(String.format("Invalid fusion range %s", range), start);
    }
    return FusionRange.of(matcher.group(1).charAt(0),
        Coordinate.fromToken(matcher.group(2)), Coordinate.fromToken(matcher.group(3)));
  }
}
