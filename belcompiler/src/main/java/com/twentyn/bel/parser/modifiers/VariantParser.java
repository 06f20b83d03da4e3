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
import com.twentyn.bel.model.variant.HgvsVariant;
import com.twentyn.bel.parser.BelScanner;
import com.twentyn.bel.parser.ModifierParser;

import java.util.regex.Pattern;

/**
 * Parses var("...") with a description in a lightweight subset of HGVS: the reference marker "=", the unknown
 * marker "?", a sequence-type-prefixed expression (p.Phe508del, c.1521_1523delCTT, g.117199646_117199648delCTT,
 * r.1653_1655delcuu) or a bare deletion (delCTT).
 */
public class VariantParser extends ModifierParser<HgvsVariant> {
  private static final Pattern HGVS_PATTERN = Pattern.compile("^(=|\\?|[cgmnpr]\\.\\S+|del[A-Za-z]+)$");

  public VariantParser() {
    super("var", "variant");
  }

  @Override
  protected HgvsVariant parseArguments(BelScanner scanner) throws BelException {
    int start = scanner.getPosition();
    String description = scanner.readValue();
    if (!HGVS_PATTERN.matcher(description).matches()) {
      throw new BelSyntaxException(String.format("Invalid HGVS variant description %s", description), start);
    }
    return new HgvsVariant(description);
  }
}
