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
import com.twentyn.bel.language.BelConstants;
import com.twentyn.bel.language.MolecularActivity;
import com.twentyn.bel.model.NamespaceValue;
import com.twentyn.bel.parser.BelScanner;
import com.twentyn.bel.parser.IdentifierParser;
import com.twentyn.bel.parser.ModifierParser;

import java.util.Optional;

/**
 * Parses ma(kin), ma(kinaseActivity) or ma(GOMF:"kinase activity"). Default activities are normalized to their
 * short code in the "bel" namespace.
 */
public class MolecularActivityParser extends ModifierParser<NamespaceValue> {
  private final IdentifierParser identifierParser;

  public MolecularActivityParser(IdentifierParser identifierParser) {
    super("ma", "molecularActivity");
    this.identifierParser = identifierParser;
  }

  @Override
  protected NamespaceValue parseArguments(BelScanner scanner) throws BelException {
    if (scanner.lookingAtIdentifier()) {
      return identifierParser.parse(scanner);
    }
    int start = scanner.getPosition();
    String token = scanner.readValue();
    Optional<MolecularActivity> activity = MolecularActivity.fromToken(token);
    if (!activity.isPresent()) {
      throw new BelSyntaxException(String.format("Unknown molecular activity %s", token), start);
    }
    return new NamespaceValue(BelConstants.BEL_DEFAULT_NAMESPACE, activity.get().getCode());
  }
}
