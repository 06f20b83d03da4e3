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
import com.twentyn.bel.language.AminoAcid;
import com.twentyn.bel.language.BelConstants;
import com.twentyn.bel.language.ProteinModificationType;
import com.twentyn.bel.model.NamespaceValue;
import com.twentyn.bel.model.variant.ProteinModification;
import com.twentyn.bel.parser.BelScanner;
import com.twentyn.bel.parser.IdentifierParser;
import com.twentyn.bel.parser.ModifierParser;

import java.util.Optional;

/**
 * Parses pmod(NAME), pmod(NAME, RESIDUE) and pmod(NAME, RESIDUE, POSITION).
 *
 * NAME is either a modification from the default vocabulary, by code (Ph) or by name (phosphorylation), or a
 * namespaced identifier. BEL 1.0 single-letter names (P, A, ...) are mapped to their current code and noted as
 * legacy syntax. RESIDUE may be a one- or three-letter amino acid code and is normalized to three letters.
 */
public class ProteinModificationParser extends ModifierParser<ProteinModification> {
  private final IdentifierParser identifierParser;

  public ProteinModificationParser(IdentifierParser identifierParser) {
    super("pmod", "proteinModification");
    this.identifierParser = identifierParser;
  }

  @Override
  protected ProteinModification parseArguments(BelScanner scanner) throws BelException {
    NamespaceValue modification = parseModification(scanner);

    AminoAcid aminoAcid = null;
    Integer position = null;
    if (scanner.tryConsume(',')) {
      int codeStart = scanner.getPosition();
      String code = scanner.readValue();
      Optional<AminoAcid> parsed = AminoAcid.fromCode(code);
      if (!parsed.isPresent()) {
        throw new BelSyntaxException(String.format("Unknown amino acid code %s", code), codeStart);
      }
      aminoAcid = parsed.get();
      if (scanner.tryConsume(',')) {
        position = scanner.readInteger();
      }
    }
    return new ProteinModification(modification, aminoAcid, position);
  }

  private NamespaceValue parseModification(BelScanner scanner) throws BelException {
    if (scanner.lookingAtIdentifier()) {
      return identifierParser.parse(scanner);
    }

    int start = scanner.getPosition();
    String token = scanner.readValue();
    Optional<ProteinModificationType> type = ProteinModificationType.fromToken(token);
    if (type.isPresent()) {
      return new NamespaceValue(BelConstants.BEL_DEFAULT_NAMESPACE, type.get().getCode());
    }

    Optional<ProteinModificationType> legacyType = ProteinModificationType.fromLegacyCode(token);
    if (legacyType.isPresent()) {
      scanner.addLegacyWarning("Legacy protein modification code %s, use %s", token, legacyType.get().getCode());
      return new NamespaceValue(BelConstants.BEL_DEFAULT_NAMESPACE, legacyType.get().getCode());
    }
    if (ProteinModificationType.LEGACY_OTHER.equals(token)) {
      scanner.addLegacyWarning("Legacy protein modification code %s has no current equivalent", token);
      return new NamespaceValue(BelConstants.BEL_DEFAULT_NAMESPACE, token);
    }
    throw new BelSyntaxException(String.format("Unknown protein modification %s", token), start);
  }
}
