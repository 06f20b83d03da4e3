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
import com.twentyn.bel.model.variant.Substitution;
import com.twentyn.bel.parser.BelScanner;
import com.twentyn.bel.parser.ModifierParser;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses the BEL 1.0 substitution sub(REFERENCE, POSITION, VARIANT). Inside a protein the residues are amino acids;
 * inside a gene they are nucleotides. Every match is noted as legacy syntax.
 */
public class SubstitutionParser extends ModifierParser<Substitution> {
  private static final Pattern NUCLEOTIDE_PATTERN = Pattern.compile("^[ACGTacgt]$");

  public enum SequenceType {
    PROTEIN,
    GENE,
  }

  private final SequenceType sequenceType;

  public SubstitutionParser(SequenceType sequenceType) {
    super("sub", "substitution");
    this.sequenceType = sequenceType;
  }

  @Override
  protected Substitution parseArguments(BelScanner scanner) throws BelException {
    String reference = parseResidue(scanner);
    scanner.expect(',');
    int position = scanner.readInteger();
    scanner.expect(',');
    String variant = parseResidue(scanner);
    scanner.addLegacyWarning("Legacy substitution sub(%s, %d, %s), use var(...)", reference, position, variant);
    return new Substitution(reference, position, variant);
  }

  private String parseResidue(BelScanner scanner) throws BelException {
    int start = scanner.getPosition();
    String residue = scanner.readValue();
    if (sequenceType == SequenceType.GENE) {
      if (!NUCLEOTIDE_PATTERN.matcher(residue).matches()) {
        throw new BelSyntaxException(String.format("Invalid nucleotide %s", residue), start);
      }
      return residue.toUpperCase();
    }
    Optional<AminoAcid> aminoAcid = AminoAcid.fromCode(residue);
    if (!aminoAcid.isPresent()) {
      throw new BelSyntaxException(String.format("Unknown amino acid code %s", residue), start);
    }
    return aminoAcid.get().getThreeLetterCode();
  }
}
