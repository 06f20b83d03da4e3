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

package com.twentyn.bel.language;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public enum AminoAcid {
  ALA("A", "Ala"),
  ARG("R", "Arg"),
  ASN("N", "Asn"),
  ASP("D", "Asp"),
  CYS("C", "Cys"),
  GLU("E", "Glu"),
  GLN("Q", "Gln"),
  GLY("G", "Gly"),
  HIS("H", "His"),
  ILE("I", "Ile"),
  LEU("L", "Leu"),
  LYS("K", "Lys"),
  MET("M", "Met"),
  PHE("F", "Phe"),
  PRO("P", "Pro"),
  SER("S", "Ser"),
  THR("T", "Thr"),
  TRP("W", "Trp"),
  TYR("Y", "Tyr"),
  VAL("V", "Val"),
  ;

  private static final Map<String, AminoAcid> CODE_MAP = new HashMap<>();

  static {
    for (AminoAcid aminoAcid : AminoAcid.values()) {
      CODE_MAP.put(aminoAcid.oneLetterCode, aminoAcid);
      CODE_MAP.put(aminoAcid.threeLetterCode, aminoAcid);
    }
  }

  private final String oneLetterCode;
  private final String threeLetterCode;

  AminoAcid(String oneLetterCode, String threeLetterCode) {
    this.oneLetterCode = oneLetterCode;
    this.threeLetterCode = threeLetterCode;
  }

  public String getOneLetterCode() {
    return oneLetterCode;
  }

  public String getThreeLetterCode() {
    return threeLetterCode;
  }

  /**
   * Accepts either the one-letter or the three-letter code.
   */
  public static Optional<AminoAcid> fromCode(String code) {
    return Optional.ofNullable(CODE_MAP.get(code));
  }
}
