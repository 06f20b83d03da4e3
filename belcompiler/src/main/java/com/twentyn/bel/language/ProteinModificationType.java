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

/**
 * Protein modifications of the default BEL namespace, keyed by their BEL 2.0 code. BEL 1.0 single-letter codes are
 * mapped onto these where an equivalent exists.
 */
public enum ProteinModificationType {
  ACETYLATION("Ac", "acetylation"),
  ADP_RIBOSYLATION("ADPRib", "ADP-ribosylation"),
  FARNESYLATION("Farn", "farnesylation"),
  GERANYLGERANYLATION("Gerger", "geranylgeranylation"),
  GLYCOSYLATION("Glyco", "glycosylation"),
  HYDROXYLATION("Hy", "hydroxylation"),
  ISGYLATION("ISG", "ISGylation"),
  METHYLATION("Me", "methylation"),
  MONOMETHYLATION("Me1", "monomethylation"),
  DIMETHYLATION("Me2", "dimethylation"),
  TRIMETHYLATION("Me3", "trimethylation"),
  MYRISTOYLATION("Myr", "myristoylation"),
  NEDDYLATION("Nedd", "neddylation"),
  N_GLYCOSYLATION("NGlyco", "N-linked glycosylation"),
  NITROSYLATION("NO", "nitrosylation"),
  O_GLYCOSYLATION("OGlyco", "O-linked glycosylation"),
  PALMITOYLATION("Palm", "palmitoylation"),
  PHOSPHORYLATION("Ph", "phosphorylation"),
  SULFATION("Sulf", "sulfation"),
  SUMOYLATION("Sumo", "sumoylation"),
  UBIQUITINATION("Ub", "ubiquitination"),
  UBIQUITINATION_K48("UbK48", "Lysine 48-linked polyubiquitination"),
  UBIQUITINATION_K63("UbK63", "Lysine 63-linked polyubiquitination"),
  MONOUBIQUITINATION("UbMono", "monoubiquitination"),
  POLYUBIQUITINATION("UbPoly", "polyubiquitination"),
  ;

  private static final Map<String, ProteinModificationType> TOKEN_MAP = new HashMap<>();
  private static final Map<String, ProteinModificationType> LEGACY_MAP = new HashMap<>();

  static {
    for (ProteinModificationType type : ProteinModificationType.values()) {
      TOKEN_MAP.put(type.code, type);
      TOKEN_MAP.put(type.longName, type);
    }
    LEGACY_MAP.put("P", PHOSPHORYLATION);
    LEGACY_MAP.put("A", ACETYLATION);
    LEGACY_MAP.put("F", FARNESYLATION);
    LEGACY_MAP.put("G", GLYCOSYLATION);
    LEGACY_MAP.put("H", HYDROXYLATION);
    LEGACY_MAP.put("M", METHYLATION);
    LEGACY_MAP.put("R", ADP_RIBOSYLATION);
    LEGACY_MAP.put("S", SUMOYLATION);
    LEGACY_MAP.put("U", UBIQUITINATION);
  }

  /**
   * BEL 1.0 letter for "other" modifications. It has no BEL 2.0 counterpart and is kept as-is.
   */
  public static final String LEGACY_OTHER = "O";

  private final String code;
  private final String longName;

  ProteinModificationType(String code, String longName) {
    this.code = code;
    this.longName = longName;
  }

  public String getCode() {
    return code;
  }

  public String getLongName() {
    return longName;
  }

  public static Optional<ProteinModificationType> fromToken(String token) {
    return Optional.ofNullable(TOKEN_MAP.get(token));
  }

  public static Optional<ProteinModificationType> fromLegacyCode(String code) {
    return Optional.ofNullable(LEGACY_MAP.get(code));
  }

  public static boolean isLegacyCode(String code) {
    return LEGACY_MAP.containsKey(code) || LEGACY_OTHER.equals(code);
  }
}
