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
 * Molecular activities of the default BEL namespace. The short code is canonical; {@code ma(kin)} and
 * {@code ma(kinaseActivity)} name the same activity.
 */
public enum MolecularActivity {
  CATALYTIC("cat", "catalyticActivity"),
  CHAPERONE("chap", "chaperoneActivity"),
  GTP_BOUND("gtp", "gtpBoundActivity"),
  KINASE("kin", "kinaseActivity"),
  PEPTIDASE("pep", "peptidaseActivity"),
  PHOSPHATASE("phos", "phosphataseActivity"),
  RIBOSYLATION("ribo", "ribosylationActivity"),
  TRANSCRIPTIONAL("tscript", "transcriptionalActivity"),
  TRANSPORT("tport", "transportActivity"),
  ;

  private static final Map<String, MolecularActivity> TOKEN_MAP = new HashMap<>();

  static {
    for (MolecularActivity activity : MolecularActivity.values()) {
      TOKEN_MAP.put(activity.code, activity);
      TOKEN_MAP.put(activity.longName, activity);
    }
  }

  private final String code;
  private final String longName;

  MolecularActivity(String code, String longName) {
    this.code = code;
    this.longName = longName;
  }

  public String getCode() {
    return code;
  }

  public String getLongName() {
    return longName;
  }

  public static Optional<MolecularActivity> fromToken(String token) {
    return Optional.ofNullable(TOKEN_MAP.get(token));
  }
}
