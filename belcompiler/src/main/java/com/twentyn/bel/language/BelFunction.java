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
 * BEL term functions, each with its graph label and the short and long tags that introduce it in text.
 */
public enum BelFunction {
  ABUNDANCE("Abundance", "a", "abundance"),
  GENE("Gene", "g", "geneAbundance"),
  MIRNA("miRNA", "m", "microRNAAbundance"),
  PROTEIN("Protein", "p", "proteinAbundance"),
  RNA("RNA", "r", "rnaAbundance"),
  COMPLEX("Complex", "complex", "complexAbundance"),
  COMPOSITE("Composite", "composite", "compositeAbundance"),
  BIOLOGICAL_PROCESS("BiologicalProcess", "bp", "biologicalProcess"),
  PATHOLOGY("Pathology", "path", "pathology"),
  REACTION("Reaction", "rxn", "reaction"),
  LIST("List", "list", "list"),
  ;

  private static final Map<String, BelFunction> TAG_MAP = new HashMap<>();
  private static final Map<String, BelFunction> LABEL_MAP = new HashMap<>();

  static {
    for (BelFunction function : BelFunction.values()) {
      TAG_MAP.put(function.shortTag, function);
      TAG_MAP.put(function.longTag, function);
      LABEL_MAP.put(function.label, function);
    }
  }

  private final String label;
  private final String shortTag;
  private final String longTag;

  BelFunction(String label, String shortTag, String longTag) {
    this.label = label;
    this.shortTag = shortTag;
    this.longTag = longTag;
  }

  public String getLabel() {
    return label;
  }

  public String getShortTag() {
    return shortTag;
  }

  public String getLongTag() {
    return longTag;
  }

  /**
   * Fusion nodes are typed with the partner function followed by "Fusion", e.g. ProteinFusion.
   */
  public String getFusionLabel() {
    return label + "Fusion";
  }

  public boolean isCentralDogma() {
    return this == GENE || this == RNA || this == PROTEIN || this == MIRNA;
  }

  public static Optional<BelFunction> fromTag(String tag) {
    return Optional.ofNullable(TAG_MAP.get(tag));
  }

  public static Optional<BelFunction> fromLabel(String label) {
    return Optional.ofNullable(LABEL_MAP.get(label));
  }
}
