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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Relations that can join two terms, plus the structural relations the graph builder adds on its own.
 */
public enum BelRelation {
  INCREASES("increases", Category.CAUSAL, "->", "→"),
  DIRECTLY_INCREASES("directlyIncreases", Category.CAUSAL, "=>", "⇒"),
  DECREASES("decreases", Category.CAUSAL, "-|"),
  DIRECTLY_DECREASES("directlyDecreases", Category.CAUSAL, "=|"),
  RATE_LIMITING_STEP_OF("rateLimitingStepOf", Category.CAUSAL),
  CAUSES_NO_CHANGE("causesNoChange", Category.CAUSAL, "cnc"),
  REGULATES("regulates", Category.CAUSAL, "reg"),

  NEGATIVE_CORRELATION("negativeCorrelation", Category.CORRELATIVE, "neg"),
  POSITIVE_CORRELATION("positiveCorrelation", Category.CORRELATIVE, "pos"),
  ASSOCIATION("association", Category.CORRELATIVE, "--"),

  ORTHOLOGOUS("orthologous", Category.GENOMIC),
  TRANSCRIBED_TO("transcribedTo", Category.GENOMIC, ":>"),
  TRANSLATED_TO("translatedTo", Category.GENOMIC, ">>"),

  HAS_MEMBER("hasMember", Category.OTHER),
  HAS_MEMBERS("hasMembers", Category.OTHER),
  HAS_COMPONENT("hasComponent", Category.OTHER),
  IS_A("isA", Category.OTHER),
  SUB_PROCESS_OF("subProcessOf", Category.OTHER),

  ANALOGOUS_TO("analogousTo", Category.DEPRECATED),
  BIOMARKER_FOR("biomarkerFor", Category.DEPRECATED),
  PROGNOSTIC_BIOMARKER_FOR("prognosticBiomarkerFor", Category.DEPRECATED),

  // Only ever added by the graph builder.
  HAS_VARIANT("hasVariant", Category.STRUCTURAL),
  HAS_REACTANT("hasReactant", Category.STRUCTURAL),
  HAS_PRODUCT("hasProduct", Category.STRUCTURAL),
  ;

  public enum Category {
    CAUSAL,
    CORRELATIVE,
    GENOMIC,
    OTHER,
    DEPRECATED,
    STRUCTURAL,
  }

  private static final Map<String, BelRelation> TOKEN_MAP = new HashMap<>();
  private static final List<String> SYMBOLS;

  static {
    List<String> symbols = new ArrayList<>();
    for (BelRelation relation : BelRelation.values()) {
      if (relation.category == Category.STRUCTURAL) {
        continue;
      }
      TOKEN_MAP.put(relation.name, relation);
      for (String alias : relation.aliases) {
        TOKEN_MAP.put(alias, relation);
        if (!Character.isLetter(alias.charAt(0))) {
          symbols.add(alias);
        }
      }
    }
    SYMBOLS = Collections.unmodifiableList(symbols);
  }

  private final String name;
  private final Category category;
  private final List<String> aliases;

  BelRelation(String name, Category category, String... aliases) {
    this.name = name;
    this.category = category;
    this.aliases = Arrays.asList(aliases);
  }

  /**
   * The canonical long name, used on edges and when writing statements.
   */
  public String getName() {
    return name;
  }

  public Category getCategory() {
    return category;
  }

  public boolean isCausal() {
    return category == Category.CAUSAL;
  }

  /**
   * Only the four directional causal relations may take a parenthesized statement as their object.
   */
  public boolean acceptsNestedObject() {
    return this == INCREASES || this == DECREASES || this == DIRECTLY_INCREASES || this == DIRECTLY_DECREASES;
  }

  public static Optional<BelRelation> fromToken(String token) {
    return Optional.ofNullable(TOKEN_MAP.get(token));
  }

  /**
   * @return The relation tokens that are not words (->, -|, ...), for the scanner to try before reading a word.
   */
  public static List<String> getSymbols() {
    return SYMBOLS;
  }

  @Override
  public String toString() {
    return name;
  }
}
