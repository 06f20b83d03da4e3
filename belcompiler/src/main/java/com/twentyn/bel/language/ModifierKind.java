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
 * Functions that wrap an abundance without creating a node of their own. Their effect is recorded on the statement
 * edge as a modifier dictionary instead.
 */
public enum ModifierKind {
  ACTIVITY(BelConstants.ACTIVITY, "act", "activity"),
  DEGRADATION(BelConstants.DEGRADATION, "deg", "degradation"),
  TRANSLOCATION(BelConstants.TRANSLOCATION, "tloc", "translocation"),
  CELL_SECRETION(BelConstants.CELL_SECRETION, "sec", "cellSecretion"),
  CELL_SURFACE_EXPRESSION(BelConstants.CELL_SURFACE_EXPRESSION, "surf", "cellSurfaceExpression"),
  ;

  private static final Map<String, ModifierKind> TAG_MAP = new HashMap<>();
  private static final Map<String, ModifierKind> LABEL_MAP = new HashMap<>();

  static {
    for (ModifierKind kind : ModifierKind.values()) {
      TAG_MAP.put(kind.shortTag, kind);
      TAG_MAP.put(kind.longTag, kind);
      LABEL_MAP.put(kind.label, kind);
    }
  }

  private final String label;
  private final String shortTag;
  private final String longTag;

  ModifierKind(String label, String shortTag, String longTag) {
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

  public static Optional<ModifierKind> fromTag(String tag) {
    return Optional.ofNullable(TAG_MAP.get(tag));
  }

  public static Optional<ModifierKind> fromLabel(String label) {
    return Optional.ofNullable(LABEL_MAP.get(label));
  }
}
