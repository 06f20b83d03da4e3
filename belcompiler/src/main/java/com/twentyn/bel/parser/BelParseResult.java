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

package com.twentyn.bel.parser;

import com.twentyn.bel.exceptions.BelException;
import com.twentyn.bel.graph.BelGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class BelParseResult {
  private final BelGraph graph;
  private final List<ParseWarning> warnings;

  public BelParseResult(BelGraph graph, List<ParseWarning> warnings) {
    this.graph = graph;
    this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
  }

  public BelGraph getGraph() {
    return graph;
  }

  public List<ParseWarning> getWarnings() {
    return warnings;
  }

  /**
   * @return The warnings caused by a given kind of failure.
   */
  public List<ParseWarning> getWarnings(Class<? extends BelException> type) {
    List<ParseWarning> result = new ArrayList<>();
    for (ParseWarning warning : warnings) {
      if (type.isInstance(warning.getException())) {
        result.add(warning);
      }
    }
    return result;
  }
}
