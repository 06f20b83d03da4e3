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

package com.twentyn.bel.graph;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * The ambient provenance that qualified edges are stamped with as statements are added.
 */
public interface CitationContext {
  /**
   * An empty context, for building graphs from statements that carry no provenance.
   */
  CitationContext EMPTY = new CitationContext() {
    @Override
    public Map<String, String> getCurrentCitation() {
      return Collections.emptyMap();
    }

    @Override
    public Optional<String> getCurrentEvidence() {
      return Optional.empty();
    }

    @Override
    public Map<String, String> getCurrentAnnotations() {
      return Collections.emptyMap();
    }
  };

  Map<String, String> getCurrentCitation();

  Optional<String> getCurrentEvidence();

  Map<String, String> getCurrentAnnotations();
}
