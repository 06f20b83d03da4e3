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

import com.twentyn.bel.exceptions.InvalidNamespaceException;
import com.twentyn.bel.model.NamespaceValue;

/**
 * Decides which namespace:name identifiers a document may use. Implementations may also map a name onto a
 * preferred synonym through {@link #resolve}.
 */
public interface NamespaceValidator {

  /**
   * Accepts every identifier, for parsing statements without any namespace definitions.
   */
  NamespaceValidator PERMISSIVE = new NamespaceValidator() {
    @Override
    public boolean isDefined(String namespace) {
      return true;
    }

    @Override
    public boolean isMember(String namespace, String name) {
      return true;
    }
  };

  boolean isDefined(String namespace);

  boolean isMember(String namespace, String name);

  /**
   * Maps an accepted identifier onto the one the graph should use. The default keeps it as written.
   *
   * @throws InvalidNamespaceException If the identifier has no stable mapping.
   */
  default NamespaceValue resolve(String namespace, String name) throws InvalidNamespaceException {
    return new NamespaceValue(namespace, name);
  }
}
