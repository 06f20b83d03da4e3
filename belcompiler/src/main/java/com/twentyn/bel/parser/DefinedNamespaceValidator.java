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

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Validates identifiers against the namespaces a document defines. Namespaces defined as inline lists are checked
 * for membership; namespaces defined by URL are only checked for existence, since their contents live elsewhere.
 */
public class DefinedNamespaceValidator implements NamespaceValidator {
  private final Set<String> urlNamespaces;
  private final Map<String, Set<String>> listNamespaces;

  public DefinedNamespaceValidator(Set<String> urlNamespaces, Map<String, Set<String>> listNamespaces) {
    this.urlNamespaces = new HashSet<>(urlNamespaces);
    this.listNamespaces = new HashMap<>(listNamespaces);
  }

  @Override
  public boolean isDefined(String namespace) {
    return urlNamespaces.contains(namespace) || listNamespaces.containsKey(namespace);
  }

  @Override
  public boolean isMember(String namespace, String name) {
    if (urlNamespaces.contains(namespace)) {
      return true;
    }
    return listNamespaces.getOrDefault(namespace, Collections.emptySet()).contains(name);
  }
}
