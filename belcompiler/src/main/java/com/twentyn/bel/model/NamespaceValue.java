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

package com.twentyn.bel.model;

import com.twentyn.bel.language.BelQuoting;

import java.util.Objects;
import java.util.Optional;

/**
 * A namespace-qualified name, e.g. HGNC:AKT1, optionally carrying the namespace's stable identifier for the name.
 */
public class NamespaceValue {
  private final String namespace;
  private final String name;
  private final String identifier;

  public NamespaceValue(String namespace, String name) {
    this(namespace, name, null);
  }

  public NamespaceValue(String namespace, String name, String identifier) {
    if (namespace == null || name == null) {
      throw new IllegalArgumentException("Namespace values need both a namespace and a name.");
    }
    this.namespace = namespace;
    this.name = name;
    this.identifier = identifier;
  }

  public String getNamespace() {
    return namespace;
  }

  public String getName() {
    return name;
  }

  public Optional<String> getIdentifier() {
    return Optional.ofNullable(identifier);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    NamespaceValue that = (NamespaceValue) o;
    return namespace.equals(that.namespace) && name.equals(that.name) && Objects.equals(identifier, that.identifier);
  }

  @Override
  public int hashCode() {
    return Objects.hash(namespace, name, identifier);
  }

  @Override
  public String toString() {
    return BelQuoting.namespaced(namespace, name);
  }
}
