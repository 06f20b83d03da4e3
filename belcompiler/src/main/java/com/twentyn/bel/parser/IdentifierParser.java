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
import com.twentyn.bel.exceptions.InvalidNamespaceException;
import com.twentyn.bel.model.NamespaceValue;

/**
 * Parses namespace:value tokens such as HGNC:AKT1 or GOBP:"cell death", checking each against the session's
 * namespace validator.
 */
public class IdentifierParser implements GrammarRule<NamespaceValue> {
  private final NamespaceValidator validator;

  public IdentifierParser(NamespaceValidator validator) {
    this.validator = validator;
  }

  @Override
  public NamespaceValue parse(BelScanner scanner) throws BelException {
    String namespace = scanner.readNamespacePrefix();
    scanner.expect(':');
    String name = scanner.readValue();
    return validate(namespace, name);
  }

  public NamespaceValue validate(String namespace, String name) throws InvalidNamespaceException {
    if (!validator.isDefined(namespace)) {
      throw new InvalidNamespaceException(String.format("Undefined namespace %s", namespace), namespace, name);
    }
    if (!validator.isMember(namespace, name)) {
      throw new InvalidNamespaceException(
          String.format("\"%s\" is not a member of namespace %s", name, namespace), namespace, name);
    }
    return validator.resolve(namespace, name);
  }
}
