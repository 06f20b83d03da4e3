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

import org.apache.commons.lang3.StringUtils;

public final class BelQuoting {
  private BelQuoting() {
  }

  /**
   * Quotes a value unless it is purely alphanumeric.
   */
  public static String ensureQuotes(String value) {
    if (StringUtils.isAlphanumeric(value)) {
      return value;
    }
    return quote(value);
  }

  /**
   * Wraps a value in double quotes, escaping backslashes and double quotes so the scanner reads back the same value.
   */
  public static String quote(String value) {
    return "\"" + StringUtils.replaceEach(value, new String[] {"\\", "\""}, new String[] {"\\\\", "\\\""})
        + "\"";
  }

  /**
   * Renders a namespace:name pair the way it appears in BEL text.
   */
  public static String namespaced(String namespace, String name) {
    return namespace + ":" + ensureQuotes(name);
  }
}
