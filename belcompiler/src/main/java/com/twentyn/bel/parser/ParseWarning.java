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

/**
 * A line of a document that could not be compiled, or that used legacy syntax, with the reason.
 * Line 0 refers to the document as a whole.
 */
public class ParseWarning {
  private final int lineNumber;
  private final String line;
  private final BelException exception;

  public ParseWarning(int lineNumber, String line, BelException exception) {
    this.lineNumber = lineNumber;
    this.line = line;
    this.exception = exception;
  }

  public int getLineNumber() {
    return lineNumber;
  }

  public String getLine() {
    return line;
  }

  public BelException getException() {
    return exception;
  }

  @Override
  public String toString() {
    return String.format("%d: %s [%s: %s]", lineNumber, line, exception.getClass().getSimpleName(),
        exception.getMessage());
  }
}
