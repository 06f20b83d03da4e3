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

/**
 * Visits every kind of term.
 *
 * @param <R> The result type.
 * @param <E> The exception a visit may throw.
 */
public interface TermVisitor<R, E extends Exception> {
  R visitSimpleAbundance(SimpleAbundance term) throws E;

  R visitModifiedAbundance(ModifiedAbundance term) throws E;

  R visitFusedAbundance(FusedAbundance term) throws E;

  R visitNamedComplex(NamedComplex term) throws E;

  R visitComplexList(ComplexList term) throws E;

  R visitComposite(CompositeAbundance term) throws E;

  R visitProcess(ProcessTerm term) throws E;

  R visitReaction(Reaction term) throws E;

  R visitActivity(Activity term) throws E;

  R visitTransformation(Transformation term) throws E;

  R visitAbundanceList(AbundanceList term) throws E;
}
