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

import com.twentyn.bel.exceptions.LegacySyntaxWarning;
import com.twentyn.bel.language.BelRelation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A parsed BEL statement: a bare term, a subject-relation-object triple, or a causal relation whose object is
 * another (parenthesized) causal relation.
 */
public class Statement {
  private final Term subject;
  private final BelRelation relation;
  private final Term object;
  private final Statement nestedObject;
  private final List<LegacySyntaxWarning> legacyWarnings;

  private Statement(Term subject, BelRelation relation, Term object, Statement nestedObject,
                    List<LegacySyntaxWarning> legacyWarnings) {
    if (subject == null) {
      throw new IllegalArgumentException("Statements need a subject.");
    }
    this.subject = subject;
    this.relation = relation;
    this.object = object;
    this.nestedObject = nestedObject;
    this.legacyWarnings = new ArrayList<>(legacyWarnings);
  }

  public static Statement ofTerm(Term term) {
    return new Statement(term, null, null, null, Collections.emptyList());
  }

  public static Statement ofRelation(Term subject, BelRelation relation, Term object) {
    if (relation == null || object == null) {
      throw new IllegalArgumentException("Relations need both a relation and an object.");
    }
    return new Statement(subject, relation, object, null, Collections.emptyList());
  }

  public static Statement ofNestedRelation(Term subject, BelRelation relation, Statement nestedObject) {
    if (relation == null || nestedObject == null || nestedObject.isTermOnly()) {
      throw new IllegalArgumentException("Nested relations need a relation and a nested relation as object.");
    }
    return new Statement(subject, relation, null, nestedObject, Collections.emptyList());
  }

  /**
   * @return A copy of this statement that also carries the given legacy syntax notices.
   */
  public Statement withLegacyWarnings(List<LegacySyntaxWarning> warnings) {
    List<LegacySyntaxWarning> merged = new ArrayList<>(legacyWarnings);
    merged.addAll(warnings);
    return new Statement(subject, relation, object, nestedObject, merged);
  }

  public Term getSubject() {
    return subject;
  }

  public Optional<BelRelation> getRelation() {
    return Optional.ofNullable(relation);
  }

  public Optional<Term> getObject() {
    return Optional.ofNullable(object);
  }

  public Optional<Statement> getNestedObject() {
    return Optional.ofNullable(nestedObject);
  }

  public boolean isTermOnly() {
    return relation == null;
  }

  public boolean isNested() {
    return nestedObject != null;
  }

  public Optional<StatementModifier> getSubjectModifier() {
    return StatementModifier.fromTerm(subject);
  }

  public Optional<StatementModifier> getObjectModifier() {
    return object == null ? Optional.empty() : StatementModifier.fromTerm(object);
  }

  public List<LegacySyntaxWarning> getLegacyWarnings() {
    return Collections.unmodifiableList(legacyWarnings);
  }
}
