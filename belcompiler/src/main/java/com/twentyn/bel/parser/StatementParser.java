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
import com.twentyn.bel.exceptions.BelSyntaxException;
import com.twentyn.bel.exceptions.NestedRelationNotSupportedException;
import com.twentyn.bel.language.BelFunction;
import com.twentyn.bel.language.BelRelation;
import com.twentyn.bel.model.AbundanceList;
import com.twentyn.bel.model.AbundanceTerm;
import com.twentyn.bel.model.Activity;
import com.twentyn.bel.model.ComplexList;
import com.twentyn.bel.model.CompositeAbundance;
import com.twentyn.bel.model.NamedComplex;
import com.twentyn.bel.model.ProcessTerm;
import com.twentyn.bel.model.Statement;
import com.twentyn.bel.model.Term;
import com.twentyn.bel.model.Transformation;

/**
 * Parses a whole BEL statement: a bare term, or subject, relation and object. A causal relation may take one
 * parenthesized relationship as its object when nesting is allowed.
 */
public class StatementParser {
  private final TermParser termParser;
  private final boolean allowNested;

  public StatementParser(TermParser termParser, boolean allowNested) {
    this.termParser = termParser;
    this.allowNested = allowNested;
  }

  public TermParser getTermParser() {
    return termParser;
  }

  public Statement parseStatement(String text) throws BelException {
    BelScanner scanner = new BelScanner(text);
    Term subject = termParser.parse(scanner);

    Statement statement;
    if (scanner.atEnd()) {
      if (subject instanceof AbundanceList) {
        throw new BelSyntaxException("list(...) can only be the object of hasMembers", 0);
      }
      statement = Statement.ofTerm(subject);
    } else {
      BelRelation relation = parseRelation(scanner);
      if (scanner.peek('(')) {
        statement = parseNested(scanner, subject, relation);
      } else {
        Term object = termParser.parse(scanner);
        checkOperands(subject, relation, object, scanner);
        statement = Statement.ofRelation(subject, relation, object);
      }
      scanner.expectEnd();
    }
    return statement.withLegacyWarnings(scanner.getLegacyWarnings());
  }

  private Statement parseNested(BelScanner scanner, Term subject, BelRelation relation) throws BelException {
    if (!allowNested) {
      throw new NestedRelationNotSupportedException(
          String.format("Nested statements are not supported (object of %s at position %d)",
              relation.getName(), scanner.getPosition()));
    }
    if (!relation.acceptsNestedObject()) {
      throw new BelSyntaxException(
          String.format("%s cannot take a nested statement as its object", relation.getName()), scanner.getPosition());
    }
    scanner.expect('(');
    Term innerSubject = termParser.parse(scanner);
    BelRelation innerRelation = parseRelation(scanner);
    if (scanner.peek('(')) {
      throw new NestedRelationNotSupportedException(
          String.format("Statements nested more than one level deep are not supported (at position %d)",
              scanner.getPosition()));
    }
    if (!innerRelation.isCausal()) {
      throw new BelSyntaxException(
          String.format("A nested statement must be causal, found %s", innerRelation.getName()),
          scanner.getPosition());
    }
    Term innerObject = termParser.parse(scanner);
    checkOperands(innerSubject, innerRelation, innerObject, scanner);
    scanner.expect(')');
    return Statement.ofNestedRelation(subject, relation, Statement.ofRelation(innerSubject, innerRelation, innerObject));
  }

  private BelRelation parseRelation(BelScanner scanner) throws BelException {
    for (String symbol : BelRelation.getSymbols()) {
      if (scanner.tryConsume(symbol)) {
        return BelRelation.fromToken(symbol).get();
      }
    }
    int start = scanner.getPosition();
    String word = scanner.readWord();
    BelRelation relation = BelRelation.fromToken(word)
        .orElseThrow(() -> new BelSyntaxException(String.format("Unknown relation %s", word), start));
    if (relation.getCategory() == BelRelation.Category.DEPRECATED) {
      scanner.addLegacyWarning("Deprecated relation %s", relation.getName());
    }
    return relation;
  }

  private static void checkOperands(Term subject, BelRelation relation, Term object, BelScanner scanner)
      throws BelSyntaxException {
    if (subject instanceof AbundanceList) {
      throw invalid("list(...) can only be the object of hasMembers", scanner);
    }
    if (object instanceof AbundanceList && relation != BelRelation.HAS_MEMBERS) {
      throw invalid("list(...) can only be the object of hasMembers", scanner);
    }

    switch (relation) {
      case TRANSCRIBED_TO:
        require(hasFunction(subject, BelFunction.GENE) && hasFunction(object, BelFunction.RNA),
            "transcribedTo relates a gene to an RNA", scanner);
        break;
      case TRANSLATED_TO:
        require(hasFunction(subject, BelFunction.RNA) && hasFunction(object, BelFunction.PROTEIN),
            "translatedTo relates an RNA to a protein", scanner);
        break;
      case HAS_COMPONENT:
        require((subject instanceof NamedComplex || subject instanceof ComplexList
                || subject instanceof CompositeAbundance) && object instanceof AbundanceTerm,
            "hasComponent relates a complex or composite to an abundance", scanner);
        break;
      case HAS_MEMBER:
        require(subject instanceof AbundanceTerm && object instanceof AbundanceTerm,
            "hasMember relates two abundances", scanner);
        break;
      case HAS_MEMBERS:
        require(subject instanceof AbundanceTerm && object instanceof AbundanceList,
            "hasMembers relates an abundance to list(...)", scanner);
        break;
      case RATE_LIMITING_STEP_OF:
        require((hasFunction(subject, BelFunction.BIOLOGICAL_PROCESS) || isActivityOrTransformation(subject))
                && hasFunction(object, BelFunction.BIOLOGICAL_PROCESS),
            "rateLimitingStepOf relates a process, activity or transformation to a biological process", scanner);
        break;
      case SUB_PROCESS_OF:
        require((subject instanceof ProcessTerm || isActivityOrTransformation(subject))
                && object instanceof ProcessTerm,
            "subProcessOf relates a process, activity or transformation to a process", scanner);
        break;
      case BIOMARKER_FOR:
      case PROGNOSTIC_BIOMARKER_FOR:
        require(object instanceof ProcessTerm, String.format("%s takes a process as its object", relation), scanner);
        break;
      default:
        break;
    }
  }

  private static boolean hasFunction(Term term, BelFunction function) {
    if (term instanceof AbundanceTerm) {
      return ((AbundanceTerm) term).getFunction() == function;
    }
    if (term instanceof ProcessTerm) {
      return ((ProcessTerm) term).getFunction() == function;
    }
    return false;
  }

  private static boolean isActivityOrTransformation(Term term) {
    return term instanceof Activity || term instanceof Transformation;
  }

  private static void require(boolean condition, String message, BelScanner scanner) throws BelSyntaxException {
    if (!condition) {
      throw invalid(message, scanner);
    }
  }

  private static BelSyntaxException invalid(String message, BelScanner scanner) {
    return new BelSyntaxException(message, scanner.getPosition());
  }
}
