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
import com.twentyn.bel.exceptions.LegacySyntaxWarning;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A cursor over one line of BEL text, providing the lexical pieces every grammar rule is built from: whitespace
 * tolerant punctuation, function tags, namespace prefixes, quoted and bare values, and integers.
 *
 * The scanner also collects legacy syntax notices. Marks record how many notices existed, so that backtracking out
 * of an alternative drops the notices that alternative produced.
 */
public class BelScanner {
  private static final String VALUE_DELIMITERS = ",()\"";
  private static final int SNIPPET_WIDTH = 24;

  private final String text;
  private int position;
  private final List<LegacySyntaxWarning> legacyWarnings = new ArrayList<>();

  public BelScanner(String text) {
    if (text == null) {
      throw new IllegalArgumentException("Cannot scan null text.");
    }
    this.text = text;
    this.position = 0;
  }

  public static final class Mark {
    private final int position;
    private final int warningCount;

    private Mark(int position, int warningCount) {
      this.position = position;
      this.warningCount = warningCount;
    }
  }

  public Mark mark() {
    return new Mark(position, legacyWarnings.size());
  }

  public void reset(Mark mark) {
    position = mark.position;
    while (legacyWarnings.size() > mark.warningCount) {
      legacyWarnings.remove(legacyWarnings.size() - 1);
    }
  }

  public String getText() {
    return text;
  }

  public int getPosition() {
    return position;
  }

  public void skipWhitespace() {
    while (position < text.length() && Character.isWhitespace(text.charAt(position))) {
      position++;
    }
  }

  public boolean atEnd() {
    skipWhitespace();
    return position >= text.length();
  }

  public void expectEnd() throws BelSyntaxException {
    if (!atEnd()) {
      throw error("end of statement");
    }
  }

  public boolean peek(char c) {
    skipWhitespace();
    return position < text.length() && text.charAt(position) == c;
  }

  public boolean tryConsume(char c) {
    if (peek(c)) {
      position++;
      return true;
    }
    return false;
  }

  public boolean tryConsume(String literal) {
    skipWhitespace();
    if (text.startsWith(literal, position)) {
      position += literal.length();
      return true;
    }
    return false;
  }

  public void expect(char c) throws BelSyntaxException {
    if (!tryConsume(c)) {
      throw error(String.format("'%s'", c));
    }
  }

  /**
   * Looks for a function tag: a word followed by an opening parenthesis. Nothing but whitespace is consumed.
   *
   * @return The tag, if the input continues with a function call.
   */
  public Optional<String> peekFunctionTag() {
    skipWhitespace();
    int end = position;
    while (end < text.length() && isWordChar(text.charAt(end))) {
      end++;
    }
    if (end == position) {
      return Optional.empty();
    }
    int next = end;
    while (next < text.length() && Character.isWhitespace(text.charAt(next))) {
      next++;
    }
    if (next < text.length() && text.charAt(next) == '(') {
      return Optional.of(text.substring(position, end));
    }
    return Optional.empty();
  }

  /**
   * Consumes a function tag and its opening parenthesis.
   *
   * @param tags The accepted spellings of the function; if empty, any tag is accepted.
   * @return The tag as written.
   */
  public String openFunction(String... tags) throws BelSyntaxException {
    Optional<String> tag = peekFunctionTag();
    List<String> accepted = Arrays.asList(tags);
    if (!tag.isPresent() || (!accepted.isEmpty() && !accepted.contains(tag.get()))) {
      throw error(accepted.isEmpty() ? "a function" : String.format("%s(...)", accepted.get(0)));
    }
    position += tag.get().length();
    expect('(');
    return tag.get();
  }

  /**
   * @return True if the input continues with namespace:value.
   */
  public boolean lookingAtIdentifier() {
    skipWhitespace();
    int end = position;
    while (end < text.length() && isPrefixChar(text.charAt(end))) {
      end++;
    }
    return end > position && end < text.length() && text.charAt(end) == ':';
  }

  public String readNamespacePrefix() throws BelSyntaxException {
    skipWhitespace();
    int start = position;
    while (position < text.length() && isPrefixChar(text.charAt(position))) {
      position++;
    }
    if (start == position) {
      throw error("a namespace");
    }
    return text.substring(start, position);
  }

  public String readWord() throws BelSyntaxException {
    skipWhitespace();
    int start = position;
    while (position < text.length() && isWordChar(text.charAt(position))) {
      position++;
    }
    if (start == position) {
      throw error("a word");
    }
    return text.substring(start, position);
  }

  /**
   * Reads a double-quoted string. A backslash escapes the character after it.
   */
  public String readQuoted() throws BelSyntaxException {
    skipWhitespace();
    if (position >= text.length() || text.charAt(position) != '"') {
      throw error("a quoted string");
    }
    int start = position;
    position++;
    StringBuilder builder = new StringBuilder();
    while (position < text.length()) {
      char c = text.charAt(position++);
      if (c == '\\' && position < text.length()) {
        builder.append(text.charAt(position++));
      } else if (c == '"') {
        return builder.toString();
      } else {
        builder.append(c);
      }
    }
    throw new BelSyntaxException("Unterminated quoted string", start);
  }

  /**
   * Reads either a quoted string or a bare value running up to the next delimiter or whitespace.
   */
  public String readValue() throws BelSyntaxException {
    if (peek('"')) {
      return readQuoted();
    }
    int start = position;
    while (position < text.length() && !isValueDelimiter(text.charAt(position))) {
      position++;
    }
    if (start == position) {
      throw error("a value");
    }
    return text.substring(start, position);
  }

  public int readInteger() throws BelSyntaxException {
    skipWhitespace();
    int start = position;
    if (position < text.length() && text.charAt(position) == '-') {
      position++;
    }
    int digitsStart = position;
    while (position < text.length() && Character.isDigit(text.charAt(position))) {
      position++;
    }
    if (digitsStart == position) {
      position = start;
      throw error("an integer");
    }
    try {
      return Integer.parseInt(text.substring(start, position));
    } catch (NumberFormatException e) {
      throw new BelSyntaxException(String.format("Integer out of range: %s", text.substring(start, position)), start);
    }
  }

  /**
   * Tries each alternative in order from the current position and returns the first that matches. If none match,
   * rethrows the failure that got furthest into the input. Only syntax failures cause backtracking; any other
   * failure, such as an unknown namespace, ends the search.
   */
  public <T> T firstOf(String description, List<GrammarRule<? extends T>> alternatives) throws BelException {
    Mark start = mark();
    BelSyntaxException furthest = null;
    for (GrammarRule<? extends T> alternative : alternatives) {
      try {
        return alternative.parse(this);
      } catch (BelSyntaxException e) {
        if (furthest == null || e.getPosition() > furthest.getPosition()) {
          furthest = e;
        }
        reset(start);
      }
    }
    if (furthest == null) {
      throw error(description);
    }
    throw furthest;
  }

  public void addLegacyWarning(String format, Object... args) {
    legacyWarnings.add(new LegacySyntaxWarning(String.format(format, args)));
  }

  public List<LegacySyntaxWarning> getLegacyWarnings() {
    return Collections.unmodifiableList(legacyWarnings);
  }

  public BelSyntaxException error(String expected) {
    String found = position >= text.length()
        ? "end of input"
        : String.format("'%s'", StringUtils.abbreviate(text.substring(position), SNIPPET_WIDTH));
    return new BelSyntaxException(String.format("Expected %s but found %s", expected, found), position);
  }

  private static boolean isWordChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  private static boolean isPrefixChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
  }

  private static boolean isValueDelimiter(char c) {
    return Character.isWhitespace(c) || VALUE_DELIMITERS.indexOf(c) >= 0;
  }
}
