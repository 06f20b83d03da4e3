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
import com.twentyn.bel.exceptions.InvalidControlStatementException;
import com.twentyn.bel.graph.CitationContext;
import com.twentyn.bel.language.BelConstants;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tracks the SET and UNSET lines of a BEL document's statement section: the current citation, evidence, statement
 * group and annotations. Statement edges are stamped with whatever this holds when they are added.
 */
public class ControlParser implements CitationContext {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ControlParser.class);

  private static final Pattern SET_PATTERN = Pattern.compile("^SET\\s+(\\w+)\\s*=\\s*(.+?)\\s*$");
  private static final Pattern UNSET_PATTERN = Pattern.compile("^UNSET\\s+(\\w+|\\{.*\\})\\s*$");
  private static final Pattern CITATION_PATTERN = Pattern.compile("^\\{(.*)\\}$");
  private static final Pattern QUOTED_PATTERN = Pattern.compile("\"((?:[^\"\\\\]|\\\\.)*)\"");
  private static final Pattern ESCAPE_PATTERN = Pattern.compile("\\\\(.)");

  private static final String CITATION = "Citation";
  private static final String EVIDENCE = "Evidence";
  private static final String SUPPORTING_TEXT = "SupportingText";
  private static final String STATEMENT_GROUP = "STATEMENT_GROUP";
  private static final String ALL = "ALL";

  private static final List<String> SHORT_CITATION_KEYS = Arrays.asList(
      BelConstants.CITATION_TYPE, BelConstants.CITATION_NAME, BelConstants.CITATION_REFERENCE);
  private static final List<String> FULL_CITATION_KEYS = Arrays.asList(
      BelConstants.CITATION_TYPE, BelConstants.CITATION_NAME, BelConstants.CITATION_REFERENCE,
      BelConstants.CITATION_DATE, BelConstants.CITATION_AUTHORS, BelConstants.CITATION_COMMENTS);

  private final Map<String, Set<String>> listAnnotations;
  private final Map<String, String> urlAnnotations;

  private final Map<String, String> citation = new LinkedHashMap<>();
  private final Map<String, String> annotations = new LinkedHashMap<>();
  private String evidence;
  private String statementGroup;

  /**
   * @param listAnnotations Annotations defined with a list of allowed values.
   * @param urlAnnotations Annotations defined by URL; any value is accepted for these.
   */
  public ControlParser(Map<String, Set<String>> listAnnotations, Map<String, String> urlAnnotations) {
    this.listAnnotations = listAnnotations;
    this.urlAnnotations = urlAnnotations;
  }

  public static boolean isControlStatement(String line) {
    return SET_PATTERN.matcher(line).matches() || UNSET_PATTERN.matcher(line).matches();
  }

  public void parseLine(String line) throws BelException {
    Matcher set = SET_PATTERN.matcher(line);
    if (set.matches()) {
      handleSet(set.group(1), set.group(2));
      return;
    }
    Matcher unset = UNSET_PATTERN.matcher(line);
    if (unset.matches()) {
      String target = unset.group(1);
      if (target.startsWith("{")) {
        for (String key : target.substring(1, target.length() - 1).split(",")) {
          handleUnset(unquote(key.trim()));
        }
      } else {
        handleUnset(target);
      }
      return;
    }
    throw new BelSyntaxException(String.format("Not a control statement: %s", line), 0);
  }

  private void handleSet(String key, String value) throws BelException {
    switch (key) {
      case CITATION:
        setCitation(value);
        break;
      case EVIDENCE:
      case SUPPORTING_TEXT:
        evidence = unquote(value);
        break;
      case STATEMENT_GROUP:
        statementGroup = unquote(value);
        break;
      default:
        setAnnotation(key, unquote(value));
        break;
    }
  }

  private void setCitation(String value) throws BelException {
    Matcher matcher = CITATION_PATTERN.matcher(value);
    if (!matcher.matches()) {
      throw new InvalidControlStatementException(String.format("Citation must be a {...} list: %s", value));
    }
    List<String> values = new ArrayList<>();
    Matcher quoted = QUOTED_PATTERN.matcher(matcher.group(1));
    while (quoted.find()) {
      values.add(unescape(quoted.group(1)));
    }

    List<String> keys;
    if (values.size() == SHORT_CITATION_KEYS.size()) {
      keys = SHORT_CITATION_KEYS;
    } else if (values.size() == FULL_CITATION_KEYS.size()) {
      keys = FULL_CITATION_KEYS;
    } else {
      throw new InvalidControlStatementException(
          String.format("Citation needs 3 or 6 values but has %d: %s", values.size(), value));
    }

    // A new citation starts a new context.
    clearContext();
    for (int i = 0; i < keys.size(); i++) {
      citation.put(keys.get(i), values.get(i));
    }
    LOGGER.debug("Citation set to %s", citation);
  }

  private void setAnnotation(String key, String value) throws InvalidControlStatementException {
    if (listAnnotations.containsKey(key)) {
      if (!listAnnotations.get(key).contains(value)) {
        throw new InvalidControlStatementException(
            String.format("\"%s\" is not a legal value of annotation %s", value, key));
      }
    } else if (!urlAnnotations.containsKey(key)) {
      throw new InvalidControlStatementException(String.format("Undefined annotation %s", key));
    }
    annotations.put(key, value);
  }

  private void handleUnset(String key) throws InvalidControlStatementException {
    switch (key) {
      case ALL:
        clearContext();
        statementGroup = null;
        break;
      case CITATION:
        clearContext();
        break;
      case EVIDENCE:
      case SUPPORTING_TEXT:
        evidence = null;
        break;
      case STATEMENT_GROUP:
        statementGroup = null;
        break;
      default:
        if (annotations.remove(key) == null) {
          throw new InvalidControlStatementException(String.format("Cannot unset %s: it is not set", key));
        }
        break;
    }
  }

  private void clearContext() {
    citation.clear();
    annotations.clear();
    evidence = null;
  }

  private static String unquote(String value) {
    if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
      return unescape(value.substring(1, value.length() - 1));
    }
    return value;
  }

  private static String unescape(String value) {
    return ESCAPE_PATTERN.matcher(value).replaceAll("$1");
  }

  @Override
  public Map<String, String> getCurrentCitation() {
    return Collections.unmodifiableMap(citation);
  }

  @Override
  public Optional<String> getCurrentEvidence() {
    return Optional.ofNullable(evidence);
  }

  @Override
  public Map<String, String> getCurrentAnnotations() {
    return Collections.unmodifiableMap(annotations);
  }

  public Optional<String> getStatementGroup() {
    return Optional.ofNullable(statementGroup);
  }

  public void reset() {
    clearContext();
    statementGroup = null;
  }
}
