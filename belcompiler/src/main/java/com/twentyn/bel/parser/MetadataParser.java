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
import com.twentyn.bel.exceptions.MissingMetadataException;
import com.twentyn.bel.graph.BelGraph;
import com.twentyn.bel.language.BelConstants;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the preamble of a BEL document: SET DOCUMENT lines and the DEFINE NAMESPACE / DEFINE ANNOTATION lines.
 * Everything it reads is stored on the graph; the namespace definitions also back a {@link NamespaceValidator}.
 */
public class MetadataParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(MetadataParser.class);

  public static final Pattern HEADER_PATTERN =
      Pattern.compile("^(SET\\s+DOCUMENT|DEFINE\\s+NAMESPACE|DEFINE\\s+ANNOTATION)\\b.*");
  public static final Pattern DOCUMENT_PATTERN = Pattern.compile("^SET\\s+DOCUMENT\\b.*");

  private static final Pattern SET_DOCUMENT_PATTERN =
      Pattern.compile("^SET\\s+DOCUMENT\\s+(\\w+)\\s*=\\s*\"((?:[^\"\\\\]|\\\\.)*)\"\\s*$");
  private static final Pattern DEFINE_PATTERN =
      Pattern.compile("^DEFINE\\s+(NAMESPACE|ANNOTATION)\\s+(\\S+)\\s+AS\\s+(URL|LIST)\\s+(.+?)\\s*$");
  private static final Pattern URL_PATTERN = Pattern.compile("^\"([^\"]*)\"$");
  private static final Pattern LIST_PATTERN = Pattern.compile("^\\{(.*)\\}$");
  private static final Pattern QUOTED_PATTERN = Pattern.compile("\"((?:[^\"\\\\]|\\\\.)*)\"");

  private static final Map<String, String> DOCUMENT_KEYS = new HashMap<String, String>() {{
    put("Name", BelConstants.DOCUMENT_NAME);
    put("Version", BelConstants.DOCUMENT_VERSION);
    put("Description", BelConstants.DOCUMENT_DESCRIPTION);
    put("Authors", BelConstants.DOCUMENT_AUTHORS);
    put("ContactInfo", BelConstants.DOCUMENT_CONTACT);
    put("Copyright", BelConstants.DOCUMENT_COPYRIGHT);
    put("Licenses", BelConstants.DOCUMENT_LICENSES);
    put("Disclaimer", BelConstants.DOCUMENT_DISCLAIMER);
  }};

  private static final Map<String, String> INVERSE_DOCUMENT_KEYS = new HashMap<String, String>() {{
    for (Map.Entry<String, String> entry : DOCUMENT_KEYS.entrySet()) {
      put(entry.getValue(), entry.getKey());
    }
  }};

  private final BelGraph graph;

  public MetadataParser(BelGraph graph) {
    this.graph = graph;
  }

  public static boolean isHeaderLine(String line) {
    return HEADER_PATTERN.matcher(line).matches();
  }

  public static boolean isDocumentLine(String line) {
    return DOCUMENT_PATTERN.matcher(line).matches();
  }

  /**
   * Maps a graph document key back to the key written after SET DOCUMENT.
   */
  public static String toDocumentKeyword(String key) {
    return INVERSE_DOCUMENT_KEYS.getOrDefault(key, key);
  }

  public void parseLine(String line) throws BelException {
    Matcher document = SET_DOCUMENT_PATTERN.matcher(line);
    if (document.matches()) {
      String key = DOCUMENT_KEYS.getOrDefault(document.group(1), document.group(1));
      graph.getDocument().put(key, unescape(document.group(2)));
      return;
    }

    Matcher define = DEFINE_PATTERN.matcher(line);
    if (define.matches()) {
      boolean isNamespace = "NAMESPACE".equals(define.group(1));
      String name = define.group(2);
      if ("URL".equals(define.group(3))) {
        String url = parseUrl(define.group(4), line);
        (isNamespace ? graph.getNamespaceUrl() : graph.getAnnotationUrl()).put(name, url);
      } else {
        Set<String> values = parseList(define.group(4), line);
        (isNamespace ? graph.getNamespaceList() : graph.getAnnotationList()).put(name, values);
      }
      LOGGER.debug("Defined %s %s", define.group(1).toLowerCase(), name);
      return;
    }

    throw new BelSyntaxException(String.format("Unrecognized document header: %s", line), 0);
  }

  private static String parseUrl(String text, String line) throws InvalidControlStatementException {
    Matcher matcher = URL_PATTERN.matcher(text);
    if (!matcher.matches()) {
      throw new InvalidControlStatementException(String.format("Definition URL must be quoted: %s", line));
    }
    return matcher.group(1);
  }

  private static Set<String> parseList(String text, String line) throws InvalidControlStatementException {
    Matcher matcher = LIST_PATTERN.matcher(text);
    if (!matcher.matches()) {
      throw new InvalidControlStatementException(String.format("Definition list must be a {...} list: %s", line));
    }
    Set<String> values = new LinkedHashSet<>();
    Matcher quoted = QUOTED_PATTERN.matcher(matcher.group(1));
    while (quoted.find()) {
      values.add(unescape(quoted.group(1)));
    }
    if (CollectionUtils.isEmpty(values)) {
      throw new InvalidControlStatementException(String.format("Definition list is empty: %s", line));
    }
    return Collections.unmodifiableSet(values);
  }

  private static String unescape(String value) {
    return value.replaceAll("\\\\(.)", "$1");
  }

  /**
   * @return A validator over the namespaces defined so far.
   */
  public NamespaceValidator getNamespaceValidator() {
    return new DefinedNamespaceValidator(graph.getNamespaceUrl().keySet(), graph.getNamespaceList());
  }

  /**
   * @return One exception per required key that the document section did not set.
   */
  public List<MissingMetadataException> checkRequiredMetadata(Collection<String> requiredKeys) {
    List<MissingMetadataException> missing = new ArrayList<>();
    for (String key : requiredKeys) {
      if (!graph.getDocument().containsKey(key)) {
        missing.add(new MissingMetadataException(key));
      }
    }
    return missing;
  }
}
