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

package com.twentyn.bel.writer;

import com.twentyn.bel.exceptions.UnknownModifierException;
import com.twentyn.bel.graph.BelEdge;
import com.twentyn.bel.graph.BelGraph;
import com.twentyn.bel.graph.NodeKey;
import com.twentyn.bel.language.BelConstants;
import com.twentyn.bel.language.BelQuoting;
import com.twentyn.bel.language.BelRelation;
import com.twentyn.bel.parser.MetadataParser;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Writes a graph as a BEL document that parses back into the same graph: the document metadata, the namespace and
 * annotation definitions, the nodes that no statement mentions, and then every statement edge under the SET lines
 * that give it its citation, evidence and annotations.
 */
public class BelDocumentWriter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BelDocumentWriter.class);

  private static final List<String> CITATION_KEYS = Arrays.asList(
      BelConstants.CITATION_TYPE, BelConstants.CITATION_NAME, BelConstants.CITATION_REFERENCE,
      BelConstants.CITATION_DATE, BelConstants.CITATION_AUTHORS, BelConstants.CITATION_COMMENTS);

  // Edges whose source is implied by their target: the writer never needs to mention the source on its own.
  private static final Set<String> IMPLYING_SOURCE_RELATIONS = new HashSet<String>() {{
    add(BelRelation.HAS_VARIANT.getName());
    add(BelRelation.TRANSCRIBED_TO.getName());
    add(BelRelation.TRANSLATED_TO.getName());
  }};

  private static final Set<String> MEMBERSHIP_RELATIONS = new HashSet<String>() {{
    add(BelRelation.HAS_COMPONENT.getName());
    add(BelRelation.HAS_REACTANT.getName());
    add(BelRelation.HAS_PRODUCT.getName());
  }};

  private final BelCanonicalizer canonicalizer;

  public BelDocumentWriter() {
    this(new BelCanonicalizer());
  }

  public BelDocumentWriter(BelCanonicalizer canonicalizer) {
    this.canonicalizer = canonicalizer;
  }

  public String writeDocument(BelGraph graph) throws UnknownModifierException {
    StringWriter out = new StringWriter();
    try {
      writeDocument(graph, out);
    } catch (IOException e) {
      throw new IllegalStateException("StringWriter does not throw IOException", e);
    }
    return out.toString();
  }

  public void writeDocument(BelGraph graph, Writer writer) throws IOException, UnknownModifierException {
    PrintWriter out = new PrintWriter(writer);
    writeMetadata(graph, out);
    writeUnqualifiedNodes(graph, out);
    writeMemberships(graph, out);
    writeStatements(graph, out);
    out.flush();
    if (out.checkError()) {
      throw new IOException("Failed to write BEL document");
    }
  }

  private void writeMetadata(BelGraph graph, PrintWriter out) {
    for (Map.Entry<String, String> entry : graph.getDocument().entrySet()) {
      out.printf("SET DOCUMENT %s = %s%n", MetadataParser.toDocumentKeyword(entry.getKey()),
          BelQuoting.quote(entry.getValue()));
    }
    out.println();

    for (Map.Entry<String, String> definition : definitions(graph.getNamespaceUrl(), graph.getNamespaceList())
        .entrySet()) {
      out.printf("DEFINE NAMESPACE %s AS %s%n", definition.getKey(), definition.getValue());
    }
    out.println();

    for (Map.Entry<String, String> definition : definitions(graph.getAnnotationUrl(), graph.getAnnotationList())
        .entrySet()) {
      out.printf("DEFINE ANNOTATION %s AS %s%n", definition.getKey(), definition.getValue());
    }
    out.println();
  }

  private static Map<String, String> definitions(Map<String, String> urls, Map<String, Set<String>> lists) {
    Map<String, String> definitions = new TreeMap<>();
    for (Map.Entry<String, String> entry : urls.entrySet()) {
      definitions.put(entry.getKey(), String.format("URL %s", BelQuoting.quote(entry.getValue())));
    }
    for (Map.Entry<String, Set<String>> entry : lists.entrySet()) {
      definitions.put(entry.getKey(), String.format("LIST {%s}", quoteAll(new TreeSet<>(entry.getValue()))));
    }
    return definitions;
  }

  private static String quoteAll(Collection<String> values) {
    List<String> quoted = new ArrayList<>(values.size());
    for (String value : values) {
      quoted.add(BelQuoting.quote(value));
    }
    return StringUtils.join(quoted, ", ");
  }

  /**
   * Writes a bare line for every node that would otherwise be lost: nodes that no statement mentions and that no
   * other node implies.
   */
  private void writeUnqualifiedNodes(BelGraph graph, PrintWriter out) {
    Set<NodeKey> covered = new HashSet<>();
    for (BelEdge edge : graph.getEdges()) {
      if (edge.isQualified()) {
        covered.add(edge.getSource());
        covered.add(edge.getTarget());
      } else if (IMPLYING_SOURCE_RELATIONS.contains(edge.getRelation())) {
        covered.add(edge.getSource());
      } else if (MEMBERSHIP_RELATIONS.contains(edge.getRelation())) {
        covered.add(edge.getTarget());
      } else if (BelRelation.HAS_MEMBER.getName().equals(edge.getRelation())) {
        covered.add(edge.getSource());
        covered.add(edge.getTarget());
      }
    }

    int written = 0;
    for (NodeKey key : graph.getNodes()) {
      if (!covered.contains(key)) {
        out.println(canonicalizer.writeNode(graph, key));
        written++;
      }
    }
    if (written > 0) {
      out.println();
    }
    LOGGER.debug("Wrote %d nodes without statements", written);
  }

  /**
   * Writes the structural hasMember edges of each node back as one hasMembers list, ahead of any citation.
   */
  private void writeMemberships(BelGraph graph, PrintWriter out) {
    Map<String, List<String>> membersByParent = new TreeMap<>();
    for (BelEdge edge : graph.getEdges()) {
      if (!edge.isQualified() && BelRelation.HAS_MEMBER.getName().equals(edge.getRelation())) {
        membersByParent.computeIfAbsent(canonicalizer.writeNode(graph, edge.getSource()), k -> new ArrayList<>())
            .add(canonicalizer.writeNode(graph, edge.getTarget()));
      }
    }
    for (Map.Entry<String, List<String>> entry : membersByParent.entrySet()) {
      List<String> members = entry.getValue();
      Collections.sort(members);
      out.printf("%s %s list(%s)%n", entry.getKey(), BelRelation.HAS_MEMBERS.getName(),
          StringUtils.join(members, ", "));
    }
    if (!membersByParent.isEmpty()) {
      out.println();
    }
  }

  private void writeStatements(BelGraph graph, PrintWriter out) throws UnknownModifierException {
    List<BelEdge> edges = new ArrayList<>();
    for (BelEdge edge : graph.getEdges()) {
      if (edge.isQualified()) {
        edges.add(edge);
      }
    }
    Collections.sort(edges, Comparator.comparing(BelDocumentWriter::contextOf));

    Map<String, String> currentCitation = Collections.emptyMap();
    String currentEvidence = null;
    Map<String, String> currentAnnotations = new TreeMap<>();

    for (BelEdge edge : edges) {
      Map<String, String> citation = stringMap(edge.getAttributes().get(BelConstants.CITATION));
      String evidence = (String) edge.getAttributes().get(BelConstants.EVIDENCE);
      Map<String, String> annotations = new TreeMap<>(stringMap(edge.getAttributes().get(BelConstants.ANNOTATIONS)));

      if (!citation.equals(currentCitation)) {
        out.println();
        if (citation.isEmpty()) {
          out.println("UNSET Citation");
        } else {
          out.printf("SET Citation = {%s}%n", quoteAll(citationValues(citation)));
        }
        // Setting or unsetting a citation clears evidence and annotations.
        currentCitation = citation;
        currentEvidence = null;
        currentAnnotations.clear();
      }

      if (!Objects.equals(evidence, currentEvidence)) {
        if (evidence == null) {
          out.println("UNSET Evidence");
        } else {
          out.printf("SET Evidence = %s%n", BelQuoting.quote(evidence));
        }
        currentEvidence = evidence;
      }

      for (String key : new ArrayList<>(currentAnnotations.keySet())) {
        if (!annotations.containsKey(key)) {
          out.printf("UNSET %s%n", key);
          currentAnnotations.remove(key);
        }
      }
      for (Map.Entry<String, String> annotation : annotations.entrySet()) {
        if (!annotation.getValue().equals(currentAnnotations.get(annotation.getKey()))) {
          out.printf("SET %s = %s%n", annotation.getKey(), BelQuoting.quote(annotation.getValue()));
          currentAnnotations.put(annotation.getKey(), annotation.getValue());
        }
      }

      out.println(canonicalizer.writeStatement(graph, edge));
    }
  }

  /**
   * Sort key that groups edges by citation and then by evidence. Edges without a citation come first.
   */
  private static Pair<String, String> contextOf(BelEdge edge) {
    Map<String, String> citation = stringMap(edge.getAttributes().get(BelConstants.CITATION));
    String evidence = (String) edge.getAttributes().get(BelConstants.EVIDENCE);
    return Pair.of(StringUtils.join(citationValues(citation), "\t"), StringUtils.defaultString(evidence));
  }

  private static List<String> citationValues(Map<String, String> citation) {
    List<String> values = new ArrayList<>();
    for (String key : CITATION_KEYS) {
      if (citation.containsKey(key)) {
        values.add(citation.get(key));
      }
    }
    return values;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, String> stringMap(Object value) {
    if (value == null) {
      return Collections.emptyMap();
    }
    return new LinkedHashMap<>((Map<String, String>) value);
  }
}
