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

package com.twentyn.bel.graph;

import com.twentyn.bel.language.BelConstants;
import com.twentyn.bel.language.BelRelation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * A directed multigraph of BEL nodes and edges, plus the document metadata and the namespace and annotation
 * definitions that the document declared. Nodes and edges keep their insertion order.
 */
public class BelGraph {
  private final Map<NodeKey, Map<String, Object>> nodes = new LinkedHashMap<>();
  private final List<BelEdge> edges = new ArrayList<>();
  private final Map<NodeKey, List<BelEdge>> outEdges = new HashMap<>();
  private final Map<NodeKey, List<BelEdge>> inEdges = new HashMap<>();
  private int nextEdgeKey = 0;

  private final Map<String, String> document = new TreeMap<>();
  private final Map<String, String> namespaceUrl = new TreeMap<>();
  private final Map<String, Set<String>> namespaceList = new TreeMap<>();
  private final Map<String, String> annotationUrl = new TreeMap<>();
  private final Map<String, Set<String>> annotationList = new TreeMap<>();

  /**
   * @return True if the node was not already in the graph.
   */
  public boolean addNode(NodeKey key, Map<String, Object> data) {
    if (nodes.containsKey(key)) {
      return false;
    }
    nodes.put(key, Collections.unmodifiableMap(new LinkedHashMap<>(data)));
    return true;
  }

  public boolean hasNode(NodeKey key) {
    return nodes.containsKey(key);
  }

  public Optional<Map<String, Object>> getNodeData(NodeKey key) {
    return Optional.ofNullable(nodes.get(key));
  }

  public Set<NodeKey> getNodes() {
    return Collections.unmodifiableSet(nodes.keySet());
  }

  /**
   * @param filter Attributes the node data must match; see {@link #matches}.
   */
  public List<NodeKey> getNodes(Map<String, ?> filter) {
    List<NodeKey> result = new ArrayList<>();
    for (Map.Entry<NodeKey, Map<String, Object>> entry : nodes.entrySet()) {
      if (matches(entry.getValue(), filter)) {
        result.add(entry.getKey());
      }
    }
    return result;
  }

  public int numberOfNodes() {
    return nodes.size();
  }

  /**
   * Adds a structural edge. Its key is the relation name, so adding the same edge twice has no effect.
   *
   * @return True if the edge was not already in the graph.
   */
  public boolean addUnqualifiedEdge(NodeKey source, NodeKey target, BelRelation relation) {
    requireNodes(source, target);
    if (hasEdge(source, target, relation.getName())) {
      return false;
    }
    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put(BelConstants.RELATION, relation.getName());
    insertEdge(new BelEdge(source, target, relation.getName(), attributes, false));
    return true;
  }

  /**
   * Adds an asserted statement edge under a fresh integer key. The attributes must include the relation.
   */
  public BelEdge addQualifiedEdge(NodeKey source, NodeKey target, Map<String, Object> attributes) {
    requireNodes(source, target);
    if (!attributes.containsKey(BelConstants.RELATION)) {
      throw new IllegalArgumentException("Qualified edges need a relation.");
    }
    BelEdge edge = new BelEdge(source, target, nextEdgeKey++, attributes, true);
    insertEdge(edge);
    return edge;
  }

  private void insertEdge(BelEdge edge) {
    edges.add(edge);
    outEdges.computeIfAbsent(edge.getSource(), k -> new ArrayList<>()).add(edge);
    inEdges.computeIfAbsent(edge.getTarget(), k -> new ArrayList<>()).add(edge);
  }

  private void requireNodes(NodeKey source, NodeKey target) {
    if (!nodes.containsKey(source) || !nodes.containsKey(target)) {
      throw new IllegalArgumentException(String.format("Cannot link %s to %s: both nodes must exist first.",
          source, target));
    }
  }

  /**
   * @return True if an unqualified edge with this relation already joins source to target.
   */
  public boolean hasEdge(NodeKey source, NodeKey target, String relation) {
    for (BelEdge edge : getOutEdges(source)) {
      if (!edge.isQualified() && edge.getTarget().equals(target) && relation.equals(edge.getKey())) {
        return true;
      }
    }
    return false;
  }

  public List<BelEdge> getEdges() {
    return Collections.unmodifiableList(edges);
  }

  /**
   * @param filter Attributes the edge data must match; see {@link #matches}.
   */
  public List<BelEdge> getEdges(Map<String, ?> filter) {
    List<BelEdge> result = new ArrayList<>();
    for (BelEdge edge : edges) {
      if (matches(edge.getAttributes(), filter)) {
        result.add(edge);
      }
    }
    return result;
  }

  public List<BelEdge> getOutEdges(NodeKey key) {
    return Collections.unmodifiableList(outEdges.getOrDefault(key, Collections.emptyList()));
  }

  public List<BelEdge> getInEdges(NodeKey key) {
    return Collections.unmodifiableList(inEdges.getOrDefault(key, Collections.emptyList()));
  }

  public int numberOfEdges() {
    return edges.size();
  }

  /**
   * Sub-dictionary matching: every filter key must be present in the data. A string or map filter value must equal
   * the data value; a collection filter value must contain it.
   */
  static boolean matches(Map<String, Object> data, Map<String, ?> filter) {
    for (Map.Entry<String, ?> entry : filter.entrySet()) {
      if (!data.containsKey(entry.getKey())) {
        return false;
      }
      Object expected = entry.getValue();
      Object actual = data.get(entry.getKey());
      if (expected instanceof String || expected instanceof Map) {
        if (!expected.equals(actual)) {
          return false;
        }
      } else if (expected instanceof Collection) {
        if (!((Collection<?>) expected).contains(actual)) {
          return false;
        }
      } else {
        throw new IllegalArgumentException(String.format(
            "Cannot filter %s on a value of type %s", entry.getKey(),
            expected == null ? "null" : expected.getClass().getSimpleName()));
      }
    }
    return true;
  }

  public Map<String, String> getDocument() {
    return document;
  }

  public Map<String, String> getNamespaceUrl() {
    return namespaceUrl;
  }

  public Map<String, Set<String>> getNamespaceList() {
    return namespaceList;
  }

  public Map<String, String> getAnnotationUrl() {
    return annotationUrl;
  }

  public Map<String, Set<String>> getAnnotationList() {
    return annotationList;
  }

  public void clear() {
    nodes.clear();
    edges.clear();
    outEdges.clear();
    inEdges.clear();
    nextEdgeKey = 0;
    document.clear();
    namespaceUrl.clear();
    namespaceList.clear();
    annotationUrl.clear();
    annotationList.clear();
  }
}
