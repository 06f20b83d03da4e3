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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.twentyn.bel.graph.BelEdge;
import com.twentyn.bel.graph.BelGraph;
import com.twentyn.bel.graph.NodeKey;
import com.twentyn.bel.language.BelConstants;
import com.twentyn.bel.model.Coordinate;
import com.twentyn.bel.model.Fusion;
import com.twentyn.bel.model.FusionRange;
import com.twentyn.bel.model.NamespaceValue;
import com.twentyn.bel.model.variant.Fragment;
import com.twentyn.bel.model.variant.HgvsVariant;
import com.twentyn.bel.model.variant.ProteinModification;
import com.twentyn.bel.model.variant.Substitution;
import com.twentyn.bel.model.variant.Truncation;
import com.twentyn.bel.model.variant.Variant;
import com.twentyn.bel.model.variant.VariantVisitor;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exports a graph as node-link JSON: a "graph" object with the document metadata and definitions, a "nodes" array
 * and a "links" array whose source and target refer to node ids.
 */
public class BelGraphJsonWriter {
  private static transient final ObjectMapper OBJECT_MAPPER =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private static final VariantJson VARIANT_JSON = new VariantJson();

  public void writeToJsonFile(BelGraph graph, File outputFile) throws IOException {
    try (BufferedWriter writer = Files.newBufferedWriter(outputFile.toPath(), StandardCharsets.UTF_8)) {
      OBJECT_MAPPER.writeValue(writer, toNodeLink(graph));
    }
  }

  public String writeToJsonString(BelGraph graph) throws IOException {
    StringWriter writer = new StringWriter();
    OBJECT_MAPPER.writeValue(writer, toNodeLink(graph));
    return writer.toString();
  }

  public static NodeLinkGraph readFromJsonFile(File inputFile) throws IOException {
    return OBJECT_MAPPER.readValue(inputFile, NodeLinkGraph.class);
  }

  public NodeLinkGraph toNodeLink(BelGraph graph) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("document", graph.getDocument());
    metadata.put("namespace_url", graph.getNamespaceUrl());
    metadata.put("namespace_list", graph.getNamespaceList());
    metadata.put("annotation_url", graph.getAnnotationUrl());
    metadata.put("annotation_list", graph.getAnnotationList());

    Map<NodeKey, Integer> ids = new HashMap<>();
    List<JsonNode> nodes = new ArrayList<>();
    for (NodeKey key : graph.getNodes()) {
      int id = nodes.size();
      ids.put(key, id);
      nodes.add(new JsonNode(id, key.getParts(), jsonData(graph.getNodeData(key).get())));
    }

    List<JsonLink> links = new ArrayList<>();
    for (BelEdge edge : graph.getEdges()) {
      links.add(new JsonLink(ids.get(edge.getSource()), ids.get(edge.getTarget()), edge.getKey(),
          edge.getAttributes()));
    }
    return new NodeLinkGraph(metadata, nodes, links);
  }

  private static Map<String, Object> jsonData(Map<String, Object> data) {
    Map<String, Object> json = new LinkedHashMap<>(data);
    if (data.containsKey(BelConstants.VARIANTS)) {
      List<Map<String, Object>> variants = new ArrayList<>();
      for (Object variant : (List<?>) data.get(BelConstants.VARIANTS)) {
        variants.add(((Variant) variant).accept(VARIANT_JSON));
      }
      json.put(BelConstants.VARIANTS, variants);
    }
    if (data.containsKey(BelConstants.FUSION)) {
      json.put(BelConstants.FUSION, fusionJson((Fusion) data.get(BelConstants.FUSION)));
    }
    return json;
  }

  private static Map<String, Object> fusionJson(Fusion fusion) {
    Map<String, Object> json = new LinkedHashMap<>();
    json.put("partner_5p", entity(fusion.getPartner5p()));
    json.put("range_5p", rangeJson(fusion.getRange5p()));
    json.put("partner_3p", entity(fusion.getPartner3p()));
    json.put("range_3p", rangeJson(fusion.getRange3p()));
    return json;
  }

  private static Map<String, Object> rangeJson(FusionRange range) {
    Map<String, Object> json = new LinkedHashMap<>();
    if (range.isMissing()) {
      json.put("missing", "?");
      return json;
    }
    json.put("reference", String.valueOf(range.getReference()));
    json.put("left", coordinate(range.getStart()));
    json.put("right", coordinate(range.getStop()));
    return json;
  }

  private static Object coordinate(Coordinate coordinate) {
    return coordinate.toKeyPart();
  }

  private static Map<String, Object> entity(NamespaceValue value) {
    Map<String, Object> json = new LinkedHashMap<>();
    json.put(BelConstants.NAMESPACE, value.getNamespace());
    json.put(BelConstants.NAME, value.getName());
    return json;
  }

  private static class VariantJson implements VariantVisitor<Map<String, Object>> {
    @Override
    public Map<String, Object> visitProteinModification(ProteinModification modification) {
      Map<String, Object> json = kind("pmod");
      json.put("identifier", entity(modification.getModification()));
      modification.getAminoAcid().ifPresent(aminoAcid -> json.put("code", aminoAcid.getThreeLetterCode()));
      modification.getPosition().ifPresent(position -> json.put("pos", position));
      return json;
    }

    @Override
    public Map<String, Object> visitHgvsVariant(HgvsVariant variant) {
      Map<String, Object> json = kind("hgvs");
      json.put("variant", variant.getDescription());
      return json;
    }

    @Override
    public Map<String, Object> visitFragment(Fragment fragment) {
      Map<String, Object> json = kind("frag");
      if (fragment.isMissing()) {
        json.put("missing", "?");
      } else {
        json.put("start", coordinate(fragment.getStart()));
        json.put("stop", coordinate(fragment.getStop()));
      }
      fragment.getDescription().ifPresent(description -> json.put("description", description));
      return json;
    }

    @Override
    public Map<String, Object> visitSubstitution(Substitution substitution) {
      Map<String, Object> json = kind("sub");
      json.put("reference", substitution.getReference());
      json.put("pos", substitution.getPosition());
      json.put("variant", substitution.getVariant());
      return json;
    }

    @Override
    public Map<String, Object> visitTruncation(Truncation truncation) {
      Map<String, Object> json = kind("trunc");
      json.put("pos", truncation.getPosition());
      return json;
    }

    private static Map<String, Object> kind(String kind) {
      Map<String, Object> json = new LinkedHashMap<>();
      json.put("kind", kind);
      return json;
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class NodeLinkGraph {
    @JsonProperty("graph")
    private Map<String, Object> graph;

    @JsonProperty("nodes")
    private List<JsonNode> nodes;

    @JsonProperty("links")
    private List<JsonLink> links;

    @JsonCreator
    public NodeLinkGraph(@JsonProperty("graph") Map<String, Object> graph,
                         @JsonProperty("nodes") List<JsonNode> nodes,
                         @JsonProperty("links") List<JsonLink> links) {
      this.graph = graph;
      this.nodes = nodes;
      this.links = links;
    }

    public Map<String, Object> getGraph() {
      return graph;
    }

    public List<JsonNode> getNodes() {
      return nodes;
    }

    public List<JsonLink> getLinks() {
      return links;
    }
  }

  public static class JsonNode {
    @JsonProperty("id")
    private Integer id;

    @JsonProperty("key")
    private List<Object> key;

    @JsonProperty("data")
    private Map<String, Object> data;

    @JsonCreator
    public JsonNode(@JsonProperty("id") Integer id,
                    @JsonProperty("key") List<Object> key,
                    @JsonProperty("data") Map<String, Object> data) {
      this.id = id;
      this.key = key;
      this.data = data;
    }

    public Integer getId() {
      return id;
    }

    public List<Object> getKey() {
      return key;
    }

    public Map<String, Object> getData() {
      return data;
    }
  }

  public static class JsonLink {
    @JsonProperty("source")
    private Integer source;

    @JsonProperty("target")
    private Integer target;

    @JsonProperty("key")
    private Object key;

    @JsonProperty("data")
    private Map<String, Object> data;

    @JsonCreator
    public JsonLink(@JsonProperty("source") Integer source,
                    @JsonProperty("target") Integer target,
                    @JsonProperty("key") Object key,
                    @JsonProperty("data") Map<String, Object> data) {
      this.source = source;
      this.target = target;
      this.key = key;
      this.data = data;
    }

    public Integer getSource() {
      return source;
    }

    public Integer getTarget() {
      return target;
    }

    public Object getKey() {
      return key;
    }

    public Map<String, Object> getData() {
      return data;
    }
  }
}
