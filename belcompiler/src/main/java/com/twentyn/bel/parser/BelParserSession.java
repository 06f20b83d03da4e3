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
import com.twentyn.bel.exceptions.LegacySyntaxWarning;
import com.twentyn.bel.graph.BelEdge;
import com.twentyn.bel.graph.BelGraph;
import com.twentyn.bel.graph.BelGraphBuilder;
import com.twentyn.bel.graph.NodeInterner;
import com.twentyn.bel.model.Statement;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Owns everything that changes while a document is parsed: the graph, the aggregate interning table, the control
 * context and the legacy syntax notices. Sessions are independent of one another; use one per document or call
 * {@link #reset()} in between.
 */
public class BelParserSession {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BelParserSession.class);

  private final BelParserConfiguration configuration;
  private final NamespaceValidator initialValidator;
  private final BelGraph graph = new BelGraph();
  private final NodeInterner interner = new NodeInterner();
  private final ControlParser controlParser;
  private final MetadataParser metadataParser;
  private final BelGraphBuilder builder;
  private final List<LegacySyntaxWarning> legacyWarnings = new ArrayList<>();

  private NamespaceValidator namespaceValidator;
  private StatementParser statementParser;

  public BelParserSession(BelParserConfiguration configuration) {
    this(configuration, NamespaceValidator.PERMISSIVE);
  }

  public BelParserSession(BelParserConfiguration configuration, NamespaceValidator namespaceValidator) {
    this.configuration = configuration;
    this.initialValidator = namespaceValidator;
    this.controlParser = new ControlParser(graph.getAnnotationList(), graph.getAnnotationUrl());
    this.metadataParser = new MetadataParser(graph);
    this.builder = new BelGraphBuilder(graph, interner, controlParser, configuration.isCompleteOrigin());
    setNamespaceValidator(namespaceValidator);
  }

  /**
   * Replaces the validator that identifiers in subsequent statements are checked against.
   */
  public void setNamespaceValidator(NamespaceValidator namespaceValidator) {
    this.namespaceValidator = namespaceValidator;
    this.statementParser = new StatementParser(new TermParser(namespaceValidator), configuration.isAllowNested());
  }

  /**
   * Parses one statement and adds it to the graph. Nothing is added if either step fails.
   *
   * @return The qualified edges the statement produced.
   */
  public List<BelEdge> parseStatement(String line) throws BelException {
    Statement statement = statementParser.parseStatement(line);
    List<BelEdge> edges = builder.addStatement(statement);
    for (LegacySyntaxWarning warning : statement.getLegacyWarnings()) {
      LOGGER.debug("Legacy syntax in \"%s\": %s", line, warning.getMessage());
    }
    legacyWarnings.addAll(statement.getLegacyWarnings());
    return edges;
  }

  public void reset() {
    graph.clear();
    interner.reset();
    controlParser.reset();
    legacyWarnings.clear();
    setNamespaceValidator(initialValidator);
  }

  public BelParserConfiguration getConfiguration() {
    return configuration;
  }

  public BelGraph getGraph() {
    return graph;
  }

  public NodeInterner getInterner() {
    return interner;
  }

  public ControlParser getControlParser() {
    return controlParser;
  }

  public MetadataParser getMetadataParser() {
    return metadataParser;
  }

  public BelGraphBuilder getBuilder() {
    return builder;
  }

  public NamespaceValidator getNamespaceValidator() {
    return namespaceValidator;
  }

  public List<LegacySyntaxWarning> getLegacyWarnings() {
    return Collections.unmodifiableList(legacyWarnings);
  }
}
