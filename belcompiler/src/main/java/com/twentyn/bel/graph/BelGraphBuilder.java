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

import com.twentyn.bel.exceptions.BelException;
import com.twentyn.bel.exceptions.MalformedTermException;
import com.twentyn.bel.exceptions.UnsupportedTermException;
import com.twentyn.bel.language.BelConstants;
import com.twentyn.bel.language.BelFunction;
import com.twentyn.bel.language.BelRelation;
import com.twentyn.bel.language.ModifierKind;
import com.twentyn.bel.model.AbundanceList;
import com.twentyn.bel.model.AbundanceTerm;
import com.twentyn.bel.model.Activity;
import com.twentyn.bel.model.ComplexList;
import com.twentyn.bel.model.CompositeAbundance;
import com.twentyn.bel.model.FusedAbundance;
import com.twentyn.bel.model.ModifiedAbundance;
import com.twentyn.bel.model.NamedComplex;
import com.twentyn.bel.model.NamespaceValue;
import com.twentyn.bel.model.ProcessTerm;
import com.twentyn.bel.model.Reaction;
import com.twentyn.bel.model.SimpleAbundance;
import com.twentyn.bel.model.Statement;
import com.twentyn.bel.model.StatementModifier;
import com.twentyn.bel.model.Term;
import com.twentyn.bel.model.TermVisitor;
import com.twentyn.bel.model.Transformation;
import com.twentyn.bel.model.variant.Variant;
import com.twentyn.bel.writer.VariantWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves parsed terms to graph nodes and statements to edges.
 *
 * Every term is checked in full before the graph is touched, so a statement that fails leaves no partial nodes
 * behind. Once a term is valid, {@link #ensureNode} inserts its node (and whatever structure it implies: variant
 * parents, aggregate members, and the gene and RNA behind a protein when origin completion is on) and returns its
 * canonical key.
 */
public class BelGraphBuilder {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BelGraphBuilder.class);

  private final BelGraph graph;
  private final NodeInterner interner;
  private final CitationContext citationContext;
  private final boolean completeOrigin;

  private final TermChecker termChecker = new TermChecker();
  private final NodeInserter nodeInserter = new NodeInserter();

  public BelGraphBuilder(BelGraph graph, NodeInterner interner, CitationContext citationContext,
                         boolean completeOrigin) {
    this.graph = graph;
    this.interner = interner;
    this.citationContext = citationContext;
    this.completeOrigin = completeOrigin;
  }

  public BelGraph getGraph() {
    return graph;
  }

  public NodeKey ensureNode(Term term) throws BelException {
    term.accept(termChecker);
    return term.accept(nodeInserter);
  }

  /**
   * Adds a parsed statement: its nodes, then one qualified edge stamped with the current citation, evidence and
   * annotations. hasMembers over a list becomes one structural hasMember edge per list member, carrying no context.
   *
   * @return The qualified edges that were added; empty for a bare term or a hasMembers list.
   */
  public List<BelEdge> addStatement(Statement statement) throws BelException {
    checkStatement(statement);

    List<BelEdge> added = new ArrayList<>();
    NodeKey subject = statement.getSubject().accept(nodeInserter);
    if (statement.isTermOnly()) {
      return added;
    }

    BelRelation relation = statement.getRelation().get();
    Optional<StatementModifier> subjectModifier = statement.getSubjectModifier();

    if (statement.isNested()) {
      Statement nested = statement.getNestedObject().get();
      NodeKey nestedSubject = nested.getSubject().accept(nodeInserter);
      NodeKey nestedObject = nested.getObject().get().accept(nodeInserter);
      added.add(addQualifiedEdge(subject, nestedSubject, relation, subjectModifier, nested.getSubjectModifier()));
      added.add(addQualifiedEdge(nestedSubject, nestedObject, nested.getRelation().get(),
          nested.getSubjectModifier(), nested.getObjectModifier()));
      return added;
    }

    Term object = statement.getObject().get();
    if (relation == BelRelation.HAS_MEMBERS && object instanceof AbundanceList) {
      for (AbundanceTerm member : ((AbundanceList) object).getMembers()) {
        NodeKey memberKey = member.accept(nodeInserter);
        graph.addUnqualifiedEdge(subject, memberKey, BelRelation.HAS_MEMBER);
      }
      return added;
    }

    NodeKey objectKey = object.accept(nodeInserter);
    added.add(addQualifiedEdge(subject, objectKey, relation, subjectModifier, statement.getObjectModifier()));
    return added;
  }

  private void checkStatement(Statement statement) throws BelException {
    statement.getSubject().accept(termChecker);
    if (statement.isNested()) {
      Statement nested = statement.getNestedObject().get();
      nested.getSubject().accept(termChecker);
      nested.getObject().get().accept(termChecker);
    } else if (statement.getObject().isPresent()) {
      Term object = statement.getObject().get();
      if (object instanceof AbundanceList && statement.getRelation().get() == BelRelation.HAS_MEMBERS) {
        AbundanceList list = (AbundanceList) object;
        if (list.getMembers().isEmpty()) {
          throw new MalformedTermException("list(...) needs at least one member");
        }
        for (AbundanceTerm member : list.getMembers()) {
          member.accept(termChecker);
        }
      } else {
        object.accept(termChecker);
      }
    }
  }

  private BelEdge addQualifiedEdge(NodeKey source, NodeKey target, BelRelation relation,
                                   Optional<StatementModifier> subjectModifier,
                                   Optional<StatementModifier> objectModifier) {
    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put(BelConstants.RELATION, relation.getName());
    if (subjectModifier.isPresent()) {
      attributes.put(BelConstants.SUBJECT, modifierDictionary(subjectModifier.get()));
    }
    if (objectModifier.isPresent()) {
      attributes.put(BelConstants.OBJECT, modifierDictionary(objectModifier.get()));
    }
    Map<String, String> citation = citationContext.getCurrentCitation();
    if (!citation.isEmpty()) {
      attributes.put(BelConstants.CITATION, new LinkedHashMap<>(citation));
    }
    Optional<String> evidence = citationContext.getCurrentEvidence();
    if (evidence.isPresent()) {
      attributes.put(BelConstants.EVIDENCE, evidence.get());
    }
    Map<String, String> annotations = citationContext.getCurrentAnnotations();
    if (!annotations.isEmpty()) {
      attributes.put(BelConstants.ANNOTATIONS, new LinkedHashMap<>(annotations));
    }
    BelEdge edge = graph.addQualifiedEdge(source, target, attributes);
    LOGGER.debug("Added %s", edge);
    return edge;
  }

  /**
   * Flattens a statement modifier into the dictionary stored on the edge: modifier, effect and location.
   */
  static Map<String, Object> modifierDictionary(StatementModifier modifier) {
    Map<String, Object> dictionary = new LinkedHashMap<>();
    if (modifier.getKind().isPresent()) {
      ModifierKind kind = modifier.getKind().get();
      dictionary.put(BelConstants.MODIFIER, kind.getLabel());
      Map<String, Object> effect = modifierEffect(kind, modifier);
      if (!effect.isEmpty()) {
        dictionary.put(BelConstants.EFFECT, effect);
      }
    }
    if (modifier.getLocation().isPresent()) {
      dictionary.put(BelConstants.LOCATION, entity(modifier.getLocation().get()));
    }
    return dictionary;
  }

  private static Map<String, Object> modifierEffect(ModifierKind kind, StatementModifier modifier) {
    Map<String, Object> effect = new LinkedHashMap<>();
    switch (kind) {
      case ACTIVITY:
        if (modifier.getMolecularActivity().isPresent()) {
          effect.putAll(entity(modifier.getMolecularActivity().get()));
        }
        break;
      case TRANSLOCATION:
        if (modifier.getFromLocation().isPresent() && modifier.getToLocation().isPresent()) {
          effect.put(BelConstants.FROM_LOC, entity(modifier.getFromLocation().get()));
          effect.put(BelConstants.TO_LOC, entity(modifier.getToLocation().get()));
        }
        break;
      case CELL_SECRETION:
        effect.put(BelConstants.FROM_LOC, entity(new NamespaceValue(BelConstants.GOCC, BelConstants.INTRACELLULAR)));
        effect.put(BelConstants.TO_LOC,
            entity(new NamespaceValue(BelConstants.GOCC, BelConstants.EXTRACELLULAR_SPACE)));
        break;
      case CELL_SURFACE_EXPRESSION:
        effect.put(BelConstants.FROM_LOC, entity(new NamespaceValue(BelConstants.GOCC, BelConstants.INTRACELLULAR)));
        effect.put(BelConstants.TO_LOC, entity(new NamespaceValue(BelConstants.GOCC, BelConstants.CELL_SURFACE)));
        break;
      case DEGRADATION:
        break;
      default:
        throw new IllegalStateException(String.format("No effect defined for modifier %s", kind));
    }
    return effect;
  }

  static Map<String, Object> entity(NamespaceValue value) {
    Map<String, Object> entity = new LinkedHashMap<>();
    entity.put(BelConstants.NAMESPACE, value.getNamespace());
    entity.put(BelConstants.NAME, value.getName());
    return entity;
  }

  /**
   * Rejects terms that cannot become nodes, without touching the graph.
   */
  private static class TermChecker implements TermVisitor<Void, BelException> {
    @Override
    public Void visitSimpleAbundance(SimpleAbundance term) throws BelException {
      requireIdentifier(term.getIdentifier(), term.getFunction().getLabel());
      return null;
    }

    @Override
    public Void visitModifiedAbundance(ModifiedAbundance term) throws BelException {
      requireIdentifier(term.getIdentifier(), term.getFunction().getLabel());
      if (term.getVariants().isEmpty()) {
        throw new MalformedTermException(String.format("Modified %s %s has no variants",
            term.getFunction().getLabel(), term.getIdentifier()));
      }
      return null;
    }

    @Override
    public Void visitFusedAbundance(FusedAbundance term) throws BelException {
      if (term.getFusion() == null) {
        throw new MalformedTermException(String.format("%s has no fusion", term.getFunction().getFusionLabel()));
      }
      return null;
    }

    @Override
    public Void visitNamedComplex(NamedComplex term) throws BelException {
      requireIdentifier(term.getIdentifier(), BelFunction.COMPLEX.getLabel());
      return null;
    }

    @Override
    public Void visitComplexList(ComplexList term) throws BelException {
      checkMembers(term.getMembers(), "Complex");
      return null;
    }

    @Override
    public Void visitComposite(CompositeAbundance term) throws BelException {
      checkMembers(term.getMembers(), "Composite");
      return null;
    }

    @Override
    public Void visitProcess(ProcessTerm term) throws BelException {
      requireIdentifier(term.getIdentifier(), term.getFunction().getLabel());
      return null;
    }

    @Override
    public Void visitReaction(Reaction term) throws BelException {
      checkMembers(term.getReactants(), "Reaction reactants");
      checkMembers(term.getProducts(), "Reaction products");
      return null;
    }

    @Override
    public Void visitActivity(Activity term) throws BelException {
      return requireTarget(term.getTarget(), "Activity");
    }

    @Override
    public Void visitTransformation(Transformation term) throws BelException {
      return requireTarget(term.getTarget(), term.getKind().getLabel());
    }

    @Override
    public Void visitAbundanceList(AbundanceList term) throws BelException {
      throw new UnsupportedTermException("list(...) does not denote a node; it is only allowed after hasMembers");
    }

    private Void requireTarget(AbundanceTerm target, String what) throws BelException {
      if (target == null) {
        throw new MalformedTermException(String.format("%s has no target", what));
      }
      return target.accept(this);
    }

    private void checkMembers(List<AbundanceTerm> members, String what) throws BelException {
      if (members.isEmpty()) {
        throw new MalformedTermException(String.format("%s has no members", what));
      }
      for (AbundanceTerm member : members) {
        member.accept(this);
      }
    }

    private static void requireIdentifier(NamespaceValue identifier, String what) throws MalformedTermException {
      if (identifier == null) {
        throw new MalformedTermException(String.format("%s has no identifier", what));
      }
    }
  }

  /**
   * Inserts checked terms. Activities and transformations resolve to their target's node.
   */
  private class NodeInserter implements TermVisitor<NodeKey, RuntimeException> {
    @Override
    public NodeKey visitSimpleAbundance(SimpleAbundance term) {
      BelFunction function = term.getFunction();
      NamespaceValue identifier = term.getIdentifier();
      NodeKey key = NodeKey.of(function.getLabel(), identifier.getNamespace(), identifier.getName());
      if (graph.hasNode(key)) {
        return key;
      }
      graph.addNode(key, namedNodeData(function.getLabel(), identifier));

      if (completeOrigin && function == BelFunction.PROTEIN) {
        NodeKey rna = new SimpleAbundance(BelFunction.RNA, identifier).accept(this);
        graph.addUnqualifiedEdge(rna, key, BelRelation.TRANSLATED_TO);
      } else if (completeOrigin && function == BelFunction.RNA) {
        NodeKey gene = new SimpleAbundance(BelFunction.GENE, identifier).accept(this);
        graph.addUnqualifiedEdge(gene, key, BelRelation.TRANSCRIBED_TO);
      }
      return key;
    }

    @Override
    public NodeKey visitModifiedAbundance(ModifiedAbundance term) {
      List<Variant> variants = VariantWriter.sorted(term.getVariants());
      List<Object> parts = new ArrayList<>();
      parts.add(term.getFunction().getLabel());
      parts.add(term.getIdentifier().getNamespace());
      parts.add(term.getIdentifier().getName());
      for (Variant variant : variants) {
        parts.add(variant.accept(VariantKeys.INSTANCE));
      }
      NodeKey key = NodeKey.of(parts);
      if (graph.hasNode(key)) {
        return key;
      }

      Map<String, Object> data = new LinkedHashMap<>();
      data.put(BelConstants.TYPE, term.getFunction().getLabel());
      data.put(BelConstants.VARIANTS, variants);
      graph.addNode(key, data);

      NodeKey parent = term.getParent().accept(this);
      graph.addUnqualifiedEdge(parent, key, BelRelation.HAS_VARIANT);
      return key;
    }

    @Override
    public NodeKey visitFusedAbundance(FusedAbundance term) {
      String type = term.getFunction().getFusionLabel();
      NodeKey key = NodeKey.of(VariantKeys.fusionTuple(type, term.getFusion()));
      Map<String, Object> data = new LinkedHashMap<>();
      data.put(BelConstants.TYPE, type);
      data.put(BelConstants.FUSION, term.getFusion());
      graph.addNode(key, data);
      return key;
    }

    @Override
    public NodeKey visitNamedComplex(NamedComplex term) {
      String type = BelFunction.COMPLEX.getLabel();
      NodeKey key = NodeKey.of(type, term.getIdentifier().getNamespace(), term.getIdentifier().getName());
      graph.addNode(key, namedNodeData(type, term.getIdentifier()));
      return key;
    }

    @Override
    public NodeKey visitComplexList(ComplexList term) {
      return insertAggregate(BelFunction.COMPLEX.getLabel(), term.getMembers());
    }

    @Override
    public NodeKey visitComposite(CompositeAbundance term) {
      return insertAggregate(BelFunction.COMPOSITE.getLabel(), term.getMembers());
    }

    @Override
    public NodeKey visitProcess(ProcessTerm term) {
      NodeKey key = NodeKey.of(term.getFunction().getLabel(),
          term.getIdentifier().getNamespace(), term.getIdentifier().getName());
      graph.addNode(key, namedNodeData(term.getFunction().getLabel(), term.getIdentifier()));
      return key;
    }

    @Override
    public NodeKey visitReaction(Reaction term) {
      String type = BelFunction.REACTION.getLabel();
      List<NodeKey> reactants = insertAll(term.getReactants());
      List<NodeKey> products = insertAll(term.getProducts());
      int id = interner.intern(NodeInterner.reactionTuple(type, reactants, products));
      NodeKey key = NodeKey.of(type, id);
      graph.addNode(key, typeOnly(type));
      for (NodeKey reactant : reactants) {
        graph.addUnqualifiedEdge(key, reactant, BelRelation.HAS_REACTANT);
      }
      for (NodeKey product : products) {
        graph.addUnqualifiedEdge(key, product, BelRelation.HAS_PRODUCT);
      }
      return key;
    }

    @Override
    public NodeKey visitActivity(Activity term) {
      return term.getTarget().accept(this);
    }

    @Override
    public NodeKey visitTransformation(Transformation term) {
      return term.getTarget().accept(this);
    }

    @Override
    public NodeKey visitAbundanceList(AbundanceList term) {
      throw new IllegalStateException("Lists must be rejected before insertion");
    }

    private NodeKey insertAggregate(String type, List<AbundanceTerm> members) {
      List<NodeKey> memberKeys = insertAll(members);
      int id = interner.intern(NodeInterner.memberTuple(type, memberKeys));
      NodeKey key = NodeKey.of(type, id);
      graph.addNode(key, typeOnly(type));
      for (NodeKey member : memberKeys) {
        graph.addUnqualifiedEdge(key, member, BelRelation.HAS_COMPONENT);
      }
      return key;
    }

    private List<NodeKey> insertAll(List<AbundanceTerm> terms) {
      List<NodeKey> keys = new ArrayList<>(terms.size());
      for (AbundanceTerm term : terms) {
        keys.add(term.accept(this));
      }
      return keys;
    }
  }

  private static Map<String, Object> namedNodeData(String type, NamespaceValue identifier) {
    Map<String, Object> data = typeOnly(type);
    data.put(BelConstants.NAMESPACE, identifier.getNamespace());
    data.put(BelConstants.NAME, identifier.getName());
    return data;
  }

  private static Map<String, Object> typeOnly(String type) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put(BelConstants.TYPE, type);
    return data;
  }
}
