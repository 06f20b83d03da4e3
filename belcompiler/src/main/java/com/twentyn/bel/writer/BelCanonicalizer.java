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
import com.twentyn.bel.language.BelFunction;
import com.twentyn.bel.language.BelQuoting;
import com.twentyn.bel.language.BelRelation;
import com.twentyn.bel.language.ModifierKind;
import com.twentyn.bel.model.AbundanceList;
import com.twentyn.bel.model.AbundanceTerm;
import com.twentyn.bel.model.Activity;
import com.twentyn.bel.model.ComplexList;
import com.twentyn.bel.model.CompositeAbundance;
import com.twentyn.bel.model.FusedAbundance;
import com.twentyn.bel.model.Fusion;
import com.twentyn.bel.model.ModifiedAbundance;
import com.twentyn.bel.model.NamedComplex;
import com.twentyn.bel.model.NamespaceValue;
import com.twentyn.bel.model.ProcessTerm;
import com.twentyn.bel.model.Reaction;
import com.twentyn.bel.model.SimpleAbundance;
import com.twentyn.bel.model.Term;
import com.twentyn.bel.model.TermVisitor;
import com.twentyn.bel.model.Transformation;
import com.twentyn.bel.model.variant.Variant;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Writes terms, graph nodes and statement edges back out as BEL. Parsing the output gives back the same nodes and
 * edges; member and variant lists come out sorted by their own text, so equivalent inputs produce the same output.
 */
public class BelCanonicalizer {
  private static final String FUSION_SUFFIX = "Fusion";

  private final TermWriter termWriter = new TermWriter();

  public String writeTerm(Term term) {
    return term.accept(termWriter);
  }

  /**
   * Reconstructs a node's term from its data, from its membership edges for aggregates, and from its hasVariant
   * parent for variant nodes.
   */
  public String writeNode(BelGraph graph, NodeKey key) {
    Map<String, Object> data = graph.getNodeData(key).orElseThrow(
        () -> new IllegalArgumentException(String.format("No node %s in graph", key)));
    String type = (String) data.get(BelConstants.TYPE);

    if (type.endsWith(FUSION_SUFFIX) && data.containsKey(BelConstants.FUSION)) {
      BelFunction function = functionForLabel(StringUtils.removeEnd(type, FUSION_SUFFIX));
      return call(function.getShortTag(), writeFusion((Fusion) data.get(BelConstants.FUSION)));
    }

    if (data.containsKey(BelConstants.VARIANTS)) {
      String term = writeNode(graph, variantParent(graph, key));
      for (Object variant : (List<?>) data.get(BelConstants.VARIANTS)) {
        term = insertArgument(term, VariantWriter.write((Variant) variant));
      }
      return term;
    }

    BelFunction function = functionForLabel(type);
    if (data.containsKey(BelConstants.NAMESPACE)) {
      return call(function.getShortTag(),
          BelQuoting.namespaced((String) data.get(BelConstants.NAMESPACE), (String) data.get(BelConstants.NAME)));
    }

    if (function == BelFunction.REACTION) {
      String reactants = call("reactants", sortedMembers(graph, key, BelRelation.HAS_REACTANT));
      String products = call("products", sortedMembers(graph, key, BelRelation.HAS_PRODUCT));
      return call(function.getShortTag(), reactants, products);
    }
    return call(function.getShortTag(), sortedMembers(graph, key, BelRelation.HAS_COMPONENT));
  }

  // Variant nodes carry only their variants; the name comes from the unmodified node.
  private static NodeKey variantParent(BelGraph graph, NodeKey key) {
    for (BelEdge edge : graph.getInEdges(key)) {
      if (!edge.isQualified() && BelRelation.HAS_VARIANT.getName().equals(edge.getRelation())) {
        return edge.getSource();
      }
    }
    throw new IllegalStateException(String.format("Variant node %s has no %s parent", key,
        BelRelation.HAS_VARIANT.getName()));
  }

  private List<String> sortedMembers(BelGraph graph, NodeKey key, BelRelation relation) {
    List<String> members = new ArrayList<>();
    for (BelEdge edge : graph.getOutEdges(key)) {
      if (!edge.isQualified() && relation.getName().equals(edge.getRelation())) {
        members.add(writeNode(graph, edge.getTarget()));
      }
    }
    Collections.sort(members);
    return members;
  }

  /**
   * Writes a qualified edge as a subject-relation-object statement, wrapping each side in its modifier.
   */
  public String writeStatement(BelGraph graph, BelEdge edge) throws UnknownModifierException {
    Map<String, Object> attributes = edge.getAttributes();
    String subject = applyModifier(writeNode(graph, edge.getSource()), attributes.get(BelConstants.SUBJECT));
    String object = applyModifier(writeNode(graph, edge.getTarget()), attributes.get(BelConstants.OBJECT));
    return String.format("%s %s %s", subject, edge.getRelation(), object);
  }

  private String applyModifier(String term, Object dictionary) throws UnknownModifierException {
    if (dictionary == null) {
      return term;
    }
    Map<?, ?> modifier = (Map<?, ?>) dictionary;

    Object location = modifier.get(BelConstants.LOCATION);
    if (location != null) {
      term = insertArgument(term, call("loc", entity(location).toString()));
    }

    Object label = modifier.get(BelConstants.MODIFIER);
    if (label == null) {
      return term;
    }
    Optional<ModifierKind> kind = ModifierKind.fromLabel(label.toString());
    if (!kind.isPresent()) {
      throw new UnknownModifierException(label);
    }
    Map<?, ?> effect = (Map<?, ?>) modifier.get(BelConstants.EFFECT);

    switch (kind.get()) {
      case ACTIVITY:
        if (effect == null) {
          return call(kind.get().getShortTag(), term);
        }
        return call(kind.get().getShortTag(), term, writeMolecularActivity(entity(effect)));
      case TRANSLOCATION:
        if (effect == null) {
          return call(kind.get().getShortTag(), term);
        }
        return call(kind.get().getShortTag(), term,
            call(BelConstants.FROM_LOC, entity(effect.get(BelConstants.FROM_LOC)).toString()),
            call(BelConstants.TO_LOC, entity(effect.get(BelConstants.TO_LOC)).toString()));
      case DEGRADATION:
      case CELL_SECRETION:
      case CELL_SURFACE_EXPRESSION:
        return call(kind.get().getShortTag(), term);
      default:
        throw new UnknownModifierException(label);
    }
  }

  private static NamespaceValue entity(Object value) {
    Map<?, ?> entity = (Map<?, ?>) value;
    return new NamespaceValue((String) entity.get(BelConstants.NAMESPACE), (String) entity.get(BelConstants.NAME));
  }

  private static String writeMolecularActivity(NamespaceValue activity) {
    if (BelConstants.BEL_DEFAULT_NAMESPACE.equals(activity.getNamespace())) {
      return call("ma", activity.getName());
    }
    return call("ma", activity.toString());
  }

  private static String writeFusion(Fusion fusion) {
    return call("fus", fusion.getPartner5p().toString(), fusion.getRange5p().toString(),
        fusion.getPartner3p().toString(), fusion.getRange3p().toString());
  }

  /**
   * Adds an argument at the end of a term's outermost argument list.
   */
  static String insertArgument(String term, String argument) {
    int close = term.lastIndexOf(')');
    if (close < 0) {
      throw new IllegalArgumentException(String.format("Not a function call: %s", term));
    }
    return String.format("%s, %s%s", term.substring(0, close), argument, term.substring(close));
  }

  private static String call(String tag, String... arguments) {
    return call(tag, Arrays.asList(arguments));
  }

  private static String call(String tag, List<String> arguments) {
    return String.format("%s(%s)", tag, StringUtils.join(arguments, ", "));
  }

  private static BelFunction functionForLabel(String label) {
    return BelFunction.fromLabel(label).orElseThrow(
        () -> new IllegalArgumentException(String.format("Unknown node type %s", label)));
  }

  private class TermWriter implements TermVisitor<String, RuntimeException> {
    @Override
    public String visitSimpleAbundance(SimpleAbundance term) {
      List<String> arguments = new ArrayList<>();
      arguments.add(term.getIdentifier().toString());
      return withLocation(term, term.getFunction().getShortTag(), arguments);
    }

    @Override
    public String visitModifiedAbundance(ModifiedAbundance term) {
      List<String> arguments = new ArrayList<>();
      arguments.add(term.getIdentifier().toString());
      for (Variant variant : VariantWriter.sorted(term.getVariants())) {
        arguments.add(VariantWriter.write(variant));
      }
      return withLocation(term, term.getFunction().getShortTag(), arguments);
    }

    @Override
    public String visitFusedAbundance(FusedAbundance term) {
      List<String> arguments = new ArrayList<>();
      arguments.add(writeFusion(term.getFusion()));
      return withLocation(term, term.getFunction().getShortTag(), arguments);
    }

    @Override
    public String visitNamedComplex(NamedComplex term) {
      List<String> arguments = new ArrayList<>();
      arguments.add(term.getIdentifier().toString());
      return withLocation(term, BelFunction.COMPLEX.getShortTag(), arguments);
    }

    @Override
    public String visitComplexList(ComplexList term) {
      return withLocation(term, BelFunction.COMPLEX.getShortTag(), sorted(term.getMembers()));
    }

    @Override
    public String visitComposite(CompositeAbundance term) {
      return withLocation(term, BelFunction.COMPOSITE.getShortTag(), sorted(term.getMembers()));
    }

    @Override
    public String visitProcess(ProcessTerm term) {
      return call(term.getFunction().getShortTag(), term.getIdentifier().toString());
    }

    @Override
    public String visitReaction(Reaction term) {
      return call(BelFunction.REACTION.getShortTag(),
          call("reactants", sorted(term.getReactants())), call("products", sorted(term.getProducts())));
    }

    @Override
    public String visitActivity(Activity term) {
      String target = term.getTarget().accept(this);
      if (term.getMolecularActivity().isPresent()) {
        return call(ModifierKind.ACTIVITY.getShortTag(), target,
            writeMolecularActivity(term.getMolecularActivity().get()));
      }
      return call(ModifierKind.ACTIVITY.getShortTag(), target);
    }

    @Override
    public String visitTransformation(Transformation term) {
      String target = term.getTarget().accept(this);
      if (term.getFromLocation().isPresent() && term.getToLocation().isPresent()) {
        return call(term.getKind().getShortTag(), target,
            call(BelConstants.FROM_LOC, term.getFromLocation().get().toString()),
            call(BelConstants.TO_LOC, term.getToLocation().get().toString()));
      }
      return call(term.getKind().getShortTag(), target);
    }

    @Override
    public String visitAbundanceList(AbundanceList term) {
      List<String> members = new ArrayList<>();
      for (AbundanceTerm member : term.getMembers()) {
        members.add(member.accept(this));
      }
      return call(BelFunction.LIST.getShortTag(), members);
    }

    private List<String> sorted(List<AbundanceTerm> terms) {
      List<String> written = new ArrayList<>();
      for (AbundanceTerm term : terms) {
        written.add(term.accept(this));
      }
      Collections.sort(written);
      return written;
    }

    private String withLocation(AbundanceTerm term, String tag, List<String> arguments) {
      if (term.getLocation().isPresent()) {
        arguments.add(call("loc", term.getLocation().get().toString()));
      }
      return call(tag, arguments);
    }
  }
}
