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
import com.twentyn.bel.language.BelConstants;
import com.twentyn.bel.language.BelFunction;
import com.twentyn.bel.language.ModifierKind;
import com.twentyn.bel.language.MolecularActivity;
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
import com.twentyn.bel.model.Transformation;
import com.twentyn.bel.model.variant.Variant;
import com.twentyn.bel.parser.modifiers.FragmentParser;
import com.twentyn.bel.parser.modifiers.FusionParser;
import com.twentyn.bel.parser.modifiers.LocationParser;
import com.twentyn.bel.parser.modifiers.MolecularActivityParser;
import com.twentyn.bel.parser.modifiers.ProteinModificationParser;
import com.twentyn.bel.parser.modifiers.SubstitutionParser;
import com.twentyn.bel.parser.modifiers.TruncationParser;
import com.twentyn.bel.parser.modifiers.VariantParser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Recursive descent parser for BEL terms. The function tag at the start of a term selects the production; where a
 * function has several shapes (modified, simple and fused abundances, list and named complexes, the translocation
 * forms) they are tried in order with backtracking.
 */
public class TermParser implements GrammarRule<Term> {
  private final IdentifierParser identifierParser;
  private final LocationParser locationParser;
  private final FusionParser fusionParser;
  private final MolecularActivityParser molecularActivityParser;
  private final Map<BelFunction, List<ModifierParser<? extends Variant>>> variantParsers =
      new EnumMap<>(BelFunction.class);

  public TermParser(NamespaceValidator namespaceValidator) {
    this.identifierParser = new IdentifierParser(namespaceValidator);
    this.locationParser = new LocationParser(identifierParser);
    this.fusionParser = new FusionParser(identifierParser);
    this.molecularActivityParser = new MolecularActivityParser(identifierParser);

    VariantParser variantParser = new VariantParser();
    variantParsers.put(BelFunction.GENE, Arrays.asList(
        variantParser, new SubstitutionParser(SubstitutionParser.SequenceType.GENE)));
    variantParsers.put(BelFunction.MIRNA, Collections.singletonList(variantParser));
    variantParsers.put(BelFunction.RNA, Collections.singletonList(variantParser));
    variantParsers.put(BelFunction.PROTEIN, Arrays.asList(
        new ProteinModificationParser(identifierParser),
        variantParser,
        new FragmentParser(),
        new SubstitutionParser(SubstitutionParser.SequenceType.PROTEIN),
        new TruncationParser()));
  }

  /**
   * Parses a complete term. The whole text must be consumed.
   */
  public Term parseTerm(String text) throws BelException {
    BelScanner scanner = new BelScanner(text);
    Term term = parse(scanner);
    scanner.expectEnd();
    return term;
  }

  @Override
  public Term parse(BelScanner scanner) throws BelException {
    String tag = peekTag(scanner, "a BEL term");

    Optional<BelFunction> function = BelFunction.fromTag(tag);
    if (function.isPresent()) {
      switch (function.get()) {
        case ABUNDANCE:
        case GENE:
        case MIRNA:
        case PROTEIN:
        case RNA:
          return parseSingleAbundance(scanner, function.get());
        case COMPLEX:
          return parseComplex(scanner);
        case COMPOSITE:
          return parseComposite(scanner);
        case BIOLOGICAL_PROCESS:
        case PATHOLOGY:
          return parseProcess(scanner, function.get());
        case REACTION:
          return parseReaction(scanner);
        case LIST:
          return parseList(scanner);
        default:
          throw new IllegalStateException(String.format("No production for function %s", function.get()));
      }
    }

    Optional<ModifierKind> modifier = ModifierKind.fromTag(tag);
    if (modifier.isPresent()) {
      switch (modifier.get()) {
        case ACTIVITY:
          return parseActivity(scanner);
        case TRANSLOCATION:
          return parseTranslocation(scanner);
        default:
          return parseTransformation(scanner, modifier.get());
      }
    }

    if (MolecularActivity.fromToken(tag).isPresent()) {
      return parseLegacyActivity(scanner);
    }

    throw new BelSyntaxException(String.format("Unknown function %s", tag), scanner.getPosition());
  }

  /**
   * Any abundance: a single abundance, a complex or a composite.
   */
  public AbundanceTerm parseAbundance(BelScanner scanner) throws BelException {
    String tag = peekTag(scanner, "an abundance");
    if (BelFunction.fromTag(tag).orElse(null) == BelFunction.COMPOSITE) {
      return parseComposite(scanner);
    }
    return parseSimpleAbundance(scanner);
  }

  /**
   * A single abundance or a complex. This is what reactions, composites and transformations are built from.
   */
  public AbundanceTerm parseSimpleAbundance(BelScanner scanner) throws BelException {
    String tag = peekTag(scanner, "an abundance");
    BelFunction function = BelFunction.fromTag(tag).orElse(null);
    if (function == BelFunction.COMPLEX) {
      return parseComplex(scanner);
    }
    if (isSingleAbundance(function)) {
      return parseSingleAbundance(scanner, function);
    }
    throw scanner.error("an abundance");
  }

  private AbundanceTerm parseSingleAbundance(BelScanner scanner, BelFunction function) throws BelException {
    List<GrammarRule<? extends AbundanceTerm>> shapes = new ArrayList<>();
    if (variantParsers.containsKey(function)) {
      shapes.add(s -> parseModified(s, function));
    }
    shapes.add(s -> parseSimple(s, function));
    if (function == BelFunction.GENE || function == BelFunction.RNA || function == BelFunction.PROTEIN) {
      shapes.add(s -> parseFused(s, function));
    }
    return scanner.firstOf(String.format("%s(...)", function.getShortTag()), shapes);
  }

  private SimpleAbundance parseSimple(BelScanner scanner, BelFunction function) throws BelException {
    scanner.openFunction(function.getShortTag(), function.getLongTag());
    NamespaceValue identifier = identifierParser.parse(scanner);
    NamespaceValue location = parseOptionalLocation(scanner);
    scanner.expect(')');
    return new SimpleAbundance(function, identifier, location);
  }

  private ModifiedAbundance parseModified(BelScanner scanner, BelFunction function) throws BelException {
    scanner.openFunction(function.getShortTag(), function.getLongTag());
    NamespaceValue identifier = identifierParser.parse(scanner);
    scanner.expect(',');

    List<Variant> variants = new ArrayList<>();
    variants.add(parseVariant(scanner, function));
    NamespaceValue location = null;
    while (scanner.tryConsume(',')) {
      if (isLocationNext(scanner)) {
        location = locationParser.parse(scanner);
        break;
      }
      variants.add(parseVariant(scanner, function));
    }
    scanner.expect(')');
    return new ModifiedAbundance(function, identifier, variants, location);
  }

  private Variant parseVariant(BelScanner scanner, BelFunction function) throws BelException {
    String tag = peekTag(scanner, "a variant");
    for (ModifierParser<? extends Variant> parser : variantParsers.get(function)) {
      if (parser.acceptsTag(tag)) {
        return parser.parse(scanner);
      }
    }
    throw new BelSyntaxException(
        String.format("%s(...) is not a variant of %s", tag, function.getLabel()), scanner.getPosition());
  }

  private FusedAbundance parseFused(BelScanner scanner, BelFunction function) throws BelException {
    scanner.openFunction(function.getShortTag(), function.getLongTag());
    Fusion fusion = fusionParser.parse(scanner);
    NamespaceValue location = parseOptionalLocation(scanner);
    scanner.expect(')');
    return new FusedAbundance(function, fusion, location);
  }

  private AbundanceTerm parseComplex(BelScanner scanner) throws BelException {
    List<GrammarRule<? extends AbundanceTerm>> shapes = Arrays.asList(this::parseComplexList, this::parseNamedComplex);
    return scanner.firstOf("complex(...)", shapes);
  }

  private ComplexList parseComplexList(BelScanner scanner) throws BelException {
    scanner.openFunction(BelFunction.COMPLEX.getShortTag(), BelFunction.COMPLEX.getLongTag());
    List<AbundanceTerm> members = new ArrayList<>();
    members.add(parseComplexMember(scanner));
    NamespaceValue location = null;
    while (scanner.tryConsume(',')) {
      if (isLocationNext(scanner)) {
        location = locationParser.parse(scanner);
        break;
      }
      members.add(parseComplexMember(scanner));
    }
    scanner.expect(')');
    return new ComplexList(members, location);
  }

  private AbundanceTerm parseComplexMember(BelScanner scanner) throws BelException {
    String tag = peekTag(scanner, "a complex member");
    BelFunction function = BelFunction.fromTag(tag).orElse(null);
    if (function == BelFunction.COMPLEX) {
      return parseNamedComplex(scanner);
    }
    if (isSingleAbundance(function)) {
      return parseSingleAbundance(scanner, function);
    }
    throw scanner.error("a complex member");
  }

  private NamedComplex parseNamedComplex(BelScanner scanner) throws BelException {
    scanner.openFunction(BelFunction.COMPLEX.getShortTag(), BelFunction.COMPLEX.getLongTag());
    NamespaceValue identifier = identifierParser.parse(scanner);
    NamespaceValue location = parseOptionalLocation(scanner);
    scanner.expect(')');
    return new NamedComplex(identifier, location);
  }

  private CompositeAbundance parseComposite(BelScanner scanner) throws BelException {
    scanner.openFunction(BelFunction.COMPOSITE.getShortTag(), BelFunction.COMPOSITE.getLongTag());
    List<AbundanceTerm> members = new ArrayList<>();
    members.add(parseSimpleAbundance(scanner));
    NamespaceValue location = null;
    while (scanner.tryConsume(',')) {
      if (isLocationNext(scanner)) {
        location = locationParser.parse(scanner);
        break;
      }
      members.add(parseSimpleAbundance(scanner));
    }
    scanner.expect(')');
    return new CompositeAbundance(members, location);
  }

  private ProcessTerm parseProcess(BelScanner scanner, BelFunction function) throws BelException {
    scanner.openFunction(function.getShortTag(), function.getLongTag());
    NamespaceValue identifier = identifierParser.parse(scanner);
    scanner.expect(')');
    return new ProcessTerm(function, identifier);
  }

  private Reaction parseReaction(BelScanner scanner) throws BelException {
    scanner.openFunction(BelFunction.REACTION.getShortTag(), BelFunction.REACTION.getLongTag());
    scanner.openFunction("reactants");
    List<AbundanceTerm> reactants = parseSimpleAbundanceList(scanner);
    scanner.expect(')');
    scanner.expect(',');
    scanner.openFunction("products");
    List<AbundanceTerm> products = parseSimpleAbundanceList(scanner);
    scanner.expect(')');
    scanner.expect(')');
    return new Reaction(reactants, products);
  }

  private List<AbundanceTerm> parseSimpleAbundanceList(BelScanner scanner) throws BelException {
    List<AbundanceTerm> members = new ArrayList<>();
    do {
      members.add(parseSimpleAbundance(scanner));
    } while (scanner.tryConsume(','));
    return members;
  }

  private AbundanceList parseList(BelScanner scanner) throws BelException {
    scanner.openFunction(BelFunction.LIST.getShortTag());
    List<AbundanceTerm> members = new ArrayList<>();
    do {
      members.add(parseAbundance(scanner));
    } while (scanner.tryConsume(','));
    scanner.expect(')');
    return new AbundanceList(members);
  }

  private Activity parseActivity(BelScanner scanner) throws BelException {
    scanner.openFunction(ModifierKind.ACTIVITY.getShortTag(), "activity");
    AbundanceTerm target = parseAbundance(scanner);
    NamespaceValue molecularActivity = null;
    if (scanner.tryConsume(',')) {
      molecularActivity = molecularActivityParser.parse(scanner);
    }
    scanner.expect(')');
    return new Activity(target, molecularActivity);
  }

  /**
   * BEL 1.0 wrote activities as their own functions, kin(p(HGNC:AKT1)). These become act(p(HGNC:AKT1), ma(kin)).
   */
  private Activity parseLegacyActivity(BelScanner scanner) throws BelException {
    String tag = scanner.openFunction();
    MolecularActivity activity = MolecularActivity.fromToken(tag)
        .orElseThrow(() -> scanner.error("a molecular activity"));
    AbundanceTerm target = parseAbundance(scanner);
    scanner.expect(')');
    scanner.addLegacyWarning("Legacy activity %s(...), use act(..., ma(%s))", tag, activity.getCode());
    return new Activity(target, new NamespaceValue(BelConstants.BEL_DEFAULT_NAMESPACE, activity.getCode()));
  }

  private Transformation parseTransformation(BelScanner scanner, ModifierKind kind) throws BelException {
    scanner.openFunction();
    AbundanceTerm target = parseSimpleAbundance(scanner);
    scanner.expect(')');
    return new Transformation(kind, target);
  }

  private Transformation parseTranslocation(BelScanner scanner) throws BelException {
    List<GrammarRule<? extends Transformation>> shapes = Arrays.asList(
        this::parseStandardTranslocation, this::parseLegacyTranslocation, this::parseSingletonTranslocation);
    return scanner.firstOf("tloc(...)", shapes);
  }

  private Transformation parseStandardTranslocation(BelScanner scanner) throws BelException {
    scanner.openFunction();
    AbundanceTerm target = parseSimpleAbundance(scanner);
    scanner.expect(',');
    scanner.openFunction("fromLoc");
    NamespaceValue from = identifierParser.parse(scanner);
    scanner.expect(')');
    scanner.expect(',');
    scanner.openFunction("toLoc");
    NamespaceValue to = identifierParser.parse(scanner);
    scanner.expect(')');
    scanner.expect(')');
    return new Transformation(ModifierKind.TRANSLOCATION, target, from, to);
  }

  private Transformation parseLegacyTranslocation(BelScanner scanner) throws BelException {
    scanner.openFunction();
    AbundanceTerm target = parseSimpleAbundance(scanner);
    scanner.expect(',');
    NamespaceValue from = identifierParser.parse(scanner);
    scanner.expect(',');
    NamespaceValue to = identifierParser.parse(scanner);
    scanner.expect(')');
    scanner.addLegacyWarning("Legacy translocation, use fromLoc(...) and toLoc(...)");
    return new Transformation(ModifierKind.TRANSLOCATION, target, from, to);
  }

  private Transformation parseSingletonTranslocation(BelScanner scanner) throws BelException {
    scanner.openFunction();
    AbundanceTerm target = parseSimpleAbundance(scanner);
    scanner.expect(')');
    scanner.addLegacyWarning("Legacy translocation without locations");
    return new Transformation(ModifierKind.TRANSLOCATION, target);
  }

  private NamespaceValue parseOptionalLocation(BelScanner scanner) throws BelException {
    if (scanner.tryConsume(',')) {
      return locationParser.parse(scanner);
    }
    return null;
  }

  private boolean isLocationNext(BelScanner scanner) {
    Optional<String> tag = scanner.peekFunctionTag();
    return tag.isPresent() && locationParser.acceptsTag(tag.get());
  }

  private static String peekTag(BelScanner scanner, String expected) throws BelSyntaxException {
    Optional<String> tag = scanner.peekFunctionTag();
    if (!tag.isPresent()) {
      throw scanner.error(expected);
    }
    return tag.get();
  }

  private static boolean isSingleAbundance(BelFunction function) {
    return function == BelFunction.ABUNDANCE || function == BelFunction.GENE || function == BelFunction.MIRNA
        || function == BelFunction.PROTEIN || function == BelFunction.RNA;
  }
}
