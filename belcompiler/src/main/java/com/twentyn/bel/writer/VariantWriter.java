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

import com.twentyn.bel.language.BelConstants;
import com.twentyn.bel.language.BelQuoting;
import com.twentyn.bel.model.NamespaceValue;
import com.twentyn.bel.model.variant.Fragment;
import com.twentyn.bel.model.variant.HgvsVariant;
import com.twentyn.bel.model.variant.ProteinModification;
import com.twentyn.bel.model.variant.Substitution;
import com.twentyn.bel.model.variant.Truncation;
import com.twentyn.bel.model.variant.Variant;
import com.twentyn.bel.model.variant.VariantVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Writes a variant in its canonical BEL 2.0 spelling. Legacy substitutions and truncations keep their own
 * function names so that writing and re-reading a graph gives back the same variants.
 */
public class VariantWriter implements VariantVisitor<String> {
  public static final VariantWriter INSTANCE = new VariantWriter();

  public static final Comparator<Variant> CANONICAL_ORDER =
      Comparator.comparing(variant -> variant.accept(INSTANCE));

  public static String write(Variant variant) {
    return variant.accept(INSTANCE);
  }

  public static List<Variant> sorted(List<? extends Variant> variants) {
    List<Variant> result = new ArrayList<>(variants);
    Collections.sort(result, CANONICAL_ORDER);
    return result;
  }

  @Override
  public String visitProteinModification(ProteinModification modification) {
    StringBuilder builder = new StringBuilder("pmod(");
    NamespaceValue name = modification.getModification();
    if (BelConstants.BEL_DEFAULT_NAMESPACE.equals(name.getNamespace())) {
      builder.append(BelQuoting.ensureQuotes(name.getName()));
    } else {
      builder.append(name);
    }
    if (modification.getAminoAcid().isPresent()) {
      builder.append(", ").append(modification.getAminoAcid().get().getThreeLetterCode());
    }
    if (modification.getPosition().isPresent()) {
      builder.append(", ").append(modification.getPosition().get());
    }
    return builder.append(')').toString();
  }

  @Override
  public String visitHgvsVariant(HgvsVariant variant) {
    return String.format("var(%s)", BelQuoting.quote(variant.getDescription()));
  }

  @Override
  public String visitFragment(Fragment fragment) {
    String range = fragment.isMissing()
        ? "?"
        : String.format("%s_%s", fragment.getStart(), fragment.getStop());
    if (fragment.getDescription().isPresent()) {
      return String.format("frag(%s, %s)", BelQuoting.quote(range), BelQuoting.quote(fragment.getDescription().get()));
    }
    return String.format("frag(%s)", BelQuoting.quote(range));
  }

  @Override
  public String visitSubstitution(Substitution substitution) {
    return String.format("sub(%s, %d, %s)",
        substitution.getReference(), substitution.getPosition(), substitution.getVariant());
  }

  @Override
  public String visitTruncation(Truncation truncation) {
    return String.format("trunc(%d)", truncation.getPosition());
  }
}
