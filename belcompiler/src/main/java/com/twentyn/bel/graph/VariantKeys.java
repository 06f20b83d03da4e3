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

import com.twentyn.bel.model.Fusion;
import com.twentyn.bel.model.FusionRange;
import com.twentyn.bel.model.variant.Fragment;
import com.twentyn.bel.model.variant.HgvsVariant;
import com.twentyn.bel.model.variant.ProteinModification;
import com.twentyn.bel.model.variant.Substitution;
import com.twentyn.bel.model.variant.Truncation;
import com.twentyn.bel.model.variant.VariantVisitor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Turns variants and fusion ranges into the tuples that make up node keys.
 */
class VariantKeys implements VariantVisitor<List<Object>> {
  static final VariantKeys INSTANCE = new VariantKeys();

  @Override
  public List<Object> visitProteinModification(ProteinModification modification) {
    List<Object> tuple = new ArrayList<>();
    tuple.add("pmod");
    tuple.add(modification.getModification().getNamespace());
    tuple.add(modification.getModification().getName());
    if (modification.getAminoAcid().isPresent()) {
      tuple.add(modification.getAminoAcid().get().getThreeLetterCode());
    }
    if (modification.getPosition().isPresent()) {
      tuple.add(modification.getPosition().get());
    }
    return Collections.unmodifiableList(tuple);
  }

  @Override
  public List<Object> visitHgvsVariant(HgvsVariant variant) {
    return Collections.unmodifiableList(Arrays.<Object>asList("var", variant.getDescription()));
  }

  @Override
  public List<Object> visitFragment(Fragment fragment) {
    List<Object> tuple = new ArrayList<>();
    tuple.add("frag");
    if (fragment.isMissing()) {
      tuple.add("?");
    } else {
      tuple.add(fragment.getStart().toKeyPart());
      tuple.add(fragment.getStop().toKeyPart());
    }
    if (fragment.getDescription().isPresent()) {
      tuple.add(fragment.getDescription().get());
    }
    return Collections.unmodifiableList(tuple);
  }

  @Override
  public List<Object> visitSubstitution(Substitution substitution) {
    return Collections.unmodifiableList(Arrays.<Object>asList(
        "sub", substitution.getReference(), substitution.getPosition(), substitution.getVariant()));
  }

  @Override
  public List<Object> visitTruncation(Truncation truncation) {
    return Collections.unmodifiableList(Arrays.<Object>asList("trunc", truncation.getPosition()));
  }

  static List<Object> rangeTuple(FusionRange range) {
    if (range.isMissing()) {
      return Collections.singletonList("?");
    }
    return Collections.unmodifiableList(Arrays.<Object>asList(
        String.valueOf(range.getReference()), range.getStart().toKeyPart(), range.getStop().toKeyPart()));
  }

  static List<Object> fusionTuple(String type, Fusion fusion) {
    return Arrays.<Object>asList(type,
        fusion.getPartner5p().getNamespace(), fusion.getPartner5p().getName(), rangeTuple(fusion.getRange5p()),
        fusion.getPartner3p().getNamespace(), fusion.getPartner3p().getName(), rangeTuple(fusion.getRange3p()));
  }
}
