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

package com.twentyn.bel.model;

import com.twentyn.bel.language.AminoAcid;
import com.twentyn.bel.language.BelConstants;
import com.twentyn.bel.language.BelFunction;
import com.twentyn.bel.language.MolecularActivity;
import com.twentyn.bel.language.ModifierKind;
import com.twentyn.bel.model.variant.HgvsVariant;
import com.twentyn.bel.model.variant.ProteinModification;
import com.twentyn.bel.model.variant.Variant;

import java.util.Arrays;
import java.util.List;

/**
 * Shorthand constructors for building terms in code rather than parsing them from text.
 */
public final class BelTerms {
  private BelTerms() {
  }

  public static NamespaceValue id(String namespace, String name) {
    return new NamespaceValue(namespace, name);
  }

  public static SimpleAbundance abundance(String namespace, String name) {
    return new SimpleAbundance(BelFunction.ABUNDANCE, id(namespace, name));
  }

  public static SimpleAbundance gene(String namespace, String name) {
    return new SimpleAbundance(BelFunction.GENE, id(namespace, name));
  }

  public static SimpleAbundance rna(String namespace, String name) {
    return new SimpleAbundance(BelFunction.RNA, id(namespace, name));
  }

  public static SimpleAbundance mirna(String namespace, String name) {
    return new SimpleAbundance(BelFunction.MIRNA, id(namespace, name));
  }

  public static SimpleAbundance protein(String namespace, String name) {
    return new SimpleAbundance(BelFunction.PROTEIN, id(namespace, name));
  }

  public static ModifiedAbundance protein(String namespace, String name, Variant... variants) {
    return new ModifiedAbundance(BelFunction.PROTEIN, id(namespace, name), Arrays.asList(variants));
  }

  public static ModifiedAbundance gene(String namespace, String name, Variant... variants) {
    return new ModifiedAbundance(BelFunction.GENE, id(namespace, name), Arrays.asList(variants));
  }

  public static NamedComplex namedComplex(String namespace, String name) {
    return new NamedComplex(id(namespace, name));
  }

  public static ComplexList complex(AbundanceTerm... members) {
    return new ComplexList(Arrays.asList(members));
  }

  public static CompositeAbundance composite(AbundanceTerm... members) {
    return new CompositeAbundance(Arrays.asList(members));
  }

  public static ProcessTerm biologicalProcess(String namespace, String name) {
    return new ProcessTerm(BelFunction.BIOLOGICAL_PROCESS, id(namespace, name));
  }

  public static ProcessTerm pathology(String namespace, String name) {
    return new ProcessTerm(BelFunction.PATHOLOGY, id(namespace, name));
  }

  public static Reaction reaction(List<? extends AbundanceTerm> reactants, List<? extends AbundanceTerm> products) {
    return new Reaction(reactants, products);
  }

  public static ProteinModification pmod(String code) {
    return new ProteinModification(id(BelConstants.BEL_DEFAULT_NAMESPACE, code), null, null);
  }

  public static ProteinModification pmod(String code, AminoAcid aminoAcid, int position) {
    return new ProteinModification(id(BelConstants.BEL_DEFAULT_NAMESPACE, code), aminoAcid, position);
  }

  public static HgvsVariant hgvs(String description) {
    return new HgvsVariant(description);
  }

  public static Activity activity(AbundanceTerm target, MolecularActivity molecularActivity) {
    return new Activity(target, id(BelConstants.BEL_DEFAULT_NAMESPACE, molecularActivity.getCode()));
  }

  public static Activity activity(AbundanceTerm target) {
    return new Activity(target, null);
  }

  public static Transformation degradation(AbundanceTerm target) {
    return new Transformation(ModifierKind.DEGRADATION, target);
  }

  public static Transformation translocation(AbundanceTerm target, NamespaceValue from, NamespaceValue to) {
    return new Transformation(ModifierKind.TRANSLOCATION, target, from, to);
  }
}
