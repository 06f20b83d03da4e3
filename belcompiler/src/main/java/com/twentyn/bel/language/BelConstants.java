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

package com.twentyn.bel.language;

/**
 * Attribute keys and fixed values shared by the graph builder, the writers and the metadata parsers.
 */
public final class BelConstants {
  private BelConstants() {
  }

  public static final String BEL_DEFAULT_NAMESPACE = "bel";

  // Node attributes.
  public static final String TYPE = "type";
  public static final String NAMESPACE = "namespace";
  public static final String NAME = "name";
  public static final String IDENTIFIER = "identifier";
  public static final String VARIANTS = "variants";
  public static final String FUSION = "fusion";

  // Edge attributes.
  public static final String RELATION = "relation";
  public static final String SUBJECT = "subject";
  public static final String OBJECT = "object";
  public static final String CITATION = "citation";
  public static final String EVIDENCE = "evidence";
  public static final String ANNOTATIONS = "annotations";

  // Modifier dictionaries.
  public static final String MODIFIER = "modifier";
  public static final String EFFECT = "effect";
  public static final String LOCATION = "location";
  public static final String FROM_LOC = "fromLoc";
  public static final String TO_LOC = "toLoc";

  public static final String ACTIVITY = "Activity";
  public static final String DEGRADATION = "Degradation";
  public static final String TRANSLOCATION = "Translocation";
  public static final String CELL_SECRETION = "CellSecretion";
  public static final String CELL_SURFACE_EXPRESSION = "CellSurfaceExpression";

  // Cellular component namespace used for implied translocation endpoints.
  public static final String GOCC = "GOCC";
  public static final String INTRACELLULAR = "intracellular";
  public static final String EXTRACELLULAR_SPACE = "extracellular space";
  public static final String CELL_SURFACE = "cell surface";

  // Citation fields, in the order they appear inside SET Citation = {...}.
  public static final String CITATION_TYPE = "type";
  public static final String CITATION_NAME = "name";
  public static final String CITATION_REFERENCE = "reference";
  public static final String CITATION_DATE = "date";
  public static final String CITATION_AUTHORS = "authors";
  public static final String CITATION_COMMENTS = "comments";

  // Document metadata keys.
  public static final String DOCUMENT_NAME = "name";
  public static final String DOCUMENT_VERSION = "version";
  public static final String DOCUMENT_DESCRIPTION = "description";
  public static final String DOCUMENT_AUTHORS = "authors";
  public static final String DOCUMENT_CONTACT = "contact";
  public static final String DOCUMENT_COPYRIGHT = "copyright";
  public static final String DOCUMENT_LICENSES = "licenses";
  public static final String DOCUMENT_DISCLAIMER = "disclaimer";
}
