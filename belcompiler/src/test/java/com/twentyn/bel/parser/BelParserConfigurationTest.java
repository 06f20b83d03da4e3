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

import org.junit.Test;

import java.util.Arrays;
import java.util.Properties;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class BelParserConfigurationTest {

  @Test
  public void testLoadDefault() throws Exception {
    BelParserConfiguration configuration = BelParserConfiguration.loadDefault();
    assertFalse("Completion is off by default", configuration.isCompleteOrigin());
    assertFalse("Nesting is off by default", configuration.isAllowNested());
    assertEquals("Default required keys", BelParserConfiguration.DEFAULT_REQUIRED_DOCUMENT_KEYS,
        configuration.getRequiredDocumentKeys());
  }

  @Test
  public void testFromProperties() {
    // Arrange
    Properties properties = new Properties();
    properties.setProperty(BelParserConfiguration.COMPLETE_ORIGIN_KEY, "true");
    properties.setProperty(BelParserConfiguration.REQUIRED_DOCUMENT_KEYS_KEY, " name , version ,");

    // Act
    BelParserConfiguration configuration = BelParserConfiguration.fromProperties(properties);

    // Assert
    assertTrue("Completion was turned on", configuration.isCompleteOrigin());
    assertFalse("Absent keys keep their default", configuration.isAllowNested());
    assertEquals("Keys are trimmed and blanks dropped", Arrays.asList("name", "version"),
        configuration.getRequiredDocumentKeys());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNullRequiredKeysFail() {
    new BelParserConfiguration(false, false, null);
  }
}
