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

import com.twentyn.bel.language.BelConstants;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * Settings for one parsing session. Defaults come from the bel-parser.properties resource.
 */
public class BelParserConfiguration {
  public static final String DEFAULT_PROPERTIES_PATH = "bel-parser.properties";

  public static final String COMPLETE_ORIGIN_KEY = "bel.parser.complete_origin";
  public static final String ALLOW_NESTED_KEY = "bel.parser.allow_nested";
  public static final String REQUIRED_DOCUMENT_KEYS_KEY = "bel.parser.required_document_keys";

  public static final List<String> DEFAULT_REQUIRED_DOCUMENT_KEYS = Collections.unmodifiableList(Arrays.asList(
      BelConstants.DOCUMENT_NAME, BelConstants.DOCUMENT_VERSION, BelConstants.DOCUMENT_DESCRIPTION,
      BelConstants.DOCUMENT_AUTHORS, BelConstants.DOCUMENT_CONTACT));

  private boolean completeOrigin = false;
  private boolean allowNested = false;
  private List<String> requiredDocumentKeys = DEFAULT_REQUIRED_DOCUMENT_KEYS;

  public BelParserConfiguration() {
  }

  public BelParserConfiguration(boolean completeOrigin, boolean allowNested, List<String> requiredDocumentKeys) {
    this.completeOrigin = completeOrigin;
    this.allowNested = allowNested;
    setRequiredDocumentKeys(requiredDocumentKeys);
  }

  /**
   * Reads settings from properties; keys that are absent keep their default values.
   */
  public static BelParserConfiguration fromProperties(Properties properties) {
    BelParserConfiguration configuration = new BelParserConfiguration();
    String completeOrigin = properties.getProperty(COMPLETE_ORIGIN_KEY);
    if (completeOrigin != null) {
      configuration.setCompleteOrigin(Boolean.parseBoolean(completeOrigin.trim()));
    }
    String allowNested = properties.getProperty(ALLOW_NESTED_KEY);
    if (allowNested != null) {
      configuration.setAllowNested(Boolean.parseBoolean(allowNested.trim()));
    }
    String requiredKeys = properties.getProperty(REQUIRED_DOCUMENT_KEYS_KEY);
    if (requiredKeys != null) {
      List<String> keys = new ArrayList<>();
      for (String key : StringUtils.split(requiredKeys, ',')) {
        if (StringUtils.isNotBlank(key)) {
          keys.add(key.trim());
        }
      }
      configuration.setRequiredDocumentKeys(keys);
    }
    return configuration;
  }

  public static BelParserConfiguration loadDefault() throws IOException {
    Properties properties = new Properties();
    try (InputStream stream = BelParserConfiguration.class.getClassLoader()
        .getResourceAsStream(DEFAULT_PROPERTIES_PATH)) {
      if (stream == null) {
        throw new IOException(String.format("Missing classpath resource %s", DEFAULT_PROPERTIES_PATH));
      }
      properties.load(stream);
    }
    return fromProperties(properties);
  }

  public boolean isCompleteOrigin() {
    return completeOrigin;
  }

  public void setCompleteOrigin(boolean completeOrigin) {
    this.completeOrigin = completeOrigin;
  }

  public boolean isAllowNested() {
    return allowNested;
  }

  public void setAllowNested(boolean allowNested) {
    this.allowNested = allowNested;
  }

  public List<String> getRequiredDocumentKeys() {
    return requiredDocumentKeys;
  }

  public void setRequiredDocumentKeys(List<String> requiredDocumentKeys) {
    if (requiredDocumentKeys == null) {
      throw new IllegalArgumentException("Required document keys may be empty but not null.");
    }
    this.requiredDocumentKeys = Collections.unmodifiableList(new ArrayList<>(requiredDocumentKeys));
  }
}
