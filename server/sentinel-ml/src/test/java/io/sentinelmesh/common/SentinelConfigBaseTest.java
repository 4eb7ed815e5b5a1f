/*
 * Copyright (C) 2025 Isima, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.sentinelmesh.common;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.arrayContaining;
import static org.hamcrest.Matchers.emptyArray;
import static org.hamcrest.Matchers.is;

import io.sentinelmesh.errors.exception.InvalidConfigurationException;
import java.util.Properties;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class SentinelConfigBaseTest {
  private Properties properties;
  private SentinelConfigBase config;

  @Before
  public void setUp() {
    properties = new Properties();
    SentinelConfigBase.setProperties(properties);
    config = SentinelConfigBase.getInstance();
  }

  @After
  public void tearDown() {
    SentinelConfigBase.setProperties(System.getProperties());
  }

  @Test
  public void testDefaultsApplyWhenMissing() {
    assertThat(config.getString("a", "x"), is("x"));
    assertThat(config.getInt("a", 3), is(3));
    assertThat(config.getLong("a", 4L), is(4L));
    assertThat(config.getDouble("a", 0.5), is(0.5));
    assertThat(config.getBoolean("a", true), is(true));
  }

  @Test
  public void testValuesAreTrimmedAndParsed() {
    properties.setProperty("int", " 12 ");
    properties.setProperty("double", "0.25");
    properties.setProperty("bool", "false");
    properties.setProperty("str", " text ");
    assertThat(config.getInt("int", 0), is(12));
    assertThat(config.getDouble("double", 0), is(0.25));
    assertThat(config.getBoolean("bool", true), is(false));
    assertThat(config.getString("str", null), is("text"));
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testMalformedInt() {
    properties.setProperty("int", "twelve");
    config.getInt("int", 0);
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testIntOutOfRange() {
    properties.setProperty("int", "0");
    config.getInt("int", 5, 1, 10);
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testDoubleRangeIsExclusive() {
    properties.setProperty("double", "0.5");
    config.getDouble("double", 0.1, 0.0, 0.5);
  }

  @Test
  public void testStringArray() {
    assertThat(config.getStringArray("list", ",", "a, b"), arrayContaining("a", "b"));
    properties.setProperty("list", "  ");
    assertThat(config.getStringArray("list", ",", "a"), emptyArray());
  }
}
