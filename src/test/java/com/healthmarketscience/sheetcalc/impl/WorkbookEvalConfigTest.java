/*
Copyright (c) 2016 James Ahlborn

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package com.healthmarketscience.sheetcalc.impl;

import com.healthmarketscience.sheetcalc.impl.expr.DefaultFunctions;
import junit.framework.TestCase;
import static com.healthmarketscience.sheetcalc.TestUtil.*;

/**
 *
 * @author James Ahlborn
 */
public class WorkbookEvalConfigTest extends TestCase
{

  public WorkbookEvalConfigTest(String name) {
    super(name);
  }

  @Override
  protected void tearDown() {
    System.clearProperty(WorkbookEvalConfig.ITERATIVE_CALC_PROPERTY);
    System.clearProperty(WorkbookEvalConfig.MAX_ITERATIONS_PROPERTY);
    System.clearProperty(WorkbookEvalConfig.MAX_CHANGE_PROPERTY);
  }

  public void testDefaults() throws Exception
  {
    WorkbookEvalConfig config = new WorkbookEvalConfig();
    assertSame(DefaultFunctions.LOOKUP, config.getFunctionLookup());
    assertFalse(config.isIterative());
    assertEquals(WorkbookEvalConfig.DEFAULT_MAX_ITERATIONS,
                 config.getMaxIterations());
    assertEquals(WorkbookEvalConfig.DEFAULT_MAX_CHANGE,
                 config.getMaxChange(), 0.0d);

    System.setProperty(WorkbookEvalConfig.ITERATIVE_CALC_PROPERTY, " true ");
    System.setProperty(WorkbookEvalConfig.MAX_ITERATIONS_PROPERTY, "25");
    System.setProperty(WorkbookEvalConfig.MAX_CHANGE_PROPERTY, "0.5");

    config = new WorkbookEvalConfig();
    assertTrue(config.isIterative());
    assertEquals(25, config.getMaxIterations());
    assertEquals(0.5d, config.getMaxChange(), 0.0d);

    System.setProperty(WorkbookEvalConfig.MAX_ITERATIONS_PROPERTY, "0");
    System.setProperty(WorkbookEvalConfig.MAX_CHANGE_PROPERTY, "lots");

    config = new WorkbookEvalConfig();
    assertEquals(WorkbookEvalConfig.DEFAULT_MAX_ITERATIONS,
                 config.getMaxIterations());
    assertEquals(WorkbookEvalConfig.DEFAULT_MAX_CHANGE,
                 config.getMaxChange(), 0.0d);
  }

  public void testSetters() throws Exception
  {
    WorkbookEvalConfig config = new WorkbookEvalConfig();
    config.setFunctionLookup(TEST_FUNCS);
    config.setIterative(true);
    config.setMaxIterations(5);
    config.setMaxChange(0.0d);

    WorkbookEvalConfig copy = new WorkbookEvalConfig(config);
    assertSame(TEST_FUNCS, copy.getFunctionLookup());
    assertTrue(copy.isIterative());
    assertEquals(5, copy.getMaxIterations());
    assertEquals(0.0d, copy.getMaxChange(), 0.0d);

    copy.setFunctionLookup(null);
    assertSame(DefaultFunctions.LOOKUP, copy.getFunctionLookup());

    try {
      config.setMaxIterations(0);
      fail("IllegalArgumentException should have been thrown");
    } catch(IllegalArgumentException expected) {
      // success
    }

    try {
      config.setMaxChange(-1.0d);
      fail("IllegalArgumentException should have been thrown");
    } catch(IllegalArgumentException expected) {
      // success
    }

    try {
      config.setMaxChange(Double.NaN);
      fail("IllegalArgumentException should have been thrown");
    } catch(IllegalArgumentException expected) {
      // success
    }
    assertEquals(5, config.getMaxIterations());
  }
}
