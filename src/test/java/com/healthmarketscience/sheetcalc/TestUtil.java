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


package com.healthmarketscience.sheetcalc;

import java.util.concurrent.atomic.AtomicInteger;

import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.Function;
import com.healthmarketscience.sheetcalc.expr.FunctionLookup;
import com.healthmarketscience.sheetcalc.expr.Value;
import com.healthmarketscience.sheetcalc.impl.expr.DefaultFunctions;
import com.healthmarketscience.sheetcalc.impl.expr.FunctionSupport;
import static junit.framework.TestCase.*;

/**
 * Utility code for the test cases.
 *
 * @author James Ahlborn
 */
public class TestUtil
{
  public static final String SHEET = WorkbookBuilder.DEFAULT_SHEET;

  /** identity function which counts its invocations */
  public static final CountingFunc COUNT_CALLS = new CountingFunc();

  /** the default functions plus COUNTCALLS */
  public static final FunctionLookup TEST_FUNCS = new FunctionLookup() {
    @Override
    public Function getFunction(String name) {
      if(COUNT_CALLS.getName().equalsIgnoreCase(name)) {
        return COUNT_CALLS;
      }
      return DefaultFunctions.LOOKUP.getFunction(name);
    }
  };

  private TestUtil() {}

  /**
   * @return a builder for the given address/content pairs using the test
   *         functions
   */
  public static WorkbookBuilder newBuilder(Object... cells) {
    WorkbookBuilder builder = new WorkbookBuilder()
      .setFunctionLookup(TEST_FUNCS);
    for(int i = 0; i < cells.length; i += 2) {
      builder.putCell((String)cells[i], cells[i + 1]);
    }
    return builder;
  }

  public static Workbook compile(Object... cells) {
    return newBuilder(cells).compile();
  }

  /**
   * @return the value of the given formula evaluated in an otherwise empty
   *         workbook
   */
  public static Value eval(String formula) {
    return compile("Z1000", formula).evaluate("Z1000");
  }

  public static CellAddress addr(String str) {
    return CellAddress.parse(str, SHEET);
  }

  public static CellRange range(String str) {
    return CellRange.parse(str, SHEET);
  }

  public static void assertNumber(double expected, Value actual) {
    assertEquals("Not a number: " + actual, Value.Type.NUMBER,
                 actual.getType());
    assertEquals(expected, actual.getAsDouble(), 0.0000001d);
  }

  public static void assertString(String expected, Value actual) {
    assertEquals("Not a string: " + actual, Value.Type.STRING,
                 actual.getType());
    assertEquals(expected, actual.getAsString());
  }

  public static void assertBoolean(boolean expected, Value actual) {
    assertEquals("Not a boolean: " + actual, Value.Type.BOOLEAN,
                 actual.getType());
    assertEquals(expected, actual.getAsBoolean());
  }

  public static void assertError(String expectedCode, Value actual) {
    assertTrue("Not an error: " + actual, actual.isError());
    assertEquals(expectedCode, actual.getErrorCode().getCode());
  }

  /**
   * Single argument function which returns its argument and counts the
   * number of times it is called.
   */
  public static final class CountingFunc extends FunctionSupport.Func1
  {
    private final AtomicInteger _count = new AtomicInteger();

    private CountingFunc() {
      super("COUNTCALLS");
    }

    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      _count.incrementAndGet();
      return param1;
    }

    public int getCount() {
      return _count.get();
    }

    public void reset() {
      _count.set(0);
    }
  }
}
