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


package com.healthmarketscience.sheetcalc.impl.expr;

import com.healthmarketscience.sheetcalc.expr.ErrorCode;
import com.healthmarketscience.sheetcalc.expr.Value;
import junit.framework.TestCase;
import static com.healthmarketscience.sheetcalc.TestUtil.*;

/**
 *
 * @author James Ahlborn
 */
public class ArraySupportTest extends TestCase
{

  public ArraySupportTest(String name) {
    super(name);
  }

  public void testBroadcast() throws Exception
  {
    Value row = toArray(new Object[][]{{1, 2, 3}});
    Value col = toArray(new Object[][]{{10}, {20}});

    assertArray(new Object[][]{{11, 12, 13}},
                BuiltinOperators.add(row, ValueSupport.toValue(10)));
    assertArray(new Object[][]{{9, 8, 7}},
                BuiltinOperators.subtract(ValueSupport.toValue(10), row));

    // a row against a column fills the full grid
    assertArray(new Object[][]{{11, 12, 13}, {21, 22, 23}},
                BuiltinOperators.add(row, col));

    Value grid23 = toArray(new Object[][]{{1, 2, 3}, {4, 5, 6}});
    Value grid32 = toArray(new Object[][]{{1, 2}, {3, 4}, {5, 6}});
    assertArray(new Object[][]{{2, 4, 6}, {8, 10, 12}},
                BuiltinOperators.add(grid23, grid23));
    assertArray(new Object[][]{{10, 20, 30}, {80, 100, 120}},
                BuiltinOperators.multiply(grid23, col));

    assertError("#VALUE!", BuiltinOperators.add(grid23, grid32));
    assertError("#VALUE!", BuiltinOperators.add(
                    row, toArray(new Object[][]{{1, 2}})));
  }

  public void testElementErrors() throws Exception
  {
    Value arr = toArray(new Object[][]{{1, "x", 0}});

    Value result = BuiltinOperators.divide(ValueSupport.toValue(6), arr);
    assertNumber(6, result.getElement(0, 0));
    assertError("#VALUE!", result.getElement(0, 1));
    assertError("#DIV/0!", result.getElement(0, 2));

    result = BuiltinOperators.negate(
        toArray(new Object[][]{{1, ErrorCode.NA}}));
    assertNumber(-1, result.getElement(0, 0));
    assertError("#N/A", result.getElement(0, 1));

    result = BuiltinOperators.concat(arr, ValueSupport.toValue("!"));
    assertString("1!", result.getElement(0, 0));
    assertString("x!", result.getElement(0, 1));

    result = BuiltinOperators.lessThan(arr, ValueSupport.toValue(1));
    assertBoolean(false, result.getElement(0, 0));
    // text sorts after numbers
    assertBoolean(false, result.getElement(0, 1));
    assertBoolean(true, result.getElement(0, 2));
  }

  public void testScalarOps() throws Exception
  {
    assertNumber(5, BuiltinOperators.add(ValueSupport.toValue("2"),
                                         ValueSupport.toValue(3)));
    assertNumber(1, BuiltinOperators.add(ValueSupport.TRUE_VAL,
                                         ValueSupport.BLANK_VAL));
    assertError("#VALUE!", BuiltinOperators.add(ValueSupport.toValue("a"),
                                                ValueSupport.toValue(3)));
    assertError("#DIV/0!", BuiltinOperators.divide(
                    ValueSupport.toValue(ErrorCode.DIV0),
                    ValueSupport.toValue(ErrorCode.NA)));
    assertError("#NUM!", BuiltinOperators.power(ValueSupport.ZERO_VAL,
                                               ValueSupport.ZERO_VAL));
    assertError("#DIV/0!", BuiltinOperators.power(ValueSupport.ZERO_VAL,
                                                 ValueSupport.toValue(-1)));
    assertError("#NUM!", BuiltinOperators.power(ValueSupport.toValue(-8),
                                               ValueSupport.toValue(0.5)));
    assertNumber(0.25, BuiltinOperators.percent(ValueSupport.toValue(25)));

    assertBoolean(true, BuiltinOperators.equalTo(ValueSupport.toValue("abc"),
                                                 ValueSupport.toValue("ABC")));
    assertBoolean(true, BuiltinOperators.equalTo(ValueSupport.BLANK_VAL,
                                                 ValueSupport.ZERO_VAL));
    assertBoolean(true, BuiltinOperators.equalTo(ValueSupport.BLANK_VAL,
                                                 ValueSupport.EMPTY_STR_VAL));
    assertBoolean(true, BuiltinOperators.greaterThan(
                      ValueSupport.TRUE_VAL, ValueSupport.toValue("zzz")));
    assertBoolean(false, BuiltinOperators.equalTo(ValueSupport.toValue(1),
                                                  ValueSupport.toValue("1")));
  }

  public void testFitToRange() throws Exception
  {
    Value row = toArray(new Object[][]{{1, 2, 3, 4, 5}});

    assertArray(new Object[][]{{1, 2, 3}},
                ArraySupport.fitToRange(null, row, 1, 3));
    assertArray(new Object[][]{{1, 2, 3, 4, 5, null, null}},
                ArraySupport.fitToRange(null, row, 1, 7));
    // a single row is repeated down
    assertArray(new Object[][]{{1, 2}, {1, 2}},
                ArraySupport.fitToRange(null, row, 2, 2));
    // a scalar fills everything
    assertArray(new Object[][]{{7, 7}, {7, 7}},
                ArraySupport.fitToRange(null, ValueSupport.toValue(7), 2, 2));

    Value grid = toArray(new Object[][]{{1, 2}, {3, 4}});
    assertArray(new Object[][]{{1, 2, null}, {3, 4, null}, {null, null, null}},
                ArraySupport.fitToRange(null, grid, 3, 3));

    assertNumber(1, ArraySupport.topLeft(grid));
    assertNumber(7, ArraySupport.topLeft(ValueSupport.toValue(7)));
  }

  private static Value toArray(Object[][] vals) {
    return ValueSupport.toValue((Object)vals);
  }

  private static void assertArray(Object[][] expected, Value actual) {
    assertEquals(Value.Type.ARRAY, actual.getType());
    assertEquals(expected.length, actual.getNumRows());
    assertEquals(expected[0].length, actual.getNumColumns());
    for(int i = 0; i < expected.length; ++i) {
      for(int j = 0; j < expected[i].length; ++j) {
        Value val = actual.getElement(i, j);
        if(expected[i][j] == null) {
          assertTrue(val.isBlank());
        } else {
          assertNumber(((Number)expected[i][j]).doubleValue(), val);
        }
      }
    }
  }
}
