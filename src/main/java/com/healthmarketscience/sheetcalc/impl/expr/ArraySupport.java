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

import com.healthmarketscience.sheetcalc.CellAddress;
import com.healthmarketscience.sheetcalc.CellRange;
import com.healthmarketscience.sheetcalc.expr.ErrorCode;
import com.healthmarketscience.sheetcalc.expr.ErrorCodeException;
import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.Value;

/**
 * Shape handling for range and array values: implicit intersection,
 * element-wise mapping with broadcasting, and fitting array results into
 * the target range of an array formula.
 *
 * @author James Ahlborn
 */
public class ArraySupport
{
  @FunctionalInterface
  public interface ScalarOp1
  {
    public Value apply(Value param1);
  }

  @FunctionalInterface
  public interface ScalarOp2
  {
    public Value apply(Value param1, Value param2);
  }

  @FunctionalInterface
  public interface ScalarOpN
  {
    public Value apply(Value[] params);
  }

  private ArraySupport() {}

  /**
   * Prepares a value for use as the operand of a scalar operator or
   * function.  Within an array formula, ranges become arrays.  Otherwise,
   * ranges are implicitly intersected with the current cell.
   */
  public static Value toOperand(EvalContext ctx, Value val) {
    if(val.getType() != Value.Type.RANGE) {
      return val;
    }
    if(ctx.isArrayContext()) {
      return ((RangeValue)val).toArray();
    }
    return implicitIntersect(ctx, val.getRange());
  }

  /**
   * Picks the single cell of the given range which lines up with the current
   * cell: the cell in the current row for a single column range, the cell in
   * the current column for a single row range.
   *
   * @return the value of the picked cell, or {@code #VALUE!} if no cell
   *         lines up
   */
  public static Value implicitIntersect(EvalContext ctx, CellRange range) {
    if(range.isMultiArea()) {
      return ValueSupport.toValue(ErrorCode.VALUE);
    }
    if(range.isSingleCell()) {
      return ctx.getCellValue(range.getStart());
    }
    CellAddress cur = ctx.getCurrentAddress();
    if(cur == null) {
      return ValueSupport.toValue(ErrorCode.VALUE);
    }
    if(range.getNumColumns() == 1) {
      int row = cur.getRow();
      if((row >= range.getFirstRow()) && (row <= range.getLastRow())) {
        return ctx.getCellValue(
            range.getCell(row - range.getFirstRow(), 0));
      }
    } else if(range.getNumRows() == 1) {
      int col = cur.getColumn();
      if((col >= range.getFirstColumn()) && (col <= range.getLastColumn())) {
        return ctx.getCellValue(
            range.getCell(0, col - range.getFirstColumn()));
      }
    }
    return ValueSupport.toValue(ErrorCode.VALUE);
  }

  public static boolean isScalar(Value val) {
    return val.getType().isScalar();
  }

  public static Value map(Value val, ScalarOp1 op) {
    if(isScalar(val)) {
      return apply(op, val);
    }
    int rows = val.getNumRows();
    int cols = val.getNumColumns();
    Value[][] result = new Value[rows][cols];
    for(int i = 0; i < rows; ++i) {
      for(int j = 0; j < cols; ++j) {
        result[i][j] = toScalar(apply(op, val.getElement(i, j)));
      }
    }
    return ValueSupport.toValue(result);
  }

  /**
   * Applies the given operation element-wise, broadcasting scalars and
   * single row/column arrays across the larger operand.
   *
   * @return the result array, or {@code #VALUE!} if the operand shapes are
   *         incompatible
   */
  public static Value map(Value val1, Value val2, ScalarOp2 op) {
    if(isScalar(val1) && isScalar(val2)) {
      return apply(op, val1, val2);
    }
    int rows = broadcastSize(val1.getNumRows(), val2.getNumRows());
    int cols = broadcastSize(val1.getNumColumns(), val2.getNumColumns());
    if((rows < 0) || (cols < 0)) {
      return ValueSupport.toValue(ErrorCode.VALUE);
    }
    Value[][] result = new Value[rows][cols];
    for(int i = 0; i < rows; ++i) {
      for(int j = 0; j < cols; ++j) {
        result[i][j] = toScalar(apply(op, getBroadcastElement(val1, i, j),
                                      getBroadcastElement(val2, i, j)));
      }
    }
    return ValueSupport.toValue(result);
  }

  /**
   * Multi-operand version of {@link #map(Value,Value,ScalarOp2)}, used to
   * invoke scalar functions once per element within array formulas.
   */
  public static Value map(Value[] vals, ScalarOpN op) {
    int rows = 1;
    int cols = 1;
    boolean allScalar = true;
    for(Value val : vals) {
      if(isScalar(val)) {
        continue;
      }
      allScalar = false;
      rows = broadcastSize(rows, val.getNumRows());
      cols = broadcastSize(cols, val.getNumColumns());
      if((rows < 0) || (cols < 0)) {
        return ValueSupport.toValue(ErrorCode.VALUE);
      }
    }
    if(allScalar) {
      return apply(op, vals);
    }
    Value[][] result = new Value[rows][cols];
    for(int i = 0; i < rows; ++i) {
      for(int j = 0; j < cols; ++j) {
        Value[] elems = new Value[vals.length];
        for(int k = 0; k < vals.length; ++k) {
          elems[k] = getBroadcastElement(vals[k], i, j);
        }
        result[i][j] = toScalar(apply(op, elems));
      }
    }
    return ValueSupport.toValue(result);
  }

  /**
   * @return {@code true} if any of the given values is an array or range
   */
  public static boolean anyNonScalar(Value[] vals) {
    for(Value val : vals) {
      if(!isScalar(val)) {
        return true;
      }
    }
    return false;
  }

  // coercion failures only affect the element being computed

  private static Value apply(ScalarOp1 op, Value param1) {
    try {
      return op.apply(param1);
    } catch(ErrorCodeException e) {
      return ValueSupport.toValue(e.getErrorCode());
    }
  }

  private static Value apply(ScalarOp2 op, Value param1, Value param2) {
    try {
      return op.apply(param1, param2);
    } catch(ErrorCodeException e) {
      return ValueSupport.toValue(e.getErrorCode());
    }
  }

  private static Value apply(ScalarOpN op, Value[] params) {
    try {
      return op.apply(params);
    } catch(ErrorCodeException e) {
      return ValueSupport.toValue(e.getErrorCode());
    }
  }

  private static int broadcastSize(int size1, int size2) {
    if(size1 == size2) {
      return size1;
    }
    if(size1 == 1) {
      return size2;
    }
    if(size2 == 1) {
      return size1;
    }
    return -1;
  }

  private static Value getBroadcastElement(Value val, int row, int col) {
    return val.getElement(((val.getNumRows() == 1) ? 0 : row),
                          ((val.getNumColumns() == 1) ? 0 : col));
  }

  /**
   * Reduces a nested array result (e.g. from a function returning an array
   * within an element-wise mapping) to a single element.
   */
  private static Value toScalar(Value val) {
    return (isScalar(val) ? val : topLeft(val));
  }

  /**
   * @return the top-left element of the given value (the value itself for
   *         scalars)
   */
  public static Value topLeft(Value val) {
    if(isScalar(val)) {
      return val;
    }
    return val.getElement(0, 0);
  }

  /**
   * Reduces a formula result to the value of a single (non-array formula)
   * cell.
   */
  public static Value toCellResult(EvalContext ctx, Value val) {
    if(val.getType() == Value.Type.RANGE) {
      val = implicitIntersect(ctx, val.getRange());
    }
    return topLeft(val);
  }

  /**
   * Reduces a formula result to an array which exactly fills the target of
   * an array formula.  Single row/column results are repeated to fill the
   * target, larger results are truncated, and missing cells are blank.
   */
  public static Value fitToRange(EvalContext ctx, Value val, int numRows,
                                 int numCols) {
    if(val.getType() == Value.Type.RANGE) {
      val = ((RangeValue)val).toArray();
    }
    int valRows = val.getNumRows();
    int valCols = val.getNumColumns();
    Value[][] result = new Value[numRows][numCols];
    for(int i = 0; i < numRows; ++i) {
      int row = ((valRows == 1) ? 0 : i);
      for(int j = 0; j < numCols; ++j) {
        int col = ((valCols == 1) ? 0 : j);
        result[i][j] = (((row < valRows) && (col < valCols)) ?
                        val.getElement(row, col) : ValueSupport.BLANK_VAL);
      }
    }
    return ValueSupport.toValue(result);
  }
}
