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
import com.healthmarketscience.sheetcalc.expr.Function;
import com.healthmarketscience.sheetcalc.expr.Value;
import static com.healthmarketscience.sheetcalc.impl.expr.DefaultFunctions.*;
import static com.healthmarketscience.sheetcalc.impl.expr.FunctionSupport.*;

/**
 * Reference and lookup functions.  These all receive their reference
 * parameters unmodified, OFFSET and INDIRECT build new references at
 * evaluation time.
 *
 * @author James Ahlborn
 */
public class DefaultLookupFunctions
{
  private DefaultLookupFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }

  public static final Function ROW = registerFunc(new FuncVar(
      "ROW", 0, 1, Function.Dispatch.ARRAY) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      if(params.length == 0) {
        return ValueSupport.toValue(ctx.getCurrentAddress().getRow());
      }
      CellRange range = getRangeParam(params[0]);
      if(!ctx.isArrayContext() || (range.getNumRows() == 1)) {
        return ValueSupport.toValue(range.getFirstRow());
      }
      Value[][] rows = new Value[range.getNumRows()][1];
      for(int i = 0; i < rows.length; ++i) {
        rows[i][0] = ValueSupport.toValue(range.getFirstRow() + i);
      }
      return ValueSupport.toValue(rows);
    }
  });

  public static final Function COLUMN = registerFunc(new FuncVar(
      "COLUMN", 0, 1, Function.Dispatch.ARRAY) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      if(params.length == 0) {
        return ValueSupport.toValue(ctx.getCurrentAddress().getColumn());
      }
      CellRange range = getRangeParam(params[0]);
      if(!ctx.isArrayContext() || (range.getNumColumns() == 1)) {
        return ValueSupport.toValue(range.getFirstColumn());
      }
      Value[][] cols = new Value[1][range.getNumColumns()];
      for(int i = 0; i < cols[0].length; ++i) {
        cols[0][i] = ValueSupport.toValue(range.getFirstColumn() + i);
      }
      return ValueSupport.toValue(cols);
    }
  });

  public static final Function ROWS = registerFunc(new Func1(
      "ROWS", Function.Dispatch.ARRAY) {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(param1.getNumRows());
    }
  });

  public static final Function COLUMNS = registerFunc(new Func1(
      "COLUMNS", Function.Dispatch.ARRAY) {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(param1.getNumColumns());
    }
  });

  public static final Function INDEX = registerFunc(new FuncVar(
      "INDEX", 2, 3, Function.Dispatch.ARRAY) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      Value ref = params[0];
      int numRows = ref.getNumRows();
      int numCols = ref.getNumColumns();
      int rowNum = toScalarParam(ctx, params[1]).getAsInt();
      int colNum = 0;
      if(params.length > 2) {
        colNum = toScalarParam(ctx, params[2]).getAsInt();
      } else if(numRows == 1) {
        // a single index into a single row picks the column
        colNum = rowNum;
        rowNum = 1;
      } else if(numCols == 1) {
        colNum = 1;
      }

      if((rowNum < 0) || (colNum < 0)) {
        throw new ErrorCodeException(ErrorCode.VALUE, "Negative index");
      }
      if((rowNum > numRows) || (colNum > numCols)) {
        throw new ErrorCodeException(ErrorCode.REF, "Index out of range");
      }

      // a zero index selects the entire row/column
      int firstRow = ((rowNum == 0) ? 0 : rowNum - 1);
      int lastRow = ((rowNum == 0) ? numRows - 1 : rowNum - 1);
      int firstCol = ((colNum == 0) ? 0 : colNum - 1);
      int lastCol = ((colNum == 0) ? numCols - 1 : colNum - 1);

      CellRange range = ref.getRange();
      if(range != null) {
        CellAddress start = range.getCell(firstRow, firstCol);
        CellAddress end = range.getCell(lastRow, lastCol);
        return ctx.getReference(CellRange.of(start, end));
      }
      if((firstRow == lastRow) && (firstCol == lastCol)) {
        return ref.getElement(firstRow, firstCol);
      }
      Value[][] result = new Value[lastRow - firstRow + 1][
          lastCol - firstCol + 1];
      for(int i = 0; i < result.length; ++i) {
        for(int j = 0; j < result[i].length; ++j) {
          result[i][j] = ref.getElement(firstRow + i, firstCol + j);
        }
      }
      return ValueSupport.toValue(result);
    }
  });

  public static final Function TRANSPOSE = registerFunc(new Func1(
      "TRANSPOSE", Function.Dispatch.ARRAY) {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      if(param1.getType().isScalar()) {
        return param1;
      }
      Value[][] result = new Value[param1.getNumColumns()][
          param1.getNumRows()];
      for(int i = 0; i < result.length; ++i) {
        for(int j = 0; j < result[i].length; ++j) {
          result[i][j] = param1.getElement(j, i);
        }
      }
      return ValueSupport.toValue(result);
    }
  });

  public static final Function OFFSET = registerFunc(new FuncVar(
      "OFFSET", 3, 5, Function.Dispatch.ARRAY) {
    @Override
    public boolean isPure() {
      return false;
    }
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      CellRange base = getRangeParam(params[0]);
      int rows = toScalarParam(ctx, params[1]).getAsInt();
      int cols = toScalarParam(ctx, params[2]).getAsInt();
      int height = getSizeParam(ctx, params, 3);
      int width = getSizeParam(ctx, params, 4);
      CellRange result = base.offset(rows, cols, height, width);
      if(result == null) {
        throw new ErrorCodeException(
            ErrorCode.REF, "Offset outside of the sheet");
      }
      return ctx.getReference(result);
    }
  });

  public static final Function INDIRECT = registerFunc(new FuncVar(
      "INDIRECT", 1, 2, Function.Dispatch.ARRAY) {
    @Override
    public boolean isPure() {
      return false;
    }
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      String refText = toScalarParam(ctx, params[0]).getAsString();
      boolean a1Style = true;
      if((params.length > 1) && !params[1].isMissing()) {
        a1Style = toScalarParam(ctx, params[1]).getAsBoolean();
      }
      CellRange result = ctx.parseReference(refText, a1Style);
      if(result == null) {
        throw new ErrorCodeException(
            ErrorCode.REF, "Invalid reference '" + refText + "'");
      }
      return ctx.getReference(result);
    }
  });

  private static CellRange getRangeParam(Value param) {
    CellRange range = param.getRange();
    if(range == null) {
      throw new ErrorCodeException(
          ErrorCode.VALUE, param + " is not a reference");
    }
    return range;
  }

  /**
   * @return the optional height/width parameter of OFFSET, 0 if omitted
   */
  private static int getSizeParam(EvalContext ctx, Value[] params, int idx) {
    if((params.length <= idx) || params[idx].isMissing()) {
      return 0;
    }
    int size = toScalarParam(ctx, params[idx]).getAsInt();
    if(size <= 0) {
      throw new ErrorCodeException(ErrorCode.REF, "Invalid size " + size);
    }
    return size;
  }

  /**
   * Reduces a parameter of an array aware function to a single value.
   */
  private static Value toScalarParam(EvalContext ctx, Value param) {
    Value val = ArraySupport.topLeft(ArraySupport.toOperand(ctx, param));
    if(val.isError()) {
      throw new ErrorCodeException(val.getErrorCode());
    }
    return val;
  }
}
