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

import java.util.Iterator;

import com.healthmarketscience.sheetcalc.CellAddress;
import com.healthmarketscience.sheetcalc.CellRange;
import com.healthmarketscience.sheetcalc.expr.ErrorCode;
import com.healthmarketscience.sheetcalc.expr.ErrorCodeException;
import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.Value;

/**
 * A lazy, read-only view of the cells of a range.  Cells are only evaluated
 * when they are read, and the view may be iterated any number of times.
 * Range values only live for the duration of a single formula evaluation,
 * they are never cached.
 *
 * @author James Ahlborn
 */
public class RangeValue extends BaseValue
{
  private final EvalContext _ctx;
  private final CellRange _range;

  public RangeValue(EvalContext ctx, CellRange range) {
    _ctx = ctx;
    _range = range;
  }

  @Override
  public Type getType() {
    return Type.RANGE;
  }

  @Override
  public Object get() {
    return _range;
  }

  @Override
  public CellRange getRange() {
    return _range;
  }

  @Override
  public int getNumRows() {
    return _range.getFirstArea().getNumRows();
  }

  @Override
  public int getNumColumns() {
    return _range.getFirstArea().getNumColumns();
  }

  @Override
  public Value getElement(int row, int col) {
    return _ctx.getCellValue(_range.getCell(row, col));
  }

  @Override
  public Iterable<Value> getElements() {
    return new Iterable<Value>() {
      @Override
      public Iterator<Value> iterator() {
        final Iterator<CellAddress> addrIter = _range.iterator();
        return new Iterator<Value>() {
          @Override
          public boolean hasNext() {
            return addrIter.hasNext();
          }
          @Override
          public Value next() {
            return _ctx.getCellValue(addrIter.next());
          }
        };
      }
    };
  }

  /**
   * @return the values of this range as an array value, or {@code #VALUE!}
   *         for a multi-area range
   */
  public Value toArray() {
    if(_range.isMultiArea()) {
      return ValueSupport.toValue(ErrorCode.VALUE);
    }
    return _ctx.getRangeValue(_range);
  }

  @Override
  public boolean getAsBoolean() {
    return getSingleCellValue().getAsBoolean();
  }

  @Override
  public String getAsString() {
    return getSingleCellValue().getAsString();
  }

  @Override
  public double getAsDouble() {
    return getSingleCellValue().getAsDouble();
  }

  private Value getSingleCellValue() {
    if(!_range.isSingleCell()) {
      throw new ErrorCodeException(
          ErrorCode.VALUE, "Multi-cell range " + _range + " used as a value");
    }
    return _ctx.getCellValue(_range.getStart());
  }

  @Override
  public String toString() {
    return "Value[RANGE] '" + _range + "'";
  }
}
