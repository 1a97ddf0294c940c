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

import java.util.AbstractList;
import java.util.Arrays;
import java.util.List;

import com.healthmarketscience.sheetcalc.CellRange;
import com.healthmarketscience.sheetcalc.expr.ErrorCode;
import com.healthmarketscience.sheetcalc.expr.ErrorCodeException;
import com.healthmarketscience.sheetcalc.expr.Value;

/**
 * An immutable, rectangular 2-D grid of scalar values.  Every position holds
 * a value, empty positions hold the blank value.
 *
 * @author James Ahlborn
 */
public class ArrayValue extends BaseValue
{
  private final Value[][] _vals;
  private final int _numCols;

  /**
   * @param vals the rows of the array, which must all have the same (non
   *             zero) length.  The given arrays are copied.
   */
  public ArrayValue(Value[][] vals) {
    if((vals.length == 0) || (vals[0].length == 0)) {
      throw new IllegalArgumentException("Empty array");
    }
    _numCols = vals[0].length;
    _vals = new Value[vals.length][];
    for(int i = 0; i < vals.length; ++i) {
      if(vals[i].length != _numCols) {
        throw new IllegalArgumentException("Array is not rectangular");
      }
      _vals[i] = vals[i].clone();
      for(int j = 0; j < _numCols; ++j) {
        Value val = _vals[i][j];
        if(val == null) {
          _vals[i][j] = ValueSupport.BLANK_VAL;
        } else if(!val.getType().isScalar()) {
          throw new IllegalArgumentException(
              "Arrays may only contain scalar values " + val);
        }
      }
    }
  }

  @Override
  public Type getType() {
    return Type.ARRAY;
  }

  @Override
  public Object get() {
    Value[][] copy = new Value[_vals.length][];
    for(int i = 0; i < _vals.length; ++i) {
      copy[i] = _vals[i].clone();
    }
    return copy;
  }

  @Override
  public int getNumRows() {
    return _vals.length;
  }

  @Override
  public int getNumColumns() {
    return _numCols;
  }

  @Override
  public Value getElement(int row, int col) {
    return _vals[row][col];
  }

  @Override
  public Iterable<Value> getElements() {
    final int numCols = _numCols;
    final int size = _vals.length * numCols;
    List<Value> elems = new AbstractList<Value>() {
      @Override
      public Value get(int idx) {
        return _vals[idx / numCols][idx % numCols];
      }
      @Override
      public int size() {
        return size;
      }
    };
    return elems;
  }

  @Override
  public CellRange getRange() {
    return null;
  }

  @Override
  protected ErrorCodeException invalidConversion(Type newType) {
    return new ErrorCodeException(
        ErrorCode.VALUE, "Array cannot be converted to " + newType);
  }

  @Override
  public boolean equals(Object o) {
    return ((o instanceof ArrayValue) &&
            Arrays.deepEquals(_vals, ((ArrayValue)o)._vals));
  }

  @Override
  public int hashCode() {
    return Arrays.deepHashCode(_vals);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Value[ARRAY] {");
    for(int i = 0; i < _vals.length; ++i) {
      if(i > 0) {
        sb.append(";");
      }
      for(int j = 0; j < _numCols; ++j) {
        if(j > 0) {
          sb.append(",");
        }
        sb.append(ValueSupport.toLiteralString(_vals[i][j]));
      }
    }
    return sb.append("}").toString();
  }
}
