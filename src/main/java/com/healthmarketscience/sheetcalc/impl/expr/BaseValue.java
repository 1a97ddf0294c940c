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

import java.util.Collections;

import com.healthmarketscience.sheetcalc.CellRange;
import com.healthmarketscience.sheetcalc.expr.ErrorCode;
import com.healthmarketscience.sheetcalc.expr.ErrorCodeException;
import com.healthmarketscience.sheetcalc.expr.Value;

/**
 * Base class for scalar values, which are viewed as a 1x1 grid of
 * themselves.
 *
 * @author James Ahlborn
 */
public abstract class BaseValue implements Value
{
  @Override
  public boolean isBlank() {
    return(getType() == Type.BLANK);
  }

  @Override
  public boolean isError() {
    return false;
  }

  @Override
  public boolean isMissing() {
    return false;
  }

  @Override
  public ErrorCode getErrorCode() {
    return null;
  }

  @Override
  public boolean getAsBoolean() {
    throw invalidConversion(Type.BOOLEAN);
  }

  @Override
  public String getAsString() {
    throw invalidConversion(Type.STRING);
  }

  @Override
  public double getAsDouble() {
    throw invalidConversion(Type.NUMBER);
  }

  @Override
  public int getAsInt() {
    double d = getAsDouble();
    if((d >= (Integer.MAX_VALUE + 1.0d)) || (d <= (Integer.MIN_VALUE - 1.0d))) {
      throw new ErrorCodeException(ErrorCode.NUM, this + " is out of range");
    }
    return (int)d;
  }

  @Override
  public int getNumRows() {
    return 1;
  }

  @Override
  public int getNumColumns() {
    return 1;
  }

  @Override
  public Value getElement(int row, int col) {
    if((row != 0) || (col != 0)) {
      throw new IndexOutOfBoundsException(
          "Invalid position " + row + "," + col + " for " + this);
    }
    return this;
  }

  @Override
  public Iterable<Value> getElements() {
    return Collections.<Value>singletonList(this);
  }

  @Override
  public CellRange getRange() {
    return null;
  }

  protected ErrorCodeException invalidConversion(Type newType) {
    return new ErrorCodeException(
        ErrorCode.VALUE, this + " cannot be converted to " + newType);
  }

  @Override
  public String toString() {
    return "Value[" + getType() + "] '" + get() + "'";
  }
}
