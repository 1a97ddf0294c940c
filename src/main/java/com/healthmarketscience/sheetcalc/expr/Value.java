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

package com.healthmarketscience.sheetcalc.expr;

import com.healthmarketscience.sheetcalc.CellRange;

/**
 * Wrapper for a typed value used within the formula evaluation engine.  The
 * set of value types is closed (see {@link Type}), consumers are expected to
 * switch on {@link #getType}.  Note that the "blank" value is represented by
 * an actual Value instance with the type of {@link Type#BLANK}.  Also note
 * that all the conversion methods will throw an {@link ErrorCodeException}
 * if the conversion is not supported for the current value.
 * <p/>
 * Every value can be viewed as a 2-D grid: scalars are 1x1 grids of
 * themselves, arrays are grids of scalars and ranges are lazy views over the
 * cells of a {@link CellRange}.
 *
 * @author James Ahlborn
 */
public interface Value
{
  /** the types supported within the formula evaluation engine */
  public enum Type
  {
    BLANK, NUMBER, STRING, BOOLEAN, ERROR, ARRAY, RANGE;

    public boolean isScalar() {
      return ((this != ARRAY) && (this != RANGE));
    }
  }

  /**
   * @return the type of this value
   */
  public Type getType();

  /**
   * @return the raw value: {@code null} for blank, a Double, String, Boolean,
   *         {@link ErrorCode}, {@code Value[][]} copy for arrays or the
   *         {@link CellRange} for ranges.
   */
  public Object get();

  public boolean isBlank();

  public boolean isError();

  /**
   * @return {@code true} if this value is the placeholder for an omitted
   *         function argument (e.g. the middle argument of
   *         {@code IF(A1,,2)}).  A missing value is otherwise blank.
   */
  public boolean isMissing();

  /**
   * @return the error code if this is an error value, {@code null} otherwise
   */
  public ErrorCode getErrorCode();

  /**
   * @return this value converted to a boolean
   */
  public boolean getAsBoolean();

  /**
   * @return this value converted to a String
   */
  public String getAsString();

  /**
   * @return this value converted to a double
   */
  public double getAsDouble();

  /**
   * @return this value converted (truncated) to an int
   */
  public int getAsInt();

  /**
   * @return the number of rows in the grid view of this value
   */
  public int getNumRows();

  /**
   * @return the number of columns in the grid view of this value
   */
  public int getNumColumns();

  /**
   * @return the element at the given (0 based) position in the grid view of
   *         this value
   */
  public Value getElement(int row, int col);

  /**
   * @return a restartable, row major sequence of the scalar elements of this
   *         value.  For ranges, cells are only evaluated as the sequence is
   *         consumed.
   */
  public Iterable<Value> getElements();

  /**
   * @return the referenced range if this is a range value, {@code null}
   *         otherwise
   */
  public CellRange getRange();
}
