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

import com.healthmarketscience.sheetcalc.expr.Formula;
import com.healthmarketscience.sheetcalc.expr.Value;
import com.healthmarketscience.sheetcalc.impl.CustomToStringStyle;

/**
 * One entry in the enumeration of a compiled {@link Workbook}: a literal
 * cell, a formula cell, or an array formula with its target range.  Entries
 * hold parsed formulas, so a workbook can be rebuilt from them (see {@link
 * WorkbookBuilder#addEntries}) without parsing any formula text again.
 *
 * @author James Ahlborn
 */
public class CellEntry
{
  private final CellRange _target;
  private final Formula _formula;
  private final Value _value;
  private final boolean _arrayFormula;

  public CellEntry(CellRange target, Formula formula, Value value,
                   boolean arrayFormula) {
    if(!arrayFormula && !target.isSingleCell()) {
      throw new IllegalArgumentException(
          "Only array formulas may target multiple cells " + target);
    }
    if(arrayFormula && (formula == null)) {
      throw new IllegalArgumentException(
          "Array formula entry missing formula " + target);
    }
    _target = target;
    _formula = formula;
    _value = value;
    _arrayFormula = arrayFormula;
  }

  /**
   * @return the address of the cell (the top-left cell for array formulas)
   */
  public CellAddress getAddress() {
    return _target.getStart();
  }

  /**
   * @return the cells filled by this entry, a single cell unless this is an
   *         array formula
   */
  public CellRange getTarget() {
    return _target;
  }

  /**
   * @return the parsed formula, {@code null} for literal cells
   */
  public Formula getFormula() {
    return _formula;
  }

  public boolean isFormula() {
    return (_formula != null);
  }

  public boolean isArrayFormula() {
    return _arrayFormula;
  }

  /**
   * @return the literal value of a literal cell, or the last computed value
   *         of a formula ({@code null} if the formula has not been evaluated
   *         since it was last invalidated)
   */
  public Value getValue() {
    return _value;
  }

  @Override
  public String toString() {
    return CustomToStringStyle.valueBuilder(this)
      .append("target", _target)
      .append("formula", _formula)
      .append("value", _value)
      .append("arrayFormula", _arrayFormula)
      .toString();
  }
}
