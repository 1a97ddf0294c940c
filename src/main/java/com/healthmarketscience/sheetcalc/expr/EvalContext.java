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

import com.healthmarketscience.sheetcalc.CellAddress;
import com.healthmarketscience.sheetcalc.CellRange;

/**
 * EvalContext encapsulates all state for the evaluation of one formula.  It
 * provides a bridge between the formula execution engine and the workbook
 * graph.  A new context is created for each formula evaluation and passed
 * down explicitly, there is no "current" context.
 *
 * @author James Ahlborn
 */
public interface EvalContext
{
  /**
   * @return the address of the cell whose formula is being evaluated (the
   *         top-left cell for array formulas)
   */
  public CellAddress getCurrentAddress();

  /**
   * @return the sheet of the cell whose formula is being evaluated
   */
  public String getCurrentSheet();

  /**
   * @return {@code true} if the current formula is an array formula, in which
   *         case ranges are handled as arrays instead of implicitly
   *         intersected
   */
  public boolean isArrayContext();

  /**
   * @return the target range of the current array formula, {@code null} if
   *         this is not an array context
   */
  public CellRange getArrayTarget();

  /**
   * @return a lazy range value for the given reference.  References obtained
   *         while evaluating a dynamic formula are recorded as dependencies
   *         of the current cell.
   */
  public Value getReference(CellRange range);

  /**
   * @return the (evaluated) value of the given cell, blank if the cell is
   *         empty
   */
  public Value getCellValue(CellAddress address);

  /**
   * @return the (evaluated) values of the given single area range as an
   *         array value
   */
  public Value getRangeValue(CellRange range);

  /**
   * @return the range for the given defined name or structured reference,
   *         {@code null} if the reference selects no cells for the current
   *         cell (e.g. a "this row" reference outside of the table's rows)
   * @throws com.healthmarketscience.sheetcalc.UnresolvedReferenceException if
   *         the name cannot be resolved
   */
  public CellRange resolveName(String name);

  /**
   * Parses reference text at evaluation time (e.g. for INDIRECT).
   *
   * @param refText address, range or defined name
   * @param a1Style {@code true} for A1 references, {@code false} for R1C1
   *                references (relative to the current cell)
   * @return the referenced range, or {@code null} if the text is not a valid
   *         reference
   */
  public CellRange parseReference(String refText, boolean a1Style);
}
