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

/**
 * Source of the contents of cells which were not part of the initial set of
 * cells given to the {@link WorkbookBuilder}.  The workbook consults its
 * CellSource when evaluation reaches a cell it has never seen, e.g. through
 * a dynamic reference produced by {@code OFFSET} or {@code INDIRECT}.
 *
 * @author James Ahlborn
 */
public interface CellSource
{
  /**
   * @param address the (sheet qualified) address of the cell
   * @return {@code null} for an empty cell, a String starting with {@code '='}
   *         for a formula, otherwise the literal value of the cell (Number,
   *         String, Boolean or {@link
   *         com.healthmarketscience.sheetcalc.expr.ErrorCode})
   */
  public Object getCellContent(CellAddress address);
}
