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

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.healthmarketscience.sheetcalc.expr.EvalConfig;
import com.healthmarketscience.sheetcalc.expr.Value;

/**
 * A compiled workbook: the dependency graph of a set of cells and their
 * formulas, evaluated lazily and cached.  Instances are created by a {@link
 * WorkbookBuilder}.
 * <p/>
 * Evaluation is on demand.  A cell's value is computed the first time it is
 * requested (along with everything it depends on) and cached until a cell it
 * depends on changes.  Circular references are engine failures unless
 * iterative calculation is enabled in the {@link #getEvalConfig EvalConfig}.
 * <p/>
 * If evaluation fails with an engine failure ({@link
 * com.healthmarketscience.sheetcalc.expr.EvalException}), every cell on the
 * failed evaluation path is left unevaluated, cached values of unrelated cells
 * are kept.
 * <p/>
 * All operations are synchronized on the workbook instance, so a workbook may
 * be shared between threads (evaluations are serialized).
 * <p/>
 * Addresses given as Strings are in A1 notation, optionally sheet qualified
 * ({@code "Sheet2!B3"}), unqualified addresses refer to the {@link
 * #getDefaultSheet default sheet}.
 *
 * @author James Ahlborn
 */
public interface Workbook
{
  /**
   * @return the sheet of unqualified addresses
   */
  public String getDefaultSheet();

  /**
   * @return the evaluation configuration of this workbook
   */
  public EvalConfig getEvalConfig();

  /**
   * @return the defined names of this workbook (upper case name to range)
   */
  public Map<String,CellRange> getDefinedNames();

  public List<StructuredTable> getTables();

  /**
   * Evaluates the given cell (and anything it depends on).
   *
   * @return the value of the cell, blank for empty cells
   * @throws com.healthmarketscience.sheetcalc.expr.EvalException for engine
   *         failures (e.g. circular references)
   */
  public Value evaluate(CellAddress address);

  public Value evaluate(String address);

  /**
   * Evaluates the cells of the given single area range.
   *
   * @return an array value with the values of all the cells of the range
   */
  public Value evaluate(CellRange range);

  /**
   * Replaces the contents of the given cell with a literal value,
   * invalidating everything which depends on it.
   *
   * @param value Number, String, Boolean, ErrorCode, Value or {@code null}
   *              (empty cell)
   * @throws IllegalArgumentException if the cell is part of an array formula
   */
  public void setValue(CellAddress address, Object value);

  public void setValue(String address, Object value);

  /**
   * Replaces the contents of all the cells of the given single area range
   * with literal values, invalidating everything which depends on any of
   * them.
   *
   * @param values the rows of values, which must have the shape of the range
   *               (elements as for {@link #setValue(CellAddress,Object)})
   * @throws IllegalArgumentException if the range is not a single bounded
   *         area, the shapes differ, or a cell is part of an array formula
   */
  public void setValues(CellRange range, Object[][] values);

  public void setValues(String range, Object[][] values);

  /**
   * Replaces the contents of the given cell with a formula, invalidating
   * everything which depends on it.
   *
   * @throws com.healthmarketscience.sheetcalc.expr.ParseException if the
   *         formula is malformed
   * @throws IllegalArgumentException if the cell is part of an array formula
   */
  public void setFormula(CellAddress address, String formula);

  public void setFormula(String address, String formula);

  /**
   * Invalidates all formulas, forcing the next evaluation to recompute them.
   */
  public void recalculate();

  /**
   * Creates a new workbook which only contains the given output cells and
   * everything they (transitively) depend on.  The outputs are evaluated
   * before trimming so that dynamic references are known.
   */
  public Workbook trim(Collection<CellAddress> outputs);

  /**
   * Like {@link #trim(Collection)}, but additionally replaces every formula
   * which does not depend (transitively) on any of the given input cells
   * with its current value.
   */
  public Workbook trim(Collection<CellAddress> outputs,
                       Collection<CellAddress> inputs);

  /**
   * @return the cells whose formulas reference the given cell, directly or
   *         through a range
   */
  public Set<CellAddress> getDependents(CellAddress address);

  /**
   * @return the cells referenced by the formula of the given cell (the cells
   *         of referenced ranges are included individually)
   */
  public Set<CellAddress> getPrecedents(CellAddress address);

  /**
   * @return the circular references currently in the graph, each as the
   *         list of the cells and ranges which make up the cycle
   */
  public List<List<CellRange>> getCycles();

  /**
   * @return all the non-empty cells of this workbook, ordered by address
   */
  public List<CellEntry> getEntries();

  /**
   * Evaluates the given cell and returns a printable tree of its value and
   * the values of everything it depends on.
   */
  public String getValueTree(CellAddress address);
}
