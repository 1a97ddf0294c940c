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

import java.util.Collection;

import com.healthmarketscience.sheetcalc.CellRange;

/**
 * A Formula is the parsed, immutable form of the formula text of one cell
 * (or one array formula).  It may be shared between workbooks.
 *
 * @author James Ahlborn
 */
public interface Formula
{
  /**
   * Evaluates the formula against the given context.  The result may be a
   * range or array value, callers are responsible for reducing it to the
   * shape of the target cell(s).
   */
  public Value eval(EvalContext ctx);

  /**
   * @return the original, unparsed formula string (including the leading
   *         {@code '='})
   */
  public String toRawString();

  /**
   * @return the parsed formula string, which may be slightly different than
   *         the original formula string (all sheet names explicit, whitespace
   *         normalized)
   */
  public String toCleanString();

  /**
   * @return a detailed formula string which indicates how the formula was
   *         parsed
   */
  public String toDebugString();

  /**
   * @return {@code true} if this formula always evaluates to the same value,
   *         {@code false} otherwise
   */
  public boolean isConstant();

  /**
   * @return {@code true} if this formula calls an impure function (whose
   *         references can only be discovered by evaluating it)
   */
  public boolean isDynamic();

  /**
   * Adds the cell references which appear directly in this formula to the
   * given collection.
   */
  public void collectReferences(Collection<CellRange> refs);

  /**
   * Adds the defined names and structured references which appear in this
   * formula to the given collection.
   */
  public void collectNames(Collection<String> names);
}
