/*
Copyright (c) 2018 James Ahlborn

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.healthmarketscience.sheetcalc.expr.EvalException;

/**
 * Thrown when a circular reference is encountered while evaluating a
 * workbook which does not have iterative calculation enabled.
 *
 * @author James Ahlborn
 */
public class CircularReferenceException extends EvalException
{
  private static final long serialVersionUID = 20180330L;

  private final List<CellRange> _cycle;

  public CircularReferenceException(List<CellRange> cycle) {
    super("Circular reference: " + cycleToString(cycle));
    _cycle = Collections.unmodifiableList(new ArrayList<CellRange>(cycle));
  }

  /**
   * @return the cells making up the cycle, in evaluation order, starting
   *         (and implicitly ending) with the revisited cell
   */
  public List<CellRange> getCycle() {
    return _cycle;
  }

  private static String cycleToString(List<CellRange> cycle) {
    StringBuilder sb = new StringBuilder();
    for(CellRange key : cycle) {
      sb.append(key).append(" -> ");
    }
    if(!cycle.isEmpty()) {
      sb.append(cycle.get(0));
    }
    return sb.toString();
  }
}
