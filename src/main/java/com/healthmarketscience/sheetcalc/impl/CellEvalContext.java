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

package com.healthmarketscience.sheetcalc.impl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.healthmarketscience.sheetcalc.CellAddress;
import com.healthmarketscience.sheetcalc.CellRange;
import com.healthmarketscience.sheetcalc.UnresolvedReferenceException;
import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.Value;
import com.healthmarketscience.sheetcalc.impl.expr.RangeValue;
import org.apache.commons.lang3.StringUtils;

/**
 * EvalContext for the evaluation of the formula of one node of the graph.
 *
 * @author James Ahlborn
 */
class CellEvalContext implements EvalContext
{
  private static final String RANGE_SEP = ":";

  private final WorkbookImpl _wb;
  private final EvalSession _session;
  private final CellNode _node;
  /** references used by a dynamic formula, null for static formulas */
  private final List<CellRange> _touched;

  CellEvalContext(WorkbookImpl wb, EvalSession session, CellNode node) {
    _wb = wb;
    _session = session;
    _node = node;
    _touched = (node.isDynamic() ? new ArrayList<CellRange>() : null);
  }

  @Override
  public CellAddress getCurrentAddress() {
    return _node.getAddress();
  }

  @Override
  public String getCurrentSheet() {
    return _node.getAddress().getSheet();
  }

  @Override
  public boolean isArrayContext() {
    return (_node.getKind() == CellNode.Kind.ARRAY_FORMULA);
  }

  @Override
  public CellRange getArrayTarget() {
    return (isArrayContext() ? _node.getKey() : null);
  }

  @Override
  public Value getReference(CellRange range) {
    if(_touched != null) {
      _touched.add(range);
    }
    return new RangeValue(this, _wb.clipRange(range));
  }

  @Override
  public Value getCellValue(CellAddress address) {
    return _session.evaluateCell(address);
  }

  @Override
  public Value getRangeValue(CellRange range) {
    return _session.evaluateRange(_wb.clipRange(range));
  }

  @Override
  public CellRange resolveName(String name) {
    return _wb.resolveName(name, getCurrentAddress());
  }

  @Override
  public CellRange parseReference(String refText, boolean a1Style) {
    refText = StringUtils.trimToNull(refText);
    if(refText == null) {
      return null;
    }

    if(!a1Style) {
      return parseR1C1Reference(refText);
    }

    CellRange range = CellRange.tryParse(refText, getCurrentSheet());
    if(range != null) {
      return range;
    }

    // maybe a defined name
    try {
      return _wb.resolveName(refText, getCurrentAddress());
    } catch(UnresolvedReferenceException e) {
      return null;
    }
  }

  private CellRange parseR1C1Reference(String refText) {
    CellAddress cur = getCurrentAddress();
    String[] parts = StringUtils.split(refText, RANGE_SEP);
    if((parts.length < 1) || (parts.length > 2)) {
      return null;
    }
    CellAddress start = CellAddress.tryParseR1C1(parts[0], cur);
    if(start == null) {
      return null;
    }
    if(parts.length == 1) {
      return CellRange.of(start);
    }
    CellAddress end = CellAddress.tryParseR1C1(
        parts[1], cur.withSheet(start.getSheet()));
    if((end == null) || !StringUtils.equals(start.getSheet(), end.getSheet())) {
      return null;
    }
    return CellRange.of(start, end);
  }

  /**
   * @return the references used while evaluating a dynamic formula
   */
  public List<CellRange> getTouchedReferences() {
    return ((_touched != null) ? _touched :
            Collections.<CellRange>emptyList());
  }
}
