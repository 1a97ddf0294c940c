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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.healthmarketscience.sheetcalc.CellAddress;
import com.healthmarketscience.sheetcalc.CellRange;
import com.healthmarketscience.sheetcalc.expr.Formula;
import com.healthmarketscience.sheetcalc.expr.FunctionLookup;
import com.healthmarketscience.sheetcalc.impl.expr.FormulaParser;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Parses formulas and turns the references of parsed formulas into edges of
 * the evaluation graph.  Defined names and structured references are
 * resolved to their cells here, so the graph only contains cells and ranges.
 *
 * @author James Ahlborn
 */
class GraphCompiler
{
  private static final Log LOG = LogFactory.getLog(GraphCompiler.class);

  private final WorkbookImpl _wb;

  GraphCompiler(WorkbookImpl wb) {
    _wb = wb;
  }

  /**
   * Parses the given formula text for a cell on the given sheet.
   */
  public Formula parse(String formulaStr, final String sheet) {
    return FormulaParser.parse(formulaStr, new FormulaParser.ParseContext() {
      @Override
      public FunctionLookup getFunctionLookup() {
        return _wb.getEvalConfig().getFunctionLookup();
      }
      @Override
      public String getDefaultSheet() {
        return sheet;
      }
    });
  }

  /**
   * @return the distinct ranges read by the given formula when evaluated for
   *         the given cell
   * @throws com.healthmarketscience.sheetcalc.UnresolvedReferenceException
   *         if the formula uses an unknown name
   */
  public Set<CellRange> collectTargets(Formula formula, CellAddress current) {
    List<CellRange> refs = new ArrayList<CellRange>();
    formula.collectReferences(refs);

    List<String> names = new ArrayList<String>();
    formula.collectNames(names);
    for(String name : names) {
      CellRange range = _wb.resolveName(name, current);
      if(range != null) {
        refs.add(range);
      }
    }

    return new LinkedHashSet<CellRange>(refs);
  }

  /**
   * Replaces the static edges of the given formula node with edges to the
   * targets of its current formula.
   */
  public void link(CellNode node) {
    Set<CellRange> targets = collectTargets(node.getFormula(),
                                            node.getAddress());
    node.clearPrecedents();
    for(CellRange target : targets) {
      node.addPrecedent(getTargetNode(target));
    }
    _wb.graphChanged();

    if(LOG.isDebugEnabled()) {
      LOG.debug("Linked " + node.getKey() + " " + node.getFormulaText() +
                " to " + targets);
    }
  }

  /**
   * Links all the given formula nodes.
   */
  public void linkAll(List<CellNode> nodes) {
    for(CellNode node : nodes) {
      link(node);
    }
  }

  /**
   * Replaces the dynamic edges of the given node with edges to the
   * references used by its latest evaluation.
   */
  public void updateDynamicEdges(CellNode node, List<CellRange> touched) {
    Set<CellNode> newPrecs = new LinkedHashSet<CellNode>();
    for(CellRange range : touched) {
      CellNode target = getTargetNode(range);
      if(!node.getPrecedents().contains(target)) {
        newPrecs.add(target);
      }
    }

    if(newPrecs.equals(node.getDynamicPrecedents())) {
      return;
    }

    node.clearDynamicPrecedents();
    for(CellNode target : newPrecs) {
      node.addDynamicPrecedent(target);
    }
    _wb.graphChanged();

    if(LOG.isDebugEnabled()) {
      LOG.debug("Updated dynamic references of " + node.getKey() + " to " +
                EvalSession.toKeys(new ArrayList<CellNode>(newPrecs)));
    }
  }

  private CellNode getTargetNode(CellRange range) {
    if(range.isSingleCell()) {
      return _wb.getOrCreateReferencedCell(range.getStart());
    }
    return _wb.getOrCreateRangeNode(range);
  }
}
