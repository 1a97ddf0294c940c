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
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.healthmarketscience.sheetcalc.CellAddress;
import com.healthmarketscience.sheetcalc.CellRange;
import com.healthmarketscience.sheetcalc.CircularReferenceException;
import com.healthmarketscience.sheetcalc.expr.ErrorCode;
import com.healthmarketscience.sheetcalc.expr.EvalConfig;
import com.healthmarketscience.sheetcalc.expr.EvalException;
import com.healthmarketscience.sheetcalc.expr.Value;
import com.healthmarketscience.sheetcalc.impl.expr.ArraySupport;
import com.healthmarketscience.sheetcalc.impl.expr.ValueSupport;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * State of one top-level evaluation request: the path of nodes currently
 * being evaluated (used to report circular references) and the cycles
 * currently being iterated.
 * <p/>
 * Node state machine: {@code UNEVALUATED -> EVALUATING -> CACHED} (or
 * {@code ERROR_CACHED} for error values).  An engine failure resets every
 * node on the evaluation path to {@code UNEVALUATED}.
 *
 * @author James Ahlborn
 */
class EvalSession
{
  private static final Log LOG = LogFactory.getLog(EvalSession.class);

  private final WorkbookImpl _wb;
  private final List<CellNode> _path = new ArrayList<CellNode>();
  private final Set<CellNode> _iterating =
    Collections.newSetFromMap(new IdentityHashMap<CellNode,Boolean>());
  /** number of revisits answered with an iteration seed */
  private int _numSeeded;

  EvalSession(WorkbookImpl wb) {
    _wb = wb;
  }

  /**
   * @return the value of the given cell, blank for cells which do not exist
   */
  public Value evaluateCell(CellAddress address) {
    CellNode node = _wb.findCellNode(address, true);
    if(node == null) {
      return ValueSupport.BLANK_VAL;
    }
    return evaluate(node);
  }

  /**
   * @return the values of the cells of the given single area range as an
   *         array value
   */
  public Value evaluateRange(CellRange range) {
    int numRows = range.getNumRows();
    int numCols = range.getNumColumns();
    Value[][] vals = new Value[numRows][numCols];
    for(int i = 0; i < numRows; ++i) {
      for(int j = 0; j < numCols; ++j) {
        vals[i][j] = evaluateCell(range.getCell(i, j));
      }
    }
    return ValueSupport.toValue(vals);
  }

  public Value evaluate(CellNode node) {

    if(node.isCached()) {
      return node.getValue();
    }

    EvalConfig config = _wb.getEvalConfig();

    if(node.getState() == CellNode.State.EVALUATING) {
      if(!config.isIterative()) {
        throw new CircularReferenceException(getCyclePath(node));
      }
      // the iteration driver of the cycle will come back to this node
      ++_numSeeded;
      Value seed = node.getValue();
      return ((seed != null) ? seed : ValueSupport.ZERO_VAL);
    }

    if(config.isIterative() && !_iterating.contains(node)) {
      List<CellNode> cycle = _wb.getCycle(node);
      if(cycle != null) {
        return iterate(cycle, node, config);
      }

      int numSeeded = _numSeeded;
      Value val = compute(node);
      if(_numSeeded > numSeeded) {
        // dynamic references found while computing may have closed a cycle
        // through this node
        cycle = _wb.getCycle(node);
        if(cycle != null) {
          if(LOG.isDebugEnabled()) {
            LOG.debug("Found cycle " + toKeys(cycle) + " through " +
                      node.getKey() + " while evaluating");
          }
          return iterate(cycle, node, config);
        }
      }
      return val;
    }

    return compute(node);
  }

  private Value compute(CellNode node) {

    if(LOG.isDebugEnabled()) {
      LOG.debug("Evaluating " + node.getKey() + " " + node.getFormulaText());
    }

    node.setEvaluating();
    _path.add(node);
    boolean success = false;
    try {

      Value val = null;
      switch(node.getKind()) {
      case CELL:
        val = computeCell(node);
        break;
      case RANGE:
        val = computeRange(node);
        break;
      case ARRAY_FORMULA:
        val = computeArrayFormula(node);
        break;
      default:
        throw new IllegalStateException("Unknown node kind " + node);
      }

      node.setValue(val);
      success = true;

      if(LOG.isDebugEnabled()) {
        LOG.debug(node.getKey() + " evaluated to " + val);
      }

      return val;

    } catch(EvalException e) {
      throw e;
    } catch(RuntimeException e) {
      throw new EvalException("Failed evaluating " + node.getKey() + " " +
                              node.getFormulaText() + ": " + e.getMessage(),
                              e);
    } finally {
      _path.remove(_path.size() - 1);
      if(!success) {
        node.invalidate();
      }
    }
  }

  private Value computeCell(CellNode node) {

    CellNode anchor = node.getAnchor();
    if(anchor != null) {
      Value arrayVal = evaluate(anchor);
      CellRange target = anchor.getKey();
      CellAddress addr = node.getAddress();
      int row = addr.getRow() - target.getFirstRow();
      int col = addr.getColumn() - target.getFirstColumn();
      if(ArraySupport.isScalar(arrayVal)) {
        // seed of an iterative calculation
        return arrayVal;
      }
      return arrayVal.getElement(row, col);
    }

    if(!node.isFormula()) {
      return node.getLiteral();
    }

    CellEvalContext ctx = new CellEvalContext(_wb, this, node);
    Value val = ArraySupport.toCellResult(ctx, node.getFormula().eval(ctx));
    if(node.isDynamic()) {
      _wb.getCompiler().updateDynamicEdges(node, ctx.getTouchedReferences());
    }
    return val;
  }

  private Value computeRange(CellNode node) {
    CellRange range = node.getKey();
    if(range.isMultiArea()) {
      return ValueSupport.toValue(ErrorCode.VALUE);
    }
    return evaluateRange(_wb.clipRange(range));
  }

  private Value computeArrayFormula(CellNode node) {
    CellEvalContext ctx = new CellEvalContext(_wb, this, node);
    CellRange target = node.getKey();
    Value val = ArraySupport.fitToRange(ctx, node.getFormula().eval(ctx),
                                        target.getNumRows(),
                                        target.getNumColumns());
    if(node.isDynamic()) {
      _wb.getCompiler().updateDynamicEdges(node, ctx.getTouchedReferences());
    }
    return val;
  }

  /**
   * Evaluates the members of a cycle repeatedly, each pass seeded with the
   * values of the previous pass, until the values settle or the maximum
   * number of passes is reached.
   */
  private Value iterate(List<CellNode> cycle, CellNode requested,
                        EvalConfig config) {

    int maxIterations = config.getMaxIterations();
    double maxChange = config.getMaxChange();

    _iterating.addAll(cycle);
    boolean success = false;
    try {

      Value[] prevVals = new Value[cycle.size()];
      int pass = 1;
      for(; pass <= maxIterations; ++pass) {

        for(int i = 0; i < prevVals.length; ++i) {
          CellNode member = cycle.get(i);
          prevVals[i] = (member.isCached() ? member.getValue() : null);
          if(member.getState() != CellNode.State.EVALUATING) {
            member.invalidate();
          }
        }

        evaluate(requested);
        for(CellNode member : cycle) {
          evaluate(member);
        }

        double delta = 0.0d;
        for(int i = 0; i < prevVals.length; ++i) {
          CellNode member = cycle.get(i);
          if(member.getKind() != CellNode.Kind.RANGE) {
            delta = Math.max(delta, getChange(prevVals[i], member.getValue()));
          }
        }

        if(LOG.isDebugEnabled()) {
          LOG.debug("Iteration " + pass + " of cycle " + toKeys(cycle) +
                    " max change " + delta);
        }

        if(delta < maxChange) {
          break;
        }
      }

      if(pass > maxIterations) {
        LOG.warn("Iterative calculation of cycle " + toKeys(cycle) +
                 " did not converge within " + maxIterations + " iterations");
      }

      success = true;
      return requested.getValue();

    } finally {
      _iterating.removeAll(cycle);
      if(!success) {
        for(CellNode member : cycle) {
          if(member.getState() != CellNode.State.EVALUATING) {
            member.invalidate();
          }
        }
      }
    }
  }

  private static double getChange(Value prevVal, Value curVal) {
    if((prevVal == null) || (curVal == null)) {
      return Double.POSITIVE_INFINITY;
    }
    if(!ArraySupport.isScalar(prevVal) || !ArraySupport.isScalar(curVal)) {
      if((prevVal.getNumRows() != curVal.getNumRows()) ||
         (prevVal.getNumColumns() != curVal.getNumColumns())) {
        return Double.POSITIVE_INFINITY;
      }
      double change = 0.0d;
      for(int i = 0; i < curVal.getNumRows(); ++i) {
        for(int j = 0; j < curVal.getNumColumns(); ++j) {
          change = Math.max(change, getChange(prevVal.getElement(i, j),
                                              curVal.getElement(i, j)));
        }
      }
      return change;
    }
    if((prevVal.getType() == Value.Type.NUMBER) &&
       (curVal.getType() == Value.Type.NUMBER)) {
      return Math.abs(curVal.getAsDouble() - prevVal.getAsDouble());
    }
    return (((prevVal.getType() == curVal.getType()) &&
             Objects.equals(prevVal.get(), curVal.get())) ?
            0.0d : Double.POSITIVE_INFINITY);
  }

  private List<CellRange> getCyclePath(CellNode node) {
    int idx = _path.lastIndexOf(node);
    return toKeys(_path.subList(idx, _path.size()));
  }

  static List<CellRange> toKeys(List<CellNode> nodes) {
    List<CellRange> keys = new ArrayList<CellRange>(nodes.size());
    for(CellNode node : nodes) {
      keys.add(node.getKey());
    }
    return keys;
  }
}
