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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import com.healthmarketscience.sheetcalc.CellAddress;
import com.healthmarketscience.sheetcalc.CellRange;
import com.healthmarketscience.sheetcalc.expr.Formula;
import com.healthmarketscience.sheetcalc.expr.Value;
import com.healthmarketscience.sheetcalc.impl.expr.ValueSupport;

/**
 * A vertex of the evaluation graph.  A node is either a single cell, a range
 * referenced by some formula, or the shared formula of an array formula
 * (whose member cells point at it).
 * <p/>
 * Edges are kept in both directions: precedents are the nodes the formula of
 * this node reads, dependents are the nodes whose formulas read this node.
 *
 * @author James Ahlborn
 */
class CellNode
{
  enum Kind {
    CELL, RANGE, ARRAY_FORMULA;
  }

  enum State {
    UNEVALUATED, EVALUATING, CACHED, ERROR_CACHED;
  }

  private final Kind _kind;
  private final CellRange _key;
  private Formula _formula;
  private Value _literal = ValueSupport.BLANK_VAL;
  /** the array formula this cell belongs to, if any */
  private CellNode _anchor;
  private Value _value;
  private State _state = State.UNEVALUATED;
  private final Set<CellNode> _precedents = new LinkedHashSet<CellNode>();
  private final Set<CellNode> _dynamicPrecedents =
    new LinkedHashSet<CellNode>();
  private final Set<CellNode> _dependents = new LinkedHashSet<CellNode>();

  private CellNode(Kind kind, CellRange key) {
    _kind = kind;
    _key = key;
  }

  static CellNode newCell(CellAddress address) {
    return new CellNode(Kind.CELL, CellRange.of(address));
  }

  static CellNode newRange(CellRange range) {
    return new CellNode(Kind.RANGE, range);
  }

  static CellNode newArrayFormula(CellRange target, Formula formula) {
    CellNode node = new CellNode(Kind.ARRAY_FORMULA, target);
    node._formula = formula;
    return node;
  }

  public Kind getKind() {
    return _kind;
  }

  public boolean isCell() {
    return (_kind == Kind.CELL);
  }

  public CellRange getKey() {
    return _key;
  }

  public CellAddress getAddress() {
    return _key.getStart();
  }

  public Formula getFormula() {
    return _formula;
  }

  public boolean isFormula() {
    return (_formula != null);
  }

  public boolean isDynamic() {
    return ((_formula != null) && _formula.isDynamic());
  }

  public Value getLiteral() {
    return _literal;
  }

  /**
   * @return {@code true} if this cell has no content, i.e. it only exists
   *         because some formula references it
   */
  public boolean isEmptyCell() {
    return ((_kind == Kind.CELL) && (_formula == null) && (_anchor == null) &&
            _literal.isBlank());
  }

  void setFormula(Formula formula) {
    _formula = formula;
    _literal = ValueSupport.BLANK_VAL;
  }

  void setLiteral(Value literal) {
    _formula = null;
    _literal = literal;
  }

  public CellNode getAnchor() {
    return _anchor;
  }

  void setAnchor(CellNode anchor) {
    _anchor = anchor;
    _formula = null;
    _literal = ValueSupport.BLANK_VAL;
  }

  public State getState() {
    return _state;
  }

  public boolean isCached() {
    return ((_state == State.CACHED) || (_state == State.ERROR_CACHED));
  }

  void setEvaluating() {
    _state = State.EVALUATING;
  }

  /**
   * @return the last computed value, which is kept after invalidation as the
   *         seed of iterative calculation ({@code null} if never computed)
   */
  public Value getValue() {
    return _value;
  }

  void setValue(Value value) {
    _value = value;
    _state = (value.isError() ? State.ERROR_CACHED : State.CACHED);
  }

  void setSeed(Value seed) {
    _value = seed;
  }

  /**
   * Resets this node to unevaluated.
   * @return {@code true} if the node was cached
   */
  boolean invalidate() {
    boolean wasCached = isCached();
    _state = State.UNEVALUATED;
    return wasCached;
  }

  void clearValue() {
    _value = null;
    _state = State.UNEVALUATED;
  }

  public Set<CellNode> getPrecedents() {
    return Collections.unmodifiableSet(_precedents);
  }

  public Set<CellNode> getDependents() {
    return Collections.unmodifiableSet(_dependents);
  }

  public Set<CellNode> getDynamicPrecedents() {
    return Collections.unmodifiableSet(_dynamicPrecedents);
  }

  void addPrecedent(CellNode node) {
    _precedents.add(node);
    node._dependents.add(this);
  }

  void addDynamicPrecedent(CellNode node) {
    _dynamicPrecedents.add(node);
    node._dependents.add(this);
  }

  /**
   * Removes all the outgoing edges of this node.
   */
  void clearPrecedents() {
    for(CellNode node : _precedents) {
      node._dependents.remove(this);
    }
    _precedents.clear();
    clearDynamicPrecedents();
  }

  void clearDynamicPrecedents() {
    for(CellNode node : _dynamicPrecedents) {
      if(!_precedents.contains(node)) {
        node._dependents.remove(this);
      }
    }
    _dynamicPrecedents.clear();
  }

  /**
   * @return all the nodes read by this node, static and dynamic
   */
  public Set<CellNode> getAllPrecedents() {
    if(_dynamicPrecedents.isEmpty()) {
      return getPrecedents();
    }
    Set<CellNode> all = new LinkedHashSet<CellNode>(_precedents);
    all.addAll(_dynamicPrecedents);
    return all;
  }

  /**
   * @return the formula text of this node (or of its array formula), the
   *         empty string if none
   */
  public String getFormulaText() {
    if(_anchor != null) {
      return _anchor.getFormulaText();
    }
    if(_formula == null) {
      return "";
    }
    String text = _formula.toCleanString();
    return ((_kind == Kind.ARRAY_FORMULA) ? ("{" + text + "}") : text);
  }

  @Override
  public String toString() {
    return CustomToStringStyle.valueBuilder(this)
      .append("kind", _kind)
      .append("key", _key)
      .append("formula", getFormulaText())
      .append("state", _state)
      .append("value", _value)
      .toString();
  }
}
