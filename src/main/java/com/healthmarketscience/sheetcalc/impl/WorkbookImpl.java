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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.healthmarketscience.sheetcalc.CellAddress;
import com.healthmarketscience.sheetcalc.CellEntry;
import com.healthmarketscience.sheetcalc.CellRange;
import com.healthmarketscience.sheetcalc.CellSource;
import com.healthmarketscience.sheetcalc.StructuredTable;
import com.healthmarketscience.sheetcalc.UnresolvedReferenceException;
import com.healthmarketscience.sheetcalc.Workbook;
import com.healthmarketscience.sheetcalc.expr.EvalConfig;
import com.healthmarketscience.sheetcalc.expr.EvalException;
import com.healthmarketscience.sheetcalc.expr.Formula;
import com.healthmarketscience.sheetcalc.expr.Value;
import com.healthmarketscience.sheetcalc.impl.expr.ArraySupport;
import com.healthmarketscience.sheetcalc.impl.expr.ValueSupport;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Implementation of a compiled Workbook: the store of the nodes of the
 * evaluation graph.
 *
 * @author James Ahlborn
 * @usage _advanced_class_
 */
public class WorkbookImpl implements Workbook
{
  private static final Log LOG = LogFactory.getLog(WorkbookImpl.class);

  private static final char FORMULA_START_CHAR = '=';
  private static final char SHEET_SEP_CHAR = '!';
  private static final String TREE_INDENT = "  ";

  private static final Comparator<CellNode> NODE_ORDER =
    new Comparator<CellNode>() {
      @Override
      public int compare(CellNode n1, CellNode n2) {
        return n1.getAddress().compareTo(n2.getAddress());
      }
    };

  private final String _defaultSheet;
  private final WorkbookEvalConfig _config;
  private final CellSource _cellSource;
  private final Map<String,CellRange> _names =
    new LinkedHashMap<String,CellRange>();
  private final Map<String,StructuredTable> _tables =
    new LinkedHashMap<String,StructuredTable>();
  private final Map<CellAddress,CellNode> _cells =
    new HashMap<CellAddress,CellNode>();
  private final Map<CellRange,CellNode> _ranges =
    new HashMap<CellRange,CellNode>();
  private final Map<CellRange,CellNode> _arrayFormulas =
    new LinkedHashMap<CellRange,CellNode>();
  /** sheet name to the last used row and column of the sheet */
  private final Map<String,int[]> _extents = new HashMap<String,int[]>();
  private final GraphCompiler _compiler = new GraphCompiler(this);
  private boolean _compiled;
  /** node to the cycle containing it, null when the graph has changed */
  private Map<CellNode,List<CellNode>> _cycleMap;
  private List<List<CellNode>> _cycles;

  public WorkbookImpl(String defaultSheet, WorkbookEvalConfig config,
                      CellSource cellSource, Map<String,CellRange> names,
                      List<StructuredTable> tables) {
    if(StringUtils.isBlank(defaultSheet)) {
      throw new IllegalArgumentException("Default sheet must be given");
    }
    _defaultSheet = defaultSheet;
    _config = config;
    _cellSource = cellSource;
    for(Map.Entry<String,CellRange> e : names.entrySet()) {
      if(StringUtils.isBlank(e.getKey()) ||
         (CellRange.tryParse(e.getKey(), defaultSheet) != null)) {
        // formulas would read these as cell references
        throw new IllegalArgumentException(
            "Invalid defined name '" + e.getKey() + "'");
      }
      CellRange range = e.getValue();
      if(range.getSheet() == null) {
        range = range.withSheet(defaultSheet);
      }
      _names.put(toNameKey(e.getKey()), range);
    }
    for(StructuredTable table : tables) {
      String key = toNameKey(table.getName());
      if(_tables.containsKey(key)) {
        throw new IllegalArgumentException("Duplicate table " +
                                           table.getName());
      }
      _tables.put(key, table);
    }
  }

  @Override
  public String getDefaultSheet() {
    return _defaultSheet;
  }

  @Override
  public EvalConfig getEvalConfig() {
    return _config;
  }

  @Override
  public synchronized Map<String,CellRange> getDefinedNames() {
    return Collections.unmodifiableMap(_names);
  }

  @Override
  public synchronized List<StructuredTable> getTables() {
    return Collections.unmodifiableList(
        new ArrayList<StructuredTable>(_tables.values()));
  }

  GraphCompiler getCompiler() {
    return _compiler;
  }

  /**
   * Adds the contents of a cell while building the workbook.
   */
  public void addCell(CellAddress address, Object content) {
    if(content == null) {
      return;
    }
    CellNode node = newDefinedCell(address);
    if(isFormulaText(content)) {
      node.setFormula(_compiler.parse((String)content, address.getSheet()));
    } else {
      node.setLiteral(toLiteral(content));
    }
  }

  /**
   * Adds an array formula while building the workbook.
   */
  public void addArrayFormula(CellRange target, String formulaStr) {
    addArrayFormula(target, _compiler.parse(formulaStr, target.getSheet()));
  }

  /**
   * Adds a cell enumerated from another workbook while building the
   * workbook.
   */
  public void addEntry(CellEntry entry) {
    if(entry.isArrayFormula()) {
      addArrayFormula(entry.getTarget(), entry.getFormula());
      return;
    }
    CellNode node = newDefinedCell(entry.getAddress());
    if(entry.isFormula()) {
      node.setFormula(entry.getFormula());
    } else {
      node.setLiteral(toLiteral(entry.getValue()));
    }
  }

  private void addArrayFormula(CellRange target, Formula formula) {
    if(target.isMultiArea() || target.isUnbounded()) {
      throw new IllegalArgumentException(
          "Array formula target must be a single bounded area " + target);
    }
    if(target.getSheet() == null) {
      target = target.withSheet(_defaultSheet);
    }
    CellNode anchor = CellNode.newArrayFormula(target, formula);
    for(CellAddress addr : target) {
      CellNode member = newDefinedCell(addr);
      member.setAnchor(anchor);
      member.addPrecedent(anchor);
    }
    _arrayFormulas.put(target, anchor);
    if(_compiled) {
      _compiler.link(anchor);
    }
  }

  /**
   * Links all the formulas added while building the workbook.
   */
  public void compile() {
    List<CellNode> formulaNodes = new ArrayList<CellNode>();
    for(CellNode node : _cells.values()) {
      if(node.isFormula()) {
        formulaNodes.add(node);
      }
    }
    formulaNodes.addAll(_arrayFormulas.values());
    Collections.sort(formulaNodes, NODE_ORDER);

    _compiled = true;
    _compiler.linkAll(formulaNodes);

    if(LOG.isDebugEnabled()) {
      LOG.debug("Compiled workbook with " + _cells.size() + " cells, " +
                _ranges.size() + " ranges and " + _arrayFormulas.size() +
                " array formulas");
    }

    if(!_config.isIterative()) {
      for(List<CellNode> cycle : findCycles()) {
        LOG.warn("Workbook contains circular reference " +
                 EvalSession.toKeys(cycle) +
                 " and iterative calculation is disabled");
      }
    }
  }

  @Override
  public synchronized Value evaluate(CellAddress address) {
    address = normalize(address);
    CellNode node = findCellNode(address, true);
    if(node == null) {
      return ValueSupport.BLANK_VAL;
    }
    return new EvalSession(this).evaluate(node);
  }

  @Override
  public Value evaluate(String address) {
    return evaluate(CellAddress.parse(address, _defaultSheet));
  }

  @Override
  public synchronized Value evaluate(CellRange range) {
    if(range.isMultiArea()) {
      throw new IllegalArgumentException(
          "Cannot evaluate multi-area range " + range);
    }
    if(range.getSheet() == null) {
      range = range.withSheet(_defaultSheet);
    }
    return new EvalSession(this).evaluateRange(clipRange(range));
  }

  @Override
  public synchronized void setValue(CellAddress address, Object value) {
    address = normalize(address);
    Value literal = toLiteral(value);
    CellNode node = getModifiableCell(address);
    node.clearPrecedents();
    node.setLiteral(literal);
    graphChanged();
    invalidate(node);

    if(LOG.isDebugEnabled()) {
      LOG.debug("Set value of " + address + " to " + literal);
    }
  }

  @Override
  public void setValue(String address, Object value) {
    setValue(CellAddress.parse(address, _defaultSheet), value);
  }

  @Override
  public synchronized void setValues(CellRange range, Object[][] values) {
    if(range.isMultiArea() || range.isUnbounded()) {
      throw new IllegalArgumentException(
          "Values must be set on a single bounded area " + range);
    }
    if(range.getSheet() == null) {
      range = range.withSheet(_defaultSheet);
    }
    int numRows = range.getNumRows();
    int numCols = range.getNumColumns();
    if(values.length != numRows) {
      throw new IllegalArgumentException(
          "Got " + values.length + " rows of values for range " + range);
    }

    // validate everything before changing anything
    Value[][] literals = new Value[numRows][];
    for(int i = 0; i < numRows; ++i) {
      if(values[i].length != numCols) {
        throw new IllegalArgumentException(
            "Got " + values[i].length + " values in row " + i +
            " for range " + range);
      }
      literals[i] = new Value[numCols];
      for(int j = 0; j < numCols; ++j) {
        literals[i][j] = toLiteral(values[i][j]);
      }
    }
    for(CellAddress addr : range) {
      CellNode node = _cells.get(addr);
      if(node != null) {
        checkModifiable(node);
      }
    }

    List<CellNode> nodes = new ArrayList<CellNode>(numRows * numCols);
    for(int i = 0; i < numRows; ++i) {
      for(int j = 0; j < numCols; ++j) {
        CellNode node = getModifiableCell(range.getCell(i, j));
        node.clearPrecedents();
        node.setLiteral(literals[i][j]);
        nodes.add(node);
      }
    }
    graphChanged();
    invalidate(nodes);

    if(LOG.isDebugEnabled()) {
      LOG.debug("Set values of " + range);
    }
  }

  @Override
  public void setValues(String range, Object[][] values) {
    setValues(CellRange.parse(range, _defaultSheet), values);
  }

  @Override
  public synchronized void setFormula(CellAddress address, String formulaStr) {
    address = normalize(address);
    Formula formula = _compiler.parse(formulaStr, address.getSheet());
    // resolve names before touching the graph
    _compiler.collectTargets(formula, address);
    CellNode node = getModifiableCell(address);
    node.setFormula(formula);
    _compiler.link(node);
    invalidate(node);

    if(LOG.isDebugEnabled()) {
      LOG.debug("Set formula of " + address + " to " +
                formula.toCleanString());
    }
  }

  @Override
  public void setFormula(String address, String formulaStr) {
    setFormula(CellAddress.parse(address, _defaultSheet), formulaStr);
  }

  @Override
  public synchronized void recalculate() {
    for(CellNode node : getAllNodes()) {
      node.invalidate();
    }
    LOG.debug("Invalidated all formulas");
  }

  @Override
  public Workbook trim(Collection<CellAddress> outputs) {
    return trim(outputs, null);
  }

  @Override
  public synchronized Workbook trim(Collection<CellAddress> outputs,
                                    Collection<CellAddress> inputs) {

    // evaluate first so that dynamic references are part of the graph
    EvalSession session = new EvalSession(this);
    List<CellNode> outNodes = new ArrayList<CellNode>();
    for(CellAddress addr : outputs) {
      CellNode node = getExistingCell(addr);
      session.evaluate(node);
      outNodes.add(node);
    }

    Set<CellNode> reachable = collectReachable(outNodes, true);

    Set<CellNode> inputDependents = null;
    if(inputs != null) {
      List<CellNode> inNodes = new ArrayList<CellNode>();
      for(CellAddress addr : inputs) {
        inNodes.add(getExistingCell(addr));
      }
      inputDependents = collectReachable(inNodes, false);
    }

    WorkbookImpl trimmed = new WorkbookImpl(
        _defaultSheet, new WorkbookEvalConfig(_config), _cellSource, _names,
        new ArrayList<StructuredTable>(_tables.values()));

    List<CellNode> nodes = new ArrayList<CellNode>(reachable);
    Collections.sort(nodes, NODE_ORDER);
    int numFrozen = 0;
    for(CellNode node : nodes) {

      boolean frozen = ((inputDependents != null) &&
                        !inputDependents.contains(node));

      switch(node.getKind()) {
      case CELL:
        if(node.getAnchor() != null) {
          // added with the array formula
          break;
        }
        if(node.isFormula()) {
          if(frozen) {
            trimmed.addCell(node.getAddress(), session.evaluate(node));
            ++numFrozen;
          } else {
            trimmed.newDefinedCell(node.getAddress()).setFormula(
                node.getFormula());
          }
        } else if(!node.isEmptyCell()) {
          trimmed.addCell(node.getAddress(), node.getLiteral());
        }
        break;
      case ARRAY_FORMULA:
        if(frozen) {
          Value arrayVal = session.evaluate(node);
          CellRange target = node.getKey();
          for(int i = 0; i < target.getNumRows(); ++i) {
            for(int j = 0; j < target.getNumColumns(); ++j) {
              Value val = ArraySupport.topLeft(arrayVal.getElement(i, j));
              if(!val.isBlank()) {
                trimmed.addCell(target.getCell(i, j), val);
              }
            }
          }
          ++numFrozen;
        } else {
          trimmed.addArrayFormula(node.getKey(), node.getFormula());
        }
        break;
      default:
        // range nodes are rebuilt by linking
      }
    }

    trimmed.compile();

    if(LOG.isDebugEnabled()) {
      LOG.debug("Trimmed workbook from " + _cells.size() + " to " +
                trimmed._cells.size() + " cells, froze " + numFrozen +
                " formulas");
    }

    return trimmed;
  }

  @Override
  public synchronized Set<CellAddress> getDependents(CellAddress address) {
    CellNode node = getExistingCell(address);
    Set<CellAddress> deps = new TreeSet<CellAddress>();
    Set<CellNode> visited = newNodeSet();
    Deque<CellNode> toVisit = new ArrayDeque<CellNode>(node.getDependents());
    while(!toVisit.isEmpty()) {
      CellNode dep = toVisit.removeFirst();
      if(!visited.add(dep)) {
        continue;
      }
      if(dep.getKind() == CellNode.Kind.CELL) {
        deps.add(dep.getAddress());
      } else {
        // ranges and array formulas are read by the cells depending on them
        toVisit.addAll(dep.getDependents());
      }
    }
    return deps;
  }

  @Override
  public synchronized Set<CellAddress> getPrecedents(CellAddress address) {
    CellNode node = getExistingCell(address);
    if(node.getAnchor() != null) {
      node = node.getAnchor();
    }
    Set<CellAddress> precs = new TreeSet<CellAddress>();
    for(CellNode prec : node.getAllPrecedents()) {
      if(prec.getKind() == CellNode.Kind.CELL) {
        precs.add(prec.getAddress());
      } else {
        for(CellRange area : clipRange(prec.getKey()).getAreas()) {
          for(CellAddress addr : area) {
            precs.add(addr);
          }
        }
      }
    }
    return precs;
  }

  @Override
  public synchronized List<List<CellRange>> getCycles() {
    List<List<CellRange>> cycles = new ArrayList<List<CellRange>>();
    for(List<CellNode> cycle : findCycles()) {
      cycles.add(EvalSession.toKeys(cycle));
    }
    return cycles;
  }

  @Override
  public synchronized List<CellEntry> getEntries() {
    List<CellNode> nodes = new ArrayList<CellNode>(_cells.values());
    nodes.addAll(_arrayFormulas.values());
    Collections.sort(nodes, NODE_ORDER);

    List<CellEntry> entries = new ArrayList<CellEntry>();
    for(CellNode node : nodes) {
      if(node.getKind() == CellNode.Kind.ARRAY_FORMULA) {
        entries.add(new CellEntry(node.getKey(), node.getFormula(),
                                  getCachedValue(node), true));
      } else if(node.isFormula()) {
        entries.add(new CellEntry(node.getKey(), node.getFormula(),
                                  getCachedValue(node), false));
      } else if((node.getAnchor() == null) && !node.isEmptyCell()) {
        entries.add(new CellEntry(node.getKey(), null, node.getLiteral(),
                                  false));
      }
    }
    return entries;
  }

  @Override
  public synchronized String getValueTree(CellAddress address) {
    CellNode node = getExistingCell(address);
    EvalSession session = new EvalSession(this);
    session.evaluate(node);
    StringBuilder sb = new StringBuilder();
    appendValueTree(node, session, 0, newNodeSet(), sb);
    return sb.toString();
  }

  private void appendValueTree(CellNode node, EvalSession session, int depth,
                               Set<CellNode> visited, StringBuilder sb) {
    sb.append(StringUtils.repeat(TREE_INDENT, depth)).append(node.getKey());
    boolean firstVisit = visited.add(node);
    if(node.getKind() != CellNode.Kind.ARRAY_FORMULA) {
      Value val = session.evaluate(node);
      sb.append(" = ").append(val.getType().isScalar() ?
                              ValueSupport.toLiteralString(val) :
                              String.valueOf(val));
    }
    String formulaText = node.getFormulaText();
    if((node.getAnchor() == null) && !formulaText.isEmpty()) {
      sb.append(" ").append(formulaText);
    }
    if(!firstVisit && !node.getAllPrecedents().isEmpty()) {
      sb.append(" ...");
    }
    sb.append(System.lineSeparator());

    if(firstVisit) {
      for(CellNode prec : node.getAllPrecedents()) {
        appendValueTree(prec, session, depth + 1, visited, sb);
      }
    }
  }

  @Override
  public String toString() {
    return CustomToStringStyle.builder(this)
      .append("defaultSheet", _defaultSheet)
      .append("numCells", _cells.size())
      .append("numRanges", _ranges.size())
      .append("arrayFormulas", _arrayFormulas.keySet())
      .append("definedNames", _names)
      .append("tables", _tables.keySet())
      .toString();
  }

  /**
   * Resolves a defined name or structured reference for a formula of the
   * given cell.
   */
  CellRange resolveName(String name, CellAddress current) {
    if(StructuredReferences.isStructured(name)) {
      return StructuredReferences.resolve(name, current, _tables);
    }
    CellRange range = _names.get(toNameKey(name));
    if(range == null) {
      // sheet scoped spelling of a workbook name
      int sepIdx = name.lastIndexOf(SHEET_SEP_CHAR);
      if(sepIdx >= 0) {
        range = _names.get(toNameKey(name.substring(sepIdx + 1)));
      }
    }
    if(range == null) {
      throw new UnresolvedReferenceException(
          name, "Unknown name '" + name + "'");
    }
    return range;
  }

  /**
   * @return the given range with any unbounded axis limited to the used
   *         extent of its sheet
   */
  CellRange clipRange(CellRange range) {
    if(!range.isUnbounded()) {
      return range;
    }
    int[] extent = _extents.get(range.getSheet());
    if(extent == null) {
      return range.clip(1, 1);
    }
    return range.clip(extent[0], extent[1]);
  }

  /**
   * Notes that edges of the graph have changed.
   */
  void graphChanged() {
    _cycleMap = null;
    _cycles = null;
  }

  /**
   * @return the cycle containing the given node, {@code null} if none
   */
  List<CellNode> getCycle(CellNode node) {
    findCycles();
    return _cycleMap.get(node);
  }

  private List<List<CellNode>> findCycles() {
    if(_cycles == null) {
      _cycles = new CycleFinder<CellNode>(getAllNodes()) {
        @Override
        protected void getDescendents(CellNode from,
                                      List<CellNode> descendents) {
          descendents.addAll(from.getAllPrecedents());
        }
      }.find();
      _cycleMap = new IdentityHashMap<CellNode,List<CellNode>>();
      for(List<CellNode> cycle : _cycles) {
        for(CellNode node : cycle) {
          _cycleMap.put(node, cycle);
        }
      }
    }
    return _cycles;
  }

  /**
   * @return the node of the given cell, loading the cell from the cell
   *         source if allowed and necessary, {@code null} if the cell does not
   *         exist
   */
  CellNode findCellNode(CellAddress address, boolean fromSource) {
    CellNode node = _cells.get(address);
    if((node == null) && fromSource) {
      node = loadFromSource(address);
    }
    return node;
  }

  /**
   * @return the node of a cell referenced by a formula, an empty cell node is
   *         created if the cell does not exist
   */
  CellNode getOrCreateReferencedCell(CellAddress address) {
    CellNode node = findCellNode(address, true);
    if(node == null) {
      node = createCellNode(address);
    }
    return node;
  }

  CellNode getOrCreateRangeNode(CellRange range) {
    CellNode node = _ranges.get(range);
    if(node == null) {
      node = CellNode.newRange(range);
      _ranges.put(range, node);
      if(range.getNumCells() <= _cells.size()) {
        for(CellRange area : clipRange(range).getAreas()) {
          for(CellAddress addr : area) {
            CellNode cell = _cells.get(addr);
            if(cell != null) {
              node.addPrecedent(cell);
            }
          }
        }
      } else {
        for(CellNode cell : _cells.values()) {
          if(range.contains(cell.getAddress())) {
            node.addPrecedent(cell);
          }
        }
      }
      graphChanged();
    }
    return node;
  }

  private CellNode loadFromSource(CellAddress address) {
    if((_cellSource == null) || !_compiled) {
      return null;
    }
    Object content = _cellSource.getCellContent(address);
    if(content == null) {
      return null;
    }

    CellNode node = createCellNode(address);
    if(isFormulaText(content)) {
      node.setFormula(_compiler.parse((String)content, address.getSheet()));
      _compiler.link(node);
    } else {
      node.setLiteral(toLiteral(content));
    }

    if(LOG.isDebugEnabled()) {
      LOG.debug("Loaded " + address + " from cell source");
    }
    return node;
  }

  private CellNode createCellNode(CellAddress address) {
    CellNode node = CellNode.newCell(address);
    _cells.put(address, node);

    int[] extent = _extents.get(address.getSheet());
    if(extent == null) {
      extent = new int[]{1, 1};
      _extents.put(address.getSheet(), extent);
    }
    extent[0] = Math.max(extent[0], address.getRow());
    extent[1] = Math.max(extent[1], address.getColumn());

    for(CellNode rangeNode : _ranges.values()) {
      if(rangeNode.getKey().contains(address)) {
        rangeNode.addPrecedent(node);
      }
    }
    graphChanged();
    return node;
  }

  private CellNode newDefinedCell(CellAddress address) {
    if(address.getSheet() == null) {
      address = address.withSheet(_defaultSheet);
    }
    CellNode node = _cells.get(address);
    if(node == null) {
      return createCellNode(address);
    }
    if(!node.isEmptyCell()) {
      throw new IllegalArgumentException("Cell " + address +
                                         " is defined more than once");
    }
    return node;
  }

  private CellNode getModifiableCell(CellAddress address) {
    CellNode node = _cells.get(address);
    if(node == null) {
      return createCellNode(address);
    }
    checkModifiable(node);
    return node;
  }

  private static void checkModifiable(CellNode node) {
    if(node.getAnchor() != null) {
      throw new IllegalArgumentException(
          "Cannot change part of the array formula " +
          node.getAnchor().getKey());
    }
  }

  private CellNode getExistingCell(CellAddress address) {
    CellNode node = findCellNode(normalize(address), true);
    if(node == null) {
      throw new IllegalArgumentException("Unknown cell " + address);
    }
    return node;
  }

  /**
   * Resets the given node and everything depending on it (transitively) to
   * unevaluated.
   */
  private void invalidate(CellNode node) {
    invalidate(Collections.singletonList(node));
  }

  /**
   * Resets the given nodes and everything depending on them (transitively)
   * to unevaluated.
   */
  private void invalidate(List<CellNode> nodes) {
    int numInvalidated = 0;
    Set<CellNode> visited = newNodeSet();
    Deque<CellNode> toVisit = new ArrayDeque<CellNode>();
    for(CellNode node : nodes) {
      node.clearValue();
      toVisit.addAll(node.getDependents());
    }
    while(!toVisit.isEmpty()) {
      CellNode dep = toVisit.removeFirst();
      if(!visited.add(dep)) {
        continue;
      }
      if(dep.invalidate()) {
        ++numInvalidated;
      }
      toVisit.addAll(dep.getDependents());
    }

    if(LOG.isDebugEnabled()) {
      LOG.debug("Invalidated " + numInvalidated + " cached dependents of " +
                EvalSession.toKeys(nodes));
    }
  }

  /**
   * @return the given nodes and all the nodes reachable from them, following
   *         precedents or dependents
   */
  private static Set<CellNode> collectReachable(List<CellNode> nodes,
                                                boolean precedents) {
    Set<CellNode> reachable = newNodeSet();
    Deque<CellNode> toVisit = new ArrayDeque<CellNode>(nodes);
    while(!toVisit.isEmpty()) {
      CellNode node = toVisit.removeFirst();
      if(!reachable.add(node)) {
        continue;
      }
      toVisit.addAll(precedents ? node.getAllPrecedents() :
                     node.getDependents());
    }
    return reachable;
  }

  private List<CellNode> getAllNodes() {
    List<CellNode> nodes = new ArrayList<CellNode>(
        _cells.size() + _ranges.size() + _arrayFormulas.size());
    nodes.addAll(_cells.values());
    nodes.addAll(_ranges.values());
    nodes.addAll(_arrayFormulas.values());
    return nodes;
  }

  private CellAddress normalize(CellAddress address) {
    return ((address.getSheet() != null) ? address :
            address.withSheet(_defaultSheet));
  }

  private static Value getCachedValue(CellNode node) {
    return (node.isCached() ? node.getValue() : null);
  }

  private static Set<CellNode> newNodeSet() {
    return Collections.newSetFromMap(new IdentityHashMap<CellNode,Boolean>());
  }

  private static boolean isFormulaText(Object content) {
    return ((content instanceof String) &&
            StringUtils.startsWith((String)content,
                                   String.valueOf(FORMULA_START_CHAR)) &&
            (((String)content).length() > 1));
  }

  private static Value toLiteral(Object content) {
    Value val = null;
    try {
      val = ValueSupport.toValue(content);
    } catch(EvalException e) {
      throw new IllegalArgumentException(e.getMessage(), e);
    }
    if(!val.getType().isScalar()) {
      throw new IllegalArgumentException(
          "Cell values must be scalars, not " + val.getType());
    }
    return val;
  }

  private static String toNameKey(String name) {
    return name.trim().toUpperCase(Locale.ROOT);
  }
}
