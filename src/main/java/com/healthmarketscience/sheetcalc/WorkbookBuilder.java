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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.healthmarketscience.sheetcalc.expr.FunctionLookup;
import com.healthmarketscience.sheetcalc.impl.WorkbookEvalConfig;
import com.healthmarketscience.sheetcalc.impl.WorkbookImpl;

/**
 * Builder style class for constructing a {@link Workbook}.
 * <p/>
 * Simple example usage:
 * <pre>
 *   Workbook wb = new WorkbookBuilder()
 *     .putCell("A1", 2)
 *     .putCell("A2", "=A1*3")
 *     .putArrayFormula("B1:B3", "=ROW(B1:B3)*A1")
 *     .putDefinedName("Total", "Sheet1!A1:A2")
 *     .compile();
 *   Value val = wb.evaluate("A2");
 * </pre>
 * Cell contents are Numbers, Strings, Booleans or {@link
 * com.healthmarketscience.sheetcalc.expr.ErrorCode}s.  A String starting
 * with {@code '='} is a formula.
 *
 * @author James Ahlborn
 */
public class WorkbookBuilder
{
  /** the default sheet of unqualified addresses */
  public static final String DEFAULT_SHEET = "Sheet1";

  private String _defaultSheet = DEFAULT_SHEET;
  /** cell contents keyed by CellAddress or unparsed address String */
  private final Map<Object,Object> _cells = new LinkedHashMap<Object,Object>();
  /** array formulas keyed by CellRange or unparsed range String */
  private final Map<Object,String> _arrayFormulas =
    new LinkedHashMap<Object,String>();
  /** defined names to CellRange or unparsed range String */
  private final Map<String,Object> _names = new LinkedHashMap<String,Object>();
  private final List<StructuredTable> _tables = new ArrayList<StructuredTable>();
  private final List<CellEntry> _entries = new ArrayList<CellEntry>();
  private CellSource _cellSource;
  private FunctionLookup _funcs;
  private Boolean _iterative;
  private Integer _maxIterations;
  private Double _maxChange;

  public WorkbookBuilder() {
  }

  /**
   * Sets the sheet of unqualified addresses (in cell addresses, defined
   * names and formulas).  Defaults to {@value #DEFAULT_SHEET}.
   */
  public WorkbookBuilder setDefaultSheet(String defaultSheet) {
    _defaultSheet = defaultSheet;
    return this;
  }

  /**
   * Sets the contents of a cell, a String starting with {@code '='} is a
   * formula.
   */
  public WorkbookBuilder putCell(String address, Object content) {
    _cells.put(address, content);
    return this;
  }

  public WorkbookBuilder putCell(CellAddress address, Object content) {
    _cells.put(address, content);
    return this;
  }

  /**
   * Puts an array (CSE) formula which fills the given target range.
   */
  public WorkbookBuilder putArrayFormula(String target, String formula) {
    _arrayFormulas.put(target, formula);
    return this;
  }

  public WorkbookBuilder putArrayFormula(CellRange target, String formula) {
    _arrayFormulas.put(target, formula);
    return this;
  }

  /**
   * Adds a workbook scoped name for the given range.  Names which are valid
   * cell references (e.g. {@code "AB12"}) are rejected by {@link #compile}.
   */
  public WorkbookBuilder putDefinedName(String name, String range) {
    _names.put(name, range);
    return this;
  }

  public WorkbookBuilder putDefinedName(String name, CellRange range) {
    _names.put(name, range);
    return this;
  }

  public WorkbookBuilder putDefinedNames(Map<String,CellRange> names) {
    _names.putAll(names);
    return this;
  }

  public WorkbookBuilder addTable(StructuredTable table) {
    _tables.add(table);
    return this;
  }

  public WorkbookBuilder addTables(List<StructuredTable> tables) {
    _tables.addAll(tables);
    return this;
  }

  /**
   * Adds cells enumerated from another workbook (see {@link
   * Workbook#getEntries}).  Formulas of entries are already parsed and are
   * used as is.
   */
  public WorkbookBuilder addEntries(Iterable<CellEntry> entries) {
    for(CellEntry entry : entries) {
      _entries.add(entry);
    }
    return this;
  }

  /**
   * Sets the source consulted for cells which were never added to this
   * builder.
   */
  public WorkbookBuilder setCellSource(CellSource cellSource) {
    _cellSource = cellSource;
    return this;
  }

  public WorkbookBuilder setFunctionLookup(FunctionLookup funcs) {
    _funcs = funcs;
    return this;
  }

  /**
   * Enables iterative calculation of circular references.  Defaults to the
   * system property {@value
   * com.healthmarketscience.sheetcalc.impl.WorkbookEvalConfig#ITERATIVE_CALC_PROPERTY}
   * or {@code false}.
   */
  public WorkbookBuilder setIterative(boolean iterative) {
    _iterative = iterative;
    return this;
  }

  public WorkbookBuilder setMaxIterations(int maxIterations) {
    _maxIterations = maxIterations;
    return this;
  }

  public WorkbookBuilder setMaxChange(double maxChange) {
    _maxChange = maxChange;
    return this;
  }

  /**
   * Parses all formulas and builds the dependency graph of the configured
   * cells.
   *
   * @throws com.healthmarketscience.sheetcalc.expr.ParseException if a
   *         formula is malformed
   * @throws UnresolvedReferenceException if a formula uses an unknown name
   * @throws IllegalArgumentException if an address or defined name is
   *         malformed or a cell is defined more than once
   */
  public Workbook compile() {

    WorkbookEvalConfig config = new WorkbookEvalConfig();
    if(_funcs != null) {
      config.setFunctionLookup(_funcs);
    }
    if(_iterative != null) {
      config.setIterative(_iterative);
    }
    if(_maxIterations != null) {
      config.setMaxIterations(_maxIterations);
    }
    if(_maxChange != null) {
      config.setMaxChange(_maxChange);
    }

    Map<String,CellRange> names = new LinkedHashMap<String,CellRange>();
    for(Map.Entry<String,Object> e : _names.entrySet()) {
      names.put(e.getKey(), toRange(e.getValue()));
    }

    WorkbookImpl wb = new WorkbookImpl(_defaultSheet, config, _cellSource,
                                       names, _tables);

    for(CellEntry entry : _entries) {
      wb.addEntry(entry);
    }
    for(Map.Entry<Object,Object> e : _cells.entrySet()) {
      wb.addCell(toAddress(e.getKey()), e.getValue());
    }
    for(Map.Entry<Object,String> e : _arrayFormulas.entrySet()) {
      wb.addArrayFormula(toRange(e.getKey()), e.getValue());
    }

    wb.compile();
    return wb;
  }

  private CellAddress toAddress(Object addrObj) {
    if(addrObj instanceof CellAddress) {
      CellAddress addr = (CellAddress)addrObj;
      return ((addr.getSheet() != null) ? addr : addr.withSheet(_defaultSheet));
    }
    return CellAddress.parse((String)addrObj, _defaultSheet);
  }

  private CellRange toRange(Object rangeObj) {
    if(rangeObj instanceof CellRange) {
      CellRange range = (CellRange)rangeObj;
      return ((range.getSheet() != null) ? range :
              range.withSheet(_defaultSheet));
    }
    return CellRange.parse((String)rangeObj, _defaultSheet);
  }
}
