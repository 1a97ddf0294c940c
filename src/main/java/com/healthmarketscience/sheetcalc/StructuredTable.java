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
import java.util.Collections;
import java.util.List;

import com.healthmarketscience.sheetcalc.impl.CustomToStringStyle;

/**
 * Metadata for a table (list object) within a sheet, used to resolve
 * structured references like {@code Table1[Amount]} or {@code [@Amount]}.
 * The range of the table includes any header and totals rows.
 *
 * @author James Ahlborn
 */
public class StructuredTable
{
  private final String _name;
  private final CellRange _range;
  private final List<String> _columnNames;
  private final int _headerRowCount;
  private final int _totalsRowCount;

  public StructuredTable(String name, CellRange range,
                         List<String> columnNames) {
    this(name, range, columnNames, 1, 0);
  }

  public StructuredTable(String name, CellRange range,
                         List<String> columnNames, int headerRowCount,
                         int totalsRowCount) {
    if(range.isMultiArea() || range.isUnbounded()) {
      throw new IllegalArgumentException(
          "Table " + name + " must cover a single bounded area " + range);
    }
    if(columnNames.size() != range.getNumColumns()) {
      throw new IllegalArgumentException(
          "Table " + name + " has " + columnNames.size() +
          " column names for " + range.getNumColumns() + " columns");
    }
    if((headerRowCount < 0) || (totalsRowCount < 0) ||
       ((headerRowCount + totalsRowCount) >= range.getNumRows())) {
      throw new IllegalArgumentException(
          "Invalid header/totals row counts for table " + name);
    }
    _name = name;
    _range = range;
    _columnNames = Collections.unmodifiableList(
        new ArrayList<String>(columnNames));
    _headerRowCount = headerRowCount;
    _totalsRowCount = totalsRowCount;
  }

  public String getName() {
    return _name;
  }

  public CellRange getRange() {
    return _range;
  }

  public List<String> getColumnNames() {
    return _columnNames;
  }

  public int getHeaderRowCount() {
    return _headerRowCount;
  }

  public int getTotalsRowCount() {
    return _totalsRowCount;
  }

  /**
   * @return the 0 based index of the column with the given name (case
   *         insensitive), or -1 if there is no such column
   */
  public int getColumnIndex(String columnName) {
    for(int i = 0; i < _columnNames.size(); ++i) {
      if(_columnNames.get(i).equalsIgnoreCase(columnName)) {
        return i;
      }
    }
    return -1;
  }

  @Override
  public String toString() {
    return CustomToStringStyle.valueBuilder(this)
      .append("name", _name)
      .append("range", _range)
      .append("columnNames", _columnNames)
      .append("headerRowCount", _headerRowCount)
      .append("totalsRowCount", _totalsRowCount)
      .toString();
  }
}
