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
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

/**
 * Immutable reference to one or more rectangular areas of cells on a single
 * sheet.  A single area range is defined by its top-left and bottom-right
 * addresses and is always normalized on construction.  An area may be
 * unbounded on one axis (whole columns like {@code A:C} or whole rows like
 * {@code 2:5}).  A multi-area range (e.g. a defined name referring to
 * {@code A1:B2,D4}) holds its areas in order, the first area doubling as
 * "the" area of the range.
 *
 * @author James Ahlborn
 */
public class CellRange implements Iterable<CellAddress>
{
  private static final char RANGE_SEP_CHAR = ':';
  private static final char AREA_SEP_CHAR = ',';
  private static final char ABS_CHAR = '$';
  private static final Pattern COL_PAT = Pattern.compile("\\$?[A-Za-z]{1,3}");
  private static final Pattern ROW_PAT = Pattern.compile("\\$?[0-9]{1,7}");

  private final CellAddress _start;
  private final CellAddress _end;
  private final boolean _fullColumns;
  private final boolean _fullRows;
  private final List<CellRange> _areas;

  private CellRange(CellAddress start, CellAddress end,
                    boolean fullColumns, boolean fullRows) {
    String sheet = start.getSheet();
    if((end.getSheet() != null) && !Objects.equals(sheet, end.getSheet())) {
      throw new IllegalArgumentException(
          "Range corners on different sheets " + start + ", " + end);
    }
    int firstRow = Math.min(start.getRow(), end.getRow());
    int lastRow = Math.max(start.getRow(), end.getRow());
    int firstCol = Math.min(start.getColumn(), end.getColumn());
    int lastCol = Math.max(start.getColumn(), end.getColumn());
    // the absolute flags stay with the coordinate they were given for
    boolean startRowFirst = (start.getRow() <= end.getRow());
    boolean startColFirst = (start.getColumn() <= end.getColumn());
    _start = new CellAddress(
        sheet, firstRow, firstCol,
        (startRowFirst ? start : end).isRowAbsolute(),
        (startColFirst ? start : end).isColumnAbsolute());
    _end = new CellAddress(
        sheet, lastRow, lastCol,
        (startRowFirst ? end : start).isRowAbsolute(),
        (startColFirst ? end : start).isColumnAbsolute());
    _fullColumns = fullColumns;
    _fullRows = fullRows;
    _areas = null;
  }

  private CellRange(List<CellRange> areas) {
    CellRange first = areas.get(0);
    _start = first._start;
    _end = first._end;
    _fullColumns = first._fullColumns;
    _fullRows = first._fullRows;
    _areas = Collections.unmodifiableList(new ArrayList<CellRange>(areas));
  }

  public static CellRange of(CellAddress cell) {
    return new CellRange(cell, cell, false, false);
  }

  public static CellRange of(CellAddress start, CellAddress end) {
    return new CellRange(start, end, false, false);
  }

  public static CellRange of(String sheet, int firstRow, int firstCol,
                             int lastRow, int lastCol) {
    return new CellRange(new CellAddress(sheet, firstRow, firstCol),
                         new CellAddress(sheet, lastRow, lastCol),
                         false, false);
  }

  /**
   * @return a range of whole columns, e.g. {@code A:C}
   */
  public static CellRange ofColumns(String sheet, int firstCol, int lastCol) {
    return new CellRange(new CellAddress(sheet, 1, firstCol),
                         new CellAddress(sheet, CellAddress.MAX_ROW, lastCol),
                         true, false);
  }

  /**
   * @return a range of whole rows, e.g. {@code 2:5}
   */
  public static CellRange ofRows(String sheet, int firstRow, int lastRow) {
    return new CellRange(new CellAddress(sheet, firstRow, 1),
                         new CellAddress(sheet, lastRow, CellAddress.MAX_COL),
                         false, true);
  }

  /**
   * @return a range made of all the areas of the given ranges (duplicate
   *         areas are kept, as a spreadsheet union does)
   */
  public static CellRange union(List<CellRange> ranges) {
    List<CellRange> areas = new ArrayList<CellRange>();
    for(CellRange range : ranges) {
      areas.addAll(range.getAreas());
    }
    if(areas.isEmpty()) {
      throw new IllegalArgumentException("No areas given");
    }
    if(areas.size() == 1) {
      return areas.get(0);
    }
    String sheet = areas.get(0).getSheet();
    for(CellRange area : areas) {
      if(!Objects.equals(sheet, area.getSheet())) {
        throw new IllegalArgumentException(
            "Union of areas on different sheets " + areas);
      }
    }
    return new CellRange(areas);
  }

  /**
   * @return the smallest single area range which contains both of the given
   *         ranges (as the {@code :} operator does)
   */
  public static CellRange bounding(CellRange r1, CellRange r2) {
    if(!Objects.equals(r1.getSheet(), r2.getSheet())) {
      throw new IllegalArgumentException(
          "Range corners on different sheets " + r1 + ", " + r2);
    }
    CellAddress rowStart = ((r1.getFirstRow() <= r2.getFirstRow()) ?
                            r1._start : r2._start);
    CellAddress colStart = ((r1.getFirstColumn() <= r2.getFirstColumn()) ?
                            r1._start : r2._start);
    CellAddress rowEnd = ((r1.getLastRow() >= r2.getLastRow()) ?
                          r1._end : r2._end);
    CellAddress colEnd = ((r1.getLastColumn() >= r2.getLastColumn()) ?
                          r1._end : r2._end);
    return new CellRange(
        new CellAddress(r1.getSheet(), rowStart.getRow(), colStart.getColumn(),
                        rowStart.isRowAbsolute(),
                        colStart.isColumnAbsolute()),
        new CellAddress(r1.getSheet(), rowEnd.getRow(), colEnd.getColumn(),
                        rowEnd.isRowAbsolute(), colEnd.isColumnAbsolute()),
        (r1._fullColumns && r2._fullColumns), (r1._fullRows && r2._fullRows));
  }

  public String getSheet() {
    return _start.getSheet();
  }

  public CellAddress getStart() {
    return _start;
  }

  public CellAddress getEnd() {
    return _end;
  }

  public int getFirstRow() {
    return _start.getRow();
  }

  public int getLastRow() {
    return _end.getRow();
  }

  public int getFirstColumn() {
    return _start.getColumn();
  }

  public int getLastColumn() {
    return _end.getColumn();
  }

  public int getNumRows() {
    return getLastRow() - getFirstRow() + 1;
  }

  public int getNumColumns() {
    return getLastColumn() - getFirstColumn() + 1;
  }

  public long getNumCells() {
    long num = 0L;
    for(CellRange area : getAreas()) {
      num += ((long)area.getNumRows() * area.getNumColumns());
    }
    return num;
  }

  public boolean isSingleCell() {
    return ((_areas == null) && _start.equals(_end));
  }

  public boolean isMultiArea() {
    return (_areas != null);
  }

  /**
   * @return {@code true} if this range spans whole columns ({@code A:C})
   */
  public boolean isFullColumns() {
    return _fullColumns;
  }

  /**
   * @return {@code true} if this range spans whole rows ({@code 2:5})
   */
  public boolean isFullRows() {
    return _fullRows;
  }

  public boolean isUnbounded() {
    for(CellRange area : getAreas()) {
      if(area._fullColumns || area._fullRows) {
        return true;
      }
    }
    return false;
  }

  /**
   * @return the single area ranges making up this range
   */
  public List<CellRange> getAreas() {
    if(_areas != null) {
      return _areas;
    }
    return Collections.singletonList(this);
  }

  /**
   * @return the first (or only) area of this range
   */
  public CellRange getFirstArea() {
    return ((_areas != null) ? _areas.get(0) : this);
  }

  /**
   * @return the address at the given (0 based) offset within the first area
   */
  public CellAddress getCell(int rowOffset, int colOffset) {
    return new CellAddress(getSheet(), getFirstRow() + rowOffset,
                           getFirstColumn() + colOffset);
  }

  public boolean contains(CellAddress addr) {
    for(CellRange area : getAreas()) {
      if(Objects.equals(area.getSheet(), addr.getSheet()) &&
         (addr.getRow() >= area.getFirstRow()) &&
         (addr.getRow() <= area.getLastRow()) &&
         (addr.getColumn() >= area.getFirstColumn()) &&
         (addr.getColumn() <= area.getLastColumn())) {
        return true;
      }
    }
    return false;
  }

  /**
   * @return the overlap of the first areas of this and the given range, or
   *         {@code null} if they do not overlap
   */
  public CellRange intersect(CellRange other) {
    if(!Objects.equals(getSheet(), other.getSheet())) {
      return null;
    }
    int firstRow = Math.max(getFirstRow(), other.getFirstRow());
    int lastRow = Math.min(getLastRow(), other.getLastRow());
    int firstCol = Math.max(getFirstColumn(), other.getFirstColumn());
    int lastCol = Math.min(getLastColumn(), other.getLastColumn());
    if((firstRow > lastRow) || (firstCol > lastCol)) {
      return null;
    }
    return of(getSheet(), firstRow, firstCol, lastRow, lastCol);
  }

  /**
   * Computes a range relative to the first area of this range, following the
   * rules of the OFFSET function.
   *
   * @param rows rows to move the top-left corner
   * @param cols columns to move the top-left corner
   * @param height height of the result, &lt;= 0 for the height of this range
   * @param width width of the result, &lt;= 0 for the width of this range
   * @return the new range, or {@code null} if it would fall outside of the
   *         sheet
   */
  public CellRange offset(int rows, int cols, int height, int width) {
    if(height <= 0) {
      height = getNumRows();
    }
    if(width <= 0) {
      width = getNumColumns();
    }
    int firstRow = getFirstRow() + rows;
    int firstCol = getFirstColumn() + cols;
    int lastRow = firstRow + height - 1;
    int lastCol = firstCol + width - 1;
    if(!CellAddress.isValidRow(firstRow) || !CellAddress.isValidRow(lastRow) ||
       !CellAddress.isValidColumn(firstCol) ||
       !CellAddress.isValidColumn(lastCol)) {
      return null;
    }
    return of(getSheet(), firstRow, firstCol, lastRow, lastCol);
  }

  /**
   * @return this range with any unbounded axis limited to the given extent
   *         (at least one row/column is kept)
   */
  public CellRange clip(int maxRow, int maxCol) {
    if(_areas != null) {
      List<CellRange> areas = new ArrayList<CellRange>(_areas.size());
      for(CellRange area : _areas) {
        areas.add(area.clip(maxRow, maxCol));
      }
      return new CellRange(areas);
    }
    if(!_fullColumns && !_fullRows) {
      return this;
    }
    int lastRow = (_fullColumns ?
                   Math.max(getFirstRow(), Math.min(getLastRow(), maxRow)) :
                   getLastRow());
    int lastCol = (_fullRows ?
                   Math.max(getFirstColumn(), Math.min(getLastColumn(), maxCol)) :
                   getLastColumn());
    return of(getSheet(), getFirstRow(), getFirstColumn(), lastRow, lastCol);
  }

  /**
   * @return this range on the given sheet
   */
  public CellRange withSheet(String sheet) {
    List<CellRange> areas = new ArrayList<CellRange>();
    for(CellRange area : getAreas()) {
      areas.add(new CellRange(area._start.withSheet(sheet),
                              area._end.withSheet(sheet),
                              area._fullColumns, area._fullRows));
    }
    return ((areas.size() == 1) ? areas.get(0) : new CellRange(areas));
  }

  /**
   * Iterates the addresses of all the areas of this range in row major
   * order.
   */
  @Override
  public Iterator<CellAddress> iterator() {
    return new AddressIterator();
  }

  @Override
  public boolean equals(Object o) {
    if(this == o) {
      return true;
    }
    if(!(o instanceof CellRange)) {
      return false;
    }
    CellRange other = (CellRange)o;
    return (_start.equals(other._start) && _end.equals(other._end) &&
            (_fullColumns == other._fullColumns) &&
            (_fullRows == other._fullRows) &&
            Objects.equals(_areas, other._areas));
  }

  @Override
  public int hashCode() {
    return Objects.hash(_start, _end, _fullColumns, _fullRows, _areas);
  }

  @Override
  public String toString() {
    if(_areas != null) {
      StringBuilder sb = new StringBuilder();
      for(CellRange area : _areas) {
        if(sb.length() > 0) {
          sb.append(AREA_SEP_CHAR);
        }
        sb.append(area);
      }
      return sb.toString();
    }
    return CellAddress.toSheetPrefix(getSheet()) + toLocalString();
  }

  /**
   * @return the first area of this range in A1 notation without the sheet
   *         name
   */
  public String toLocalString() {
    if(_fullColumns) {
      return absPrefix(_start.isColumnAbsolute()) +
        _start.getColumnLetters() + RANGE_SEP_CHAR +
        absPrefix(_end.isColumnAbsolute()) + _end.getColumnLetters();
    }
    if(_fullRows) {
      return absPrefix(_start.isRowAbsolute()) + _start.getRow() +
        RANGE_SEP_CHAR + absPrefix(_end.isRowAbsolute()) + _end.getRow();
    }
    if(_start.equals(_end)) {
      return _start.toLocalString();
    }
    return _start.toLocalString() + RANGE_SEP_CHAR + _end.toLocalString();
  }

  /**
   * Parses a range in A1 notation.  Supports single cells, rectangular ranges
   * ({@code A1:B2}), unbounded ranges ({@code A:C}, {@code 2:5}), multi colon
   * ranges (resolved to their bounding rectangle) and comma separated
   * multi-area ranges.
   *
   * @throws IllegalArgumentException if the text is not a valid range
   */
  public static CellRange parse(String str, String defaultSheet) {
    CellRange range = tryParse(str, defaultSheet);
    if(range == null) {
      throw new IllegalArgumentException("Invalid cell range '" + str + "'");
    }
    return range;
  }

  /**
   * Parses a range in A1 notation.
   *
   * @return the parsed range or {@code null} if the text is not a valid
   *         range
   */
  public static CellRange tryParse(String str, String defaultSheet) {
    if(StringUtils.isBlank(str)) {
      return null;
    }
    List<String> areaStrs = splitOutsideQuotes(str, AREA_SEP_CHAR);
    if(areaStrs == null) {
      return null;
    }
    List<CellRange> areas = new ArrayList<CellRange>(areaStrs.size());
    for(String areaStr : areaStrs) {
      CellRange area = parseArea(areaStr, defaultSheet);
      if((area == null) ||
         (!areas.isEmpty() &&
          !Objects.equals(areas.get(0).getSheet(), area.getSheet()))) {
        return null;
      }
      areas.add(area);
    }
    return union(areas);
  }

  private static CellRange parseArea(String str, String defaultSheet) {
    List<String> partStrs = splitOutsideQuotes(str, RANGE_SEP_CHAR);
    if(partStrs == null) {
      return null;
    }

    String sheet = null;
    List<String> locals = new ArrayList<String>(partStrs.size());
    for(String partStr : partStrs) {
      String[] sheetParts = CellAddress.splitSheetName(partStr);
      if(sheetParts == null) {
        return null;
      }
      if(sheetParts[0] != null) {
        if((sheet != null) && !sheet.equals(sheetParts[0])) {
          // 3-D references are not a single range
          return null;
        }
        sheet = sheetParts[0];
      }
      locals.add(sheetParts[1].trim());
    }
    if(sheet == null) {
      sheet = defaultSheet;
    }

    if(locals.size() == 1) {
      CellAddress addr = CellAddress.parseLocal(locals.get(0), sheet);
      return ((addr != null) ? of(addr) : null);
    }

    CellRange result = null;
    for(String local : locals) {
      CellRange part = parseAreaPart(local, sheet);
      if(part == null) {
        return null;
      }
      if(result != null) {
        if((result._fullColumns != part._fullColumns) ||
           (result._fullRows != part._fullRows)) {
          return null;
        }
        part = bounding(result, part);
      }
      result = part;
    }
    return result;
  }

  private static CellRange parseAreaPart(String local, String sheet) {
    boolean abs = (local.charAt(0) == ABS_CHAR);
    if(COL_PAT.matcher(local).matches()) {
      int col = CellAddress.toColumnIndex(StringUtils.removeStart(local, "$"));
      if(!CellAddress.isValidColumn(col)) {
        return null;
      }
      return new CellRange(new CellAddress(sheet, 1, col, false, abs),
                           new CellAddress(sheet, CellAddress.MAX_ROW, col,
                                           false, abs),
                           true, false);
    }
    if(ROW_PAT.matcher(local).matches()) {
      int row = Integer.parseInt(StringUtils.removeStart(local, "$"));
      if(!CellAddress.isValidRow(row)) {
        return null;
      }
      return new CellRange(new CellAddress(sheet, row, 1, abs, false),
                           new CellAddress(sheet, row, CellAddress.MAX_COL,
                                           abs, false),
                           false, true);
    }
    CellAddress addr = CellAddress.parseLocal(local, sheet);
    return ((addr != null) ? of(addr) : null);
  }

  private static String absPrefix(boolean abs) {
    return (abs ? String.valueOf(ABS_CHAR) : "");
  }

  private static List<String> splitOutsideQuotes(String str, char sepChar) {
    List<String> parts = new ArrayList<String>();
    boolean inQuote = false;
    int start = 0;
    for(int i = 0; i < str.length(); ++i) {
      char c = str.charAt(i);
      if(c == CellAddress.SHEET_QUOTE_CHAR) {
        inQuote = !inQuote;
      } else if(!inQuote && (c == sepChar)) {
        parts.add(str.substring(start, i));
        start = i + 1;
      }
    }
    if(inQuote) {
      return null;
    }
    parts.add(str.substring(start));
    for(String part : parts) {
      if(StringUtils.isBlank(part)) {
        return null;
      }
    }
    return parts;
  }

  private final class AddressIterator implements Iterator<CellAddress>
  {
    private final Iterator<CellRange> _areaIter = getAreas().iterator();
    private CellRange _area;
    private int _row;
    private int _col;

    private AddressIterator() {
      nextArea();
    }

    private void nextArea() {
      _area = (_areaIter.hasNext() ? _areaIter.next() : null);
      if(_area != null) {
        _row = _area.getFirstRow();
        _col = _area.getFirstColumn();
      }
    }

    @Override
    public boolean hasNext() {
      return (_area != null);
    }

    @Override
    public CellAddress next() {
      if(!hasNext()) {
        throw new NoSuchElementException();
      }
      CellAddress addr = new CellAddress(_area.getSheet(), _row, _col);
      if(_col < _area.getLastColumn()) {
        ++_col;
      } else if(_row < _area.getLastRow()) {
        _col = _area.getFirstColumn();
        ++_row;
      } else {
        nextArea();
      }
      return addr;
    }
  }
}
