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

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

/**
 * Immutable address of a single cell: optional sheet name, 1 based row and
 * column indexes and the absolute/relative flag of each axis.  Two addresses
 * are equal if they identify the same cell, the absolute flags only affect
 * the formula text.
 *
 * @author James Ahlborn
 */
public class CellAddress implements Comparable<CellAddress>
{
  /** the number of columns in a sheet */
  public static final int MAX_COL = 16384;
  /** the number of rows in a sheet */
  public static final int MAX_ROW = 1048576;

  static final char SHEET_SEP_CHAR = '!';
  static final char SHEET_QUOTE_CHAR = '\'';
  private static final char ABS_CHAR = '$';

  private static final Pattern A1_PAT = Pattern.compile(
      "(\\$?)([A-Za-z]{1,3})(\\$?)([0-9]{1,7})");
  private static final Pattern R1C1_PAT = Pattern.compile(
      "[Rr](\\[-?[0-9]+\\]|[0-9]+)?[Cc](\\[-?[0-9]+\\]|[0-9]+)?");
  private static final Pattern SIMPLE_SHEET_PAT = Pattern.compile(
      "[A-Za-z_][A-Za-z0-9_.]*");

  private final String _sheet;
  private final int _row;
  private final int _col;
  private final boolean _absRow;
  private final boolean _absCol;

  public CellAddress(String sheet, int row, int col) {
    this(sheet, row, col, false, false);
  }

  public CellAddress(String sheet, int row, int col,
                     boolean absRow, boolean absCol) {
    if(!isValidRow(row) || !isValidColumn(col)) {
      throw new IllegalArgumentException(
          "Invalid cell coordinates row " + row + ", column " + col);
    }
    _sheet = StringUtils.trimToNull(sheet);
    _row = row;
    _col = col;
    _absRow = absRow;
    _absCol = absCol;
  }

  public String getSheet() {
    return _sheet;
  }

  public int getRow() {
    return _row;
  }

  public int getColumn() {
    return _col;
  }

  public boolean isRowAbsolute() {
    return _absRow;
  }

  public boolean isColumnAbsolute() {
    return _absCol;
  }

  public String getColumnLetters() {
    return toColumnLetters(_col);
  }

  /**
   * @return this address on the given sheet
   */
  public CellAddress withSheet(String sheet) {
    return new CellAddress(sheet, _row, _col, _absRow, _absCol);
  }

  /**
   * @return this address shifted by the given number of rows and columns, or
   *         {@code null} if the result would fall outside of the sheet
   */
  public CellAddress offset(int rows, int cols) {
    int row = _row + rows;
    int col = _col + cols;
    if(!isValidRow(row) || !isValidColumn(col)) {
      return null;
    }
    return new CellAddress(_sheet, row, col, _absRow, _absCol);
  }

  /**
   * @return the address in A1 notation without the sheet name
   */
  public String toLocalString() {
    StringBuilder sb = new StringBuilder();
    if(_absCol) {
      sb.append(ABS_CHAR);
    }
    sb.append(getColumnLetters());
    if(_absRow) {
      sb.append(ABS_CHAR);
    }
    return sb.append(_row).toString();
  }

  @Override
  public int compareTo(CellAddress o) {
    int cmp = StringUtils.compare(_sheet, o._sheet);
    if(cmp != 0) {
      return cmp;
    }
    cmp = Integer.compare(_row, o._row);
    if(cmp != 0) {
      return cmp;
    }
    return Integer.compare(_col, o._col);
  }

  @Override
  public boolean equals(Object o) {
    if(this == o) {
      return true;
    }
    if(!(o instanceof CellAddress)) {
      return false;
    }
    CellAddress other = (CellAddress)o;
    return ((_row == other._row) && (_col == other._col) &&
            Objects.equals(_sheet, other._sheet));
  }

  @Override
  public int hashCode() {
    return (Objects.hashCode(_sheet) * 31 + _row) * 31 + _col;
  }

  @Override
  public String toString() {
    return toSheetPrefix(_sheet) + toLocalString();
  }

  /**
   * Parses an address in A1 notation, e.g. {@code "Sheet1!$A$1"}.
   *
   * @param str the address text
   * @param defaultSheet sheet for addresses without an explicit sheet
   * @throws IllegalArgumentException if the text is not a valid address
   */
  public static CellAddress parse(String str, String defaultSheet) {
    CellAddress addr = tryParse(str, defaultSheet);
    if(addr == null) {
      throw new IllegalArgumentException("Invalid cell address '" + str + "'");
    }
    return addr;
  }

  /**
   * Parses an address in A1 notation.
   *
   * @return the parsed address or {@code null} if the text is not a valid
   *         address
   */
  public static CellAddress tryParse(String str, String defaultSheet) {
    String[] parts = splitSheetName(str);
    if(parts == null) {
      return null;
    }
    String sheet = ((parts[0] != null) ? parts[0] : defaultSheet);
    return parseLocal(parts[1], sheet);
  }

  /**
   * Parses an address in R1C1 notation, e.g. {@code "R2C3"} or
   * {@code "R[-1]C"}.  Bracketed offsets and missing indexes are relative to
   * the given base cell.
   *
   * @return the parsed address or {@code null} if the text is not a valid
   *         R1C1 address
   */
  public static CellAddress tryParseR1C1(String str, CellAddress base) {
    String[] parts = splitSheetName(str);
    if(parts == null) {
      return null;
    }
    Matcher m = R1C1_PAT.matcher(parts[1].trim());
    if(!m.matches()) {
      return null;
    }
    String sheet = ((parts[0] != null) ? parts[0] : base.getSheet());
    int row = parseR1C1Index(m.group(1), base.getRow());
    int col = parseR1C1Index(m.group(2), base.getColumn());
    if(!isValidRow(row) || !isValidColumn(col)) {
      return null;
    }
    return new CellAddress(sheet, row, col, isAbsoluteR1C1(m.group(1)),
                           isAbsoluteR1C1(m.group(2)));
  }

  private static int parseR1C1Index(String idxStr, int baseIdx) {
    if(idxStr == null) {
      return baseIdx;
    }
    if(idxStr.charAt(0) == '[') {
      return baseIdx + Integer.parseInt(
          idxStr.substring(1, idxStr.length() - 1));
    }
    return Integer.parseInt(idxStr);
  }

  private static boolean isAbsoluteR1C1(String idxStr) {
    return ((idxStr != null) && (idxStr.charAt(0) != '['));
  }

  static CellAddress parseLocal(String str, String sheet) {
    Matcher m = A1_PAT.matcher(str.trim());
    if(!m.matches()) {
      return null;
    }
    int col = toColumnIndex(m.group(2));
    int row = Integer.parseInt(m.group(4));
    if(!isValidRow(row) || !isValidColumn(col)) {
      return null;
    }
    return new CellAddress(sheet, row, col, !m.group(3).isEmpty(),
                           !m.group(1).isEmpty());
  }

  public static boolean isValidRow(int row) {
    return ((row >= 1) && (row <= MAX_ROW));
  }

  public static boolean isValidColumn(int col) {
    return ((col >= 1) && (col <= MAX_COL));
  }

  /**
   * @return the 1 based index of the given column letters, e.g. 28 for
   *         {@code "AB"}, or -1 if the letters are invalid
   */
  public static int toColumnIndex(String letters) {
    if(StringUtils.isEmpty(letters) || (letters.length() > 3)) {
      return -1;
    }
    int col = 0;
    for(int i = 0; i < letters.length(); ++i) {
      char c = Character.toUpperCase(letters.charAt(i));
      if((c < 'A') || (c > 'Z')) {
        return -1;
      }
      col = (col * 26) + (c - 'A' + 1);
    }
    return col;
  }

  /**
   * @return the column letters for the given 1 based column index
   */
  public static String toColumnLetters(int col) {
    StringBuilder sb = new StringBuilder(3);
    while(col > 0) {
      int rem = (col - 1) % 26;
      sb.insert(0, (char)('A' + rem));
      col = (col - 1) / 26;
    }
    return sb.toString();
  }

  /**
   * Splits a reference into sheet name and local part.  Quoted sheet names
   * ({@code 'My Sheet'!A1}) are unquoted.
   *
   * @return two element array of sheet name (or {@code null}) and local
   *         part, or {@code null} if the quoting is malformed
   */
  static String[] splitSheetName(String ref) {
    if(ref == null) {
      return null;
    }
    ref = ref.trim();
    if((ref.length() > 0) && (ref.charAt(0) == SHEET_QUOTE_CHAR)) {
      StringBuilder sb = new StringBuilder();
      int i = 1;
      for(; i < ref.length(); ++i) {
        char c = ref.charAt(i);
        if(c == SHEET_QUOTE_CHAR) {
          if(((i + 1) < ref.length()) &&
             (ref.charAt(i + 1) == SHEET_QUOTE_CHAR)) {
            sb.append(c);
            ++i;
            continue;
          }
          break;
        }
        sb.append(c);
      }
      if(((i + 1) >= ref.length()) ||
         (ref.charAt(i + 1) != SHEET_SEP_CHAR)) {
        return null;
      }
      return new String[]{sb.toString(), ref.substring(i + 2)};
    }

    int sepIdx = ref.lastIndexOf(SHEET_SEP_CHAR);
    if(sepIdx < 0) {
      return new String[]{null, ref};
    }
    if(sepIdx == 0) {
      return null;
    }
    return new String[]{ref.substring(0, sepIdx), ref.substring(sepIdx + 1)};
  }

  /**
   * @return the sheet name (quoted if necessary) followed by the sheet
   *         separator, or the empty string for a {@code null} sheet
   */
  static String toSheetPrefix(String sheet) {
    if(sheet == null) {
      return "";
    }
    if(SIMPLE_SHEET_PAT.matcher(sheet).matches()) {
      return sheet + SHEET_SEP_CHAR;
    }
    return SHEET_QUOTE_CHAR +
      StringUtils.replace(sheet, "'", "''") + SHEET_QUOTE_CHAR +
      SHEET_SEP_CHAR;
  }
}
