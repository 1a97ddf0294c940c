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
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.healthmarketscience.sheetcalc.CellAddress;
import com.healthmarketscience.sheetcalc.CellRange;
import com.healthmarketscience.sheetcalc.StructuredTable;
import com.healthmarketscience.sheetcalc.UnresolvedReferenceException;
import org.apache.commons.lang3.StringUtils;

/**
 * Resolves structured (table) references like {@code Table1[Amount]},
 * {@code Table1[[#Headers],[Amount]]}, {@code Table1[[Qty]:[Amount]]} or
 * {@code [@Amount]} to cell ranges.
 *
 * @author James Ahlborn
 */
class StructuredReferences
{
  private static final char BRACKET_START = '[';
  private static final char BRACKET_END = ']';
  private static final char ESCAPE_CHAR = '\'';
  private static final char ITEM_SEP = ',';
  private static final char SPAN_SEP = ':';
  private static final char THIS_ROW_CHAR = '@';
  private static final char SPECIAL_CHAR = '#';

  private enum Special {
    ALL("#ALL"), DATA("#DATA"), HEADERS("#HEADERS"), TOTALS("#TOTALS"),
    THIS_ROW("#THIS ROW");

    private final String _name;

    private Special(String name) {
      _name = name;
    }

    private static Special fromName(String str) {
      String name = StringUtils.normalizeSpace(str).toUpperCase(Locale.ROOT);
      for(Special special : values()) {
        if(special._name.equals(name)) {
          return special;
        }
      }
      return null;
    }
  }

  private StructuredReferences() {}

  /**
   * @return {@code true} if the given name is a structured reference
   */
  public static boolean isStructured(String name) {
    return (name.indexOf(BRACKET_START) >= 0);
  }

  /**
   * Resolves the given structured reference relative to the given cell.
   *
   * @param tables tables keyed by upper case table name
   * @return the referenced range, or {@code null} if a "this row" reference
   *         is used outside of the data rows of the table
   * @throws UnresolvedReferenceException if the table or a column is unknown
   *         or the reference is malformed
   */
  public static CellRange resolve(String ref, CellAddress current,
                                  Map<String,StructuredTable> tables) {

    int bracketIdx = ref.indexOf(BRACKET_START);
    String tableName = ref.substring(0, bracketIdx).trim();
    StructuredTable table = findTable(ref, tableName, current, tables);

    if(!ref.endsWith(String.valueOf(BRACKET_END))) {
      throw invalidRef(ref, "Malformed structured reference");
    }
    String itemsStr = ref.substring(bracketIdx + 1, ref.length() - 1).trim();

    Set<Special> specials = EnumSet.noneOf(Special.class);
    List<String> cols = new ArrayList<String>(2);
    boolean colSpan = false;

    if(itemsStr.isEmpty()) {
      // Table1[] is the data of the table
    } else if(itemsStr.charAt(0) != BRACKET_START) {
      addItem(ref, unescape(itemsStr), specials, cols);
    } else {
      int pos = 0;
      boolean expectItem = true;
      while(pos < itemsStr.length()) {
        char c = itemsStr.charAt(pos);
        if(Character.isWhitespace(c)) {
          ++pos;
        } else if(expectItem && (c == BRACKET_START)) {
          int end = findItemEnd(ref, itemsStr, pos + 1);
          addItem(ref, unescape(itemsStr.substring(pos + 1, end)), specials,
                  cols);
          pos = end + 1;
          expectItem = false;
        } else if(!expectItem && ((c == ITEM_SEP) || (c == SPAN_SEP))) {
          colSpan |= (c == SPAN_SEP);
          ++pos;
          expectItem = true;
        } else {
          throw invalidRef(ref, "Malformed structured reference");
        }
      }
      if(expectItem) {
        throw invalidRef(ref, "Malformed structured reference");
      }
    }

    if((cols.size() > 2) || (colSpan && (cols.size() != 2))) {
      throw invalidRef(ref, "Invalid column selection in structured reference");
    }

    return toRange(ref, table, specials, cols, current);
  }

  private static StructuredTable findTable(
      String ref, String tableName, CellAddress current,
      Map<String,StructuredTable> tables) {

    if(tableName.isEmpty()) {
      // a reference within the table containing the formula
      if(current != null) {
        for(StructuredTable table : tables.values()) {
          if(table.getRange().contains(current)) {
            return table;
          }
        }
      }
      throw new UnresolvedReferenceException(
          ref, "No table contains the cell " + current + " for reference " +
          ref);
    }

    StructuredTable table = tables.get(tableName.toUpperCase(Locale.ROOT));
    if(table == null) {
      throw new UnresolvedReferenceException(
          tableName, "Unknown table '" + tableName + "' in reference " + ref);
    }
    return table;
  }

  private static void addItem(String ref, String item, Set<Special> specials,
                              List<String> cols) {
    item = item.trim();
    if(item.isEmpty()) {
      throw invalidRef(ref, "Empty item in structured reference");
    }

    char c = item.charAt(0);
    if(c == SPECIAL_CHAR) {
      Special special = Special.fromName(item);
      if(special == null) {
        throw invalidRef(ref, "Unknown special item '" + item + "'");
      }
      specials.add(special);
    } else if(c == THIS_ROW_CHAR) {
      specials.add(Special.THIS_ROW);
      String col = item.substring(1).trim();
      if(!col.isEmpty()) {
        if(col.charAt(0) == BRACKET_START) {
          // [@[Col Name]]
          col = unescape(col.substring(1, col.length() - 1));
        }
        cols.add(col);
      }
    } else {
      cols.add(item);
    }
  }

  private static CellRange toRange(String ref, StructuredTable table,
                                   Set<Special> specials, List<String> cols,
                                   CellAddress current) {
    CellRange range = table.getRange();

    int firstCol = range.getFirstColumn();
    int lastCol = range.getLastColumn();
    if(!cols.isEmpty()) {
      int idx1 = getColumnIndex(ref, table, cols.get(0));
      int idx2 = getColumnIndex(ref, table, cols.get(cols.size() - 1));
      firstCol = range.getFirstColumn() + Math.min(idx1, idx2);
      lastCol = range.getFirstColumn() + Math.max(idx1, idx2);
    }

    int dataFirstRow = range.getFirstRow() + table.getHeaderRowCount();
    int dataLastRow = range.getLastRow() - table.getTotalsRowCount();

    int firstRow = Integer.MAX_VALUE;
    int lastRow = Integer.MIN_VALUE;
    if(specials.contains(Special.THIS_ROW)) {
      if(specials.size() > 1) {
        throw invalidRef(ref, "#This Row cannot be combined with other items");
      }
      int row = ((current != null) ? current.getRow() : -1);
      if(!StringUtils.equals(range.getSheet(),
                             ((current != null) ? current.getSheet() : null)) ||
         (row < dataFirstRow) || (row > dataLastRow)) {
        return null;
      }
      firstRow = row;
      lastRow = row;
    } else {
      if(specials.isEmpty()) {
        specials.add(Special.DATA);
      }
      if(specials.contains(Special.ALL)) {
        firstRow = range.getFirstRow();
        lastRow = range.getLastRow();
      }
      if(specials.contains(Special.HEADERS)) {
        if(table.getHeaderRowCount() == 0) {
          throw invalidRef(ref, "Table " + table.getName() +
                           " has no header rows");
        }
        firstRow = Math.min(firstRow, range.getFirstRow());
        lastRow = Math.max(lastRow, dataFirstRow - 1);
      }
      if(specials.contains(Special.DATA)) {
        firstRow = Math.min(firstRow, dataFirstRow);
        lastRow = Math.max(lastRow, dataLastRow);
      }
      if(specials.contains(Special.TOTALS)) {
        if(table.getTotalsRowCount() == 0) {
          throw invalidRef(ref, "Table " + table.getName() +
                           " has no totals rows");
        }
        firstRow = Math.min(firstRow, dataLastRow + 1);
        lastRow = Math.max(lastRow, range.getLastRow());
      }
    }

    return CellRange.of(range.getSheet(), firstRow, firstCol, lastRow, lastCol);
  }

  private static int getColumnIndex(String ref, StructuredTable table,
                                    String col) {
    int idx = table.getColumnIndex(col);
    if(idx < 0) {
      throw new UnresolvedReferenceException(
          col, "Unknown column '" + col + "' of table " + table.getName() +
          " in reference " + ref);
    }
    return idx;
  }

  private static int findItemEnd(String ref, String itemsStr, int start) {
    int level = 1;
    for(int i = start; i < itemsStr.length(); ++i) {
      char c = itemsStr.charAt(i);
      if(c == ESCAPE_CHAR) {
        ++i;
      } else if(c == BRACKET_START) {
        ++level;
      } else if((c == BRACKET_END) && (--level == 0)) {
        return i;
      }
    }
    throw invalidRef(ref, "Malformed structured reference");
  }

  private static String unescape(String str) {
    if(str.indexOf(ESCAPE_CHAR) < 0) {
      return str;
    }
    StringBuilder sb = new StringBuilder(str.length());
    for(int i = 0; i < str.length(); ++i) {
      char c = str.charAt(i);
      if((c == ESCAPE_CHAR) && ((i + 1) < str.length())) {
        c = str.charAt(++i);
      }
      sb.append(c);
    }
    return sb.toString();
  }

  private static UnresolvedReferenceException invalidRef(String ref,
                                                         String msg) {
    return new UnresolvedReferenceException(ref, msg + " " + ref);
  }
}
