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
import java.util.Arrays;
import java.util.List;

import junit.framework.TestCase;

/**
 *
 * @author James Ahlborn
 */
public class CellRangeTest extends TestCase
{

  public CellRangeTest(String name) {
    super(name);
  }

  public void testParse() throws Exception
  {
    CellRange range = CellRange.parse("B3:A1", "Sheet1");
    assertEquals("Sheet1!A1:B3", range.toString());
    assertEquals(3, range.getNumRows());
    assertEquals(2, range.getNumColumns());
    assertEquals(6L, range.getNumCells());
    assertFalse(range.isSingleCell());
    assertFalse(range.isUnbounded());

    range = CellRange.parse("Data!C5", "Sheet1");
    assertTrue(range.isSingleCell());
    assertEquals("Data", range.getSheet());
    assertEquals("Data!C5", range.toString());

    // absolute markers stay with their coordinates
    range = CellRange.parse("$B$2:C3", "Sheet1");
    assertTrue(range.getStart().isRowAbsolute());
    assertTrue(range.getStart().isColumnAbsolute());
    assertFalse(range.getEnd().isRowAbsolute());
    assertEquals("Sheet1!$B$2:C3", range.toString());
    assertEquals("Sheet1!B$2:$C3",
                 CellRange.parse("$C3:B$2", "Sheet1").toString());
    assertEquals("Sheet1!$A:C", CellRange.parse("$A:C", "Sheet1").toString());
    assertEquals("Sheet1!2:$5", CellRange.parse("2:$5", "Sheet1").toString());
    assertEquals(CellRange.parse("B2:C3", "Sheet1"), range);

    // colon chains resolve to the bounding rectangle
    assertEquals(CellRange.parse("A1:D6", "Sheet1"),
                 CellRange.parse("B2:A1:D6", "Sheet1"));
    assertEquals("Sheet1!$A$1:D6",
                 CellRange.parse("B2:$A$1:D6", "Sheet1").toString());

    range = CellRange.parse("A:C", "Sheet1");
    assertTrue(range.isFullColumns());
    assertTrue(range.isUnbounded());
    assertEquals(CellAddress.MAX_ROW, range.getNumRows());
    assertEquals("Sheet1!A:C", range.toString());

    range = CellRange.parse("2:5", "Sheet1");
    assertTrue(range.isFullRows());
    assertEquals(4, range.getNumRows());
    assertEquals(CellAddress.MAX_COL, range.getNumColumns());
    assertEquals("Sheet1!2:5", range.toString());

    range = CellRange.parse("A1:B2,D4", "Sheet1");
    assertTrue(range.isMultiArea());
    assertEquals(2, range.getAreas().size());
    assertEquals(5L, range.getNumCells());
    assertEquals("Sheet1!A1:B2,Sheet1!D4", range.toString());

    for(String invalid : new String[]{"", "A1:", ":B2", "A1:3", "Sheet1!A1:Sheet2!B2",
                                      "A1,Sheet2!B2", "'Open!A1"}) {
      assertNull(invalid, CellRange.tryParse(invalid, "Sheet1"));
    }
  }

  public void testContainsAndIterate() throws Exception
  {
    CellRange range = CellRange.parse("B2:C3", "Sheet1");
    assertTrue(range.contains(CellAddress.parse("C3", "Sheet1")));
    assertFalse(range.contains(CellAddress.parse("A1", "Sheet1")));
    assertFalse(range.contains(CellAddress.parse("Other!B2", "Sheet1")));

    List<String> addrs = new ArrayList<String>();
    for(CellAddress addr : CellRange.parse("A1:B2,D4", "Sheet1")) {
      addrs.add(addr.toLocalString());
    }
    assertEquals(Arrays.asList("A1", "B1", "A2", "B2", "D4"), addrs);

    assertEquals(CellAddress.parse("C3", "Sheet1"), range.getCell(1, 1));
  }

  public void testRangeMath() throws Exception
  {
    CellRange r1 = CellRange.parse("A1:C3", "Sheet1");
    CellRange r2 = CellRange.parse("B2:D4", "Sheet1");

    assertEquals(CellRange.parse("B2:C3", "Sheet1"), r1.intersect(r2));
    assertNull(r1.intersect(CellRange.parse("E5", "Sheet1")));
    assertNull(r1.intersect(CellRange.parse("Other!A1", "Sheet1")));

    assertEquals(CellRange.parse("A1:D4", "Sheet1"),
                 CellRange.bounding(r1, r2));

    assertEquals(CellRange.parse("B3:D5", "Sheet1"),
                 r1.offset(2, 1, 0, 0));
    assertEquals(CellRange.parse("B3", "Sheet1"),
                 r1.offset(2, 1, 1, 1));
    assertNull(r1.offset(-1, 0, 0, 0));

    CellRange cols = CellRange.parse("B:C", "Sheet1");
    assertEquals(CellRange.parse("B1:C10", "Sheet1"), cols.clip(10, 7));
    assertEquals(CellRange.parse("B1:C1", "Sheet1"), cols.clip(0, 0));
    assertSame(r1, r1.clip(1, 1));

    CellRange union = CellRange.union(Arrays.asList(r1, r2));
    assertTrue(union.isMultiArea());
    assertEquals(18L, union.getNumCells());
    assertEquals(r1, union.getFirstArea());

    try {
      CellRange.union(Arrays.asList(r1, CellRange.parse("Other!A1",
                                                        "Sheet1")));
      fail("IllegalArgumentException should have been thrown");
    } catch(IllegalArgumentException expected) {
      // success
    }
  }
}
