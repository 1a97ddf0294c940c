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

import junit.framework.TestCase;

/**
 *
 * @author James Ahlborn
 */
public class CellAddressTest extends TestCase
{

  public CellAddressTest(String name) {
    super(name);
  }

  public void testParse() throws Exception
  {
    CellAddress addr = CellAddress.parse("B3", "Sheet1");
    assertEquals("Sheet1", addr.getSheet());
    assertEquals(3, addr.getRow());
    assertEquals(2, addr.getColumn());
    assertFalse(addr.isRowAbsolute());
    assertFalse(addr.isColumnAbsolute());
    assertEquals("Sheet1!B3", addr.toString());
    assertEquals("B3", addr.toLocalString());

    addr = CellAddress.parse("Data!$AB$12", "Sheet1");
    assertEquals("Data", addr.getSheet());
    assertEquals(12, addr.getRow());
    assertEquals(28, addr.getColumn());
    assertTrue(addr.isRowAbsolute());
    assertTrue(addr.isColumnAbsolute());
    assertEquals("Data!$AB$12", addr.toString());

    addr = CellAddress.parse("'My Sheet'!c$7", "Sheet1");
    assertEquals("My Sheet", addr.getSheet());
    assertTrue(addr.isRowAbsolute());
    assertFalse(addr.isColumnAbsolute());
    assertEquals("'My Sheet'!C$7", addr.toString());

    addr = CellAddress.parse("'Bob''s'!A1", null);
    assertEquals("Bob's", addr.getSheet());
    assertEquals("'Bob''s'!A1", addr.toString());

    // absolute markers do not change identity
    assertEquals(CellAddress.parse("$A$1", "Sheet1"),
                 CellAddress.parse("A1", "Sheet1"));
    assertFalse(CellAddress.parse("A1", "Sheet1").equals(
                    CellAddress.parse("A1", "Sheet2")));

    for(String invalid : new String[]{"", "A", "1", "A0", "AAAA1",
                                      "XFE1", "A1048577", "'Sheet1!A1",
                                      "!A1"}) {
      assertNull(invalid, CellAddress.tryParse(invalid, "Sheet1"));
    }

    try {
      CellAddress.parse("1A", "Sheet1");
      fail("IllegalArgumentException should have been thrown");
    } catch(IllegalArgumentException expected) {
      // success
    }

    try {
      new CellAddress("Sheet1", 0, 1);
      fail("IllegalArgumentException should have been thrown");
    } catch(IllegalArgumentException expected) {
      // success
    }
  }

  public void testColumnLetters() throws Exception
  {
    assertEquals(1, CellAddress.toColumnIndex("A"));
    assertEquals(26, CellAddress.toColumnIndex("z"));
    assertEquals(27, CellAddress.toColumnIndex("AA"));
    assertEquals(CellAddress.MAX_COL, CellAddress.toColumnIndex("XFD"));
    assertEquals(-1, CellAddress.toColumnIndex("A1"));
    assertEquals(-1, CellAddress.toColumnIndex(""));

    assertEquals("A", CellAddress.toColumnLetters(1));
    assertEquals("Z", CellAddress.toColumnLetters(26));
    assertEquals("AA", CellAddress.toColumnLetters(27));
    assertEquals("AZ", CellAddress.toColumnLetters(52));
    assertEquals("XFD", CellAddress.toColumnLetters(CellAddress.MAX_COL));
  }

  public void testR1C1() throws Exception
  {
    CellAddress base = CellAddress.parse("C5", "Sheet1");

    assertEquals(CellAddress.parse("B3", "Sheet1"),
                 CellAddress.tryParseR1C1("R3C2", base));
    assertEquals(CellAddress.parse("B4", "Sheet1"),
                 CellAddress.tryParseR1C1("R[-1]C[-1]", base));
    assertEquals(CellAddress.parse("C7", "Sheet1"),
                 CellAddress.tryParseR1C1("r[2]c", base));
    assertEquals(CellAddress.parse("Other!A5", "Sheet1"),
                 CellAddress.tryParseR1C1("Other!RC1", base));

    assertTrue(CellAddress.tryParseR1C1("R3C2", base).isRowAbsolute());
    assertFalse(CellAddress.tryParseR1C1("R[3]C2", base).isRowAbsolute());

    assertNull(CellAddress.tryParseR1C1("R[-5]C", base));
    assertNull(CellAddress.tryParseR1C1("A1", base));
  }

  public void testOrderAndOffset() throws Exception
  {
    CellAddress a1 = CellAddress.parse("A1", "Sheet1");
    CellAddress b1 = CellAddress.parse("B1", "Sheet1");
    CellAddress a2 = CellAddress.parse("A2", "Sheet1");

    assertTrue(a1.compareTo(b1) < 0);
    assertTrue(b1.compareTo(a2) < 0);
    assertEquals(0, a1.compareTo(CellAddress.parse("$A$1", "Sheet1")));

    assertEquals(CellAddress.parse("C4", "Sheet1"), a1.offset(3, 2));
    assertNull(a1.offset(-1, 0));
    assertEquals("Other!A1", a1.withSheet("Other").toString());
  }
}
