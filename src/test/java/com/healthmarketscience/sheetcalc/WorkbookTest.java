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
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.healthmarketscience.sheetcalc.expr.ParseException;
import com.healthmarketscience.sheetcalc.expr.Value;
import junit.framework.TestCase;
import static com.healthmarketscience.sheetcalc.TestUtil.*;

/**
 *
 * @author James Ahlborn
 */
public class WorkbookTest extends TestCase
{

  public WorkbookTest(String name) {
    super(name);
  }

  @Override
  protected void setUp() {
    COUNT_CALLS.reset();
  }

  public void testEvaluate() throws Exception
  {
    Workbook wb = compile("A1", 3,
                          "A2", "text",
                          "A3", true,
                          "B1", "=A1 * 2 + 1",
                          "B2", "=A2 & \"!\"",
                          "B3", "=NOT(A3)",
                          "B4", "=1/0",
                          "B5", "=B4 + 1",
                          "B6", "=A9",
                          "B7", "=A9 + 1",
                          "Sheet2!A1", 5,
                          "C1", "=Sheet2!A1 * B1");

    assertNumber(3, wb.evaluate("A1"));
    assertNumber(7, wb.evaluate("B1"));
    assertString("text!", wb.evaluate("B2"));
    assertBoolean(false, wb.evaluate("B3"));
    assertError("#DIV/0!", wb.evaluate("B4"));
    assertError("#DIV/0!", wb.evaluate("B5"));
    assertTrue(wb.evaluate("B6").isBlank());
    assertNumber(1, wb.evaluate("B7"));
    assertNumber(35, wb.evaluate("C1"));
    assertNumber(35, wb.evaluate(addr("C1")));

    // never defined and never referenced
    assertTrue(wb.evaluate("Z99").isBlank());

    Value vals = wb.evaluate(range("A1:B2"));
    assertEquals(2, vals.getNumRows());
    assertEquals(2, vals.getNumColumns());
    assertNumber(3, vals.getElement(0, 0));
    assertNumber(7, vals.getElement(0, 1));
    assertString("text", vals.getElement(1, 0));
  }

  public void testCaching() throws Exception
  {
    Workbook wb = compile("A1", 1,
                          "A2", 10,
                          "B1", "=COUNTCALLS(A1) * 2",
                          "B2", "=COUNTCALLS(A2) + B1");

    assertNumber(2, wb.evaluate("B1"));
    assertNumber(2, wb.evaluate("B1"));
    assertEquals(1, COUNT_CALLS.getCount());

    assertNumber(12, wb.evaluate("B2"));
    assertNumber(12, wb.evaluate("B2"));
    assertEquals(2, COUNT_CALLS.getCount());

    // only the dependents of the changed cell are recomputed
    wb.setValue("A2", 20);
    assertNumber(22, wb.evaluate("B2"));
    assertNumber(2, wb.evaluate("B1"));
    assertEquals(3, COUNT_CALLS.getCount());

    wb.setValue("A1", 5);
    assertNumber(30, wb.evaluate("B2"));
    assertNumber(10, wb.evaluate("B1"));
    assertEquals(5, COUNT_CALLS.getCount());

    wb.recalculate();
    assertNumber(30, wb.evaluate("B2"));
    assertEquals(7, COUNT_CALLS.getCount());
  }

  public void testSetFormula() throws Exception
  {
    Workbook wb = compile("A1", 1,
                          "A2", 2,
                          "B1", "=A1 + 1",
                          "C1", "=B1 * 10");

    assertNumber(20, wb.evaluate("C1"));

    wb.setFormula("B1", "=A2 + 1");
    assertNumber(30, wb.evaluate("C1"));

    // the old reference is gone
    wb.setValue("A1", 100);
    assertNumber(30, wb.evaluate("C1"));
    wb.setValue("A2", 4);
    assertNumber(50, wb.evaluate("C1"));

    wb.setValue("B1", 7);
    assertNumber(70, wb.evaluate("C1"));
    assertEquals(Collections.emptySet(), wb.getPrecedents(addr("B1")));

    // new cells may be added
    wb.setFormula("D1", "=C1 + E1");
    assertNumber(70, wb.evaluate("D1"));
    wb.setValue("E1", 1);
    assertNumber(71, wb.evaluate("D1"));

    wb.setValue("E1", null);
    assertNumber(70, wb.evaluate("D1"));

    try {
      wb.setFormula("D1", "=1 +");
      fail("ParseException should have been thrown");
    } catch(ParseException expected) {
      // success
    }
    try {
      wb.setFormula("D1", "=Bogus + 1");
      fail("UnresolvedReferenceException should have been thrown");
    } catch(UnresolvedReferenceException expected) {
      // success
    }
    // failed changes leave the cell alone
    assertNumber(70, wb.evaluate("D1"));
  }

  public void testSetValues() throws Exception
  {
    Workbook wb = compile("A1", 1,
                          "B1", "=SUM(A1:A2) + B2",
                          "C1", "=COUNTCALLS(A2) + COUNTCALLS(B2)",
                          "D1", "=B2 * 2");

    assertNumber(1, wb.evaluate("B1"));
    assertNumber(0, wb.evaluate("C1"));
    assertEquals(2, COUNT_CALLS.getCount());

    wb.setValues("A2:B2", new Object[][]{{5, 7}});
    assertNumber(13, wb.evaluate("B1"));
    assertNumber(12, wb.evaluate("C1"));
    assertNumber(14, wb.evaluate("D1"));
    assertEquals(4, COUNT_CALLS.getCount());

    // replacing formulas with values, and adding new cells
    wb.setValues(range("B1:C2"), new Object[][]{{"x", true}, {null, 3}});
    assertString("x", wb.evaluate("B1"));
    assertBoolean(true, wb.evaluate("C1"));
    assertTrue(wb.evaluate("B2").isBlank());
    assertNumber(3, wb.evaluate("C2"));
    assertNumber(0, wb.evaluate("D1"));
    assertEquals(cells(), wb.getPrecedents(addr("C1")));

    for(Object[][] badShape : new Object[][][]{
          {{1, 2}}, {{1}, {2}, {3}}, {{1}, {2, 3}}}) {
      try {
        wb.setValues("A1:A2", badShape);
        fail("IllegalArgumentException should have been thrown");
      } catch(IllegalArgumentException expected) {
        // success
      }
    }
    try {
      wb.setValues("A:A", new Object[][]{{1}});
      fail("IllegalArgumentException should have been thrown");
    } catch(IllegalArgumentException expected) {
      // success
    }

    wb = newBuilder("A1", 1,
                    "A2", 2)
      .putArrayFormula("B1:B2", "=A1:A2 * 2")
      .compile();
    try {
      wb.setValues("A2:B2", new Object[][]{{10, 20}});
      fail("IllegalArgumentException should have been thrown");
    } catch(IllegalArgumentException expected) {
      // success
    }
    // nothing was changed
    assertNumber(2, wb.evaluate("A2"));
    assertNumber(4, wb.evaluate("B2"));
  }

  public void testCircularReference() throws Exception
  {
    Workbook wb = compile("A1", "=B1 + 1",
                          "B1", "=A1 / 2",
                          "C1", "=COUNTCALLS(7)",
                          "D1", "=A1 * 2");

    assertNumber(7, wb.evaluate("C1"));

    List<List<CellRange>> cycles = wb.getCycles();
    assertEquals(1, cycles.size());
    assertEquals(new HashSet<CellRange>(Arrays.asList(range("A1"),
                                                      range("B1"))),
                 new HashSet<CellRange>(cycles.get(0)));

    try {
      wb.evaluate("D1");
      fail("CircularReferenceException should have been thrown");
    } catch(CircularReferenceException expected) {
      assertEquals(Arrays.asList(range("A1"), range("B1")),
                   expected.getCycle());
    }

    try {
      wb.evaluate("B1");
      fail("CircularReferenceException should have been thrown");
    } catch(CircularReferenceException expected) {
      assertEquals(Arrays.asList(range("B1"), range("A1")),
                   expected.getCycle());
    }

    // unrelated cells keep their cached values
    assertNumber(7, wb.evaluate("C1"));
    assertEquals(1, COUNT_CALLS.getCount());

    wb.setFormula("B1", "=5");
    assertEquals(0, wb.getCycles().size());
    assertNumber(6, wb.evaluate("A1"));
    assertNumber(12, wb.evaluate("D1"));

    wb = compile("A1", "=A1 + 1");
    try {
      wb.evaluate("A1");
      fail("CircularReferenceException should have been thrown");
    } catch(CircularReferenceException expected) {
      assertEquals(Arrays.asList(range("A1")), expected.getCycle());
    }

    // a cycle through a range
    wb = compile("A1", 1,
                 "A2", "=SUM(A1:A3)");
    try {
      wb.evaluate("A2");
      fail("CircularReferenceException should have been thrown");
    } catch(CircularReferenceException expected) {
      assertEquals(Arrays.asList(range("A2")), expected.getCycle());
    }
    assertEquals(1, wb.getCycles().size());
    assertEquals(new HashSet<CellRange>(Arrays.asList(range("A2"),
                                                      range("A1:A3"))),
                 new HashSet<CellRange>(wb.getCycles().get(0)));
  }

  public void testIterativeCalculation() throws Exception
  {
    Workbook wb = newBuilder("A1", "=B1 + 1",
                             "B1", "=A1 / 2",
                             "C1", "=A1 + B1")
      .setIterative(true)
      .setMaxChange(0.00001d)
      .compile();

    assertEquals(1, wb.getCycles().size());
    assertEquals(2d, wb.evaluate("A1").getAsDouble(), 0.0001d);
    assertEquals(1d, wb.evaluate("B1").getAsDouble(), 0.0001d);
    assertEquals(3d, wb.evaluate("C1").getAsDouble(), 0.001d);

    wb.setFormula("A1", "=B1 + 3");
    assertEquals(6d, wb.evaluate("A1").getAsDouble(), 0.0001d);
    assertEquals(3d, wb.evaluate("B1").getAsDouble(), 0.0001d);

    // never converges, stops after the max iterations
    wb = newBuilder("A1", "=A1 + 1")
      .setIterative(true)
      .setMaxIterations(10)
      .compile();
    assertNumber(10, wb.evaluate("A1"));
  }

  public void testDynamicCycles() throws Exception
  {
    // the cycle only exists once INDIRECT has been evaluated
    Workbook wb = newBuilder("A1", "=INDIRECT(\"B1\") + 1",
                             "B1", "=A1 / 2")
      .setIterative(true)
      .setMaxChange(0.00001d)
      .compile();

    assertEquals(0, wb.getCycles().size());
    assertEquals(2d, wb.evaluate("A1").getAsDouble(), 0.0001d);
    assertEquals(1d, wb.evaluate("B1").getAsDouble(), 0.0001d);
    assertEquals(1, wb.getCycles().size());

    wb.setFormula("B1", "=A1 / 4");
    assertEquals(4d / 3d, wb.evaluate("A1").getAsDouble(), 0.0001d);
    assertEquals(1d / 3d, wb.evaluate("B1").getAsDouble(), 0.0001d);

    // closed by the inner cell of the evaluation
    wb = newBuilder("A1", "=B1 + 1",
                    "B1", "=INDIRECT(\"A1\") / 2",
                    "C1", "=B1 * 10")
      .setIterative(true)
      .setMaxChange(0.00001d)
      .compile();

    assertEquals(10d, wb.evaluate("C1").getAsDouble(), 0.001d);
    assertEquals(2d, wb.evaluate("A1").getAsDouble(), 0.0001d);

    wb = compile("A1", "=INDIRECT(\"B1\") + 1",
                 "B1", "=A1 / 2");
    try {
      wb.evaluate("A1");
      fail("CircularReferenceException should have been thrown");
    } catch(CircularReferenceException expected) {
      assertEquals(Arrays.asList(range("A1"), range("B1")),
                   expected.getCycle());
    }
  }

  public void testDynamicReferences() throws Exception
  {
    Workbook wb = compile("A1", 1,
                          "A2", 2,
                          "A3", 3,
                          "B1", 2,
                          "C1", "=SUM(OFFSET(A1,0,0,B1,1))",
                          "D1", "A3",
                          "E1", "=INDIRECT(D1) * 10");

    assertNumber(3, wb.evaluate("C1"));
    assertNumber(30, wb.evaluate("E1"));

    // cells found while evaluating are tracked
    wb.setValue("A2", 10);
    assertNumber(11, wb.evaluate("C1"));

    wb.setValue("B1", 3);
    assertNumber(14, wb.evaluate("C1"));

    wb.setValue("A3", 5);
    assertNumber(16, wb.evaluate("C1"));
    assertNumber(50, wb.evaluate("E1"));
    assertEquals(new TreeSet<CellAddress>(Arrays.asList(addr("D1"),
                                                        addr("A3"))),
                 wb.getPrecedents(addr("E1")));

    wb.setValue("D1", "A1");
    assertNumber(10, wb.evaluate("E1"));
    wb.setValue("A3", 6);
    wb.setValue("A1", 2);
    assertNumber(20, wb.evaluate("E1"));

    wb.setValue("D1", "not a ref");
    assertError("#REF!", wb.evaluate("E1"));
  }

  public void testDefinedNamesAndTables() throws Exception
  {
    Workbook wb = newBuilder("A1", "Item",
                             "B1", "Qty",
                             "C1", "Price",
                             "A2", "a",
                             "B2", 1,
                             "C2", 10,
                             "A3", "b",
                             "B3", 2,
                             "C3", 20,
                             "A4", "c",
                             "B4", 3,
                             "C4", 30,
                             "F1", 0.5,
                             "D3", "=Sales[@Qty] * Sales[@Price]",
                             "E1", "=SUM(Sales[Qty])",
                             "E2", "=SUM(Sales[Price]) * Rate",
                             "E3", "=ROWS(Sales[#All])")
      .putDefinedName("Rate", "$F$1")
      .addTable(new StructuredTable("Sales", range("A1:C4"),
                                    Arrays.asList("Item", "Qty", "Price")))
      .compile();

    assertNumber(40, wb.evaluate("D3"));
    assertNumber(6, wb.evaluate("E1"));
    assertNumber(30, wb.evaluate("E2"));
    assertNumber(4, wb.evaluate("E3"));

    wb.setValue("B2", 5);
    assertNumber(10, wb.evaluate("E1"));
    wb.setValue("F1", 2);
    assertNumber(120, wb.evaluate("E2"));

    assertEquals(range("F1"), wb.getDefinedNames().get("RATE"));
    assertEquals(1, wb.getTables().size());

    try {
      compile("A1", "=Bogus * 2");
      fail("UnresolvedReferenceException should have been thrown");
    } catch(UnresolvedReferenceException expected) {
      assertEquals("Bogus", expected.getName());
    }

    for(String badName : new String[]{"nm1", "A1", "$B$2", "C:D", "  "}) {
      try {
        newBuilder("A1", 1)
          .putDefinedName(badName, "A1")
          .compile();
        fail("IllegalArgumentException should have been thrown for " +
             badName);
      } catch(IllegalArgumentException expected) {
        // success
      }
    }

    try {
      compile("A1", "=SUM(Bogus[Qty])");
      fail("UnresolvedReferenceException should have been thrown");
    } catch(UnresolvedReferenceException expected) {
      // success
    }
  }

  public void testUnsupported() throws Exception
  {
    try {
      compile("A1", "=[Book1.xlsx]Sheet1!A1 + 1");
      fail("UnsupportedConstructException should have been thrown");
    } catch(UnsupportedConstructException expected) {
      // success
    }

    try {
      compile("A1", "=1 + * 2");
      fail("ParseException should have been thrown");
    } catch(ParseException expected) {
      // success
    }
  }

  public void testArrayFormulas() throws Exception
  {
    Workbook wb = newBuilder("A1", 1,
                             "A2", 2,
                             "A3", 3,
                             "G1", "=SUM(C1:E1) + F3")
      .putArrayFormula("C1:E1", "=TRANSPOSE(A1:A3)")
      .putArrayFormula("F1:F3", "=ROW(A1:A3) * 2")
      .compile();

    assertNumber(1, wb.evaluate("C1"));
    assertNumber(2, wb.evaluate("D1"));
    assertNumber(3, wb.evaluate("E1"));
    assertNumber(2, wb.evaluate("F1"));
    assertNumber(6, wb.evaluate("F3"));
    assertNumber(12, wb.evaluate("G1"));

    Value vals = wb.evaluate(range("C1:E1"));
    assertEquals(1, vals.getNumRows());
    assertEquals(3, vals.getNumColumns());

    wb.setValue("A3", 10);
    assertNumber(10, wb.evaluate("E1"));
    assertNumber(19, wb.evaluate("G1"));

    assertEquals(new TreeSet<CellAddress>(Arrays.asList(
                     addr("A1"), addr("A2"), addr("A3"))),
                 wb.getPrecedents(addr("D1")));

    try {
      wb.setValue("D1", 5);
      fail("IllegalArgumentException should have been thrown");
    } catch(IllegalArgumentException expected) {
      // success
    }
    try {
      wb.setFormula("F2", "=1");
      fail("IllegalArgumentException should have been thrown");
    } catch(IllegalArgumentException expected) {
      // success
    }

    // results smaller than the target are padded with blanks
    wb = newBuilder("A1", 1,
                    "A2", 2)
      .putArrayFormula("C1:C3", "=A1:A2 * 10")
      .compile();
    assertNumber(20, wb.evaluate("C2"));
    assertTrue(wb.evaluate("C3").isBlank());
  }

  public void testDependentsAndPrecedents() throws Exception
  {
    Workbook wb = compile("A1", 1,
                          "A2", 2,
                          "B1", "=A1 + 1",
                          "B2", "=SUM(A1:A2)",
                          "C1", "=B1 * 2 + A1");

    assertEquals(cells("B1", "B2", "C1"), wb.getDependents(addr("A1")));
    assertEquals(cells("B2"), wb.getDependents(addr("A2")));
    assertEquals(cells("C1"), wb.getDependents(addr("B1")));
    assertEquals(cells(), wb.getDependents(addr("C1")));

    assertEquals(cells("A1", "A2"), wb.getPrecedents(addr("B2")));
    assertEquals(cells("A1", "B1"), wb.getPrecedents(addr("C1")));
    assertEquals(cells(), wb.getPrecedents(addr("A1")));

    try {
      wb.getDependents(addr("Z99"));
      fail("IllegalArgumentException should have been thrown");
    } catch(IllegalArgumentException expected) {
      // success
    }
  }

  public void testTrim() throws Exception
  {
    Workbook wb = compile("A1", 1,
                          "A2", 2,
                          "A3", 3,
                          "B1", "=A1 * 10",
                          "B2", "=A2 + B1",
                          "B3", "=A2 * 3",
                          "C1", "=A3 * 100");

    Workbook trimmed = wb.trim(Arrays.asList(addr("B2"), addr("B3")));
    assertEquals(Arrays.asList(addr("A1"), addr("A2"), addr("B1"),
                               addr("B2"), addr("B3")),
                 getAddresses(trimmed.getEntries()));
    assertNumber(12, trimmed.evaluate("B2"));
    assertTrue(trimmed.evaluate("C1").isBlank());

    // the original is unchanged
    assertNumber(300, wb.evaluate("C1"));

    trimmed = wb.trim(Arrays.asList(addr("B2"), addr("B3")),
                      Arrays.asList(addr("A1")));
    Map<CellAddress,CellEntry> entries = new HashMap<CellAddress,CellEntry>();
    for(CellEntry entry : trimmed.getEntries()) {
      entries.put(entry.getAddress(), entry);
    }
    assertTrue(entries.get(addr("B1")).isFormula());
    assertTrue(entries.get(addr("B2")).isFormula());
    // does not depend on the inputs
    assertFalse(entries.get(addr("B3")).isFormula());
    assertNumber(6, entries.get(addr("B3")).getValue());

    trimmed.setValue("A1", 2);
    trimmed.setValue("A2", 5);
    assertNumber(25, trimmed.evaluate("B2"));
    assertNumber(6, trimmed.evaluate("B3"));

    try {
      wb.trim(Arrays.asList(addr("Z99")));
      fail("IllegalArgumentException should have been thrown");
    } catch(IllegalArgumentException expected) {
      // success
    }
  }

  public void testRebuildFromEntries() throws Exception
  {
    Workbook wb = newBuilder("A1", 1,
                             "A2", "=A1 + 1",
                             "B1", "=SUM(C1:C2)")
      .putArrayFormula("C1:C2", "=A1:A2 * 2")
      .compile();

    assertNumber(6, wb.evaluate("B1"));

    List<CellEntry> entries = wb.getEntries();
    assertEquals(Arrays.asList(addr("A1"), addr("A2"), addr("B1"),
                               addr("C1")),
                 getAddresses(entries));
    assertTrue(entries.get(3).isArrayFormula());
    assertEquals(range("C1:C2"), entries.get(3).getTarget());
    assertNumber(2, entries.get(1).getValue());

    Workbook copy = new WorkbookBuilder()
      .setFunctionLookup(TEST_FUNCS)
      .addEntries(entries)
      .compile();
    assertNumber(6, copy.evaluate("B1"));
    copy.setValue("A1", 2);
    assertNumber(10, copy.evaluate("B1"));
    assertNumber(6, wb.evaluate("B1"));
  }

  public void testCellSource() throws Exception
  {
    final Map<CellAddress,Object> source = new HashMap<CellAddress,Object>();
    source.put(addr("A1"), "=B1 * 2");
    source.put(addr("B1"), 21);
    source.put(addr("B2"), "hello");
    final List<CellAddress> loaded = new ArrayList<CellAddress>();

    Workbook wb = newBuilder("C1", "=A1 + 1")
      .setCellSource(new CellSource() {
        @Override
        public Object getCellContent(CellAddress address) {
          loaded.add(address);
          return source.get(address);
        }
      })
      .compile();

    assertNumber(43, wb.evaluate("C1"));
    assertString("hello", wb.evaluate("B2"));
    assertTrue(wb.evaluate("D5").isBlank());

    // loaded cells are kept
    int numLoaded = loaded.size();
    assertNumber(42, wb.evaluate("A1"));
    assertString("hello", wb.evaluate("B2"));
    assertEquals(numLoaded, loaded.size());
  }

  public void testUnboundedRanges() throws Exception
  {
    Workbook wb = compile("A1", 1,
                          "A2", 2,
                          "C1", "=SUM(A:A)",
                          "C2", "=COUNT(1:1)");

    assertNumber(3, wb.evaluate("C1"));
    assertNumber(2, wb.evaluate("C2"));

    wb.setValue("A10", 4);
    assertNumber(7, wb.evaluate("C1"));

    wb.setValue("E1", 5);
    assertNumber(3, wb.evaluate("C2"));
  }

  public void testValueTree() throws Exception
  {
    Workbook wb = compile("A1", 1,
                          "A2", "=A1 * 2",
                          "A3", "=A1 + A2");

    String tree = wb.getValueTree(addr("A3"));
    List<String> lines = Arrays.asList(tree.split("\\r?\\n"));
    assertEquals(4, lines.size());
    assertTrue(lines.get(0).startsWith("Sheet1!A3 = 3 ="));
    assertTrue(lines.contains("  Sheet1!A1 = 1"));
    assertTrue(lines.contains("    Sheet1!A1 = 1"));
    assertTrue(lines.contains("  Sheet1!A2 = 2 =Sheet1!A1 * 2"));
  }

  private static Set<CellAddress> cells(String... addrs) {
    Set<CellAddress> cells = new TreeSet<CellAddress>();
    for(String str : addrs) {
      cells.add(addr(str));
    }
    return cells;
  }

  private static List<CellAddress> getAddresses(List<CellEntry> entries) {
    List<CellAddress> addrs = new ArrayList<CellAddress>();
    for(CellEntry entry : entries) {
      addrs.add(entry.getAddress());
    }
    return addrs;
  }
}
