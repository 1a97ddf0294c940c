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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import com.healthmarketscience.sheetcalc.CellRange;
import com.healthmarketscience.sheetcalc.StructuredTable;
import com.healthmarketscience.sheetcalc.UnresolvedReferenceException;
import junit.framework.TestCase;
import static com.healthmarketscience.sheetcalc.TestUtil.*;

/**
 *
 * @author James Ahlborn
 */
public class StructuredReferencesTest extends TestCase
{
  private static final Map<String,StructuredTable> TABLES =
    new LinkedHashMap<String,StructuredTable>();
  static {
    addTable(new StructuredTable(
                 "Sales", range("A1:C5"),
                 Arrays.asList("Item", "Qty", "Unit Price"), 1, 1));
    addTable(new StructuredTable(
                 "Rates", range("F1:G4"),
                 Arrays.asList("Code", "Rate [%]")));
  }

  public StructuredReferencesTest(String name) {
    super(name);
  }

  public void testIsStructured() throws Exception
  {
    assertTrue(StructuredReferences.isStructured("Sales[Qty]"));
    assertTrue(StructuredReferences.isStructured("[@Qty]"));
    assertFalse(StructuredReferences.isStructured("Sales"));
  }

  public void testColumns() throws Exception
  {
    assertResolve("B2:B4", "Sales[Qty]");
    assertResolve("B2:B4", "sales[qty]");
    assertResolve("C2:C4", "Sales[Unit Price]");
    assertResolve("A2:C4", "Sales[]");
    assertResolve("A2:B4", "Sales[[Item]:[Qty]]");
    assertResolve("A2:B4", "Sales[[Qty]:[Item]]");
    assertResolve("G2:G4", "Rates[Rate '[%']]");
    assertResolve("G2:G4", "Rates[[Rate '[%']]]");
  }

  public void testSpecialItems() throws Exception
  {
    assertResolve("A1:C5", "Sales[#All]");
    assertResolve("A1:C1", "Sales[#Headers]");
    assertResolve("A2:C4", "Sales[#Data]");
    assertResolve("A5:C5", "Sales[#Totals]");
    assertResolve("B5", "Sales[[#Totals],[Qty]]");
    assertResolve("B1:B4", "Sales[[#Headers],[#Data],[Qty]]");
    assertResolve("B2:B5", "Sales[[#Data],[#Totals],[Qty]]");
    assertResolve("A1:B5", "Sales[[#All],[Item]:[Qty]]");
    assertResolve("F1:F4", "Rates[[#All],[Code]]");
  }

  public void testThisRow() throws Exception
  {
    assertResolve("B3", "Sales[[#This Row],[Qty]]", "D3");
    assertResolve("C3", "Sales[@Unit Price]", "D3");
    assertResolve("C3", "Sales[@[Unit Price]]", "D3");
    assertResolve("A4:C4", "Sales[@]", "E4");

    // unqualified references use the table containing the cell
    assertResolve("B2", "[@Qty]", "C2");
    assertResolve("G3", "[@[Rate '[%']]]", "F3");

    // outside of the data rows
    assertNull(StructuredReferences.resolve("Sales[@Qty]", addr("D1"),
                                            TABLES));
    assertNull(StructuredReferences.resolve("Sales[@Qty]", addr("D5"),
                                            TABLES));
    assertNull(StructuredReferences.resolve("Sales[@Qty]", addr("Sheet2!D3"),
                                            TABLES));
  }

  public void testInvalidRefs() throws Exception
  {
    assertInvalid("Bogus[Qty]", "D3");
    assertInvalid("Sales[Price]", "D3");
    assertInvalid("Sales[[Item]:[Bogus]]", "D3");
    assertInvalid("Sales[#Bogus]", "D3");
    assertInvalid("Sales[Qty", "D3");
    assertInvalid("Sales[[Qty]", "D3");
    assertInvalid("Sales[[Qty]]]", "D3");
    assertInvalid("Sales[[Item],]", "D3");
    assertInvalid("Sales[[Item][Qty]]", "D3");
    assertInvalid("Sales[[Item],[Qty],[Unit Price]]", "D3");
    assertInvalid("Sales[[#This Row],[#Totals],[Qty]]", "D3");
    assertInvalid("Rates[#Totals]", "H3");
    assertInvalid("[@Qty]", "Z100");
  }

  private static void addTable(StructuredTable table) {
    TABLES.put(table.getName().toUpperCase(), table);
  }

  private static void assertResolve(String expected, String ref) {
    assertResolve(expected, ref, "Z100");
  }

  private static void assertResolve(String expected, String ref,
                                    String current) {
    CellRange actual = StructuredReferences.resolve(ref, addr(current),
                                                    TABLES);
    assertEquals(range(expected), actual);
  }

  private static void assertInvalid(String ref, String current) {
    try {
      StructuredReferences.resolve(ref, addr(current), TABLES);
      fail("UnresolvedReferenceException should have been thrown for " + ref);
    } catch(UnresolvedReferenceException expected) {
      // success
    }
  }
}
