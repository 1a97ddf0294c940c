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


package com.healthmarketscience.sheetcalc.impl.expr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.healthmarketscience.sheetcalc.CellRange;
import com.healthmarketscience.sheetcalc.expr.Formula;
import com.healthmarketscience.sheetcalc.expr.FunctionLookup;
import com.healthmarketscience.sheetcalc.expr.ParseException;
import junit.framework.TestCase;
import static com.healthmarketscience.sheetcalc.TestUtil.*;

/**
 *
 * @author James Ahlborn
 */
public class FormulaParserTest extends TestCase
{
  private static final FormulaParser.ParseContext PARSE_CTX =
    new FormulaParser.ParseContext() {
      @Override
      public FunctionLookup getFunctionLookup() {
        return DefaultFunctions.LOOKUP;
      }
      @Override
      public String getDefaultSheet() {
        return SHEET;
      }
    };

  public FormulaParserTest(String name) {
    super(name);
  }

  public void testParseSimpleExprs() throws Exception
  {
    validateExpr("=\"A\"", "<ELiteralValue>{\"A\"}");

    validateExpr("=13", "<ELiteralValue>{13}");

    validateExpr("=-42", "<EUnaryOp>{- <ELiteralValue>{42}}");

    validateExpr("=(+37)", "<EParen>{(<EUnaryOp>{+ <ELiteralValue>{37}})}");

    doTestSimpleBinOp("EBinaryOp", "+", "-", "*", "/", "^", "&");
    doTestSimpleBinOp("ECompOp", "<", "<=", ">", ">=", "=", "<>");

    validateExpr("=TRUE", "<ELiteralValue>{TRUE}");

    validateExpr("=#N/A", "<ELiteralValue>{#N/A}");

    validateExpr("=50%", "<EPostfixOp>{<ELiteralValue>{50}%}");

    validateExpr("=A1", "<ERef>{Sheet1!A1}", "=Sheet1!A1");

    validateExpr("=Other!$B$2:C3", "<ERef>{Other!$B$2:C3}");

    validateExpr("='My Sheet'!A1", "<ERef>{'My Sheet'!A1}");

    validateExpr("=Rate", "<ENameRef>{Rate}");

    validateExpr("=Sales[[#Totals],[Amount]]",
                 "<ENameRef>{Sales[[#Totals],[Amount]]}");

    validateExpr("=\" \"\"A\"\" \"", "<ELiteralValue>{\" \"\"A\"\" \"}");

    validateExpr("={1,-2;\"x\",TRUE}",
                 "<EArray>{{1,-2;\"x\",TRUE}}");

    validateExpr("=sum(A1:B2,C3)",
                 "<EFunc>{SUM(<ERef>{Sheet1!A1:B2},<ERef>{Sheet1!C3})}",
                 "=SUM(Sheet1!A1:B2,Sheet1!C3)");

    validateExpr("=IF(A1,,2)",
                 "<EFunc>{IF(<ERef>{Sheet1!A1},<EMissingArg>{},<ELiteralValue>{2})}",
                 "=IF(Sheet1!A1,,2)");

    validateExpr("=NA()", "<EFunc>{NA()}");

    validateExpr("=Foo(1)", "<EUnknownFunc>{Foo(<ELiteralValue>{1})}");

    validateExpr("=(A1,B1:B2)",
                 "<EParen>{(<EUnionOp>{<ERef>{Sheet1!A1},<ERef>{Sheet1!B1:B2}})}",
                 "=(Sheet1!A1,Sheet1!B1:B2)");

    validateExpr("=A1:B2 B2:C3",
                 "<ERefOp>{<ERef>{Sheet1!A1:B2} <ERef>{Sheet1!B2:C3}}",
                 "=Sheet1!A1:B2 Sheet1!B2:C3");

    validateExpr("=A1:INDEX(B1:B3,2)",
                 "<ERefOp>{<ERef>{Sheet1!A1}:<EFunc>{INDEX(<ERef>{Sheet1!B1:B3},<ELiteralValue>{2})}}",
                 "=Sheet1!A1:INDEX(Sheet1!B1:B3,2)");
  }

  private static void doTestSimpleBinOp(String opName, String... ops)
    throws Exception
  {
    for(String op : ops) {
      validateExpr("=\"A\" " + op + " \"B\"",
                   "<" + opName + ">{<ELiteralValue>{\"A\"} " + op +
                   " <ELiteralValue>{\"B\"}}");
    }
  }

  public void testOrderOfOperations() throws Exception
  {
    validateExpr("=1 + 2 * 3",
                 "<EBinaryOp>{<ELiteralValue>{1} + <EBinaryOp>{<ELiteralValue>{2} * <ELiteralValue>{3}}}");

    validateExpr("=1 * 2 + 3",
                 "<EBinaryOp>{<EBinaryOp>{<ELiteralValue>{1} * <ELiteralValue>{2}} + <ELiteralValue>{3}}");

    validateExpr("=1 - 2 - 3",
                 "<EBinaryOp>{<EBinaryOp>{<ELiteralValue>{1} - <ELiteralValue>{2}} - <ELiteralValue>{3}}");

    validateExpr("=2 ^ 3 ^ 2",
                 "<EBinaryOp>{<EBinaryOp>{<ELiteralValue>{2} ^ <ELiteralValue>{3}} ^ <ELiteralValue>{2}}");

    validateExpr("=-2 ^ 2",
                 "<EBinaryOp>{<EUnaryOp>{- <ELiteralValue>{2}} ^ <ELiteralValue>{2}}");

    validateExpr("=-2 + 3",
                 "<EBinaryOp>{<EUnaryOp>{- <ELiteralValue>{2}} + <ELiteralValue>{3}}");

    validateExpr("=2 * -3",
                 "<EBinaryOp>{<ELiteralValue>{2} * <EUnaryOp>{- <ELiteralValue>{3}}}");

    validateExpr("=---2",
                 "<EUnaryOp>{- <EUnaryOp>{- <EUnaryOp>{- <ELiteralValue>{2}}}}");

    validateExpr("=2 ^ 50%",
                 "<EBinaryOp>{<ELiteralValue>{2} ^ <EPostfixOp>{<ELiteralValue>{50}%}}");

    validateExpr("=1 & 2 = \"12\"",
                 "<ECompOp>{<EBinaryOp>{<ELiteralValue>{1} & <ELiteralValue>{2}} = <ELiteralValue>{\"12\"}}");

    validateExpr("=1 + 2 & 3",
                 "<EBinaryOp>{<EBinaryOp>{<ELiteralValue>{1} + <ELiteralValue>{2}} & <ELiteralValue>{3}}");

    validateExpr("=(1 + 2) * 3",
                 "<EBinaryOp>{<EParen>{(<EBinaryOp>{<ELiteralValue>{1} + <ELiteralValue>{2}})} * <ELiteralValue>{3}}");

    validateExpr("=SUM(A1:B2 B1:C3)*2",
                 "<EBinaryOp>{<EFunc>{SUM(<ERefOp>{<ERef>{Sheet1!A1:B2} <ERef>{Sheet1!B1:C3}})} * <ELiteralValue>{2}}",
                 "=SUM(Sheet1!A1:B2 Sheet1!B1:C3) * 2");
  }

  public void testEvalOrderOfOperations() throws Exception
  {
    assertNumber(7, eval("=1+2*3"));
    assertNumber(-4, eval("=1-2-3"));
    assertNumber(64, eval("=2^3^2"));
    assertNumber(4, eval("=-2^2"));
    assertNumber(-4, eval("=0-2^2"));
    assertNumber(1, eval("=-2+3"));
    assertNumber(-6, eval("=2*-3"));
    assertNumber(-2, eval("=---2"));
    assertNumber(2, eval("=--2"));
    assertNumber(0.5, eval("=50%"));
    assertNumber(Math.sqrt(2), eval("=2^50%"));
    assertNumber(9, eval("=(1+2)*3"));
    assertString("33", eval("=1+2&3"));
    assertBoolean(true, eval("=1&2=\"12\""));
    assertBoolean(true, eval("=2<10"));
    assertBoolean(false, eval("=\"2\"<\"10\""));
  }

  public void testCollect() throws Exception
  {
    Formula formula = parse(
        "=SUM(A1:B2, Rate) + IF(C3 > 0, Data!D4, Table1[Col]) * A1:B2");
    assertFalse(formula.isConstant());
    assertFalse(formula.isDynamic());

    Set<CellRange> refs = new LinkedHashSet<CellRange>();
    formula.collectReferences(refs);
    assertEquals(Arrays.asList(range("A1:B2"), range("C3"),
                               range("Data!D4")),
                 new ArrayList<CellRange>(refs));

    List<String> names = new ArrayList<String>();
    formula.collectNames(names);
    assertEquals(Arrays.asList("Rate", "Table1[Col]"), names);

    assertTrue(parse("=1+2*3").isConstant());
    assertTrue(parse("=OFFSET(A1,1,1)").isDynamic());
    assertTrue(parse("=SUM(INDIRECT(\"A1\"))+1").isDynamic());
    assertFalse(parse("=OFFSET(A1,1,1)").isConstant());
  }

  public void testInvalidExprs() throws Exception
  {
    for(String formula : new String[]{
          "=", "=1+", "=*2", "=(1+2", "=SUM(1,2", "=1 2",
          "=)", "=1,2", "=()", "=SUM((),1)", "={1,2;3}", "={1,A1}",
          "={1,,2}", "={-\"a\"}", "=IF(1)", "=NA(1)",
          "=SUM(1,2)(3)", "=%", "=1+{1,2}{3}"}) {
      try {
        parse(formula);
        fail("ParseException should have been thrown for " + formula);
      } catch(ParseException expected) {
        // success
        assertNotNull(expected.getMessage());
      }
    }

    try {
      parse("=1+(2");
      fail("ParseException should have been thrown");
    } catch(ParseException expected) {
      assertTrue(expected.getPosition() >= 0);
    }
  }

  private static Formula parse(String exprStr) {
    return FormulaParser.parse(exprStr, PARSE_CTX);
  }

  private static void validateExpr(String exprStr, String debugStr) {
    validateExpr(exprStr, debugStr, exprStr);
  }

  private static void validateExpr(String exprStr, String debugStr,
                                   String cleanStr) {
    Formula formula = parse(exprStr);
    String actualDebug = formula.toDebugString();
    assertEquals("Mismatched debug string for " + exprStr, debugStr,
                 actualDebug);
    assertEquals("Mismatched clean string for " + exprStr, cleanStr,
                 formula.toCleanString());
    assertEquals(exprStr, formula.toRawString());

    // the clean string parses to the same expression
    assertEquals(debugStr, parse(formula.toCleanString()).toDebugString());
  }
}
