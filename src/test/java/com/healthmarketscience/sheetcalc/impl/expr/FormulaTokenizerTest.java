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
import java.util.List;

import com.healthmarketscience.sheetcalc.CellRange;
import com.healthmarketscience.sheetcalc.UnsupportedConstructException;
import com.healthmarketscience.sheetcalc.expr.ErrorCode;
import com.healthmarketscience.sheetcalc.expr.LexException;
import com.healthmarketscience.sheetcalc.expr.ParseException;
import com.healthmarketscience.sheetcalc.expr.Value;
import com.healthmarketscience.sheetcalc.impl.expr.FormulaTokenizer.Token;
import com.healthmarketscience.sheetcalc.impl.expr.FormulaTokenizer.TokenType;
import junit.framework.TestCase;

/**
 *
 * @author James Ahlborn
 */
public class FormulaTokenizerTest extends TestCase
{
  private static final String SHEET = "Sheet1";

  public FormulaTokenizerTest(String name) {
    super(name);
  }

  public void testSimpleTokens() throws Exception
  {
    List<Token> toks = tokenize("=SUM(A1:B2, 3.5)");
    assertTypes(toks, TokenType.FUNC, TokenType.PAREN, TokenType.REF,
                TokenType.SEP, TokenType.LITERAL, TokenType.PAREN);
    assertEquals("SUM", toks.get(0).getValueStr());
    assertEquals(CellRange.parse("A1:B2", SHEET), toks.get(2).getValue());
    assertEquals(3.5d, ((Value)toks.get(4).getValue()).getAsDouble(), 0.0d);
    assertEquals(5, toks.get(2).getPosition());

    // leading '=' is optional
    toks = tokenize("1+2");
    assertTypes(toks, TokenType.LITERAL, TokenType.OP, TokenType.LITERAL);
    assertEquals(1, toks.get(1).getPosition());

    toks = tokenize("=A1<>B1 & \"x\"\"y\"");
    assertTypes(toks, TokenType.REF, TokenType.OP, TokenType.REF,
                TokenType.OP, TokenType.LITERAL);
    assertEquals("<>", toks.get(1).getValueStr());
    assertEquals("&", toks.get(3).getValueStr());
    assertEquals("x\"y", ((Value)toks.get(4).getValue()).getAsString());

    toks = tokenize("=1<=2");
    assertEquals("<=", toks.get(1).getValueStr());
    toks = tokenize("=1>-2");
    assertTypes(toks, TokenType.LITERAL, TokenType.OP, TokenType.OP,
                TokenType.LITERAL);

    toks = tokenize("=#N/A+#DIV/0!");
    assertEquals(ErrorCode.NA,
                 ((Value)toks.get(0).getValue()).getErrorCode());
    assertEquals(ErrorCode.DIV0,
                 ((Value)toks.get(2).getValue()).getErrorCode());

    toks = tokenize("=1.5E+3%");
    assertEquals(1500.0d, ((Value)toks.get(0).getValue()).getAsDouble(), 0.0d);
    assertEquals("%", toks.get(1).getValueStr());

    toks = tokenize("=true");
    assertEquals(Value.Type.BOOLEAN, toks.get(0).getValueType());

    toks = tokenize("={1,2;3,4}");
    assertTypes(toks, TokenType.ARRAY, TokenType.LITERAL, TokenType.SEP,
                TokenType.LITERAL, TokenType.SEP, TokenType.LITERAL,
                TokenType.SEP, TokenType.LITERAL, TokenType.ARRAY);
    assertEquals(";", toks.get(4).getValueStr());

    assertTrue(tokenize("   ").isEmpty());
  }

  public void testReferencesAndNames() throws Exception
  {
    List<Token> toks = tokenize("=Data!B2+'My Sheet'!$C$3");
    assertEquals(CellRange.parse("Data!B2", SHEET), toks.get(0).getValue());
    assertEquals("My Sheet", ((CellRange)toks.get(2).getValue()).getSheet());

    toks = tokenize("=SUM(A:A, 2:3)");
    assertTrue(((CellRange)toks.get(2).getValue()).isFullColumns());
    assertTrue(((CellRange)toks.get(4).getValue()).isFullRows());

    // reference-like prefixes of longer words
    toks = tokenize("=LOG10(A1B)");
    assertTypes(toks, TokenType.FUNC, TokenType.PAREN, TokenType.NAME,
                TokenType.PAREN);
    assertEquals("LOG10", toks.get(0).getValueStr());
    assertEquals("A1B", toks.get(2).getValueStr());

    toks = tokenize("=Rate * Table1[[#This Row],[Unit Price]] + [@Qty]");
    assertTypes(toks, TokenType.NAME, TokenType.OP, TokenType.NAME,
                TokenType.OP, TokenType.NAME);
    assertEquals("Table1[[#This Row],[Unit Price]]",
                 toks.get(2).getValueStr());
    assertEquals("[@Qty]", toks.get(4).getValueStr());
  }

  public void testIntersection() throws Exception
  {
    List<Token> toks = tokenize("=A1:B2 B2:C3");
    assertTypes(toks, TokenType.REF, TokenType.OP, TokenType.REF);
    assertEquals(FormulaTokenizer.INTERSECT_OP, toks.get(1).getValueStr());

    toks = tokenize("=(A1:B2)  MyRange");
    assertTypes(toks, TokenType.PAREN, TokenType.REF, TokenType.PAREN,
                TokenType.OP, TokenType.NAME);

    // whitespace around other operators is not significant
    toks = tokenize("= A1 + B1 ");
    assertTypes(toks, TokenType.REF, TokenType.OP, TokenType.REF);
    toks = tokenize("=SUM( A1 , B1 )");
    assertTypes(toks, TokenType.FUNC, TokenType.PAREN, TokenType.REF,
                TokenType.SEP, TokenType.REF, TokenType.PAREN);
  }

  public void testErrors() throws Exception
  {
    assertLexFailure("=\"abc");
    assertLexFailure("=#FOO!");
    assertLexFailure("={1,{2}}");
    assertLexFailure("=1}");
    assertLexFailure("={1,2");
    assertLexFailure("=Table1[Col");
    assertLexFailure("='My Sheet'+1");
    assertLexFailure("=1$");

    assertUnsupported("=[Book1.xlsx]Sheet1!A1");
    assertUnsupported("=SUM([1]Sheet1!A1:B2)");
    assertUnsupported("=Sheet1:Sheet3!A1");
    assertUnsupported("='Sheet1:Sheet3'!A1");
    assertUnsupported("='[Book1]Sheet1'!A1");
  }

  private static List<Token> tokenize(String formula) {
    return FormulaTokenizer.tokenize(formula, SHEET);
  }

  private static void assertTypes(List<Token> toks, TokenType... types) {
    List<TokenType> actual = new ArrayList<TokenType>();
    for(Token t : toks) {
      actual.add(t.getType());
    }
    assertEquals(Arrays.asList(types), actual);
  }

  private static void assertLexFailure(String formula) {
    try {
      tokenize(formula);
      fail("LexException should have been thrown for " + formula);
    } catch(LexException expected) {
      // success
    }
  }

  private static void assertUnsupported(String formula) {
    try {
      tokenize(formula);
      fail("UnsupportedConstructException should have been thrown for " +
           formula);
    } catch(ParseException expected) {
      assertTrue(expected instanceof UnsupportedConstructException);
    }
  }
}
