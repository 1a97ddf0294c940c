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
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.healthmarketscience.sheetcalc.CellRange;
import com.healthmarketscience.sheetcalc.UnsupportedConstructException;
import com.healthmarketscience.sheetcalc.expr.ErrorCode;
import com.healthmarketscience.sheetcalc.expr.LexException;
import com.healthmarketscience.sheetcalc.expr.Value;
import org.apache.commons.lang3.StringUtils;


/**
 * Splits formula text into tokens.  References are resolved against the
 * default sheet here, everything else is left to the parser.
 *
 * @author James Ahlborn
 */
class FormulaTokenizer
{
  private static final int EOF = -1;
  static final char QUOTED_STR_CHAR = '"';
  private static final char SHEET_QUOTE_CHAR = '\'';
  private static final char BRACKET_START_CHAR = '[';
  private static final char BRACKET_END_CHAR = ']';
  private static final char ERROR_START_CHAR = '#';
  private static final char ARRAY_START_CHAR = '{';
  private static final char ARRAY_END_CHAR = '}';
  static final char FORMULA_START_CHAR = '=';
  static final String INTERSECT_OP = " ";

  private static final byte IS_OP_FLAG =     0x01;
  private static final byte IS_COMP_FLAG =   0x02;
  private static final byte IS_DELIM_FLAG =  0x04;
  private static final byte IS_SPACE_FLAG =  0x08;
  private static final byte IS_QUOTE_FLAG =  0x10;
  private static final byte IS_NUM_FLAG =    0x20;

  enum TokenType {
    LITERAL, REF, NAME, FUNC, OP, PAREN, SEP, ARRAY;
  }

  private static final byte[] CHAR_FLAGS = new byte[128];
  private static final Set<String> TWO_CHAR_COMP_OPS = new HashSet<String>(
      Arrays.asList("<=", ">=", "<>"));

  static {
    setCharFlag(IS_OP_FLAG, '+', '-', '*', '/', '^', '&', '%', ':');
    setCharFlag(IS_COMP_FLAG, '<', '>', '=');
    setCharFlag(IS_DELIM_FLAG, '(', ')', ',', ';', '{', '}');
    setCharFlag(IS_SPACE_FLAG, ' ', '\n', '\r', '\t');
    setCharFlag(IS_QUOTE_FLAG, '"', '#');
    setCharFlag(IS_NUM_FLAG, '0', '1', '2', '3', '4', '5', '6', '7', '8', '9',
                '.');
  }

  private static final String SHEET_PREFIX_RE =
    "(?:'(?:[^']|'')+'|[A-Za-z_][A-Za-z0-9_.]*)!";
  private static final String CELL_RE = "\\$?[A-Za-z]{1,3}\\$?[0-9]{1,7}";
  // a reference may not be the leading part of a longer name
  private static final String REF_END_RE = "(?![A-Za-z0-9_.(\\[!'?\\\\])";
  private static final Pattern REF_PAT = Pattern.compile(
      "(?:" + SHEET_PREFIX_RE + ")?(?:" +
      CELL_RE + "(?::" + CELL_RE + ")*|" +
      "\\$?[A-Za-z]{1,3}:\\$?[A-Za-z]{1,3}|" +
      "\\$?[0-9]{1,7}:\\$?[0-9]{1,7})" + REF_END_RE);
  private static final Pattern NAME_PAT = Pattern.compile(
      "(?:" + SHEET_PREFIX_RE + ")?[A-Za-z_\\\\][A-Za-z0-9_.?\\\\]*");
  private static final Pattern NUMBER_PAT = Pattern.compile(
      "(?:[0-9]+[.]?[0-9]*|[.][0-9]+)(?:[eE][+-]?[0-9]+)?");
  private static final Pattern THREE_D_PAT = Pattern.compile(
      "[A-Za-z_][A-Za-z0-9_.]*:[A-Za-z_][A-Za-z0-9_.]*!");
  private static final Pattern EXTERNAL_PAT = Pattern.compile(
      "\\[[^\\]]*\\](?:[A-Za-z0-9_.]+)?!");

  private FormulaTokenizer() {}

  /**
   * Tokenizes the given formula text.  A leading {@code '='} is optional.
   * Token positions are offsets into the given text.
   */
  static List<Token> tokenize(String formulaStr, String defaultSheet) {

    if(StringUtils.isBlank(formulaStr)) {
      return Collections.emptyList();
    }

    List<Token> tokens = new ArrayList<Token>();

    ExprBuf buf = new ExprBuf(formulaStr, defaultSheet);
    consumeWhitespace(buf);
    if(buf.peekNext() == FORMULA_START_CHAR) {
      buf.next();
    }

    boolean pendingSpace = false;
    int arrayStart = -1;

    while(buf.hasNext()) {
      int startPos = buf.curPos();
      char c = buf.next();

      byte charFlag = getCharFlag(c);
      Token tok = null;

      if(hasFlag(charFlag, IS_SPACE_FLAG)) {

        // whitespace is only significant as the intersection operator
        consumeWhitespace(buf);
        pendingSpace = true;
        continue;

      } else if(hasFlag(charFlag, IS_OP_FLAG)) {

        // all simple operator chars are single character operators
        tok = new Token(TokenType.OP, String.valueOf(c), startPos);

      } else if(hasFlag(charFlag, IS_COMP_FLAG)) {

        tok = new Token(TokenType.OP, parseCompOp(c, buf), startPos);

      } else if(hasFlag(charFlag, IS_DELIM_FLAG)) {

        switch(c) {
        case '(':
        case ')':
          tok = new Token(TokenType.PAREN, String.valueOf(c), startPos);
          break;
        case ARRAY_START_CHAR:
          if(arrayStart >= 0) {
            throw new LexException("Nested array literal " + buf, startPos);
          }
          arrayStart = startPos;
          tok = new Token(TokenType.ARRAY, String.valueOf(c), startPos);
          break;
        case ARRAY_END_CHAR:
          if(arrayStart < 0) {
            throw new LexException("Unexpected '" + c + "' " + buf, startPos);
          }
          arrayStart = -1;
          tok = new Token(TokenType.ARRAY, String.valueOf(c), startPos);
          break;
        default:
          tok = new Token(TokenType.SEP, String.valueOf(c), startPos);
        }

      } else if(c == QUOTED_STR_CHAR) {

        String str = parseStringUntil(buf, QUOTED_STR_CHAR, true, startPos);
        tok = new Token(TokenType.LITERAL, ValueSupport.toValue(str),
                        buf.substring(startPos), startPos);

      } else if(c == ERROR_START_CHAR) {

        tok = parseErrorLiteral(buf, startPos);

      } else {

        buf.reset(startPos);
        tok = parseWord(buf);

      }

      if(pendingSpace && !tokens.isEmpty() &&
         isRefEnd(tokens.get(tokens.size() - 1)) && isRefStart(tok)) {
        tokens.add(new Token(TokenType.OP, INTERSECT_OP, startPos - 1));
      }
      pendingSpace = false;
      tokens.add(tok);
    }

    if(arrayStart >= 0) {
      throw new LexException("Missing closing '" + ARRAY_END_CHAR +
                             "' for array literal " + buf, arrayStart);
    }

    return tokens;
  }

  private static Token parseWord(ExprBuf buf) {
    int startPos = buf.curPos();
    char c = buf.next();

    if(c == BRACKET_START_CHAR) {
      if(buf.lookingAt(EXTERNAL_PAT, startPos) != null) {
        throw new UnsupportedConstructException(
            "External workbook references are not supported " + buf,
            startPos);
      }
      // structured reference within the current table, e.g. "[@Col]"
      buf.reset(startPos);
      String str = parseBrackets(buf);
      return new Token(TokenType.NAME, str, startPos);
    }

    if(buf.lookingAt(THREE_D_PAT, startPos) != null) {
      throw new UnsupportedConstructException(
          "3-D references are not supported " + buf, startPos);
    }

    if(c == SHEET_QUOTE_CHAR) {
      validateQuotedSheet(buf, startPos);
    }

    String refStr = buf.lookingAt(REF_PAT, startPos);
    if(refStr != null) {
      CellRange range = CellRange.tryParse(refStr, buf.getDefaultSheet());
      if(range == null) {
        throw new LexException("Invalid reference '" + refStr + "' " + buf,
                               startPos);
      }
      buf.reset(startPos + refStr.length());
      return new Token(TokenType.REF, range, refStr, startPos);
    }

    if(hasFlag(getCharFlag(c), IS_NUM_FLAG)) {
      String numStr = buf.lookingAt(NUMBER_PAT, startPos);
      if(numStr == null) {
        throw new LexException("Invalid number literal " + buf, startPos);
      }
      buf.reset(startPos + numStr.length());
      try {
        return new Token(TokenType.LITERAL,
                         ValueSupport.toValue(Double.parseDouble(numStr)),
                         numStr, startPos);
      } catch(NumberFormatException ne) {
        throw new LexException(
            "Invalid number literal " + numStr + " " + buf, startPos);
      }
    }

    String nameStr = buf.lookingAt(NAME_PAT, startPos);
    if(nameStr == null) {
      throw new LexException("Unexpected character '" + c + "' " + buf,
                             startPos);
    }
    buf.reset(startPos + nameStr.length());

    int next = buf.peekNext();
    if(next == '(') {
      return new Token(TokenType.FUNC, nameStr, startPos);
    }
    if(next == BRACKET_START_CHAR) {
      // structured reference, e.g. "Table1[[#Headers],[Col]]"
      String str = nameStr + parseBrackets(buf);
      return new Token(TokenType.NAME, str, startPos);
    }
    if("TRUE".equalsIgnoreCase(nameStr)) {
      return new Token(TokenType.LITERAL, ValueSupport.TRUE_VAL, nameStr,
                       startPos);
    }
    if("FALSE".equalsIgnoreCase(nameStr)) {
      return new Token(TokenType.LITERAL, ValueSupport.FALSE_VAL, nameStr,
                       startPos);
    }
    return new Token(TokenType.NAME, nameStr, startPos);
  }

  private static void validateQuotedSheet(ExprBuf buf, int startPos) {
    String sheet = parseStringUntil(buf, SHEET_QUOTE_CHAR, true, startPos);
    if(buf.peekNext() != '!') {
      throw new LexException("Quoted sheet name must be followed by '!' " +
                             buf, startPos);
    }
    if(sheet.indexOf(BRACKET_START_CHAR) >= 0) {
      throw new UnsupportedConstructException(
          "External workbook references are not supported " + buf, startPos);
    }
    if(sheet.indexOf(':') >= 0) {
      throw new UnsupportedConstructException(
          "3-D references are not supported " + buf, startPos);
    }
    buf.reset(startPos);
  }

  private static Token parseErrorLiteral(ExprBuf buf, int startPos) {
    for(ErrorCode code : ErrorCode.values()) {
      if(buf.regionMatches(startPos, code.getCode())) {
        buf.reset(startPos + code.getCode().length());
        return new Token(TokenType.LITERAL, ValueSupport.toValue(code),
                         code.getCode(), startPos);
      }
    }
    throw new LexException("Invalid error literal " + buf, startPos);
  }

  private static String parseBrackets(ExprBuf buf) {
    int startPos = buf.curPos();
    StringBuilder sb = new StringBuilder();
    int level = 0;
    while(buf.hasNext()) {
      char c = buf.next();
      sb.append(c);
      if(c == BRACKET_START_CHAR) {
        ++level;
      } else if(c == BRACKET_END_CHAR) {
        if(--level == 0) {
          return sb.toString();
        }
      } else if((c == SHEET_QUOTE_CHAR) && buf.hasNext()) {
        // escapes a special character within a column name
        sb.append(buf.next());
      }
    }
    throw new LexException("Missing closing '" + BRACKET_END_CHAR + "' " +
                           buf, startPos);
  }

  private static byte getCharFlag(char c) {
    return ((c < 128) ? CHAR_FLAGS[c] : 0);
  }

  private static String parseCompOp(char firstChar, ExprBuf buf) {
    String opStr = String.valueOf(firstChar);

    int c = buf.peekNext();
    if((c != EOF) && hasFlag(getCharFlag((char)c), IS_COMP_FLAG)) {

      // is the combo a valid comparison operator?
      String tmpStr = opStr + (char)c;
      if(TWO_CHAR_COMP_OPS.contains(tmpStr)) {
        opStr = tmpStr;
        buf.next();
      }
    }

    return opStr;
  }

  private static void consumeWhitespace(ExprBuf buf) {
    int c = EOF;
    while(((c = buf.peekNext()) != EOF) &&
          hasFlag(getCharFlag((char)c), IS_SPACE_FLAG)) {
        buf.next();
    }
  }

  static String parseStringUntil(ExprBuf buf, char endChar,
                                 boolean allowDoubledEscape, int startPos)
  {
    StringBuilder sb = buf.getScratchBuffer();
    boolean complete = false;
    while(buf.hasNext()) {
      char c = buf.next();
      if(c == endChar) {
        if(allowDoubledEscape && (buf.peekNext() == endChar)) {
          buf.next();
        } else {
          complete = true;
          break;
        }
      }

      sb.append(c);
    }

    if(!complete) {
      throw new LexException("Missing closing '" + endChar +
                             "' for quoted string " + buf, startPos);
    }

    return sb.toString();
  }

  private static boolean isRefEnd(Token t) {
    switch(t.getType()) {
    case REF:
    case NAME:
      return true;
    case PAREN:
      return ")".equals(t.getValueStr());
    default:
      return false;
    }
  }

  private static boolean isRefStart(Token t) {
    switch(t.getType()) {
    case REF:
    case NAME:
    case FUNC:
      return true;
    case PAREN:
      return "(".equals(t.getValueStr());
    default:
      return false;
    }
  }

  private static boolean hasFlag(byte charFlag, byte flag) {
    return ((charFlag & flag) != 0);
  }

  private static void setCharFlag(byte flag, char... chars) {
    for(char c : chars) {
      CHAR_FLAGS[c] |= flag;
    }
  }

  static final class ExprBuf
  {
    private final String _str;
    private final String _defaultSheet;
    private int _pos;
    private final StringBuilder _scratch = new StringBuilder();

    ExprBuf(String str, String defaultSheet) {
      _str = str;
      _defaultSheet = defaultSheet;
    }

    private int len() {
      return _str.length();
    }

    public int curPos() {
      return _pos;
    }

    public boolean hasNext() {
      return _pos < len();
    }

    public char next() {
      return _str.charAt(_pos++);
    }

    public int peekNext() {
      if(!hasNext()) {
        return EOF;
      }
      return _str.charAt(_pos);
    }

    public void reset(int pos) {
      _pos = pos;
    }

    public String substring(int start) {
      return _str.substring(start, _pos);
    }

    public boolean regionMatches(int start, String str) {
      return _str.regionMatches(true, start, str, 0, str.length());
    }

    /**
     * @return the text matched by the given pattern at the given position,
     *         {@code null} if it does not match
     */
    public String lookingAt(Pattern pat, int start) {
      Matcher m = pat.matcher(_str);
      m.region(start, len());
      m.useTransparentBounds(true);
      return (m.lookingAt() ? m.group() : null);
    }

    public StringBuilder getScratchBuffer() {
      _scratch.setLength(0);
      return _scratch;
    }

    public String getDefaultSheet() {
      return _defaultSheet;
    }

    @Override
    public String toString() {
      return "[char " + _pos + "] '" + _str + "'";
    }
  }


  static final class Token
  {
    private final TokenType _type;
    private final Object _val;
    private final String _valStr;
    private final int _pos;

    private Token(TokenType type, String val, int pos) {
      this(type, val, val, pos);
    }

    private Token(TokenType type, Object val, String valStr, int pos) {
      _type = type;
      _val = ((val != null) ? val : valStr);
      _valStr = valStr;
      _pos = pos;
    }

    public TokenType getType() {
      return _type;
    }

    public Object getValue() {
      return _val;
    }

    public String getValueStr() {
      return _valStr;
    }

    public int getPosition() {
      return _pos;
    }

    public Value.Type getValueType() {
      return ((_val instanceof Value) ? ((Value)_val).getType() : null);
    }

    @Override
    public String toString() {
      String str = "[" + _type + "] '" + _val + "'";
      Value.Type valType = getValueType();
      if(valType != null) {
        str = "[" + _type + "] '" + _valStr + "' (" + valType + ")";
      }
      return str;
    }
  }

}
