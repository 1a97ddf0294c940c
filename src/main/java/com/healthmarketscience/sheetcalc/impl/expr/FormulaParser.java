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
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.healthmarketscience.sheetcalc.CellRange;
import com.healthmarketscience.sheetcalc.expr.ErrorCode;
import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.Formula;
import com.healthmarketscience.sheetcalc.expr.Function;
import com.healthmarketscience.sheetcalc.expr.FunctionLookup;
import com.healthmarketscience.sheetcalc.expr.ParseException;
import com.healthmarketscience.sheetcalc.expr.Value;
import com.healthmarketscience.sheetcalc.impl.expr.FormulaTokenizer.Token;
import com.healthmarketscience.sheetcalc.impl.expr.FormulaTokenizer.TokenType;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Parses formula text into an executable {@link Formula}.
 * <p/>
 * Operator precedence, from highest to lowest: range ({@code :}),
 * intersection (space), union ({@code ,} within parentheses), negation,
 * percent, exponentiation, multiplication and division, addition and
 * subtraction, concatenation, comparison.  All binary operators are left
 * associative, so {@code -2^2} is 4 and {@code 2^3^2} is 64.
 *
 * @author James Ahlborn
 */
public class FormulaParser
{
  private static final Log LOG = LogFactory.getLog(FormulaParser.class);

  /** context for parsing a single formula */
  public interface ParseContext
  {
    public FunctionLookup getFunctionLookup();

    /**
     * @return the sheet of unqualified references (the sheet of the formula
     *         cell)
     */
    public String getDefaultSheet();
  }

  private static final String OPEN_PAREN = "(";
  private static final String CLOSE_PAREN = ")";
  private static final String PARAM_SEP = ",";
  private static final String ARRAY_COL_SEP = ",";
  private static final String ARRAY_ROW_SEP = ";";
  private static final String ARRAY_START = "{";
  private static final String ARRAY_END = "}";

  private interface OpType {}

  private enum UnaryOp implements OpType {
    NEG("-") {
      @Override public Value eval(EvalContext ctx, Value param1) {
        return BuiltinOperators.negate(ArraySupport.toOperand(ctx, param1));
      }
    },
    POS("+") {
      @Override public Value eval(EvalContext ctx, Value param1) {
        // basically a no-op
        return param1;
      }
    };

    private final String _str;

    private UnaryOp(String str) {
      _str = str;
    }

    @Override
    public String toString() {
      return _str;
    }

    public abstract Value eval(EvalContext ctx, Value param1);
  }

  private enum PostfixOp implements OpType {
    PCT("%");

    private final String _str;

    private PostfixOp(String str) {
      _str = str;
    }

    @Override
    public String toString() {
      return _str;
    }
  }

  private enum BinaryOp implements OpType {
    PLUS("+") {
      @Override public Value eval(Value param1, Value param2) {
        return BuiltinOperators.add(param1, param2);
      }
    },
    MINUS("-") {
      @Override public Value eval(Value param1, Value param2) {
        return BuiltinOperators.subtract(param1, param2);
      }
    },
    MULT("*") {
      @Override public Value eval(Value param1, Value param2) {
        return BuiltinOperators.multiply(param1, param2);
      }
    },
    DIV("/") {
      @Override public Value eval(Value param1, Value param2) {
        return BuiltinOperators.divide(param1, param2);
      }
    },
    EXP("^") {
      @Override public Value eval(Value param1, Value param2) {
        return BuiltinOperators.power(param1, param2);
      }
    },
    CONCAT("&") {
      @Override public Value eval(Value param1, Value param2) {
        return BuiltinOperators.concat(param1, param2);
      }
    };

    private final String _str;

    private BinaryOp(String str) {
      _str = str;
    }

    @Override
    public String toString() {
      return _str;
    }

    public abstract Value eval(Value param1, Value param2);
  }

  private enum CompOp implements OpType {
    LT("<") {
      @Override public Value eval(Value param1, Value param2) {
        return BuiltinOperators.lessThan(param1, param2);
      }
    },
    LTE("<=") {
      @Override public Value eval(Value param1, Value param2) {
        return BuiltinOperators.lessThanEq(param1, param2);
      }
    },
    GT(">") {
      @Override public Value eval(Value param1, Value param2) {
        return BuiltinOperators.greaterThan(param1, param2);
      }
    },
    GTE(">=") {
      @Override public Value eval(Value param1, Value param2) {
        return BuiltinOperators.greaterThanEq(param1, param2);
      }
    },
    EQ("=") {
      @Override public Value eval(Value param1, Value param2) {
        return BuiltinOperators.equalTo(param1, param2);
      }
    },
    NE("<>") {
      @Override public Value eval(Value param1, Value param2) {
        return BuiltinOperators.notEqualTo(param1, param2);
      }
    };

    private final String _str;

    private CompOp(String str) {
      _str = str;
    }

    @Override
    public String toString() {
      return _str;
    }

    public abstract Value eval(Value param1, Value param2);
  }

  private enum RefOp implements OpType {
    RANGE(":") {
      @Override public Value eval(EvalContext ctx, Value param1, Value param2) {
        return BuiltinOperators.range(ctx, param1, param2);
      }
    },
    INTERSECT(FormulaTokenizer.INTERSECT_OP) {
      @Override public Value eval(EvalContext ctx, Value param1, Value param2) {
        return BuiltinOperators.intersect(ctx, param1, param2);
      }
    };

    private final String _str;

    private RefOp(String str) {
      _str = str;
    }

    @Override
    public String toString() {
      return _str;
    }

    public abstract Value eval(EvalContext ctx, Value param1, Value param2);
  }

  private static final Map<String,OpType> BINARY_OPS =
    new HashMap<String,OpType>();

  static {
    for(BinaryOp op : BinaryOp.values()) {
      BINARY_OPS.put(op.toString(), op);
    }
    for(CompOp op : CompOp.values()) {
      BINARY_OPS.put(op.toString(), op);
    }
    for(RefOp op : RefOp.values()) {
      BINARY_OPS.put(op.toString(), op);
    }
  }

  private static final Map<OpType, Integer> PRECENDENCE =
    buildPrecedenceMap(
        new OpType[]{RefOp.RANGE},
        new OpType[]{RefOp.INTERSECT},
        new OpType[]{UnaryOp.NEG, UnaryOp.POS},
        new OpType[]{PostfixOp.PCT},
        new OpType[]{BinaryOp.EXP},
        new OpType[]{BinaryOp.MULT, BinaryOp.DIV},
        new OpType[]{BinaryOp.PLUS, BinaryOp.MINUS},
        new OpType[]{BinaryOp.CONCAT},
        new OpType[]{CompOp.LT, CompOp.GT, CompOp.NE, CompOp.LTE, CompOp.GTE,
                     CompOp.EQ});

  private FormulaParser() {}

  /**
   * Parses the given formula text (the leading {@code '='} is optional).
   *
   * @throws ParseException if the formula is malformed
   */
  public static Formula parse(String formulaStr, ParseContext context) {

    List<Token> tokens = FormulaTokenizer.tokenize(
        formulaStr, context.getDefaultSheet());

    if(tokens.isEmpty()) {
      throw new ParseException("empty formula '" + formulaStr + "'", 0);
    }

    TokBuf buf = new TokBuf(tokens, context);

    Expr expr = parseExpression(buf, false);

    return new FormulaWrapper(formulaStr, expr);
  }

  private static Expr parseExpression(TokBuf buf, boolean singleExpr)
  {
    while(buf.hasNext()) {
      Token t = buf.next();

      switch(t.getType()) {
      case LITERAL:

        buf.setPendingExpr(new ELiteralValue((Value)t.getValue()));
        break;

      case REF:

        buf.setPendingExpr(new ERef((CellRange)t.getValue()));
        break;

      case NAME:

        buf.setPendingExpr(new ENameRef(t.getValueStr()));
        break;

      case FUNC:

        parseFuncCallExpression(t, buf);
        break;

      case OP:

        parseOperatorExpression(t, buf);
        break;

      case PAREN:

        parseParenExpression(t, buf);
        break;

      case ARRAY:

        parseArrayExpression(t, buf);
        break;

      case SEP:

        throw new ParseException("Unexpected separator " + buf,
                                 t.getPosition());

      default:
        throw new ParseException("unknown token type " + t, t.getPosition());
      }

      if(singleExpr && buf.hasPendingExpr()) {
        break;
      }
    }

    Expr expr = buf.takePendingExpr();
    if(expr == null) {
      throw new ParseException("No expression found " + buf,
                               buf.curCharPos());
    }

    return expr;
  }

  private static void parseParenExpression(Token firstTok, TokBuf buf) {
    // the only "top-level" paren we expect to find is open paren, and
    // there shouldn't be any pending expression
    if(!isParen(firstTok, OPEN_PAREN) || buf.hasPendingExpr()) {
      throw new ParseException("Unexpected parenthesis " + buf,
                               firstTok.getPosition());
    }

    List<Expr> exprs = findParenExprs(buf, false);
    if(exprs.size() == 1) {
      buf.setPendingExpr(new EParen(exprs.get(0)));
    } else {
      // commas within plain parentheses are the union operator
      buf.setPendingExpr(new EParen(new EUnionOp(exprs)));
    }
  }

  private static void parseFuncCallExpression(Token firstTok, TokBuf buf) {

    if(buf.hasPendingExpr()) {
      throw new ParseException("Found multiple expressions with no operator " +
                               buf, firstTok.getPosition());
    }

    // the tokenizer only produces function tokens before an open paren
    buf.next();
    List<Expr> params = findParenExprs(buf, true);
    String funcName = firstTok.getValueStr();
    Function func = buf.getFunction(funcName);
    if(func == null) {
      LOG.warn("Unknown function '" + funcName + "' will evaluate to " +
               ErrorCode.NAME);
      buf.setPendingExpr(new EUnknownFunc(funcName, params));
      return;
    }

    int numParams = params.size();
    if((numParams < func.getMinParams()) || (numParams > func.getMaxParams())) {
      throw new ParseException(
          "Invalid number of parameters " + numParams + " for function " +
          func.getName() + ", expected " +
          FunctionSupport.toParamRange(func.getMinParams(),
                                       func.getMaxParams()) + " " + buf,
          firstTok.getPosition());
    }

    buf.setPendingExpr(new EFunc(func, params));
  }

  private static List<Expr> findParenExprs(
      TokBuf buf, boolean isFuncCall) {

    if(isFuncCall) {
      // simple case, no params
      Token t = buf.peekNext();
      if(isParen(t, CLOSE_PAREN)) {
        buf.next();
        return Collections.emptyList();
      }
    }

    // find closing ")", handle nested parens and array literals
    List<Expr> exprs = new ArrayList<Expr>(3);
    int level = 1;
    boolean inArray = false;
    int startPos = buf.curPos();
    while(buf.hasNext()) {

      Token t = buf.next();

      if(t.getType() == TokenType.ARRAY) {

        inArray = ARRAY_START.equals(t.getValueStr());

      } else if(isParen(t, OPEN_PAREN)) {

        ++level;

      } else if(isParen(t, CLOSE_PAREN)) {

        --level;
        if(level == 0) {
          exprs.add(parseParenPart(buf, startPos, buf.prevPos(), isFuncCall));
          return exprs;
        }

      } else if(!inArray && (level == 1) && isSep(t, PARAM_SEP)) {

        exprs.add(parseParenPart(buf, startPos, buf.prevPos(), isFuncCall));
        startPos = buf.curPos();
      }
    }

    throw new ParseException("Missing closing '" + CLOSE_PAREN + "' " + buf,
                             buf.curCharPos());
  }

  private static Expr parseParenPart(TokBuf buf, int start, int end,
                                     boolean isFuncCall) {
    if(start == end) {
      if(isFuncCall) {
        // explicitly omitted parameter
        return EMissingArg.INSTANCE;
      }
      throw new ParseException("Empty expression " + buf, buf.curCharPos());
    }
    return parseExpression(buf.subBuf(start, end), false);
  }

  private static void parseOperatorExpression(Token t, TokBuf buf) {

    String opStr = t.getValueStr();

    if(PostfixOp.PCT.toString().equals(opStr)) {
      if(!buf.hasPendingExpr()) {
        throw new ParseException(
            "Missing expression for operator " + opStr + " " + buf,
            t.getPosition());
      }
      buf.setPendingExpr(new EPostfixOp(PostfixOp.PCT,
                                        buf.takePendingExpr()));
      return;
    }

    // most ops are two argument except that '-' could be negation, "+" could
    // be pos-ation
    if(buf.hasPendingExpr()) {
      parseBinaryOpExpression(t, buf);
    } else if(isEitherOp(t, "-", "+")) {
      parseUnaryOpExpression(t, buf);
    } else {
      throw new ParseException(
          "Missing left expression for binary operator " + opStr + " " + buf,
          t.getPosition());
    }
  }

  private static void parseBinaryOpExpression(Token firstTok, TokBuf buf) {
    OpType op = BINARY_OPS.get(firstTok.getValueStr());
    if(op == null) {
      throw new ParseException("Invalid operator " + firstTok + " " + buf,
                               firstTok.getPosition());
    }
    Expr leftExpr = buf.takePendingExpr();
    Expr rightExpr = parseExpression(buf, true);

    if(op instanceof CompOp) {
      buf.setPendingExpr(new ECompOp((CompOp)op, leftExpr, rightExpr));
    } else if(op instanceof RefOp) {
      buf.setPendingExpr(new ERefOp((RefOp)op, leftExpr, rightExpr));
    } else {
      buf.setPendingExpr(new EBinaryOp((BinaryOp)op, leftExpr, rightExpr));
    }
  }

  private static void parseUnaryOpExpression(Token firstTok, TokBuf buf) {
    UnaryOp op = (isOp(firstTok, "-") ? UnaryOp.NEG : UnaryOp.POS);

    Expr val = parseExpression(buf, true);

    buf.setPendingExpr(new EUnaryOp(op, val));
  }

  private static void parseArrayExpression(Token firstTok, TokBuf buf) {
    if(!ARRAY_START.equals(firstTok.getValueStr()) || buf.hasPendingExpr()) {
      throw new ParseException("Unexpected array delimiter " + buf,
                               firstTok.getPosition());
    }

    List<List<Value>> rows = new ArrayList<List<Value>>();
    List<Value> row = new ArrayList<Value>();
    rows.add(row);
    boolean negate = false;
    boolean expectValue = true;
    while(buf.hasNext()) {
      Token t = buf.next();

      if(expectValue) {
        if(isEitherOp(t, "-", "+")) {
          negate ^= isOp(t, "-");
          continue;
        }
        if(t.getType() != TokenType.LITERAL) {
          throw new ParseException("Array literals may only contain constants " +
                                   buf, t.getPosition());
        }
        Value val = (Value)t.getValue();
        if(negate) {
          if(val.getType() != Value.Type.NUMBER) {
            throw new ParseException("Invalid array literal element " + buf,
                                     t.getPosition());
          }
          val = BuiltinOperators.negate(val);
          negate = false;
        }
        row.add(val);
        expectValue = false;
        continue;
      }

      if(isArray(t, ARRAY_END)) {
        buf.setPendingExpr(new EArray(toArrayValue(rows, buf, t)));
        return;
      }
      if(isSep(t, ARRAY_COL_SEP)) {
        expectValue = true;
      } else if(isSep(t, ARRAY_ROW_SEP)) {
        row = new ArrayList<Value>();
        rows.add(row);
        expectValue = true;
      } else {
        throw new ParseException("Unexpected token in array literal " + buf,
                                 t.getPosition());
      }
    }

    throw new ParseException("Missing closing '" + ARRAY_END + "' " + buf,
                             firstTok.getPosition());
  }

  private static Value toArrayValue(List<List<Value>> rows, TokBuf buf,
                                    Token endTok) {
    int numCols = rows.get(0).size();
    Value[][] vals = new Value[rows.size()][];
    for(int i = 0; i < vals.length; ++i) {
      List<Value> row = rows.get(i);
      if(row.size() != numCols) {
        throw new ParseException("Array literal rows must all be the same " +
                                 "length " + buf, endTok.getPosition());
      }
      vals[i] = row.toArray(new Value[numCols]);
    }
    return ValueSupport.toValue(vals);
  }

  private static boolean isOp(Token t, String opStr) {
    return ((t != null) && (t.getType() == TokenType.OP) &&
            opStr.equals(t.getValueStr()));
  }

  private static boolean isEitherOp(Token t, String opStr1, String opStr2) {
    return (isOp(t, opStr1) || isOp(t, opStr2));
  }

  private static boolean isParen(Token t, String str) {
    return ((t != null) && (t.getType() == TokenType.PAREN) &&
            str.equals(t.getValueStr()));
  }

  private static boolean isSep(Token t, String str) {
    return ((t != null) && (t.getType() == TokenType.SEP) &&
            str.equals(t.getValueStr()));
  }

  private static boolean isArray(Token t, String str) {
    return ((t != null) && (t.getType() == TokenType.ARRAY) &&
            str.equals(t.getValueStr()));
  }

  private static StringBuilder appendLeadingExpr(
      Expr expr, StringBuilder sb, boolean isDebug)
  {
    int len = sb.length();
    expr.toString(sb, isDebug);
    if(sb.length() > len) {
      // only add space if the leading expr added some text
      sb.append(" ");
    }
    return sb;
  }

  private static final class TokBuf
  {
    private final List<Token> _tokens;
    private final TokBuf _parent;
    private final int _parentOff;
    private final ParseContext _ctx;
    private int _pos;
    private Expr _pendingExpr;

    private TokBuf(List<Token> tokens, ParseContext context) {
      this(tokens, null, 0, context);
    }

    private TokBuf(List<Token> tokens, TokBuf parent, int parentOff,
                   ParseContext context) {
      _tokens = tokens;
      _parent = parent;
      _parentOff = parentOff;
      _ctx = context;
    }

    public int curPos() {
      return _pos;
    }

    public int prevPos() {
      return _pos - 1;
    }

    /**
     * @return the formula text position of the current token
     */
    public int curCharPos() {
      if(hasNext()) {
        return _tokens.get(_pos).getPosition();
      }
      if(!_tokens.isEmpty()) {
        return _tokens.get(_tokens.size() - 1).getPosition();
      }
      return ((_parent != null) ? _parent.curCharPos() : 0);
    }

    public boolean hasNext() {
      return (_pos < _tokens.size());
    }

    public Token peekNext() {
      if(!hasNext()) {
        return null;
      }
      return _tokens.get(_pos);
    }

    public Token next() {
      if(!hasNext()) {
        throw new ParseException(
            "Unexpected end of formula " + this, curCharPos());
      }
      return _tokens.get(_pos++);
    }

    public TokBuf subBuf(int start, int end) {
      return new TokBuf(_tokens.subList(start, end), this, start, _ctx);
    }

    public void setPendingExpr(Expr expr) {
      if(_pendingExpr != null) {
        throw new ParseException(
            "Found multiple expressions with no operator " + this,
            curCharPos());
      }
      _pendingExpr = expr.resolveOrderOfOperations();
    }

    public Expr takePendingExpr() {
      Expr expr = _pendingExpr;
      _pendingExpr = null;
      return expr;
    }

    public boolean hasPendingExpr() {
      return (_pendingExpr != null);
    }

    public Function getFunction(String funcName) {
      return _ctx.getFunctionLookup().getFunction(funcName);
    }

    @Override
    public String toString() {

      int pos = _pos;
      List<Token> toks = _tokens;
      TokBuf cur = this;
      while(cur._parent != null) {
        pos += cur._parentOff;
        cur = cur._parent;
        toks = cur._tokens;
      }

      StringBuilder sb = new StringBuilder()
        .append("[token ").append(pos).append("] (");

      for(Iterator<Token> iter = toks.iterator(); iter.hasNext(); ) {
        Token t = iter.next();
        sb.append("'").append(t.getValueStr()).append("'");
        if(iter.hasNext()) {
          sb.append(",");
        }
      }

      sb.append(")");

      if(_pendingExpr != null) {
        sb.append(" [pending '").append(_pendingExpr.toDebugString())
          .append("']");
      }

      return sb.toString();
    }
  }

  private static boolean isHigherPrecendence(OpType op1, OpType op2) {
    int prec1 = PRECENDENCE.get(op1);
    int prec2 = PRECENDENCE.get(op2);

    // higher preceendence ops have lower numbers
    return (prec1 < prec2);
  }

  private static final Map<OpType, Integer> buildPrecedenceMap(
      OpType[]... opArrs) {
    Map<OpType, Integer> prec = new HashMap<OpType, Integer>();

    int level = 0;
    for(OpType[] ops : opArrs) {
      for(OpType op : ops) {
        prec.put(op, level);
      }
      ++level;
    }

    return prec;
  }

  private static void exprListToString(
      List<Expr> exprs, String sep, StringBuilder sb, boolean isDebug) {
    Iterator<Expr> iter = exprs.iterator();
    iter.next().toString(sb, isDebug);
    while(iter.hasNext()) {
      sb.append(sep);
      iter.next().toString(sb, isDebug);
    }
  }

  private static Value[] exprListToValues(
      List<Expr> exprs, EvalContext ctx) {
    Value[] paramVals = new Value[exprs.size()];
    for(int i = 0; i < exprs.size(); ++i) {
      paramVals[i] = exprs.get(i).eval(ctx);
    }
    return paramVals;
  }

  private static boolean areConstant(List<Expr> exprs) {
    for(Expr expr : exprs) {
      if(!expr.isConstant()) {
        return false;
      }
    }
    return true;
  }

  private static boolean areDynamic(List<Expr> exprs) {
    for(Expr expr : exprs) {
      if(expr.isDynamic()) {
        return true;
      }
    }
    return false;
  }

  private interface LeftAssocExpr {
    public OpType getOp();
    public Expr getLeft();
    public void setLeft(Expr left);
  }

  private interface RightAssocExpr {
    public OpType getOp();
    public Expr getRight();
    public void setRight(Expr right);
  }

  private static abstract class Expr
  {
    public String toCleanString() {
      return toString(new StringBuilder(), false).toString();
    }

    public String toDebugString() {
      return toString(new StringBuilder(), true).toString();
    }

    protected StringBuilder toString(StringBuilder sb, boolean isDebug) {
      if(isDebug) {
        sb.append("<").append(getClass().getSimpleName()).append(">{");
      }
      toExprString(sb, isDebug);
      if(isDebug) {
        sb.append("}");
      }
      return sb;
    }

    protected Expr resolveOrderOfOperations() {

      if(!(this instanceof LeftAssocExpr)) {
        // nothing we can do
        return this;
      }

      // in order to get the precedence right, we need to first associate this
      // expression with the "rightmost" expression preceding it, then adjust
      // this expression "down" (lower precedence) as the precedence of the
      // operations dictates.  since we parse from left to right, the initial
      // "left" value isn't the immediate left expression, instead it's based
      // on how the preceding operator precedence worked out.

      Expr outerExpr = this;
      final LeftAssocExpr thisExpr = (LeftAssocExpr)this;
      final Expr thisLeft = thisExpr.getLeft();

      // current: <this>{<left>{A op1 B} op2 <right>{C}}
      if(thisLeft instanceof RightAssocExpr) {

        RightAssocExpr leftOp = (RightAssocExpr)thisLeft;

        // target: <left>{A op1 <this>{B op2 <right>{C}}}

        thisExpr.setLeft(leftOp.getRight());

        // give the new version of this expression an opportunity to further
        // swap (since the swapped expression may itself be a binary
        // expression)
        leftOp.setRight(resolveOrderOfOperations());
        outerExpr = thisLeft;

        // now shift "this" back down if the operator precedence is
        // incorrect.  we only need to check precedence against "this", as
        // all other precedence has been resolved in previous parsing rounds.
        if((leftOp.getRight() == this) &&
           !isHigherPrecendence(thisExpr.getOp(), leftOp.getOp())) {

          // doh, "this" is lower (or the same) precedence, restore the
          // original order of things
          leftOp.setRight(thisExpr.getLeft());
          thisExpr.setLeft(thisLeft);
          outerExpr = this;
        }
      }

      return outerExpr;
    }

    public abstract boolean isConstant();

    public boolean isDynamic() {
      return false;
    }

    public abstract Value eval(EvalContext ctx);

    public void collectReferences(Collection<CellRange> refs) {
      // none
    }

    public void collectNames(Collection<String> names) {
      // none
    }

    protected abstract void toExprString(StringBuilder sb, boolean isDebug);
  }

  private static final class ELiteralValue extends Expr
  {
    private final Value _val;

    private ELiteralValue(Value val) {
      _val = val;
    }

    @Override
    public boolean isConstant() {
      return true;
    }

    @Override
    public Value eval(EvalContext ctx) {
      return _val;
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append(ValueSupport.toLiteralString(_val));
    }
  }

  private static final class EMissingArg extends Expr
  {
    private static final EMissingArg INSTANCE = new EMissingArg();

    @Override
    public boolean isConstant() {
      return true;
    }

    @Override
    public Value eval(EvalContext ctx) {
      return ValueSupport.MISSING_VAL;
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      // nothing to show
    }
  }

  private static final class EArray extends Expr
  {
    private final Value _val;

    private EArray(Value val) {
      _val = val;
    }

    @Override
    public boolean isConstant() {
      return true;
    }

    @Override
    public Value eval(EvalContext ctx) {
      return _val;
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append(ARRAY_START);
      for(int i = 0; i < _val.getNumRows(); ++i) {
        if(i > 0) {
          sb.append(ARRAY_ROW_SEP);
        }
        for(int j = 0; j < _val.getNumColumns(); ++j) {
          if(j > 0) {
            sb.append(ARRAY_COL_SEP);
          }
          sb.append(ValueSupport.toLiteralString(_val.getElement(i, j)));
        }
      }
      sb.append(ARRAY_END);
    }
  }

  private static final class ERef extends Expr
  {
    private final CellRange _range;

    private ERef(CellRange range) {
      _range = range;
    }

    @Override
    public boolean isConstant() {
      return false;
    }

    @Override
    public Value eval(EvalContext ctx) {
      return ctx.getReference(_range);
    }

    @Override
    public void collectReferences(Collection<CellRange> refs) {
      refs.add(_range);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append(_range);
    }
  }

  private static final class ENameRef extends Expr
  {
    private final String _name;

    private ENameRef(String name) {
      _name = name;
    }

    @Override
    public boolean isConstant() {
      return false;
    }

    @Override
    public Value eval(EvalContext ctx) {
      CellRange range = ctx.resolveName(_name);
      if(range == null) {
        return ValueSupport.toValue(ErrorCode.VALUE);
      }
      return ctx.getReference(range);
    }

    @Override
    public void collectNames(Collection<String> names) {
      names.add(_name);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append(_name);
    }
  }

  private static class EParen extends Expr
  {
    private final Expr _expr;

    private EParen(Expr expr) {
      _expr = expr;
    }

    @Override
    public boolean isConstant() {
      return _expr.isConstant();
    }

    @Override
    public boolean isDynamic() {
      return _expr.isDynamic();
    }

    @Override
    public Value eval(EvalContext ctx) {
      return _expr.eval(ctx);
    }

    @Override
    public void collectReferences(Collection<CellRange> refs) {
      _expr.collectReferences(refs);
    }

    @Override
    public void collectNames(Collection<String> names) {
      _expr.collectNames(names);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append("(");
      _expr.toString(sb, isDebug);
      sb.append(")");
    }
  }

  private static abstract class EBaseFunc extends Expr
  {
    protected final List<Expr> _params;

    private EBaseFunc(List<Expr> params) {
      _params = params;
    }

    protected abstract String getName();

    @Override
    public boolean isDynamic() {
      return areDynamic(_params);
    }

    @Override
    public void collectReferences(Collection<CellRange> refs) {
      for(Expr param : _params) {
        param.collectReferences(refs);
      }
    }

    @Override
    public void collectNames(Collection<String> names) {
      for(Expr param : _params) {
        param.collectNames(names);
      }
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append(getName()).append("(");

      if(!_params.isEmpty()) {
        exprListToString(_params, PARAM_SEP, sb, isDebug);
      }

      sb.append(")");
    }
  }

  private static class EFunc extends EBaseFunc
  {
    private final Function _func;

    private EFunc(Function func, List<Expr> params) {
      super(params);
      _func = func;
    }

    @Override
    protected String getName() {
      return _func.getName();
    }

    @Override
    public boolean isConstant() {
      return _func.isPure() && areConstant(_params);
    }

    @Override
    public boolean isDynamic() {
      return !_func.isPure() || super.isDynamic();
    }

    @Override
    public Value eval(EvalContext ctx) {
      Value[] params = exprListToValues(_params, ctx);
      if(_func.getDispatch() == Function.Dispatch.ARRAY) {
        return _func.eval(ctx, params);
      }

      for(int i = 0; i < params.length; ++i) {
        params[i] = ArraySupport.toOperand(ctx, params[i]);
      }
      if(ArraySupport.anyNonScalar(params)) {
        // invoke once per element
        return ArraySupport.map(params, elems -> _func.eval(ctx, elems));
      }
      return _func.eval(ctx, params);
    }
  }

  private static class EUnknownFunc extends EBaseFunc
  {
    private final String _name;

    private EUnknownFunc(String name, List<Expr> params) {
      super(params);
      _name = name;
    }

    @Override
    protected String getName() {
      return _name;
    }

    @Override
    public boolean isConstant() {
      return true;
    }

    @Override
    public Value eval(EvalContext ctx) {
      return ValueSupport.toValue(ErrorCode.NAME);
    }
  }

  private static abstract class EBaseBinaryOp extends Expr
    implements LeftAssocExpr, RightAssocExpr
  {
    protected final OpType _op;
    protected Expr _left;
    protected Expr _right;

    private EBaseBinaryOp(OpType op, Expr left, Expr right) {
      _op = op;
      _left = left;
      _right = right;
    }

    @Override
    public boolean isConstant() {
      return (_left.isConstant() && _right.isConstant());
    }

    @Override
    public boolean isDynamic() {
      return (_left.isDynamic() || _right.isDynamic());
    }

    @Override
    public OpType getOp() {
      return _op;
    }

    @Override
    public Expr getLeft() {
      return _left;
    }

    @Override
    public void setLeft(Expr left) {
      _left = left;
    }

    @Override
    public Expr getRight() {
      return _right;
    }

    @Override
    public void setRight(Expr right) {
      _right = right;
    }

    @Override
    public void collectReferences(Collection<CellRange> refs) {
      _left.collectReferences(refs);
      _right.collectReferences(refs);
    }

    @Override
    public void collectNames(Collection<String> names) {
      _left.collectNames(names);
      _right.collectNames(names);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      appendLeadingExpr(_left, sb, isDebug)
        .append(_op).append(" ");
      _right.toString(sb, isDebug);
    }
  }

  private static class EBinaryOp extends EBaseBinaryOp
  {
    private EBinaryOp(BinaryOp op, Expr left, Expr right) {
      super(op, left, right);
    }

    @Override
    public Value eval(EvalContext ctx) {
      return ((BinaryOp)_op).eval(ArraySupport.toOperand(ctx, _left.eval(ctx)),
                                  ArraySupport.toOperand(ctx, _right.eval(ctx)));
    }
  }

  private static class ECompOp extends EBaseBinaryOp
  {
    private ECompOp(CompOp op, Expr left, Expr right) {
      super(op, left, right);
    }

    @Override
    public Value eval(EvalContext ctx) {
      return ((CompOp)_op).eval(ArraySupport.toOperand(ctx, _left.eval(ctx)),
                                ArraySupport.toOperand(ctx, _right.eval(ctx)));
    }
  }

  private static class ERefOp extends EBaseBinaryOp
  {
    private ERefOp(RefOp op, Expr left, Expr right) {
      super(op, left, right);
    }

    @Override
    public Value eval(EvalContext ctx) {
      return ((RefOp)_op).eval(ctx, _left.eval(ctx), _right.eval(ctx));
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      // reference operators are written without surrounding spaces
      _left.toString(sb, isDebug);
      sb.append(_op);
      _right.toString(sb, isDebug);
    }
  }

  private static class EUnaryOp extends Expr
    implements RightAssocExpr
  {
    private final OpType _op;
    private Expr _expr;

    private EUnaryOp(UnaryOp op, Expr expr) {
      _op = op;
      _expr = expr;
    }

    @Override
    public boolean isConstant() {
      return _expr.isConstant();
    }

    @Override
    public boolean isDynamic() {
      return _expr.isDynamic();
    }

    @Override
    public OpType getOp() {
      return _op;
    }

    @Override
    public Expr getRight() {
      return _expr;
    }

    @Override
    public void setRight(Expr right) {
      _expr = right;
    }

    @Override
    public Value eval(EvalContext ctx) {
      return ((UnaryOp)_op).eval(ctx, _expr.eval(ctx));
    }

    @Override
    public void collectReferences(Collection<CellRange> refs) {
      _expr.collectReferences(refs);
    }

    @Override
    public void collectNames(Collection<String> names) {
      _expr.collectNames(names);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append(_op);
      if(isDebug) {
        sb.append(" ");
      }
      _expr.toString(sb, isDebug);
    }
  }

  private static class EPostfixOp extends Expr
    implements LeftAssocExpr
  {
    private final OpType _op;
    private Expr _expr;

    private EPostfixOp(PostfixOp op, Expr expr) {
      _op = op;
      _expr = expr;
    }

    @Override
    public boolean isConstant() {
      return _expr.isConstant();
    }

    @Override
    public boolean isDynamic() {
      return _expr.isDynamic();
    }

    @Override
    public OpType getOp() {
      return _op;
    }

    @Override
    public Expr getLeft() {
      return _expr;
    }

    @Override
    public void setLeft(Expr left) {
      _expr = left;
    }

    @Override
    public Value eval(EvalContext ctx) {
      return BuiltinOperators.percent(
          ArraySupport.toOperand(ctx, _expr.eval(ctx)));
    }

    @Override
    public void collectReferences(Collection<CellRange> refs) {
      _expr.collectReferences(refs);
    }

    @Override
    public void collectNames(Collection<String> names) {
      _expr.collectNames(names);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      _expr.toString(sb, isDebug);
      sb.append(_op);
    }
  }

  private static class EUnionOp extends Expr
  {
    private final List<Expr> _exprs;

    private EUnionOp(List<Expr> exprs) {
      _exprs = exprs;
    }

    @Override
    public boolean isConstant() {
      return false;
    }

    @Override
    public boolean isDynamic() {
      return areDynamic(_exprs);
    }

    @Override
    public Value eval(EvalContext ctx) {
      return BuiltinOperators.union(ctx, exprListToValues(_exprs, ctx));
    }

    @Override
    public void collectReferences(Collection<CellRange> refs) {
      for(Expr expr : _exprs) {
        expr.collectReferences(refs);
      }
    }

    @Override
    public void collectNames(Collection<String> names) {
      for(Expr expr : _exprs) {
        expr.collectNames(names);
      }
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      exprListToString(_exprs, PARAM_SEP, sb, isDebug);
    }
  }

  /**
   * Formula implementation which wraps the root of a parsed expression.
   */
  private static final class FormulaWrapper implements Formula
  {
    private final String _rawFormulaStr;
    private final Expr _expr;

    private FormulaWrapper(String rawFormulaStr, Expr expr) {
      _rawFormulaStr = rawFormulaStr;
      _expr = expr;
    }

    @Override
    public Value eval(EvalContext ctx) {
      return _expr.eval(ctx);
    }

    @Override
    public String toRawString() {
      return _rawFormulaStr;
    }

    @Override
    public String toCleanString() {
      return FormulaTokenizer.FORMULA_START_CHAR + _expr.toCleanString();
    }

    @Override
    public String toDebugString() {
      return _expr.toDebugString();
    }

    @Override
    public boolean isConstant() {
      return _expr.isConstant();
    }

    @Override
    public boolean isDynamic() {
      return _expr.isDynamic();
    }

    @Override
    public void collectReferences(Collection<CellRange> refs) {
      _expr.collectReferences(refs);
    }

    @Override
    public void collectNames(Collection<String> names) {
      _expr.collectNames(names);
    }

    @Override
    public String toString() {
      return toRawString();
    }
  }
}
