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

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.EnumMap;
import java.util.Map;

import com.healthmarketscience.sheetcalc.expr.ErrorCode;
import com.healthmarketscience.sheetcalc.expr.EvalException;
import com.healthmarketscience.sheetcalc.expr.Value;
import org.apache.commons.lang3.StringUtils;

/**
 *
 * @author James Ahlborn
 */
public class ValueSupport
{
  public static final Value BLANK_VAL = new BlankValue(false);
  /** placeholder for an omitted function argument */
  public static final Value MISSING_VAL = new BlankValue(true);
  public static final Value TRUE_VAL = new BooleanValue(true);
  public static final Value FALSE_VAL = new BooleanValue(false);
  public static final Value ZERO_VAL = new NumberValue(0.0d);
  public static final Value ONE_VAL = new NumberValue(1.0d);
  public static final Value EMPTY_STR_VAL = new StringValue("");

  private static final Map<ErrorCode,Value> ERROR_VALS =
    new EnumMap<ErrorCode,Value>(ErrorCode.class);
  static {
    for(ErrorCode code : ErrorCode.values()) {
      ERROR_VALS.put(code, new ErrorValue(code));
    }
  }

  // numbers are displayed with at most 15 significant digits
  private static final MathContext NUMBER_CTX = new MathContext(15);
  private static final double MIN_PLAIN = 1e-9d;
  private static final double MAX_PLAIN = 1e15d;
  private static final char STRING_QUOTE_CHAR = '"';

  private ValueSupport() {}

  public static Value toValue(boolean b) {
    return (b ? TRUE_VAL : FALSE_VAL);
  }

  public static Value toValue(String s) {
    return (s.isEmpty() ? EMPTY_STR_VAL : new StringValue(s));
  }

  /**
   * @return a number value, or {@code #NUM!} if the given double is infinite
   *         or NaN
   */
  public static Value toValue(double d) {
    if(Double.isNaN(d) || Double.isInfinite(d)) {
      return toValue(ErrorCode.NUM);
    }
    if(d == 0.0d) {
      return ZERO_VAL;
    }
    return new NumberValue(d);
  }

  public static Value toValue(ErrorCode code) {
    return ERROR_VALS.get(code);
  }

  public static Value toValue(Value[][] vals) {
    return new ArrayValue(vals);
  }

  /**
   * Converts a plain java object into a Value.  Supported types are
   * {@code null} (blank), Value, Number, Boolean, String, ErrorCode and
   * {@code Object[][]}.
   *
   * @throws EvalException if the object type is not supported
   */
  public static Value toValue(Object obj) {
    if(obj == null) {
      return BLANK_VAL;
    }
    if(obj instanceof Value) {
      return (Value)obj;
    }
    if(obj instanceof Number) {
      return toValue(((Number)obj).doubleValue());
    }
    if(obj instanceof Boolean) {
      return toValue(((Boolean)obj).booleanValue());
    }
    if(obj instanceof String) {
      return toValue((String)obj);
    }
    if(obj instanceof ErrorCode) {
      return toValue((ErrorCode)obj);
    }
    if(obj instanceof Object[][]) {
      Object[][] objs = (Object[][])obj;
      Value[][] vals = new Value[objs.length][];
      for(int i = 0; i < objs.length; ++i) {
        vals[i] = new Value[objs[i].length];
        for(int j = 0; j < objs[i].length; ++j) {
          vals[i][j] = toValue(objs[i][j]);
        }
      }
      return toValue(vals);
    }
    throw new EvalException("Unsupported value type " +
                            obj.getClass().getName());
  }

  /**
   * Formats a number the way it is displayed in a cell: integral values
   * without a fraction, others with up to 15 significant digits.  Very large
   * and very small magnitudes use scientific notation, e.g.
   * {@code "1.5E+20"}.
   */
  public static String formatNumber(double d) {
    double abs = Math.abs(d);
    if((d == Math.rint(d)) && (abs < MAX_PLAIN)) {
      return Long.toString((long)d);
    }
    BigDecimal bd = new BigDecimal(d, NUMBER_CTX).stripTrailingZeros();
    if((abs >= MIN_PLAIN) && (abs < MAX_PLAIN)) {
      return bd.toPlainString();
    }
    int exp = bd.precision() - bd.scale() - 1;
    String mantissa = bd.movePointLeft(exp).toPlainString();
    return mantissa + "E" + ((exp < 0) ? '-' : '+') + Math.abs(exp);
  }

  /**
   * @return the given scalar value as formula literal text (strings quoted)
   */
  public static String toLiteralString(Value val) {
    switch(val.getType()) {
    case BLANK:
      return "";
    case STRING:
      return STRING_QUOTE_CHAR +
        StringUtils.replace(val.getAsString(), "\"", "\"\"") +
        STRING_QUOTE_CHAR;
    case ERROR:
      return val.getErrorCode().getCode();
    case NUMBER:
    case BOOLEAN:
      return val.getAsString();
    default:
      return val.toString();
    }
  }

  /**
   * The blank value, which is 0 or {@code ""} depending on the context it is
   * used in.
   */
  private static final class BlankValue extends BaseValue
  {
    private final boolean _missing;

    private BlankValue(boolean missing) {
      _missing = missing;
    }

    @Override
    public Type getType() {
      return Type.BLANK;
    }

    @Override
    public Object get() {
      return null;
    }

    @Override
    public boolean isMissing() {
      return _missing;
    }

    @Override
    public boolean getAsBoolean() {
      return false;
    }

    @Override
    public String getAsString() {
      return "";
    }

    @Override
    public double getAsDouble() {
      return 0.0d;
    }

    @Override
    public String toString() {
      return (_missing ? "Value[MISSING]" : "Value[BLANK]");
    }
  }
}
