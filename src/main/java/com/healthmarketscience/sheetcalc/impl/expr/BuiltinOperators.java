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

import java.util.Arrays;
import java.util.Objects;

import com.healthmarketscience.sheetcalc.CellRange;
import com.healthmarketscience.sheetcalc.expr.ErrorCode;
import com.healthmarketscience.sheetcalc.expr.ErrorCodeException;
import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.Value;
import static com.healthmarketscience.sheetcalc.impl.expr.ValueSupport.*;


/**
 * Implementations of the formula operators.  The arithmetic, text and
 * comparison operators expect operands which have already been prepared by
 * {@link ArraySupport#toOperand} and apply element-wise to arrays.  The
 * reference operators work on range values directly.
 *
 * @author James Ahlborn
 */
public class BuiltinOperators
{
  @FunctionalInterface
  private interface NumberOp
  {
    public double apply(double d1, double d2);
  }

  @FunctionalInterface
  private interface CompareOp
  {
    public boolean apply(int cmp);
  }

  private BuiltinOperators() {}

  // error propagation rules:
  // - an error operand is the result (the left operand wins if both are
  //   errors)
  // - coercion failures become #VALUE!
  // - infinite/NaN results become #NUM!

  public static Value negate(Value param1) {
    return ArraySupport.map(param1, p1 -> {
        if(p1.isError()) {
          return p1;
        }
        return toValue(-p1.getAsDouble());
      });
  }

  public static Value percent(Value param1) {
    return ArraySupport.map(param1, p1 -> {
        if(p1.isError()) {
          return p1;
        }
        return toValue(p1.getAsDouble() / 100.0d);
      });
  }

  public static Value add(Value param1, Value param2) {
    return numberOp(param1, param2, (d1, d2) -> d1 + d2);
  }

  public static Value subtract(Value param1, Value param2) {
    return numberOp(param1, param2, (d1, d2) -> d1 - d2);
  }

  public static Value multiply(Value param1, Value param2) {
    return numberOp(param1, param2, (d1, d2) -> d1 * d2);
  }

  public static Value divide(Value param1, Value param2) {
    return numberOp(param1, param2, (d1, d2) -> {
        if(d2 == 0.0d) {
          throw new ErrorCodeException(ErrorCode.DIV0);
        }
        return d1 / d2;
      });
  }

  public static Value power(Value param1, Value param2) {
    return numberOp(param1, param2, BuiltinOperators::power);
  }

  static double power(double base, double exp) {
    if(base == 0.0d) {
      if(exp == 0.0d) {
        throw new ErrorCodeException(ErrorCode.NUM, "0^0 is undefined");
      }
      if(exp < 0.0d) {
        throw new ErrorCodeException(ErrorCode.DIV0);
      }
    }
    return Math.pow(base, exp);
  }

  private static Value numberOp(Value param1, Value param2, NumberOp op) {
    return ArraySupport.map(param1, param2, (p1, p2) -> {
        Value err = firstError(p1, p2);
        if(err != null) {
          return err;
        }
        return toValue(op.apply(p1.getAsDouble(), p2.getAsDouble()));
      });
  }

  public static Value concat(Value param1, Value param2) {
    return ArraySupport.map(param1, param2, (p1, p2) -> {
        Value err = firstError(p1, p2);
        if(err != null) {
          return err;
        }
        return toValue(p1.getAsString().concat(p2.getAsString()));
      });
  }

  public static Value equalTo(Value param1, Value param2) {
    return compareOp(param1, param2, cmp -> (cmp == 0));
  }

  public static Value notEqualTo(Value param1, Value param2) {
    return compareOp(param1, param2, cmp -> (cmp != 0));
  }

  public static Value lessThan(Value param1, Value param2) {
    return compareOp(param1, param2, cmp -> (cmp < 0));
  }

  public static Value greaterThan(Value param1, Value param2) {
    return compareOp(param1, param2, cmp -> (cmp > 0));
  }

  public static Value lessThanEq(Value param1, Value param2) {
    return compareOp(param1, param2, cmp -> (cmp <= 0));
  }

  public static Value greaterThanEq(Value param1, Value param2) {
    return compareOp(param1, param2, cmp -> (cmp >= 0));
  }

  private static Value compareOp(Value param1, Value param2, CompareOp op) {
    return ArraySupport.map(param1, param2, (p1, p2) -> {
        Value err = firstError(p1, p2);
        if(err != null) {
          return err;
        }
        return toValue(op.apply(compare(p1, p2)));
      });
  }

  /**
   * The {@code :} operator: the bounding range of two references.
   */
  public static Value range(EvalContext ctx, Value param1, Value param2) {
    Value err = firstError(param1, param2);
    if(err != null) {
      return err;
    }
    CellRange r1 = param1.getRange();
    CellRange r2 = param2.getRange();
    if((r1 == null) || (r2 == null) || r1.isMultiArea() || r2.isMultiArea() ||
       !Objects.equals(r1.getSheet(), r2.getSheet())) {
      return toValue(ErrorCode.VALUE);
    }
    return ctx.getReference(CellRange.bounding(r1, r2));
  }

  /**
   * The intersection (space) operator.
   */
  public static Value intersect(EvalContext ctx, Value param1, Value param2) {
    Value err = firstError(param1, param2);
    if(err != null) {
      return err;
    }
    CellRange r1 = param1.getRange();
    CellRange r2 = param2.getRange();
    if((r1 == null) || (r2 == null)) {
      return toValue(ErrorCode.VALUE);
    }
    CellRange result = r1.intersect(r2);
    if(result == null) {
      return toValue(ErrorCode.NULL);
    }
    return ctx.getReference(result);
  }

  /**
   * The union ({@code ,}) operator.
   */
  public static Value union(EvalContext ctx, Value... params) {
    Value err = firstError(params);
    if(err != null) {
      return err;
    }
    CellRange[] ranges = new CellRange[params.length];
    for(int i = 0; i < params.length; ++i) {
      ranges[i] = params[i].getRange();
      if((ranges[i] == null) ||
         !Objects.equals(ranges[0].getSheet(), ranges[i].getSheet())) {
        return toValue(ErrorCode.VALUE);
      }
    }
    return ctx.getReference(CellRange.union(Arrays.asList(ranges)));
  }

  /**
   * Compares two scalar values the way spreadsheet comparisons do: numbers
   * sort before text, which sorts before booleans.  Text comparison ignores
   * case.  A blank compares as the "zero" value of the other operand's type.
   */
  public static int compare(Value param1, Value param2) {
    if(param1.isBlank()) {
      if(param2.isBlank()) {
        return 0;
      }
      param1 = zeroValue(param2);
    } else if(param2.isBlank()) {
      param2 = zeroValue(param1);
    }

    int cmp = Integer.compare(typeOrder(param1), typeOrder(param2));
    if(cmp != 0) {
      return cmp;
    }

    switch(param1.getType()) {
    case NUMBER:
      double d1 = param1.getAsDouble();
      double d2 = param2.getAsDouble();
      return ((d1 < d2) ? -1 : ((d1 > d2) ? 1 : 0));
    case STRING:
      return Integer.signum(
          param1.getAsString().compareToIgnoreCase(param2.getAsString()));
    case BOOLEAN:
      return Boolean.compare(param1.getAsBoolean(), param2.getAsBoolean());
    default:
      throw new ErrorCodeException(
          ErrorCode.VALUE, "Cannot compare " + param1 + " and " + param2);
    }
  }

  private static int typeOrder(Value val) {
    switch(val.getType()) {
    case NUMBER:
      return 0;
    case STRING:
      return 1;
    case BOOLEAN:
      return 2;
    default:
      return 3;
    }
  }

  private static Value zeroValue(Value val) {
    switch(val.getType()) {
    case STRING:
      return EMPTY_STR_VAL;
    case BOOLEAN:
      return FALSE_VAL;
    default:
      return ZERO_VAL;
    }
  }

  /**
   * @return the first error value among the given values, {@code null} if
   *         there is none
   */
  public static Value firstError(Value... params) {
    for(Value param : params) {
      if(param.isError()) {
        return param;
      }
    }
    return null;
  }
}
