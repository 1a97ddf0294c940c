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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.healthmarketscience.sheetcalc.expr.ErrorCode;
import com.healthmarketscience.sheetcalc.expr.ErrorCodeException;
import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.Function;
import com.healthmarketscience.sheetcalc.expr.FunctionLookup;
import com.healthmarketscience.sheetcalc.expr.Value;
import static com.healthmarketscience.sheetcalc.impl.expr.FunctionSupport.*;

/**
 * The default function table, plus the logical and information functions.
 *
 * @author James Ahlborn
 */
public class DefaultFunctions
{
  private static final Map<String,Function> FUNCS =
    new HashMap<String,Function>();

  static {
    // load all default functions
    DefaultMathFunctions.init();
    DefaultTextFunctions.init();
    DefaultLookupFunctions.init();
  }

  public static final FunctionLookup LOOKUP = new FunctionLookup() {
    @Override
    public Function getFunction(String name) {
      return FUNCS.get(toLookupName(name));
    }
  };

  private DefaultFunctions() {}


  public static final Function IF = registerFunc(new FuncVar("IF", 2, 3) {
    @Override
    protected boolean isErrorTrapping() {
      // only the condition propagates errors
      return true;
    }
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      Value cond = params[0];
      if(cond.isError()) {
        return cond;
      }
      if(cond.getAsBoolean()) {
        return toResult(params[1]);
      }
      return ((params.length > 2) ? toResult(params[2]) :
              ValueSupport.FALSE_VAL);
    }
  });

  public static final Function IFERROR = registerFunc(new Func2("IFERROR") {
    @Override
    protected boolean isErrorTrapping() {
      return true;
    }
    @Override
    protected Value eval2(EvalContext ctx, Value param1, Value param2) {
      return toResult(param1.isError() ? param2 : param1);
    }
  });

  public static final Function ISERROR = registerFunc(new Func1("ISERROR") {
    @Override
    protected boolean isErrorTrapping() {
      return true;
    }
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(param1.isError());
    }
  });

  public static final Function ISNA = registerFunc(new Func1("ISNA") {
    @Override
    protected boolean isErrorTrapping() {
      return true;
    }
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(param1.getErrorCode() == ErrorCode.NA);
    }
  });

  public static final Function ISBLANK = registerFunc(new Func1("ISBLANK") {
    @Override
    protected boolean isErrorTrapping() {
      return true;
    }
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(param1.isBlank());
    }
  });

  public static final Function NA = registerFunc(new Func0("NA") {
    @Override
    protected Value eval0(EvalContext ctx) {
      return ValueSupport.toValue(ErrorCode.NA);
    }
  });

  public static final Function AND = registerFunc(new FuncVar(
      "AND", 1, MAX_PARAMS, Function.Dispatch.ARRAY) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      boolean result = true;
      for(Value bool : collectBooleans(params)) {
        result &= ((Boolean)bool.get());
      }
      return ValueSupport.toValue(result);
    }
  });

  public static final Function OR = registerFunc(new FuncVar(
      "OR", 1, MAX_PARAMS, Function.Dispatch.ARRAY) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      boolean result = false;
      for(Value bool : collectBooleans(params)) {
        result |= ((Boolean)bool.get());
      }
      return ValueSupport.toValue(result);
    }
  });

  public static final Function NOT = registerFunc(new Func1("NOT") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(!param1.getAsBoolean());
    }
  });

  /**
   * Gathers the logical values of the given AND/OR parameters.  Within
   * ranges and arrays, text and blanks are ignored.
   *
   * @throws ErrorCodeException with {@code #VALUE!} if there are no logical values at all
   */
  private static Iterable<Value> collectBooleans(Value[] params) {
    List<Value> bools = new ArrayList<Value>();
    for(Value param : params) {
      if(param.getType().isScalar()) {
        if(!param.isBlank()) {
          bools.add(ValueSupport.toValue(param.getAsBoolean()));
        }
        continue;
      }
      for(Value elem : param.getElements()) {
        switch(elem.getType()) {
        case ERROR:
          throw new ErrorCodeException(elem.getErrorCode());
        case NUMBER:
        case BOOLEAN:
          bools.add(ValueSupport.toValue(elem.getAsBoolean()));
          break;
        default:
          // text and blanks are ignored
        }
      }
    }
    if(bools.isEmpty()) {
      throw new ErrorCodeException(
          ErrorCode.VALUE, "No logical values");
    }
    return bools;
  }

  /**
   * A blank function result is the number zero (an omitted IF branch or a
   * reference to an empty cell).
   */
  static Value toResult(Value val) {
    return ((val.isBlank() && val.getType().isScalar()) ?
            ValueSupport.ZERO_VAL : val);
  }

  /**
   * @return the names of all the default functions
   */
  public static Set<String> getFunctionNames() {
    return Collections.unmodifiableSet(new TreeSet<String>(FUNCS.keySet()));
  }

  static String toLookupName(String name) {
    return ((name != null) ? name.toUpperCase(Locale.ROOT) : null);
  }

  static Function registerFunc(Function func) {
    String lookupFname = toLookupName(func.getName());
    if(FUNCS.put(lookupFname, func) != null) {
      throw new IllegalStateException("Duplicate function " + func);
    }
    return func;
  }
}
