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

import java.util.Locale;

import com.healthmarketscience.sheetcalc.expr.ErrorCode;
import com.healthmarketscience.sheetcalc.expr.ErrorCodeException;
import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.Function;
import com.healthmarketscience.sheetcalc.expr.Value;
import org.apache.commons.lang3.StringUtils;
import static com.healthmarketscience.sheetcalc.impl.expr.DefaultFunctions.*;
import static com.healthmarketscience.sheetcalc.impl.expr.FunctionSupport.*;

/**
 *
 * @author James Ahlborn
 */
public class DefaultTextFunctions
{
  private DefaultTextFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }

  public static final Function LEN = registerFunc(new Func1("LEN") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(param1.getAsString().length());
    }
  });

  public static final Function CONCATENATE = registerFunc(new FuncVar("CONCATENATE") {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      StringBuilder sb = new StringBuilder();
      for(Value param : params) {
        sb.append(param.getAsString());
      }
      return ValueSupport.toValue(sb.toString());
    }
  });

  public static final Function LEFT = registerFunc(new FuncVar("LEFT", 1, 2) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      String str = params[0].getAsString();
      return ValueSupport.toValue(
          StringUtils.left(str, getNumChars(params)));
    }
  });

  public static final Function RIGHT = registerFunc(new FuncVar("RIGHT", 1, 2) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      String str = params[0].getAsString();
      return ValueSupport.toValue(
          StringUtils.right(str, getNumChars(params)));
    }
  });

  public static final Function UPPER = registerFunc(new Func1("UPPER") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(
          param1.getAsString().toUpperCase(Locale.ROOT));
    }
  });

  public static final Function LOWER = registerFunc(new Func1("LOWER") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(
          param1.getAsString().toLowerCase(Locale.ROOT));
    }
  });

  private static int getNumChars(Value[] params) {
    if(params.length < 2) {
      return 1;
    }
    int len = params[1].getAsInt();
    if(len < 0) {
      throw new ErrorCodeException(ErrorCode.VALUE, "Negative length " + len);
    }
    return len;
  }
}
