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

import com.healthmarketscience.sheetcalc.expr.ErrorCodeException;
import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.EvalException;
import com.healthmarketscience.sheetcalc.expr.Function;
import com.healthmarketscience.sheetcalc.expr.Value;

/**
 *
 * @author James Ahlborn
 */
public class FunctionSupport
{
  /** the most parameters a variable argument function accepts */
  public static final int MAX_PARAMS = 255;

  private FunctionSupport() {}

  public static abstract class BaseFunction implements Function
  {
    private final String _name;
    private final int _minParams;
    private final int _maxParams;
    private final Dispatch _dispatch;

    protected BaseFunction(String name, int minParams, int maxParams,
                           Dispatch dispatch)
    {
      _name = name;
      _minParams = minParams;
      _maxParams = maxParams;
      _dispatch = dispatch;
    }

    @Override
    public String getName() {
      return _name;
    }

    @Override
    public int getMinParams() {
      return _minParams;
    }

    @Override
    public int getMaxParams() {
      return _maxParams;
    }

    @Override
    public Dispatch getDispatch() {
      return _dispatch;
    }

    @Override
    public boolean isPure() {
      // most functions are probably pure, so make this the default
      return true;
    }

    /**
     * @return {@code true} if this function handles error parameters itself,
     *         {@code false} if the first error parameter is the result
     */
    protected boolean isErrorTrapping() {
      return false;
    }

    @Override
    public final Value eval(EvalContext ctx, Value... params) {
      try {
        validateNumParams(params);
        if(!isErrorTrapping()) {
          Value err = BuiltinOperators.firstError(params);
          if(err != null) {
            return err;
          }
        }
        return evalParams(ctx, params);
      } catch(ErrorCodeException e) {
        return ValueSupport.toValue(e.getErrorCode());
      } catch(EvalException e) {
        throw e;
      } catch(RuntimeException e) {
        throw invalidFunctionCall(e, params);
      }
    }

    protected abstract Value evalParams(EvalContext ctx, Value[] params);

    protected void validateNumParams(Value[] params) {
      int num = params.length;
      if((num < _minParams) || (num > _maxParams)) {
        throw new EvalException(
            "Invalid number of parameters " + num + " passed to " + _name +
            ", expected " + toParamRange(_minParams, _maxParams));
      }
    }

    protected EvalException invalidFunctionCall(
        Throwable t, Value[] params)
    {
      String paramStr = Arrays.toString(params);
      String msg = "Invalid function call {" + _name + "(" +
        paramStr.substring(1, paramStr.length() - 1) + ")}";
      return new EvalException(msg, t);
    }

    @Override
    public String toString() {
      return getName() + "()";
    }
  }

  public static abstract class Func0 extends BaseFunction
  {
    protected Func0(String name) {
      super(name, 0, 0, Dispatch.SCALAR);
    }

    @Override
    protected final Value evalParams(EvalContext ctx, Value[] params) {
      return eval0(ctx);
    }

    protected abstract Value eval0(EvalContext ctx);
  }

  public static abstract class Func1 extends BaseFunction
  {
    protected Func1(String name) {
      this(name, Dispatch.SCALAR);
    }

    protected Func1(String name, Dispatch dispatch) {
      super(name, 1, 1, dispatch);
    }

    @Override
    protected final Value evalParams(EvalContext ctx, Value[] params) {
      return eval1(ctx, params[0]);
    }

    protected abstract Value eval1(EvalContext ctx, Value param);
  }

  public static abstract class Func2 extends BaseFunction
  {
    protected Func2(String name) {
      super(name, 2, 2, Dispatch.SCALAR);
    }

    @Override
    protected final Value evalParams(EvalContext ctx, Value[] params) {
      return eval2(ctx, params[0], params[1]);
    }

    protected abstract Value eval2(EvalContext ctx, Value param1, Value param2);
  }

  public static abstract class Func3 extends BaseFunction
  {
    protected Func3(String name) {
      super(name, 3, 3, Dispatch.SCALAR);
    }

    @Override
    protected final Value evalParams(EvalContext ctx, Value[] params) {
      return eval3(ctx, params[0], params[1], params[2]);
    }

    protected abstract Value eval3(EvalContext ctx,
                                   Value param1, Value param2, Value param3);
  }

  public static abstract class FuncVar extends BaseFunction
  {
    protected FuncVar(String name) {
      this(name, 1, MAX_PARAMS, Dispatch.SCALAR);
    }

    protected FuncVar(String name, int minParams, int maxParams) {
      this(name, minParams, maxParams, Dispatch.SCALAR);
    }

    protected FuncVar(String name, int minParams, int maxParams,
                      Dispatch dispatch) {
      super(name, minParams, maxParams, dispatch);
    }

    @Override
    protected final Value evalParams(EvalContext ctx, Value[] params) {
      return evalVar(ctx, params);
    }

    protected abstract Value evalVar(EvalContext ctx, Value[] params);
  }

  /**
   * Base for functions which reduce all the numbers in their parameters to
   * a single result (SUM, MIN, ...).  Numbers within ranges and arrays are
   * used, other values there are ignored.  Direct parameters are coerced to
   * numbers.
   */
  public static abstract class AggregateFunc extends BaseFunction
  {
    protected AggregateFunc(String name) {
      super(name, 1, MAX_PARAMS, Dispatch.ARRAY);
    }

    @Override
    protected final Value evalParams(EvalContext ctx, Value[] params) {
      Aggregator agg = newAggregator();
      for(Value param : params) {
        if(param.getType().isScalar()) {
          if(!param.isBlank()) {
            agg.add(param.getAsDouble());
          }
          continue;
        }
        for(Value elem : param.getElements()) {
          if(elem.isError()) {
            return elem;
          }
          if(elem.getType() == Value.Type.NUMBER) {
            agg.add(elem.getAsDouble());
          }
        }
      }
      return agg.getResult();
    }

    protected abstract Aggregator newAggregator();
  }

  /**
   * Accumulates the numbers passed to an {@link AggregateFunc}.
   */
  public static abstract class Aggregator
  {
    private int _count;

    public void add(double d) {
      ++_count;
      addImpl(d);
    }

    public int getCount() {
      return _count;
    }

    protected abstract void addImpl(double d);

    public abstract Value getResult();
  }

  static String toParamRange(int minParams, int maxParams) {
    return ((minParams == maxParams) ? "" + minParams :
            minParams + " to " + maxParams);
  }
}
