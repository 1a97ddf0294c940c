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
import java.math.RoundingMode;

import com.healthmarketscience.sheetcalc.expr.ErrorCode;
import com.healthmarketscience.sheetcalc.expr.ErrorCodeException;
import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.Function;
import com.healthmarketscience.sheetcalc.expr.Value;
import static com.healthmarketscience.sheetcalc.impl.expr.DefaultFunctions.*;
import static com.healthmarketscience.sheetcalc.impl.expr.FunctionSupport.*;

/**
 *
 * @author James Ahlborn
 */
public class DefaultMathFunctions
{
  private DefaultMathFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }

  public static final Function SUM = registerFunc(new AggregateFunc("SUM") {
    @Override
    protected Aggregator newAggregator() {
      return new Aggregator() {
        private double _sum;
        @Override
        protected void addImpl(double d) {
          _sum += d;
        }
        @Override
        public Value getResult() {
          return ValueSupport.toValue(_sum);
        }
      };
    }
  });

  public static final Function PRODUCT = registerFunc(new AggregateFunc("PRODUCT") {
    @Override
    protected Aggregator newAggregator() {
      return new Aggregator() {
        private double _product = 1.0d;
        @Override
        protected void addImpl(double d) {
          _product *= d;
        }
        @Override
        public Value getResult() {
          return ((getCount() > 0) ? ValueSupport.toValue(_product) :
                  ValueSupport.ZERO_VAL);
        }
      };
    }
  });

  public static final Function MIN = registerFunc(new AggregateFunc("MIN") {
    @Override
    protected Aggregator newAggregator() {
      return new Aggregator() {
        private double _min = Double.POSITIVE_INFINITY;
        @Override
        protected void addImpl(double d) {
          _min = Math.min(_min, d);
        }
        @Override
        public Value getResult() {
          return ((getCount() > 0) ? ValueSupport.toValue(_min) :
                  ValueSupport.ZERO_VAL);
        }
      };
    }
  });

  public static final Function MAX = registerFunc(new AggregateFunc("MAX") {
    @Override
    protected Aggregator newAggregator() {
      return new Aggregator() {
        private double _max = Double.NEGATIVE_INFINITY;
        @Override
        protected void addImpl(double d) {
          _max = Math.max(_max, d);
        }
        @Override
        public Value getResult() {
          return ((getCount() > 0) ? ValueSupport.toValue(_max) :
                  ValueSupport.ZERO_VAL);
        }
      };
    }
  });

  public static final Function AVERAGE = registerFunc(new AggregateFunc("AVERAGE") {
    @Override
    protected Aggregator newAggregator() {
      return new Aggregator() {
        private double _sum;
        @Override
        protected void addImpl(double d) {
          _sum += d;
        }
        @Override
        public Value getResult() {
          if(getCount() == 0) {
            return ValueSupport.toValue(ErrorCode.DIV0);
          }
          return ValueSupport.toValue(_sum / getCount());
        }
      };
    }
  });

  public static final Function COUNT = registerFunc(new FuncVar(
      "COUNT", 1, MAX_PARAMS, Function.Dispatch.ARRAY) {
    @Override
    protected boolean isErrorTrapping() {
      // errors are simply not counted
      return true;
    }
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      int count = 0;
      for(Value param : params) {
        if(param.getType().isScalar()) {
          if(isCountable(param)) {
            ++count;
          }
          continue;
        }
        for(Value elem : param.getElements()) {
          if(elem.getType() == Value.Type.NUMBER) {
            ++count;
          }
        }
      }
      return ValueSupport.toValue(count);
    }
  });

  public static final Function ABS = registerFunc(new Func1("ABS") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(Math.abs(param1.getAsDouble()));
    }
  });

  public static final Function INT = registerFunc(new Func1("INT") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(Math.floor(param1.getAsDouble()));
    }
  });

  public static final Function SQRT = registerFunc(new Func1("SQRT") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      double d = param1.getAsDouble();
      if(d < 0.0d) {
        throw new ErrorCodeException(ErrorCode.NUM, "Negative square root");
      }
      return ValueSupport.toValue(Math.sqrt(d));
    }
  });

  public static final Function ROUND = registerFunc(new Func2("ROUND") {
    @Override
    protected Value eval2(EvalContext ctx, Value param1, Value param2) {
      double d = param1.getAsDouble();
      int digits = param2.getAsInt();
      // half rounds away from zero
      BigDecimal bd = BigDecimal.valueOf(d).setScale(
          digits, RoundingMode.HALF_UP);
      return ValueSupport.toValue(bd.doubleValue());
    }
  });

  public static final Function MOD = registerFunc(new Func2("MOD") {
    @Override
    protected Value eval2(EvalContext ctx, Value param1, Value param2) {
      double num = param1.getAsDouble();
      double div = param2.getAsDouble();
      if(div == 0.0d) {
        throw new ErrorCodeException(ErrorCode.DIV0);
      }
      // the result has the sign of the divisor
      return ValueSupport.toValue(num - (div * Math.floor(num / div)));
    }
  });

  public static final Function POWER = registerFunc(new Func2("POWER") {
    @Override
    protected Value eval2(EvalContext ctx, Value param1, Value param2) {
      return ValueSupport.toValue(BuiltinOperators.power(
                                      param1.getAsDouble(),
                                      param2.getAsDouble()));
    }
  });

  private static boolean isCountable(Value param) {
    switch(param.getType()) {
    case NUMBER:
    case BOOLEAN:
      return true;
    case STRING:
      return ((StringValue)param).isNumeric();
    default:
      return false;
    }
  }
}
