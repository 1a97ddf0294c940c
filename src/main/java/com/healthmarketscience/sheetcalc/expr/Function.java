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

package com.healthmarketscience.sheetcalc.expr;

/**
 * A Function provides an invokable handle to external functionality to a
 * formula.
 *
 * @author James Ahlborn
 */
public interface Function
{
  /** how a function receives its arguments within array formulas */
  public enum Dispatch
  {
    /**
     * the function only handles scalar arguments.  Within an array formula,
     * the function is invoked once per element of any array arguments and the
     * results are assembled into an array.
     */
    SCALAR,
    /**
     * the function handles array and range arguments itself and is always
     * invoked exactly once with the arguments as given.
     */
    ARRAY;
  }

  /**
   * @return the name of this function
   */
  public String getName();

  /**
   * @return the minimum number of parameters this function accepts
   */
  public int getMinParams();

  /**
   * @return the maximum number of parameters this function accepts
   */
  public int getMaxParams();

  /**
   * @return the argument dispatch mode of this function
   */
  public Dispatch getDispatch();

  /**
   * Evaluates this function within the given context with the given
   * parameters.
   *
   * @return the result of the function evaluation (errors are returned as
   *         error values)
   */
  public Value eval(EvalContext ctx, Value... params);

  /**
   * @return {@code true} if this function is a "pure" function, {@code false}
   *         otherwise.  A pure function will always return the same result
   *         for a given set of parameters and only reads the references it
   *         is given.  Formulas calling impure functions (e.g. OFFSET or
   *         INDIRECT) have their references tracked at evaluation time.
   */
  public boolean isPure();
}
