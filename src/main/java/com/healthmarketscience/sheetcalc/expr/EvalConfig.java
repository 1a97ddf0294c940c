/*
Copyright (c) 2018 James Ahlborn

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

import com.healthmarketscience.sheetcalc.Workbook;

/**
 * The EvalConfig allows for customization of formula evaluation for a given
 * {@link Workbook} instance.
 *
 * @see com.healthmarketscience.sheetcalc.expr formula package docs
 *
 * @author James Ahlborn
 */
public interface EvalConfig
{
  /**
   * @return the currently configured FunctionLookup
   */
  public FunctionLookup getFunctionLookup();

  /**
   * Sets the {@link Function} provider to use when parsing formulas.  Custom
   * Functions can be provided to the formula engine by installing a custom
   * FunctionLookup instance (which would presumably wrap and delegate to the
   * default FunctionLookup instance for any default implementations).  Note
   * that formulas which have already been parsed keep the functions they
   * were parsed with.
   */
  public void setFunctionLookup(FunctionLookup lookup);

  /**
   * @return {@code true} if circular references are resolved by iterative
   *         calculation, {@code false} if they are engine failures
   */
  public boolean isIterative();

  /**
   * Enables/disables iterative calculation of circular references.
   */
  public void setIterative(boolean iterative);

  /**
   * @return the maximum number of passes made over a cycle in iterative
   *         calculation
   */
  public int getMaxIterations();

  public void setMaxIterations(int maxIterations);

  /**
   * @return the convergence threshold for iterative calculation.  Iteration
   *         stops once no cycle member changes by this amount (absolute
   *         difference) or more.
   */
  public double getMaxChange();

  public void setMaxChange(double maxChange);
}
