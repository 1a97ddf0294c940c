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

package com.healthmarketscience.sheetcalc.impl;

import com.healthmarketscience.sheetcalc.expr.EvalConfig;
import com.healthmarketscience.sheetcalc.expr.FunctionLookup;
import com.healthmarketscience.sheetcalc.impl.expr.DefaultFunctions;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * EvalConfig of a workbook.  Initial settings may be given through system
 * properties.
 *
 * @author James Ahlborn
 */
public class WorkbookEvalConfig implements EvalConfig
{
  private static final Log LOG = LogFactory.getLog(WorkbookEvalConfig.class);

  /** system property which enables iterative calculation by default */
  public static final String ITERATIVE_CALC_PROPERTY =
    "com.healthmarketscience.sheetcalc.iterativeCalc";
  /** system property with the default maximum number of iterations */
  public static final String MAX_ITERATIONS_PROPERTY =
    "com.healthmarketscience.sheetcalc.maxIterations";
  /** system property with the default convergence threshold */
  public static final String MAX_CHANGE_PROPERTY =
    "com.healthmarketscience.sheetcalc.maxChange";

  public static final int DEFAULT_MAX_ITERATIONS = 100;
  public static final double DEFAULT_MAX_CHANGE = 0.001d;

  private FunctionLookup _funcs = DefaultFunctions.LOOKUP;
  private boolean _iterative = getDefaultIterative();
  private int _maxIterations = getDefaultMaxIterations();
  private double _maxChange = getDefaultMaxChange();

  public WorkbookEvalConfig() {
  }

  /**
   * Copy constructor.
   */
  public WorkbookEvalConfig(EvalConfig other) {
    _funcs = other.getFunctionLookup();
    _iterative = other.isIterative();
    _maxIterations = other.getMaxIterations();
    _maxChange = other.getMaxChange();
  }

  @Override
  public FunctionLookup getFunctionLookup() {
    return _funcs;
  }

  @Override
  public void setFunctionLookup(FunctionLookup lookup) {
    _funcs = ((lookup != null) ? lookup : DefaultFunctions.LOOKUP);
  }

  @Override
  public boolean isIterative() {
    return _iterative;
  }

  @Override
  public void setIterative(boolean iterative) {
    _iterative = iterative;
  }

  @Override
  public int getMaxIterations() {
    return _maxIterations;
  }

  @Override
  public void setMaxIterations(int maxIterations) {
    if(maxIterations < 1) {
      throw new IllegalArgumentException(
          "Invalid max iterations " + maxIterations);
    }
    _maxIterations = maxIterations;
  }

  @Override
  public double getMaxChange() {
    return _maxChange;
  }

  @Override
  public void setMaxChange(double maxChange) {
    if(!(maxChange >= 0.0d) || Double.isInfinite(maxChange)) {
      throw new IllegalArgumentException("Invalid max change " + maxChange);
    }
    _maxChange = maxChange;
  }

  /**
   * Returns the default iterative calculation setting, from the system
   * property {@value #ITERATIVE_CALC_PROPERTY} if set, otherwise
   * {@code false}.
   */
  public static boolean getDefaultIterative() {
    String prop = System.getProperty(ITERATIVE_CALC_PROPERTY);
    if(prop != null) {
      return Boolean.parseBoolean(prop.trim());
    }
    return false;
  }

  /**
   * Returns the default maximum iterations, from the system property
   * {@value #MAX_ITERATIONS_PROPERTY} if set, otherwise
   * {@value #DEFAULT_MAX_ITERATIONS}.
   */
  public static int getDefaultMaxIterations() {
    String prop = StringUtils.trimToNull(
        System.getProperty(MAX_ITERATIONS_PROPERTY));
    if(prop != null) {
      try {
        int val = Integer.parseInt(prop);
        if(val >= 1) {
          return val;
        }
      } catch(NumberFormatException e) {
        LOG.warn("Ignoring invalid " + MAX_ITERATIONS_PROPERTY + " '" +
                 prop + "'", e);
        return DEFAULT_MAX_ITERATIONS;
      }
      LOG.warn("Ignoring invalid " + MAX_ITERATIONS_PROPERTY + " '" +
               prop + "'");
    }
    return DEFAULT_MAX_ITERATIONS;
  }

  /**
   * Returns the default convergence threshold, from the system property
   * {@value #MAX_CHANGE_PROPERTY} if set, otherwise
   * {@value #DEFAULT_MAX_CHANGE}.
   */
  public static double getDefaultMaxChange() {
    String prop = StringUtils.trimToNull(
        System.getProperty(MAX_CHANGE_PROPERTY));
    if(prop != null) {
      try {
        double val = Double.parseDouble(prop);
        if((val >= 0.0d) && !Double.isInfinite(val)) {
          return val;
        }
      } catch(NumberFormatException e) {
        LOG.warn("Ignoring invalid " + MAX_CHANGE_PROPERTY + " '" +
                 prop + "'", e);
        return DEFAULT_MAX_CHANGE;
      }
      LOG.warn("Ignoring invalid " + MAX_CHANGE_PROPERTY + " '" +
               prop + "'");
    }
    return DEFAULT_MAX_CHANGE;
  }
}
