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

/**
 * The formula evaluation api of sheetcalc.
 * <p/>
 * The formula engine does its best to follow the conventions of spreadsheet
 * formula evaluation.  These include such things as value coercions, error
 * code propagation, implicit intersection of ranges outside of array
 * formulas, and broadcasting of arrays within array formulas.
 * <p/>
 * <h2>Supporting Classes</h2>
 * <p/>
 * <h3>General Use Classes</h3>
 * <p/>
 * <ul>
 * <li>{@link com.healthmarketscience.sheetcalc.expr.EvalConfig} allows for
 *     customization of formula evaluation for a given
 *     {@link com.healthmarketscience.sheetcalc.Workbook} instance (function
 *     lookup, iterative calculation).</li>
 * <li>{@link com.healthmarketscience.sheetcalc.expr.FunctionLookup} provides
 *     a source for {@link com.healthmarketscience.sheetcalc.expr.Function}
 *     instances used during formula parsing.</li>
 * <li>{@link com.healthmarketscience.sheetcalc.expr.Value} and
 *     {@link com.healthmarketscience.sheetcalc.expr.ErrorCode} represent the
 *     values computed by formulas.</li>
 * <li>{@link com.healthmarketscience.sheetcalc.expr.EvalException} base
 *     exception thrown for engine failures which occur during formula
 *     compilation or evaluation.</li>
 * <li>{@link com.healthmarketscience.sheetcalc.expr.ParseException} and
 *     {@link com.healthmarketscience.sheetcalc.expr.LexException} thrown for
 *     malformed formulas.</li>
 * </ul>
 * <p/>
 * <h3>Advanced Use Classes</h3>
 * <p/>
 * <ul>
 * <li>{@link com.healthmarketscience.sheetcalc.expr.EvalContext} encapsulates
 *     the state for the evaluation of one formula.</li>
 * <li>{@link com.healthmarketscience.sheetcalc.expr.Formula} provides an
 *     executable handle to a parsed formula.</li>
 * <li>{@link com.healthmarketscience.sheetcalc.expr.Function} provides an
 *     invokable handle to external functionality to a formula.</li>
 * <li>{@link com.healthmarketscience.sheetcalc.expr.ErrorCodeException}
 *     signals a failed value coercion inside function implementations.</li>
 * </ul>
 * <p/>
 * <h2>Function Support</h2>
 * <p/>
 * The default function table contains: SUM, MIN, MAX, AVERAGE, COUNT,
 * PRODUCT, ABS, ROUND, INT, MOD, SQRT, POWER, IF, IFERROR, ISERROR, ISNA,
 * ISBLANK, NA, AND, OR, NOT, LEN, CONCATENATE, LEFT, RIGHT, UPPER, LOWER,
 * ROW, COLUMN, ROWS, COLUMNS, INDEX, TRANSPOSE, OFFSET and INDIRECT.
 */
package com.healthmarketscience.sheetcalc.expr;
