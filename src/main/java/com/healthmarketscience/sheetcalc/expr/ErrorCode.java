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
 * The closed set of spreadsheet error codes.  Error codes are ordinary
 * values which flow through formula evaluation, they are never thrown as
 * engine failures.
 *
 * @author James Ahlborn
 */
public enum ErrorCode
{
  /** division by zero */
  DIV0("#DIV/0!"),
  /** invalid value or type mismatch */
  VALUE("#VALUE!"),
  /** invalid reference */
  REF("#REF!"),
  /** unknown name */
  NAME("#NAME?"),
  /** invalid numeric argument */
  NUM("#NUM!"),
  /** value not available (lookup miss) */
  NA("#N/A"),
  /** empty intersection */
  NULL("#NULL!");

  private final String _str;

  private ErrorCode(String str) {
    _str = str;
  }

  /**
   * @return the error code as it is written in a formula, e.g.
   *         {@code "#DIV/0!"}
   */
  public String getCode() {
    return _str;
  }

  @Override
  public String toString() {
    return _str;
  }

  /**
   * @return the error code with the given formula text (case-insensitive), or
   *         {@code null} if the text does not name an error code
   */
  public static ErrorCode fromCode(String str) {
    for(ErrorCode code : values()) {
      if(code._str.equalsIgnoreCase(str)) {
        return code;
      }
    }
    return null;
  }
}
