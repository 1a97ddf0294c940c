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

package com.healthmarketscience.sheetcalc;

import com.healthmarketscience.sheetcalc.expr.ParseException;

/**
 * Thrown for formula syntax which is recognized but not supported, e.g.
 * references into external workbooks or 3-D references spanning sheets.
 *
 * @author James Ahlborn
 */
public class UnsupportedConstructException extends ParseException
{
  private static final long serialVersionUID = 20180330L;

  public UnsupportedConstructException(String message, int position) {
    super(message, position);
  }
}
