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

import com.healthmarketscience.sheetcalc.expr.EvalException;

/**
 * Thrown when a defined name or structured (table) reference cannot be
 * resolved to cells.
 *
 * @author James Ahlborn
 */
public class UnresolvedReferenceException extends EvalException
{
  private static final long serialVersionUID = 20180330L;

  private final String _name;

  public UnresolvedReferenceException(String name, String message) {
    super(message);
    _name = name;
  }

  /**
   * @return the name which could not be resolved
   */
  public String getName() {
    return _name;
  }
}
