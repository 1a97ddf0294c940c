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
 * Exception thrown when a formula contains a malformed token.  The position
 * is the character offset within the formula text.
 *
 * @author James Ahlborn
 */
public class LexException extends ParseException
{
  private static final long serialVersionUID = 20180330L;

  public LexException(String message, int position) {
    super(message, position);
  }
}
