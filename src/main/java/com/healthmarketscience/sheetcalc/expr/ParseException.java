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
 * Exception thrown when a formula cannot be parsed.  The position is the
 * index of the offending token (or character, for {@link LexException}),
 * {@code -1} if unknown.
 *
 * @author James Ahlborn
 */
public class ParseException extends EvalException
{
  private static final long serialVersionUID = 20180330L;

  private final int _position;

  public ParseException(String message) {
    this(message, -1);
  }

  public ParseException(String message, int position) {
    super(message);
    _position = position;
  }

  public ParseException(String message, int position, Throwable cause) {
    super(message, cause);
    _position = position;
  }

  public int getPosition() {
    return _position;
  }
}
