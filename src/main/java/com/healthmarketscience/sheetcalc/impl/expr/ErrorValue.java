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

import com.healthmarketscience.sheetcalc.expr.ErrorCode;
import com.healthmarketscience.sheetcalc.expr.ErrorCodeException;

/**
 * An error code value.  All conversions rethrow the error code.
 *
 * @author James Ahlborn
 */
public class ErrorValue extends BaseValue
{
  private final ErrorCode _code;

  ErrorValue(ErrorCode code) {
    _code = code;
  }

  @Override
  public Type getType() {
    return Type.ERROR;
  }

  @Override
  public Object get() {
    return _code;
  }

  @Override
  public boolean isError() {
    return true;
  }

  @Override
  public ErrorCode getErrorCode() {
    return _code;
  }

  @Override
  public boolean getAsBoolean() {
    throw new ErrorCodeException(_code);
  }

  @Override
  public String getAsString() {
    throw new ErrorCodeException(_code);
  }

  @Override
  public double getAsDouble() {
    throw new ErrorCodeException(_code);
  }

  @Override
  public String toString() {
    return "Value[" + getType() + "] '" + _code + "'";
  }
}
