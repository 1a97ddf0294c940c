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
 * Thrown by the {@link Value} conversion methods when a value cannot be
 * coerced (or is itself an error).  Operators and functions catch this and
 * return the corresponding error value, so it never escapes a formula
 * evaluation.
 *
 * @author James Ahlborn
 */
public class ErrorCodeException extends EvalException
{
  private static final long serialVersionUID = 20180330L;

  private final ErrorCode _errorCode;

  public ErrorCodeException(ErrorCode errorCode) {
    this(errorCode, errorCode.getCode());
  }

  public ErrorCodeException(ErrorCode errorCode, String message) {
    super(message);
    _errorCode = errorCode;
  }

  public ErrorCode getErrorCode() {
    return _errorCode;
  }

  @Override
  public synchronized Throwable fillInStackTrace() {
    // thrown for every failed coercion, no stack trace needed
    return this;
  }
}
