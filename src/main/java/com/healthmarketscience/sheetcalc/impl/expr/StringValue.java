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

import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

/**
 *
 * @author James Ahlborn
 */
public class StringValue extends BaseValue
{
  private static final Pattern NUMBER_PAT = Pattern.compile(
      "[+-]?(([0-9]+[.]?[0-9]*)|([.][0-9]+))([eE][+-]?[0-9]+)?%?");

  private final String _val;

  public StringValue(String val) {
    _val = val;
  }

  @Override
  public Type getType() {
    return Type.STRING;
  }

  @Override
  public Object get() {
    return _val;
  }

  @Override
  public boolean getAsBoolean() {
    if("TRUE".equalsIgnoreCase(_val)) {
      return true;
    }
    if("FALSE".equalsIgnoreCase(_val)) {
      return false;
    }
    throw invalidConversion(Type.BOOLEAN);
  }

  @Override
  public String getAsString() {
    return _val;
  }

  @Override
  public double getAsDouble() {
    String str = StringUtils.trim(_val);
    if(!NUMBER_PAT.matcher(str).matches()) {
      throw invalidConversion(Type.NUMBER);
    }
    if(str.endsWith("%")) {
      return Double.parseDouble(str.substring(0, str.length() - 1)) / 100.0d;
    }
    return Double.parseDouble(str);
  }

  /**
   * @return {@code true} if this string can be coerced to a number
   */
  public boolean isNumeric() {
    return NUMBER_PAT.matcher(StringUtils.trim(_val)).matches();
  }

  @Override
  public boolean equals(Object o) {
    return ((o instanceof StringValue) && _val.equals(((StringValue)o)._val));
  }

  @Override
  public int hashCode() {
    return _val.hashCode();
  }
}
