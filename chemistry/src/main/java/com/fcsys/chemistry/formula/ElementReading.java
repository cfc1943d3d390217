/*************************************************************************
*                                                                        *
*  This file is part of the FCSys chemistry project.                     *
*  FCSys models fuel cell systems from first principles.                 *
*  Copyright (C) 2026 the FCSys authors.                                 *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.fcsys.chemistry.formula;

import org.apache.commons.lang3.StringUtils;

/**
 * The result of reading a single element off the front of a formula: the token that was read and the text that
 * remains.  A reading with an empty symbol is a failed reading; its remainder is the original, unconsumed input and
 * its coefficient and charge carry no meaning.
 */
public class ElementReading {

  private ElementToken token;
  private String remainder;

  private ElementReading(ElementToken token, String remainder) {
    this.token = token;
    this.remainder = remainder;
  }

  static ElementReading of(String symbol, Integer coefficient, Integer charge, String remainder) {
    return new ElementReading(new ElementToken(symbol, coefficient, charge), remainder);
  }

  static ElementReading failure(String input) {
    return new ElementReading(new ElementToken(StringUtils.EMPTY, 0, 0), input);
  }

  public boolean isValid() {
    return !token.getSymbol().isEmpty();
  }

  public ElementToken getToken() {
    return token;
  }

  public String getSymbol() {
    return token.getSymbol();
  }

  public Integer getCoefficient() {
    return token.getCoefficient();
  }

  public Integer getCharge() {
    return token.getCharge();
  }

  public String getRemainder() {
    return remainder;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    ElementReading that = (ElementReading) o;

    if (!token.equals(that.token)) return false;
    return remainder.equals(that.remainder);
  }

  @Override
  public int hashCode() {
    return 31 * token.hashCode() + remainder.hashCode();
  }

  @Override
  public String toString() {
    return String.format("(%s, %d, %d, \"%s\")", getSymbol(), getCoefficient(), getCharge(), remainder);
  }
}
