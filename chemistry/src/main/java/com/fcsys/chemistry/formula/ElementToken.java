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

/**
 * One element read from a chemical formula: a symbol, its coefficient and the charge annotation that followed it.
 * For example, "Hg2+2" is a single token (Hg -> 2, charge +2).
 */
public class ElementToken {

  public static final String ELECTRON_SYMBOL = "e";

  private String symbol;
  private Integer coefficient;
  private Integer charge;

  public ElementToken(String symbol, Integer coefficient, Integer charge) {
    this.symbol = symbol;
    this.coefficient = coefficient;
    this.charge = charge;
  }

  public String getSymbol() {
    return this.symbol;
  }

  public Integer getCoefficient() {
    return this.coefficient;
  }

  public Integer getCharge() {
    return this.charge;
  }

  public boolean isElectron() {
    return ELECTRON_SYMBOL.equals(symbol);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    ElementToken that = (ElementToken) o;

    if (!symbol.equals(that.symbol)) return false;
    if (!coefficient.equals(that.coefficient)) return false;
    return charge.equals(that.charge);
  }

  @Override
  public int hashCode() {
    int result = symbol.hashCode();
    result = 31 * result + coefficient.hashCode();
    result = 31 * result + charge.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return String.format("%s%d(%+d)", symbol, coefficient, charge);
  }
}
