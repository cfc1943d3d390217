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

import org.apache.commons.lang3.tuple.Pair;

import java.util.List;

/**
 * Reads charge annotations ("+", "-", "+2", "-3") and computes the net charge of whole formulas.
 */
public class ChargeResolver {

  /**
   * Reads an optional charge annotation from the front of some text.  The text is expected to start right after an
   * element symbol and its coefficient, so "+2Cl" reads as charge +2 with "Cl" remaining.
   * A sign without digits counts as a unit charge.  Text that does not start with a sign has charge 0 and nothing is
   * consumed.
   * @param text The text following an element symbol and coefficient.
   * @return A pair of (charge, remainder), or null if the magnitude's digits can't be read as an int.
   */
  public static Pair<Integer, String> readCharge(String text) {
    if (text.isEmpty()) {
      return Pair.of(0, text);
    }

    char sign = text.charAt(0);
    if (sign != '+' && sign != '-') {
      return Pair.of(0, text);
    }

    int digitsEnd = FormulaParser.endOfDigits(text, 1);
    int magnitude = 1;
    if (digitsEnd > 1) {
      try {
        magnitude = Integer.parseInt(text.substring(1, digitsEnd));
      } catch (NumberFormatException e) {
        return null;
      }
    }

    return Pair.of(sign == '+' ? magnitude : -magnitude, text.substring(digitsEnd));
  }

  /**
   * Computes the net charge of a formula, i.e. the sum of the charges of all its element tokens.
   * This is the lenient entry point: a formula that can't be parsed has charge 0, so a malformed formula is
   * indistinguishable from a neutral one.  Use {@link #strictCharge(String)} when that matters.
   * @param formula A chemical formula, like "SO4-2".
   * @return The net charge, or 0 if the formula is malformed.
   */
  public static int charge(String formula) {
    try {
      return strictCharge(formula);
    } catch (InvalidFormulaException e) {
      return 0;
    }
  }

  /**
   * Computes the net charge of a formula.
   * @param formula A chemical formula.
   * @return The sum of the charges of the formula's element tokens.
   * @throws InvalidFormulaException if any part of the formula can't be read, or the charge overflows an int.
   */
  public static int strictCharge(String formula) throws InvalidFormulaException {
    return netCharge(formula, FormulaParser.tokenize(formula));
  }

  static int netCharge(String formula, List<ElementToken> tokens) throws InvalidFormulaException {
    int netCharge = 0;
    try {
      for (ElementToken token : tokens) {
        netCharge = Math.addExact(netCharge, token.getCharge());
      }
      // The "e-" entry of a species is the negated charge, so that has to fit too.
      Math.negateExact(netCharge);
    } catch (ArithmeticException e) {
      throw new InvalidFormulaException(formula, "charge overflow");
    }
    return netCharge;
  }
}
