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
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.List;

/**
 * A small recursive-descent reader for chemical formulas such as "H2O", "SO4-2" or "C19HF37O5S-".
 *
 * A formula is a sequence of element tokens, each of which is:
 *   symbol      an uppercase letter followed by any number of lowercase letters, or "e" for electrons
 *   coefficient an optional positive integer without leading zeros (1 when absent)
 *   charge      an optional "+" or "-", optionally followed by a magnitude (see {@link ChargeResolver})
 * Whitespace before a token is skipped.  Parentheses and hydrates are not supported.
 *
 * Electrons carry a charge of -1 each, so "e-" and "e" both read as one electron with charge -1, and "e4" as four
 * electrons with charge -4.  The only annotation allowed after an electron is a bare "-".
 */
public class FormulaParser {

  /**
   * Reads one element token off the front of a formula.
   * @param formula The formula text, which may start with whitespace.
   * @return The token and the text following it.  If the text does not start with a well-formed token, the reading's
   *         symbol is empty and its remainder is the unmodified input.
   */
  public static ElementReading readElement(String formula) {
    int pos = 0;
    while (pos < formula.length() && Character.isWhitespace(formula.charAt(pos))) {
      pos++;
    }
    if (pos == formula.length()) {
      return ElementReading.failure(formula);
    }

    // Symbol.
    int symbolStart = pos;
    char first = formula.charAt(pos);
    boolean electron = false;
    if (isUpper(first)) {
      pos++;
      while (pos < formula.length() && isLower(formula.charAt(pos))) {
        pos++;
      }
    } else if (first == ElementToken.ELECTRON_SYMBOL.charAt(0)) {
      pos++;
      if (pos < formula.length() && isLower(formula.charAt(pos))) {
        return ElementReading.failure(formula);
      }
      electron = true;
    } else {
      return ElementReading.failure(formula);
    }
    String symbol = formula.substring(symbolStart, pos);

    // Coefficient.
    int coefficient = 1;
    int digitsEnd = endOfDigits(formula, pos);
    if (digitsEnd > pos) {
      if (formula.charAt(pos) == '0') {
        return ElementReading.failure(formula);
      }
      try {
        coefficient = Integer.parseInt(formula.substring(pos, digitsEnd));
      } catch (NumberFormatException e) {
        return ElementReading.failure(formula);
      }
      pos = digitsEnd;
    }
    String rest = formula.substring(pos);

    // Charge.
    if (electron) {
      if (rest.startsWith("-")) {
        if (endOfDigits(rest, 1) > 1) {
          return ElementReading.failure(formula);
        }
        rest = rest.substring(1);
      } else if (rest.startsWith("+")) {
        return ElementReading.failure(formula);
      }
      return ElementReading.of(symbol, coefficient, -coefficient, rest);
    }

    Pair<Integer, String> chargeAndRemainder = ChargeResolver.readCharge(rest);
    if (chargeAndRemainder == null) {
      return ElementReading.failure(formula);
    }
    return ElementReading.of(symbol, coefficient, chargeAndRemainder.getLeft(), chargeAndRemainder.getRight());
  }

  /**
   * Reads every element token of a formula, in order.
   * @param formula The formula to read.
   * @return The formula's tokens; repeated symbols are left as separate tokens.
   * @throws InvalidFormulaException if the formula is blank or any token can't be read.
   */
  public static List<ElementToken> tokenize(String formula) throws InvalidFormulaException {
    if (StringUtils.isBlank(formula)) {
      throw new InvalidFormulaException(formula, "no elements");
    }

    List<ElementToken> tokens = new ArrayList<>();
    String remainder = formula;
    while (!StringUtils.isBlank(remainder)) {
      ElementReading reading = readElement(remainder);
      if (!reading.isValid()) {
        throw new InvalidFormulaException(formula, String.format("can't read an element at \"%s\"", remainder.trim()));
      }
      tokens.add(reading.getToken());
      remainder = reading.getRemainder();
    }
    return tokens;
  }

  /**
   * Counts the entries {@link SpeciesExpander#readSpecies(String)} will produce for a formula: one per distinct
   * element symbol, plus one for "e-" if the formula carries a net charge.
   * @param formula The formula to read.
   * @return The number of entries.
   * @throws InvalidFormulaException if the formula can't be read.
   */
  public static int countElements(String formula) throws InvalidFormulaException {
    return SpeciesExpander.readSpecies(formula).size();
  }

  static int endOfDigits(String text, int start) {
    int pos = start;
    while (pos < text.length() && text.charAt(pos) >= '0' && text.charAt(pos) <= '9') {
      pos++;
    }
    return pos;
  }

  private static boolean isUpper(char c) {
    return c >= 'A' && c <= 'Z';
  }

  private static boolean isLower(char c) {
    return c >= 'a' && c <= 'z';
  }
}
