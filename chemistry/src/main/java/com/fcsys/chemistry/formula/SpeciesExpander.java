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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Expands a formula into the element counts of its species.
 */
public class SpeciesExpander {

  /**
   * Reads a whole formula into a map of element symbol to count.
   *
   * A symbol that appears in more than one token ("CH3COOH") is merged by adding up its coefficients.  Electron
   * tokens don't produce an entry of their own: like every other charged token they contribute to the net charge,
   * and a species with a nonzero net charge gets a final "e-" entry equal to minus that charge.
   * @param formula The formula to read, e.g. "C19HF37O5S-".
   * @return The species, e.g. (C -> 19, H -> 1, F -> 37, O -> 5, S -> 1, e- -> 1).
   * @throws InvalidFormulaException if any part of the formula can't be read, or a count or the charge overflows an
   *         int.
   */
  public static ParsedSpecies readSpecies(String formula) throws InvalidFormulaException {
    List<ElementToken> tokens = FormulaParser.tokenize(formula);

    Map<String, Integer> elementCounts = new LinkedHashMap<>();
    try {
      for (ElementToken token : tokens) {
        if (!token.isElectron()) {
          elementCounts.merge(token.getSymbol(), token.getCoefficient(), Math::addExact);
        }
      }
    } catch (ArithmeticException e) {
      throw new InvalidFormulaException(formula, "coefficient overflow");
    }

    int netCharge = ChargeResolver.netCharge(formula, tokens);
    if (netCharge != 0) {
      elementCounts.put(ParsedSpecies.ELECTRON, -netCharge);
    }

    return new ParsedSpecies(formula, elementCounts);
  }
}
