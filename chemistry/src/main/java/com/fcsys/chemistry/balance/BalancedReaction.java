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

package com.fcsys.chemistry.balance;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A reaction's species together with the coefficients that balance it.  Species with negative coefficients are
 * reactants and species with positive coefficients are products.
 */
public class BalancedReaction {

  @JsonProperty("species")
  private List<String> formulas;

  @JsonProperty("coefficients")
  private List<Integer> coefficients;

  public BalancedReaction(List<String> formulas, int[] coefficients) {
    if (formulas.size() != coefficients.length) {
      throw new IllegalArgumentException(String.format("Got %d species but %d coefficients",
          formulas.size(), coefficients.length));
    }
    this.formulas = Collections.unmodifiableList(new ArrayList<>(formulas));
    List<Integer> coefficientList = new ArrayList<>(coefficients.length);
    for (int coefficient : coefficients) {
      coefficientList.add(coefficient);
    }
    this.coefficients = Collections.unmodifiableList(coefficientList);
  }

  public List<String> getFormulas() {
    return formulas;
  }

  public List<Integer> getCoefficients() {
    return coefficients;
  }

  @JsonIgnore
  public int[] getCoefficientArray() {
    int[] result = new int[coefficients.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = coefficients.get(i);
    }
    return result;
  }

  /**
   * Writes the reaction as an equation, reactants first: ["e-", "H+", "O2", "H2O"] with [-4, -4, -1, 2] becomes
   * "4 e- + 4 H+ + O2 = 2 H2O".
   */
  @JsonProperty("equation")
  public String getEquation() {
    return String.format("%s = %s", formatSide(-1), formatSide(1));
  }

  private String formatSide(int sign) {
    List<String> terms = new ArrayList<>();
    for (int i = 0; i < formulas.size(); i++) {
      int coefficient = coefficients.get(i) * sign;
      if (coefficient <= 0) {
        continue;
      }
      String formula = formulas.get(i).trim();
      terms.add(coefficient == 1 ? formula : coefficient + " " + formula);
    }
    return String.join(" + ", terms);
  }

  @Override
  public String toString() {
    return getEquation();
  }
}
