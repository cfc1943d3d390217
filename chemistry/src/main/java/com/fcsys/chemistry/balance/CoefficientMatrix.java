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

import com.fcsys.chemistry.formula.ParsedSpecies;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The species-by-element count matrix of a reaction.  Row i holds the counts of species i; column k holds the counts
 * of the k-th element of the reaction's element universe, in the order elements are first seen across the species.
 */
public class CoefficientMatrix {

  private List<ParsedSpecies> species;
  private List<String> elements;
  private int[][] counts;

  public CoefficientMatrix(List<ParsedSpecies> species) {
    this.species = Collections.unmodifiableList(new ArrayList<>(species));

    Set<String> universe = new LinkedHashSet<>();
    for (ParsedSpecies s : species) {
      universe.addAll(s.getSymbols());
    }
    this.elements = Collections.unmodifiableList(new ArrayList<>(universe));

    this.counts = new int[species.size()][elements.size()];
    for (int i = 0; i < species.size(); i++) {
      for (int k = 0; k < elements.size(); k++) {
        counts[i][k] = species.get(i).getElementCount(elements.get(k));
      }
    }
  }

  public List<ParsedSpecies> getSpecies() {
    return species;
  }

  public List<String> getElements() {
    return elements;
  }

  public int getSpeciesCount() {
    return species.size();
  }

  public int getElementCount() {
    return elements.size();
  }

  public int getCount(int speciesIndex, int elementIndex) {
    return counts[speciesIndex][elementIndex];
  }

  /**
   * Builds a real matrix of the counts with some number of all-zero columns appended on the right.
   * @param extraZeroColumns The number of zero columns to append.
   * @return A (species) x (elements + extraZeroColumns) matrix.
   */
  public RealMatrix toRealMatrix(int extraZeroColumns) {
    RealMatrix matrix = new Array2DRowRealMatrix(getSpeciesCount(), getElementCount() + extraZeroColumns);
    for (int i = 0; i < getSpeciesCount(); i++) {
      for (int k = 0; k < getElementCount(); k++) {
        matrix.setEntry(i, k, counts[i][k]);
      }
    }
    return matrix;
  }

  /**
   * Computes how far a set of coefficients is from conserving each element.  Sums are taken as longs, so a product
   * of two ints can't wrap around to a false zero.
   * @param coefficients One coefficient per species, in species order.
   * @return A map from each element of the universe to the sum over species of coefficient times count.  Every
   *         value is zero iff the coefficients balance the reaction.
   * @throws ArithmeticException if a sum doesn't fit in a long.
   */
  public Map<String, Long> getImbalance(int[] coefficients) {
    if (coefficients.length != getSpeciesCount()) {
      throw new IllegalArgumentException(String.format("Expected %d coefficients but got %d",
          getSpeciesCount(), coefficients.length));
    }

    Map<String, Long> imbalance = new LinkedHashMap<>();
    for (int k = 0; k < getElementCount(); k++) {
      long total = 0L;
      for (int i = 0; i < getSpeciesCount(); i++) {
        total = Math.addExact(total, (long) coefficients[i] * counts[i][k]);
      }
      imbalance.put(elements.get(k), total);
    }
    return imbalance;
  }

  public boolean isBalancedBy(int[] coefficients) {
    Map<String, Long> imbalance;
    try {
      imbalance = getImbalance(coefficients);
    } catch (ArithmeticException e) {
      // A residual too large for a long is certainly not zero.
      return false;
    }
    for (Long value : imbalance.values()) {
      if (value != 0L) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder();
    builder.append(String.join("\t", elements));
    for (int i = 0; i < getSpeciesCount(); i++) {
      builder.append('\n');
      for (int k = 0; k < getElementCount(); k++) {
        if (k > 0) {
          builder.append('\t');
        }
        builder.append(counts[i][k]);
      }
      builder.append('\t').append(species.get(i).getFormula());
    }
    return builder.toString();
  }
}
