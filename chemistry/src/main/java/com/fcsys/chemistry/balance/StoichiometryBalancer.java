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

import com.fcsys.chemistry.formula.InvalidFormulaException;
import com.fcsys.chemistry.formula.ParsedSpecies;
import com.fcsys.chemistry.formula.SpeciesExpander;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Computes integer stoichiometric coefficients that balance a reaction.
 *
 * Each species' formula is expanded into element counts (charge being carried by the pseudo-element "e-") and the
 * counts are stacked into a species-by-element matrix A.  A coefficient vector x balances the reaction iff
 * x<sup>T</sup>A = 0, i.e. x lies in the left null space of A.  For a well-posed reaction with N species and M
 * elements, N = M + 1 and that null space is one-dimensional.  A is padded with a zero column to make it square, so
 * the null direction is the left singular vector of the smallest singular value.  That vector is scaled so its
 * smallest entry has magnitude one and then rounded to integers.
 *
 * The sign of the result depends on the SVD and is not meaningful: callers must accept either sign.
 */
public class StoichiometryBalancer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(StoichiometryBalancer.class);

  public static final double DEFAULT_TOLERANCE = 1e-6;
  public static final int DEFAULT_MAX_MULTIPLIER = 20;

  private double tolerance;
  private int maxMultiplier;

  public StoichiometryBalancer() {
    this(DEFAULT_TOLERANCE, DEFAULT_MAX_MULTIPLIER);
  }

  /**
   * @param tolerance Values below this (relative to the problem's scale) are treated as zero, and scaled coefficients
   *                  within this distance of an integer are treated as integers.
   * @param maxMultiplier The largest factor the scaled coefficients are multiplied by when looking for integer
   *                      ratios.  Use 1 to always round right after scaling by the smallest coefficient.
   */
  public StoichiometryBalancer(double tolerance, int maxMultiplier) {
    if (tolerance <= 0.0) {
      throw new IllegalArgumentException(String.format("Tolerance must be positive, got %g", tolerance));
    }
    if (maxMultiplier < 1) {
      throw new IllegalArgumentException(String.format("Max multiplier must be at least 1, got %d", maxMultiplier));
    }
    this.tolerance = tolerance;
    this.maxMultiplier = maxMultiplier;
  }

  public double getTolerance() {
    return tolerance;
  }

  public int getMaxMultiplier() {
    return maxMultiplier;
  }

  public int[] stoich(String... formulas) throws InvalidFormulaException, IllPosedReactionException {
    return stoich(Arrays.asList(formulas));
  }

  /**
   * Balances a reaction.
   * @param formulas The formulas of the reaction's species, e.g. ["e-", "H+", "O2", "H2O"].
   * @return One coefficient per formula, in input order, e.g. [-4, -4, -1, 2] or [4, 4, 1, -2].
   * @throws InvalidFormulaException if a formula can't be read.
   * @throws IllPosedReactionException if the species don't determine a single balanced reaction.
   */
  public int[] stoich(List<String> formulas) throws InvalidFormulaException, IllPosedReactionException {
    CoefficientMatrix matrix = buildMatrix(formulas);
    checkWellPosed(matrix, formulas);

    double[] direction = findNullDirection(matrix, formulas);
    int[] coefficients = toIntegerRatios(direction, formulas);

    if (!matrix.isBalancedBy(coefficients)) {
      LOGGER.warn("Coefficients %s don't balance %s; residuals per element: %s",
          Arrays.toString(coefficients), formulas, matrix.getImbalance(coefficients));
    }
    return coefficients;
  }

  /**
   * Balances a reaction and orients it so the first species is a reactant.
   * @param formulas The formulas of the reaction's species.
   * @return The balanced reaction.
   * @throws InvalidFormulaException if a formula can't be read.
   * @throws IllPosedReactionException if the species don't determine a single balanced reaction.
   */
  public BalancedReaction balance(List<String> formulas) throws InvalidFormulaException, IllPosedReactionException {
    int[] coefficients = stoich(formulas);
    if (coefficients.length > 0 && coefficients[0] > 0) {
      for (int i = 0; i < coefficients.length; i++) {
        coefficients[i] = -coefficients[i];
      }
    }
    return new BalancedReaction(formulas, coefficients);
  }

  CoefficientMatrix buildMatrix(List<String> formulas) throws InvalidFormulaException {
    List<ParsedSpecies> species = new ArrayList<>(formulas.size());
    for (String formula : formulas) {
      species.add(SpeciesExpander.readSpecies(formula));
    }
    CoefficientMatrix matrix = new CoefficientMatrix(species);
    LOGGER.debug("Coefficient matrix for %s:\n%s", formulas, matrix);
    return matrix;
  }

  void checkWellPosed(CoefficientMatrix matrix, List<String> formulas) throws IllPosedReactionException {
    int n = matrix.getSpeciesCount();
    int m = matrix.getElementCount();
    String detail = String.format("%d species, %d elements %s", n, m, matrix.getElements());
    if (n > m + 1) {
      throw new IllPosedReactionException(IllPosedReactionException.Diagnosis.REDUNDANT_SPECIES, formulas, detail);
    }
    if (n < m + 1) {
      throw new IllPosedReactionException(IllPosedReactionException.Diagnosis.MISSING_SPECIES, formulas, detail);
    }
  }

  /**
   * Finds the left singular vector of the smallest singular value of the zero-padded count matrix.
   */
  double[] findNullDirection(CoefficientMatrix matrix, List<String> formulas) throws IllPosedReactionException {
    RealMatrix padded = matrix.toRealMatrix(1);
    SingularValueDecomposition svd = new SingularValueDecomposition(padded);
    double[] singularValues = svd.getSingularValues();

    // The singular values come back sorted in non-increasing order; don't rely on it.
    int smallest = 0;
    for (int i = 1; i < singularValues.length; i++) {
      if (singularValues[i] <= singularValues[smallest]) {
        smallest = i;
      }
    }
    LOGGER.debug("Singular values for %s: %s", formulas, Arrays.toString(singularValues));

    double scale = Math.max(1.0, svd.getNorm());
    for (int i = 0; i < singularValues.length; i++) {
      if (i != smallest && singularValues[i] < tolerance * scale) {
        throw new IllPosedReactionException(IllPosedReactionException.Diagnosis.UNRELATED_SPECIES, formulas,
            "the species admit more than one independent balance");
      }
    }

    return svd.getU().getColumn(smallest);
  }

  /**
   * Scales a null direction to integers: divides by the smallest magnitude, then rounds half up.  When the scaled
   * entries aren't all close to integers, multiplies them by the smallest factor up to maxMultiplier that makes them
   * so before rounding.
   */
  int[] toIntegerRatios(double[] direction, List<String> formulas) throws IllPosedReactionException {
    double minAbs = Double.POSITIVE_INFINITY;
    for (double value : direction) {
      minAbs = Math.min(minAbs, Math.abs(value));
    }
    if (minAbs < tolerance) {
      throw new IllPosedReactionException(IllPosedReactionException.Diagnosis.UNRELATED_SPECIES, formulas,
          "a species takes no part in the balance");
    }

    double[] scaled = new double[direction.length];
    for (int i = 0; i < direction.length; i++) {
      scaled[i] = direction[i] / minAbs;
    }

    int multiplier = 1;
    while (multiplier <= maxMultiplier && !allNearIntegers(scaled, multiplier)) {
      multiplier++;
    }
    if (multiplier > maxMultiplier) {
      LOGGER.warn("No multiplier up to %d gives integer ratios for %s (scaled: %s); rounding as is",
          maxMultiplier, formulas, Arrays.toString(scaled));
      multiplier = 1;
    }

    int[] coefficients = new int[scaled.length];
    for (int i = 0; i < scaled.length; i++) {
      coefficients[i] = (int) Math.floor(scaled[i] * multiplier + 0.5);
    }
    return coefficients;
  }

  private boolean allNearIntegers(double[] values, int multiplier) {
    for (double value : values) {
      double x = value * multiplier;
      if (Math.abs(x - Math.floor(x + 0.5)) > tolerance * Math.max(1.0, Math.abs(x))) {
        return false;
      }
    }
    return true;
  }

  /**
   * Convenience for callers that only need to know whether some coefficients conserve every element and charge.
   */
  public static Map<String, Long> getImbalance(List<String> formulas, int[] coefficients)
      throws InvalidFormulaException {
    List<ParsedSpecies> species = new ArrayList<>(formulas.size());
    for (String formula : formulas) {
      species.add(SpeciesExpander.readSpecies(formula));
    }
    return new CoefficientMatrix(species).getImbalance(coefficients);
  }
}
