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

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * The element counts of one chemical species, in the order the elements first appear in its formula.
 * Charge is represented by the pseudo-element "e-": a species with net charge z has an "e-" entry of -z, so that
 * conserving "e-" across a reaction conserves charge.
 * For example, "SO4-2" is represented as Map(S -> 1, O -> 4, e- -> 2).
 */
public class ParsedSpecies {

  public static final String ELECTRON = "e-";

  private String formula;
  private Map<String, Integer> elementCounts;

  public ParsedSpecies(String formula, Map<String, Integer> elementCounts) {
    this.formula = formula;
    this.elementCounts = Collections.unmodifiableMap(new LinkedHashMap<>(elementCounts));
  }

  /**
   * Get the formula this species was read from
   */
  public String getFormula() {
    return formula;
  }

  public Map<String, Integer> getElementCounts() {
    return elementCounts;
  }

  public Set<String> getSymbols() {
    return elementCounts.keySet();
  }

  public Integer getElementCount(String symbol) {
    return elementCounts.getOrDefault(symbol, 0);
  }

  public int size() {
    return elementCounts.size();
  }

  public int getCharge() {
    return -getElementCount(ELECTRON);
  }

  @Override
  public boolean equals(Object o) {
    return (o instanceof ParsedSpecies) && elementCounts.equals(((ParsedSpecies) o).getElementCounts());
  }

  @Override
  public int hashCode() {
    return elementCounts.hashCode();
  }

  /**
   * Orders elements according to the Hill system: if the species contains carbon, carbon first, hydrogen second and
   * the rest alphabetically; otherwise everything alphabetically.
   */
  private Comparator<String> getSymbolComparator() {
    if (getElementCount("C") > 0) {
      return (String s1, String s2) -> {
        if (s1.equals(s2)) {
          return 0;
        } else if (s1.equals("C")) {
          return -1;
        } else if (s2.equals("C")) {
          return 1;
        } else if (s1.equals("H")) {
          return -1;
        } else if (s2.equals("H")) {
          return 1;
        } else {
          return s1.compareTo(s2);
        }
      };
    } else {
      return String::compareTo;
    }
  }

  /**
   * Writes the species in Hill order followed by its charge, so (C -> 8, H -> 9, N -> 1, O -> 2) becomes "C8H9NO2"
   * and (O -> 1, H -> 1, e- -> 1) becomes "HO-".  A lone "e-" entry is written as "e-".
   * @return the species' canonical string representation
   */
  @Override
  public String toString() {
    if (elementCounts.size() == 1 && elementCounts.containsKey(ELECTRON) && getElementCount(ELECTRON) > 0) {
      int electrons = getElementCount(ELECTRON);
      return electrons == 1 ? ELECTRON : ElementToken.ELECTRON_SYMBOL + electrons + "-";
    }

    TreeMap<String, Integer> sorted = new TreeMap<>(getSymbolComparator());
    sorted.putAll(elementCounts);
    sorted.remove(ELECTRON);

    StringBuilder builder = new StringBuilder();
    for (Map.Entry<String, Integer> entry : sorted.entrySet()) {
      builder.append(entry.getKey());
      if (entry.getValue() != 1) {
        builder.append(entry.getValue());
      }
    }

    int charge = getCharge();
    if (charge != 0) {
      builder.append(charge > 0 ? '+' : '-');
      if (Math.abs(charge) != 1) {
        builder.append(Math.abs(charge));
      }
    }
    return builder.toString();
  }
}
