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

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SpeciesExpanderTest {

  @Test
  public void testReadSpeciesWithCharge() throws Exception {
    Map<String, Integer> expected = new LinkedHashMap<String, Integer>() {{
      put("C", 19); put("H", 1); put("F", 37); put("O", 5); put("S", 1); put("e-", 1);
    }};
    ParsedSpecies species = SpeciesExpander.readSpecies("C19HF37O5S-");
    assertEquals(expected, species.getElementCounts());
    assertEquals(Arrays.asList("C", "H", "F", "O", "S", "e-"), new ArrayList<>(species.getSymbols()));
    assertEquals(-1, species.getCharge());
    assertEquals("C19HF37O5S-", species.getFormula());
  }

  @Test
  public void testReadSpeciesOfIonsAndElectrons() throws Exception {
    assertEquals(counts("H", 1, "e-", -1), SpeciesExpander.readSpecies("H+").getElementCounts());
    assertEquals(counts("e-", 1), SpeciesExpander.readSpecies("e-").getElementCounts());
    assertEquals(counts("e-", 3), SpeciesExpander.readSpecies("e3").getElementCounts());
    assertEquals(counts("S", 1, "O", 4, "e-", 2), SpeciesExpander.readSpecies("SO4-2").getElementCounts());
    assertEquals(counts("Hg", 2, "e-", -2), SpeciesExpander.readSpecies("Hg2+2").getElementCounts());
  }

  @Test
  public void testNeutralSpeciesHasNoElectronEntry() throws Exception {
    assertFalse(SpeciesExpander.readSpecies("H2O").getSymbols().contains(ParsedSpecies.ELECTRON));
    assertEquals(counts("Na", 1, "Cl", 1), SpeciesExpander.readSpecies("Na+ Cl-").getElementCounts());
    assertEquals(counts("Na", 1), SpeciesExpander.readSpecies("Na+ e-").getElementCounts());
  }

  @Test
  public void testRepeatedSymbolsAreMerged() throws Exception {
    assertEquals(counts("C", 2, "H", 4, "O", 2), SpeciesExpander.readSpecies("CH3COOH").getElementCounts());
    assertEquals(counts("H", 2, "O", 1), SpeciesExpander.readSpecies("HOH").getElementCounts());
  }

  @Test
  public void testElectronEntryIsNegatedCharge() throws Exception {
    for (String formula : Arrays.asList("H+", "e-", "SO4-2", "Hg2+2", "C19HF37O5S-", "H2O", "Fe+3", "e2")) {
      ParsedSpecies species = SpeciesExpander.readSpecies(formula);
      assertEquals(formula, -ChargeResolver.charge(formula), (int) species.getElementCount(ParsedSpecies.ELECTRON));
      assertEquals(formula, ChargeResolver.charge(formula), species.getCharge());
    }
  }

  @Test
  public void testReadSpeciesRejectsInvalidFormula() {
    try {
      SpeciesExpander.readSpecies("H2O+x");
      fail("Expected an invalid formula");
    } catch (InvalidFormulaException e) {
      assertEquals("H2O+x", e.getFormula());
      assertTrue(e.getMessage().contains("H2O+x"));
    }
  }

  @Test
  public void testReadSpeciesRejectsOverflowingSums() {
    // Each digit run fits in an int, but the merged count or the net charge doesn't.
    for (String formula : Arrays.asList("H2147483647H", "H+2147483647H+", "e2147483647e", "Cl-2147483647Cl-")) {
      try {
        SpeciesExpander.readSpecies(formula);
        fail(String.format("Expected \"%s\" to overflow", formula));
      } catch (InvalidFormulaException e) {
        assertEquals(formula, e.getFormula());
        assertTrue(e.getMessage().contains("overflow"));
      }
    }
  }

  @Test
  public void testReadSpeciesAcceptsLargestCount() throws Exception {
    assertEquals(counts("H", Integer.MAX_VALUE), SpeciesExpander.readSpecies("H2147483646H").getElementCounts());
  }

  @Test
  public void testReadSpeciesIsRepeatable() throws Exception {
    assertEquals(SpeciesExpander.readSpecies("C19HF37O5S-"), SpeciesExpander.readSpecies("C19HF37O5S-"));
    assertEquals(SpeciesExpander.readSpecies("CH3COOH"), SpeciesExpander.readSpecies("C2H4O2"));
  }

  @Test
  public void testSpeciesToStringUsesHillOrder() throws Exception {
    List<String> formulas = Arrays.asList("C19HF37O5S-", "SO4-2", "H+", "e-", "e3", "HOH", "CH3COOH", "Hg2+2", "NaCl");
    List<String> expected = Arrays.asList("C19HF37O5S-", "O4S-2", "H+", "e-", "e3-", "H2O", "C2H4O2", "Hg2+2", "ClNa");
    for (int i = 0; i < formulas.size(); i++) {
      assertEquals(expected.get(i), SpeciesExpander.readSpecies(formulas.get(i)).toString());
    }
  }

  private static Map<String, Integer> counts(Object... symbolsAndCounts) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (int i = 0; i < symbolsAndCounts.length; i += 2) {
      counts.put((String) symbolsAndCounts[i], (Integer) symbolsAndCounts[i + 1]);
    }
    return counts;
  }
}
