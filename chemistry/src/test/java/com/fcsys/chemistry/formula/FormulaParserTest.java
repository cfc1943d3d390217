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

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class FormulaParserTest {

  private static final List<String> VALID_FORMULAS = Arrays.asList(
      "H2O",
      "H+",
      "e-",
      "O2",
      "Hg2+2",
      "SO4-2",
      "C19HF37O5S-",
      "CH3COOH",
      "KMnO4",
      " Na+ Cl-",
      "e4"
  );

  private static final List<String> INVALID_FORMULAS = Arrays.asList(
      "h2o", // lowercase element
      "2H", // leading coefficient
      "", // nothing to read
      "   ",
      "H0", // zero coefficient
      "H02", // leading zero
      "e+", // positive electron
      "e-2", // electrons carry a fixed charge
      "ex",
      "H99999999999", // coefficient overflows an int
      "H+99999999999", // charge overflows an int
      "(OH)2"
  );

  @Test
  public void testReadElementWithCoefficientAndCharge() {
    ElementReading reading = FormulaParser.readElement("Hg2+2");
    assertTrue(reading.isValid());
    assertEquals("Hg", reading.getSymbol());
    assertEquals(Integer.valueOf(2), reading.getCoefficient());
    assertEquals(Integer.valueOf(2), reading.getCharge());
    assertEquals("", reading.getRemainder());
    assertEquals(ElementReading.of("Hg", 2, 2, ""), reading);
  }

  @Test
  public void testReadElementLeavesRemainder() {
    assertEquals(ElementReading.of("C", 19, 0, "HF37O5S-"), FormulaParser.readElement("C19HF37O5S-"));
    assertEquals(ElementReading.of("H", 1, 0, "F37O5S-"), FormulaParser.readElement("HF37O5S-"));
    assertEquals(ElementReading.of("S", 1, -1, ""), FormulaParser.readElement("S-"));
    assertEquals(ElementReading.of("S", 1, 0, "O4-2"), FormulaParser.readElement("SO4-2"));
    assertEquals(ElementReading.of("O", 4, -2, ""), FormulaParser.readElement("O4-2"));
    assertEquals(ElementReading.of("Cl", 1, 1, "O"), FormulaParser.readElement("Cl+O"));
  }

  @Test
  public void testReadElementSkipsLeadingWhitespace() {
    assertEquals(ElementReading.of("H", 2, 0, "O"), FormulaParser.readElement("  H2O"));
    assertEquals(ElementReading.of("Cl", 1, -1, ""), FormulaParser.readElement("\tCl-"));
  }

  @Test
  public void testReadElementReadsElectrons() {
    assertEquals(ElementReading.of("e", 1, -1, ""), FormulaParser.readElement("e-"));
    assertEquals(ElementReading.of("e", 1, -1, ""), FormulaParser.readElement("e"));
    assertEquals(ElementReading.of("e", 4, -4, ""), FormulaParser.readElement("e4"));
    assertEquals(ElementReading.of("e", 2, -2, " H"), FormulaParser.readElement("e2- H"));
  }

  @Test
  public void testReadElementSignalsFailureWithEmptySymbol() {
    for (String formula : INVALID_FORMULAS) {
      ElementReading reading = FormulaParser.readElement(formula);
      assertFalse(String.format("Expected \"%s\" to fail", formula), reading.isValid());
      assertEquals("", reading.getSymbol());
      assertEquals("Failed readings keep the whole input", formula, reading.getRemainder());
    }
  }

  @Test
  public void testReadElementAlwaysConsumesInput() {
    for (String formula : VALID_FORMULAS) {
      String remainder = formula;
      while (!remainder.trim().isEmpty()) {
        ElementReading reading = FormulaParser.readElement(remainder);
        assertTrue(String.format("Unable to read \"%s\" in \"%s\"", remainder, formula), reading.isValid());
        assertTrue(reading.getCoefficient() >= 1);
        assertTrue(reading.getRemainder().length() < remainder.length());
        remainder = reading.getRemainder();
      }
    }
  }

  @Test
  public void testTokenizeKeepsRepeatedSymbols() throws Exception {
    List<ElementToken> expected = Arrays.asList(
        new ElementToken("C", 1, 0),
        new ElementToken("H", 3, 0),
        new ElementToken("C", 1, 0),
        new ElementToken("O", 1, 0),
        new ElementToken("O", 1, 0),
        new ElementToken("H", 1, 0)
    );
    assertEquals(expected, FormulaParser.tokenize("CH3COOH"));
  }

  @Test
  public void testTokenizeRejectsInvalidFormulas() {
    for (String formula : Arrays.asList("H2o", "H2O!", "C6H12O6 glucose", "")) {
      try {
        FormulaParser.tokenize(formula);
        fail(String.format("Expected \"%s\" to be rejected", formula));
      } catch (InvalidFormulaException e) {
        assertEquals(formula, e.getFormula());
      }
    }
  }

  @Test
  public void testCountElements() throws Exception {
    assertEquals(6, FormulaParser.countElements("C19HF37O5S-"));
    assertEquals(2, FormulaParser.countElements("H+"));
    assertEquals(2, FormulaParser.countElements("H2O"));
    assertEquals(1, FormulaParser.countElements("e-"));
    assertEquals(3, FormulaParser.countElements("CH3COOH"));
    assertEquals(1, FormulaParser.countElements("Na+ e-"));
  }

  @Test(expected = InvalidFormulaException.class)
  public void testCountElementsPropagatesFailure() throws Exception {
    FormulaParser.countElements("H2O2x");
  }

  @Test
  public void testCountElementsMatchesReadSpecies() throws Exception {
    for (String formula : VALID_FORMULAS) {
      assertEquals(formula, SpeciesExpander.readSpecies(formula).size(), FormulaParser.countElements(formula));
    }
  }

  @Test
  public void testParsingIsRepeatable() throws Exception {
    for (String formula : VALID_FORMULAS) {
      assertEquals(FormulaParser.readElement(formula), FormulaParser.readElement(formula));
      assertEquals(FormulaParser.tokenize(formula), FormulaParser.tokenize(formula));
    }
  }
}
