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

import com.fcsys.chemistry.ChemistryException;

public class InvalidFormulaException extends ChemistryException {
  private String formula;

  public InvalidFormulaException(String formula) {
    super(String.format("Invalid chemical formula: \"%s\"", formula));
    this.formula = formula;
  }

  public InvalidFormulaException(String formula, String reason) {
    super(String.format("Invalid chemical formula \"%s\": %s", formula, reason));
    this.formula = formula;
  }

  public String getFormula() {
    return formula;
  }
}
