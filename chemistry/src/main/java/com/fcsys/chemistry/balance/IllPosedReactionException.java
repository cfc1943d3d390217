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

import com.fcsys.chemistry.ChemistryException;

import java.util.List;

public class IllPosedReactionException extends ChemistryException {

  public enum Diagnosis {
    REDUNDANT_SPECIES("a species is duplicated or redundant"),
    MISSING_SPECIES("a species is missing or doesn't match the others"),
    UNRELATED_SPECIES("the reaction contains unrelated species"),
    ;

    private String description;

    Diagnosis(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

  private Diagnosis diagnosis;
  private List<String> formulas;

  public IllPosedReactionException(Diagnosis diagnosis, List<String> formulas, String detail) {
    super(String.format("The reaction %s is ill-posed: %s (%s)", formulas, diagnosis.getDescription(), detail));
    this.diagnosis = diagnosis;
    this.formulas = formulas;
  }

  public Diagnosis getDiagnosis() {
    return diagnosis;
  }

  public List<String> getFormulas() {
    return formulas;
  }
}
