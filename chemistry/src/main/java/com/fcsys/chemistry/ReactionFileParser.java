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

package com.fcsys.chemistry;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads reactions from a headerless TSV file: one reaction per line, one species formula per column.  Blank lines and
 * lines starting with '#' are skipped, as are empty cells.
 */
public class ReactionFileParser {
  public static final CSVFormat TSV_FORMAT = CSVFormat.newFormat('\t').
      withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true).withCommentMarker('#');

  private List<List<String>> reactions = null;

  public void parse(File inFile) throws IOException {
    try (Reader reader = new FileReader(inFile)) {
      parse(reader);
    }
  }

  public void parse(Reader reader) throws IOException {
    List<List<String>> reactions = new ArrayList<>();
    try (CSVParser parser = new CSVParser(reader, TSV_FORMAT)) {
      for (CSVRecord r : parser) {
        List<String> formulas = new ArrayList<>(r.size());
        for (String cell : r) {
          if (StringUtils.isNotBlank(cell)) {
            formulas.add(cell.trim());
          }
        }
        if (!formulas.isEmpty()) {
          reactions.add(formulas);
        }
      }
    }
    this.reactions = reactions;
  }

  public List<List<String>> getReactions() {
    return this.reactions;
  }
}
