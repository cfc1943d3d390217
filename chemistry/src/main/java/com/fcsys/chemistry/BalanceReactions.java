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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fcsys.chemistry.balance.BalancedReaction;
import com.fcsys.chemistry.balance.StoichiometryBalancer;
import com.fcsys.utils.CLIUtil;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class BalanceReactions {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BalanceReactions.class);

  // Callers own the writers we're handed (stdout included), so Jackson must not close them.
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
      .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);

  private static final String OPTION_INPUT_FILE = "i";
  private static final String OPTION_OUTPUT_FILE = "o";
  private static final String OPTION_JSON = "j";
  private static final String OPTION_TOLERANCE = "t";
  private static final String OPTION_MAX_MULTIPLIER = "m";

  private static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "This class computes integer stoichiometric coefficients that balance chemical reactions.  Pass the formulas ",
      "of one reaction on the command line (e.g. e- H+ O2 H2O), or a TSV file with one reaction per line.  Charge ",
      "is written after an element, as in SO4-2 or H+, and electrons are written e-."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_INPUT_FILE)
        .argName("input-file")
        .desc("A TSV file with one reaction per line and one species formula per column")
        .hasArg()
        .longOpt("input-file")
    );
    add(Option.builder(OPTION_OUTPUT_FILE)
        .argName("output-file")
        .desc("An output file to which to write balanced reactions (default is stdout)")
        .hasArg()
        .longOpt("output-file")
    );
    add(Option.builder(OPTION_JSON)
        .desc("Write results as JSON instead of TSV")
        .longOpt("json")
    );
    add(Option.builder(OPTION_TOLERANCE)
        .argName("tolerance")
        .desc(String.format("Numerical tolerance for zero and integer tests (default %g)",
            StoichiometryBalancer.DEFAULT_TOLERANCE))
        .hasArg()
        .longOpt("tolerance")
    );
    add(Option.builder(OPTION_MAX_MULTIPLIER)
        .argName("max-multiplier")
        .desc(String.format("Largest factor tried when looking for integer coefficient ratios (default %d)",
            StoichiometryBalancer.DEFAULT_MAX_MULTIPLIER))
        .hasArg()
        .longOpt("max-multiplier")
    );
  }};

  private static final CLIUtil CLI_UTIL = new CLIUtil(BalanceReactions.class, HELP_MESSAGE, OPTION_BUILDERS);

  /**
   * The outcome of balancing one reaction: either coefficients and an equation, or an error message.
   */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class ReactionResult {
    @JsonProperty("species")
    private List<String> formulas;
    @JsonProperty("coefficients")
    private List<Integer> coefficients;
    @JsonProperty("equation")
    private String equation;
    @JsonProperty("error")
    private String error;

    static ReactionResult success(BalancedReaction reaction) {
      ReactionResult result = new ReactionResult();
      result.formulas = reaction.getFormulas();
      result.coefficients = reaction.getCoefficients();
      result.equation = reaction.getEquation();
      return result;
    }

    static ReactionResult failure(List<String> formulas, String error) {
      ReactionResult result = new ReactionResult();
      result.formulas = formulas;
      result.error = error;
      return result;
    }

    public List<String> getFormulas() {
      return formulas;
    }

    public List<Integer> getCoefficients() {
      return coefficients;
    }

    public String getEquation() {
      return equation;
    }

    public String getError() {
      return error;
    }

    @JsonIgnore
    public boolean isSuccess() {
      return error == null;
    }
  }

  private StoichiometryBalancer balancer;

  public BalanceReactions(StoichiometryBalancer balancer) {
    this.balancer = balancer;
  }

  /**
   * Balances each reaction independently; a reaction that can't be balanced is reported, not fatal.
   */
  public List<ReactionResult> balanceAll(List<List<String>> reactions) {
    List<ReactionResult> results = new ArrayList<>(reactions.size());
    for (List<String> formulas : reactions) {
      try {
        BalancedReaction reaction = balancer.balance(formulas);
        LOGGER.debug("Balanced %s as %s", formulas, reaction);
        results.add(ReactionResult.success(reaction));
      } catch (ChemistryException e) {
        LOGGER.error("Unable to balance %s: %s", formulas, e.getMessage());
        results.add(ReactionResult.failure(formulas, e.getMessage()));
      }
    }
    return results;
  }

  public void writeTSV(List<ReactionResult> results, Writer writer) throws IOException {
    CSVPrinter printer = new CSVPrinter(writer, CSVFormat.newFormat('\t').withRecordSeparator('\n'));
    printer.printRecord("reaction", "coefficients", "equation", "error");
    for (ReactionResult result : results) {
      printer.printRecord(
          StringUtils.join(result.getFormulas(), " "),
          result.getCoefficients() == null ? "" : StringUtils.join(result.getCoefficients(), " "),
          result.getEquation() == null ? "" : result.getEquation(),
          result.getError() == null ? "" : result.getError());
    }
    printer.flush();
  }

  public void writeJSON(List<ReactionResult> results, Writer writer) throws IOException {
    OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(writer, results);
  }

  public void writeResults(List<ReactionResult> results, Writer writer, boolean asJSON) throws IOException {
    if (asJSON) {
      writeJSON(results, writer);
    } else {
      writeTSV(results, writer);
    }
  }

  public static void main(String[] args) throws Exception {
    CommandLine cl = CLI_UTIL.parseCommandLine(args);

    double tolerance = StoichiometryBalancer.DEFAULT_TOLERANCE;
    int maxMultiplier = StoichiometryBalancer.DEFAULT_MAX_MULTIPLIER;
    try {
      if (cl.hasOption(OPTION_TOLERANCE)) {
        tolerance = Double.parseDouble(cl.getOptionValue(OPTION_TOLERANCE));
      }
      if (cl.hasOption(OPTION_MAX_MULTIPLIER)) {
        maxMultiplier = Integer.parseInt(cl.getOptionValue(OPTION_MAX_MULTIPLIER));
      }
    } catch (NumberFormatException e) {
      CLI_UTIL.failWithMessage("Unable to read a numeric option: %s", e.getMessage());
    }

    List<List<String>> reactions = new ArrayList<>();
    if (cl.hasOption(OPTION_INPUT_FILE)) {
      File inputFile = new File(cl.getOptionValue(OPTION_INPUT_FILE));
      if (!inputFile.exists()) {
        CLI_UTIL.failWithMessage("Input file at %s does not exist", inputFile.getAbsolutePath());
      }
      ReactionFileParser parser = new ReactionFileParser();
      parser.parse(inputFile);
      LOGGER.info("Read %d reactions from %s", parser.getReactions().size(), inputFile.getPath());
      reactions.addAll(parser.getReactions());
    }

    if (cl.getArgList().size() > 0) {
      LOGGER.info("Reading one reaction of %d species from the command line", cl.getArgList().size());
      reactions.add(new ArrayList<>(cl.getArgList()));
    }

    if (reactions.isEmpty()) {
      CLI_UTIL.failWithMessage("No reactions to balance: pass formulas as arguments or use -%s", OPTION_INPUT_FILE);
    }

    BalanceReactions balanceReactions = new BalanceReactions(new StoichiometryBalancer(tolerance, maxMultiplier));
    List<ReactionResult> results = balanceReactions.balanceAll(reactions);

    if (cl.hasOption(OPTION_OUTPUT_FILE)) {
      try (Writer writer = new OutputStreamWriter(
          new FileOutputStream(cl.getOptionValue(OPTION_OUTPUT_FILE)), StandardCharsets.UTF_8)) {
        balanceReactions.writeResults(results, writer, cl.hasOption(OPTION_JSON));
      }
    } else {
      // Leave stdout open for anything that runs after us; just flush what we wrote.
      Writer writer = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
      balanceReactions.writeResults(results, writer, cl.hasOption(OPTION_JSON));
      writer.flush();
    }

    long failures = results.stream().filter(r -> !r.isSuccess()).count();
    LOGGER.info("Balanced %d of %d reactions", results.size() - failures, results.size());
  }
}
