/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.pvs.ui;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.pvs.ast.AstPrinter;
import exm.pvs.ast.Theory;
import exm.pvs.common.Logging;
import exm.pvs.common.Settings;
import exm.pvs.common.diag.Diagnostic;
import exm.pvs.common.diag.Severity;
import exm.pvs.common.exceptions.InvalidOptionException;
import exm.pvs.common.exceptions.UserException;
import exm.pvs.parser.ParseResult;
import exm.pvs.parser.ParserOptions;
import exm.pvs.parser.PvsParser;

/**
 * Command line interface to the parser: checks each input file and prints
 * diagnostics as {@code file:line:col: severity: message}.  Parser options
 * are passed indirectly through Java properties.  See Settings.java for
 * handling of these options.
 */
public class Main {
  private static final String TREE_FLAG = "t";
  private static final String QUIET_FLAG = "q";
  private static final String WARN_FIELDS_FLAG = "w";

  public static void main(String[] args) {
    ExitCode code = run(args, System.out, System.err);
    System.exit(code.code());
  }

  /**
   * Run the front end without exiting the JVM
   * @return worst outcome over all input files
   */
  public static ExitCode run(String[] args, PrintStream out,
                             PrintStream err) {
    Options opts = initOptions();
    CommandLine cmd;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      err.println(ex.getMessage());
      usage(opts, err);
      return ExitCode.ERROR_COMMAND;
    }

    String[] files = cmd.getArgs();
    if (files.length < 1) {
      err.println("Expected at least one input file");
      usage(opts, err);
      return ExitCode.ERROR_COMMAND;
    }

    ParserOptions options;
    Logger logger;
    try {
      Settings.initPvsProperties();
      options = ParserOptions.fromSettings();
      if (cmd.hasOption(WARN_FIELDS_FLAG)) {
        options = options.withWarnDuplicateFields(true);
      }
      logger = setupLogging();
    } catch (InvalidOptionException ex) {
      err.println("Error setting up options: " + ex.getMessage());
      return ExitCode.ERROR_COMMAND;
    } catch (IOException ex) {
      err.println("Error setting up logging: " + ex.getMessage());
      return ExitCode.ERROR_COMMAND;
    }

    boolean printTree = cmd.hasOption(TREE_FLAG);
    boolean quiet = cmd.hasOption(QUIET_FLAG);
    ExitCode result = ExitCode.SUCCESS;
    for (String file: files) {
      ExitCode fileResult;
      try {
        fileResult = checkFile(file, options, printTree, quiet, out, err);
      } catch (UserException ex) {
        err.println(ex.getMessage());
        fileResult = ExitCode.ERROR_IO;
      } catch (Throwable t) {
        reportInternalError(logger, t, err);
        return ExitCode.ERROR_INTERNAL;
      }
      if (fileResult.code() > result.code()) {
        result = fileResult;
      }
    }
    return result;
  }

  private static ExitCode checkFile(String file, ParserOptions options,
      boolean printTree, boolean quiet, PrintStream out, PrintStream err)
          throws UserException {
    String source = readSource(file);
    ParseResult result = PvsParser.parseSource(source, options);
    Logging.getPvsLogger().debug(file + ": " + result.getTheories().size()
              + " theories, " + result.errorCount() + " errors");

    for (Diagnostic d: result.getDiagnostics()) {
      if (quiet && d.getSeverity() == Severity.WARNING) {
        continue;
      }
      err.println(d.format(file));
    }
    if (printTree) {
      for (Theory theory: result.getTheories()) {
        out.print(AstPrinter.printTree(theory));
      }
    }
    return result.hasErrors() ? ExitCode.ERROR_USER : ExitCode.SUCCESS;
  }

  private static String readSource(String file) throws UserException {
    File input = new File(file);
    if (!input.isFile() || !input.canRead()) {
      throw new UserException("Input file \"" + file + "\" is not readable");
    }
    try {
      return FileUtils.readFileToString(input, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new UserException("Error reading \"" + file + "\": "
                              + ex.getMessage(), ex);
    }
  }

  private static Options initOptions() {
    Options opts = new Options();
    opts.addOption(TREE_FLAG, "tree", false, "Print the syntax tree");
    opts.addOption(QUIET_FLAG, "quiet", false, "Do not print warnings");
    opts.addOption(WARN_FIELDS_FLAG, "warn-fields", false,
                   "Warn about fields assigned twice in one expression");
    return opts;
  }

  private static Logger setupLogging()
      throws InvalidOptionException, IOException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    if (StringUtils.isBlank(logfile)) {
      logfile = null;
    }
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts, PrintStream err) {
    HelpFormatter fmt = new HelpFormatter();
    PrintWriter pw = new PrintWriter(err);
    fmt.printHelp(pw, HelpFormatter.DEFAULT_WIDTH,
                  "pvs-parse [options] <file>...", null, opts,
                  HelpFormatter.DEFAULT_LEFT_PAD,
                  HelpFormatter.DEFAULT_DESC_PAD, null);
    pw.flush();
  }

  private static void reportInternalError(Logger logger, Throwable t,
                                          PrintStream err) {
    logger.error("internal error", t);
    err.println("PVS PARSER INTERNAL ERROR");
    err.println("Please report this");
    t.printStackTrace(err);
  }
}
