package io.nusantara.tradenet.commands;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

/// Entry point for the trade network command line.
///
/// - `simulate`: run seasons and report season results and network statistics
/// - `roster`: show an island roster with type floors applied
@CommandLine.Command(name = "tradenet",
    headerHeading = "Usage:%n%n",
    synopsisHeading = "%n",
    descriptionHeading = "%nDescription%n%n",
    optionListHeading = "%nOptions:%n",
    header = "Simulate a seasonal maritime trade network between island agents",
    description = """
        Islands attempt voyages each season. Success depends on navigation skill,
        distance, the monsoon and whether a route between the islands already exists.
        Successful voyages accumulate into a route network whose centrality and
        connectivity are reported after the run.
        """,
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0:success", "2:error"},
    mixinStandardHelpOptions = true,
    subcommands = {CMD_simulate.class, CMD_roster.class, CommandLine.HelpCommand.class})
public class CMD_tradenet {
  private static final Logger logger = LogManager.getLogger(CMD_tradenet.class);

  /// Create the default CMD_tradenet command
  public CMD_tradenet() {
  }

  /// @return a command line configured the way `main` runs it
  public static CommandLine commandLine() {
    return new CommandLine(new CMD_tradenet())
        .setCaseInsensitiveEnumValuesAllowed(true)
        .setOptionsCaseInsensitive(true);
  }

  /// Run a tradenet command
  /// @param args Command line arguments
  public static void main(String[] args) {
    int exitCode = commandLine().execute(args);
    logger.debug("Exiting main with code: {}", exitCode);
    System.exit(exitCode);
  }
}
