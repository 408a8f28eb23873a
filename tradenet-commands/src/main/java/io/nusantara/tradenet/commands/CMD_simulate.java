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

import io.nusantara.tradenet.model.IslandDefinition;
import io.nusantara.tradenet.model.SeasonResult;
import io.nusantara.tradenet.random.RandomGenerators;
import io.nusantara.tradenet.roster.IslandRosterLoader;
import io.nusantara.tradenet.sim.SimulationConfig;
import io.nusantara.tradenet.sim.SimulationController;
import io.nusantara.tradenet.sim.UnknownIslandException;
import io.nusantara.tradenet.stats.NetworkStatsSnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Run a batch of seasons and report what the network became.
 *
 * Without {@code --seed} a seed is drawn and printed, so any run can be repeated.
 */
@CommandLine.Command(name = "simulate",
    description = "Run seasons of voyages and report season results and network statistics")
public class CMD_simulate implements Callable<Integer> {
  private static final Logger logger = LogManager.getLogger(CMD_simulate.class);

  public static final int EXIT_OK = 0;
  public static final int EXIT_ERROR = 2;

  @CommandLine.Spec
  private CommandLine.Model.CommandSpec spec;

  @CommandLine.Option(names = {"--seasons"},
      description = "Number of seasons to run (default: ${DEFAULT-VALUE})",
      defaultValue = "" + SimulationController.DEFAULT_BATCH_SEASONS)
  private int seasons;

  @CommandLine.Option(names = {"--seed"},
      description = "Seed for the random generator; drawn at random when omitted")
  private Long seed;

  @CommandLine.Option(names = {"--algorithm"},
      description = "PRNG algorithm: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
      defaultValue = "XO_SHI_RO_256_PP")
  private RandomGenerators.Algorithm algorithm;

  @CommandLine.Option(names = {"--roster"},
      description = "YAML island roster; the built-in archipelago when omitted")
  private Path roster;

  @CommandLine.Option(names = {"--island"},
      description = "Print the detail view of this island after the run")
  private String island;

  @CommandLine.Option(names = {"--json"},
      description = "Write season history and network statistics as JSON instead of tables")
  private boolean json;

  @Override
  public Integer call() {
    PrintWriter out = spec.commandLine().getOut();
    PrintWriter err = spec.commandLine().getErr();
    try {
      List<IslandDefinition> islands = roster != null
          ? IslandRosterLoader.load(roster)
          : IslandRosterLoader.loadDefault();
      SimulationConfig config = new SimulationConfig(
          seed != null ? seed : RandomGenerators.createSeed(), algorithm);

      SimulationController controller = SimulationController.initialize(islands, config);
      if (island != null) {
        controller.getIsland(island);
      }
      List<SeasonResult> results = controller.runBatch(seasons);
      NetworkStatsSnapshot stats = controller.getNetworkStats();

      if (json) {
        out.println(ReportJson.toJson(new ReportJson.RunReport(config.seed(), results, stats)));
      } else {
        out.println("seed: " + config.seed());
        out.println();
        out.print(SimulationReport.seasonTable(results));
        out.println();
        out.print(SimulationReport.networkSummary(stats));
        if (island != null) {
          out.println();
          out.print(SimulationReport.islandDetail(stats.island(island).orElseThrow()));
        }
      }
      out.flush();
      return EXIT_OK;
    } catch (UnknownIslandException e) {
      err.println("error: " + e.getMessage());
      logger.error("unknown island '{}'", e.getIslandId());
      return EXIT_ERROR;
    } catch (RuntimeException e) {
      err.println("error: " + e.getMessage());
      logger.error("simulation failed", e);
      return EXIT_ERROR;
    }
  }
}
