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
import io.nusantara.tradenet.roster.IslandRosterLoader;
import io.nusantara.tradenet.sim.Island;
import io.nusantara.tradenet.sim.IslandRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/// List a roster's islands with their attributes after type floors.
@CommandLine.Command(name = "roster",
    description = "Show the island roster with type floors applied")
public class CMD_roster implements Callable<Integer> {
  private static final Logger logger = LogManager.getLogger(CMD_roster.class);

  @CommandLine.Spec
  private CommandLine.Model.CommandSpec spec;

  @CommandLine.Option(names = {"--roster"},
      description = "YAML island roster; the built-in archipelago when omitted")
  private Path roster;

  @Override
  public Integer call() {
    PrintWriter out = spec.commandLine().getOut();
    try {
      List<IslandDefinition> definitions = roster != null
          ? IslandRosterLoader.load(roster)
          : IslandRosterLoader.loadDefault();
      IslandRegistry registry = IslandRegistry.initialize(definitions);

      out.printf("%-14s %-13s %10s %6s %8s%n", "Island", "Type", "Navigation", "Trade", "Culture");
      for (Island island : registry.islands()) {
        out.printf("%-14s %-13s %9d%% %6d %7d%%%n",
            island.getId(),
            island.getType().label(),
            Math.round(island.getNavigationSkill() * 100),
            island.getTradeCapacity(),
            Math.round(island.getCultureAffinity() * 100));
      }
      out.flush();
      return CMD_simulate.EXIT_OK;
    } catch (RuntimeException e) {
      spec.commandLine().getErr().println("error: " + e.getMessage());
      logger.error("could not read roster", e);
      return CMD_simulate.EXIT_ERROR;
    }
  }
}
