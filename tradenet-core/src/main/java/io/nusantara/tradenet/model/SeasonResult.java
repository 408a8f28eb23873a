package io.nusantara.tradenet.model;

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

/// Aggregate of one season's batch of voyages.
/// @param season
///     1-based season number since the last reset
/// @param sailedMonsoon
///     the monsoon the voyages of this season sailed under
/// @param monsoon
///     the monsoon after the season's advance, which is what the season is reported as
/// @param attempts
///     number of voyages attempted
/// @param successes
///     number of voyages that arrived
/// @param successRate
///     successes / attempts
/// @param trade
///     goods moved by this season's successful voyages
/// @param cultural
///     cultural exchanges in this season
/// @param routes
///     size of the route set when the season ended
public record SeasonResult(
    int season,
    Monsoon sailedMonsoon,
    Monsoon monsoon,
    int attempts,
    int successes,
    double successRate,
    long trade,
    int cultural,
    int routes
) {
}
