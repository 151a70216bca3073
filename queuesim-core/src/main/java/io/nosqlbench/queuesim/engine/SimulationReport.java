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

package io.nosqlbench.queuesim.engine;

import io.nosqlbench.queuesim.state.SharedSimulationState;
import io.nosqlbench.queuesim.state.StateSnapshot;
import io.nosqlbench.queuesim.state.StatisticsTracker;

/**
 * The summary of one finished run. Averages over time use {@code finalTime}
 * as the observation window; averages over customers use the completed
 * customers only.
 *
 * @param outcome             why the run stopped
 * @param finalTime           the end of the observation window
 * @param numWindows          servers in the system
 * @param totalCustomers      customers on the admission list
 * @param admittedCustomers   customers which entered the queue
 * @param completedCustomers  customers which left the system
 * @param averageWaitTime     mean time from arrival to service start
 * @param maxWaitTime         longest time from arrival to service start
 * @param averageServiceTime  mean time in service
 * @param averageQueueLength  time-weighted mean queue length
 * @param maxQueueLength      longest queue seen after any transition
 * @param averageBusyServers  time-weighted mean number of busy servers
 * @param utilization         average busy servers over servers, in {@code [0, 1]}
 * @param throughputPerHour   completed customers per hour of virtual time
 * @param customersInSystem   customers waiting or in service when the run stopped
 */
public record SimulationReport(
    RunOutcome outcome,
    double finalTime,
    int numWindows,
    int totalCustomers,
    int admittedCustomers,
    long completedCustomers,
    double averageWaitTime,
    double maxWaitTime,
    double averageServiceTime,
    double averageQueueLength,
    int maxQueueLength,
    double averageBusyServers,
    double utilization,
    double throughputPerHour,
    int customersInSystem
) {

    /**
     * Build a report from the state of a finished run.
     *
     * @param state   the state after integrals were finalized
     * @param outcome why the run stopped
     * @return the report
     */
    public static SimulationReport of(SharedSimulationState state, RunOutcome outcome) {
        StateSnapshot snapshot = state.snapshot();
        StatisticsTracker stats = state.getStatistics();
        double elapsed = snapshot.currentTime();
        return new SimulationReport(
            outcome,
            elapsed,
            snapshot.numWindows(),
            state.getCustomerCount(),
            snapshot.admitted(),
            stats.getCompletedCustomers(),
            stats.getAverageWaitTime(),
            stats.getMaxWaitTime(),
            stats.getAverageServiceTime(),
            stats.getAverageQueueLength(elapsed),
            stats.getMaxQueueLength(),
            stats.getAverageBusyServers(elapsed),
            stats.getUtilization(elapsed, snapshot.numWindows()),
            stats.getThroughputPerHour(elapsed),
            snapshot.inSystem()
        );
    }

    /** @return utilization as a percentage */
    public double utilizationPercent() {
        return utilization * 100.0d;
    }

    /** @return customers on the admission list which did not complete */
    public long unfinishedCustomers() {
        return totalCustomers - completedCustomers;
    }
}
