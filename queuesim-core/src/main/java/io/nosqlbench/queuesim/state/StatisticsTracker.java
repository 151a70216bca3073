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

package io.nosqlbench.queuesim.state;

/**
 * Running statistics of a simulation, accumulated one event at a time.
 *
 * <p>Nothing here is ever recomputed from history. The time-weighted
 * integrals grow by {@code elapsed * level} each time the state is about to
 * change, and the per-customer sums grow once per completion. Every counter
 * is monotonically non-decreasing.</p>
 *
 * <p>This class is not thread safe; its owner, {@link SharedSimulationState},
 * serializes access to it.</p>
 */
public class StatisticsTracker {

    private double totalWaitTime;
    private double totalServiceTime;
    private long completedCustomers;
    private double queueLengthIntegral;
    private double serverBusyIntegral;
    private double maxWaitTime;
    private int maxQueueLength;
    private double lastEventTime;

    /**
     * Account for the interval since the last update, during which the queue
     * length and busy server count held the given values.
     *
     * <p>A call whose {@code now} is not after the last update adds nothing,
     * so repeated or out-of-order calls are harmless.</p>
     *
     * @param now         the end of the interval
     * @param queueLength customers waiting throughout the interval
     * @param busyServers servers occupied throughout the interval
     */
    public void updateIntegrals(double now, int queueLength, int busyServers) {
        double elapsed = now - lastEventTime;
        if (elapsed > 0.0d) {
            queueLengthIntegral += elapsed * queueLength;
            serverBusyIntegral += elapsed * busyServers;
            lastEventTime = now;
        }
    }

    /**
     * Count one finished customer.
     *
     * @param waitTime    time between arrival and service start
     * @param serviceTime time between service start and end
     */
    public void recordCompletion(double waitTime, double serviceTime) {
        totalWaitTime += waitTime;
        totalServiceTime += serviceTime;
        completedCustomers++;
        if (waitTime > maxWaitTime) {
            maxWaitTime = waitTime;
        }
    }

    public void updateMaxQueue(int queueLength) {
        if (queueLength > maxQueueLength) {
            maxQueueLength = queueLength;
        }
    }

    public double getTotalWaitTime() {
        return totalWaitTime;
    }

    public double getTotalServiceTime() {
        return totalServiceTime;
    }

    public long getCompletedCustomers() {
        return completedCustomers;
    }

    public double getQueueLengthIntegral() {
        return queueLengthIntegral;
    }

    public double getServerBusyIntegral() {
        return serverBusyIntegral;
    }

    public double getMaxWaitTime() {
        return maxWaitTime;
    }

    public int getMaxQueueLength() {
        return maxQueueLength;
    }

    public double getLastEventTime() {
        return lastEventTime;
    }

    /** @return mean wait of completed customers, or 0 if none completed */
    public double getAverageWaitTime() {
        return completedCustomers == 0 ? 0.0d : totalWaitTime / completedCustomers;
    }

    /** @return mean service time of completed customers, or 0 if none completed */
    public double getAverageServiceTime() {
        return completedCustomers == 0 ? 0.0d : totalServiceTime / completedCustomers;
    }

    /** @return time-weighted mean queue length over {@code [0, elapsed]} */
    public double getAverageQueueLength(double elapsed) {
        return elapsed > 0.0d ? queueLengthIntegral / elapsed : 0.0d;
    }

    /** @return time-weighted mean number of busy servers over {@code [0, elapsed]} */
    public double getAverageBusyServers(double elapsed) {
        return elapsed > 0.0d ? serverBusyIntegral / elapsed : 0.0d;
    }

    /** @return fraction of total server capacity in use over {@code [0, elapsed]} */
    public double getUtilization(double elapsed, int numWindows) {
        return elapsed > 0.0d && numWindows > 0 ? serverBusyIntegral / (elapsed * numWindows) : 0.0d;
    }

    /** @return completed customers per hour, with {@code elapsed} in seconds */
    public double getThroughputPerHour(double elapsed) {
        double hours = elapsed / 3600.0d;
        return hours > 0.0d ? completedCustomers / hours : 0.0d;
    }

    @Override
    public String toString() {
        return String.format("StatisticsTracker[completed=%d, queueIntegral=%.3f, busyIntegral=%.3f, last=%.3f]",
            completedCustomers, queueLengthIntegral, serverBusyIntegral, lastEventTime);
    }
}
