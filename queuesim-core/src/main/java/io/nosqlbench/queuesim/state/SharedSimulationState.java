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

import io.nosqlbench.queuesim.events.SimulationEvent;
import io.nosqlbench.queuesim.events.SimulationEventSink;
import io.nosqlbench.queuesim.events.SimulationEventType;
import io.nosqlbench.queuesim.model.Customer;
import io.nosqlbench.queuesim.sinks.NoopEventSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.concurrent.locks.ReentrantLock;

/// The single owner of the customer list, the live counters and the
/// statistics of one simulation.
///
/// Every transition is one method, and every method runs its whole
/// read-modify-record sequence under one lock:
///
/// 1. integrals are brought up to the transition instant using the counters
///    as they stood *before* the transition
/// 2. the counters change
/// 3. the event is recorded, which notifies the sink and updates the peak
///    and completion statistics
///
/// The lock is never held by a caller across a suspension point; each
/// method acquires and releases it internally.
public class SharedSimulationState {
    private static final Logger logger = LogManager.getLogger(SharedSimulationState.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final List<Customer> customers = new ArrayList<>();
    private final StatisticsTracker stats = new StatisticsTracker();
    private final int numWindows;

    private SimulationEventSink sink = NoopEventSink.INSTANCE;
    private int queueLength;
    private int busyServers;
    private int admitted;
    private double currentTime;

    /// @param numWindows the number of identical servers, at least one
    public SharedSimulationState(int numWindows) {
        if (numWindows <= 0) {
            throw new IllegalArgumentException("Number of windows must be greater than 0, got " + numWindows);
        }
        this.numWindows = numWindows;
    }

    /// Append a customer to the admission list.
    /// @param customer the customer to add
    /// @return the index of the customer before sorting
    public int addCustomer(Customer customer) {
        Objects.requireNonNull(customer, "customer");
        lock.lock();
        try {
            customers.add(customer);
            return customers.size() - 1;
        } finally {
            lock.unlock();
        }
    }

    /// Stably sort the admission list by arrival time. Customer ids are
    /// indices into the sorted list.
    public void sortByArrival() {
        lock.lock();
        try {
            customers.sort(Comparator.comparingDouble(Customer::getArrivalTime));
        } finally {
            lock.unlock();
        }
    }

    /// @param sink where transition events go from now on
    public void setEventSink(SimulationEventSink sink) {
        lock.lock();
        try {
            this.sink = sink == null ? NoopEventSink.INSTANCE : sink;
        } finally {
            lock.unlock();
        }
    }

    /// A customer has arrived and entered the waiting queue.
    /// @param customerId the customer index
    /// @param arrivalTime the arrival instant
    public void admit(int customerId, double arrivalTime) {
        lock.lock();
        try {
            updateIntegral(arrivalTime);
            queueLength++;
            admitted++;
            record(arrivalTime, SimulationEventType.ARRIVAL, customerId);
        } finally {
            lock.unlock();
        }
    }

    /// A server has taken a customer from the queue.
    /// @param customerId the customer index
    /// @param now the current virtual time
    /// @return the service duration, or empty if the id names no customer
    public OptionalDouble beginService(int customerId, double now) {
        lock.lock();
        try {
            if (!isValidId(customerId)) {
                logger.error("invalid customer id {} reached a server at T={}", customerId, now);
                return OptionalDouble.empty();
            }
            updateIntegral(now);
            if (busyServers >= numWindows) {
                logger.warn("all {} windows already busy at T={}, customer {} starts anyway",
                    numWindows, now, customerId);
            }
            busyServers++;
            if (queueLength > 0) {
                queueLength--;
            } else {
                logger.warn("queue underflow prevented at T={} for customer {}", now, customerId);
            }
            Customer customer = customers.get(customerId);
            customer.markServiceStart(now);
            record(now, SimulationEventType.SERVICE_START, customerId);
            return OptionalDouble.of(customer.getServiceDuration());
        } finally {
            lock.unlock();
        }
    }

    /// A server has finished with a customer.
    /// @param customerId the customer index
    /// @param now the current virtual time
    public void endService(int customerId, double now) {
        lock.lock();
        try {
            if (!isValidId(customerId)) {
                logger.error("invalid customer id {} finished service at T={}", customerId, now);
                return;
            }
            updateIntegral(now);
            if (busyServers > 0) {
                busyServers--;
            } else {
                logger.warn("busy server underflow prevented at T={} for customer {}", now, customerId);
            }
            customers.get(customerId).markServiceEnd(now);
            record(now, SimulationEventType.SERVICE_END, customerId);
        } finally {
            lock.unlock();
        }
    }

    /// Carry the integrals forward to the end of the run using the last
    /// known counters. Does nothing if the state has already reached that
    /// instant.
    /// @param finalTime the instant the run ended
    public void finalizeAt(double finalTime) {
        lock.lock();
        try {
            if (currentTime < finalTime) {
                stats.updateIntegrals(finalTime, queueLength, busyServers);
                currentTime = finalTime;
            }
        } finally {
            lock.unlock();
        }
    }

    /// @return the counters as they stand now
    public StateSnapshot snapshot() {
        lock.lock();
        try {
            return new StateSnapshot(currentTime, admitted, queueLength, busyServers,
                stats.getCompletedCustomers(), numWindows);
        } finally {
            lock.unlock();
        }
    }

    public int getNumWindows() {
        return numWindows;
    }

    public int getCustomerCount() {
        lock.lock();
        try {
            return customers.size();
        } finally {
            lock.unlock();
        }
    }

    public Customer getCustomer(int customerId) {
        lock.lock();
        try {
            return customers.get(customerId);
        } finally {
            lock.unlock();
        }
    }

    /// @return a copy of the admission list, in id order
    public List<Customer> getCustomers() {
        lock.lock();
        try {
            return List.copyOf(customers);
        } finally {
            lock.unlock();
        }
    }

    /// The statistics are owned by this state. Read them only while no run is
    /// in progress.
    /// @return the statistics tracker
    public StatisticsTracker getStatistics() {
        return stats;
    }

    private boolean isValidId(int customerId) {
        return customerId >= 0 && customerId < customers.size();
    }

    private void updateIntegral(double now) {
        stats.updateIntegrals(now, queueLength, busyServers);
        if (now > currentTime) {
            currentTime = now;
        }
    }

    private void record(double now, SimulationEventType type, int customerId) {
        stats.updateMaxQueue(queueLength);

        if (type == SimulationEventType.SERVICE_END) {
            Customer customer = customers.get(customerId);
            OptionalDouble start = customer.getServiceStartTime();
            OptionalDouble end = customer.getServiceEndTime();
            if (start.isPresent() && end.isPresent()) {
                stats.recordCompletion(start.getAsDouble() - customer.getArrivalTime(),
                    end.getAsDouble() - start.getAsDouble());
            }
        }

        SimulationEvent event = new SimulationEvent(now, type, customerId, queueLength, busyServers, numWindows);
        try {
            sink.onEvent(event);
        } catch (RuntimeException e) {
            logger.warn("event sink {} rejected {}: {}", sink, event, e.toString());
        }
    }
}
