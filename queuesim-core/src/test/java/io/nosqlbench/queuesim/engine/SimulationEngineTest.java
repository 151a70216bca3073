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

import io.nosqlbench.queuesim.events.SimulationEvent;
import io.nosqlbench.queuesim.events.SimulationEventType;
import io.nosqlbench.queuesim.model.Customer;
import io.nosqlbench.queuesim.sinks.MemoryEventSink;
import io.nosqlbench.queuesim.state.SharedSimulationState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.OptionalDouble;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SimulationEngine")
class SimulationEngineTest {

    private static final double EPSILON = 1e-9;

    private static double startOf(SharedSimulationState state, int id) {
        return state.getCustomer(id).getServiceStartTime().orElseThrow();
    }

    private static double endOf(SharedSimulationState state, int id) {
        return state.getCustomer(id).getServiceEndTime().orElseThrow();
    }

    @Nested
    @DisplayName("preconditions")
    class Preconditions {

        @ParameterizedTest
        @ValueSource(ints = {0, -1, -50})
        @DisplayName("should reject non-positive window counts")
        void shouldRejectWindows(int windows) {
            assertThatThrownBy(() -> new SimulationEngine(windows))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("greater than 0");
        }

        @Test
        @DisplayName("should reject invalid generator parameters")
        void shouldRejectGeneratorParameters() {
            SimulationEngine engine = new SimulationEngine(1);
            Random random = new Random(1);
            assertThatThrownBy(() -> engine.generateRandomCustomers(0, 10, 1, 2, random))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> engine.generateRandomCustomers(100, 0, 1, 2, random))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> engine.generateRandomCustomers(100, 10, 0, 2, random))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> engine.generateRandomCustomers(100, 10, 5, 2, random))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(">=");
        }

        @Test
        @DisplayName("should refuse to run twice")
        void shouldRunOnce() {
            SimulationEngine engine = new SimulationEngine(1);
            engine.addCustomer(0, 10);
            engine.run();

            assertThat(engine.isStarted()).isTrue();
            assertThatThrownBy(engine::run).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> engine.addCustomer(1, 1)).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("fixed scenarios")
    class FixedScenarios {

        @Test
        @DisplayName("single window serves customers one after another")
        void singleWindowSequencing() {
            SimulationEngine engine = new SimulationEngine(1);
            engine.addCustomer(0, 100);
            engine.addCustomer(10, 50);
            engine.addCustomer(20, 50);

            SimulationReport report = engine.run();
            SharedSimulationState state = engine.getState();

            assertThat(report.outcome()).isEqualTo(RunOutcome.COMPLETED);
            assertThat(startOf(state, 0)).isEqualTo(0.0d);
            assertThat(startOf(state, 1)).isEqualTo(100.0d);
            assertThat(startOf(state, 2)).isEqualTo(150.0d);
            assertThat(report.finalTime()).isEqualTo(200.0d);
            assertThat(report.completedCustomers()).isEqualTo(3);
            assertThat(report.averageWaitTime()).isCloseTo(220.0d / 3.0d, within(EPSILON));
            assertThat(report.maxWaitTime()).isEqualTo(130.0d);
            assertThat(state.getStatistics().getQueueLengthIntegral()).isCloseTo(220.0d, within(EPSILON));
            assertThat(state.getStatistics().getServerBusyIntegral()).isCloseTo(200.0d, within(EPSILON));
            assertThat(report.utilization()).isCloseTo(1.0d, within(EPSILON));
            assertThat(report.maxQueueLength()).isEqualTo(2);
        }

        @Test
        @DisplayName("parallel windows serve simultaneous customers without waiting")
        void parallelWindows() {
            SimulationEngine engine = new SimulationEngine(3);
            engine.addCustomer(0, 50);
            engine.addCustomer(1, 50);
            engine.addCustomer(2, 50);

            SimulationReport report = engine.run();
            SharedSimulationState state = engine.getState();

            for (int id = 0; id < 3; id++) {
                assertThat(startOf(state, id)).isEqualTo((double) id);
                assertThat(endOf(state, id)).isEqualTo(50.0d + id);
            }
            assertThat(report.finalTime()).isEqualTo(52.0d);
            assertThat(report.averageWaitTime()).isZero();
            assertThat(report.maxQueueLength()).isLessThanOrEqualTo(2);
        }

        @Test
        @DisplayName("queue builds up behind a long service")
        void queueBuildUp() {
            SimulationEngine engine = new SimulationEngine(1);
            engine.addCustomer(0, 100);
            for (int t = 10; t <= 40; t += 10) {
                engine.addCustomer(t, 10);
            }

            SimulationReport report = engine.run();
            assertThat(report.maxQueueLength()).isGreaterThanOrEqualTo(4);
            assertThat(report.completedCustomers()).isEqualTo(5);
            assertThat(report.finalTime()).isEqualTo(140.0d);
        }

        @Test
        @DisplayName("customers added out of order are served by arrival")
        void sortsByArrival() {
            SimulationEngine engine = new SimulationEngine(1);
            engine.addCustomer(30, 5);
            engine.addCustomer(0, 5);
            engine.addCustomer(10, 5);

            engine.run();
            List<Customer> customers = engine.getState().getCustomers();
            assertThat(customers).extracting(Customer::getArrivalTime).containsExactly(0.0d, 10.0d, 30.0d);
            assertThat(customers).allMatch(Customer::isCompleted);
        }

        @Test
        @DisplayName("an empty admission list completes at time zero")
        void emptyList() {
            SimulationReport report = new SimulationEngine(2).run();

            assertThat(report.outcome()).isEqualTo(RunOutcome.COMPLETED);
            assertThat(report.finalTime()).isZero();
            assertThat(report.completedCustomers()).isZero();
            assertThat(report.utilization()).isZero();
            assertThat(report.throughputPerHour()).isZero();
        }
    }

    @Nested
    @DisplayName("event stream")
    class EventStream {

        @Test
        @DisplayName("a single customer produces arrival, start and end")
        void singleCustomerEvents() {
            SimulationEngine engine = new SimulationEngine(1);
            engine.addCustomer(0, 45);
            MemoryEventSink sink = new MemoryEventSink();
            engine.run(OptionalDouble.empty(), sink);

            assertThat(sink.getEvents()).containsExactly(
                new SimulationEvent(0.0d, SimulationEventType.ARRIVAL, 0, 1, 0, 1),
                new SimulationEvent(0.0d, SimulationEventType.SERVICE_START, 0, 0, 1, 1),
                new SimulationEvent(45.0d, SimulationEventType.SERVICE_END, 0, 0, 0, 1)
            );
        }

        @Test
        @DisplayName("events are emitted in non-decreasing time order")
        void nonDecreasingOrder() {
            SimulationEngine engine = new SimulationEngine(2);
            engine.generateRandomCustomers(5000, 20, 10, 50, new Random(7));
            MemoryEventSink sink = new MemoryEventSink();
            engine.run(OptionalDouble.empty(), sink);

            List<SimulationEvent> events = sink.getEvents();
            for (int i = 1; i < events.size(); i++) {
                assertThat(events.get(i).time()).isGreaterThanOrEqualTo(events.get(i - 1).time());
            }
            assertThat(events).allSatisfy(e -> {
                assertThat(e.queueLength()).isNotNegative();
                assertThat(e.busyServers()).isBetween(0, 2);
            });
            assertThat(events).hasSize(3 * engine.getState().getCustomerCount());
        }

        @Test
        @DisplayName("each customer starts service only after arriving and ends after starting")
        void perCustomerOrder() {
            SimulationEngine engine = new SimulationEngine(3);
            engine.generateRandomCustomers(2000, 10, 15, 40, new Random(99));
            MemoryEventSink sink = new MemoryEventSink();
            engine.run(OptionalDouble.empty(), sink);

            for (int id = 0; id < engine.getState().getCustomerCount(); id++) {
                assertThat(sink.getEventsFor(id)).extracting(SimulationEvent::type).containsExactly(
                    SimulationEventType.ARRIVAL, SimulationEventType.SERVICE_START, SimulationEventType.SERVICE_END);
            }
        }
    }

    @Nested
    @DisplayName("invariants")
    class Invariants {

        @Test
        @DisplayName("single window serves in arrival order")
        void firstComeFirstServed() {
            SimulationEngine engine = new SimulationEngine(1);
            engine.generateRandomCustomers(3000, 15, 10, 30, new Random(3));
            engine.run();

            List<Customer> customers = engine.getState().getCustomers();
            for (int i = 1; i < customers.size(); i++) {
                double previousStart = customers.get(i - 1).getServiceStartTime().orElseThrow();
                assertThat(customers.get(i).getServiceStartTime().orElseThrow())
                    .isGreaterThanOrEqualTo(previousStart);
            }
        }

        @Test
        @DisplayName("waits are non-negative and service lasts exactly its duration")
        void waitsAndServiceAccuracy() {
            SimulationEngine engine = new SimulationEngine(2);
            engine.generateRandomCustomers(4000, 12, 5, 35, new Random(11));
            SimulationReport report = engine.run();

            assertThat(engine.getState().getCustomers()).allSatisfy(c -> {
                assertThat(c.getWaitTime().orElseThrow()).isNotNegative();
                double served = c.getServiceEndTime().orElseThrow() - c.getServiceStartTime().orElseThrow();
                assertThat(served).isCloseTo(c.getServiceDuration(), within(1e-6));
            });
            assertThat(report.utilization()).isBetween(0.0d, 1.0d);
            assertThat(report.customersInSystem()).isZero();
            assertThat(engine.getState().snapshot().isConserved()).isTrue();
        }

        @Test
        @DisplayName("seeded generation is reproducible and within bounds")
        void seededGeneration() {
            SimulationEngine first = new SimulationEngine(1);
            SimulationEngine second = new SimulationEngine(1);
            int added = first.generateRandomCustomers(1000, 10, 2, 4, new Random(5));
            second.generateRandomCustomers(1000, 10, 2, 4, new Random(5));

            assertThat(added).isPositive().isEqualTo(first.getState().getCustomerCount());
            List<Customer> a = first.getState().getCustomers();
            List<Customer> b = second.getState().getCustomers();
            for (int i = 0; i < a.size(); i++) {
                assertThat(a.get(i).getArrivalTime()).isEqualTo(b.get(i).getArrivalTime());
                assertThat(a.get(i).getArrivalTime()).isBetween(0.0d, 1000.0d);
                assertThat(a.get(i).getServiceDuration()).isBetween(2.0d, 4.0d);
                if (i > 0) {
                    assertThat(a.get(i).getArrivalTime()).isGreaterThan(a.get(i - 1).getArrivalTime());
                }
            }
        }
    }

    @Nested
    @DisplayName("time limit")
    class TimeLimit {

        @Test
        @DisplayName("should stop at the limit with customers still in the system")
        void truncates() {
            SimulationEngine engine = new SimulationEngine(1);
            engine.addCustomer(0, 100);
            engine.addCustomer(10, 10);
            engine.addCustomer(500, 10);
            MemoryEventSink sink = new MemoryEventSink();

            SimulationReport report = engine.run(OptionalDouble.of(50.0d), sink);

            assertThat(report.outcome()).isEqualTo(RunOutcome.TIME_LIMIT);
            assertThat(report.outcome().isEarly()).isTrue();
            assertThat(report.finalTime()).isEqualTo(50.0d);
            assertThat(engine.getClock().now()).isEqualTo(50.0d);
            assertThat(report.admittedCustomers()).isEqualTo(2);
            assertThat(report.completedCustomers()).isZero();
            assertThat(report.customersInSystem()).isEqualTo(2);
            assertThat(report.unfinishedCustomers()).isEqualTo(3);
            assertThat(engine.getState().getStatistics().getServerBusyIntegral()).isCloseTo(50.0d, within(EPSILON));
            assertThat(engine.getState().getStatistics().getQueueLengthIntegral()).isCloseTo(40.0d, within(EPSILON));
            assertThat(sink.size()).isEqualTo(3);
            assertThat(engine.getState().snapshot().isConserved()).isTrue();
        }

        @ParameterizedTest
        @ValueSource(longs = {1L, 7L, 19L, 42L, 2024L})
        @DisplayName("should conserve customers at every transition of a truncated run")
        void conservesAtEveryTransition(long seed) {
            SimulationEngine engine = new SimulationEngine(3);
            engine.generateRandomCustomers(3000, 4, 5, 20, new Random(seed));
            MemoryEventSink sink = new MemoryEventSink();

            SimulationReport report = engine.run(OptionalDouble.of(1500.0d), sink);

            assertThat(report.outcome()).isEqualTo(RunOutcome.TIME_LIMIT);
            assertThat(sink.getEvents(SimulationEventType.SERVICE_END)).isNotEmpty();
            int arrivals = 0;
            int ends = 0;
            double lastTime = 0.0d;
            for (SimulationEvent event : sink.getEvents()) {
                if (event.type() == SimulationEventType.ARRIVAL) {
                    arrivals++;
                } else if (event.type() == SimulationEventType.SERVICE_END) {
                    ends++;
                }
                assertThat(ends + event.queueLength() + event.busyServers()).as("at %s", event).isEqualTo(arrivals);
                assertThat(event.busyServers()).isBetween(0, 3);
                assertThat(event.time()).isGreaterThanOrEqualTo(lastTime).isLessThanOrEqualTo(1500.0d);
                lastTime = event.time();
            }
            assertThat(report.admittedCustomers()).isEqualTo(arrivals);
            assertThat(report.completedCustomers()).isEqualTo(ends);
        }

        @Test
        @DisplayName("should report the limit as final time when work ends before it")
        void finishesEarly() {
            SimulationEngine engine = new SimulationEngine(1);
            engine.addCustomer(0, 10);

            SimulationReport report = engine.run(OptionalDouble.of(100.0d), new MemoryEventSink());

            assertThat(report.outcome()).isEqualTo(RunOutcome.COMPLETED);
            assertThat(report.finalTime()).isEqualTo(100.0d);
            assertThat(report.utilization()).isCloseTo(0.1d, within(EPSILON));
        }
    }
}
