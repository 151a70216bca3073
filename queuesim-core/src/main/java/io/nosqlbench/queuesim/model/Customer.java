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

package io.nosqlbench.queuesim.model;

import java.util.OptionalDouble;

/**
 * A customer of the queueing system. Arrival time and service duration are
 * fixed when the customer is created. The service start and end times are set
 * once each, by the server which handles the customer, start before end.
 */
public final class Customer {

    private final double arrivalTime;
    private final double serviceDuration;
    private double serviceStartTime = Double.NaN;
    private double serviceEndTime = Double.NaN;

    /**
     * @param arrivalTime     the instant the customer arrives, at least zero
     * @param serviceDuration how long the customer occupies a server, above zero
     */
    public Customer(double arrivalTime, double serviceDuration) {
        if (!Double.isFinite(arrivalTime) || arrivalTime < 0.0d) {
            throw new IllegalArgumentException("Arrival time must be non-negative, got " + arrivalTime);
        }
        if (!Double.isFinite(serviceDuration) || serviceDuration <= 0.0d) {
            throw new IllegalArgumentException("Service duration must be positive, got " + serviceDuration);
        }
        this.arrivalTime = arrivalTime;
        this.serviceDuration = serviceDuration;
    }

    public double getArrivalTime() {
        return arrivalTime;
    }

    public double getServiceDuration() {
        return serviceDuration;
    }

    public OptionalDouble getServiceStartTime() {
        return Double.isNaN(serviceStartTime) ? OptionalDouble.empty() : OptionalDouble.of(serviceStartTime);
    }

    public OptionalDouble getServiceEndTime() {
        return Double.isNaN(serviceEndTime) ? OptionalDouble.empty() : OptionalDouble.of(serviceEndTime);
    }

    public boolean isStarted() {
        return !Double.isNaN(serviceStartTime);
    }

    public boolean isCompleted() {
        return !Double.isNaN(serviceEndTime);
    }

    /**
     * Record the instant service began.
     *
     * @throws IllegalStateException if service already began
     */
    public void markServiceStart(double time) {
        if (isStarted()) {
            throw new IllegalStateException("service start already recorded at " + serviceStartTime);
        }
        this.serviceStartTime = time;
    }

    /**
     * Record the instant service ended.
     *
     * @throws IllegalStateException if service never began, or already ended
     */
    public void markServiceEnd(double time) {
        if (!isStarted()) {
            throw new IllegalStateException("service end recorded before service start");
        }
        if (isCompleted()) {
            throw new IllegalStateException("service end already recorded at " + serviceEndTime);
        }
        this.serviceEndTime = time;
    }

    /**
     * @return time spent waiting before service, if service began
     */
    public OptionalDouble getWaitTime() {
        return isStarted() ? OptionalDouble.of(serviceStartTime - arrivalTime) : OptionalDouble.empty();
    }

    @Override
    public String toString() {
        return String.format("Customer[arrival=%.3f, service=%.3f, start=%s, end=%s]",
            arrivalTime, serviceDuration, getServiceStartTime(), getServiceEndTime());
    }
}
