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
 * A consistent view of the live counters, taken under the state lock.
 *
 * @param currentTime time of the last state change
 * @param admitted    customers which have entered the queue so far
 * @param queueLength customers waiting
 * @param busyServers servers occupied
 * @param completed   customers which have left the system
 * @param numWindows  servers in the system
 */
public record StateSnapshot(
    double currentTime,
    int admitted,
    int queueLength,
    int busyServers,
    long completed,
    int numWindows
) {
    /** @return customers waiting or in service */
    public int inSystem() {
        return queueLength + busyServers;
    }

    /** @return true if every admitted customer is waiting, in service, or done */
    public boolean isConserved() {
        return completed + queueLength + busyServers == admitted;
    }
}
