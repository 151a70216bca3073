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

package io.nosqlbench.queuesim.format;

/// Thrown when text cannot be read as a duration.
public class DurationFormatException extends IllegalArgumentException {

    private final String input;

    public DurationFormatException(String input, String reason) {
        super("Invalid duration: '" + input + "'. " + reason);
        this.input = input;
    }

    /// @return the text which failed to parse
    public String getInput() {
        return input;
    }
}
