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

package io.nosqlbench.queuesim.command.common;

import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("command options")
class CommandOptionsTest {

    @CommandLine.Command(name = "options")
    static class OptionHost {
        @CommandLine.Mixin
        ConfigFileOption config = new ConfigFileOption();
        @CommandLine.Mixin
        RandomSeedOption seed = new RandomSeedOption();
        @CommandLine.Mixin
        VerbosityOption verbosity = new VerbosityOption();
    }

    private static OptionHost parse(String... args) {
        OptionHost host = new OptionHost();
        new CommandLine(host).parseArgs(args);
        return host;
    }

    @Nested
    @DisplayName("ConfigFileOption")
    class ConfigFile {

        @Test
        @DisplayName("should default to config.yaml")
        void shouldDefault() {
            assertThat(parse().config.getConfigPath()).isEqualTo(Path.of("config.yaml"));
        }

        @Test
        @DisplayName("should accept a short and a long name")
        void shouldAcceptNames() {
            assertThat(parse("-c", "a.yaml").config.getConfigPath()).isEqualTo(Path.of("a.yaml"));
            assertThat(parse("--config", "b.yaml").config.getConfigPath()).isEqualTo(Path.of("b.yaml"));
        }
    }

    @Nested
    @DisplayName("RandomSeedOption")
    class Seed {

        @Test
        @DisplayName("should keep an explicit seed")
        void shouldKeepExplicit() {
            RandomSeedOption option = parse("--seed", "42").seed;
            assertThat(option.isSeedSpecified()).isTrue();
            assertThat(option.getSeed()).isEqualTo(42L);
            assertThat(parse("-s", "-7").seed.getSeed()).isEqualTo(-7L);
        }

        @Test
        @DisplayName("should fall back to a time-based seed")
        void shouldFallBack() {
            RandomSeedOption option = parse().seed;
            long before = System.currentTimeMillis();
            assertThat(option.isSeedSpecified()).isFalse();
            assertThat(option.getSeed()).isGreaterThanOrEqualTo(before);
        }

        @Test
        @DisplayName("should reject a seed which is not a number")
        void shouldRejectNonNumeric() {
            assertThatThrownBy(() -> parse("--seed", "abc"))
                .isInstanceOf(CommandLine.ParameterException.class)
                .hasMessageContaining("--seed")
                .hasMessageContaining("abc");
        }
    }

    @Nested
    @DisplayName("VerbosityOption")
    class Verbosity {

        @Test
        @DisplayName("should map flags to log levels")
        void shouldMapLevels() {
            assertThat(parse().verbosity.logLevel()).isNull();
            assertThat(parse("-v").verbosity.logLevel()).isEqualTo(Level.DEBUG);
            assertThat(parse("-q").verbosity.logLevel()).isEqualTo(Level.WARN);
            assertThat(parse("-q").verbosity.showEvents()).isFalse();
        }

        @Test
        @DisplayName("should reject verbose together with quiet")
        void shouldRejectBoth() {
            VerbosityOption both = parse("-v", "-q").verbosity;
            assertThatThrownBy(both::validate).isInstanceOf(IllegalStateException.class);
            assertThatNoException().isThrownBy(parse("-v").verbosity::validate);
        }
    }
}
