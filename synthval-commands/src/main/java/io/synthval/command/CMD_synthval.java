package io.synthval.command;

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

import io.synthval.command.compare.CMD_compare;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Top-level synthval command.
///
/// This is an umbrella command; the work happens in its subcommands.
@CommandLine.Command(name = "synthval",
    header = "Validate synthetic survey data against real survey data",
    description = "Compares synthetic and real survey responses with a battery of statistical tests",
    mixinStandardHelpOptions = true,
    version = "synthval 0.1.0",
    subcommands = {
        CMD_compare.class,
        CommandLine.HelpCommand.class
    })
public class CMD_synthval implements Callable<Integer> {

    /// Run CMD_synthval
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(new CommandLine(new CMD_synthval()).execute(args));
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
