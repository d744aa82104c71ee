/* Copyright (C) 2026 The rexinfer Authors
 * This file is part of rexinfer.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.rexinfer.inference;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

import de.rexinfer.datastructure.regex.RegexSimplifier;
import de.rexinfer.datastructure.regex.RegexSimplifiers;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Command line front end: learns a 0-reversible automaton from a list of examples and prints the regular expression
 * extracted from it.
 * <p>
 * Examples are read from the file given as last argument, one per line (an empty line denotes the empty string), or,
 * with {@code -c}, from the remaining arguments.
 */
public final class RegexInferenceCLI {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;

    private static final String USAGE = "rexinfer [-h] [-v] [-s none|nested|extended] [-d <dir>] (-c <examples...> | <file>)";

    private RegexInferenceCLI() {
        // prevent instantiation
    }

    public static void main(String[] args) {
        System.exit(run(args, utf8(new FileOutputStream(FileDescriptor.out))));
    }

    /**
     * Wraps the given stream so that the expression markers print independently of the platform charset.
     */
    static PrintStream utf8(OutputStream out) {
        return new PrintStream(out, true, StandardCharsets.UTF_8);
    }

    static int run(String[] args, PrintStream out) {
        final Options options = options();
        final HelpFormatter formatter = new HelpFormatter();
        final CommandLineParser parser = new DefaultParser();

        final CommandLine cmd;
        try {
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            out.println(e.getMessage());
            printHelp(formatter, options, out);
            return EXIT_ERROR;
        }

        if (cmd.hasOption("help")) {
            printHelp(formatter, options, out);
            return EXIT_OK;
        }

        final Config config;
        try {
            config = new Config(cmd);
        } catch (IllegalArgumentException e) {
            out.println(e.getMessage());
            printHelp(formatter, options, out);
            return EXIT_ERROR;
        } catch (IOException e) {
            out.println(e);
            out.println("Unable to read file [" + cmd.getArgList().get(cmd.getArgList().size() - 1) + "]. Exiting.");
            return EXIT_ERROR;
        }

        if (config.examples.isEmpty()) {
            out.println("No examples given. Exiting.");
            return EXIT_ERROR;
        }

        try {
            if (config.dotDirectory != null) {
                Files.createDirectories(config.dotDirectory);
            }
            final AtomicInteger counter = new AtomicInteger();
            final PrintStream verboseOut = config.verbose ? out : null;
            final RegexInference<String> inference =
                    new RegexInference<>(config.simplifier,
                                         new DotStageWriter<>(counter, verboseOut, config.dotDirectory),
                                         new DotStageWriter<>(counter, verboseOut, config.dotDirectory));

            final InferenceResult<String> result = inference.infer(RegexInference.toWords(config.examples));
            out.println("Final Expression: [" + result + "]");
            return EXIT_OK;
        } catch (IOException | UncheckedIOException e) {
            out.println(e.getMessage());
            return EXIT_ERROR;
        }
    }

    private static Options options() {
        final Options options = new Options();
        options.addOption("h", "help", false, "print this message");
        options.addOption("v", "verbose", false, "print the automaton of every stage in DOT format");
        options.addOption("c", "command-line", false, "read the examples from the remaining arguments");
        options.addOption("s", "simplifier", true, "expression simplification: none, nested (default) or extended");
        options.addOption("d", "dot-dir", true, "directory to store the automaton of every stage as DOT file");
        return options;
    }

    private static void printHelp(HelpFormatter formatter, Options options, PrintStream out) {
        final PrintWriter pw = new PrintWriter(out);
        formatter.printHelp(pw,
                            formatter.getWidth(),
                            USAGE,
                            null,
                            options,
                            formatter.getLeftPadding(),
                            formatter.getDescPadding(),
                            null);
        pw.flush();
    }

    static final class Config {

        final boolean verbose;
        final RegexSimplifier<String> simplifier;
        final @Nullable Path dotDirectory;
        final List<String> examples;

        Config(CommandLine cmd) throws IOException {
            this.verbose = cmd.hasOption("verbose");
            this.simplifier = simplifier(cmd.getOptionValue("simplifier", "nested"));

            final String dir = cmd.getOptionValue("dot-dir");
            this.dotDirectory = dir == null ? null : Paths.get(dir);

            final List<String> arguments = cmd.getArgList();
            if (cmd.hasOption("command-line")) {
                this.examples = arguments;
            } else {
                if (arguments.isEmpty()) {
                    throw new IllegalArgumentException("Missing argument: filepath");
                }
                this.examples = Files.readAllLines(Paths.get(arguments.get(arguments.size() - 1)),
                                                   StandardCharsets.UTF_8);
            }
        }

        private static RegexSimplifier<String> simplifier(String name) {
            switch (name.toLowerCase(Locale.ROOT)) {
                case "none":
                    return RegexSimplifiers.structural();
                case "nested":
                    return RegexSimplifiers.nested();
                case "extended":
                    return RegexSimplifiers.nestedExtended();
                default:
                    throw new IllegalArgumentException("Unknown simplifier: " + name);
            }
        }
    }
}
