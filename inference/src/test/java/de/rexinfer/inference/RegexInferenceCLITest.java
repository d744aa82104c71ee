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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class RegexInferenceCLITest {

    private ByteArrayOutputStream buffer;
    private PrintStream out;

    @BeforeMethod
    public void setUp() throws UnsupportedEncodingException {
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, "UTF-8");
    }

    @Test
    public void testExamplesFromArguments() {
        final int status = RegexInferenceCLI.run(new String[] {"-c", "b", "ab", "aab", "aaaab"}, out);

        Assert.assertEquals(status, RegexInferenceCLI.EXIT_OK);
        Assert.assertTrue(output().contains("Final Expression: [a*b]"), output());
    }

    @Test
    public void testExamplesFromFile() throws IOException {
        final Path file = Files.createTempFile("examples", ".txt");
        Files.write(file, "b\nab\naab\n".getBytes(StandardCharsets.UTF_8));

        final int status = RegexInferenceCLI.run(new String[] {file.toString()}, out);

        Assert.assertEquals(status, RegexInferenceCLI.EXIT_OK);
        Assert.assertTrue(output().contains("Final Expression: [a*b]"), output());
    }

    @Test
    public void testEmptyLineIsEmptyString() throws IOException {
        final Path file = Files.createTempFile("examples", ".txt");
        Files.write(file, "\n".getBytes(StandardCharsets.UTF_8));

        final int status = RegexInferenceCLI.run(new String[] {"-s", "none", file.toString()}, out);

        Assert.assertEquals(status, RegexInferenceCLI.EXIT_OK);
        Assert.assertTrue(output().contains("Final Expression: [ε]"), output());
    }

    @Test
    public void testEmptyFile() throws IOException {
        final Path file = Files.createTempFile("examples", ".txt");

        Assert.assertEquals(RegexInferenceCLI.run(new String[] {file.toString()}, out), RegexInferenceCLI.EXIT_ERROR);
        Assert.assertTrue(output().contains("No examples given"), output());
    }

    @Test
    public void testMissingFile() throws IOException {
        final Path dir = Files.createTempDirectory("rexinfer");
        final String missing = dir.resolve("missing.txt").toString();

        Assert.assertEquals(RegexInferenceCLI.run(new String[] {missing}, out), RegexInferenceCLI.EXIT_ERROR);
        Assert.assertTrue(output().contains("Unable to read file"), output());
    }

    @Test
    public void testMissingFileArgument() {
        Assert.assertEquals(RegexInferenceCLI.run(new String[] {"-v"}, out), RegexInferenceCLI.EXIT_ERROR);
        Assert.assertTrue(output().contains("Missing argument"), output());
    }

    @Test
    public void testUnknownSimplifier() {
        Assert.assertEquals(RegexInferenceCLI.run(new String[] {"-s", "magic", "-c", "a"}, out),
                            RegexInferenceCLI.EXIT_ERROR);
        Assert.assertTrue(output().contains("Unknown simplifier"), output());
    }

    @Test
    public void testSupplementaryCharacterOutput() {
        final int status = RegexInferenceCLI.run(new String[] {"-c", "\uD83D\uDE00", "\uD83D\uDE01"}, out);

        Assert.assertEquals(status, RegexInferenceCLI.EXIT_OK);
        Assert.assertTrue(output().contains("Final Expression: [\uD83D\uDE00|\uD83D\uDE01]"), output());
    }

    @Test
    public void testConsoleStreamIsUtf8() {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        RegexInferenceCLI.utf8(bytes).print("\u03B5\u2205");

        Assert.assertEquals(bytes.toByteArray(), "\u03B5\u2205".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testHelp() {
        Assert.assertEquals(RegexInferenceCLI.run(new String[] {"-h"}, out), RegexInferenceCLI.EXIT_OK);
        Assert.assertTrue(output().contains("usage"), output());
    }

    @Test
    public void testVerbose() {
        Assert.assertEquals(RegexInferenceCLI.run(new String[] {"-v", "-c", "a", "b"}, out), RegexInferenceCLI.EXIT_OK);
        Assert.assertTrue(output().contains("# prefix-tree"), output());
        Assert.assertTrue(output().contains("digraph"), output());
        Assert.assertTrue(output().contains("Final Expression: [a|b]"), output());
    }

    @Test
    public void testDotDirectory() throws IOException {
        final Path dir = Files.createTempDirectory("rexinfer").resolve("stages");

        final int status = RegexInferenceCLI.run(new String[] {"-d", dir.toString(), "-c", "b", "ab"}, out);

        Assert.assertEquals(status, RegexInferenceCLI.EXIT_OK);
        Assert.assertTrue(Files.exists(dir.resolve("00-prefix-tree.dot")));
        Assert.assertTrue(Files.exists(dir.resolve("03-uniform.dot")));
        try (Stream<Path> files = Files.list(dir)) {
            Assert.assertEquals(files.count(), 5L);
        }
        final String dot = new String(Files.readAllBytes(dir.resolve("00-prefix-tree.dot")), StandardCharsets.UTF_8);
        Assert.assertTrue(dot.contains("digraph"), dot);
    }

    private String output() {
        try {
            return buffer.toString("UTF-8");
        } catch (UnsupportedEncodingException e) {
            throw new IllegalStateException(e);
        }
    }
}
