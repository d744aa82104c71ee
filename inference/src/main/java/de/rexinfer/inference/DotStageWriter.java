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

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import de.rexinfer.datastructure.graph.GraphSnapshot;
import de.rexinfer.datastructure.graph.SnapshotListener;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints and/or stores the automata of the individual pipeline stages in DOT format. Instances created from the same
 * counter number their files consecutively, so the learner and the extractor stages end up in pipeline order.
 *
 * @param <L>
 *         transition label type
 */
class DotStageWriter<L> implements SnapshotListener<L> {

    private static final Logger LOGGER = LoggerFactory.getLogger(DotStageWriter.class);

    private final AtomicInteger counter;
    private final @Nullable PrintStream verboseOut;
    private final @Nullable Path directory;

    DotStageWriter(AtomicInteger counter, @Nullable PrintStream verboseOut, @Nullable Path directory) {
        this.counter = counter;
        this.verboseOut = verboseOut;
        this.directory = directory;
    }

    @Override
    public void onSnapshot(String stage, GraphSnapshot<L> snapshot) {
        final int index = counter.getAndIncrement();

        if (verboseOut != null) {
            verboseOut.println("# " + stage + " (" + snapshot.size() + " states)");
            verboseOut.println(snapshot.toDOT());
        }

        if (directory != null) {
            final Path file = directory.resolve(String.format("%02d-%s.dot", index, stage));
            try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                snapshot.writeDOT(w);
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to write " + file, e);
            }
            LOGGER.debug("Wrote stage '{}' to {}", stage, file);
        }
    }
}
