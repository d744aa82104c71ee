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
package de.rexinfer.exception;

/**
 * Thrown when the merge loop of a learner terminates without reaching a clash-free automaton. This always signals a
 * defect in the learner, never a problem with the input sample.
 */
public class LearnerInvariantException extends RuntimeException {

    /**
     * Default constructor.
     *
     * @see RuntimeException#RuntimeException()
     */
    public LearnerInvariantException() {
        super();
    }

    /**
     * Constructor.
     *
     * @see RuntimeException#RuntimeException(String, Throwable)
     */
    public LearnerInvariantException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructor.
     *
     * @see RuntimeException#RuntimeException(String)
     */
    public LearnerInvariantException(String s) {
        super(s);
    }

    /**
     * Constructor.
     *
     * @see RuntimeException#RuntimeException(Throwable)
     */
    public LearnerInvariantException(Throwable cause) {
        super(cause);
    }

}
