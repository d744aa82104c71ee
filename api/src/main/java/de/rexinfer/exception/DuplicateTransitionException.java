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

// Thrown when a transition is added whose (source, label, target) triple is already present in the graph.
public class DuplicateTransitionException extends RuntimeException {

    /**
     * Default constructor.
     *
     * @see RuntimeException#RuntimeException()
     */
    public DuplicateTransitionException() {
        super();
    }

    /**
     * Constructor.
     *
     * @see RuntimeException#RuntimeException(String, Throwable)
     */
    public DuplicateTransitionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructor.
     *
     * @see RuntimeException#RuntimeException(String)
     */
    public DuplicateTransitionException(String s) {
        super(s);
    }

    /**
     * Constructor.
     *
     * @see RuntimeException#RuntimeException(Throwable)
     */
    public DuplicateTransitionException(Throwable cause) {
        super(cause);
    }

}
