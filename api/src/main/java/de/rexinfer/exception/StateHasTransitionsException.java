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

// Thrown when a state is removed while transitions still enter or leave it.
public class StateHasTransitionsException extends RuntimeException {

    /**
     * Default constructor.
     *
     * @see RuntimeException#RuntimeException()
     */
    public StateHasTransitionsException() {
        super();
    }

    /**
     * Constructor.
     *
     * @see RuntimeException#RuntimeException(String, Throwable)
     */
    public StateHasTransitionsException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructor.
     *
     * @see RuntimeException#RuntimeException(String)
     */
    public StateHasTransitionsException(String s) {
        super(s);
    }

    /**
     * Constructor.
     *
     * @see RuntimeException#RuntimeException(Throwable)
     */
    public StateHasTransitionsException(Throwable cause) {
        super(cause);
    }

}
