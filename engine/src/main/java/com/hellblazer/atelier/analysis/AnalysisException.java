/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Atelier.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.atelier.analysis;

/**
 * Exception thrown when an analysis response cannot be understood.
 */
public class AnalysisException extends Exception {

    /**
     * Creates a new analysis exception with the specified message.
     *
     * @param message the detail message
     */
    public AnalysisException(String message) {
        super(message);
    }

    /**
     * Creates a new analysis exception with the specified message and cause.
     *
     * @param message the detail message
     * @param cause   the underlying cause
     */
    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates a new analysis exception with the specified cause.
     *
     * @param cause the underlying cause
     */
    public AnalysisException(Throwable cause) {
        super(cause);
    }
}
