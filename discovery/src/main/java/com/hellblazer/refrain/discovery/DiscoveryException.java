/*
 * Copyright (c) 2026 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.refrain.discovery;

/**
 * Signals a fatal condition during pattern discovery: a point lacking the onset component an algorithm depends on, or
 * an internal inconsistency such as a difference that the algorithm's own index should contain but does not. No
 * partial results are produced once this is thrown.
 *
 * @author hal.hildebrand
 */
public class DiscoveryException extends RuntimeException {

    /**
     * Creates a new discovery exception with the specified message.
     *
     * @param message the detail message
     */
    public DiscoveryException(String message) {
        super(message);
    }
}
