/**
 * Copyright (C) 2016, BMW AG
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.bmw.discretehmm;

/**
 * Thrown when an observation or state index lies outside of its declared domain.
 * The check happens before any computation starts.
 */
public class InvalidIndexException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final int index;
    private final int position;
    private final int bound;

    /**
     * @param position position in the sequence or -1 if the index is not part of a sequence
     */
    public InvalidIndexException(String kind, int index, int position, int bound) {
        super(message(kind, index, position, bound));
        this.index = index;
        this.position = position;
        this.bound = bound;
    }

    private static String message(String kind, int index, int position, int bound) {
        final String where = position < 0 ? "" : " at position " + position;
        return kind + " index " + index + where + " is outside of [0, " + bound + ").";
    }

    public int getIndex() {
        return index;
    }

    public int getPosition() {
        return position;
    }

    public int getBound() {
        return bound;
    }

}
