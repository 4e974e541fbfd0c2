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

import java.util.Objects;

/**
 * Represents the transition between two states.
 *
 * @param <S> the state type
 */
public class Transition<S> {

    public final S fromState;
    public final S toState;

    public Transition(S fromState, S toState) {
        this.fromState = fromState;
        this.toState = toState;
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromState, toState);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final Transition<?> other = (Transition<?>) obj;
        return Objects.equals(fromState, other.fromState)
                && Objects.equals(toState, other.toState);
    }

    @Override
    public String toString() {
        return "Transition [fromState=" + fromState + ", toState=" + toState
                + "]";
    }

}
