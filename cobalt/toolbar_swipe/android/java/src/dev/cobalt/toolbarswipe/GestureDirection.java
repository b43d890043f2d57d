// Copyright 2026 The Cobalt Authors. All Rights Reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package dev.cobalt.toolbarswipe;

/** The direction the finger travels in, fixed for the lifetime of one toolbar swipe. */
public enum GestureDirection {
    LEFT_TO_RIGHT,
    RIGHT_TO_LEFT,
    TOP_TO_BOTTOM,
    BOTTOM_TO_TOP;

    /** @return Whether this direction runs along the x axis. */
    public boolean isHorizontal() {
        return this == LEFT_TO_RIGHT || this == RIGHT_TO_LEFT;
    }

    /**
     * Whether a release velocity along the primary axis agrees with this direction. Vertical
     * directions accept any velocity.
     *
     * @param velocity Velocity in px/s, positive toward the right.
     */
    boolean matchesVelocity(float velocity) {
        switch (this) {
            case RIGHT_TO_LEFT:
                return velocity <= 0;
            case LEFT_TO_RIGHT:
                return velocity >= 0;
            default:
                return true;
        }
    }
}
