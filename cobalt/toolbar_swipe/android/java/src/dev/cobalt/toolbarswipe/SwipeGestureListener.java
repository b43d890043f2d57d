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

/**
 * Receives the start, updates and end of a swipe from the raw touch recognizer. Calls arrive in
 * order on the UI thread and never overlap.
 */
public interface SwipeGestureListener {
    /**
     * Called with the first two samples of a drag.
     *
     * @param start Where the finger went down.
     * @param next The first sample after {@code start}.
     * @return Whether the listener consumes the rest of this gesture.
     */
    boolean onSwipeStarted(GesturePoint start, GesturePoint next);

    /**
     * Called for each further sample of a consumed gesture.
     *
     * @param distanceX Distance along x since the last sample, positive when the finger moved
     *     left (same convention as {@code GestureDetector.OnGestureListener#onScroll}).
     * @param distanceY Distance along y since the last sample, positive when the finger moved
     *     up.
     */
    void onSwipeUpdate(float distanceX, float distanceY);

    /**
     * Called when the finger is lifted.
     *
     * @param velocityX Release velocity in px/s, positive toward the right.
     * @param velocityY Release velocity in px/s, positive toward the bottom.
     */
    void onSwipeFinished(float velocityX, float velocityY);
}
