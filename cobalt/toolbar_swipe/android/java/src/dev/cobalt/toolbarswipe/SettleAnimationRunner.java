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
 * Plays the animations that settle a released toolbar swipe. Implementations return immediately
 * and call back later on the UI thread.
 */
public interface SettleAnimationRunner {
    /** Receives each animated value. */
    interface UpdateListener {
        void onAnimationUpdate(float value);
    }

    /**
     * Animates a value from {@code from} to {@code to}. An animation this runner is still
     * playing is first jumped to its end, so its {@code onEnd} still runs exactly once.
     *
     * @param from Start value.
     * @param to End value, always delivered to {@code listener} before {@code onEnd} runs.
     * @param durationMs Duration of the animation.
     * @param listener Receives every frame's value.
     * @param onEnd Runs once after the last frame.
     */
    void animate(float from, float to, long durationMs, UpdateListener listener, Runnable onEnd);

    /**
     * Jumps the running animation to its end, then does the same for every animation its
     * {@code onEnd} starts, until nothing is running.
     */
    void endAllAnimations();
}
