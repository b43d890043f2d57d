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

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * {@link SettleAnimationRunner} that holds each animation until the test ends it, so tests can
 * observe the surfaces between the steps of a settle.
 */
class FakeSettleAnimationRunner implements SettleAnimationRunner {
    /** One requested animation. */
    static final class Animation {
        final float from;
        final float to;
        final long durationMs;
        private final UpdateListener mListener;
        private final Runnable mOnEnd;

        private Animation(
                float from, float to, long durationMs, UpdateListener listener, Runnable onEnd) {
            this.from = from;
            this.to = to;
            this.durationMs = durationMs;
            mListener = listener;
            mOnEnd = onEnd;
        }

        /** Delivers an intermediate value without ending the animation. */
        void update(float value) {
            mListener.onAnimationUpdate(value);
        }
    }

    private final Deque<Animation> mHistory = new ArrayDeque<>();
    private Animation mRunning;

    @Override
    public void animate(
            float from, float to, long durationMs, UpdateListener listener, Runnable onEnd) {
        if (mRunning != null) end();
        mRunning = new Animation(from, to, durationMs, listener, onEnd);
        mHistory.addLast(mRunning);
    }

    boolean isRunning() {
        return mRunning != null;
    }

    Animation getRunning() {
        return mRunning;
    }

    /** @return How many animations were requested so far. */
    int getAnimationCount() {
        return mHistory.size();
    }

    /** Jumps the running animation to its end value and runs its continuation. */
    void end() {
        Animation animation = mRunning;
        if (animation == null) throw new IllegalStateException("No running animation");
        mRunning = null;
        animation.mListener.onAnimationUpdate(animation.to);
        animation.mOnEnd.run();
    }

    @Override
    public void endAllAnimations() {
        while (mRunning != null) end();
    }
}
