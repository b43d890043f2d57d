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

package dev.cobalt.toolbarswipe.view;

import android.animation.Animator;
import android.animation.AnimatorListenerAdapter;
import android.animation.ValueAnimator;
import android.util.Log;
import android.view.animation.DecelerateInterpolator;
import android.view.animation.Interpolator;
import dev.cobalt.toolbarswipe.SettleAnimationRunner;

/** {@link SettleAnimationRunner} playing each step on a {@link ValueAnimator}. */
public class AnimatorSettleAnimationRunner implements SettleAnimationRunner {
    private static final String TAG = "cobalt";

    private final Interpolator mInterpolator = new DecelerateInterpolator();

    private ValueAnimator mCurrentAnimator;

    @Override
    public void animate(
            float from, float to, long durationMs, UpdateListener listener, Runnable onEnd) {
        endCurrentAnimation();

        final ValueAnimator animator = ValueAnimator.ofFloat(from, to);
        animator.setDuration(durationMs);
        animator.setInterpolator(mInterpolator);
        animator.addUpdateListener(
                new ValueAnimator.AnimatorUpdateListener() {
                    @Override
                    public void onAnimationUpdate(ValueAnimator animation) {
                        listener.onAnimationUpdate((Float) animation.getAnimatedValue());
                    }
                });
        animator.addListener(
                new AnimatorListenerAdapter() {
                    @Override
                    public void onAnimationEnd(Animator animation) {
                        if (mCurrentAnimator == animator) mCurrentAnimator = null;
                        onEnd.run();
                    }
                });
        mCurrentAnimator = animator;
        animator.start();
    }

    @Override
    public void endAllAnimations() {
        while (mCurrentAnimator != null) endCurrentAnimation();
    }

    /** Jumps a running animation to its end value, running its end continuation. */
    public void endCurrentAnimation() {
        if (mCurrentAnimator == null) return;
        Log.d(TAG, "AnimatorSettleAnimationRunner ending running settle animation early.");
        ValueAnimator animator = mCurrentAnimator;
        mCurrentAnimator = null;
        animator.end();
    }
}
