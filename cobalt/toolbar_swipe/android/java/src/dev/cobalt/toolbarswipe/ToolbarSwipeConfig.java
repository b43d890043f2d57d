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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Device-dependent thresholds of the toolbar swipe. On Android these come from
 * {@code ViewConfiguration} and resources, see
 * {@link dev.cobalt.toolbarswipe.view.ToolbarSwipeViewConfiguration}.
 */
public final class ToolbarSwipeConfig {
    // Matches the framework default of android.R.integer.config_shortAnimTime.
    static final long DEFAULT_FADE_OUT_DURATION_MS = 200;

    private final float mTouchSlop;
    private final float mMinimumFlingVelocity;
    private final float mPreviewOffset;
    private final long mFadeOutDurationMs;

    private ToolbarSwipeConfig(Builder builder) {
        mTouchSlop = builder.mTouchSlop;
        mMinimumFlingVelocity = builder.mMinimumFlingVelocity;
        mPreviewOffset = builder.mPreviewOffset;
        mFadeOutDurationMs = builder.mFadeOutDurationMs;
    }

    /** @return Distance in px a touch may wander before it counts as a drag. */
    public float getTouchSlop() {
        return mTouchSlop;
    }

    /** @return Smallest release velocity, in px/s, treated as a fling. */
    public float getMinimumFlingVelocity() {
        return mMinimumFlingVelocity;
    }

    /** @return Gap in px between the edge of the window and a staged preview. */
    public float getPreviewOffset() {
        return mPreviewOffset;
    }

    /** @return Duration of the preview fade out that ends a tab switch. */
    public long getFadeOutDurationMs() {
        return mFadeOutDurationMs;
    }

    /** Builder for {@link ToolbarSwipeConfig}. */
    public static final class Builder {
        private float mTouchSlop;
        private float mMinimumFlingVelocity;
        private float mPreviewOffset;
        private long mFadeOutDurationMs = DEFAULT_FADE_OUT_DURATION_MS;

        public Builder setTouchSlop(float touchSlop) {
            mTouchSlop = touchSlop;
            return this;
        }

        public Builder setMinimumFlingVelocity(float minimumFlingVelocity) {
            mMinimumFlingVelocity = minimumFlingVelocity;
            return this;
        }

        public Builder setPreviewOffset(float previewOffset) {
            mPreviewOffset = previewOffset;
            return this;
        }

        public Builder setFadeOutDurationMs(long fadeOutDurationMs) {
            mFadeOutDurationMs = fadeOutDurationMs;
            return this;
        }

        public ToolbarSwipeConfig build() {
            checkArgument(mTouchSlop >= 0, "Touch slop must not be negative: %s", mTouchSlop);
            checkArgument(
                    mMinimumFlingVelocity > 0,
                    "Minimum fling velocity must be positive: %s",
                    mMinimumFlingVelocity);
            checkArgument(
                    mPreviewOffset >= 0, "Preview offset must not be negative: %s", mPreviewOffset);
            checkArgument(
                    mFadeOutDurationMs >= 0,
                    "Fade out duration must not be negative: %s",
                    mFadeOutDurationMs);
            return new ToolbarSwipeConfig(this);
        }
    }
}
