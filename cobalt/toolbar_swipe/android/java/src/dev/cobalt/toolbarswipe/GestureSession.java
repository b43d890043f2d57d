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
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Locale;

/**
 * State of one toolbar swipe, from the accepted start sample until the settle animation ends.
 * Instances are immutable; each drag sample produces a new session. Layout facts are captured
 * when the gesture arms so a configuration change mid-drag cannot flip the gesture.
 */
public final class GestureSession {
    private final GestureDirection mDirection;
    private final GesturePoint mStart;
    private final int mWindowWidth;
    private final boolean mIsLayoutRtl;
    private final ToolbarPosition mToolbarPosition;
    private final BrowsingMode mBrowsingMode;
    private final float mPreviewOffset;
    private final float mContentOffset;
    private final int mStagedTabId;

    private GestureSession(
            GestureDirection direction,
            GesturePoint start,
            int windowWidth,
            boolean isLayoutRtl,
            ToolbarPosition toolbarPosition,
            BrowsingMode browsingMode,
            float previewOffset,
            float contentOffset,
            int stagedTabId) {
        checkArgument(windowWidth > 0, "Window width must be positive: %s", windowWidth);
        mDirection = checkNotNull(direction);
        mStart = checkNotNull(start);
        mWindowWidth = windowWidth;
        mIsLayoutRtl = isLayoutRtl;
        mToolbarPosition = checkNotNull(toolbarPosition);
        mBrowsingMode = checkNotNull(browsingMode);
        mPreviewOffset = previewOffset;
        mContentOffset = contentOffset;
        mStagedTabId = stagedTabId;
    }

    /**
     * Creates the session of a gesture that has just been armed.
     *
     * @param direction The direction classified from the first two samples.
     * @param start Where the finger went down.
     * @param environment Read once here, never again for this gesture.
     * @param contentOffset The content surface's offset when the gesture armed.
     */
    public static GestureSession start(
            GestureDirection direction,
            GesturePoint start,
            SwipeEnvironment environment,
            float contentOffset) {
        return new GestureSession(
                direction,
                start,
                environment.getWindowWidth(),
                environment.isLayoutRtl(),
                environment.getToolbarPosition(),
                environment.getBrowsingMode(),
                0f,
                contentOffset,
                TabsView.INVALID_TAB_ID);
    }

    public GestureDirection getDirection() {
        return mDirection;
    }

    public GesturePoint getStart() {
        return mStart;
    }

    public int getWindowWidth() {
        return mWindowWidth;
    }

    public boolean isLayoutRtl() {
        return mIsLayoutRtl;
    }

    public ToolbarPosition getToolbarPosition() {
        return mToolbarPosition;
    }

    public BrowsingMode getBrowsingMode() {
        return mBrowsingMode;
    }

    /** @return Horizontal offset of the preview surface in px. */
    public float getPreviewOffset() {
        return mPreviewOffset;
    }

    /** @return Horizontal offset of the content surface in px. */
    public float getContentOffset() {
        return mContentOffset;
    }

    /** @return The tab whose thumbnail the preview shows, or {@link TabsView#INVALID_TAB_ID}. */
    public int getStagedTabId() {
        return mStagedTabId;
    }

    public boolean hasStagedPreview() {
        return mStagedTabId != TabsView.INVALID_TAB_ID;
    }

    GestureSession withOffsets(float previewOffset, float contentOffset) {
        return new GestureSession(
                mDirection,
                mStart,
                mWindowWidth,
                mIsLayoutRtl,
                mToolbarPosition,
                mBrowsingMode,
                previewOffset,
                contentOffset,
                mStagedTabId);
    }

    GestureSession withStagedTab(int tabId, float previewOffset) {
        return new GestureSession(
                mDirection,
                mStart,
                mWindowWidth,
                mIsLayoutRtl,
                mToolbarPosition,
                mBrowsingMode,
                previewOffset,
                mContentOffset,
                tabId);
    }

    @Override
    public String toString() {
        return String.format(
                Locale.US,
                "GestureSession(%s, preview=%.1f, content=%.1f, staged=%d)",
                mDirection,
                mPreviewOffset,
                mContentOffset,
                mStagedTabId);
    }
}
