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

import com.google.common.annotations.VisibleForTesting;

/**
 * Computes where the content and preview surfaces sit while a toolbar swipe is dragged and
 * settled. All methods are pure; {@link ToolbarGestureHandler} pushes the results to the
 * surfaces.
 */
public class SwipePreviewAnimator {
    /**
     * The fraction of the content that can be hidden by the tab switching gesture if there is no
     * tab to switch to.
     */
    @VisibleForTesting static final float OVERSCROLL_HIDE_PERCENT = 0.20f;

    private final float mPreviewOffset;

    public SwipePreviewAnimator(ToolbarSwipeConfig config) {
        mPreviewOffset = config.getPreviewOffset();
    }

    /**
     * @return Distance from the resting position to fully off screen: one window width plus the
     *     gap between content and preview.
     */
    public float getTravelDistance(GestureSession session) {
        return session.getWindowWidth() + mPreviewOffset;
    }

    /**
     * @return Where a freshly staged preview waits, just outside the window edge the gesture
     *     pulls it in from.
     */
    public float getStagedPreviewOffset(GestureSession session) {
        switch (session.getDirection()) {
            case RIGHT_TO_LEFT:
                return getTravelDistance(session);
            case LEFT_TO_RIGHT:
                return -getTravelDistance(session);
            default:
                return 0f;
        }
    }

    /**
     * Moves the preview to show {@code destination}. The first staging parks the preview outside
     * the window; staging a different tab later keeps the preview where the drag left it.
     *
     * @return The session with the staged tab recorded.
     */
    public GestureSession stagePreview(
            GestureSession session, SwipeDestination destination, TabPreviewSurface preview) {
        assert destination.isTab();
        float previewOffset =
                session.hasStagedPreview()
                        ? session.getPreviewOffset()
                        : getStagedPreviewOffset(session);

        preview.loadPreviewThumbnail(destination.getTabId(), destination.isPrivate());
        preview.setAlpha(1f);
        preview.setTranslationX(previewOffset);
        preview.setVisible(true);
        return session.withStagedTab(destination.getTabId(), previewOffset);
    }

    /**
     * Applies one drag sample. The new offsets are derived from the current ones, so clamping
     * at one step carries into the next.
     *
     * @param session The gesture before this sample.
     * @param destination What the gesture targets now.
     * @param distanceX Distance since the last sample, positive when the finger moved left.
     * @param contentWidth Width of the content surface, bounds the rubber band.
     * @return The gesture after this sample.
     */
    public GestureSession applyDrag(
            GestureSession session,
            SwipeDestination destination,
            float distanceX,
            int contentWidth) {
        GestureDirection direction = session.getDirection();
        if (!direction.isHorizontal()) return session;

        float content = session.getContentOffset() - distanceX;
        float preview = session.getPreviewOffset() - distanceX;
        switch (destination.getType()) {
            case TAB: {
                // Restrict the range of motion so a swipe started in one direction can't drag the
                // content off screen on the other side.
                float travel = getTravelDistance(session);
                if (direction == GestureDirection.RIGHT_TO_LEFT) {
                    return session.withOffsets(
                            clamp(preview, 0f, travel), clamp(content, -travel, 0f));
                }
                return session.withOffsets(
                        clamp(preview, -travel, 0f), clamp(content, 0f, travel));
            }
            case NONE: {
                // No tab to switch to, only move far enough to show the end of the list.
                float maxContentHidden = contentWidth * OVERSCROLL_HIDE_PERCENT;
                if (direction == GestureDirection.RIGHT_TO_LEFT) {
                    return session.withOffsets(
                            session.getPreviewOffset(), clamp(content, -maxContentHidden, 0f));
                }
                return session.withOffsets(
                        session.getPreviewOffset(), clamp(content, 0f, maxContentHidden));
            }
            default:
                return session;
        }
    }

    /**
     * @return Where the preview sits while a settle animation moves the content to
     *     {@code contentOffset}; the two surfaces travel together, one travel distance apart.
     */
    public float getPreviewOffsetForContent(GestureSession session, float contentOffset) {
        switch (session.getDirection()) {
            case RIGHT_TO_LEFT:
                return contentOffset + getTravelDistance(session);
            case LEFT_TO_RIGHT:
                return contentOffset - getTravelDistance(session);
            default:
                return 0f;
        }
    }

    /** @return Where the content ends up when a tab switch completes. */
    public float getCompletedContentOffset(GestureSession session) {
        switch (session.getDirection()) {
            case RIGHT_TO_LEFT:
                return -getTravelDistance(session);
            case LEFT_TO_RIGHT:
                return getTravelDistance(session);
            default:
                return 0f;
        }
    }

    /**
     * @return How many px of a preview of width {@code previewWidth} are inside the window, given
     *     the session's preview offset.
     */
    public static float getVisiblePreviewWidth(GestureSession session, int previewWidth) {
        float left = session.getPreviewOffset();
        float visible = left < 0 ? left + previewWidth : session.getWindowWidth() - left;
        return clamp(visible, 0f, session.getWindowWidth());
    }

    private static float clamp(float value, float min, float max) {
        return Math.max(min, Math.min(max, value));
    }
}
