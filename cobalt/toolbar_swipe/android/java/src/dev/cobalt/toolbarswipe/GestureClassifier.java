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
 * Turns raw swipe samples into a {@link GestureDirection}, decides whether a drag starting on
 * the toolbar should be consumed, and whether a released drag completed.
 */
public class GestureClassifier {
    /**
     * The fraction of the tab preview that needs to be visible to consider the tab switching
     * gesture complete.
     */
    @VisibleForTesting static final double GESTURE_FINISH_PERCENT = 0.25;

    private final ToolbarSwipeConfig mConfig;

    public GestureClassifier(ToolbarSwipeConfig config) {
        mConfig = config;
    }

    /**
     * Picks the direction from the dominant axis of the first displacement. Ties go to the
     * vertical axis.
     *
     * @param dx {@code next.x - start.x}.
     * @param dy {@code next.y - start.y}.
     */
    public static GestureDirection classifyDirection(float dx, float dy) {
        if (Math.abs(dx) > Math.abs(dy)) {
            return dx < 0 ? GestureDirection.RIGHT_TO_LEFT : GestureDirection.LEFT_TO_RIGHT;
        }
        return dy < 0 ? GestureDirection.BOTTOM_TO_TOP : GestureDirection.TOP_TO_BOTTOM;
    }

    /**
     * @param start Where the finger went down.
     * @param next The first sample after {@code start}.
     * @param environment Keyboard state and toolbar geometry.
     * @return Whether the toolbar swipe should consume this gesture.
     */
    public boolean shouldConsume(
            GesturePoint start, GesturePoint next, SwipeEnvironment environment) {
        if (environment.isKeyboardVisible() || !isInToolbar(start, environment)) return false;

        float absDx = Math.abs(next.x - start.x);
        float absDy = Math.abs(next.y - start.y);
        float touchSlop = mConfig.getTouchSlop();
        return (absDx > touchSlop && absDy < absDx) || (absDy > touchSlop && absDx < absDy);
    }

    @VisibleForTesting
    static boolean isInToolbar(GesturePoint point, SwipeEnvironment environment) {
        ToolbarBounds bounds = environment.getToolbarBounds();
        // With gesture navigation the system gesture area overlaps the bottom of a bottom
        // toolbar, so the swipe area is made taller by that amount.
        if (environment.getToolbarPosition() == ToolbarPosition.BOTTOM) {
            int overlap =
                    environment.getMandatorySystemGestureInsetBottom()
                            - environment.getSystemWindowInsetBottom();
            if (overlap > 0) bounds = bounds.extendTop(overlap);
        }
        return bounds.contains(point.x, point.y);
    }

    /**
     * Checks whether a released gesture completed, meaning the user wants to switch to the next
     * tab. A gesture completes if the user flung in the gesture's direction, or if at least
     * {@link #GESTURE_FINISH_PERCENT} of the preview is on screen. A fling against the
     * gesture's direction always cancels it.
     *
     * @param session The released gesture.
     * @param velocity Release velocity along the gesture's axis, positive toward the right or
     *     bottom.
     * @param previewVisibleWidth How many px of the preview are inside the window.
     */
    public boolean isGestureComplete(
            GestureSession session, float velocity, float previewVisibleWidth) {
        boolean isFling = isFling(velocity);
        boolean reverseFling = isFling && !session.getDirection().matchesVelocity(velocity);
        if (reverseFling) return false;

        double visibleFraction = (double) previewVisibleWidth / session.getWindowWidth();
        return visibleFraction >= GESTURE_FINISH_PERCENT || isFling;
    }

    /** @return Whether {@code velocity} is fast enough to count as a fling. */
    public boolean isFling(float velocity) {
        return Math.abs(velocity) >= mConfig.getMinimumFlingVelocity();
    }
}
