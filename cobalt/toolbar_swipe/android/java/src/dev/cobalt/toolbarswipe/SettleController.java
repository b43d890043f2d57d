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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;

/**
 * Tracks the lifecycle of a toolbar swipe and, once it is released, plays the settle animation
 * and performs the one navigation it ends in.
 *
 * <p>Side effects happen strictly after the animation step before them: the tab is selected
 * once the content is off screen, and the metric is recorded once the preview has faded out.
 */
public class SettleController {
    /** Lifecycle of one gesture. */
    public enum State {
        IDLE,
        ARMED,
        UPDATING,
        COMPLETING,
        CANCELING
    }

    /** How a released gesture ends. */
    public enum Outcome {
        SWITCH_TAB,
        OPEN_TAB_TRAY,
        OPEN_NEW_TAB,
        CANCEL
    }

    /** Animation duration when switching to another tab. */
    @VisibleForTesting static final long FINISHED_GESTURE_ANIMATION_DURATION_MS = 250;

    /** Animation duration when the gesture is canceled because the swipe was not far enough. */
    @VisibleForTesting static final long CANCELED_GESTURE_ANIMATION_DURATION_MS = 200;

    /** Animation duration when the gesture is canceled by a fling. */
    @VisibleForTesting static final long CANCELED_FLING_ANIMATION_DURATION_MS = 150;

    private final ToolbarSwipeConfig mConfig;
    private final GestureClassifier mClassifier;
    private final SwipePreviewAnimator mAnimator;
    private final ContentSurface mContent;
    private final TabPreviewSurface mPreview;
    private final SettleAnimationRunner mAnimationRunner;
    private final TabSelector mTabSelector;
    private final TabSwipeNavigator mNavigator;
    private final ToolbarSwipeMetrics mMetrics;

    private State mState = State.IDLE;

    public SettleController(
            ToolbarSwipeConfig config,
            GestureClassifier classifier,
            SwipePreviewAnimator animator,
            ContentSurface content,
            TabPreviewSurface preview,
            SettleAnimationRunner animationRunner,
            TabSelector tabSelector,
            TabSwipeNavigator navigator,
            ToolbarSwipeMetrics metrics) {
        mConfig = config;
        mClassifier = classifier;
        mAnimator = animator;
        mContent = content;
        mPreview = preview;
        mAnimationRunner = animationRunner;
        mTabSelector = tabSelector;
        mNavigator = navigator;
        mMetrics = metrics;
    }

    public State getState() {
        return mState;
    }

    public boolean isIdle() {
        return mState == State.IDLE;
    }

    /** @return Whether a gesture is armed and still following the finger. */
    public boolean isTracking() {
        return mState == State.ARMED || mState == State.UPDATING;
    }

    /** Called when a new gesture has been accepted. */
    public void onArmed() {
        checkState(mState == State.IDLE, "Gesture armed while in state %s", mState);
        mState = State.ARMED;
    }

    /** Called for each drag sample of the armed gesture. */
    public void onUpdated() {
        checkState(isTracking(), "Gesture updated while in state %s", mState);
        mState = State.UPDATING;
    }

    /**
     * Decides how a released gesture ends, without side effects.
     *
     * @param session The released gesture.
     * @param destination The destination re-resolved at release.
     * @param velocity Release velocity along the gesture's axis.
     */
    public Outcome decide(GestureSession session, SwipeDestination destination, float velocity) {
        GestureDirection direction = session.getDirection();
        switch (destination.getType()) {
            case TAB:
                return isGestureComplete(session, velocity) ? Outcome.SWITCH_TAB : Outcome.CANCEL;
            case TRAY:
                return direction == session.getToolbarPosition().getTrayDirection()
                        ? Outcome.OPEN_TAB_TRAY
                        : Outcome.CANCEL;
            case NONE:
                if (isSwipeTowardNextTab(session) && isGestureComplete(session, velocity)) {
                    return Outcome.OPEN_NEW_TAB;
                }
                return Outcome.CANCEL;
            default:
                throw new IllegalStateException("Unknown destination " + destination);
        }
    }

    /**
     * Settles a released gesture.
     *
     * @param session The released gesture.
     * @param destination The destination re-resolved at release.
     * @param velocityX Release velocity in px/s along x.
     * @param velocityY Release velocity in px/s along y.
     * @param onSettled Runs once the gesture is fully resolved, after every animation.
     */
    public void settle(
            GestureSession session,
            SwipeDestination destination,
            float velocityX,
            float velocityY,
            Runnable onSettled) {
        checkState(isTracking(), "Gesture released while in state %s", mState);
        float velocity = session.getDirection().isHorizontal() ? velocityX : velocityY;
        switch (decide(session, destination, velocity)) {
            case SWITCH_TAB:
                animateToNextTab(session, destination.getTabId(), onSettled);
                break;
            case OPEN_TAB_TRAY:
                mState = State.COMPLETING;
                mNavigator.navigateToTabTray(
                        TabTrayPage.forBrowsingMode(session.getBrowsingMode()));
                finish(onSettled);
                break;
            case OPEN_NEW_TAB:
                mState = State.COMPLETING;
                mContent.setTranslationX(0f);
                // A tab staged earlier in the drag may have been closed before release.
                mPreview.setVisible(false);
                mNavigator.navigateToNewTab(true);
                finish(onSettled);
                break;
            case CANCEL:
                animateCanceledGesture(session, velocity, onSettled);
                break;
        }
    }

    private boolean isGestureComplete(GestureSession session, float velocity) {
        float visibleWidth =
                SwipePreviewAnimator.getVisiblePreviewWidth(session, mPreview.getWidth());
        return mClassifier.isGestureComplete(session, velocity, visibleWidth);
    }

    /** Right to left in LTR, left to right in RTL: toward the side new tabs are added on. */
    private static boolean isSwipeTowardNextTab(GestureSession session) {
        GestureDirection direction = session.getDirection();
        return session.isLayoutRtl()
                ? direction == GestureDirection.LEFT_TO_RIGHT
                : direction == GestureDirection.RIGHT_TO_LEFT;
    }

    private void animateToNextTab(GestureSession session, int tabId, Runnable onSettled) {
        mState = State.COMPLETING;
        // Finish animating the content off screen and the preview on screen.
        mAnimationRunner.animate(
                session.getContentOffset(),
                mAnimator.getCompletedContentOffset(session),
                FINISHED_GESTURE_ANIMATION_DURATION_MS,
                value -> moveSurfaces(session, value),
                () -> {
                    mContent.setTranslationX(0f);
                    mTabSelector.selectTab(tabId);
                    fadeOutPreview(onSettled);
                });
    }

    // Fades out the preview to prevent flickering while the selected tab draws.
    private void fadeOutPreview(Runnable onSettled) {
        mAnimationRunner.animate(
                mPreview.getAlpha(),
                0f,
                mConfig.getFadeOutDurationMs(),
                mPreview::setAlpha,
                () -> {
                    mPreview.setVisible(false);
                    mMetrics.recordToolbarTabSwipe();
                    finish(onSettled);
                });
    }

    private void animateCanceledGesture(
            GestureSession session, float velocity, Runnable onSettled) {
        mState = State.CANCELING;
        long duration =
                mClassifier.isFling(velocity)
                        ? CANCELED_FLING_ANIMATION_DURATION_MS
                        : CANCELED_GESTURE_ANIMATION_DURATION_MS;
        mAnimationRunner.animate(
                session.getContentOffset(),
                0f,
                duration,
                value -> moveSurfaces(session, value),
                () -> {
                    mPreview.setVisible(false);
                    finish(onSettled);
                });
    }

    private void moveSurfaces(GestureSession session, float contentOffset) {
        mContent.setTranslationX(contentOffset);
        mPreview.setTranslationX(mAnimator.getPreviewOffsetForContent(session, contentOffset));
    }

    private void finish(Runnable onSettled) {
        mState = State.IDLE;
        onSettled.run();
    }
}
