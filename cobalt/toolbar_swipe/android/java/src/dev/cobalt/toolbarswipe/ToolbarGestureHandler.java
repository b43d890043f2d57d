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

/**
 * Handles swipe gestures that start on the toolbar: horizontal swipes switch to the adjacent
 * tab, or open a new tab past the last one, and a vertical swipe toward the toolbar's edge opens
 * the tab tray.
 *
 * <p>Each drag sample flows through the {@link DestinationResolver} and then the
 * {@link SwipePreviewAnimator}; the release is handed to the {@link SettleController}.
 */
public class ToolbarGestureHandler implements SwipeGestureListener {
    private final SwipeEnvironment mEnvironment;
    private final ContentSurface mContent;
    private final TabPreviewSurface mPreview;
    private final GestureClassifier mClassifier;
    private final DestinationResolver mResolver;
    private final SwipePreviewAnimator mAnimator;
    private final SettleController mSettleController;
    private final SettleAnimationRunner mAnimationRunner;

    // Null between gestures.
    private GestureSession mSession;

    /**
     * @param config Device thresholds.
     * @param environment Geometry and UI state, read when a gesture starts.
     * @param tabsView The tab list swipes move through.
     * @param content The current page's view.
     * @param preview The view that shows the tab being swiped to.
     * @param animationRunner Plays the settle animations.
     * @param tabSelector Selects the tab a completed swipe lands on.
     * @param navigator Opens the tab tray or a new tab.
     * @param metrics Records completed tab switches.
     */
    public ToolbarGestureHandler(
            ToolbarSwipeConfig config,
            SwipeEnvironment environment,
            TabsView tabsView,
            ContentSurface content,
            TabPreviewSurface preview,
            SettleAnimationRunner animationRunner,
            TabSelector tabSelector,
            TabSwipeNavigator navigator,
            ToolbarSwipeMetrics metrics) {
        mEnvironment = environment;
        mContent = content;
        mPreview = preview;
        mAnimationRunner = animationRunner;
        mClassifier = new GestureClassifier(config);
        mResolver = new DestinationResolver(tabsView);
        mAnimator = new SwipePreviewAnimator(config);
        mSettleController =
                new SettleController(
                        config,
                        mClassifier,
                        mAnimator,
                        content,
                        preview,
                        animationRunner,
                        tabSelector,
                        navigator,
                        metrics);
    }

    @Override
    public boolean onSwipeStarted(GesturePoint start, GesturePoint next) {
        // A gesture still settling from the previous release owns the surfaces.
        if (!mSettleController.isIdle()) return false;
        if (!mClassifier.shouldConsume(start, next, mEnvironment)) return false;

        GestureDirection direction =
                GestureClassifier.classifyDirection(next.x - start.x, next.y - start.y);
        GestureSession session =
                GestureSession.start(direction, start, mEnvironment, mContent.getTranslationX());
        mSession = stageIfNeeded(session, mResolver.resolve(session));
        mSettleController.onArmed();
        return true;
    }

    @Override
    public void onSwipeUpdate(float distanceX, float distanceY) {
        GestureSession session = getActiveSession();
        mSettleController.onUpdated();

        SwipeDestination destination = mResolver.resolve(session);
        session = stageIfNeeded(session, destination);
        session = mAnimator.applyDrag(session, destination, distanceX, mContent.getWidth());
        mContent.setTranslationX(session.getContentOffset());
        if (session.hasStagedPreview()) mPreview.setTranslationX(session.getPreviewOffset());
        mSession = session;
    }

    @Override
    public void onSwipeFinished(float velocityX, float velocityY) {
        GestureSession session = getActiveSession();

        // The tab list may have changed since the last update.
        SwipeDestination destination = mResolver.resolve(session);
        session = stageIfNeeded(session, destination);
        mSession = session;
        mSettleController.settle(session, destination, velocityX, velocityY, () -> mSession = null);
    }

    /**
     * Finishes a gesture that is still settling right away, so the tab it switches to is
     * selected before the window goes away. A gesture still being dragged is left alone.
     */
    public void destroy() {
        mAnimationRunner.endAllAnimations();
    }

    /** @return The gesture in progress or settling, null between gestures. */
    public GestureSession getSession() {
        return mSession;
    }

    public SettleController.State getState() {
        return mSettleController.getState();
    }

    private GestureSession getActiveSession() {
        checkState(
                mSession != null && mSettleController.isTracking(),
                "No toolbar swipe in progress");
        return mSession;
    }

    // Loads the preview whenever the gesture targets a tab the preview doesn't show yet.
    private GestureSession stageIfNeeded(GestureSession session, SwipeDestination destination) {
        if (!destination.isTab() || destination.getTabId() == session.getStagedTabId()) {
            return session;
        }
        return mAnimator.stagePreview(session, destination, mPreview);
    }
}
