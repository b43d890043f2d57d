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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import dev.cobalt.toolbarswipe.SettleController.Outcome;
import dev.cobalt.toolbarswipe.SettleController.State;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

/** Unit tests for {@link SettleController}. */
public class SettleControllerUnitTest {
    private static final float MIN_FLING_VELOCITY = 50f;
    private static final float PREVIEW_OFFSET = 20f;
    private static final float TRAVEL = FakeSwipeEnvironment.WINDOW_WIDTH + PREVIEW_OFFSET;
    private static final float DELTA = 0.001f;
    private static final int NEXT_TAB_ID = 2;
    private static final SwipeDestination NEXT_TAB = SwipeDestination.forTab(NEXT_TAB_ID, false);

    @Rule public MockitoRule mMockitoRule = MockitoJUnit.rule();

    @Mock private TabSelector mTabSelector;
    @Mock private TabSwipeNavigator mNavigator;
    @Mock private ToolbarSwipeMetrics mMetrics;

    private final FakeSwipeEnvironment mEnvironment = new FakeSwipeEnvironment();
    private final FakeContentSurface mContent =
            new FakeContentSurface(FakeSwipeEnvironment.WINDOW_WIDTH);
    private final FakeTabPreviewSurface mPreview =
            new FakeTabPreviewSurface(FakeSwipeEnvironment.WINDOW_WIDTH);
    private final FakeSettleAnimationRunner mAnimationRunner = new FakeSettleAnimationRunner();

    private SwipePreviewAnimator mAnimator;
    private SettleController mController;
    private int mSettledCount;

    @Before
    public void setUp() {
        ToolbarSwipeConfig config =
                new ToolbarSwipeConfig.Builder()
                        .setTouchSlop(8f)
                        .setMinimumFlingVelocity(MIN_FLING_VELOCITY)
                        .setPreviewOffset(PREVIEW_OFFSET)
                        .build();
        mAnimator = new SwipePreviewAnimator(config);
        mController =
                new SettleController(
                        config,
                        new GestureClassifier(config),
                        mAnimator,
                        mContent,
                        mPreview,
                        mAnimationRunner,
                        mTabSelector,
                        mNavigator,
                        mMetrics);
    }

    @Test
    public void testDecide_tab() {
        GestureSession dragged = dragTowardNextTab(400f);
        assertThat(mController.decide(dragged, NEXT_TAB, 0f)).isEqualTo(Outcome.SWITCH_TAB);

        GestureSession barelyDragged = dragTowardNextTab(100f);
        assertThat(mController.decide(barelyDragged, NEXT_TAB, 0f)).isEqualTo(Outcome.CANCEL);
        assertThat(mController.decide(barelyDragged, NEXT_TAB, -MIN_FLING_VELOCITY))
                .isEqualTo(Outcome.SWITCH_TAB);
        assertThat(mController.decide(dragged, NEXT_TAB, MIN_FLING_VELOCITY))
                .isEqualTo(Outcome.CANCEL);
    }

    @Test
    public void testDecide_trayOnlyTowardToolbarEdge() {
        GestureSession down = createSession(GestureDirection.TOP_TO_BOTTOM);
        GestureSession up = createSession(GestureDirection.BOTTOM_TO_TOP);
        assertThat(mController.decide(down, SwipeDestination.TRAY, 0f))
                .isEqualTo(Outcome.OPEN_TAB_TRAY);
        assertThat(mController.decide(up, SwipeDestination.TRAY, 0f)).isEqualTo(Outcome.CANCEL);

        mEnvironment.useBottomToolbar();
        down = createSession(GestureDirection.TOP_TO_BOTTOM);
        up = createSession(GestureDirection.BOTTOM_TO_TOP);
        assertThat(mController.decide(down, SwipeDestination.TRAY, 0f)).isEqualTo(Outcome.CANCEL);
        assertThat(mController.decide(up, SwipeDestination.TRAY, 0f))
                .isEqualTo(Outcome.OPEN_TAB_TRAY);
    }

    @Test
    public void testDecide_noneOpensNewTabTowardNextTab() {
        GestureSession rightToLeft = createSession(GestureDirection.RIGHT_TO_LEFT);
        GestureSession leftToRight = createSession(GestureDirection.LEFT_TO_RIGHT);
        assertThat(mController.decide(rightToLeft, SwipeDestination.NONE, 0f))
                .isEqualTo(Outcome.OPEN_NEW_TAB);
        assertThat(mController.decide(leftToRight, SwipeDestination.NONE, 0f))
                .isEqualTo(Outcome.CANCEL);
        assertThat(mController.decide(rightToLeft, SwipeDestination.NONE, MIN_FLING_VELOCITY))
                .isEqualTo(Outcome.CANCEL);
    }

    @Test
    public void testDecide_noneOpensNewTabTowardNextTabInRtl() {
        mEnvironment.mLayoutRtl = true;
        GestureSession rightToLeft = createSession(GestureDirection.RIGHT_TO_LEFT);
        GestureSession leftToRight = createSession(GestureDirection.LEFT_TO_RIGHT);
        assertThat(mController.decide(leftToRight, SwipeDestination.NONE, 0f))
                .isEqualTo(Outcome.OPEN_NEW_TAB);
        assertThat(mController.decide(rightToLeft, SwipeDestination.NONE, 0f))
                .isEqualTo(Outcome.CANCEL);
    }

    @Test
    public void testSettle_switchTabRunsStepsInOrder() {
        GestureSession session = dragTowardNextTab(400f);
        mController.onArmed();
        mController.settle(session, NEXT_TAB, 0f, 0f, this::onSettled);

        assertThat(mController.getState()).isEqualTo(State.COMPLETING);
        FakeSettleAnimationRunner.Animation slide = mAnimationRunner.getRunning();
        assertEquals(-400f, slide.from, DELTA);
        assertEquals(-TRAVEL, slide.to, DELTA);
        assertThat(slide.durationMs)
                .isEqualTo(SettleController.FINISHED_GESTURE_ANIMATION_DURATION_MS);

        slide.update(-700f);
        assertEquals(-700f, mContent.getTranslationX(), DELTA);
        assertEquals(TRAVEL - 700f, mPreview.getTranslationX(), DELTA);
        verify(mTabSelector, never()).selectTab(anyInt());

        mAnimationRunner.end();
        assertEquals(0f, mContent.getTranslationX(), DELTA);
        assertEquals(0f, mPreview.getTranslationX(), DELTA);
        verify(mTabSelector).selectTab(NEXT_TAB_ID);
        verify(mMetrics, never()).recordToolbarTabSwipe();
        assertThat(mPreview.isVisible()).isTrue();

        FakeSettleAnimationRunner.Animation fade = mAnimationRunner.getRunning();
        assertEquals(1f, fade.from, DELTA);
        assertEquals(0f, fade.to, DELTA);
        assertThat(fade.durationMs).isEqualTo(ToolbarSwipeConfig.DEFAULT_FADE_OUT_DURATION_MS);
        assertThat(mSettledCount).isEqualTo(0);

        mAnimationRunner.end();
        assertEquals(0f, mPreview.getAlpha(), DELTA);
        assertThat(mPreview.isVisible()).isFalse();
        verify(mMetrics, times(1)).recordToolbarTabSwipe();
        verify(mTabSelector, times(1)).selectTab(anyInt());
        verifyNoInteractions(mNavigator);
        assertThat(mAnimationRunner.isRunning()).isFalse();
        assertThat(mController.getState()).isEqualTo(State.IDLE);
        assertThat(mSettledCount).isEqualTo(1);
    }

    @Test
    public void testSettle_cancelAnimatesBack() {
        GestureSession session = dragTowardNextTab(100f);
        mController.onArmed();
        mController.onUpdated();
        mController.settle(session, NEXT_TAB, 0f, 0f, this::onSettled);

        assertThat(mController.getState()).isEqualTo(State.CANCELING);
        FakeSettleAnimationRunner.Animation animation = mAnimationRunner.getRunning();
        assertEquals(-100f, animation.from, DELTA);
        assertEquals(0f, animation.to, DELTA);
        assertThat(animation.durationMs)
                .isEqualTo(SettleController.CANCELED_GESTURE_ANIMATION_DURATION_MS);

        mAnimationRunner.end();
        assertEquals(0f, mContent.getTranslationX(), DELTA);
        assertEquals(TRAVEL, mPreview.getTranslationX(), DELTA);
        assertThat(mPreview.isVisible()).isFalse();
        assertThat(mController.getState()).isEqualTo(State.IDLE);
        assertThat(mSettledCount).isEqualTo(1);
        verifyNoInteractions(mTabSelector, mNavigator, mMetrics);
    }

    @Test
    public void testSettle_reverseFlingCancelsFaster() {
        GestureSession session = dragTowardNextTab(600f);
        mController.onArmed();
        mController.settle(session, NEXT_TAB, MIN_FLING_VELOCITY * 2, 0f, this::onSettled);

        assertThat(mController.getState()).isEqualTo(State.CANCELING);
        assertThat(mAnimationRunner.getRunning().durationMs)
                .isEqualTo(SettleController.CANCELED_FLING_ANIMATION_DURATION_MS);
        mAnimationRunner.endAllAnimations();
        verifyNoInteractions(mTabSelector, mNavigator, mMetrics);
    }

    @Test
    public void testSettle_usesVelocityAlongGestureAxis() {
        GestureSession session = dragTowardNextTab(100f);
        mController.onArmed();
        // A fast vertical release does not make a horizontal swipe a fling.
        mController.settle(session, NEXT_TAB, 0f, -MIN_FLING_VELOCITY * 4, this::onSettled);

        assertThat(mController.getState()).isEqualTo(State.CANCELING);
        mAnimationRunner.endAllAnimations();
        verify(mTabSelector, never()).selectTab(anyInt());
    }

    @Test
    public void testSettle_opensTabTrayForBrowsingMode() {
        mEnvironment.mBrowsingMode = BrowsingMode.PRIVATE;
        GestureSession session = createSession(GestureDirection.TOP_TO_BOTTOM);
        mController.onArmed();
        mController.settle(session, SwipeDestination.TRAY, 0f, 2000f, this::onSettled);

        verify(mNavigator).navigateToTabTray(TabTrayPage.PRIVATE_TABS);
        verify(mNavigator, never()).navigateToNewTab(anyBoolean());
        verifyNoInteractions(mTabSelector, mMetrics);
        assertThat(mAnimationRunner.getAnimationCount()).isEqualTo(0);
        assertThat(mController.getState()).isEqualTo(State.IDLE);
        assertThat(mSettledCount).isEqualTo(1);
    }

    @Test
    public void testSettle_mismatchedTrayDirectionCancels() {
        mEnvironment.useBottomToolbar();
        GestureSession session = createSession(GestureDirection.TOP_TO_BOTTOM);
        mController.onArmed();
        mController.settle(session, SwipeDestination.TRAY, 0f, 2000f, this::onSettled);

        assertThat(mController.getState()).isEqualTo(State.CANCELING);
        mAnimationRunner.endAllAnimations();
        verifyNoInteractions(mNavigator, mTabSelector, mMetrics);
        assertThat(mSettledCount).isEqualTo(1);
    }

    @Test
    public void testSettle_opensNewTab() {
        GestureSession session = createSession(GestureDirection.RIGHT_TO_LEFT);
        session = mAnimator.applyDrag(session, SwipeDestination.NONE, 400f, mContent.getWidth());
        mContent.setTranslationX(session.getContentOffset());
        mController.onArmed();
        mController.settle(session, SwipeDestination.NONE, 0f, 0f, this::onSettled);

        assertEquals(0f, mContent.getTranslationX(), DELTA);
        verify(mNavigator).navigateToNewTab(true);
        verify(mNavigator, never()).navigateToTabTray(any());
        verifyNoInteractions(mTabSelector, mMetrics);
        assertThat(mController.getState()).isEqualTo(State.IDLE);
        assertThat(mSettledCount).isEqualTo(1);
    }

    @Test
    public void testLifecyclePreconditions() {
        GestureSession session = createSession(GestureDirection.RIGHT_TO_LEFT);
        assertThrows(IllegalStateException.class, () -> mController.onUpdated());
        assertThrows(
                IllegalStateException.class,
                () -> mController.settle(session, NEXT_TAB, 0f, 0f, this::onSettled));

        mController.onArmed();
        assertThat(mController.isTracking()).isTrue();
        assertThrows(IllegalStateException.class, () -> mController.onArmed());

        mController.settle(session, SwipeDestination.NONE, 0f, 0f, this::onSettled);
        assertThat(mController.isIdle()).isTrue();
    }

    private void onSettled() {
        mSettledCount++;
    }

    private GestureSession createSession(GestureDirection direction) {
        return GestureSession.start(direction, new GesturePoint(500f, 50f), mEnvironment, 0f);
    }

    /** Stages the next tab and drags right to left by {@code distance}. */
    private GestureSession dragTowardNextTab(float distance) {
        GestureSession session =
                mAnimator.stagePreview(
                        createSession(GestureDirection.RIGHT_TO_LEFT), NEXT_TAB, mPreview);
        return mAnimator.applyDrag(session, NEXT_TAB, distance, mContent.getWidth());
    }
}
