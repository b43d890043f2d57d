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

import android.graphics.Rect;
import android.view.View;
import dev.cobalt.toolbarswipe.BrowsingMode;
import dev.cobalt.toolbarswipe.SwipeEnvironment;
import dev.cobalt.toolbarswipe.ToolbarBounds;
import dev.cobalt.toolbarswipe.ToolbarPosition;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/** {@link SwipeEnvironment} read from the activity's view hierarchy. */
public class ViewSwipeEnvironment implements SwipeEnvironment {
    // Anything hiding more than this much of the window bottom is taken to be the keyboard.
    private static final float KEYBOARD_DETECT_BOTTOM_THRESHOLD_DP = 100;

    /** Bottom insets of the window, as reported by the platform's window insets. */
    public interface InsetsProvider {
        InsetsProvider NONE =
                new InsetsProvider() {
                    @Override
                    public int getMandatorySystemGestureInsetBottom() {
                        return 0;
                    }

                    @Override
                    public int getSystemWindowInsetBottom() {
                        return 0;
                    }
                };

        int getMandatorySystemGestureInsetBottom();

        int getSystemWindowInsetBottom();
    }

    private final View mDecorView;
    private final View mToolbarView;
    private final Supplier<ToolbarPosition> mToolbarPositionSupplier;
    private final Supplier<BrowsingMode> mBrowsingModeSupplier;
    private final BooleanSupplier mIsLayoutRtlSupplier;
    private final InsetsProvider mInsetsProvider;

    /**
     * @param decorView The window's decor view.
     * @param toolbarView The toolbar swipes must start on.
     * @param toolbarPositionSupplier Which edge the toolbar is currently anchored to.
     * @param browsingModeSupplier Whether normal or private tabs are being browsed.
     * @param isLayoutRtlSupplier Whether the UI is laid out right to left.
     * @param insetsProvider Bottom window insets, {@link InsetsProvider#NONE} before Android Q.
     */
    public ViewSwipeEnvironment(
            View decorView,
            View toolbarView,
            Supplier<ToolbarPosition> toolbarPositionSupplier,
            Supplier<BrowsingMode> browsingModeSupplier,
            BooleanSupplier isLayoutRtlSupplier,
            InsetsProvider insetsProvider) {
        mDecorView = decorView;
        mToolbarView = toolbarView;
        mToolbarPositionSupplier = toolbarPositionSupplier;
        mBrowsingModeSupplier = browsingModeSupplier;
        mIsLayoutRtlSupplier = isLayoutRtlSupplier;
        mInsetsProvider = insetsProvider;
    }

    @Override
    public int getWindowWidth() {
        return mDecorView.getResources().getDisplayMetrics().widthPixels;
    }

    @Override
    public ToolbarBounds getToolbarBounds() {
        int[] location = new int[2];
        mToolbarView.getLocationOnScreen(location);
        return new ToolbarBounds(
                location[0],
                location[1],
                location[0] + mToolbarView.getWidth(),
                location[1] + mToolbarView.getHeight());
    }

    @Override
    public int getMandatorySystemGestureInsetBottom() {
        return mInsetsProvider.getMandatorySystemGestureInsetBottom();
    }

    @Override
    public int getSystemWindowInsetBottom() {
        return mInsetsProvider.getSystemWindowInsetBottom();
    }

    @Override
    public boolean isKeyboardVisible() {
        View rootView = mDecorView.getRootView();
        Rect visibleFrame = new Rect();
        rootView.getWindowVisibleDisplayFrame(visibleFrame);
        int hiddenBottom = rootView.getHeight() - visibleFrame.bottom;
        float density = mDecorView.getResources().getDisplayMetrics().density;
        return hiddenBottom > KEYBOARD_DETECT_BOTTOM_THRESHOLD_DP * density;
    }

    @Override
    public boolean isLayoutRtl() {
        return mIsLayoutRtlSupplier.getAsBoolean();
    }

    @Override
    public ToolbarPosition getToolbarPosition() {
        return mToolbarPositionSupplier.get();
    }

    @Override
    public BrowsingMode getBrowsingMode() {
        return mBrowsingModeSupplier.get();
    }
}
