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

/** Mutable {@link SwipeEnvironment} for a 1000px wide window with a 100px toolbar. */
class FakeSwipeEnvironment implements SwipeEnvironment {
    static final int WINDOW_WIDTH = 1000;
    static final ToolbarBounds TOP_TOOLBAR = new ToolbarBounds(0, 0, WINDOW_WIDTH, 100);
    static final ToolbarBounds BOTTOM_TOOLBAR = new ToolbarBounds(0, 1900, WINDOW_WIDTH, 2000);

    int mWindowWidth = WINDOW_WIDTH;
    ToolbarBounds mToolbarBounds = TOP_TOOLBAR;
    int mMandatorySystemGestureInsetBottom;
    int mSystemWindowInsetBottom;
    boolean mKeyboardVisible;
    boolean mLayoutRtl;
    ToolbarPosition mToolbarPosition = ToolbarPosition.TOP;
    BrowsingMode mBrowsingMode = BrowsingMode.NORMAL;

    FakeSwipeEnvironment useBottomToolbar() {
        mToolbarBounds = BOTTOM_TOOLBAR;
        mToolbarPosition = ToolbarPosition.BOTTOM;
        return this;
    }

    @Override
    public int getWindowWidth() {
        return mWindowWidth;
    }

    @Override
    public ToolbarBounds getToolbarBounds() {
        return mToolbarBounds;
    }

    @Override
    public int getMandatorySystemGestureInsetBottom() {
        return mMandatorySystemGestureInsetBottom;
    }

    @Override
    public int getSystemWindowInsetBottom() {
        return mSystemWindowInsetBottom;
    }

    @Override
    public boolean isKeyboardVisible() {
        return mKeyboardVisible;
    }

    @Override
    public boolean isLayoutRtl() {
        return mLayoutRtl;
    }

    @Override
    public ToolbarPosition getToolbarPosition() {
        return mToolbarPosition;
    }

    @Override
    public BrowsingMode getBrowsingMode() {
        return mBrowsingMode;
    }
}
