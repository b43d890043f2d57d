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

import android.util.Log;
import android.view.View;
import android.widget.ImageView;
import dev.cobalt.toolbarswipe.SwipeEnvironment;
import dev.cobalt.toolbarswipe.SwipeGestureListener;
import dev.cobalt.toolbarswipe.TabSelector;
import dev.cobalt.toolbarswipe.TabSwipeNavigator;
import dev.cobalt.toolbarswipe.TabsView;
import dev.cobalt.toolbarswipe.ToolbarGestureHandler;
import dev.cobalt.toolbarswipe.ToolbarSwipeMetrics;

/**
 * Owns the toolbar swipe of one browser window. The host forwards the toolbar's swipe
 * callbacks to {@link #getSwipeGestureListener()} and calls {@link #destroy()} with the window.
 */
public class ToolbarSwipeCoordinator {
    private static final String TAG = "cobalt";

    private final ToolbarGestureHandler mGestureHandler;

    /**
     * @param contentView The view showing the current page.
     * @param previewView The view laid over the content that shows the tab being swiped to.
     * @param environment Window and toolbar state, see {@link ViewSwipeEnvironment}.
     * @param thumbnailLoader Provides tab thumbnails for the preview.
     * @param tabsView The tab list.
     * @param tabSelector Selects a tab.
     * @param navigator Opens the tab tray or a new tab.
     * @param metrics Records completed tab switches.
     */
    public ToolbarSwipeCoordinator(
            View contentView,
            ImageView previewView,
            SwipeEnvironment environment,
            ViewTabPreviewSurface.ThumbnailLoader thumbnailLoader,
            TabsView tabsView,
            TabSelector tabSelector,
            TabSwipeNavigator navigator,
            ToolbarSwipeMetrics metrics) {
        mGestureHandler =
                new ToolbarGestureHandler(
                        ToolbarSwipeViewConfiguration.createConfig(contentView.getContext()),
                        environment,
                        tabsView,
                        new ViewContentSurface(contentView),
                        new ViewTabPreviewSurface(previewView, thumbnailLoader),
                        new AnimatorSettleAnimationRunner(),
                        tabSelector,
                        navigator,
                        metrics);
        Log.i(TAG, "ToolbarSwipeCoordinator attached.");
    }

    public SwipeGestureListener getSwipeGestureListener() {
        return mGestureHandler;
    }

    /**
     * Settles a running gesture immediately, including the steps that follow the running
     * animation, so its navigation still happens before the window goes away.
     */
    public void destroy() {
        mGestureHandler.destroy();
        Log.i(TAG, "ToolbarSwipeCoordinator destroyed.");
    }
}
