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

import android.content.Context;
import android.util.DisplayMetrics;
import android.view.ViewConfiguration;
import dev.cobalt.toolbarswipe.ToolbarSwipeConfig;

/** Builds the {@link ToolbarSwipeConfig} of the current device. */
public final class ToolbarSwipeViewConfiguration {
    /** Gap between the window edge and a staged preview. */
    private static final float PREVIEW_OFFSET_DP = 8f;

    private ToolbarSwipeViewConfiguration() {}

    public static ToolbarSwipeConfig createConfig(Context context) {
        ViewConfiguration viewConfiguration = ViewConfiguration.get(context);
        DisplayMetrics metrics = context.getResources().getDisplayMetrics();
        return new ToolbarSwipeConfig.Builder()
                .setTouchSlop(viewConfiguration.getScaledTouchSlop())
                .setMinimumFlingVelocity(viewConfiguration.getScaledMinimumFlingVelocity())
                .setPreviewOffset(PREVIEW_OFFSET_DP * metrics.density)
                .setFadeOutDurationMs(
                        context.getResources().getInteger(android.R.integer.config_shortAnimTime))
                .build();
    }
}
