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

/**
 * Window geometry and UI state read when a toolbar swipe starts. Values that shape the gesture
 * (width, layout direction, toolbar edge, browsing mode) are frozen into the
 * {@link GestureSession} and not queried again until the next gesture.
 */
public interface SwipeEnvironment {
    /** @return Width of the window in px. */
    int getWindowWidth();

    /** @return Screen-space bounds of the toolbar. */
    ToolbarBounds getToolbarBounds();

    /** @return Bottom mandatory system gesture inset in px, 0 if the platform has none. */
    int getMandatorySystemGestureInsetBottom();

    /** @return Bottom system window inset in px. */
    int getSystemWindowInsetBottom();

    boolean isKeyboardVisible();

    boolean isLayoutRtl();

    ToolbarPosition getToolbarPosition();

    BrowsingMode getBrowsingMode();
}
