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

/** Screen transitions a toolbar swipe can end in. */
public interface TabSwipeNavigator {
    /**
     * Opens the tab tray.
     *
     * @param page The page of the tray to show.
     */
    void navigateToTabTray(TabTrayPage page);

    /**
     * Opens a new blank tab.
     *
     * @param focusOnAddressBar Whether the address bar takes focus once the tab is shown.
     */
    void navigateToNewTab(boolean focusOnAddressBar);
}
