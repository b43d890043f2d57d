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

import java.util.List;

/** Read-only view of the tab store, as seen by the toolbar swipe. */
public interface TabsView {
    int INVALID_TAB_ID = -1;

    /** @return The id of the selected tab, or {@link #INVALID_TAB_ID} if none is selected. */
    int getSelectedTabId();

    /** @return Whether the selected tab belongs to the private partition. */
    boolean isSelectedTabPrivate();

    /**
     * @param isPrivate Which privacy partition to list.
     * @return The ordered ids of every tab in that partition.
     */
    List<Integer> getTabIds(boolean isPrivate);
}
