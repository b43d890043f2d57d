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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;

/**
 * Works out which {@link SwipeDestination} a swipe targets given the current tab order.
 *
 * <p>Swiping toward the left reveals the "next" tab in reading order, so the index arithmetic
 * flips between LTR and RTL layouts while the on-screen motion does not.
 */
public class DestinationResolver {
    private final TabsView mTabsView;

    public DestinationResolver(TabsView tabsView) {
        mTabsView = tabsView;
    }

    /**
     * Resolves against the tab list as it is right now. Calling this again later may give a
     * different answer if tabs were opened, closed or reordered in between.
     *
     * @param session The active gesture; provides the direction and layout direction.
     */
    public SwipeDestination resolve(GestureSession session) {
        return resolve(session.getDirection(), session.isLayoutRtl());
    }

    @VisibleForTesting
    SwipeDestination resolve(GestureDirection direction, boolean isLayoutRtl) {
        if (!direction.isHorizontal()) return SwipeDestination.TRAY;

        int selectedTabId = mTabsView.getSelectedTabId();
        if (selectedTabId == TabsView.INVALID_TAB_ID) return SwipeDestination.NONE;

        boolean isPrivate = mTabsView.isSelectedTabPrivate();
        // Snapshot so that one resolution sees a single consistent ordering.
        ImmutableList<Integer> tabIds = ImmutableList.copyOf(mTabsView.getTabIds(isPrivate));
        int currentIndex = tabIds.indexOf(selectedTabId);
        if (currentIndex == -1) return SwipeDestination.NONE;

        int index = currentIndex + getIndexDelta(direction, isLayoutRtl);
        if (index < 0 || index >= tabIds.size()) return SwipeDestination.NONE;
        return SwipeDestination.forTab(tabIds.get(index), isPrivate);
    }

    /**
     * @return +1 to move to the next tab in the list, -1 to move to the previous one.
     */
    @VisibleForTesting
    static int getIndexDelta(GestureDirection direction, boolean isLayoutRtl) {
        assert direction.isHorizontal();
        boolean towardNext = direction == GestureDirection.RIGHT_TO_LEFT;
        return (towardNext ^ isLayoutRtl) ? 1 : -1;
    }
}
