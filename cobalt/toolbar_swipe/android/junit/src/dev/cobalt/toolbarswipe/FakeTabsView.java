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

import java.util.ArrayList;
import java.util.List;

/** In-memory {@link TabsView} with a normal and a private tab list. */
class FakeTabsView implements TabsView {
    private final List<Integer> mNormalTabIds = new ArrayList<>();
    private final List<Integer> mPrivateTabIds = new ArrayList<>();
    private int mSelectedTabId = INVALID_TAB_ID;
    private boolean mSelectedTabPrivate;

    FakeTabsView setNormalTabs(Integer... tabIds) {
        mNormalTabIds.clear();
        for (Integer tabId : tabIds) mNormalTabIds.add(tabId);
        return this;
    }

    FakeTabsView setPrivateTabs(Integer... tabIds) {
        mPrivateTabIds.clear();
        for (Integer tabId : tabIds) mPrivateTabIds.add(tabId);
        return this;
    }

    FakeTabsView select(int tabId, boolean isPrivate) {
        mSelectedTabId = tabId;
        mSelectedTabPrivate = isPrivate;
        return this;
    }

    @Override
    public int getSelectedTabId() {
        return mSelectedTabId;
    }

    @Override
    public boolean isSelectedTabPrivate() {
        return mSelectedTabPrivate;
    }

    @Override
    public List<Integer> getTabIds(boolean isPrivate) {
        return isPrivate ? mPrivateTabIds : mNormalTabIds;
    }
}
