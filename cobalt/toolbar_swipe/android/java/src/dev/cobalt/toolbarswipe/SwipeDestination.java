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

import static com.google.common.base.Preconditions.checkState;

import java.util.Locale;

/**
 * What a toolbar swipe currently targets: a neighboring tab, nothing, or the tab tray. Only
 * {@link Type#TAB} destinations carry a payload.
 */
public final class SwipeDestination {
    /** Discriminator of a {@link SwipeDestination}. */
    public enum Type {
        TAB,
        NONE,
        TRAY
    }

    public static final SwipeDestination NONE =
            new SwipeDestination(Type.NONE, TabsView.INVALID_TAB_ID, false);
    public static final SwipeDestination TRAY =
            new SwipeDestination(Type.TRAY, TabsView.INVALID_TAB_ID, false);

    private final Type mType;
    private final int mTabId;
    private final boolean mIsPrivate;

    private SwipeDestination(Type type, int tabId, boolean isPrivate) {
        mType = type;
        mTabId = tabId;
        mIsPrivate = isPrivate;
    }

    /**
     * @param tabId The id of the tab the swipe switches to.
     * @param isPrivate Whether that tab belongs to the private partition.
     */
    public static SwipeDestination forTab(int tabId, boolean isPrivate) {
        return new SwipeDestination(Type.TAB, tabId, isPrivate);
    }

    public Type getType() {
        return mType;
    }

    public boolean isTab() {
        return mType == Type.TAB;
    }

    public int getTabId() {
        checkState(isTab(), "Only tab destinations have a tab id");
        return mTabId;
    }

    public boolean isPrivate() {
        checkState(isTab(), "Only tab destinations have a privacy partition");
        return mIsPrivate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SwipeDestination)) return false;
        SwipeDestination other = (SwipeDestination) o;
        return mType == other.mType && mTabId == other.mTabId && mIsPrivate == other.mIsPrivate;
    }

    @Override
    public int hashCode() {
        int result = mType.hashCode();
        result = 31 * result + mTabId;
        result = 31 * result + (mIsPrivate ? 1 : 0);
        return result;
    }

    @Override
    public String toString() {
        if (!isTab()) return mType.name();
        return String.format(Locale.US, "TAB(%d%s)", mTabId, mIsPrivate ? ", private" : "");
    }
}
