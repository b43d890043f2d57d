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

/** {@link TabPreviewSurface} that remembers which thumbnails it was asked to show. */
class FakeTabPreviewSurface implements TabPreviewSurface {
    final List<Integer> mLoadedTabIds = new ArrayList<>();

    private final int mWidth;
    private float mAlpha = 1f;
    private float mTranslationX;
    private boolean mVisible;

    FakeTabPreviewSurface(int width) {
        mWidth = width;
    }

    @Override
    public void loadPreviewThumbnail(int tabId, boolean isPrivate) {
        mLoadedTabIds.add(tabId);
    }

    @Override
    public float getAlpha() {
        return mAlpha;
    }

    @Override
    public void setAlpha(float alpha) {
        mAlpha = alpha;
    }

    @Override
    public float getTranslationX() {
        return mTranslationX;
    }

    @Override
    public void setTranslationX(float translationX) {
        mTranslationX = translationX;
    }

    @Override
    public boolean isVisible() {
        return mVisible;
    }

    @Override
    public void setVisible(boolean visible) {
        mVisible = visible;
    }

    @Override
    public int getWidth() {
        return mWidth;
    }
}
