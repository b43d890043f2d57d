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

/** Stand-in for the tab being swiped to, shown sliding in from the window edge. */
public interface TabPreviewSurface {
    /**
     * Starts loading the thumbnail of a tab into the preview.
     *
     * @param tabId The tab to show.
     * @param isPrivate Whether the tab belongs to the private partition.
     */
    void loadPreviewThumbnail(int tabId, boolean isPrivate);

    float getAlpha();

    void setAlpha(float alpha);

    float getTranslationX();

    void setTranslationX(float translationX);

    boolean isVisible();

    void setVisible(boolean visible);

    /** @return Width of the preview in px. */
    int getWidth();
}
