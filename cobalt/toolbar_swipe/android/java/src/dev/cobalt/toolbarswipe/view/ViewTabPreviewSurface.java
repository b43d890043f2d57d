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
import dev.cobalt.toolbarswipe.TabPreviewSurface;

/** {@link TabPreviewSurface} backed by an {@link ImageView} laid over the content. */
public class ViewTabPreviewSurface implements TabPreviewSurface {
    private static final String TAG = "cobalt";

    /** Fills the preview with a tab's last captured thumbnail. */
    public interface ThumbnailLoader {
        /**
         * @param tabId The tab to show.
         * @param isPrivate Whether the tab belongs to the private partition.
         * @param target The view to draw the thumbnail into.
         * @return Whether a thumbnail was available for the tab.
         */
        boolean loadThumbnail(int tabId, boolean isPrivate, ImageView target);
    }

    private final ImageView mPreviewView;
    private final ThumbnailLoader mThumbnailLoader;

    public ViewTabPreviewSurface(ImageView previewView, ThumbnailLoader thumbnailLoader) {
        mPreviewView = previewView;
        mThumbnailLoader = thumbnailLoader;
    }

    @Override
    public void loadPreviewThumbnail(int tabId, boolean isPrivate) {
        if (!mThumbnailLoader.loadThumbnail(tabId, isPrivate, mPreviewView)) {
            // The swipe still works, the preview just shows no page content.
            Log.w(TAG, "ViewTabPreviewSurface no thumbnail for tab " + tabId);
            mPreviewView.setImageDrawable(null);
        }
    }

    @Override
    public float getAlpha() {
        return mPreviewView.getAlpha();
    }

    @Override
    public void setAlpha(float alpha) {
        mPreviewView.setAlpha(alpha);
    }

    @Override
    public float getTranslationX() {
        return mPreviewView.getTranslationX();
    }

    @Override
    public void setTranslationX(float translationX) {
        mPreviewView.setTranslationX(translationX);
    }

    @Override
    public boolean isVisible() {
        return mPreviewView.getVisibility() == View.VISIBLE;
    }

    @Override
    public void setVisible(boolean visible) {
        mPreviewView.setVisibility(visible ? View.VISIBLE : View.GONE);
    }

    @Override
    public int getWidth() {
        return mPreviewView.getWidth();
    }
}
