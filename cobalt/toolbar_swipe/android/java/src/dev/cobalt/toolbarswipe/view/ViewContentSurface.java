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

import android.view.View;
import dev.cobalt.toolbarswipe.ContentSurface;

/** {@link ContentSurface} backed by the view that hosts the current page. */
public class ViewContentSurface implements ContentSurface {
    private final View mContentView;

    public ViewContentSurface(View contentView) {
        mContentView = contentView;
    }

    @Override
    public float getTranslationX() {
        return mContentView.getTranslationX();
    }

    @Override
    public void setTranslationX(float translationX) {
        mContentView.setTranslationX(translationX);
    }

    @Override
    public int getWidth() {
        return mContentView.getWidth();
    }
}
