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

import java.util.Locale;

/**
 * Screen-space rectangle of the toolbar. Containment follows {@code android.graphics.Rect}:
 * left and top are inclusive, right and bottom exclusive.
 */
public final class ToolbarBounds {
    public final int left;
    public final int top;
    public final int right;
    public final int bottom;

    public ToolbarBounds(int left, int top, int right, int bottom) {
        this.left = left;
        this.top = top;
        this.right = right;
        this.bottom = bottom;
    }

    /** @return A copy whose top edge is moved up by {@code amount} px. */
    public ToolbarBounds extendTop(int amount) {
        return new ToolbarBounds(left, top - amount, right, bottom);
    }

    public boolean contains(float x, float y) {
        return left < right && top < bottom && x >= left && x < right && y >= top && y < bottom;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ToolbarBounds)) return false;
        ToolbarBounds other = (ToolbarBounds) o;
        return left == other.left && top == other.top && right == other.right
                && bottom == other.bottom;
    }

    @Override
    public int hashCode() {
        int result = left;
        result = 31 * result + top;
        result = 31 * result + right;
        result = 31 * result + bottom;
        return result;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "ToolbarBounds(%d, %d - %d, %d)", left, top, right, bottom);
    }
}
