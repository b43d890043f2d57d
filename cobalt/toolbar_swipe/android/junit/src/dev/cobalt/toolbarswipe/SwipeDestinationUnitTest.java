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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;

/** Unit tests for {@link SwipeDestination} and {@link ToolbarBounds}. */
public class SwipeDestinationUnitTest {
    @Test
    public void testTabDestination() {
        SwipeDestination destination = SwipeDestination.forTab(4, true);
        assertThat(destination.isTab()).isTrue();
        assertThat(destination.getTabId()).isEqualTo(4);
        assertThat(destination.isPrivate()).isTrue();
        assertThat(destination).isEqualTo(SwipeDestination.forTab(4, true));
        assertThat(destination).isNotEqualTo(SwipeDestination.forTab(4, false));
        assertThat(destination.toString()).isEqualTo("TAB(4, private)");
    }

    @Test
    public void testNonTabDestinationsHaveNoPayload() {
        assertThat(SwipeDestination.NONE.getType()).isEqualTo(SwipeDestination.Type.NONE);
        assertThat(SwipeDestination.TRAY.toString()).isEqualTo("TRAY");
        assertThrows(IllegalStateException.class, () -> SwipeDestination.NONE.getTabId());
        assertThrows(IllegalStateException.class, () -> SwipeDestination.TRAY.isPrivate());
    }

    @Test
    public void testToolbarBoundsContains() {
        ToolbarBounds bounds = new ToolbarBounds(0, 100, 200, 150);
        assertThat(bounds.contains(0f, 100f)).isTrue();
        assertThat(bounds.contains(199.5f, 149.5f)).isTrue();
        assertThat(bounds.contains(200f, 120f)).isFalse();
        assertThat(bounds.contains(10f, 99f)).isFalse();
        assertThat(bounds.extendTop(10).contains(10f, 95f)).isTrue();
        assertThat(new ToolbarBounds(0, 0, 0, 0).contains(0f, 0f)).isFalse();
    }
}
