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
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

/** Unit tests for {@link DestinationResolver}. */
public class DestinationResolverUnitTest {
    @Rule public MockitoRule mMockitoRule = MockitoJUnit.rule();

    @Mock private TabsView mMockTabsView;

    private FakeTabsView mTabsView;
    private DestinationResolver mResolver;

    @Before
    public void setUp() {
        mTabsView = new FakeTabsView().setNormalTabs(1, 2, 3).setPrivateTabs(10, 11);
        mResolver = new DestinationResolver(mTabsView);
    }

    @Test
    public void testGetIndexDelta() {
        assertThat(DestinationResolver.getIndexDelta(GestureDirection.RIGHT_TO_LEFT, false))
                .isEqualTo(1);
        assertThat(DestinationResolver.getIndexDelta(GestureDirection.LEFT_TO_RIGHT, false))
                .isEqualTo(-1);
        assertThat(DestinationResolver.getIndexDelta(GestureDirection.RIGHT_TO_LEFT, true))
                .isEqualTo(-1);
        assertThat(DestinationResolver.getIndexDelta(GestureDirection.LEFT_TO_RIGHT, true))
                .isEqualTo(1);
    }

    @Test
    public void testResolve_neighborsInLtr() {
        mTabsView.select(2, false);
        assertThat(mResolver.resolve(GestureDirection.RIGHT_TO_LEFT, false))
                .isEqualTo(SwipeDestination.forTab(3, false));
        assertThat(mResolver.resolve(GestureDirection.LEFT_TO_RIGHT, false))
                .isEqualTo(SwipeDestination.forTab(1, false));
    }

    @Test
    public void testResolve_neighborsInRtl() {
        mTabsView.select(2, false);
        assertThat(mResolver.resolve(GestureDirection.RIGHT_TO_LEFT, true))
                .isEqualTo(SwipeDestination.forTab(1, false));
        assertThat(mResolver.resolve(GestureDirection.LEFT_TO_RIGHT, true))
                .isEqualTo(SwipeDestination.forTab(3, false));
    }

    @Test
    public void testResolve_outOfRangeIsNone() {
        mTabsView.select(3, false);
        assertThat(mResolver.resolve(GestureDirection.RIGHT_TO_LEFT, false))
                .isEqualTo(SwipeDestination.NONE);

        mTabsView.select(1, false);
        assertThat(mResolver.resolve(GestureDirection.LEFT_TO_RIGHT, false))
                .isEqualTo(SwipeDestination.NONE);
        assertThat(mResolver.resolve(GestureDirection.RIGHT_TO_LEFT, true))
                .isEqualTo(SwipeDestination.NONE);
    }

    @Test
    public void testResolve_staysInPrivatePartition() {
        mTabsView.select(10, true);
        assertThat(mResolver.resolve(GestureDirection.RIGHT_TO_LEFT, false))
                .isEqualTo(SwipeDestination.forTab(11, true));
        assertThat(mResolver.resolve(GestureDirection.LEFT_TO_RIGHT, false))
                .isEqualTo(SwipeDestination.NONE);
    }

    @Test
    public void testResolve_verticalIsTray() {
        mTabsView.select(2, false);
        assertThat(mResolver.resolve(GestureDirection.TOP_TO_BOTTOM, false))
                .isEqualTo(SwipeDestination.TRAY);
        assertThat(mResolver.resolve(GestureDirection.BOTTOM_TO_TOP, true))
                .isEqualTo(SwipeDestination.TRAY);
    }

    @Test
    public void testResolve_noSelectedTab() {
        assertThat(mResolver.resolve(GestureDirection.RIGHT_TO_LEFT, false))
                .isEqualTo(SwipeDestination.NONE);
    }

    @Test
    public void testResolve_selectedTabMissingFromList() {
        mTabsView.select(42, false);
        assertThat(mResolver.resolve(GestureDirection.RIGHT_TO_LEFT, false))
                .isEqualTo(SwipeDestination.NONE);
    }

    @Test
    public void testResolve_seesTabListChanges() {
        mTabsView.select(3, false);
        assertThat(mResolver.resolve(GestureDirection.RIGHT_TO_LEFT, false))
                .isEqualTo(SwipeDestination.NONE);

        mTabsView.setNormalTabs(1, 2, 3, 4);
        assertThat(mResolver.resolve(GestureDirection.RIGHT_TO_LEFT, false))
                .isEqualTo(SwipeDestination.forTab(4, false));
    }

    @Test
    public void testResolve_verticalDoesNotQueryTabs() {
        DestinationResolver resolver = new DestinationResolver(mMockTabsView);
        assertThat(resolver.resolve(GestureDirection.BOTTOM_TO_TOP, false))
                .isEqualTo(SwipeDestination.TRAY);
        verify(mMockTabsView, never()).getSelectedTabId();
    }

    @Test
    public void testResolve_queriesSelectedPartition() {
        when(mMockTabsView.getSelectedTabId()).thenReturn(7);
        when(mMockTabsView.isSelectedTabPrivate()).thenReturn(true);
        when(mMockTabsView.getTabIds(true)).thenReturn(Arrays.asList(5, 7));

        DestinationResolver resolver = new DestinationResolver(mMockTabsView);
        assertThat(resolver.resolve(GestureDirection.LEFT_TO_RIGHT, false))
                .isEqualTo(SwipeDestination.forTab(5, true));
        verify(mMockTabsView, never()).getTabIds(false);
    }
}
