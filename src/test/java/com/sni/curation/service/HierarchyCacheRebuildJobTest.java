package com.sni.curation.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HierarchyCacheRebuildJobTest {

    @Mock
    private HierarchyCacheService hierarchyCache;

    @Test
    void disabledJobDoesNothing() {
        new HierarchyCacheRebuildJob(hierarchyCache, false).rebuild();

        verify(hierarchyCache, never()).refreshHierarchyCache();
    }

    @Test
    void enabledJobRefreshesOnEveryTick() {
        when(hierarchyCache.refreshHierarchyCache()).thenReturn(3, 0);
        HierarchyCacheRebuildJob job = new HierarchyCacheRebuildJob(hierarchyCache, true);

        job.rebuild();
        job.rebuild();

        verify(hierarchyCache, times(2)).refreshHierarchyCache();
    }

    @Test
    void failedRefreshDoesNotStopLaterTicks() {
        when(hierarchyCache.refreshHierarchyCache())
                .thenThrow(new IllegalStateException("connection reset"))
                .thenReturn(0);
        HierarchyCacheRebuildJob job = new HierarchyCacheRebuildJob(hierarchyCache, true);

        assertThatCode(job::rebuild).doesNotThrowAnyException();
        job.rebuild();

        verify(hierarchyCache, times(2)).refreshHierarchyCache();
    }
}
