package com.sni.curation.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic full rebuild of the hierarchy cache, to repair drift left by out-of-band writes to
 * {@code narratives}. Disabled by default; correctness does not depend on it.
 */
@Service
public class HierarchyCacheRebuildJob {

    private static final Logger logger = LoggerFactory.getLogger(HierarchyCacheRebuildJob.class);

    private final HierarchyCacheService hierarchyCache;
    private final boolean enabled;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HierarchyCacheRebuildJob(HierarchyCacheService hierarchyCache,
                                    @Value("${app.hierarchy.cache.rebuild.enabled:false}") boolean enabled) {
        this.hierarchyCache = hierarchyCache;
        this.enabled = enabled;
    }

    @Scheduled(fixedDelayString = "${app.hierarchy.cache.rebuild.interval-ms:3600000}",
            initialDelayString = "${app.hierarchy.cache.rebuild.initial-delay-ms:60000}")
    public void rebuild() {
        if (!enabled) {
            return;
        }
        if (!running.compareAndSet(false, true)) {
            logger.debug("Hierarchy cache rebuild already running; skipping this tick");
            return;
        }
        try {
            int changed = hierarchyCache.refreshHierarchyCache();
            if (changed > 0) {
                logger.warn("Hierarchy cache rebuild corrected {} rows", changed);
            }
        } catch (RuntimeException e) {
            logger.error("Hierarchy cache rebuild failed", e);
        } finally {
            running.set(false);
        }
    }
}
