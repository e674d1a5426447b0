package com.gdin.inspection.semanticrouter.route;

import com.gdin.inspection.semanticrouter.index.RouteIndex;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 启动时把本地路由同步到索引; 失败只记录日志, 服务照常启动
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "gdin.ai.router", name = "sync-on-startup", havingValue = "true", matchIfMissing = true)
public class RouteIndexInitializer implements ApplicationRunner {
    @Resource
    private RouteSyncService routeSyncService;

    @Resource
    private RouteCatalog routeCatalog;

    @Resource
    private RouteIndex routeIndex;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Initialising semantic router index...");
        long start = System.nanoTime();
        try {
            SyncReport report = routeSyncService.sync();
            log.info("Router ready in {}s - {} routes, index has {} vectors (added {}, removed {})",
                    String.format("%.2f", (System.nanoTime() - start) / 1e9),
                    routeCatalog.getRoutes().size(),
                    routeIndex.size(),
                    report.getAdded(),
                    report.getRemoved());
        } catch (Exception e) {
            log.error("Failed to initialise router index", e);
        }
    }
}
