package com.gdin.inspection.semanticrouter.route;

import cn.hutool.core.collection.CollectionUtil;
import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.semanticrouter.config.properties.RouterProperties;
import com.gdin.inspection.semanticrouter.index.RouteDocumentFields;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 本地静态路由表, 来自 gdin.ai.router.routes
 */
@Slf4j
@Component
public class RouteCatalog {
    private final List<Route> routes;

    @Autowired
    public RouteCatalog(RouterProperties routerProperties) {
        this(routerProperties.getRoutes());
    }

    public RouteCatalog(List<Route> routes) {
        Set<String> names = new HashSet<>();
        List<Route> checked = new ArrayList<>();
        for (Route route : routes == null ? List.<Route>of() : routes) {
            if (StrUtil.isBlank(route.getName())) throw new IllegalArgumentException("路由名不能为空");
            if (RouteDocumentFields.CONFIG_ROUTE.equals(route.getName())) {
                throw new IllegalArgumentException("路由名 " + route.getName() + " 为保留名称");
            }
            if (route.getName().indexOf('`') >= 0) {
                throw new IllegalArgumentException("路由名不能包含反引号: " + route.getName());
            }
            if (!names.add(route.getName())) throw new IllegalArgumentException("路由名重复: " + route.getName());
            if (CollectionUtil.isEmpty(route.getUtterances())) log.warn("路由 '{}' 没有示例话术", route.getName());
            checked.add(route);
        }
        this.routes = Collections.unmodifiableList(checked);
        log.info("已加载 {} 个路由", this.routes.size());
    }

    public List<Route> getRoutes() {
        return routes;
    }

    /**
     * 路由名 -> 去重后的话术, 保持声明顺序
     */
    public Map<String, Set<String>> utterancesByRoute() {
        Map<String, Set<String>> result = new LinkedHashMap<>();
        for (Route route : routes) {
            Set<String> utterances = new LinkedHashSet<>();
            if (route.getUtterances() != null) utterances.addAll(route.getUtterances());
            result.put(route.getName(), utterances);
        }
        return result;
    }
}
