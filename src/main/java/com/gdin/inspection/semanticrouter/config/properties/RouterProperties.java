package com.gdin.inspection.semanticrouter.config.properties;

import com.gdin.inspection.semanticrouter.route.Route;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "gdin.ai.router")
@Component
public class RouterProperties implements Serializable {
    // 启动时是否把本地路由同步到 Typesense
    private Boolean syncOnStartup = true;
    private List<Route> routes = new ArrayList<>();
}
