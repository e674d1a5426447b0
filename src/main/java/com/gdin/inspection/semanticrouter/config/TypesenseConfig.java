package com.gdin.inspection.semanticrouter.config;

import com.gdin.inspection.semanticrouter.config.properties.TypesenseProperties;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.typesense.api.Client;
import org.typesense.resources.Node;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Configuration
public class TypesenseConfig {
    @Resource
    private TypesenseProperties typesenseProperties;

    @Bean
    public Client typesenseApiClient() {
        List<Node> nodes = new ArrayList<>();
        nodes.add(new Node(typesenseProperties.getProtocol(), typesenseProperties.getHost(), typesenseProperties.getPort()));
        org.typesense.api.Configuration configuration = new org.typesense.api.Configuration(
                nodes,
                Duration.ofSeconds(typesenseProperties.getConnectionTimeoutSeconds()),
                typesenseProperties.getApiKey());
        log.info("Typesense 节点: {}", typesenseProperties.getBaseUrl());
        return new Client(configuration);
    }
}
