package com.gdin.inspection.semanticrouter.config;

import cn.hutool.core.util.StrUtil;
import com.azure.core.credential.AccessToken;
import com.azure.core.credential.TokenCredential;
import com.azure.identity.DefaultAzureCredentialBuilder;
import com.gdin.inspection.semanticrouter.config.properties.EncoderProperties;
import jakarta.annotation.Resource;
import dev.langchain4j.model.azure.AzureOpenAiEmbeddingModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;

@Slf4j
@Configuration
public class AIConfig {
    @Resource
    private EncoderProperties encoderProperties;

    /**
     * 懒加载: 未配置 Azure OpenAI 时服务依然可以启动, 只在第一次向量化时失败
     */
    @Lazy
    @Bean
    public EmbeddingModel embeddingModel() {
        if (StrUtil.isBlank(encoderProperties.getEndpoint())) {
            throw new IllegalStateException("AZURE_OPENAI_ENDPOINT is required.");
        }
        TokenCredential tokenCredential = null;
        String apiKey = null;
        switch (encoderProperties.resolveAuthMethod()) {
            case MANAGED_IDENTITY -> {
                log.info("Using Managed Identity / DefaultAzureCredential for auth.");
                tokenCredential = new DefaultAzureCredentialBuilder().build();
            }
            case AD_TOKEN -> {
                log.info("Using static Entra ID token for auth.");
                tokenCredential = staticToken(encoderProperties.getAdToken());
            }
            case API_KEY -> {
                log.info("Using API key for auth.");
                apiKey = encoderProperties.getApiKey();
            }
        }
        return AzureOpenAiEmbeddingModel.builder()
                .endpoint(encoderProperties.getEndpoint())
                .serviceVersion(encoderProperties.getApiVersion())
                .deploymentName(encoderProperties.getDeployment())
                .tokenCredential(tokenCredential)
                .apiKey(apiKey)
                .build();
    }

    // 静态 token 不会刷新, 每次请求都返回同一个值
    private TokenCredential staticToken(String token) {
        return request -> Mono.just(new AccessToken(token, OffsetDateTime.now().plusHours(1)));
    }
}
