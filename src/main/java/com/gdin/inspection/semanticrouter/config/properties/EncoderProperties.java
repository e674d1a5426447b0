package com.gdin.inspection.semanticrouter.config.properties;

import cn.hutool.core.util.StrUtil;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;

/**
 * Azure OpenAI 向量化模型配置
 */
@Data
@ConfigurationProperties(prefix = "gdin.ai.encoder")
@Component
public class EncoderProperties implements Serializable {
    private String endpoint;
    private String apiVersion = "2024-02-01";
    private String deployment = "text-embedding-ada-002";
    private Boolean useManagedIdentity = false;
    private String adToken;
    private String apiKey;

    public enum AuthMethod {
        MANAGED_IDENTITY,
        AD_TOKEN,
        API_KEY
    }

    /**
     * 按顺序选择鉴权方式: 托管身份 > 静态 Entra ID token > API key
     */
    public AuthMethod resolveAuthMethod() {
        if (Boolean.TRUE.equals(useManagedIdentity)) return AuthMethod.MANAGED_IDENTITY;
        if (StrUtil.isNotBlank(adToken)) return AuthMethod.AD_TOKEN;
        if (StrUtil.isNotBlank(apiKey)) return AuthMethod.API_KEY;
        throw new IllegalStateException("No Azure OpenAI auth configured. Set one of: "
                + "AZURE_USE_MANAGED_IDENTITY=true, AZURE_AD_TOKEN, or AZURE_OPENAI_API_KEY.");
    }
}
