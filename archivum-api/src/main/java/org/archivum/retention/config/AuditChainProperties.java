package org.archivum.retention.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "archivum.audit.chain")
public class AuditChainProperties {

    private boolean enabled = true;

    private String directory = "./logs/immutable";

    private String algorithm = "HmacSHA256";

    private String secret = "platform-immutable-secret-key";

    private String verificationCron = "0 0 3 * * ?";

    private boolean verificationEnabled = true;
}
