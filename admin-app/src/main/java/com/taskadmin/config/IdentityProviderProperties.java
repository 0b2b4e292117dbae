package com.taskadmin.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 身份提供方（Auth0）配置。
 */
@Data
@ConfigurationProperties(prefix = "app.identity")
public class IdentityProviderProperties {

    /** 租户域名，例如 tenant.eu.auth0.com。 */
    private String domain;

    /** Management API client id。 */
    private String clientId;

    /** Management API client secret。 */
    private String clientSecret;

    /** Management API 受众，缺省为 https://{domain}/api/v2/。 */
    private String managementAudience;

    /** 业务 API 访问令牌受众。 */
    private String apiAudience;

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(10);

    private Roles roles = new Roles();

    public String issuer() {
        return "https://" + domain + "/";
    }

    public String resolveManagementAudience() {
        return managementAudience == null || managementAudience.isBlank()
                ? "https://" + domain + "/api/v2/"
                : managementAudience;
    }

    @Data
    public static class Roles {

        private Role user = new Role("rol_wgtsNMZVvH6xhrnu", "User");

        private Role member = new Role("rol_ojPUsNcwlWeofPmS", "Member");

        private Role admin = new Role("rol_9wVRSPWcCNB3AypM", "Admin");
    }

    @Data
    public static class Role {

        private String id;

        private String name;

        public Role() {
        }

        public Role(String id, String name) {
            this.id = id;
            this.name = name;
        }
    }
}
