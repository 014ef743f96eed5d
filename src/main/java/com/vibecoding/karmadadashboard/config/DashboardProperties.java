package com.vibecoding.karmadadashboard.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;


@Configuration
@ConfigurationProperties(prefix = "dashboard")
@Data
public class DashboardProperties {

    private static final Logger log = LoggerFactory.getLogger(DashboardProperties.class);

    static final String DEFAULT_JWT_SECRET = "default-karmada-dashboard-secret-key";
    static final String DEFAULT_ADMIN_PASSWORD = "admin123";

    private String envName = "prod";
    private Kube karmada = new Kube();
    private Kube management = new Kube();
    private Auth auth = new Auth();
    private Etcd etcd = new Etcd();
    private Keycloak keycloak = new Keycloak();
    private OpenFga openfga = new OpenFga();
    private Porch porch = new Porch();
    private Terminal terminal = new Terminal();
    private DashboardConfigMap dashboardConfig = new DashboardConfigMap();

    @Data
    public static class Kube {
        private String kubeconfig;
        private String context;
        private boolean skipTlsVerify = false;
        private Integer requestTimeout = 30000;
        private Integer connectionTimeout = 10000;
    }

    @Data
    public static class Auth {
        private String jwtSecret = DEFAULT_JWT_SECRET;
        private long tokenTtlHours = 24;
        private String issuer = "karmada-dashboard-api";
        private String adminPassword = DEFAULT_ADMIN_PASSWORD;
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }

    @Data
    public static class Etcd {
        private String endpoint;
        private String host = "etcd";
        private int port = 2379;
        private int connectRetries = 3;
        private long retryBackoffMillis = 500;
        private long requestTimeoutMillis = 5000;
    }

    @Data
    public static class Keycloak {
        private boolean enabled = false;
        private String url = "http://keycloak.ml-platform-system.svc:8080";
        private String realm;
        private String clientId = "ml-platform-admin";
        private String clientSecret;
        private String frontendUrl = "http://localhost:5173";

        public String getJwkSetUri() {
            return url + "/realms/" + realm + "/protocol/openid-connect/certs";
        }
    }

    @Data
    public static class OpenFga {
        private String apiUrl;
        private String storeName = "ml-platform-admin";
    }

    @Data
    public static class Porch {
        private String apiUrl;
        private boolean skipTlsVerify = false;
        private String serviceAccountName = "karmada-dashboard";
        private String serviceAccountNamespace = "karmada-system";
        private long tokenLifetimeSeconds = 3600;
    }

    @Data
    public static class Terminal {
        private String defaultShell = "/bin/bash";
        private String nodeShellImage = "ubuntu";
        private String nodeShellNamespace = "default";
        private long nodeShellReadyTimeoutSeconds = 120;
    }

    @Data
    public static class DashboardConfigMap {
        private String namespace = "karmada-system";
        private String name = "karmada-dashboard-configmap";
    }

    @PostConstruct
    public void init() {
        if (keycloak.getRealm() == null || keycloak.getRealm().isBlank()) {
            keycloak.setRealm("dev".equalsIgnoreCase(envName) ? "ml-platform-dev" : "ml-platform");
        }
        validateConfig();
    }

    public void validateConfig() {
        if (auth.getJwtSecret() == null || auth.getJwtSecret().isBlank()) {
            throw new IllegalStateException("dashboard.auth.jwt-secret must not be empty");
        }
        if (DEFAULT_JWT_SECRET.equals(auth.getJwtSecret())) {
            log.warn("KARMADA_DASHBOARD_JWT_SECRET is not set, using the default signing secret");
        }
        if (DEFAULT_ADMIN_PASSWORD.equals(auth.getAdminPassword())) {
            log.info("Using default admin password for initialization");
        }

        log.info("Dashboard configuration loaded");
        log.info("  - Environment: {}", envName);
        log.info("  - Karmada kubeconfig: {}", karmada.getKubeconfig() != null ? karmada.getKubeconfig() : "(auto)");
        log.info("  - Management kubeconfig: {}", management.getKubeconfig() != null ? management.getKubeconfig() : "(auto)");
        log.info("  - Keycloak: {}", keycloak.isEnabled() ? keycloak.getUrl() + " realm=" + keycloak.getRealm() : "disabled");
        log.info("  - OpenFGA: {}", isOpenFgaEnabled() ? openfga.getApiUrl() : "disabled");
        log.info("  - Porch: {}", porch.getApiUrl() != null && !porch.getApiUrl().isBlank() ? porch.getApiUrl() : "disabled");
    }

    public boolean isOpenFgaEnabled() {
        return openfga.getApiUrl() != null && !openfga.getApiUrl().isBlank();
    }

    /**
     * 환경별 대시보드 설정 키 (예: prod.yaml)
     */
    public String getDashboardConfigKey() {
        return envName + ".yaml";
    }
}
