package com.agile.Buro.Config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

@Data
@Validated
@ConfigurationProperties("buro")
public class BuroProperties {

    @Valid
    private Cors cors = new Cors();

    @Valid
    private Access access = new Access();

    @Valid
    private Issues issues = new Issues();

    @Valid
    private Analytics analytics = new Analytics();

    @Valid
    private Mail mail = new Mail();

    private Bootstrap bootstrap = new Bootstrap();

    @Valid
    private Cleanup cleanup = new Cleanup();

    @Valid
    private Cookie cookie = new Cookie();

    @Data
    public static class Cors {
        @NotEmpty
        private List<String> allowedOrigins = List.of("http://localhost:3000", "http://localhost:5173");
    }

    @Data
    public static class Access {
        /** "project" consults project_members, "open" lets every active user in. */
        @Pattern(regexp = "project|open")
        private String membership = "project";
    }

    @Data
    public static class Issues {
        @Min(1) @Max(100)
        private int defaultPageSize = 50;

        @Min(1) @Max(100)
        private int maxPageSize = 100;

        @Min(1) @Max(5000)
        private int kanbanLimit = 1000;
    }

    @Data
    public static class Analytics {
        @Positive
        private int velocityDays = 30;
    }

    @Data
    public static class Mail {
        private boolean enabled = false;

        @NotBlank
        private String from = "noreply@buro.dev";

        @NotBlank
        private String frontendUrl = "http://localhost:3000";
    }

    @Data
    public static class Bootstrap {
        private String adminEmail;
        private String adminPassword;
        private String adminName = "System Admin";
    }

    @Data
    public static class Cleanup {
        @NotBlank
        private String cron = "0 0 2 * * *";

        @NotBlank
        private String zone = "UTC";
    }

    @Data
    public static class Cookie {
        private boolean secure = true;

        @Pattern(regexp = "Strict|Lax|None")
        private String sameSite = "Lax";
    }
}
