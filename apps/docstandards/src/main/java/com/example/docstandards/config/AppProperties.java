package com.example.docstandards.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Validation validation = new Validation();
    private Blob blob = new Blob();
    private Store store = new Store();
    private Locks locks = new Locks();
    private Audit audit = new Audit();
    private Documents documents = new Documents();
    private Standards standards = new Standards();

    @Data
    public static class Validation {
        private boolean enabled = true;
        private int workers = 4;
        private Duration pollInterval = Duration.ofMillis(500);
        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private Duration maxBackoff = Duration.ofMinutes(5);
        private Duration claimLease = Duration.ofMinutes(2);
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private Duration blobFetchTimeout = Duration.ofSeconds(20);
        private Duration evaluationTimeout = Duration.ofSeconds(30);
        private String workerIdPrefix = "worker";
    }

    @Data
    public static class Blob {
        private String type = "s3";  // "s3" or "memory"
        private String bucket = "documents";
        private String region = "us-east-1";
        private String endpoint;  // MinIO/LocalStack override
        private String accessKeyId;
        private String secretAccessKey;
        private String kmsKeyId;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Store {
        private String type = "mongo";  // "mongo" or "memory"
    }

    @Data
    public static class Locks {
        private Duration acquireTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Audit {
        private int appendMaxRetries = 5;
        private Duration appendBackoff = Duration.ofMillis(200);
        private int defaultPageSize = 100;
        private int maxPageSize = 500;
    }

    @Data
    public static class Documents {
        private int maxFileSizeMb = 25;
        private List<String> allowedExtensions = List.of("odt", "ott", "ods", "ots", "odp", "otp");
    }

    @Data
    public static class Standards {
        private int cacheMaxSize = 1000;
        private int defaultPageSize = 100;
        private int maxPageSize = 500;
    }
}
