package com.apex.resilience.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "apex.resilience")
@Validated
@Data
public class ResilienceProperties {

    @Valid
    private Circuit circuit = new Circuit();
    @Valid
    private Lease lease = new Lease();
    private Failover failover = new Failover();

    @Data
    public static class Circuit {
        private double maxErrRate = 0.15;
        private int windowSec = 300;
        private int minClosedSec = 180;
        private int halfOpenProbe = 5;
        private boolean threadSafe = true;
        private Integer eventsMaxlen;
        private int eventsPerSecHint = 1;
        private int maxLogLinesPerSec = 10;
        /**
         * Per-resource overrides; unset fields fall back to the values above.
         */
        private Map<String, ResourceOverride> resources = new LinkedHashMap<>();
    }

    @Data
    public static class ResourceOverride {
        private Double maxErrRate;
        private Integer windowSec;
        private Integer minClosedSec;
        private Integer halfOpenProbe;
    }

    @Data
    public static class Lease {
        @NotBlank
        private String key = "apex:leader";
        /**
         * Identity written into the store. Blank means hostname plus a random suffix.
         */
        private String holderId = "";
        private long ttlMs = 3000;
        private long renewMs = 1500;
        private String env = "dev";
        private String service = "apex";
        private StoreType store = StoreType.MEMORY;
    }

    public enum StoreType {
        MEMORY,
        REDIS
    }

    @Data
    public static class Failover {
        private boolean schedulerEnabled = false;
        private long tickIntervalMs = 500;
    }
}
