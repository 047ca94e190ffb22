package com.streamfirst.ddns.boot;

import com.streamfirst.ddns.application.ResolutionSettings;
import com.streamfirst.ddns.application.SyncSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Externalized bridge configuration, bound from the {@code ddns.*} properties.
 */
@Data
@ConfigurationProperties(prefix = "ddns")
public class BridgeProperties {

    private Sync sync = new Sync();
    private Resolution resolution = new Resolution();
    private Ipfs ipfs = new Ipfs();
    private Demo demo = new Demo();

    @Data
    public static class Sync {
        /** Start polling and applying as soon as the application is up */
        private boolean autoStart = true;
        private Duration pollInterval = Duration.ofSeconds(30);
        private Duration applyInterval = Duration.ofSeconds(1);
        private int applyBatchSize = 1;
        private int maxRetries = 5;
        private int confirmations = 3;
        private long safetyWindow = 10_000L;
        private Duration shutdownGrace = Duration.ofSeconds(5);

        SyncSettings toSettings() {
            return SyncSettings.builder()
                    .pollInterval(pollInterval)
                    .applyInterval(applyInterval)
                    .applyBatchSize(applyBatchSize)
                    .maxRetries(maxRetries)
                    .confirmations(confirmations)
                    .safetyWindow(safetyWindow)
                    .shutdownGrace(shutdownGrace)
                    .build();
        }
    }

    @Data
    public static class Resolution {
        private boolean cacheEnabled = true;
        private boolean preferFast = true;
        private boolean verifyWithAuthoritative = false;
        private Duration tierTimeout = Duration.ofSeconds(2);
        private Duration maxCacheTtl;
        private int tierThreads = 8;

        ResolutionSettings toSettings() {
            return ResolutionSettings.builder()
                    .cacheEnabled(cacheEnabled)
                    .preferFast(preferFast)
                    .verifyWithAuthoritative(verifyWithAuthoritative)
                    .tierTimeout(tierTimeout)
                    .maxCacheTtl(maxCacheTtl)
                    .build();
        }
    }

    @Data
    public static class Ipfs {
        /** Gateway base URL such as https://ipfs.io/ipfs/; blank keeps content in memory */
        private String gateway = "";
        private Duration requestTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Demo {
        /** Seed the in-memory ledgers with a sample domain on startup */
        private boolean enabled = false;
        private String domain = "example.eth";
    }
}
