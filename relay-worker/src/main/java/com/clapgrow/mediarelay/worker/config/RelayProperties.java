package com.clapgrow.mediarelay.worker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the relay worker.
 * 
 * Maps to:
 * relay:
 *   session:
 *     reconnect-delay: 3s
 *   directory:
 *     retry-interval: 5s
 *   delivery:
 *     cleanup-grace: 30s
 *   routing:
 *     config-file: config.json
 *   engine:
 *     base-url: http://localhost:3002
 */
@Configuration
@ConfigurationProperties(prefix = "relay")
@Data
public class RelayProperties {
    
    private Session session = new Session();
    private Directory directory = new Directory();
    private Delivery delivery = new Delivery();
    private Routing routing = new Routing();
    private Engine engine = new Engine();
    
    @Data
    public static class Session {
        /**
         * Initialise the engine as soon as the application is ready.
         */
        private boolean autoStart = true;
        
        /**
         * Delay before re-initialising after the engine reports a disconnect.
         */
        private Duration reconnectDelay = Duration.ofSeconds(3);
        
        /**
         * Delay before retrying a failed initialisation.
         */
        private Duration initRetryDelay = Duration.ofSeconds(5);
        
        /**
         * Delay between destroying a corrupted engine and wiping its session data.
         */
        private Duration corruptionCleanupDelay = Duration.ofSeconds(1);
        
        /**
         * Delay between wiping session data and the next initialisation.
         */
        private Duration corruptionRestartDelay = Duration.ofSeconds(3);
        
        /**
         * Persisted credentials of the engine.
         */
        private String authDir = ".wwebjs_auth";
        
        /**
         * Engine page cache.
         */
        private String cacheDir = ".wwebjs_cache";
        
        /**
         * Error message fragments that mean the session is corrupted.
         */
        private List<String> corruptionSignatures = new ArrayList<>(List.of(
            "Execution context was destroyed",
            "Protocol error",
            "Evaluation failed"
        ));
    }
    
    @Data
    public static class Directory {
        private Duration retryInterval = Duration.ofSeconds(5);
        
        /**
         * Attempts while the chat list still has no groups.
         */
        private int maxAttempts = 20;
        
        /**
         * Total attempts, confirmatory re-checks included, once groups were found.
         */
        private int maxConfirmAttempts = 5;
    }
    
    @Data
    public static class Delivery {
        /**
         * Root for temporary media files.
         */
        private String publicDir = "public";
        
        /**
         * How long a temporary media file is kept after it was written.
         */
        private Duration cleanupGrace = Duration.ofSeconds(30);
        
        private boolean parallelFanOut = true;
        
        private int fanOutThreads = 4;
        
        /**
         * How long ids of messages sent by the relay are remembered for loop detection.
         */
        private Duration loopGuardTtl = Duration.ofMinutes(10);
    }
    
    @Data
    public static class Routing {
        private String configFile = "config.json";
    }
    
    @Data
    public static class Engine {
        private String baseUrl = "http://localhost:3002";
        
        /**
         * Upper bound for a single bridge call; initialisation can take a while.
         */
        private Duration requestTimeout = Duration.ofSeconds(120);
        
        private int maxInMemorySize = 64 * 1024 * 1024;
    }
}
