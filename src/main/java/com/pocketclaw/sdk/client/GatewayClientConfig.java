package com.pocketclaw.sdk.client;

import com.pocketclaw.sdk.models.ClientInfo;
import com.pocketclaw.sdk.streaming.HeartbeatFilter;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Configuration for the gateway client.
 */
public class GatewayClientConfig {

    private final String url;
    private final String token;
    private final String password;
    private final Duration requestTimeout;
    private final Duration connectTimeout;
    private final Duration challengeTimeout;
    private final Duration challengePollInterval;
    private final int protocolVersion;
    private final ClientInfo clientInfo;
    private final int maxReconnectAttempts;
    private final Duration reconnectMinDelay;
    private final Duration reconnectMaxDelay;
    private final List<String> heartbeatPatterns;

    private GatewayClientConfig(Builder builder) {
        this.url = builder.url;
        this.token = builder.token;
        this.password = builder.password;
        this.requestTimeout = builder.requestTimeout;
        this.connectTimeout = builder.connectTimeout;
        this.challengeTimeout = builder.challengeTimeout;
        this.challengePollInterval = builder.challengePollInterval;
        this.protocolVersion = builder.protocolVersion;
        this.clientInfo = builder.clientInfo;
        this.maxReconnectAttempts = builder.maxReconnectAttempts;
        this.reconnectMinDelay = builder.reconnectMinDelay;
        this.reconnectMaxDelay = builder.reconnectMaxDelay;
        this.heartbeatPatterns = List.copyOf(builder.heartbeatPatterns);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static GatewayClientConfig defaultConfig() {
        return builder().build();
    }

    /**
     * WebSocket URL of the gateway, {@code ws://} or {@code wss://}.
     */
    public String getUrl() {
        return url;
    }

    public String getToken() {
        return token;
    }

    public String getPassword() {
        return password;
    }

    /**
     * Default deadline for one RPC.
     */
    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    /**
     * How long to wait for {@code connect.challenge} after the socket opens.
     */
    public Duration getChallengeTimeout() {
        return challengeTimeout;
    }

    public Duration getChallengePollInterval() {
        return challengePollInterval;
    }

    public int getProtocolVersion() {
        return protocolVersion;
    }

    public ClientInfo getClientInfo() {
        return clientInfo;
    }

    public int getMaxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    public Duration getReconnectMinDelay() {
        return reconnectMinDelay;
    }

    public Duration getReconnectMaxDelay() {
        return reconnectMaxDelay;
    }

    public List<String> getHeartbeatPatterns() {
        return heartbeatPatterns;
    }

    /**
     * Builder for creating GatewayClientConfig instances.
     */
    public static class Builder {
        private String url = "ws://localhost:18789";
        private String token;
        private String password;
        private Duration requestTimeout = Duration.ofSeconds(30);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration challengeTimeout = Duration.ofSeconds(10);
        private Duration challengePollInterval = Duration.ofMillis(100);
        private int protocolVersion = 3;
        private ClientInfo clientInfo = ClientInfo.DEFAULT;
        private int maxReconnectAttempts = 5;
        private Duration reconnectMinDelay = Duration.ofSeconds(1);
        private Duration reconnectMaxDelay = Duration.ofSeconds(30);
        private List<String> heartbeatPatterns = HeartbeatFilter.DEFAULT_PATTERNS;

        public Builder url(String url) {
            this.url = Objects.requireNonNull(url, "url must not be null");
            return this;
        }

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
            return this;
        }

        public Builder challengeTimeout(Duration challengeTimeout) {
            this.challengeTimeout = Objects.requireNonNull(challengeTimeout, "challengeTimeout must not be null");
            return this;
        }

        public Builder challengePollInterval(Duration challengePollInterval) {
            this.challengePollInterval = Objects.requireNonNull(challengePollInterval,
                    "challengePollInterval must not be null");
            return this;
        }

        public Builder protocolVersion(int protocolVersion) {
            this.protocolVersion = protocolVersion;
            return this;
        }

        public Builder clientInfo(ClientInfo clientInfo) {
            this.clientInfo = Objects.requireNonNull(clientInfo, "clientInfo must not be null");
            return this;
        }

        public Builder maxReconnectAttempts(int maxReconnectAttempts) {
            this.maxReconnectAttempts = maxReconnectAttempts;
            return this;
        }

        public Builder reconnectMinDelay(Duration reconnectMinDelay) {
            this.reconnectMinDelay = Objects.requireNonNull(reconnectMinDelay, "reconnectMinDelay must not be null");
            return this;
        }

        public Builder reconnectMaxDelay(Duration reconnectMaxDelay) {
            this.reconnectMaxDelay = Objects.requireNonNull(reconnectMaxDelay, "reconnectMaxDelay must not be null");
            return this;
        }

        public Builder heartbeatPatterns(List<String> heartbeatPatterns) {
            this.heartbeatPatterns = Objects.requireNonNull(heartbeatPatterns, "heartbeatPatterns must not be null");
            return this;
        }

        public GatewayClientConfig build() {
            return new GatewayClientConfig(this);
        }
    }
}
