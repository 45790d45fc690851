package com.questrail.noc.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings for one SNMP-managed power distribution unit.
 *
 * <p>Reads use the public community, writes the private community. Defaults
 * follow the usual APC agent: port 161, 1.5 s request timeout, 2 retries.</p>
 */
public record PduConfig(
    String host,
    int port,
    String publicCommunity,
    String privateCommunity,
    Duration requestTimeout,
    int retries,
    PollingPolicy pollingPolicy
) {
    public static final int DEFAULT_SNMP_PORT = 161;

    public PduConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(publicCommunity, "publicCommunity");
        Objects.requireNonNull(privateCommunity, "privateCommunity");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        Objects.requireNonNull(pollingPolicy, "pollingPolicy");

        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be 1-65535 (was " + port + ")");
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be non-negative");
        }
    }

    @Override
    public String toString() {
        return "PduConfig[" + host + ":" + port + "]";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host;
        private int port = DEFAULT_SNMP_PORT;
        private String publicCommunity = "public";
        private String privateCommunity = "private";
        private Duration requestTimeout = Duration.ofMillis(1500);
        private int retries = 2;
        private PollingPolicy pollingPolicy = PollingPolicy.defaults();

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withCommunities(String publicCommunity, String privateCommunity) {
            this.publicCommunity = publicCommunity;
            this.privateCommunity = privateCommunity;
            return this;
        }

        public Builder withRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder withRetries(int retries) {
            this.retries = retries;
            return this;
        }

        public Builder withPollingPolicy(PollingPolicy pollingPolicy) {
            this.pollingPolicy = pollingPolicy;
            return this;
        }

        public PduConfig build() {
            return new PduConfig(host, port, publicCommunity, privateCommunity,
                    requestTimeout, retries, pollingPolicy);
        }
    }
}
