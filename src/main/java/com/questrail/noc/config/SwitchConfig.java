package com.questrail.noc.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Connection settings for one SSH-managed switch.
 *
 * <p>{@code enableSecret} is optional: switches that log straight into
 * privileged mode need none, and callers may also pass the secret to
 * {@code enable} explicitly.</p>
 */
public record SwitchConfig(
    String host,
    int port,
    String username,
    String password,
    Optional<String> enableSecret,
    PollingPolicy pollingPolicy
) {
    public static final int DEFAULT_SSH_PORT = 22;

    public SwitchConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");
        Objects.requireNonNull(enableSecret, "enableSecret");
        Objects.requireNonNull(pollingPolicy, "pollingPolicy");

        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be 1-65535 (was " + port + ")");
        }
    }

    @Override
    public String toString() {
        return "SwitchConfig[" + username + "@" + host + ":" + port + "]";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host;
        private int port = DEFAULT_SSH_PORT;
        private String username;
        private String password;
        private String enableSecret;
        private PollingPolicy pollingPolicy = PollingPolicy.defaults();

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withCredentials(String username, String password) {
            this.username = username;
            this.password = password;
            return this;
        }

        public Builder withEnableSecret(String enableSecret) {
            this.enableSecret = enableSecret;
            return this;
        }

        public Builder withPollingPolicy(PollingPolicy pollingPolicy) {
            this.pollingPolicy = pollingPolicy;
            return this;
        }

        public SwitchConfig build() {
            return new SwitchConfig(host, port, username, password,
                    Optional.ofNullable(enableSecret), pollingPolicy);
        }
    }
}
