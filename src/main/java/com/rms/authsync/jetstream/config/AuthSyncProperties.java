package com.rms.authsync.jetstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Process identity and NATS connection settings.
 *
 * <h2>Binding</h2>
 * <pre>
 * authsync:
 *   node-id: authsync-01
 *   nats-url: nats://localhost:4222
 *   nats-user: ...
 *   nats-password: ...
 *   nats-token: ...
 *   nats-creds: /path/to/user.creds
 *   nats-tls: false
 * </pre>
 *
 * <p>Secrets should come from the environment, not from committed config files.</p>
 */
@ConfigurationProperties(prefix = "authsync")
public class AuthSyncProperties {

    /**
     * Name of this consumer process. Used as the NATS connection name and written to logs, so
     * several replicas sharing one durable can be told apart.
     */
    private String nodeId = "authsync-01";

    /** NATS server URL, e.g. {@code nats://localhost:4222} or {@code tls://nats.internal:4222}. */
    private String natsUrl = "nats://localhost:4222";

    /** Optional username; used together with {@link #natsPassword}. */
    private String natsUser;

    private String natsPassword;

    /** Optional token auth. Ignored when blank. */
    private String natsToken;

    /** Optional path to a {@code .creds} file (JWT + NKey seed). */
    private String natsCreds;

    /** Forces TLS even when the URL scheme is {@code nats://}. */
    private boolean natsTls = false;

    public String getNodeId() { return nodeId; }
    public void setNodeId(String nodeId) { this.nodeId = nodeId; }

    public String getNatsUrl() { return natsUrl; }
    public void setNatsUrl(String natsUrl) { this.natsUrl = natsUrl; }

    public String getNatsUser() { return natsUser; }
    public void setNatsUser(String natsUser) { this.natsUser = natsUser; }

    public String getNatsPassword() { return natsPassword; }
    public void setNatsPassword(String natsPassword) { this.natsPassword = natsPassword; }

    public String getNatsToken() { return natsToken; }
    public void setNatsToken(String natsToken) { this.natsToken = natsToken; }

    public String getNatsCreds() { return natsCreds; }
    public void setNatsCreds(String natsCreds) { this.natsCreds = natsCreds; }

    public boolean isNatsTls() { return natsTls; }
    public void setNatsTls(boolean natsTls) { this.natsTls = natsTls; }
}
