package com.rms.authsync.jetstream.config;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamManagement;
import io.nats.client.Nats;
import io.nats.client.Options;

/**
 * Wires the NATS {@link Connection}, the JetStream client APIs and all {@code authsync.*}
 * property classes.
 *
 * <h2>Connection</h2>
 * <ul>
 *   <li>One shared connection for the application lifecycle, closed on shutdown.</li>
 *   <li>Supports no-auth, user/password, token and creds-file auth, with optional TLS.</li>
 *   <li>Reconnects forever once connected; the poller treats a disconnected period as a
 *       stream-level failure and keeps sweeping.</li>
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({
        AuthSyncProperties.class,
        ConsumerProperties.class,
        ReplicationProperties.class
})
public class NatsJetStreamConfig {

    private static final Logger log = LoggerFactory.getLogger(NatsJetStreamConfig.class);

    private static final Duration RECONNECT_WAIT = Duration.ofSeconds(2);

    @Bean(destroyMethod = "close")
    public Connection natsConnection(AuthSyncProperties props) throws Exception {
        Options.Builder builder = new Options.Builder()
                .server(props.getNatsUrl())
                .connectionName(props.getNodeId())
                .maxReconnects(-1)
                .reconnectWait(RECONNECT_WAIT);

        if (props.isNatsTls()) {
            builder.secure();
        }
        if (hasText(props.getNatsToken())) {
            builder.token(props.getNatsToken().toCharArray());
        }
        if (hasText(props.getNatsUser())) {
            String pass = props.getNatsPassword() == null ? "" : props.getNatsPassword();
            builder.userInfo(props.getNatsUser().toCharArray(), pass.toCharArray());
        }
        if (hasText(props.getNatsCreds())) {
            builder.authHandler(Nats.credentials(props.getNatsCreds()));
        }

        Connection connection = Nats.connect(builder.build());

        log.info("Connected to NATS url={} node={} tls={} user={} creds={}",
                props.getNatsUrl(),
                props.getNodeId(),
                props.isNatsTls(),
                mask(props.getNatsUser()),
                hasText(props.getNatsCreds()) ? props.getNatsCreds() : "");

        return connection;
    }

    @Bean
    public JetStream jetStream(Connection connection) throws Exception {
        return connection.jetStream();
    }

    @Bean
    public JetStreamManagement jetStreamManagement(Connection connection) throws Exception {
        return connection.jetStreamManagement();
    }

    private static boolean hasText(String v) {
        return v != null && !v.isBlank();
    }

    /**
     * "admin" -> "a***n". Not cryptographic; just keeps raw identifiers out of logs.
     */
    static String mask(String v) {
        if (v == null || v.isBlank()) return "";
        if (v.length() <= 2) return "**";
        return v.substring(0, 1) + "***" + v.substring(v.length() - 1);
    }
}
