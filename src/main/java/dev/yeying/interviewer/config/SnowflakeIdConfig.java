package dev.yeying.interviewer.config;

import dev.yeying.interviewer.util.SnowflakeId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.UnknownHostException;

/**
 * Identifier generator wiring.
 *
 * <p>The node id comes from {@code app.snowflake.node-id} (env {@code APP_SNOWFLAKE_NODE_ID}) and
 * otherwise from the low bits of the host's MAC address, falling back to the hostname hash.</p>
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class SnowflakeIdConfig {

    private static final long NODE_MASK = 0x3FF;

    @Value("${app.snowflake.node-id:#{null}}")
    private Long configuredNodeId;

    @Bean
    public SnowflakeId snowflakeId() {
        long nodeId = configuredNodeId != null ? configuredNodeId : detectNodeId();
        log.info("Snowflake id generator ready with node id {}", nodeId);
        return new SnowflakeId(nodeId);
    }

    private long detectNodeId() {
        try {
            InetAddress localHost = InetAddress.getLocalHost();
            NetworkInterface networkInterface = NetworkInterface.getByInetAddress(localHost);
            if (networkInterface != null) {
                byte[] mac = networkInterface.getHardwareAddress();
                if (mac != null && mac.length >= 2) {
                    return (((mac[mac.length - 2] & 0xFF) << 8) | (mac[mac.length - 1] & 0xFF)) & NODE_MASK;
                }
            }
            return Math.abs(localHost.getHostName().hashCode()) & NODE_MASK;
        } catch (UnknownHostException | SocketException e) {
            log.warn("Could not derive snowflake node id from the host, using 0: {}", e.getMessage());
            return 0;
        }
    }
}
