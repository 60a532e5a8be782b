package dev.pagestack.config;

import dev.pagestack.util.SnowflakeId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetAddress;
import java.net.NetworkInterface;

/**
 * Snowflake id generator for pages, versions and data rows.
 * The node id comes from {@code app.snowflake.node-id}, else from the host's MAC address,
 * else from the hostname.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class SnowflakeIdConfig {

    @Value("${app.snowflake.node-id:#{null}}")
    private Long configuredNodeId;

    @Bean
    public SnowflakeId snowflakeId() {
        long nodeId = resolveNodeId();
        log.info("Initialized Snowflake ID generator with node ID: {}", nodeId);
        return new SnowflakeId(nodeId);
    }

    private long resolveNodeId() {
        if (configuredNodeId != null) {
            return configuredNodeId;
        }
        try {
            NetworkInterface networkInterface = NetworkInterface.getByInetAddress(InetAddress.getLocalHost());
            if (networkInterface != null) {
                byte[] mac = networkInterface.getHardwareAddress();
                if (mac != null && mac.length >= 2) {
                    int hash = ((mac[mac.length - 2] & 0xFF) << 8) | (mac[mac.length - 1] & 0xFF);
                    return hash & SnowflakeId.MAX_NODE_ID;
                }
            }
        } catch (Exception e) {
            log.warn("Could not derive node ID from network interface: {}", e.getMessage());
        }
        try {
            String hostname = InetAddress.getLocalHost().getHostName();
            return Math.abs(hostname.hashCode()) & SnowflakeId.MAX_NODE_ID;
        } catch (Exception e) {
            log.warn("Failed to get hostname, using node ID 0");
            return 0;
        }
    }
}
