package app.kartoteka.exchange.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.storage")
public record StorageProps(
        String type,
        String localRoot
) {
}
