package estate.token.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "estate.notification")
public record NotificationProperties(@DefaultValue("200") int maxPageSize) {}
