package estate.token.infrastructure.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param privilegedAccounts 발행(mint)과 입금(deposit)이 허용된 계정 목록
 */
@ConfigurationProperties(prefix = "estate.access")
public record AccessProperties(@DefaultValue List<String> privilegedAccounts) {}
