package estate.token.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param vaultAccount 첨부 금액을 보관하는 수탁 계정 ID
 */
@ConfigurationProperties(prefix = "estate.ledger")
public record LedgerProperties(@DefaultValue("estate-vault") String vaultAccount) {}
