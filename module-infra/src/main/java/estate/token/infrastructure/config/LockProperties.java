package estate.token.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 락 설정 (estate.lock.*)
 *
 * @param type local(Guava) | redis(Redisson)
 * @param waitSeconds 락 대기 시간
 * @param leaseSeconds 분산 락 Watchdog 타임아웃 (보유 중에는 자동 갱신, 만료는 인스턴스가 죽었을 때만)
 * @param stripes 로컬 락 스트라이프 수
 * @param redisAddress Redis 주소 (redis 모드)
 */
@ConfigurationProperties(prefix = "estate.lock")
public record LockProperties(
    @DefaultValue("local") String type,
    @DefaultValue("10") long waitSeconds,
    @DefaultValue("30") long leaseSeconds,
    @DefaultValue("128") int stripes,
    @DefaultValue("redis://localhost:6379") String redisAddress) {}
