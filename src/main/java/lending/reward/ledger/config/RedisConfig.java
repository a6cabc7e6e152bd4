package lending.reward.ledger.config;

import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redisson client backing the ledger mutation lock when several ledger instances share one database.
 * Only created with ledger.lock.distributed=true; a single instance uses an in-process lock.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "ledger.lock.distributed", havingValue = "true")
public class RedisConfig {

    @Value("${ledger.lock.redis-address:redis://localhost:6379}")
    private String redisAddress;

    @Value("${ledger.lock.redis-password:}")
    private String redisPassword;

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient() {
        Config config = new Config();
        config.useSingleServer()
                .setAddress(redisAddress)
                .setPassword(redisPassword.isEmpty() ? null : redisPassword)
                .setConnectionMinimumIdleSize(2)
                .setConnectionPoolSize(8);

        log.info("Creating Redisson client for distributed ledger lock: address={}", redisAddress);
        return Redisson.create(config);
    }
}
