package lending.reward.ledger.config;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Configuration;

/**
 * MyBatis configuration class
 * Mapper XML lives under classpath:mapper, type aliases come from the domain package
 */
@Configuration
@MapperScan("lending.reward.ledger.mapper")
public class MyBatisConfig {
}
