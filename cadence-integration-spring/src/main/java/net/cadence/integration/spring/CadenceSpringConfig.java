package net.cadence.integration.spring;

import net.cadence.adapter.jdbc.repo.JdbcJobRepository;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.TxRunner;
import net.cadence.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration
public class CadenceSpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // Repository 구현 등록 (adapter-jdbc 재사용). 캐시 데코레이터는 bootstrap 에서 감싼다
    @Bean
    public JdbcJobRepository jdbcJobRepository() {
        return new JdbcJobRepository();
    }

    @Bean
    public Clock systemClock() {
        return Clock.system();
    }
}
