package com.github.dimitryivaniuta.tutoring.config;

import com.github.dimitryivaniuta.tutoring.settlement.RandomSettlementDecider;
import com.github.dimitryivaniuta.tutoring.settlement.SettlementDecider;
import java.util.concurrent.ThreadLocalRandom;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Settlement decision wiring.
 */
@Configuration
public class SettlementConfig {

    /**
     * Default decider; replaced by any other {@link SettlementDecider} bean.
     *
     * @param props application properties
     * @return random decider
     */
    @Bean
    @ConditionalOnMissingBean(SettlementDecider.class)
    public SettlementDecider settlementDecider(AppProperties props) {
        return new RandomSettlementDecider(
                () -> ThreadLocalRandom.current().nextDouble(),
                props.getSettlement().getPaidProbability()
        );
    }
}
