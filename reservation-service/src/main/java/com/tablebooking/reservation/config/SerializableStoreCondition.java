package com.tablebooking.reservation.config;

import org.springframework.boot.autoconfigure.condition.ConditionMessage;
import org.springframework.boot.autoconfigure.condition.ConditionOutcome;
import org.springframework.boot.autoconfigure.condition.SpringBootCondition;
import org.springframework.boot.jdbc.DatabaseDriver;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;
import org.springframework.util.StringUtils;

import java.util.EnumSet;
import java.util.Set;

/**
 * Matches when {@code spring.datasource.url} points at a database that aborts conflicting
 * SERIALIZABLE transactions (serializable snapshot isolation).
 *
 * H2 accepts the isolation level but does not detect write skew between concurrent inserts,
 * so on H2 the serializable allocation strategy is not registered and the engine falls back
 * to row locks.
 */
public class SerializableStoreCondition extends SpringBootCondition {

    static final String DATASOURCE_URL = "spring.datasource.url";

    private static final Set<DatabaseDriver> SERIALIZABLE_STORES = EnumSet.of(DatabaseDriver.POSTGRESQL);

    @Override
    public ConditionOutcome getMatchOutcome(ConditionContext context, AnnotatedTypeMetadata metadata) {
        ConditionMessage.Builder message = ConditionMessage.forCondition("Serializable store");
        String url = context.getEnvironment().getProperty(DATASOURCE_URL);
        if (!StringUtils.hasText(url)) {
            return ConditionOutcome.noMatch(message.didNotFind("property").items(DATASOURCE_URL));
        }
        DatabaseDriver driver = DatabaseDriver.fromJdbcUrl(url);
        if (SERIALIZABLE_STORES.contains(driver)) {
            return ConditionOutcome.match(message.foundExactly(driver));
        }
        return ConditionOutcome.noMatch(message.because(driver + " does not enforce SERIALIZABLE isolation"));
    }
}
