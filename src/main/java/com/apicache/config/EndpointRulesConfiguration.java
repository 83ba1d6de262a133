package com.apicache.config;

import com.apicache.rules.EndpointRuleTable;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the immutable rule table from configuration. Invalid rules fail application startup.
 */
@Configuration
public class EndpointRulesConfiguration {

    @Bean
    public EndpointRuleTable endpointRuleTable(ApiCacheProperties properties) {
        return EndpointRuleTable.from(properties);
    }
}
