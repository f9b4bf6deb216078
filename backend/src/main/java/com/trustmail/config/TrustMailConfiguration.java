package com.trustmail.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.trustmail.directory.GroupDirectory;
import com.trustmail.trust.TrustListResolver;

@Configuration
@EnableConfigurationProperties(TrustMailProperties.class)
public class TrustMailConfiguration {

    @Bean
    public TrustListResolver trustListResolver(GroupDirectory groupDirectory) {
        return new TrustListResolver(groupDirectory);
    }
}
