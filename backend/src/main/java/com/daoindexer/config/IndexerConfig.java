package com.daoindexer.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(IndexerProperties.class)
public class IndexerConfig {
}
