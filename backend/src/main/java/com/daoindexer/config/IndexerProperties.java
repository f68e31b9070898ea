package com.daoindexer.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Which master contract and which network this instance indexes. Checked against the stored settings at startup.
 */
@ConfigurationProperties(prefix = "daoindexer")
@NoArgsConstructor
@Getter
@Setter
public class IndexerProperties {

    private String masterAddress;

    private boolean mainnet;

    /** Start the recurring tasks with the context. Off in tests that only need the beans. */
    private boolean tasksAutoStartup = true;
}
