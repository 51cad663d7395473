package com.gt.quranquest.conf;

import com.gt.quranquest.progress.VerseLearningStateDao;
import com.gt.quranquest.progress.impl.InMemoryVerseLearningStateDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "quranquest.store", havingValue = "memory", matchIfMissing = true)
public class MemoryBeanConfig {

    private static final Logger log = LoggerFactory.getLogger(MemoryBeanConfig.class);

    @Bean
    public VerseLearningStateDao getVerseLearningStateDao() {
        log.info("Using in-memory verse learning state store. Progress will not survive a restart.");
        return new InMemoryVerseLearningStateDao();
    }
}
