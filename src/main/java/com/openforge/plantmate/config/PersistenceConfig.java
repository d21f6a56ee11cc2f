package com.openforge.plantmate.config;

import com.openforge.plantmate.domain.ChatSession;
import com.openforge.plantmate.repository.ChatSessionRepository;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Conversation storage: entities, repositories and the auditing that fills
 * create/update timestamps. Kept off the application class so web-slice tests
 * start without a datasource.
 */
@Configuration
@EnableJpaAuditing
@EntityScan(basePackageClasses = ChatSession.class)
@EnableJpaRepositories(basePackageClasses = ChatSessionRepository.class)
public class PersistenceConfig {
}
