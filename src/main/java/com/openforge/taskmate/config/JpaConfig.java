package com.openforge.taskmate.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/** Populates create_time / update_time on every entity. */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
