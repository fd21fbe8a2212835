package com.github.spud.apply.orchestrator.application.config;

import com.github.spud.apply.orchestrator.domain.gateway.AgentTaskLauncher;
import com.github.spud.apply.orchestrator.domain.gateway.LoggingAgentTaskLauncher;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GatewayConfig {

  @Bean
  @ConditionalOnMissingBean(AgentTaskLauncher.class)
  public AgentTaskLauncher agentTaskLauncher() {
    return new LoggingAgentTaskLauncher();
  }
}
