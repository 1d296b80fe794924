package com.bko.delegation.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class OrchestratorConfig {

    @Bean
    public ChatClient chatClient(ChatModel chatModel) {
        return ChatClient.builder(chatModel).build();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService workerExecutor(DelegationProperties properties) {
        return Executors.newFixedThreadPool(properties.getExecution().getWorkerConcurrency());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService toolExecutor() {
        return Executors.newCachedThreadPool();
    }
}
