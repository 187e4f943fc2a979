package com.flagship.prior_auth.config;

import com.flagship.prior_auth.observability.CorrelationContext;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.util.Map;

/**
 * HTTP client for payer and pharmacy calls, and the pool transition requests run on.
 */
@Configuration
public class GatewayConfig {

    @Bean
    public RestTemplate integrationRestTemplate(IntegrationProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.getReadTimeout());
        return new RestTemplate(requestFactory);
    }

    /**
     * Runs transition requests off the servlet thread so a request timeout can cancel
     * the in-flight gateway call. Bounded; a full queue is rejected and surfaces as 503.
     */
    @Bean
    public ThreadPoolTaskExecutor transitionExecutor(
            @Value("${prior-auth.transition.worker-pool-size:16}") int poolSize,
            @Value("${prior-auth.transition.worker-queue-capacity:200}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("transition-");
        executor.setTaskDecorator(mdcPropagating());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    static TaskDecorator mdcPropagating() {
        return task -> {
            Map<String, String> mdc = MDC.getCopyOfContextMap();
            String correlationId = CorrelationContext.hasCorrelationId()
                    ? CorrelationContext.getCorrelationId()
                    : null;
            return () -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                if (correlationId != null) {
                    CorrelationContext.setCorrelationId(correlationId);
                }
                try {
                    task.run();
                } finally {
                    CorrelationContext.clear();
                    MDC.clear();
                }
            };
        };
    }
}
