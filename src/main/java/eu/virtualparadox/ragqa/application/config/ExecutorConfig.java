package eu.virtualparadox.ragqa.application.config;

import eu.virtualparadox.ragqa.application.executor.PipelineExecutor;
import eu.virtualparadox.ragqa.application.executor.QuestionExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public QuestionExecutor questionExecutor() {
        QuestionExecutor executor = new QuestionExecutor();
        executor.setCorePoolSize(1);        // one question at a time
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("question-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    /**
     * Shared by retrieval legs, judge calls and generator calls. Hands tasks off directly, never queues.
     */
    @Bean
    public PipelineExecutor pipelineExecutor(final PipelineProperties properties) {
        PipelineExecutor executor = new PipelineExecutor();
        executor.setCorePoolSize(properties.getExecutorThreads());
        executor.setMaxPoolSize(Integer.MAX_VALUE);
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("pipeline-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
