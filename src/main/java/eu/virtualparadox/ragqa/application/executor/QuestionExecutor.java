package eu.virtualparadox.ragqa.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Runs asynchronous question jobs.
 */
public class QuestionExecutor extends ThreadPoolTaskExecutor {
}
