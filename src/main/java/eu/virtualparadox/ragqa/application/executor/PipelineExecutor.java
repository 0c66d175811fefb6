package eu.virtualparadox.ragqa.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Runs the concurrent parts of a pipeline run: retrieval legs, judge calls and generator calls.
 */
public class PipelineExecutor extends ThreadPoolTaskExecutor {
}
