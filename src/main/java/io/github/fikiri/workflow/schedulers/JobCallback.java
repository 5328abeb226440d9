package io.github.fikiri.workflow.schedulers;

import java.util.Map;

/**
 * Body of a scheduled job. Must not block indefinitely and must report failure by throwing.
 */
@FunctionalInterface
public interface JobCallback {
    /**
     * @param metadata the parameters the job was registered with, unmodifiable
     */
    void run(Map<String, Object> metadata) throws Exception;
}
