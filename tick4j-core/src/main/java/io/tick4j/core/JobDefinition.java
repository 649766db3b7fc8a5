package io.tick4j.core;

import io.tick4j.Job;

/**
 * Immutable registration of a job: its id, the time expression it is evaluated against, and its body.
 */
public record JobDefinition(

        // identity
        String id,

        // scheduling
        String expression,

        // body
        Job job
) {
}
