package com.di.phaselink.stage;

/**
 * The work of one stage (scraping, aggregation, rendering...). Implementations are Spring beans
 * discovered by {@link StageProcessorRegistry}; the engine decides when and for which scope they
 * run. A processor must be idempotent for a scope: the same invocation may be delivered again.
 */
public interface StageProcessor {

    /** Name of the stage in the topology file. */
    String stageName();

    StageResult process(StageInvocation invocation) throws Exception;
}
