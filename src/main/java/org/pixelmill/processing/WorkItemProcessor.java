package org.pixelmill.processing;

import org.pixelmill.metrics.ResultRecord;

/**
 * Processes one work item into its result. Expected per-item failures are returned as failed records;
 * anything thrown is treated by the pool as a worker fault.
 */
@FunctionalInterface
public interface WorkItemProcessor {

    ResultRecord process(WorkItem item) throws Exception;
}
