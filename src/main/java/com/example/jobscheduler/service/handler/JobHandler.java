package com.example.jobscheduler.service.handler;

/**
 * Executable logic bound to a job's handler type.
 * <p>
 * Handlers should:
 * - Be stateless
 * - Honor thread interruption; the executor interrupts an attempt that exceeds its timeout
 * - Throw {@link com.example.jobscheduler.exception.JobHandlerException} to state explicitly
 *   whether a failure is worth retrying
 */
public interface JobHandler {

    /**
     * Stable key jobs use to reference this handler
     */
    String getHandlerType();

    /**
     * Execute the job
     *
     * @param parameters the job's parameters, passed through unchanged
     * @return result payload stored on the execution log
     * @throws Exception on failure; classified by the executor for retry
     */
    String execute(String parameters) throws Exception;
}
