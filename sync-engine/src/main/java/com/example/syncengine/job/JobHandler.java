package com.example.syncengine.job;

import com.example.syncengine.entity.JobKind;

import java.util.Map;
import java.util.Set;

/**
 * Executes jobs of the kinds it declares. Runs outside any transaction.
 */
public interface JobHandler {

    Set<JobKind> supportedKinds();

    /**
     * @return result document stored on the job when it completes
     * @throws Exception any failure; the runner classifies it to decide between retry and error
     */
    Map<String, Object> handle(JobContext context) throws Exception;
}
