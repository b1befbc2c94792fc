package net.cadence.core.service;

public class JobNotFoundException extends RuntimeException {
    private final long jobId;

    public JobNotFoundException(long jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public long jobId() {
        return jobId;
    }
}
