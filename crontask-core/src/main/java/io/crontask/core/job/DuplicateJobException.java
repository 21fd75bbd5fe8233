package io.crontask.core.job;

public final class DuplicateJobException extends RuntimeException {
    private final String jobId;

    public DuplicateJobException(String jobId) {
        super("job id already exists: " + jobId);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
