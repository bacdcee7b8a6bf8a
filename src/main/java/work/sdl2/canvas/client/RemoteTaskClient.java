package work.sdl2.canvas.client;

import work.sdl2.canvas.error.ResultFetchException;
import work.sdl2.canvas.error.StatusQueryException;
import work.sdl2.canvas.error.SubmissionException;

/**
 * Typed view of the asynchronous task service: submit, poll, fetch.
 */
public interface RemoteTaskClient {
    /**
     * Creates a remote task and returns its id. Never retried by callers since the service does not
     * guarantee idempotent submission.
     *
     * @throws SubmissionException on a non-2xx answer or a transport failure
     */
    String submit(RemoteTaskRequest request);

    /**
     * @throws StatusQueryException on a transport failure; implementations do not retry
     */
    TaskStatus getStatus(String taskId);

    /**
     * Returns the result payload of a task whose status is {@link RemoteStatus#SUCCEEDED}.
     *
     * @throws ResultFetchException when the task has not succeeded or the payload cannot be read
     */
    Object fetchResult(String taskId);
}
