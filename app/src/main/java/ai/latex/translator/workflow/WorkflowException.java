package ai.latex.translator.workflow;

/**
 * Runtime exception for failures that abort a workflow run.
 */
public class WorkflowException extends RuntimeException {

    public WorkflowException(String message) {
        super(message);
    }

    public WorkflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
