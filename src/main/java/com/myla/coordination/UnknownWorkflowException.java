package com.myla.coordination;

public class UnknownWorkflowException extends RuntimeException {

    public UnknownWorkflowException(String workflowType) {
        super("Workflow type '" + workflowType + "' is not supported. Available workflows: "
            + WorkflowType.availableKeys());
    }
}
