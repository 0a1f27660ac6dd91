package com.myla.coordination;

public class UnknownTaskException extends RuntimeException {

    private final String taskId;

    public UnknownTaskException(String taskId) {
        super("Task " + taskId + " not found");
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
