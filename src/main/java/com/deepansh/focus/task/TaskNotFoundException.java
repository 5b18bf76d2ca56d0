package com.deepansh.focus.task;

import com.deepansh.focus.exception.FocusException;

public class TaskNotFoundException extends FocusException {

    public TaskNotFoundException(String description) {
        super("Could not find task: '" + description + "'");
    }
}
