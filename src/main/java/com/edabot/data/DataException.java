package com.edabot.data;

import com.edabot.core.PipelineException;

public class DataException extends PipelineException {

    public DataException(String message) {
        super("data", message);
    }

    public DataException(String stage, String message) {
        super(stage, message);
    }

    public DataException(String message, Throwable cause) {
        super("data", message, cause);
    }
}
