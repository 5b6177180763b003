package com.nodeguardian.exception;

public class ActionExecutionException extends BaseException {

    public ActionExecutionException(String message) {
        super(ErrorCode.ACTION_EXECUTION_ERROR, message);
    }

    public ActionExecutionException(String message, Throwable cause) {
        super(ErrorCode.ACTION_EXECUTION_ERROR, message, cause);
    }
}
