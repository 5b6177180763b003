package com.nodeguardian.exception;

/** The node selector could not be resolved, or resolved to no nodes. */
public class NodeSelectorException extends BaseException {

    public NodeSelectorException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public NodeSelectorException(String message, Throwable cause) {
        super(ErrorCode.SELECTOR_ERROR, message, cause);
    }
}
