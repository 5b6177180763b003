package com.nodeguardian.exception;

public class NotificationException extends BaseException {

    public NotificationException(String message) {
        super(ErrorCode.NOTIFICATION_ERROR, message);
    }

    public NotificationException(String message, Throwable cause) {
        super(ErrorCode.NOTIFICATION_ERROR, message, cause);
    }
}
