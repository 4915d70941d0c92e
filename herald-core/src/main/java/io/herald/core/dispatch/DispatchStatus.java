package io.herald.core.dispatch;

public enum DispatchStatus {
    SENT,
    DELIVERY_FAILED,
    UPLOAD_FAILED,
    FILE_NOT_FOUND,
    INVALID_MESSAGE
}
