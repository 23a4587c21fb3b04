package com.tradepilot.exception;

public class InvalidOrderStateException extends BaseException {

    public InvalidOrderStateException(String message) {
        super(ErrorCode.INVALID_ORDER_STATE, message);
    }
}
