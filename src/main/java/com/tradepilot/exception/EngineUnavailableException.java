package com.tradepilot.exception;

/** The execution engine is stopped or shutting down and cannot accept work. */
public class EngineUnavailableException extends BaseException {

    public EngineUnavailableException(String message) {
        super(ErrorCode.ENGINE_UNAVAILABLE, message);
    }
}
