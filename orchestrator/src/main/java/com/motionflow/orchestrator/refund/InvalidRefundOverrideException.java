package com.motionflow.orchestrator.refund;

public class InvalidRefundOverrideException extends RuntimeException {

    public InvalidRefundOverrideException(String message) {
        super(message);
    }
}
