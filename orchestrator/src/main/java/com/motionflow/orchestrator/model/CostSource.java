package com.motionflow.orchestrator.model;

/** Whether a ledger entry came from the first attempt of a model call or a retry. */
public enum CostSource {
    PRIMARY,
    RETRY
}
