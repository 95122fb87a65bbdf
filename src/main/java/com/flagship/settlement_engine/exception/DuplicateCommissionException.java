package com.flagship.settlement_engine.exception;

import org.springframework.http.HttpStatus;

public class DuplicateCommissionException extends SettlementEngineException {

    public DuplicateCommissionException(String jobId) {
        super("DUPLICATE_COMMISSION", HttpStatus.BAD_REQUEST,
            "Commission already recorded for job " + jobId);
    }

    public DuplicateCommissionException(String jobId, Throwable cause) {
        super("DUPLICATE_COMMISSION", HttpStatus.BAD_REQUEST,
            "Commission already recorded for job " + jobId, cause);
    }
}
