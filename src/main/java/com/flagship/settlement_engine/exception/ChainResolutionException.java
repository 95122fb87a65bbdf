package com.flagship.settlement_engine.exception;

import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * A professional appeared twice while walking a referral chain.
 *
 * Raised for logging and metrics only: the resolver keeps the chain up to the
 * first repeat so the legitimate referrers still get paid.
 */
public class ChainResolutionException extends SettlementEngineException {

    public ChainResolutionException(String payerId, String repeatedProfessionalId, List<String> path) {
        super("CHAIN_RESOLUTION_ERROR", HttpStatus.UNPROCESSABLE_ENTITY,
            String.format("Referral cycle for payer %s: %s appears twice in chain %s",
                payerId, repeatedProfessionalId, path));
    }
}
