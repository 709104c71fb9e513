package com.sandkev.holdings.exchange;

public enum SetupFailure {
    UNSUPPORTED_EXCHANGE,
    ALREADY_REGISTERED,
    NOT_REGISTERED,
    VALIDATION_FAILED,
    CREDENTIAL_FILE_MISSING
}
