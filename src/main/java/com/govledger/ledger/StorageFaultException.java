package com.govledger.ledger;

import java.io.IOException;

public class StorageFaultException extends IOException {

    public StorageFaultException(String message) {
        super(message);
    }

    public StorageFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
