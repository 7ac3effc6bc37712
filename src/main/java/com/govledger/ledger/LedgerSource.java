package com.govledger.ledger;

import java.io.IOException;

public interface LedgerSource {
    LedgerSnapshot openSnapshot() throws IOException;
}
