package com.familyledger.store.sheets;

/**
 * Supplies the OAuth2 bearer token for Sheets calls. Minting and rotating tokens happens outside this service.
 */
@FunctionalInterface
public interface AccessTokenProvider {

    /**
     * @throws com.familyledger.store.LedgerConnectionException when no usable token is available
     */
    String accessToken();
}
