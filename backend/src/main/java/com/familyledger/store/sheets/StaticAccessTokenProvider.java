package com.familyledger.store.sheets;

import com.familyledger.store.LedgerConnectionException;

/**
 * Token taken verbatim from configuration.
 */
public class StaticAccessTokenProvider implements AccessTokenProvider {

    private final String token;

    public StaticAccessTokenProvider(String token) {
        this.token = token;
    }

    @Override
    public String accessToken() {
        if (token == null || token.isBlank()) {
            throw new LedgerConnectionException("No Google Sheets access token configured (familyledger.store.sheets.access-token)");
        }
        return token.strip();
    }
}
