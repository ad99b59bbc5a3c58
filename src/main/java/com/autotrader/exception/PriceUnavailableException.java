package com.autotrader.exception;

/**
 * The price oracle could not produce a usable price for a token.
 * The affected positions are skipped for the current tick only.
 */
public class PriceUnavailableException extends RuntimeException {

    private final String tokenId;

    public PriceUnavailableException(String tokenId, String message) {
        super(message);
        this.tokenId = tokenId;
    }

    public PriceUnavailableException(String tokenId, String message, Throwable cause) {
        super(message, cause);
        this.tokenId = tokenId;
    }

    public String getTokenId() {
        return tokenId;
    }
}
