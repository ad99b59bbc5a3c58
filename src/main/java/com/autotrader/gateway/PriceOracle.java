package com.autotrader.gateway;

import com.autotrader.exception.PriceUnavailableException;

/**
 * Source of current token prices, quoted in the same currency as position budgets.
 */
public interface PriceOracle {

    /**
     * Current price for a token.
     *
     * @param tokenId token identifier
     * @return strictly positive price
     * @throws PriceUnavailableException when no usable price can be produced
     */
    double getPrice(String tokenId);
}
