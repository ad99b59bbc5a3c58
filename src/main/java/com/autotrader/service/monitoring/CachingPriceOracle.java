package com.autotrader.service.monitoring;

import com.autotrader.config.MonitoringConfig;
import com.autotrader.exception.PriceUnavailableException;
import com.autotrader.gateway.PriceOracle;
import com.autotrader.util.FormatUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Price oracle decorator with a per-token TTL cache.
 * <p>
 * Only valid prices are cached. A delegate failure propagates as
 * {@link PriceUnavailableException} and a non-positive or non-finite price is converted into
 * one, so callers never see a price of zero. Moves larger than
 * {@code monitoring.price-change-log-threshold-percent} are logged at info level.
 */
@Slf4j
public class CachingPriceOracle implements PriceOracle {

    private final PriceOracle delegate;
    private final MonitoringConfig config;
    private final Clock clock;

    private final Map<String, CachedPrice> cache = new ConcurrentHashMap<>();

    public CachingPriceOracle(PriceOracle delegate, MonitoringConfig config, Clock clock) {
        this.delegate = delegate;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public double getPrice(String tokenId) {
        long now = clock.millis();
        CachedPrice cached = cache.get(tokenId);
        if (cached != null && config.getPriceCacheTtlMs() > 0
                && now - cached.fetchedAtMillis() < config.getPriceCacheTtlMs()) {
            return cached.price();
        }

        double price;
        try {
            price = delegate.getPrice(tokenId);
        } catch (PriceUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PriceUnavailableException(tokenId, "Price lookup failed for " + tokenId + ": " + e.getMessage(), e);
        }
        if (!(price > 0) || Double.isInfinite(price)) {
            throw new PriceUnavailableException(tokenId, "Invalid price " + price + " for " + tokenId);
        }

        if (cached != null) {
            double changePercent = (price - cached.price()) / cached.price() * 100.0;
            if (Math.abs(changePercent) > config.getPriceChangeLogThresholdPercent()) {
                log.info("Price change for {}: {} -> {} ({}%)", tokenId, cached.price(), price,
                        FormatUtils.formatDouble(changePercent));
            } else {
                log.debug("Price for {}: {}", tokenId, price);
            }
        }
        cache.put(tokenId, new CachedPrice(price, now));
        return price;
    }

    public void invalidate(String tokenId) {
        cache.remove(tokenId);
    }

    private record CachedPrice(double price, long fetchedAtMillis) {
    }
}
