package com.chicu.regimetrader.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Заглушка признаков: пока не подключён реальный feature store, признаков нет,
 * и цикл решений по символу пропускается.
 */
@Slf4j
@Service
public class FeatureProviderStub implements FeatureProvider {

    @Override
    public Optional<MarketFeatures> getFeatures(String symbol, Instant timestamp) {
        return Optional.empty();
    }
}
