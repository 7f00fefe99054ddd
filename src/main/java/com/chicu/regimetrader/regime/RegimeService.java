package com.chicu.regimetrader.regime;

import com.chicu.regimetrader.config.RegimeTraderProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Детекторы по символам (live/paper) и последний известный режим для read API.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegimeService {

    private final RegimeTraderProperties properties;

    private final Map<String, RegimeDetector> detectors = new ConcurrentHashMap<>();
    private final Map<String, RegimeState> latest = new ConcurrentHashMap<>();

    public RegimeDetector detector(String symbol) {
        return detectors.computeIfAbsent(symbol, s -> new RegimeDetector(properties.getRegime()));
    }

    public void refit(String symbol, List<FeatureVector> history) {
        detector(symbol).fit(history);
    }

    public RegimeState classify(String symbol, Instant ts, List<FeatureVector> window) {
        RegimeState state = detector(symbol).classify(symbol, ts, window);
        latest.put(symbol, state);
        return state;
    }

    public Optional<RegimeState> current(String symbol) {
        return Optional.ofNullable(latest.get(symbol));
    }

    public Map<String, RegimeState> currentAll() {
        return new TreeMap<>(latest);
    }
}
