package com.chicu.regimetrader.config;

import com.chicu.regimetrader.common.enums.OrderType;
import com.chicu.regimetrader.common.exception.ConfigurationException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Все параметры ядра. Читаются из application.yml (prefix = regimetrader).
 * Проверка значений: в {@link TradingCoreConfig} на старте.
 */
@Data
@ConfigurationProperties(prefix = "regimetrader")
public class RegimeTraderProperties {

    private Universe universe = new Universe();
    private RegimeProps regime = new RegimeProps();
    private Fusion fusion = new Fusion();
    private Confidence confidence = new Confidence();
    private Risk risk = new Risk();
    private Execution execution = new Execution();
    private Backtest backtest = new Backtest();
    private WalkForward walkForward = new WalkForward();
    private MonteCarlo monteCarlo = new MonteCarlo();
    private Scheduler scheduler = new Scheduler();

    @Data
    public static class Universe {
        private List<String> symbols = new ArrayList<>(List.of("BTCUSDT"));
        private String exchange = "BINANCE";
        private String timeframe = "4h";
        /** 4h бары: 6 в сутки * 365 */
        private int barsPerYear = 2190;

        /**
         * Длительность бара: "15m", "4h", "1d", "1w".
         *
         * @throws ConfigurationException если формат не распознан
         */
        public Duration timeframeDuration() {
            String tf = timeframe == null ? "" : timeframe.trim().toLowerCase(Locale.ROOT);
            if (tf.length() < 2) {
                throw new ConfigurationException("universe.timeframe is not recognised: " + timeframe);
            }
            long n;
            try {
                n = Long.parseLong(tf.substring(0, tf.length() - 1));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("universe.timeframe is not recognised: " + timeframe);
            }
            if (n <= 0) {
                throw new ConfigurationException("universe.timeframe must be positive: " + timeframe);
            }
            switch (tf.charAt(tf.length() - 1)) {
                case 'm':
                    return Duration.ofMinutes(n);
                case 'h':
                    return Duration.ofHours(n);
                case 'd':
                    return Duration.ofDays(n);
                case 'w':
                    return Duration.ofDays(7 * n);
                default:
                    throw new ConfigurationException("universe.timeframe is not recognised: " + timeframe);
            }
        }
    }

    @Data
    public static class RegimeProps {
        /** Маппинг по волатильности определён только для 3 состояний */
        private int states = 3;
        private int minTrainingBars = 200;
        private int trainingBars = 1000;
        private int classifyWindow = 50;
        private int maxIterations = 100;
        private double tolerance = 1e-4;
        private long seed = 42L;
        /** Бэктест: как часто переобучать HMM (в барах) */
        private int refitEveryBars = 500;
    }

    @Data
    public static class Fusion {
        private Weights trending = new Weights(0.4, 0.5, 0.1);
        private Weights meanReverting = new Weights(0.5, 0.3, 0.2);
        private Weights choppy = new Weights(0.3, 0.3, 0.4);
        private double choppyScale = 0.3;
        private double directionThreshold = 0.05;
    }

    @Data
    public static class Weights {
        private double technical;
        private double ml;
        private double sentiment;

        public Weights() {
        }

        public Weights(double technical, double ml, double sentiment) {
            this.technical = technical;
            this.ml = ml;
            this.sentiment = sentiment;
        }
    }

    @Data
    public static class Confidence {
        /** IQR, при котором confidence = 1.0 */
        private double minIqr = 0.2;
        /** IQR, при котором confidence = 0.0 */
        private double maxIqr = 1.5;
        /** Когда предиктор недоступен */
        private double fallback = 0.5;
    }

    @Data
    public static class Risk {
        private double initialEquity = 100_000.0;
        private double volTarget = 0.15;
        private double volFloor = 1e-4;
        private double maxPositionPct = 0.25;
        private double maxConcentrationPct = 0.30;
        private double maxDrawdownPct = 0.15;
        private double minTradeUsd = 10.0;
        /** Максимальный возраст данных, от закрытия бара */
        private int stalenessMinutes = 30;
        /** SPOT: по умолчанию без шортов */
        private boolean allowShort = false;
        private int volLookbackBars = 100;
    }

    @Data
    public static class Execution {
        /** PAPER | LIVE */
        private String mode = "PAPER";
        private OrderType orderType = OrderType.MARKET;
        private double slippageBps = 5.0;
        private double makerFeeBps = 10.0;
        private double takerFeeBps = 10.0;
        private int orderTimeoutSeconds = 120;
        private long collaboratorTimeoutMs = 5_000L;
    }

    @Data
    public static class Backtest {
        private double initialCapital = 100_000.0;
        /** 0 = исполнение на том же баре (только если явно задано) */
        private int fillLatencyBars = 1;
        private double spreadBps = 5.0;
        private double linearImpactBps = 2.0;
        private double makerFeeBps = 10.0;
        private double takerFeeBps = 10.0;
        /** Доля объёма бара, которую ордер может забрать без частичного исполнения */
        private double maxParticipation = 0.1;
        private double partialFillFraction = 0.5;
        private int cancelAfterBars = 3;
        private int advWindow = 20;
        private int historyWindow = 1_000;
    }

    @Data
    public static class WalkForward {
        private int trainBars = 1000;
        private int testBars = 100;
        private int purgeBars = 3;
        private int embargoBars = 2;
    }

    @Data
    public static class MonteCarlo {
        private int simulations = 1000;
        private int blockSize = 20;
        private long seed = 42L;
        private double perturbationPct = 0.20;
        private int perturbationRuns = 50;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = false;
        private long decisionIntervalSec = 14_400;
        private long healthIntervalSec = 60;
        private long orderPollIntervalSec = 10;
        private long retrainIntervalSec = 604_800;
    }
}
