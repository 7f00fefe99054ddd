package com.chicu.regimetrader.regime;

import com.chicu.regimetrader.common.enums.Regime;
import com.chicu.regimetrader.common.exception.ConfigurationException;
import com.chicu.regimetrader.common.exception.InsufficientDataException;
import com.chicu.regimetrader.config.RegimeTraderProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * 3-state Gaussian HMM детектор режима по (log-return, realized vol).
 *
 * <p>Маппинг state→regime пересчитывается после КАЖДОГО fit:
 * сырые состояния сортируются по средней волатильности,
 * минимальная → TRENDING, средняя → MEAN_REVERTING, максимальная → CHOPPY.
 * Сырые индексы состояний наружу не выходят.</p>
 *
 * <p>fit и classify могут идти из разных потоков: обученная модель публикуется
 * одной volatile-ссылкой.</p>
 */
@Slf4j
public class RegimeDetector {

    private static final Regime[] BY_VOL_ASC = {Regime.TRENDING, Regime.MEAN_REVERTING, Regime.CHOPPY};

    private final RegimeTraderProperties.RegimeProps props;

    private volatile Fitted fitted;

    public RegimeDetector(RegimeTraderProperties.RegimeProps props) {
        if (props.getStates() != 3) {
            throw new ConfigurationException(
                    "regime.states must be 3 (volatility-sorted regime mapping), got " + props.getStates());
        }
        if (props.getMinTrainingBars() < props.getStates()) {
            throw new ConfigurationException("regime.minTrainingBars must be >= states");
        }
        this.props = props;
    }

    public boolean isFitted() {
        return fitted != null;
    }

    /**
     * Обучение на окне истории. Нечисловые наблюдения отбрасываются до проверки длины.
     *
     * @throws InsufficientDataException если валидных баров меньше minTrainingBars
     */
    public void fit(List<FeatureVector> history) {
        double[][] raw = toMatrix(history);
        if (raw.length < props.getMinTrainingBars()) {
            throw new InsufficientDataException(
                    "not enough bars to fit regime model", raw.length, props.getMinTrainingBars());
        }

        double[] center = new double[2];
        double[] scale = new double[2];
        for (int f = 0; f < 2; f++) {
            double sum = 0.0;
            for (double[] r : raw) {
                sum += r[f];
            }
            double mean = sum / raw.length;
            double var = 0.0;
            for (double[] r : raw) {
                var += (r[f] - mean) * (r[f] - mean);
            }
            double sd = Math.sqrt(var / raw.length);
            center[f] = mean;
            scale[f] = sd > 1e-12 ? sd : 1.0;
        }

        GaussianHmm hmm = GaussianHmm.fit(
                standardize(raw, center, scale),
                props.getStates(),
                props.getMaxIterations(),
                props.getTolerance(),
                props.getSeed()
        );

        Regime[] mapping = mapByVolatility(hmm);
        this.fitted = new Fitted(hmm, mapping, center, scale, raw.length);

        log.info("🧭 HMM fitted: bars={} iters={} logL={} mapping={}",
                raw.length, hmm.iterations(), String.format("%.3f", hmm.logLikelihood()), Arrays.toString(mapping));
    }

    /**
     * Текущий режим по недавнему окну (forward-фильтрация).
     *
     * @throws InsufficientDataException модель не обучена или окно пустое
     */
    public RegimeState classify(String symbol, Instant timestamp, List<FeatureVector> recentWindow) {
        Fitted f = this.fitted;
        if (f == null) {
            throw new InsufficientDataException("regime model is not fitted", 0, props.getMinTrainingBars());
        }
        double[][] raw = toMatrix(recentWindow);
        if (raw.length == 0) {
            throw new InsufficientDataException("empty classification window", 0, 1);
        }
        int from = Math.max(0, raw.length - props.getClassifyWindow());
        double[][] window = Arrays.copyOfRange(raw, from, raw.length);

        double[] posterior = f.hmm().filteredPosterior(standardize(window, f.center(), f.scale()));

        Map<Regime, Double> byRegime = new EnumMap<>(Regime.class);
        int best = 0;
        for (int s = 0; s < posterior.length; s++) {
            byRegime.merge(f.mapping()[s], posterior[s], Double::sum);
            if (posterior[s] > posterior[best]) {
                best = s;
            }
        }
        double confidence = Math.max(0.0, Math.min(1.0, posterior[best]));
        return new RegimeState(symbol, f.mapping()[best], confidence, byRegime, timestamp);
    }

    /** Средние (log-return, vol) по режимам в исходных единицах. */
    public Map<Regime, double[]> regimeMeans() {
        Fitted f = this.fitted;
        Map<Regime, double[]> out = new EnumMap<>(Regime.class);
        if (f == null) {
            return out;
        }
        for (int s = 0; s < f.hmm().states(); s++) {
            double[] m = f.hmm().mean(s);
            out.put(f.mapping()[s], new double[]{
                    m[0] * f.scale()[0] + f.center()[0],
                    m[1] * f.scale()[1] + f.center()[1]
            });
        }
        return out;
    }

    // ===== helpers =====

    static Regime[] mapByVolatility(GaussianHmm hmm) {
        int k = hmm.states();
        Integer[] order = IntStream.range(0, k).boxed().toArray(Integer[]::new);
        // стандартизация монотонна, поэтому порядок по vol тот же, что в исходных единицах
        Arrays.sort(order, Comparator.comparingDouble(s -> hmm.mean(s)[1]));
        Regime[] mapping = new Regime[k];
        for (int rank = 0; rank < k; rank++) {
            mapping[order[rank]] = BY_VOL_ASC[rank];
        }
        return mapping;
    }

    private static double[][] toMatrix(List<FeatureVector> xs) {
        if (xs == null) {
            return new double[0][];
        }
        return xs.stream()
                .filter(v -> v != null && v.isFinite())
                .map(v -> new double[]{v.logReturn(), v.realizedVol()})
                .toArray(double[][]::new);
    }

    private static double[][] standardize(double[][] x, double[] center, double[] scale) {
        double[][] out = new double[x.length][2];
        for (int t = 0; t < x.length; t++) {
            out[t][0] = (x[t][0] - center[0]) / scale[0];
            out[t][1] = (x[t][1] - center[1]) / scale[1];
        }
        return out;
    }

    private record Fitted(GaussianHmm hmm, Regime[] mapping, double[] center, double[] scale, int trainedBars) {
    }
}
