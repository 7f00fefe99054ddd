package com.chicu.regimetrader.regime;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * HMM с гауссовыми эмиссиями (2 признака, полная ковариация 2x2).
 * Обучение Baum-Welch с масштабированием, фильтрация: forward.
 * Работает на стандартизованных наблюдениях.
 */
final class GaussianHmm {

    private static final double MIN_VARIANCE = 1e-6;
    private static final double MIN_DENSITY = 1e-300;
    private static final double MIN_WEIGHT = 1e-10;

    private final int k;
    private final double[] start;
    private final double[][] trans;
    private final double[][] means;
    private final double[][][] covs;

    private double logLikelihood = Double.NEGATIVE_INFINITY;
    private int iterations;

    private GaussianHmm(int k) {
        this.k = k;
        this.start = new double[k];
        this.trans = new double[k][k];
        this.means = new double[k][2];
        this.covs = new double[k][2][2];
    }

    static GaussianHmm fit(double[][] x, int states, int maxIterations, double tolerance, long seed) {
        if (x.length < states) {
            throw new IllegalArgumentException("need at least " + states + " observations, got " + x.length);
        }
        GaussianHmm m = new GaussianHmm(states);
        m.initialize(x, new Random(seed));

        double prev = Double.NEGATIVE_INFINITY;
        for (int it = 0; it < maxIterations; it++) {
            double ll = m.baumWelchStep(x);
            m.iterations = it + 1;
            m.logLikelihood = ll;
            if (Math.abs(ll - prev) < tolerance) {
                break;
            }
            prev = ll;
        }
        return m;
    }

    int states() {
        return k;
    }

    double[] mean(int state) {
        return means[state].clone();
    }

    double logLikelihood() {
        return logLikelihood;
    }

    int iterations() {
        return iterations;
    }

    /** Нормированный forward-вектор на последнем наблюдении. */
    double[] filteredPosterior(double[][] x) {
        double[] alpha = new double[k];
        for (int j = 0; j < k; j++) {
            alpha[j] = start[j] * density(x[0], j);
        }
        normalize(alpha);
        for (int t = 1; t < x.length; t++) {
            double[] next = new double[k];
            for (int j = 0; j < k; j++) {
                double s = 0.0;
                for (int i = 0; i < k; i++) {
                    s += alpha[i] * trans[i][j];
                }
                next[j] = s * density(x[t], j);
            }
            normalize(next);
            alpha = next;
        }
        return alpha;
    }

    // ===== INIT =====

    /**
     * Детерминированный старт: наблюдения сортируются по волатильности и режутся
     * на k равных кусков, из каждого: средние и ковариация.
     */
    private void initialize(double[][] x, Random rnd) {
        int n = x.length;
        Integer[] order = IntStream.range(0, n).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(i -> x[i][1]));

        double[][] global = covariance(x, 0, n, order);
        for (int s = 0; s < k; s++) {
            int from = s * n / k;
            int to = (s + 1) * n / k;
            double m0 = 0.0;
            double m1 = 0.0;
            for (int r = from; r < to; r++) {
                m0 += x[order[r]][0];
                m1 += x[order[r]][1];
            }
            int size = Math.max(1, to - from);
            means[s][0] = m0 / size + rnd.nextGaussian() * 1e-3;
            means[s][1] = m1 / size + rnd.nextGaussian() * 1e-3;
            double[][] c = (to - from) >= 2 ? covariance(x, from, to, order) : global;
            covs[s][0][0] = c[0][0] + MIN_VARIANCE;
            covs[s][0][1] = c[0][1];
            covs[s][1][0] = c[1][0];
            covs[s][1][1] = c[1][1] + MIN_VARIANCE;
            start[s] = 1.0 / k;
            for (int j = 0; j < k; j++) {
                trans[s][j] = (s == j) ? 0.9 : 0.1 / (k - 1);
            }
        }
    }

    private static double[][] covariance(double[][] x, int from, int to, Integer[] order) {
        int n = to - from;
        double m0 = 0.0;
        double m1 = 0.0;
        for (int r = from; r < to; r++) {
            m0 += x[order[r]][0];
            m1 += x[order[r]][1];
        }
        m0 /= n;
        m1 /= n;
        double c00 = 0.0;
        double c01 = 0.0;
        double c11 = 0.0;
        for (int r = from; r < to; r++) {
            double d0 = x[order[r]][0] - m0;
            double d1 = x[order[r]][1] - m1;
            c00 += d0 * d0;
            c01 += d0 * d1;
            c11 += d1 * d1;
        }
        return new double[][]{{c00 / n, c01 / n}, {c01 / n, c11 / n}};
    }

    // ===== BAUM-WELCH =====

    /** Один шаг EM. Возвращает log-likelihood параметров ДО обновления. */
    private double baumWelchStep(double[][] x) {
        int n = x.length;
        double[][] b = new double[n][k];
        for (int t = 0; t < n; t++) {
            for (int j = 0; j < k; j++) {
                b[t][j] = density(x[t], j);
            }
        }

        double[][] alpha = new double[n][k];
        double[] scale = new double[n];
        for (int j = 0; j < k; j++) {
            alpha[0][j] = start[j] * b[0][j];
        }
        scale[0] = normalize(alpha[0]);
        for (int t = 1; t < n; t++) {
            for (int j = 0; j < k; j++) {
                double s = 0.0;
                for (int i = 0; i < k; i++) {
                    s += alpha[t - 1][i] * trans[i][j];
                }
                alpha[t][j] = s * b[t][j];
            }
            scale[t] = normalize(alpha[t]);
        }

        double[][] beta = new double[n][k];
        Arrays.fill(beta[n - 1], 1.0);
        for (int t = n - 2; t >= 0; t--) {
            for (int i = 0; i < k; i++) {
                double s = 0.0;
                for (int j = 0; j < k; j++) {
                    s += trans[i][j] * b[t + 1][j] * beta[t + 1][j];
                }
                beta[t][i] = s / scale[t + 1];
            }
        }

        double ll = 0.0;
        for (double c : scale) {
            ll += Math.log(c);
        }

        double[][] gamma = new double[n][k];
        for (int t = 0; t < n; t++) {
            for (int i = 0; i < k; i++) {
                gamma[t][i] = alpha[t][i] * beta[t][i];
            }
            normalize(gamma[t]);
        }

        double[][] xiSum = new double[k][k];
        for (int t = 0; t < n - 1; t++) {
            double[][] xi = new double[k][k];
            double total = 0.0;
            for (int i = 0; i < k; i++) {
                for (int j = 0; j < k; j++) {
                    xi[i][j] = alpha[t][i] * trans[i][j] * b[t + 1][j] * beta[t + 1][j];
                    total += xi[i][j];
                }
            }
            if (total <= 0.0) {
                continue;
            }
            for (int i = 0; i < k; i++) {
                for (int j = 0; j < k; j++) {
                    xiSum[i][j] += xi[i][j] / total;
                }
            }
        }

        System.arraycopy(gamma[0], 0, start, 0, k);
        for (int i = 0; i < k; i++) {
            double row = 0.0;
            for (int j = 0; j < k; j++) {
                row += xiSum[i][j];
            }
            if (row > MIN_WEIGHT) {
                for (int j = 0; j < k; j++) {
                    trans[i][j] = xiSum[i][j] / row;
                }
            }
        }

        for (int s = 0; s < k; s++) {
            double w = 0.0;
            double m0 = 0.0;
            double m1 = 0.0;
            for (int t = 0; t < n; t++) {
                w += gamma[t][s];
                m0 += gamma[t][s] * x[t][0];
                m1 += gamma[t][s] * x[t][1];
            }
            if (w < MIN_WEIGHT) {
                continue; // пустое состояние: параметры остаются прежними
            }
            m0 /= w;
            m1 /= w;
            double c00 = 0.0;
            double c01 = 0.0;
            double c11 = 0.0;
            for (int t = 0; t < n; t++) {
                double d0 = x[t][0] - m0;
                double d1 = x[t][1] - m1;
                c00 += gamma[t][s] * d0 * d0;
                c01 += gamma[t][s] * d0 * d1;
                c11 += gamma[t][s] * d1 * d1;
            }
            means[s][0] = m0;
            means[s][1] = m1;
            covs[s][0][0] = c00 / w + MIN_VARIANCE;
            covs[s][0][1] = c01 / w;
            covs[s][1][0] = c01 / w;
            covs[s][1][1] = c11 / w + MIN_VARIANCE;
        }
        return ll;
    }

    // ===== MATH =====

    private double density(double[] obs, int s) {
        double s00 = covs[s][0][0];
        double s01 = covs[s][0][1];
        double s11 = covs[s][1][1];
        double det = s00 * s11 - s01 * s01;
        if (det <= MIN_VARIANCE * MIN_VARIANCE) {
            s01 = 0.0;
            det = s00 * s11;
        }
        double d0 = obs[0] - means[s][0];
        double d1 = obs[1] - means[s][1];
        double q = (s11 * d0 * d0 - 2.0 * s01 * d0 * d1 + s00 * d1 * d1) / det;
        double p = Math.exp(-0.5 * q) / (2.0 * Math.PI * Math.sqrt(det));
        return Math.max(p, MIN_DENSITY);
    }

    /** Нормирует вектор к сумме 1, возвращает исходную сумму. */
    private static double normalize(double[] v) {
        double s = 0.0;
        for (double d : v) {
            s += d;
        }
        if (!(s > 0.0) || !Double.isFinite(s)) {
            Arrays.fill(v, 1.0 / v.length);
            return MIN_DENSITY;
        }
        for (int i = 0; i < v.length; i++) {
            v[i] /= s;
        }
        return s;
    }
}
