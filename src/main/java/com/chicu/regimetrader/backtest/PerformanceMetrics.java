package com.chicu.regimetrader.backtest;

import com.chicu.regimetrader.portfolio.RoundTripTrade;
import com.chicu.regimetrader.risk.DrawdownMonitor;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Метрики по кривой капитала и закрытым сделкам.
 * Доходности бар-к-бару: r[i] = eq[i] / eq[i-1] - 1, i ≥ 1. Годовые через barsPerYear.
 */
@UtilityClass
public class PerformanceMetrics {

    public double[] returns(double[] equity) {
        if (equity.length < 2) {
            return new double[0];
        }
        double[] r = new double[equity.length - 1];
        for (int i = 1; i < equity.length; i++) {
            r[i - 1] = equity[i - 1] != 0.0 ? equity[i] / equity[i - 1] - 1.0 : 0.0;
        }
        return r;
    }

    public double totalReturn(double[] equity) {
        if (equity.length == 0 || equity[0] == 0.0) {
            return 0.0;
        }
        return equity[equity.length - 1] / equity[0] - 1.0;
    }

    public double annualizedReturn(double totalReturn, int bars, int barsPerYear) {
        if (bars <= 0) {
            return 0.0;
        }
        double years = (double) bars / barsPerYear;
        if (1.0 + totalReturn <= 0.0) {
            return -1.0;
        }
        return Math.pow(1.0 + totalReturn, 1.0 / years) - 1.0;
    }

    /** mean / σ (популяционное) * √barsPerYear; 0 при σ = 0. */
    public double sharpe(double[] returns, int barsPerYear) {
        if (returns.length == 0) {
            return 0.0;
        }
        double mean = mean(returns);
        double std = std(returns, mean);
        if (std < 1e-12) {
            return 0.0;
        }
        return mean / std * Math.sqrt(barsPerYear);
    }

    /** mean / σ(отрицательных доходностей) * √barsPerYear; 0, если убыточных баров нет. */
    public double sortino(double[] returns, int barsPerYear) {
        if (returns.length == 0) {
            return 0.0;
        }
        List<Double> down = new ArrayList<>();
        for (double r : returns) {
            if (r < 0.0) {
                down.add(r);
            }
        }
        if (down.isEmpty()) {
            return 0.0;
        }
        double[] d = down.stream().mapToDouble(Double::doubleValue).toArray();
        double downStd = std(d, mean(d));
        if (downStd < 1e-12) {
            return 0.0;
        }
        return mean(returns) / downStd * Math.sqrt(barsPerYear);
    }

    public double maxDrawdown(double[] equity) {
        return DrawdownMonitor.maxDrawdown(boxed(equity));
    }

    public int maxDrawdownDuration(double[] equity) {
        return DrawdownMonitor.maxDrawdownDuration(boxed(equity));
    }

    public double hitRate(List<RoundTripTrade> trades) {
        if (trades.isEmpty()) {
            return 0.0;
        }
        long wins = trades.stream().filter(RoundTripTrade::isWin).count();
        return (double) wins / trades.size();
    }

    /** Сумма прибылей / |сумма убытков|; +∞ без убытков, 0 без сделок. */
    public double profitFactor(List<RoundTripTrade> trades) {
        double gains = 0.0;
        double losses = 0.0;
        for (RoundTripTrade t : trades) {
            if (t.pnl() > 0.0) {
                gains += t.pnl();
            } else {
                losses += -t.pnl();
            }
        }
        if (losses == 0.0) {
            return gains > 0.0 ? Double.POSITIVE_INFINITY : 0.0;
        }
        return gains / losses;
    }

    /** Оборот: проторгованный нотионал / средний капитал, в год. */
    public double annualTurnover(double tradedNotional, double[] equity, int barsPerYear) {
        if (equity.length == 0) {
            return 0.0;
        }
        double avgEquity = mean(equity);
        if (!(avgEquity > 0.0)) {
            return 0.0;
        }
        double years = (double) equity.length / barsPerYear;
        return tradedNotional / avgEquity / years;
    }

    public double calmar(double annualizedReturn, double maxDrawdown) {
        return maxDrawdown > 0.0 ? annualizedReturn / maxDrawdown : 0.0;
    }

    double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    double std(double[] values, double mean) {
        double ss = 0.0;
        for (double v : values) {
            ss += (v - mean) * (v - mean);
        }
        return Math.sqrt(ss / values.length);
    }

    private List<Double> boxed(double[] values) {
        List<Double> out = new ArrayList<>(values.length);
        for (double v : values) {
            out.add(v);
        }
        return out;
    }
}
