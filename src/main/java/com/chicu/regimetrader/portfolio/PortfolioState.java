package com.chicu.regimetrader.portfolio;

import com.chicu.regimetrader.common.enums.Direction;
import com.chicu.regimetrader.common.exception.IdempotencyViolationException;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Кэш, позиции, капитал и кривая капитала одного портфеля.
 *
 * <ul>
 *     <li>Позиции меняются только через {@link #applyFill(Fill)}.</li>
 *     <li>applyFill идемпотентен по fillId.</li>
 *     <li>Realized PnL по методу средней цены, в момент сокращающей сделки.</li>
 *     <li>После каждой мутации проверяется
 *         {@code cash + positionsValue == capital + realized + unrealized}.</li>
 * </ul>
 *
 * Все мутации под одним локом. Читатели без лока (health-тик)
 * берут {@link #latestSnapshot()}: последний зафиксированный снимок, а не полупримененный fill.
 * Каждый прогон бэктеста создаёт свой экземпляр.
 *
 * <p>retainLimit &gt; 0 ограничивает кривую капитала, журнал round trip'ов и множество
 * применённых fillId последними retainLimit записями (live). Старые fillId повторно не приходят:
 * fill рождается только из открытого ордера, терминальный ордер новых fill'ов не принимает.
 */
@Slf4j
public class PortfolioState {

    private static final double EPS_QTY = 1e-12;

    private final ReentrantLock lock = new ReentrantLock();

    private double capital;
    private double cash;
    private double peakEquity;

    private final Map<String, Book> books = new TreeMap<>();
    private final Map<String, Double> marks = new HashMap<>();
    private final Map<String, Fill> appliedFills = new LinkedHashMap<>();
    private final List<RoundTripTrade> roundTrips = new ArrayList<>();
    private final List<PortfolioSnapshot> history = new ArrayList<>();
    private double totalFees;
    private double tradedNotional;

    private final int retainLimit;

    private volatile PortfolioSnapshot latest;

    /** Без ограничения истории (бэктест). */
    public PortfolioState(double initialCash) {
        this(initialCash, 0);
    }

    public PortfolioState(double initialCash, int retainLimit) {
        if (!(initialCash > 0.0)) {
            throw new IllegalArgumentException("initial cash must be > 0, got " + initialCash);
        }
        if (retainLimit < 0) {
            throw new IllegalArgumentException("retainLimit must be >= 0, got " + retainLimit);
        }
        this.retainLimit = retainLimit;
        this.capital = initialCash;
        this.cash = initialCash;
        this.peakEquity = initialCash;
    }

    // ===== RESTORE =====

    /**
     * Восстановление после рестарта. Пик НЕ сбрасывается к текущему капиталу:
     * берётся максимум из истории, иначе старая просадка спрячется.
     */
    public void restore(double restoredCash, Collection<Position> positions, double historicalPeakEquity) {
        lock.lock();
        try {
            books.clear();
            marks.clear();
            this.cash = restoredCash;
            for (Position p : positions) {
                Book b = new Book(p.symbol());
                b.qty = p.signedQuantity();
                b.avg = p.avgEntryPrice();
                b.realized = p.realizedPnl();
                b.tripOpenQty = p.quantity();
                b.tripEntryAvg = p.avgEntryPrice();
                books.put(p.symbol(), b);
                if (p.markPrice() > 0.0) {
                    marks.put(p.symbol(), p.markPrice());
                }
            }
            double eq = equityLocked();
            this.capital = eq - realizedLocked() - unrealizedLocked();
            this.peakEquity = Math.max(eq, historicalPeakEquity);
            log.info("♻️ Portfolio restored: cash={} equity={} peak={} positions={}",
                    fmt(cash), fmt(eq), fmt(peakEquity), books.size());
        } finally {
            lock.unlock();
        }
    }

    /** Поднять пик до исторического максимума (засев при старте). */
    public void seedPeak(double historicalPeakEquity) {
        lock.lock();
        try {
            if (historicalPeakEquity > peakEquity) {
                peakEquity = historicalPeakEquity;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Новый базовый пик после ручного reset kill switch: оператор принял просадку,
     * отсчёт идёт от текущего капитала.
     */
    public void rebaselinePeak(double equity) {
        lock.lock();
        try {
            peakEquity = equity;
        } finally {
            lock.unlock();
        }
    }

    // ===== MUTATIONS =====

    public void markPrice(String symbol, double price) {
        if (!(price > 0.0) || !Double.isFinite(price)) {
            throw new IllegalArgumentException("mark price must be > 0 for " + symbol + ", got " + price);
        }
        lock.lock();
        try {
            marks.put(symbol, price);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Применить fill.
     *
     * @return false, если этот fill уже применён (повтор: no-op)
     * @throws IdempotencyViolationException fillId уже встречался с другим содержимым
     */
    public boolean applyFill(Fill fill) {
        lock.lock();
        try {
            Fill seen = appliedFills.get(fill.fillId());
            if (seen != null) {
                if (!seen.sameContentAs(fill)) {
                    log.error("💥 Fill {} повторно пришёл с другим содержимым: was={} now={}",
                            fill.fillId(), seen, fill);
                    throw new IdempotencyViolationException(
                            "fill " + fill.fillId() + " re-applied with different content");
                }
                log.debug("[Portfolio] duplicate fill {} ignored", fill.fillId());
                return false;
            }

            double notional = fill.notional();
            switch (fill.side()) {
                case BUY -> cash -= notional + fill.fees();
                case SELL -> cash += notional - fill.fees();
            }
            totalFees += fill.fees();
            tradedNotional += notional;
            marks.putIfAbsent(fill.symbol(), fill.price());

            books.computeIfAbsent(fill.symbol(), Book::new).apply(fill, roundTrips);
            appliedFills.put(fill.fillId(), fill);
            trimLocked();

            checkEquityInvariant();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Зафиксировать снимок на момент ts: обновить пик, посчитать просадку,
     * опубликовать как последний зафиксированный.
     */
    public PortfolioSnapshot snapshot(Instant ts) {
        lock.lock();
        try {
            double pv = positionsValueLocked();
            double eq = cash + pv;
            if (eq > peakEquity) {
                peakEquity = eq;
            }
            double dd = peakEquity > 0.0 ? Math.max(0.0, (peakEquity - eq) / peakEquity) : 0.0;
            PortfolioSnapshot s = new PortfolioSnapshot(
                    ts, eq, cash, pv, unrealizedLocked(), realizedLocked(), dd);
            history.add(s);
            trimLocked();
            latest = s;
            return s;
        } finally {
            lock.unlock();
        }
    }

    // ===== READS =====

    public PortfolioSnapshot latestSnapshot() {
        return latest;
    }

    public double equity() {
        lock.lock();
        try {
            return equityLocked();
        } finally {
            lock.unlock();
        }
    }

    public double cash() {
        lock.lock();
        try {
            return cash;
        } finally {
            lock.unlock();
        }
    }

    public double peakEquity() {
        lock.lock();
        try {
            return peakEquity;
        } finally {
            lock.unlock();
        }
    }

    /** Знаковое количество по символу (0 если позиции нет). */
    public double quantity(String symbol) {
        lock.lock();
        try {
            Book b = books.get(symbol);
            return b == null ? 0.0 : b.qty;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Double> lastPrice(String symbol) {
        lock.lock();
        try {
            return Optional.ofNullable(marks.get(symbol));
        } finally {
            lock.unlock();
        }
    }

    /** Рыночная стоимость всех позиций по символу (со знаком) в текущих ценах. */
    public Map<String, Double> exposures() {
        lock.lock();
        try {
            Map<String, Double> out = new TreeMap<>();
            for (Book b : books.values()) {
                if (Math.abs(b.qty) > EPS_QTY) {
                    out.put(b.symbol, b.qty * markOf(b));
                }
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    public Position position(String symbol) {
        lock.lock();
        try {
            Book b = books.get(symbol);
            return b == null ? Position.flat(symbol) : b.toPosition(markOf(b));
        } finally {
            lock.unlock();
        }
    }

    public List<Position> positions() {
        lock.lock();
        try {
            List<Position> out = new ArrayList<>();
            for (Book b : books.values()) {
                out.add(b.toPosition(markOf(b)));
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    private void trimLocked() {
        if (retainLimit == 0) {
            return;
        }
        trimHead(history);
        trimHead(roundTrips);
        Iterator<String> it = appliedFills.keySet().iterator();
        while (appliedFills.size() > retainLimit && it.hasNext()) {
            it.next();
            it.remove();
        }
    }

    private void trimHead(List<?> list) {
        if (list.size() > retainLimit) {
            list.subList(0, list.size() - retainLimit).clear();
        }
    }

    public List<PortfolioSnapshot> history() {
        lock.lock();
        try {
            return List.copyOf(history);
        } finally {
            lock.unlock();
        }
    }

    public List<RoundTripTrade> roundTrips() {
        lock.lock();
        try {
            return List.copyOf(roundTrips);
        } finally {
            lock.unlock();
        }
    }

    public Collection<Fill> appliedFills() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(appliedFills.values()));
        } finally {
            lock.unlock();
        }
    }

    public double totalFees() {
        lock.lock();
        try {
            return totalFees;
        } finally {
            lock.unlock();
        }
    }

    public double tradedNotional() {
        lock.lock();
        try {
            return tradedNotional;
        } finally {
            lock.unlock();
        }
    }

    // ===== internals (под локом) =====

    private double equityLocked() {
        return cash + positionsValueLocked();
    }

    private double positionsValueLocked() {
        double pv = 0.0;
        for (Book b : books.values()) {
            pv += b.qty * markOf(b);
        }
        return pv;
    }

    private double unrealizedLocked() {
        double u = 0.0;
        for (Book b : books.values()) {
            u += b.unrealized(markOf(b));
        }
        return u;
    }

    private double realizedLocked() {
        double r = 0.0;
        for (Book b : books.values()) {
            r += b.realized;
        }
        return r;
    }

    private double markOf(Book b) {
        Double m = marks.get(b.symbol);
        return m != null ? m : b.avg;
    }

    private void checkEquityInvariant() {
        double eq = equityLocked();
        double expected = capital + realizedLocked() + unrealizedLocked();
        double tol = 1e-6 * Math.max(1.0, Math.abs(eq));
        if (Math.abs(eq - expected) > tol) {
            log.error("💥 Equity invariant broken: cash+positions={} capital+pnl={}", eq, expected);
            throw new IllegalStateException("equity invariant violated: " + eq + " != " + expected);
        }
    }

    private static String fmt(double v) {
        return String.format("%.2f", v);
    }

    /**
     * Позиция по символу + открытая round-trip сделка.
     */
    private static final class Book {
        private final String symbol;
        private double qty;
        private double avg;
        private double realized;

        // текущая round-trip
        private Instant tripOpened;
        private double tripOpenQty;
        private double tripEntryAvg;
        private double tripClosedQty;
        private double tripExitNotional;
        private double tripFees;
        private double tripPnl;

        private Book(String symbol) {
            this.symbol = symbol;
        }

        void apply(Fill f, List<RoundTripTrade> sink) {
            int sign = f.side().sign();
            double q = f.quantity();

            if (Math.abs(qty) <= EPS_QTY || Math.signum(qty) == sign) {
                // открытие / наращивание
                if (Math.abs(qty) <= EPS_QTY) {
                    qty = 0.0;
                    startTrip(f.timestamp());
                }
                double newAbs = Math.abs(qty) + q;
                avg = (Math.abs(qty) * avg + q * f.price()) / newAbs;
                qty += sign * q;
                tripOpenQty += q;
                tripEntryAvg = avg;
                realized -= f.fees();
                tripFees += f.fees();
                tripPnl -= f.fees();
                return;
            }

            // сокращение / закрытие / переворот
            double closeQty = Math.min(q, Math.abs(qty));
            double closeFees = f.fees() * (closeQty / q);
            double openFees = f.fees() - closeFees;
            double pnl = (f.price() - avg) * closeQty * Math.signum(qty);

            realized += pnl - closeFees;
            tripPnl += pnl - closeFees;
            tripFees += closeFees;
            tripClosedQty += closeQty;
            tripExitNotional += closeQty * f.price();
            qty += sign * closeQty;

            double remaining = q - closeQty;
            if (Math.abs(qty) <= EPS_QTY) {
                Direction tripSide = sign > 0 ? Direction.SHORT : Direction.LONG;
                sink.add(new RoundTripTrade(
                        symbol,
                        tripSide,
                        tripOpened,
                        f.timestamp(),
                        tripOpenQty,
                        tripEntryAvg,
                        tripExitNotional / tripClosedQty,
                        tripFees,
                        tripPnl
                ));
                qty = 0.0;
                avg = 0.0;
                if (remaining > EPS_QTY) {
                    startTrip(f.timestamp());
                    qty = sign * remaining;
                    avg = f.price();
                    tripOpenQty = remaining;
                    tripEntryAvg = avg;
                    realized -= openFees;
                    tripFees += openFees;
                    tripPnl -= openFees;
                }
            }
        }

        private void startTrip(Instant ts) {
            tripOpened = ts;
            tripOpenQty = 0.0;
            tripEntryAvg = 0.0;
            tripClosedQty = 0.0;
            tripExitNotional = 0.0;
            tripFees = 0.0;
            tripPnl = 0.0;
        }

        double unrealized(double mark) {
            return Math.abs(qty) <= EPS_QTY ? 0.0 : (mark - avg) * qty;
        }

        Position toPosition(double mark) {
            if (Math.abs(qty) <= EPS_QTY) {
                return new Position(symbol, Direction.FLAT, 0.0, 0.0, mark, 0.0, realized);
            }
            Direction side = qty > 0 ? Direction.LONG : Direction.SHORT;
            return new Position(symbol, side, Math.abs(qty), avg, mark, unrealized(mark), realized);
        }
    }
}
