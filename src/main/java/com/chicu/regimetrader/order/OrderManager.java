package com.chicu.regimetrader.order;

import com.chicu.regimetrader.common.enums.OrderSide;
import com.chicu.regimetrader.common.enums.OrderStatus;
import com.chicu.regimetrader.common.enums.OrderType;
import com.chicu.regimetrader.config.RegimeTraderProperties;
import com.chicu.regimetrader.persistence.PersistenceStore;
import com.chicu.regimetrader.portfolio.Fill;
import com.chicu.regimetrader.portfolio.PortfolioState;
import com.chicu.regimetrader.provider.ExecutionAck;
import com.chicu.regimetrader.provider.ExecutionAdapter;
import com.chicu.regimetrader.provider.OrderStatusReport;
import com.chicu.regimetrader.risk.LiveSlippageEstimator;
import com.chicu.regimetrader.risk.RiskChecker;
import com.chicu.regimetrader.risk.SizedOrderIntent;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Исполнение одобренных интентов в live/paper режиме.
 *
 * <p>PAPER: мгновенный симулированный fill по expected ± половина slippageBps, комиссия taker/maker.
 * LIVE: submit через {@link ExecutionAdapter}, далее {@link #pollOpenOrders()} переводит
 * накопительные отчёты биржи в инкрементальные fill'ы. Ордер без финала дольше
 * orderTimeoutSeconds отменяется.</p>
 */
@Slf4j
public class OrderManager {

    public enum Mode { PAPER, LIVE }

    private final Mode mode;
    private final RegimeTraderProperties.Execution execution;
    private final String exchange;
    private final OrderBook book;
    private final PortfolioState portfolio;
    private final RiskChecker riskChecker;
    private final PersistenceStore store;
    private final ExecutionAdapter adapter;
    private final LiveSlippageEstimator slippage;
    private final Clock clock;

    public OrderManager(RegimeTraderProperties.Execution execution,
                        String exchange,
                        OrderBook book,
                        PortfolioState portfolio,
                        RiskChecker riskChecker,
                        PersistenceStore store,
                        ExecutionAdapter adapter,
                        LiveSlippageEstimator slippage,
                        Clock clock) {
        this.mode = Mode.valueOf(execution.getMode().trim().toUpperCase(Locale.ROOT));
        this.execution = execution;
        this.exchange = exchange;
        this.book = book;
        this.portfolio = portfolio;
        this.riskChecker = riskChecker;
        this.store = store;
        this.adapter = adapter;
        this.slippage = slippage;
        this.clock = clock;
    }

    public Mode mode() {
        return mode;
    }

    /**
     * Разместить одобренный риском интент.
     *
     * @return пусто, если по символу уже есть ордер в полёте
     */
    public Optional<Order> place(SizedOrderIntent intent) {
        if (!book.tryAcquire(intent.symbol())) {
            log.info("⏸ {}: ордер уже в полёте, новый не ставим", intent.symbol());
            return Optional.empty();
        }

        Instant now = Instant.now(clock);
        Order order;
        try {
            OrderType type = execution.getOrderType();
            order = Order.builder()
                    .id(OrderIds.newOrderId())
                    .symbol(intent.symbol())
                    .exchange(exchange)
                    .side(intent.side())
                    .type(type)
                    .quantity(intent.quantity())
                    .limitPrice(type == OrderType.LIMIT ? intent.referencePrice() : null)
                    .expectedPrice(intent.referencePrice())
                    .createdAt(now)
                    .build();
            book.register(order);
            store.saveOrder(order);
        } catch (RuntimeException e) {
            book.release(intent.symbol());
            throw e;
        }

        log.info("📤 [{}] {} {} {} qty={} @~{}", mode, order.getId(), order.getSymbol(), order.getSide(),
                fmt(order.getQuantity()), fmt(order.getExpectedPrice()));

        if (mode == Mode.PAPER) {
            order.submit("PAPER-" + order.getId(), now);
            double price = paperFillPrice(order.getSide(), order.getExpectedPrice());
            double fee = price * order.getQuantity() * feeRate(order.getType());
            settle(order, order.recordFill(order.getQuantity(), price, fee, now));
            return Optional.of(order);
        }

        ExecutionAck ack;
        try {
            ack = adapter.submit(order);
        } catch (RuntimeException e) {
            log.error("❌ submit {} упал: {}", order.getId(), e.getMessage(), e);
            ack = ExecutionAck.rejected("submit failed: " + e.getMessage());
        }
        if (ack == null || !ack.accepted()) {
            order.reject(ack == null ? "no ack" : ack.reason(), Instant.now(clock));
            finish(order);
            log.warn("⛔ {} отклонён биржей: {}", order.getId(), order.getRejectReason());
            return Optional.of(order);
        }
        order.submit(ack.exchangeOrderId(), Instant.now(clock));
        store.saveOrder(order);
        return Optional.of(order);
    }

    /**
     * Опрос открытых live-ордеров + отмена по таймауту.
     */
    public void pollOpenOrders() {
        if (mode != Mode.LIVE) {
            return;
        }
        Duration timeout = Duration.ofSeconds(execution.getOrderTimeoutSeconds());
        for (Order order : book.open()) {
            try {
                pollOne(order, timeout);
            } catch (RuntimeException e) {
                log.error("❌ poll {} упал: {}", order.getId(), e.getMessage(), e);
            }
        }
    }

    private void pollOne(Order order, Duration timeout) {
        OrderStatusReport report = adapter.poll(order.getId());
        if (report != null && report.filledQty() > order.getFilledQty()) {
            double deltaQty = report.filledQty() - order.getFilledQty();
            double deltaNotional = report.avgFillPrice() * report.filledQty()
                    - order.getAvgFillPrice() * order.getFilledQty();
            double price = deltaNotional / deltaQty;
            double fee = Math.max(0.0, report.fees() - order.getFees());
            Instant ts = report.reportedAt() != null ? report.reportedAt() : Instant.now(clock);
            settle(order, order.recordFill(deltaQty, price, fee, ts));
        }

        if (!order.isOpen()) {
            return;
        }
        Instant now = Instant.now(clock);
        if (report != null && (report.status() == OrderStatus.CANCELLED || report.status() == OrderStatus.REJECTED)) {
            if (report.status() == OrderStatus.REJECTED && order.getStatus() == OrderStatus.SUBMITTED) {
                order.reject("rejected by exchange", now);
            } else {
                order.cancel(now);
            }
            finish(order);
            return;
        }
        if (Duration.between(order.getCreatedAt(), now).compareTo(timeout) > 0) {
            boolean cancelled = adapter.cancel(order.getId());
            order.cancel(now);
            log.warn("⌛ {} не исполнен за {}s, отменён (exchange cancel={})",
                    order.getId(), timeout.toSeconds(), cancelled);
            finish(order);
        }
    }

    // ===== settle =====

    private void settle(Order order, Fill fill) {
        boolean applied = portfolio.applyFill(fill);
        if (applied) {
            store.appendFill(fill);
            store.upsertPosition(portfolio.position(fill.symbol()));
            // кэш после fill: restore берёт cash из последнего снимка, позиции из таблицы
            store.appendSnapshot(portfolio.snapshot(Instant.now(clock)));
            slippage.record(order.getExpectedPrice(), fill.price());
            riskChecker.postTrade(fill.symbol(), portfolio);
            log.info("✅ FILL {} {} {} qty={} @{} fee={}", fill.fillId(), fill.symbol(), fill.side(),
                    fmt(fill.quantity()), fmt(fill.price()), fmt(fill.fees()));
        }
        if (!order.isOpen()) {
            finish(order);
        } else {
            store.saveOrder(order);
        }
    }

    private void finish(Order order) {
        store.saveOrder(order);
        book.close(order);
    }

    double paperFillPrice(OrderSide side, double expected) {
        double half = execution.getSlippageBps() / 2.0 / 10_000.0;
        return side == OrderSide.BUY ? expected * (1.0 + half) : expected * (1.0 - half);
    }

    private double feeRate(OrderType type) {
        double bps = type == OrderType.LIMIT ? execution.getMakerFeeBps() : execution.getTakerFeeBps();
        return bps / 10_000.0;
    }

    private static String fmt(double v) {
        return String.format("%.6f", v);
    }
}
