package com.chicu.regimetrader.web.controller.api;

import com.chicu.regimetrader.backtest.BacktestComparison;
import com.chicu.regimetrader.backtest.BacktestService;
import com.chicu.regimetrader.engine.CoreStatusService;
import com.chicu.regimetrader.engine.Decision;
import com.chicu.regimetrader.engine.KillSwitchService;
import com.chicu.regimetrader.engine.RetrainResult;
import com.chicu.regimetrader.engine.RetrainService;
import com.chicu.regimetrader.regime.RegimeService;
import com.chicu.regimetrader.regime.RegimeState;
import com.chicu.regimetrader.risk.KillSwitchStatus;
import com.chicu.regimetrader.risk.RiskMetrics;
import com.chicu.regimetrader.signal.FusedSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Операторское API ядра: режимы, сигналы, риск, kill switch, ретрейн, бэктест.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/core")
public class CoreStatusApiController {

    private final RegimeService regimeService;
    private final CoreStatusService status;
    private final KillSwitchService killSwitchService;
    private final RetrainService retrainService;
    private final BacktestService backtestService;

    // ================================
    // режимы и сигналы
    // ================================

    @GetMapping("/regimes")
    public Map<String, RegimeState> regimes() {
        return regimeService.currentAll();
    }

    @GetMapping("/regimes/{symbol}")
    public RegimeState regime(@PathVariable String symbol) {
        return regimeService.current(symbol)
                .orElseThrow(() -> notFound("No regime yet for " + symbol));
    }

    @GetMapping("/signals")
    public Map<String, FusedSignal> signals() {
        return status.signals();
    }

    @GetMapping("/signals/{symbol}")
    public FusedSignal signal(@PathVariable String symbol) {
        return status.signal(symbol)
                .orElseThrow(() -> notFound("No signal yet for " + symbol));
    }

    @GetMapping("/decisions/{symbol}")
    public Decision decision(@PathVariable String symbol) {
        return status.decision(symbol)
                .orElseThrow(() -> notFound("No decision yet for " + symbol));
    }

    // ================================
    // риск
    // ================================

    @GetMapping("/risk-metrics")
    public RiskMetrics riskMetrics() {
        return status.riskMetrics()
                .orElseThrow(() -> notFound("Risk metrics are not computed yet"));
    }

    @GetMapping("/kill-switch")
    public KillSwitchStatus killSwitch() {
        return killSwitchService.status();
    }

    @PostMapping("/kill-switch/reset")
    public KillSwitchStatus resetKillSwitch(@RequestParam String operator,
                                            @RequestParam(required = false) String note) {
        log.warn("🔓 Запрос сброса kill switch от '{}'", operator);
        return killSwitchService.reset(operator, note);
    }

    // ================================
    // обслуживание
    // ================================

    @PostMapping("/retrain")
    public RetrainResult retrain(@RequestParam(defaultValue = "manual") String reason) {
        return retrainService.requestRetrain(reason);
    }

    @PostMapping("/backtest")
    public Map<String, Object> backtest(@RequestParam String symbol) {
        BacktestComparison cmp = backtestService.runLatest(symbol);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("strategy", cmp.strategy().metrics());
        body.put("benchmark", cmp.benchmark().metrics());
        body.put("report", cmp.report());
        return body;
    }

    private ResponseStatusException notFound(String message) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, message);
    }
}
