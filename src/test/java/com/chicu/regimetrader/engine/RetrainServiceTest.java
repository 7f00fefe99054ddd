package com.chicu.regimetrader.engine;

import com.chicu.regimetrader.common.exception.InsufficientDataException;
import com.chicu.regimetrader.config.RegimeTraderProperties;
import com.chicu.regimetrader.provider.ModelTrainer;
import com.chicu.regimetrader.regime.FeatureVector;
import com.chicu.regimetrader.regime.RegimeService;
import com.chicu.regimetrader.validation.WalkForwardSplit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetrainServiceTest {

    @Mock
    private FeatureHistoryLoader historyLoader;
    @Mock
    private RegimeService regimeService;
    @Mock
    private ModelTrainer trainer;

    private RegimeTraderProperties props;
    private RetrainService service;

    @BeforeEach
    void setUp() {
        props = new RegimeTraderProperties();
        props.getUniverse().setSymbols(List.of("BTCUSDT", "ETHUSDT"));
        props.getWalkForward().setTrainBars(200);
        props.getWalkForward().setTestBars(50);
        props.getWalkForward().setPurgeBars(0);
        props.getWalkForward().setEmbargoBars(0);
        service = new RetrainService(props, historyLoader, regimeService, trainer,
                Clock.fixed(Instant.parse("2024-05-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    private static List<FeatureVector> history(int n) {
        List<FeatureVector> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(new FeatureVector(0.001 * (i % 5 - 2), 0.3 + 0.01 * (i % 7)));
        }
        return out;
    }

    @Test
    void retrainNow_shouldRefitEverySymbolAndTrainEveryFold() {
        when(historyLoader.load(anyString(), anyInt())).thenReturn(history(500));
        when(trainer.train(anyString(), any(WalkForwardSplit.class))).thenReturn(0.7);

        RetrainResult result = service.retrainNow("scheduled");

        assertEquals(RetrainResult.Status.COMPLETED, result.status());
        assertEquals(2, result.symbolsRefit());
        // 500 баров, окна 200 + 50: фолды на 0, 250 => 2 на символ
        assertEquals(4, result.foldsTrained());
        verify(regimeService).refit(eq("BTCUSDT"), anyList());
        verify(regimeService).refit(eq("ETHUSDT"), anyList());
        verify(historyLoader, times(2)).load(anyString(), eq(1000));
        assertFalse(service.isRunning());
    }

    @Test
    void retrainNow_shouldSkipSymbol_whenHistoryTooShortForRegime() {
        when(historyLoader.load(anyString(), anyInt())).thenReturn(history(50));
        doThrow(new InsufficientDataException("not enough bars to fit regime model", 50, 200))
                .when(regimeService).refit(anyString(), anyList());

        RetrainResult result = service.retrainNow("manual");

        assertEquals(0, result.symbolsRefit());
        assertEquals(0, result.foldsTrained());
        verifyNoInteractions(trainer);
    }

    @Test
    void retrainNow_shouldSkipWalkForward_whenWindowsDoNotFit() {
        when(historyLoader.load(anyString(), anyInt())).thenReturn(history(220));

        RetrainResult result = service.retrainNow("manual");

        assertEquals(2, result.symbolsRefit());
        assertEquals(0, result.foldsTrained());
        verifyNoInteractions(trainer);
    }

    @Test
    void requestRetrain_shouldReturnAlreadyRunning_whileRetrainInProgress() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        props.getUniverse().setSymbols(List.of("BTCUSDT"));
        when(historyLoader.load(anyString(), anyInt())).thenReturn(history(500));
        doAnswer(inv -> {
            entered.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return null;
        }).when(regimeService).refit(anyString(), anyList());

        RetrainResult first = service.requestRetrain("manual");
        assertEquals(RetrainResult.Status.STARTED, first.status());
        assertTrue(entered.await(5, TimeUnit.SECONDS), "переобучение должно стартовать");

        assertEquals(RetrainResult.Status.ALREADY_RUNNING, service.requestRetrain("manual").status());
        assertEquals(RetrainResult.Status.ALREADY_RUNNING, service.retrainNow("scheduled").status());

        release.countDown();
        long deadline = System.currentTimeMillis() + 5_000;
        while (service.isRunning() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(service.isRunning(), "флаг должен сняться после завершения");
        verify(regimeService, times(1)).refit(anyString(), anyList());
    }
}
