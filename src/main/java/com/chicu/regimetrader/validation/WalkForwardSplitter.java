package com.chicu.regimetrader.validation;

import com.chicu.regimetrader.common.exception.InvalidWindowException;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Последовательные train/test окна с purge и embargo.
 *
 * <pre>
 * train = [s, s + train)
 * test  = [s + train + purge, s + train + purge + test)
 * s'    = test.end + embargo
 * </pre>
 * Окна полуоткрытые, поэтому train и test не пересекаются даже при purge = 0.
 */
@UtilityClass
public class WalkForwardSplitter {

    /**
     * @throws InvalidWindowException некорректные размеры или ни одно окно не помещается в историю
     */
    public List<WalkForwardSplit> generate(int historyLen, int trainWindow, int testWindow, int purgeGap, int embargoGap) {
        if (trainWindow <= 0 || testWindow <= 0) {
            throw new InvalidWindowException(
                    "train/test windows must be > 0 (train=" + trainWindow + ", test=" + testWindow + ")");
        }
        if (purgeGap < 0 || embargoGap < 0) {
            throw new InvalidWindowException(
                    "purge/embargo gaps must be >= 0 (purge=" + purgeGap + ", embargo=" + embargoGap + ")");
        }
        long needed = (long) trainWindow + purgeGap + testWindow;
        if (historyLen < needed) {
            throw new InvalidWindowException(String.format(
                    "windows do not fit: train(%d) + purge(%d) + test(%d) = %d > history(%d)",
                    trainWindow, purgeGap, testWindow, needed, historyLen));
        }

        List<WalkForwardSplit> splits = new ArrayList<>();
        // long: start + окна при большом embargo не помещаются в int
        long start = 0;
        while (true) {
            long trainEnd = start + trainWindow;
            long testStart = trainEnd + purgeGap;
            long testEnd = testStart + testWindow;
            if (testEnd > historyLen) {
                break;
            }
            splits.add(new WalkForwardSplit(
                    splits.size(),
                    new IndexRange((int) start, (int) trainEnd),
                    new IndexRange((int) testStart, (int) testEnd)
            ));
            start = testEnd + embargoGap;
        }
        return splits;
    }
}
