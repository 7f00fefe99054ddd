package com.chicu.regimetrader.provider;

/**
 * Ответ квантильного предиктора.
 *
 * @param label           0 = down, 1 = neutral, 2 = up
 * @param labelConfidence вероятность предсказанного класса [0..1]
 */
public record Prediction(
        double q10,
        double q25,
        double q50,
        double q75,
        double q90,
        int label,
        double labelConfidence
) {

    public double iqr() {
        return q75 - q25;
    }

    /** Все квантили совпадают: IQR ничего не говорит о неопределённости. */
    public boolean isDegenerate() {
        return q10 == q90;
    }

    /** 0,1,2 → -1,0,1 */
    public double directionalScore() {
        return Math.max(-1.0, Math.min(1.0, label - 1.0));
    }
}
