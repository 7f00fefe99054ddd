package com.chicu.regimetrader.validation;

/**
 * Один фолд walk-forward: обучение на trainRange, оценка на testRange.
 */
public record WalkForwardSplit(int index, IndexRange trainRange, IndexRange testRange) {
}
