package com.chicu.regimetrader.order;

import lombok.experimental.UtilityClass;

import java.util.Locale;
import java.util.UUID;

/**
 * Выдача id ордеров. Формат: RT- + 32 hex (uuid без '-') = 35 символов,
 * укладывается в лимит clientOrderId спотовых бирж (36).
 */
@UtilityClass
public class OrderIds {

    public static final String PREFIX = "RT-";

    public static String newOrderId() {
        return PREFIX + UUID.randomUUID().toString()
                .replace("-", "")
                .toLowerCase(Locale.ROOT);
    }

    public static boolean isOrderId(String s) {
        return s != null
                && s.startsWith(PREFIX)
                && s.substring(PREFIX.length()).matches("[0-9a-f]{32}");
    }

    /** orderId из fillId (orderId#seq). */
    public static String orderIdOfFill(String fillId) {
        if (fillId == null) return null;
        int hash = fillId.lastIndexOf('#');
        return hash < 0 ? fillId : fillId.substring(0, hash);
    }
}
