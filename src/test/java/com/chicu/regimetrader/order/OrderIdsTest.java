package com.chicu.regimetrader.order;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class OrderIdsTest {

    @Test
    void newOrderId_shouldBePrefixedLowerHex() {
        String id = OrderIds.newOrderId();

        assertNotNull(id);
        assertTrue(id.startsWith("RT-"), "должен быть префикс RT-");
        assertEquals(35, id.length(), "RT- + 32 hex");
        assertEquals(id.toLowerCase(), id, "должно быть в lowercase");
        assertTrue(OrderIds.isOrderId(id));
    }

    @Test
    void newOrderId_shouldNotRepeat() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1_000; i++) {
            assertTrue(ids.add(OrderIds.newOrderId()), "id не должен повторяться");
        }
    }

    @Test
    void isOrderId_shouldRejectForeignFormats() {
        assertFalse(OrderIds.isOrderId(null));
        assertFalse(OrderIds.isOrderId("ATB-0123456789abcdef0123456789abcdef"));
        assertFalse(OrderIds.isOrderId("RT-XYZ"));
    }

    @Test
    void orderIdOfFill_shouldStripSequence() {
        assertEquals("RT-abc", OrderIds.orderIdOfFill("RT-abc#3"));
        assertEquals("RT-abc", OrderIds.orderIdOfFill("RT-abc"));
        assertNull(OrderIds.orderIdOfFill(null));
    }
}
