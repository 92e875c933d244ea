package org.flowxmi.activity.conversion;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IdAllocatorTest {

    @Test
    void shouldRepeatSequenceForSameSeed() {
        IdAllocator first = new IdAllocator("Orders");
        IdAllocator second = new IdAllocator("Orders");

        for (int i = 0; i < 5; i++) {
            assertEquals(first.nextElementId(), second.nextElementId());
        }
        assertEquals(first.nextPackageId(), second.nextPackageId());
        assertEquals(6, first.issuedCount());
    }

    @Test
    void shouldUseEnterpriseArchitectIdFormat() {
        IdAllocator ids = new IdAllocator("Orders");

        String elementId = ids.nextElementId();
        String packageId = ids.nextPackageId();

        assertTrue(elementId.matches("EAID_[0-9A-F]{8}_[0-9A-F]{4}_[0-9A-F]{4}_[0-9A-F]{4}_[0-9A-F]{12}"), elementId);
        assertTrue(packageId.startsWith("EAPK_"));
        assertNotEquals(elementId.substring(5), packageId.substring(5));
    }

    @Test
    void shouldNotShareIdsBetweenSeeds() {
        assertNotEquals(new IdAllocator("Orders").nextElementId(), new IdAllocator("Invoices").nextElementId());
    }
}
