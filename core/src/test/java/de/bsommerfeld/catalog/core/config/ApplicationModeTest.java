package de.bsommerfeld.catalog.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationModeTest {

    @Test
    void parse_shouldReturnProdForMissingValue() {
        assertEquals(ApplicationMode.PROD, ApplicationMode.parse(null));
        assertEquals(ApplicationMode.PROD, ApplicationMode.parse(""));
    }

    @Test
    void parse_shouldBeCaseInsensitive() {
        assertEquals(ApplicationMode.TEST, ApplicationMode.parse("test"));
        assertEquals(ApplicationMode.TEST, ApplicationMode.parse(" Test "));
    }

    @Test
    void parse_shouldDefaultToProdForInvalidValue() {
        assertEquals(ApplicationMode.PROD, ApplicationMode.parse("INVALID_GARBAGE"));
    }

    @Test
    void get_shouldResolveFromSystemProperty() {
        String original = System.getProperty("app.mode");
        try {
            System.setProperty("app.mode", "TEST");
            assertEquals(ApplicationMode.TEST, ApplicationMode.get());
        } finally {
            if (original != null)
                System.setProperty("app.mode", original);
            else
                System.clearProperty("app.mode");
        }
    }

    @Test
    void isTest_shouldOnlyBeTrueForTestMode() {
        assertTrue(ApplicationMode.TEST.isTest());
        assertFalse(ApplicationMode.PROD.isTest());
    }
}
