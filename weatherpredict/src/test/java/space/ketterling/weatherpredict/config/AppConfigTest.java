package space.ketterling.weatherpredict.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import space.ketterling.weatherpredict.predict.ConfidencePolicy;

import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @Test
    @DisplayName("Should fall back to defaults for unset keys")
    void testDefaults() {
        AppConfig cfg = AppConfig.fromProperties(new Properties());

        assertEquals(AppConfig.PROVIDER_CLIMATOLOGY, cfg.dataProvider());
        assertFalse(cfg.useArchive());
        assertEquals(Duration.ofSeconds(8), cfg.archiveTimeout());
        assertEquals(Duration.ofSeconds(60), cfg.fetchDeadline());
        assertEquals(10, cfg.yearsBack());
        assertEquals(ConfidencePolicy.WEIGHTED_BLEND, cfg.confidencePolicy());
        assertEquals(ZoneOffset.UTC.normalized(), cfg.clockZoneId().normalized());
    }

    @Test
    @DisplayName("Should read values from the properties file")
    void testProperties() {
        Properties p = new Properties();
        p.setProperty("data.provider", "Archive");
        p.setProperty("prediction.yearsBack", "5");
        p.setProperty("prediction.confidencePolicy", "std_penalty");
        p.setProperty("archive.maxAttempts", "0");
        p.setProperty("fetch.deadline", "PT30S");

        AppConfig cfg = AppConfig.fromProperties(p);

        assertTrue(cfg.useArchive());
        assertEquals(5, cfg.yearsBack());
        assertEquals(ConfidencePolicy.STD_PENALTY, cfg.confidencePolicy());
        assertEquals(1, cfg.archiveMaxAttempts());
        assertEquals(Duration.ofSeconds(30), cfg.fetchDeadline());
    }

    @Test
    @DisplayName("Should refuse an unknown provider or a non-positive year count")
    void testInvalid() {
        Properties bogus = new Properties();
        bogus.setProperty("data.provider", "opendap");
        assertThrows(IllegalStateException.class, () -> AppConfig.fromProperties(bogus));

        Properties years = new Properties();
        years.setProperty("prediction.yearsBack", "0");
        assertThrows(IllegalStateException.class, () -> AppConfig.fromProperties(years));
    }

    @Test
    @DisplayName("Should not print the archive password")
    void testToStringMasksPassword() {
        Properties p = new Properties();
        p.setProperty("archive.username", "someone");
        p.setProperty("archive.password", "hunter2");

        String s = AppConfig.fromProperties(p).toString();

        assertTrue(s.contains("someone"));
        assertFalse(s.contains("hunter2"));
    }
}
