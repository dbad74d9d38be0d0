package net.pgtyped.client.log;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class PQLoggerFactoryTest {
  private static final Logger clientLogger = Logger.getLogger(PQFormatter.CLASS_NAME_PREFIX);

  private Level previousLevel;

  @BeforeEach
  public void setUp() {
    previousLevel = clientLogger.getLevel();
  }

  @AfterEach
  public void tearDown() {
    System.clearProperty(PQLoggerFactory.LOGGER_IMPL_PROPERTY);
    System.clearProperty(PQLoggerFactory.LOG_LEVEL_PROPERTY);
    PQLoggerFactory.reset();
    JDK14Logger.removeConsoleHandler();
    clientLogger.setLevel(previousLevel);
  }

  @Test
  public void testDefaultsToJdk14Logger() {
    PQLoggerFactory.reset();
    assertEquals(PQLoggerFactory.Backend.JUL, PQLoggerFactory.getBackend());
    assertTrue(PQLoggerFactory.getLogger(PQLoggerFactoryTest.class) instanceof JDK14Logger);
    assertNull(JDK14Logger.getConsoleHandler());
  }

  @Test
  public void testSelectsSlf4jLogger() {
    System.setProperty(PQLoggerFactory.LOGGER_IMPL_PROPERTY, " SLF4J ");
    PQLoggerFactory.reset();
    PQLogger logger = PQLoggerFactory.getLogger(PQLoggerFactoryTest.class);
    assertTrue(logger instanceof SLF4JLogger);
    assertEquals(
        PQLoggerFactoryTest.class.getName(), ((SLF4JLogger) logger).getDelegate().getName());
    logger.warn("Logging through {} to {}", "slf4j", "postgres://app:pw@db/app");
  }

  @Test
  public void testUnknownBackendFallsBackToJdk14() {
    System.setProperty(PQLoggerFactory.LOGGER_IMPL_PROPERTY, "log4j");
    PQLoggerFactory.reset();
    assertTrue(PQLoggerFactory.getLogger("custom") instanceof JDK14Logger);
  }

  @Test
  public void testLevelPropertyEnablesConsoleOutput() {
    System.setProperty(PQLoggerFactory.LOG_LEVEL_PROPERTY, "debug");
    PQLoggerFactory.reset();
    PQLogger logger = PQLoggerFactory.getLogger("net.pgtyped.client.core.TypedResult");
    assertTrue(logger.isDebugEnabled());
    assertEquals(Level.FINE, clientLogger.getLevel());
    assertNotNull(JDK14Logger.getConsoleHandler());
  }

  @Test
  public void testUnknownLevelIsIgnored() {
    clientLogger.setLevel(null);
    System.setProperty(PQLoggerFactory.LOG_LEVEL_PROPERTY, "loud");
    PQLoggerFactory.reset();
    PQLoggerFactory.getLogger(PQLoggerFactoryTest.class);
    assertNull(clientLogger.getLevel());
    assertNull(JDK14Logger.getConsoleHandler());
  }
}
