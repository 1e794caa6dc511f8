package ca.gc.cra.recstream.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TelemetrySettingsTest {
  private String previousExporter;

  @BeforeEach
  void saveProperties() {
    previousExporter = System.getProperty("otel.metrics.exporter");
  }

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void explicitValuesWinOverSystemProperties() {
    System.setProperty("otel.metrics.exporter", "otlp");

    TelemetrySettings resolved = new TelemetrySettings("NONE", "http://collector:4317", "").resolve();

    assertEquals("none", resolved.exporter());
    assertEquals("http://collector:4317", resolved.endpoint());
  }

  @Test
  void systemPropertyFillsMissingExporter() {
    System.setProperty("otel.metrics.exporter", "none");

    assertEquals("none", TelemetrySettings.fromEnvironment().resolve().exporter());
  }

  @Test
  void resourceAttributesParseKeyValuePairs() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("env=dev, team = data ,broken,=x");

    assertEquals("dev", attributes.get(AttributeKey.stringKey("env")));
    assertEquals("data", attributes.get(AttributeKey.stringKey("team")));
    assertEquals(2, attributes.size());
  }
}
