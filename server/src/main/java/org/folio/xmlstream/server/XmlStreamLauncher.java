package org.folio.xmlstream.server;

import io.vertx.core.Launcher;
import io.vertx.core.VertxOptions;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.json.JsonObject;
import io.vertx.micrometer.MicrometerMetricsOptions;
import io.vertx.micrometer.VertxJmxMetricsOptions;
import io.vertx.micrometer.VertxPrometheusOptions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.folio.xmlstream.server.misc.SysConf;

/**
 * Launcher for the XML stream server. Without arguments it runs {@link MainVerticle}.
 * Connection metrics of the TCP server are published when enabled in configuration.
 */
public class XmlStreamLauncher extends Launcher {
  private static final Logger log = LogManager.getLogger(XmlStreamLauncher.class);
  static final String PROMETHEUS_PORT = "metrics.prometheus.port";
  static final String PROMETHEUS_PATH = "/metrics";
  static final String JMX_ENABLED = "metrics.jmx";
  static final String JMX_DOMAIN = "metrics.jmx.domain";
  private JsonObject config;

  public static void main(String[] args) {
    new XmlStreamLauncher().dispatch(args.length == 0
        ? new String[] {"run", MainVerticle.class.getName()} : args);
  }

  @Override
  public void afterConfigParsed(JsonObject config) {
    this.config = config;
    super.afterConfigParsed(config);
  }

  @Override
  public void beforeStartingVertx(VertxOptions options) {
    options.setMetricsOptions(metricsOptions(config));
    super.beforeStartingVertx(options);
  }

  /**
   * Metrics options from system properties and configuration.
   * @param config launcher configuration; may be null
   * @return options, disabled if neither Prometheus nor JMX is configured
   */
  static MicrometerMetricsOptions metricsOptions(JsonObject config) {
    MicrometerMetricsOptions metricsOpts = new MicrometerMetricsOptions();
    final int promPort = SysConf.getInteger(PROMETHEUS_PORT, -1, config);
    if (promPort != -1) {
      log.info("Enabling Prometheus metrics at {}:{}", PROMETHEUS_PATH, promPort);
      metricsOpts.setPrometheusOptions(new VertxPrometheusOptions()
          .setEnabled(true)
          .setStartEmbeddedServer(promPort != 0)
          .setEmbeddedServerOptions(new HttpServerOptions().setPort(promPort))
          .setEmbeddedServerEndpoint(PROMETHEUS_PATH));
    }
    final boolean jmxEnabled = SysConf.getBoolean(JMX_ENABLED, false, config);
    if (jmxEnabled) {
      String domain = SysConf.get(JMX_DOMAIN, JMX_DOMAIN, "xmlstream", config);
      log.info("Enabling JMX metrics for domain '{}'", domain);
      metricsOpts.setJmxMetricsOptions(new VertxJmxMetricsOptions()
          .setEnabled(true)
          .setStep(5)
          .setDomain(domain));
    }
    metricsOpts.setEnabled(promPort != -1 || jmxEnabled);
    return metricsOpts;
  }
}
