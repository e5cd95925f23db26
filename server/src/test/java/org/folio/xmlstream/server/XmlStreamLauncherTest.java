package org.folio.xmlstream.server;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.unit.Async;
import io.vertx.ext.unit.TestContext;
import io.vertx.ext.unit.junit.VertxUnitRunner;
import io.vertx.micrometer.MicrometerMetricsOptions;
import io.vertx.micrometer.backends.BackendRegistries;
import java.util.concurrent.atomic.AtomicReference;
import org.folio.xmlstream.util.stream.XmlStream;
import org.folio.xmlstream.util.stream.XmlStreamFactory;
import org.junit.Test;
import org.junit.runner.RunWith;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;

@RunWith(VertxUnitRunner.class)
public class XmlStreamLauncherTest {

  @Test
  public void metricsDisabledByDefault() {
    assertThat(XmlStreamLauncher.metricsOptions(null).isEnabled(), is(false));
    assertThat(XmlStreamLauncher.metricsOptions(new JsonObject()).isEnabled(), is(false));
  }

  @Test
  public void prometheusEmbeddedServer() {
    MicrometerMetricsOptions options = XmlStreamLauncher.metricsOptions(
        new JsonObject().put(XmlStreamLauncher.PROMETHEUS_PORT, 9241));
    assertThat(options.isEnabled(), is(true));
    assertThat(options.getPrometheusOptions().isEnabled(), is(true));
    assertThat(options.getPrometheusOptions().isStartEmbeddedServer(), is(true));
    assertThat(options.getPrometheusOptions().getEmbeddedServerOptions().getPort(), is(9241));
    assertThat(options.getPrometheusOptions().getEmbeddedServerEndpoint(), is("/metrics"));
  }

  @Test
  public void prometheusWithoutEmbeddedServer() {
    MicrometerMetricsOptions options = XmlStreamLauncher.metricsOptions(
        new JsonObject().put(XmlStreamLauncher.PROMETHEUS_PORT, 0));
    assertThat(options.isEnabled(), is(true));
    assertThat(options.getPrometheusOptions().isStartEmbeddedServer(), is(false));
  }

  @Test
  public void jmxDomain() {
    MicrometerMetricsOptions options = XmlStreamLauncher.metricsOptions(new JsonObject()
        .put(XmlStreamLauncher.JMX_ENABLED, true));
    assertThat(options.isEnabled(), is(true));
    assertThat(options.getJmxMetricsOptions().getDomain(), is("xmlstream"));

    options = XmlStreamLauncher.metricsOptions(new JsonObject()
        .put(XmlStreamLauncher.JMX_ENABLED, "true")
        .put(XmlStreamLauncher.JMX_DOMAIN, "xs1"));
    assertThat(options.getJmxMetricsOptions().isEnabled(), is(true));
    assertThat(options.getJmxMetricsOptions().getDomain(), is("xs1"));
  }

  @Test
  public void beforeStartingVertx() {
    XmlStreamLauncher launcher = new XmlStreamLauncher();
    launcher.afterConfigParsed(new JsonObject().put(XmlStreamLauncher.JMX_ENABLED, true));
    VertxOptions vertxOptions = new VertxOptions();
    launcher.beforeStartingVertx(vertxOptions);
    assertThat(vertxOptions.getMetricsOptions(), instanceOf(MicrometerMetricsOptions.class));
    assertThat(vertxOptions.getMetricsOptions().isEnabled(), is(true));
  }

  @Test
  public void connectionMetrics(TestContext context) {
    Vertx vertx = Vertx.vertx(new VertxOptions().setMetricsOptions(XmlStreamLauncher.metricsOptions(
        new JsonObject().put(XmlStreamLauncher.PROMETHEUS_PORT, 0))));
    MeterRegistry registry = BackendRegistries.getDefaultNow();
    assertThat(registry, instanceOf(PrometheusMeterRegistry.class));

    AtomicReference<String> scraped = new AtomicReference<>();
    Async async = context.async();
    XmlStreamFactory factory = new XmlStreamFactory();
    factory.addBootstrap(XmlStream.STREAM_START_EVENT, payload -> {
      scraped.set(((PrometheusMeterRegistry) registry).scrape());
      async.complete();
    });
    XmlStreamServer server = new XmlStreamServer(vertx, factory);
    server.listen(0)
        .compose(port -> vertx.createNetClient().connect(port, "localhost"))
        .onComplete(context.asyncAssertSuccess(socket -> socket.write("<root>")));
    async.await();
    assertThat(scraped.get(), containsString("vertx_net_server_active_connections"));
    server.close()
        .compose(x -> vertx.close())
        .onComplete(context.asyncAssertSuccess());
  }
}
