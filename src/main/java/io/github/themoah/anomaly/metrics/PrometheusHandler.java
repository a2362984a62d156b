package io.github.themoah.anomaly.metrics;

import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * GET /metrics: Prometheus text format by default, OpenMetrics when the
 * scraper asks for it in its Accept header.
 */
public class PrometheusHandler {

  private static final Logger log = LoggerFactory.getLogger(PrometheusHandler.class);

  private final PrometheusMeterRegistry registry;

  public PrometheusHandler(PrometheusMeterRegistry registry) {
    this.registry = registry;
  }

  public void registerRoutes(Router router) {
    router.get("/metrics").handler(this::handleScrape);
    log.info("Registered Prometheus metrics endpoint at /metrics");
  }

  private void handleScrape(RoutingContext ctx) {
    String contentType = TextFormat.chooseContentType(ctx.request().getHeader(HttpHeaders.ACCEPT));
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, contentType)
      .end(registry.scrape(contentType));
  }
}
