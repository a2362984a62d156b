package io.github.themoah.anomaly.config;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.ThreadingModel;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x runtime options.
 *
 * <p>Storage calls run on the worker pool, so VERTX_WORKER_POOL_SIZE bounds
 * how many JDBC calls are in flight at once (default 20). Virtual threads
 * (VERTX_USE_VIRTUAL_THREADS=true) apply only on JDK 21 and later.
 */
public final class VertxConfig {

  private static final Logger log = LoggerFactory.getLogger(VertxConfig.class);

  private static final int DEFAULT_WORKER_POOL_SIZE = VertxOptions.DEFAULT_WORKER_POOL_SIZE;
  private static final int VIRTUAL_THREADS_MIN_JDK = 21;

  private VertxConfig() {}

  public static VertxOptions createVertxOptions(Env env) {
    int workerPoolSize = env.getInt("VERTX_WORKER_POOL_SIZE", DEFAULT_WORKER_POOL_SIZE);
    if (workerPoolSize < 1) {
      log.warn("VERTX_WORKER_POOL_SIZE must be positive, got {}, using {}",
        workerPoolSize, DEFAULT_WORKER_POOL_SIZE);
      workerPoolSize = DEFAULT_WORKER_POOL_SIZE;
    }
    log.info("Vert.x worker pool size: {}", workerPoolSize);
    return new VertxOptions()
      .setPreferNativeTransport(true)
      .setWorkerPoolSize(workerPoolSize);
  }

  public static DeploymentOptions createDeploymentOptions(Env env) {
    DeploymentOptions options = new DeploymentOptions();
    if (!env.getBoolean("VERTX_USE_VIRTUAL_THREADS", false)) {
      return options;
    }
    int jdk = Runtime.version().feature();
    if (jdk < VIRTUAL_THREADS_MIN_JDK) {
      log.warn("Virtual threads requested but JDK {} has none, staying on the event loop", jdk);
      return options;
    }
    log.info("Virtual threads enabled for verticle deployment");
    return options.setThreadingModel(ThreadingModel.VIRTUAL_THREAD);
  }
}
