package com.gentoro.intake;

import com.gentoro.intake.archive.ArchiveClassifier;
import com.gentoro.intake.archive.ExtractionEngine;
import com.gentoro.intake.broker.BrokerConsumer;
import com.gentoro.intake.broker.BrokerSettings;
import com.gentoro.intake.exception.ConfigurationException;
import com.gentoro.intake.exception.ExceptionUtil;
import com.gentoro.intake.exception.IntakeException;
import com.gentoro.intake.exception.StateException;
import com.gentoro.intake.logging.LoggingService;
import com.gentoro.intake.queue.Job;
import com.gentoro.intake.queue.TaskQueue;
import com.gentoro.intake.relocate.FileRelocator;
import com.gentoro.intake.worker.JobProcessor;
import com.gentoro.intake.worker.JobResult;
import com.gentoro.intake.worker.WorkerPool;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Wires and runs the intake pipeline: configuration, logging, task queue, worker pool and broker
 * consumer.
 *
 * <p>In {@code server} mode the broker consumer runs on its own thread and the service lives until
 * a shutdown signal arrives or the consumer fails. In {@code single} mode one file given with
 * {@code --file} is processed synchronously and the service completes immediately.
 */
public class IntakeService {

  private static final org.slf4j.Logger log =
      com.gentoro.intake.logging.LoggingService.getLogger(IntakeService.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private IntakeSettings settings;
  private JobProcessor processor;
  private TaskQueue taskQueue;
  private WorkerPool workerPool;
  private BrokerConsumer consumer;
  private Thread consumerThread;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;
  private volatile int exitCode = 0;

  public IntakeService(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    // Apply logging levels from configuration as early as possible
    LoggingService.applyConfiguration(configuration());

    IntakeSettings loaded = IntakeSettings.from(configuration());
    Path outputOverride = startupParameters.getParameter("output-dir", Path.class);
    this.settings = outputOverride == null ? loaded : loaded.withOutputDir(outputOverride);
    this.processor =
        new JobProcessor(
            settings.outputDir(),
            new ArchiveClassifier(),
            new ExtractionEngine(settings.maxExtractedBytes()),
            new FileRelocator());

    String mode = startupParameters.mode();
    switch (mode) {
      case StartupParameters.MODE_SINGLE:
        runSingle();
        break;
      case StartupParameters.MODE_SERVER:
        try {
          startServer();
        } catch (RuntimeException e) {
          exitCode = 1;
          shutdown();
          throw e;
        }
        break;
      default:
        throw new ConfigurationException("Invalid mode: " + mode);
    }
  }

  private void runSingle() {
    String file = startupParameters.getParameter("file", String.class);
    if (file == null || file.isBlank() || "true".equals(file)) {
      throw new ConfigurationException("--file is required in single mode");
    }
    JobResult result = processor.process(Job.of(file));
    exitCode = result.status().isSuccess() ? 0 : 1;
    log.info(
        "Finished {} with status {} in {} ms", file, result.status(), result.elapsed().toMillis());
    shuttingDown.set(true);
    shutdownLatch.countDown();
  }

  private void startServer() {
    BrokerSettings brokerSettings = BrokerSettings.from(configuration());
    this.taskQueue = new TaskQueue(settings.queueCapacity());
    this.workerPool = new WorkerPool(taskQueue, processor, settings.workerCount());
    workerPool.start();

    this.consumer = newBrokerConsumer(brokerSettings, taskQueue);
    this.consumerThread = new Thread(this::runConsumer, "broker-consumer");
    consumerThread.start();
    log.info(
        "Archive intake started: {} workers, queue capacity {}, output directory {}, broker {}",
        settings.workerCount(),
        settings.queueCapacity(),
        settings.outputDir().toAbsolutePath(),
        brokerSettings);
  }

  protected BrokerConsumer newBrokerConsumer(BrokerSettings brokerSettings, TaskQueue queue) {
    return new BrokerConsumer(brokerSettings, queue);
  }

  private void runConsumer() {
    try {
      consumer.run();
      if (!shuttingDown.get()) {
        log.error("Broker consumer ended without a shutdown request");
        exitCode = 1;
        triggerShutdown("consumer ended");
      }
    } catch (IntakeException e) {
      log.error("Broker consumer terminated: {}", ExceptionUtil.extractErrorMessage(e));
      log.debug("Consumer failure trace: {}", ExceptionUtil.formatCompactStackTrace(e));
      exitCode = 1;
      triggerShutdown("consumer failure");
    }
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination)
   * or the service stops on its own. The shutdown hook performs a graceful drain before this
   * method returns.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "intake-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Stop consuming, drain the queue and stop the workers. Safe to call multiple times. */
  public void shutdown() {
    triggerShutdown("explicit");
  }

  private void triggerShutdown(String reason) {
    if (!shuttingDown.compareAndSet(false, true)) {
      return;
    }
    log.info("Shutting down ({})", reason);
    try {
      if (consumer != null) {
        consumer.stop();
      }
      if (taskQueue != null) {
        taskQueue.close();
      }
      if (workerPool != null) {
        drainWorkers();
      }
      joinConsumer();
    } finally {
      shutdownLatch.countDown();
    }
  }

  private void drainWorkers() {
    try {
      if (workerPool.awaitTermination(settings.drainTimeout())) {
        log.info(
            "All workers stopped ({} jobs processed, {} failed)",
            workerPool.processedCount(),
            workerPool.failedCount());
      } else {
        log.warn(
            "Workers did not drain within {}s, {} jobs left in queue; interrupting",
            settings.drainTimeout().toSeconds(),
            taskQueue.size());
        workerPool.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      workerPool.shutdownNow();
    }
  }

  private void joinConsumer() {
    Thread thread = consumerThread;
    if (thread == null || thread == Thread.currentThread()) {
      return;
    }
    try {
      thread.join(5_000L);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("IntakeService not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public IntakeSettings settings() {
    return settings;
  }

  public TaskQueue taskQueue() {
    return taskQueue;
  }

  public WorkerPool workerPool() {
    return workerPool;
  }

  /** {@code 0} after a clean run, {@code 1} after a consumer failure or a failed single job. */
  public int exitCode() {
    return exitCode;
  }

  public boolean isShuttingDown() {
    return shuttingDown.get();
  }
}
