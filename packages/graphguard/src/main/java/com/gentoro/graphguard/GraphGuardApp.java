package com.gentoro.graphguard;

import com.gentoro.graphguard.analysis.IsolationAnalyzer;
import com.gentoro.graphguard.config.ConfigurationProvider;
import com.gentoro.graphguard.config.GraphGuardSettings;
import com.gentoro.graphguard.exception.ConfigException;
import com.gentoro.graphguard.exception.GraphGuardException;
import com.gentoro.graphguard.exception.ValidationException;
import com.gentoro.graphguard.export.GraphExporter;
import com.gentoro.graphguard.graph.api.ZepGraphApi;
import com.gentoro.graphguard.graph.client.GraphClient;
import com.gentoro.graphguard.http.OkHttpFactory;
import com.gentoro.graphguard.logging.LoggingService;
import com.gentoro.graphguard.maintenance.ConsoleConfirmationPrompt;
import com.gentoro.graphguard.maintenance.DeletionExecutor;
import com.gentoro.graphguard.maintenance.GraphMaintenanceService;
import com.gentoro.graphguard.maintenance.progress.ConsoleProgressSink;
import com.gentoro.graphguard.utility.StdoutUtility;
import java.io.BufferedReader;
import java.io.File;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

public class GraphGuardApp {

  private static final org.slf4j.Logger log =
      com.gentoro.graphguard.logging.LoggingService.getLogger(GraphGuardApp.class);

  /** How long an interrupt waits for the in-flight deletion to finish before the JVM exits. */
  private static final long SHUTDOWN_GRACE_SECONDS = 10;

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String[] args) {
    StdoutUtility console = StdoutUtility.system();
    StartupParameters params;
    try {
      params = new StartupParameters(args);
    } catch (ValidationException e) {
      console.printError(e.getMessage(), null);
      console.printNewLine(GraphGuardCommand.usage());
      return GraphGuardCommand.EXIT_USAGE;
    }
    if (params.action() == Action.HELP) {
      console.printNewLine(GraphGuardCommand.usage());
      return GraphGuardCommand.EXIT_OK;
    }

    OkHttpClient httpClient = null;
    CountDownLatch finished = new CountDownLatch(1);
    try {
      Configuration cfg = new ConfigurationProvider(params.configFile()).config();
      LoggingService.applyConfiguration(cfg);
      if (params.verbose()) {
        LoggingService.enableVerbose();
      }
      GraphGuardSettings settings = GraphGuardSettings.fromConfiguration(cfg);
      if (settings.fileLoggingEnabled()) {
        LoggingService.enableFileLogging(new File(settings.logsDir()));
      }
      if (settings.apiKey() == null) {
        throw new ConfigException("zep.apiKey is not set; export ZEP_API_KEY or configure it");
      }
      log.debug("Starting with {}", settings);

      httpClient = OkHttpFactory.create(settings);
      GraphClient client =
          new GraphClient(
              new ZepGraphApi(httpClient, settings.baseUrl(), settings.healthPath()), settings);
      ConsoleProgressSink progress = new ConsoleProgressSink(console.stream());
      DeletionExecutor executor =
          new DeletionExecutor(
              client,
              new ConsoleConfirmationPrompt(
                  new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                  console.stream()),
              progress);
      GraphMaintenanceService service =
          new GraphMaintenanceService(
              client, new IsolationAnalyzer(), executor, new GraphExporter(client));

      Runtime.getRuntime()
          .addShutdownHook(
              new Thread(
                  () -> {
                    if (finished.getCount() == 0) return;
                    log.warn("Interrupted; stopping after the current item");
                    progress.cancel();
                    try {
                      finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                      Thread.currentThread().interrupt();
                    }
                  },
                  "graphguard-shutdown"));

      return new GraphGuardCommand(service, console, settings.defaultGraphId()).execute(params);
    } catch (GraphGuardException e) {
      log.error("GraphGuard failed to start", e);
      console.printError(e.getMessage(), params.verbose() ? e : null);
      return GraphGuardCommand.EXIT_FAILURE;
    } catch (RuntimeException e) {
      log.error("Unexpected failure", e);
      console.printError(e.toString(), e);
      return GraphGuardCommand.EXIT_FAILURE;
    } finally {
      finished.countDown();
      if (httpClient != null) {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
      }
    }
  }
}
