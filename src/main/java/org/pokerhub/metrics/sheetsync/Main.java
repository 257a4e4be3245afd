/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync;

import org.pokerhub.metrics.sheetsync.classify.CourseClassifier;
import org.pokerhub.metrics.sheetsync.conf.Configuration;
import org.pokerhub.metrics.sheetsync.conf.ConfigurationException;
import org.pokerhub.metrics.sheetsync.conf.JobSpec;
import org.pokerhub.metrics.sheetsync.conf.JobSpecLoader;
import org.pokerhub.metrics.sheetsync.conf.Key;
import org.pokerhub.metrics.sheetsync.cron.Scheduler;
import org.pokerhub.metrics.sheetsync.cron.ShutdownHook;
import org.pokerhub.metrics.sheetsync.destination.ServiceAccountTokenProvider;
import org.pokerhub.metrics.sheetsync.destination.SheetsDestination;
import org.pokerhub.metrics.sheetsync.downloader.Downloader;
import org.pokerhub.metrics.sheetsync.enrichment.EnrichmentFetcher;
import org.pokerhub.metrics.sheetsync.enrichment.EnrichmentMerger;
import org.pokerhub.metrics.sheetsync.enrichment.PartnerApiClient;
import org.pokerhub.metrics.sheetsync.job.SheetSyncJobFactory;
import org.pokerhub.metrics.sheetsync.job.StatusLine;
import org.pokerhub.metrics.sheetsync.retry.RetryPolicy;
import org.pokerhub.metrics.sheetsync.source.JdbcSource;
import org.pokerhub.metrics.sheetsync.source.TunnelFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Main class for starting a SheetSync instance.
 * <br>
 * Run without arguments in order to read the usage information, i.e.
 * <br>
 * <code>java -jar sheetsync.jar</code>
 */
public class Main {

  private static final Logger log = LoggerFactory.getLogger(Main.class);

  public static final String CONF_FILE = "sheetsync.properties";

  private static final int MILLIS_PER_SECOND = 1000;

  /**
   * At most one argument.
   * See class description {@link Main}.
   */
  public static void main(String[] args) throws Exception {
    Path confPath;
    if (args == null || args.length == 0) {
      confPath = Paths.get(CONF_FILE);
    } else if (args.length == 1) {
      confPath = Paths.get(args[0]);
    } else {
      printUsage("SheetSync takes at most one argument.");
      return;
    }
    if (!confPath.toFile().exists() || confPath.toFile().length() < 1L) {
      writeDefaultConfig(confPath);
      return;
    }
    Configuration conf = new Configuration();
    List<JobSpec> specs;
    try {
      conf.loadAndCheckConfiguration(confPath);
      specs = new JobSpecLoader(conf).loadAll();
      run(conf, specs);
    } catch (ConfigurationException ce) {
      printUsage(ce.getMessage());
    }
  }

  private static void run(Configuration conf, List<JobSpec> specs)
      throws Exception {
    Downloader sheetsDownloader = new Downloader(60 * MILLIS_PER_SECOND);
    SheetsDestination destination = new SheetsDestination(
        conf.getString(Key.SpreadsheetUrl), sheetsDownloader,
        ServiceAccountTokenProvider.fromKeyFile(
            conf.getPath(Key.ServiceAccountFile)));
    EnrichmentFetcher fetcher = enrichmentFetcher(conf, specs);
    TunnelFactory tunnels = TunnelFactory.forPlatform();
    SheetSyncJobFactory.Builder jobs = SheetSyncJobFactory.builder()
        .sources(spec -> new JdbcSource(spec.getSource(), spec.getTunnel(),
            tunnels))
        .destination(destination)
        .statusLine(new StatusLine(conf.getString(Key.TimeZone)))
        .fetchWarnMillis(conf.getInt(Key.FetchWarnSeconds)
            * (long) MILLIS_PER_SECOND)
        .pacing(conf.getInt(Key.PacingDelayMillis),
            conf.getInt(Key.PacingJitterMillis));
    if (null != fetcher) {
      jobs.enrichment(fetcher, new EnrichmentMerger(new CourseClassifier()));
    }
    Scheduler scheduler = new Scheduler(specs, jobs.build(),
        conf.getInt(Key.UpdateIntervalMinutes) * 60_000L,
        conf.getBool(Key.RunOnce), conf.getLong(Key.ShutdownGraceWaitMinutes));
    Runtime.getRuntime().addShutdownHook(new ShutdownHook(scheduler));
    RetryPolicy connectRetry = RetryPolicy.builder("destination connect")
        .maxAttempts(3)
        .retryOn(IOException.class)
        .build();
    try {
      scheduler.start(() -> {
        connectRetry.call(() -> {
          destination.connect();
          return null;
        });
        return null;
      });
      scheduler.awaitStopped();
    } catch (IOException e) {
      log.error("Cannot connect to the spreadsheet. Reason: {}",
          e.getMessage(), e);
      throw e;
    } finally {
      destination.close();
      if (null != fetcher) {
        fetcher.close();
      }
    }
  }

  private static EnrichmentFetcher enrichmentFetcher(Configuration conf,
      List<JobSpec> specs) throws ConfigurationException {
    for (JobSpec spec : specs) {
      if (spec.isEnrich()) {
        PartnerApiClient client = new PartnerApiClient(
            conf.getUrl(Key.PartnerApiUrl), new Downloader(
                conf.getInt(Key.PartnerApiTimeoutSeconds) * MILLIS_PER_SECOND));
        if (!client.healthCheck()) {
          log.warn("Partner service at {} is not healthy; enriched jobs "
              + "will write rows without partner data until it recovers.",
              conf.getUrl(Key.PartnerApiUrl));
        }
        return new EnrichmentFetcher(client, conf.getInt(Key.PartnerBatchSize),
            conf.getInt(Key.PartnerMaxConnections),
            EnrichmentFetcher.defaultBatchRetry());
      }
    }
    return null;
  }

  private static void printUsage(String msg) {
    final String usage = "Usage:\njava -jar sheetsync.jar "
        + "[path/to/configFile]";
    System.out.println(msg + "\n" + usage);
  }

  private static void writeDefaultConfig(Path confPath) {
    try {
      Files.copy(Main.class.getClassLoader().getResource(CONF_FILE)
          .openStream(), confPath, StandardCopyOption.REPLACE_EXISTING);
      printUsage("Could not find config file. The default configuration "
          + "lists no jobs. You need to change the configuration ("
          + CONF_FILE + "), list at least one job in 'Jobs' and configure "
          + "the spreadsheet and its service account.");
    } catch (IOException e) {
      log.error("Cannot write default configuration. Reason: " + e, e);
      throw new RuntimeException(e);
    }
  }

}
