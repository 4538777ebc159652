package energy.server.services;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.AsyncFile;
import io.vertx.core.file.OpenOptions;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedList;
import java.util.List;

/**
 * Centralized CSV logger for the energy server.
 *
 * <ul>
 *   <li>Collects lines published on the <code>log</code> address.</li>
 *   <li>Appends the buffer to <code>logs/current.csv</code> every 20 seconds.</li>
 *   <li>Once a day the file is renamed to a timestamped CSV and a fresh
 *       <code>current.csv</code> is started; only the newest 12 rotated files are kept.</li>
 *   <li>Flushes immediately on <code>saveAllDataToFiles_OnTermination</code>.</li>
 * </ul>
 */
public class Logger extends AbstractVerticle {

  public static final String READY_ADDRESS = "logger.ready";
  public static final String FLUSH_ADDRESS = "saveAllDataToFiles_OnTermination";

  private static final long FLUSH_INTERVAL_MS  = 20_000;
  private static final long ROTATE_INTERVAL_MS = 86_400_000L;
  private static final int  MAX_HISTORIC_FILES = 12;
  private static final String HEADER = "Message,Level,Component,Operation,Category,SequenceReceived,EpochTimeMillis\n";
  private static final DateTimeFormatter FILE_STAMP =
          DateTimeFormatter.ofPattern("yyyyMMdd_HHmm").withZone(ZoneId.of("UTC"));

  private final LinkedList<String> buffer = new LinkedList<>();
  private final String logsDir;
  private final String currentFile;
  private int sequenceCounter = 0;
  private long currentBlockStart;

  public Logger(String dataPath) {
    this.logsDir = dataPath + "/logs";
    this.currentFile = logsDir + "/current.csv";
  }

  @Override
  public void start(Promise<Void> startPromise) {
    vertx.fileSystem().mkdirs(logsDir)
        .compose(v -> vertx.fileSystem().writeFile(currentFile, Buffer.buffer(HEADER)))
        .onSuccess(v -> {
          currentBlockStart = System.currentTimeMillis();
          setupConsumers();
          scheduleFlush();
          vertx.eventBus().publish(READY_ADDRESS, "true");
          startPromise.complete();
        })
        .onFailure(startPromise::fail);
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    flushBuffer(ar -> stopPromise.complete());
  }

  int bufferedLines() {
    return buffer.size();
  }

  private void setupConsumers() {
    vertx.eventBus().<String>consumer(LogUtil.LOG_ADDRESS, msg -> {
      sequenceCounter++;
      buffer.add(msg.body() + "," + sequenceCounter + "," + System.currentTimeMillis() + "\n");
    });

    vertx.eventBus().consumer(FLUSH_ADDRESS, m -> flushBuffer(ar -> m.reply("flushed")));
  }

  private void scheduleFlush() {
    vertx.setPeriodic(FLUSH_INTERVAL_MS, id -> {
      long now = System.currentTimeMillis();
      if (now - currentBlockStart >= ROTATE_INTERVAL_MS) {
        rotate(now, r -> flushBuffer(null));
      } else {
        flushBuffer(null);
      }
    });
  }

  private void flushBuffer(Handler<AsyncResult<Void>> handler) {
    if (buffer.isEmpty()) {
      if (handler != null) handler.handle(Future.succeededFuture());
      return;
    }

    StringBuilder sb = new StringBuilder();
    buffer.forEach(sb::append);
    buffer.clear();

    vertx.fileSystem().open(currentFile, new OpenOptions().setAppend(true)).onComplete(openRes -> {
      if (openRes.succeeded()) {
        AsyncFile file = openRes.result();
        file.write(Buffer.buffer(sb.toString())).onComplete(wr -> {
          file.close();
          if (handler != null) handler.handle(wr.mapEmpty());
        });
      } else {
        System.err.println("[Logger] Cannot open " + currentFile + ": " + openRes.cause().getMessage());
        if (handler != null) handler.handle(openRes.mapEmpty());
      }
    });
  }

  private void rotate(long now, Handler<AsyncResult<Void>> after) {
    String rotatedPath = logsDir + "/" + FILE_STAMP.format(Instant.ofEpochMilli(currentBlockStart)) + ".csv";

    // flush first so the rotated file is complete
    flushBuffer(flush -> {
      if (flush.failed()) {
        after.handle(flush);
        return;
      }
      vertx.fileSystem().move(currentFile, rotatedPath)
          .compose(v -> {
            currentBlockStart = now;
            return vertx.fileSystem().writeFile(currentFile, Buffer.buffer(HEADER));
          })
          .onComplete(res -> {
            if (res.succeeded()) {
              cleanupOld();
            }
            after.handle(res.mapEmpty());
          });
    });
  }

  private void cleanupOld() {
    vertx.fileSystem().readDir(logsDir, ".*\\.csv").onSuccess(files -> {
      List<String> history = files.stream()
              .filter(p -> !p.endsWith("current.csv"))
              .sorted()
              .toList();

      int excess = history.size() - MAX_HISTORIC_FILES;
      if (excess > 0) {
        history.subList(0, excess).forEach(p -> vertx.fileSystem().delete(p));
      }
    });
  }
}
