package io.tsquery.mcp.logs;

import io.tsquery.client.QueryException;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cursor-driven reader for the server log.
 *
 * <p>The server returns at most {@link LogRequest#MAX_LINES_PER_PAGE} lines per {@code logview}.
 * {@link #fetchPage} reads one bounded window; {@link #fetchAll} follows {@code last_pos}
 * cursors until the log is exhausted or the iteration bound is hit. Continuation requests ask
 * for one line at a time so that a partially buffered entry is never split across pages.
 */
public final class LogPaginator {

  private static final Logger LOG = LoggerFactory.getLogger(LogPaginator.class);

  public static final Duration DEFAULT_PAGE_DELAY = Duration.ofMillis(100);
  public static final int DEFAULT_MAX_ITERATIONS = 1000;

  /** Pause between page requests. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }

  private final Duration pageDelay;
  private final Sleeper sleeper;

  public LogPaginator() {
    this(DEFAULT_PAGE_DELAY);
  }

  public LogPaginator(Duration pageDelay) {
    this(pageDelay, d -> Thread.sleep(d.toMillis()));
  }

  public LogPaginator(Duration pageDelay, Sleeper sleeper) {
    this.pageDelay = pageDelay;
    this.sleeper = sleeper;
  }

  /** Reads a single bounded window. */
  public LogPage fetchPage(LogPageSource source, LogRequest request)
      throws IOException, QueryException {
    LOG.debug("logview {}", request);
    return source.fetch(request);
  }

  /**
   * Reads the log until exhaustion.
   *
   * @param source page source
   * @param first first request; its line count is used only for the first page
   * @param maxIterations hard bound on page requests
   * @return accumulated lines with the reason the loop stopped
   * @throws IOException if the transport fails
   */
  public LogResult fetchAll(LogPageSource source, LogRequest first, int maxIterations)
      throws IOException {
    List<String> lines = new ArrayList<>();
    LogRequest request = first;
    OptionalLong current = OptionalLong.empty();
    int iterations = 0;
    int requests = 0;

    while (true) {
      if (requests >= maxIterations) {
        return result(lines, iterations, current, LogResult.Termination.MAX_ITERATIONS, null);
      }
      LogPage page;
      try {
        requests++;
        page = fetchPage(source, request);
      } catch (QueryException e) {
        if (e.isEmptyResult()) {
          return result(lines, iterations, current, LogResult.Termination.EMPTY_PAGE, null);
        }
        LOG.warn("Log pagination stopped after {} pages: {}", iterations, e.getMessage());
        return result(
            lines, iterations, current, LogResult.Termination.REMOTE_ERROR, e.getMessage());
      }

      if (page.isEmpty()) {
        return result(lines, iterations, current, LogResult.Termination.EMPTY_PAGE, null);
      }
      OptionalLong next = page.cursor();
      // a repeated cursor re-serves the window already read
      if (next.isPresent() && current.isPresent() && next.getAsLong() == current.getAsLong()) {
        return result(lines, iterations, current, LogResult.Termination.REPEATED_CURSOR, null);
      }
      lines.addAll(page.lines());
      iterations++;
      if (next.isEmpty()) {
        return result(lines, iterations, current, LogResult.Termination.NO_CURSOR, null);
      }
      current = next;
      if (next.getAsLong() == 0) {
        return result(lines, iterations, current, LogResult.Termination.ZERO_CURSOR, null);
      }
      request = request.withCursor(next.getAsLong(), 1);

      if (!pageDelay.isZero() && requests < maxIterations) {
        try {
          sleeper.sleep(pageDelay);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return result(lines, iterations, current, LogResult.Termination.INTERRUPTED, null);
        }
      }
    }
  }

  private static LogResult result(
      List<String> lines,
      int iterations,
      OptionalLong cursor,
      LogResult.Termination termination,
      String error) {
    LOG.debug(
        "Log pagination finished: {} lines, {} iterations, {}",
        lines.size(),
        iterations,
        termination);
    return new LogResult(lines, iterations, cursor, termination, error);
  }
}
