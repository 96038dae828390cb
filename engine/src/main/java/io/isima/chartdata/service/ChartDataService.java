/*
 * Copyright (C) 2025 Isima, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.isima.chartdata.service;

import com.google.common.base.Preconditions;
import io.isima.chartdata.cache.AggregateCache;
import io.isima.chartdata.cache.CacheItem;
import io.isima.chartdata.cache.CacheKeyGenerator;
import io.isima.chartdata.cache.CacheStats;
import io.isima.chartdata.diagnostics.Diagnostics;
import io.isima.chartdata.diagnostics.DiagnosticsListener;
import io.isima.chartdata.diagnostics.LoggingDiagnosticsListener;
import io.isima.chartdata.errors.PipelineError;
import io.isima.chartdata.errors.PipelineStage;
import io.isima.chartdata.errors.exception.ChartDataException;
import io.isima.chartdata.errors.exception.FetchException;
import io.isima.chartdata.errors.exception.SpecException;
import io.isima.chartdata.grammar.ExpressionEvaluator;
import io.isima.chartdata.models.PipelineResult;
import io.isima.chartdata.models.PipelineSpec;
import io.isima.chartdata.models.ResultMetadata;
import io.isima.chartdata.query.CompiledPipeline;
import io.isima.chartdata.query.PipelineCompiler;
import io.isima.chartdata.query.PipelineExecutor;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the chart data engine.
 *
 * <p>The service compiles the pipeline of a request, fetches the rows, runs the pipeline and
 * caches the result. Each cache key goes through the states absent, computing and cached:
 *
 * <ul>
 *   <li>A request whose result is cached and younger than the TTL is answered from the cache.
 *   <li>A request whose key is being computed awaits that computation instead of starting
 *       another.
 *   <li>Otherwise the request starts a computation. On success the result is cached and handed to
 *       every waiter; on failure nothing is cached and the error reaches every waiter.
 * </ul>
 *
 * <p>A request with {@code bypassCache} neither reads the cache nor joins a running computation,
 * but its result replaces the cache entry. Requests without dimensions and measures are computed
 * every time and never cached.
 *
 * <p>Cancelling a returned future drops only that caller. The computation keeps running and
 * populates the cache.
 */
public class ChartDataService {
  private static final Logger logger = LoggerFactory.getLogger(ChartDataService.class);

  private final ChartDataServiceConfig config;
  private final AggregateCache cache;
  private final PipelineCompiler compiler;
  private final PipelineExecutor executor;
  private final DiagnosticsListener diagnosticsListener;
  private final Clock clock;

  private final ConcurrentMap<String, CompletableFuture<CacheItem>> inFlight =
      new ConcurrentHashMap<>();
  private final CacheStats stats = new CacheStats();

  public ChartDataService(ChartDataServiceConfig config) {
    this(
        config,
        AggregateCache.create(config.getCacheMaxEntries()),
        new LoggingDiagnosticsListener(),
        Clock.systemUTC());
  }

  /**
   * The constructor.
   *
   * @param config Service parameters
   * @param cache The result cache
   * @param diagnosticsListener Receiver of non-fatal issues of each computation
   * @param clock Clock used for cache timestamps and TTL
   */
  public ChartDataService(
      ChartDataServiceConfig config,
      AggregateCache cache,
      DiagnosticsListener diagnosticsListener,
      Clock clock) {
    this.config = Preconditions.checkNotNull(config);
    this.cache = Preconditions.checkNotNull(cache);
    this.diagnosticsListener = Preconditions.checkNotNull(diagnosticsListener);
    this.clock = Preconditions.checkNotNull(clock);
    final var evaluator =
        new ExpressionEvaluator(
            config.getExpressionMaxLength(),
            config.getExpressionMaxDepth(),
            config.getExpressionTimeoutMillis());
    compiler = new PipelineCompiler(evaluator, config.isZeroLimitReturnsEmpty());
    executor = new PipelineExecutor();
    logger.info(
        "Chart data service started; cacheTtlMillis={}, cacheCapacity={}",
        config.getCacheTtlMillis(),
        cache.capacity());
  }

  /**
   * Executes a request asynchronously.
   *
   * <p>The specification is validated before any row is fetched. The returned future completes
   * exceptionally with a {@link ChartDataException} when the request fails.
   *
   * @param request The request
   * @return Future of the result
   */
  public CompletableFuture<PipelineResult> execute(DataRequest request) {
    Preconditions.checkNotNull(request, "request must not be null");
    final CompiledPipeline pipeline;
    final String key;
    try {
      if (request.getSpec() == null) {
        throw new SpecException("pipeline specification is missing");
      }
      if (request.getRows() == null && request.getRowSource() == null) {
        throw new SpecException("request must have either rows or a row source");
      }
      pipeline = compiler.compile(request.getSpec());
      if (pipeline.isPassThrough()) {
        logger.debug("Pass-through request; not cached");
        final var future = new CompletableFuture<CacheItem>();
        startComputation(null, pipeline, request, future);
        return future.thenApply((item) -> toResult(item, false));
      }
      key = CacheKeyGenerator.generate(keySource(request), request.getSpec());
    } catch (ChartDataException e) {
      return CompletableFuture.failedFuture(e);
    }

    if (!request.isBypassCache()) {
      final var cached = lookup(key);
      if (cached != null) {
        return CompletableFuture.completedFuture(toResult(cached, true));
      }
    }

    final var own = new CompletableFuture<CacheItem>();
    if (request.isBypassCache()) {
      final var replaced = inFlight.put(key, own);
      logger.debug("Cache bypassed; key={}, concurrentComputation={}", key, replaced != null);
    } else {
      final var existing = inFlight.putIfAbsent(key, own);
      if (existing != null) {
        stats.recordJoin();
        logger.debug("Joined in-flight computation; key={}", key);
        return existing.thenApply((item) -> toResult(item, false));
      }
      // a computation may have completed between the lookup and the registration
      final var cached = lookup(key);
      if (cached != null) {
        inFlight.remove(key, own);
        own.complete(cached);
        return CompletableFuture.completedFuture(toResult(cached, true));
      }
    }
    stats.recordMiss();
    startComputation(key, pipeline, request, own);
    return own.thenApply((item) -> toResult(item, false));
  }

  /**
   * Executes a request and waits for the result.
   *
   * @param request The request
   * @return The result
   * @throws ChartDataException when the request fails
   */
  public PipelineResult executeAndWait(DataRequest request) throws ChartDataException {
    final var future = execute(request);
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ChartDataException(PipelineError.OPERATION_CANCELED, "execution interrupted");
    } catch (ExecutionException e) {
      final var cause = e.getCause();
      if (cause instanceof ChartDataException) {
        throw (ChartDataException) cause;
      }
      throw new ChartDataException(PipelineError.GENERIC_PIPELINE_ERROR, "execution failed", cause);
    }
  }

  /** Removes the cached result of a source and specification. */
  public void invalidate(Object sourceIdentity, PipelineSpec spec) throws ChartDataException {
    final var key = CacheKeyGenerator.generate(sourceIdentity, spec);
    cache.invalidate(key);
    logger.debug("Invalidated key={}", key);
  }

  public void invalidateAll() {
    cache.invalidateAll();
    logger.debug("Invalidated all cache entries");
  }

  public CacheStats getStats() {
    return stats;
  }

  /** Returns number of computations running at the moment. */
  public int getInFlightCount() {
    return inFlight.size();
  }

  public ChartDataServiceConfig getConfig() {
    return config;
  }

  /**
   * Returns what identifies the rows of a request in its cache key.
   *
   * <p>Inline rows without a source identity are identified by their content.
   */
  private static Object keySource(DataRequest request) throws SpecException {
    if (request.getSourceIdentity() != null) {
      return request.getSourceIdentity();
    }
    if (request.getRows() == null) {
      throw new SpecException("request with a row source must have a source identity");
    }
    return Map.of("inlineRows", request.getRows());
  }

  private CacheItem lookup(String key) {
    final var item = cache.get(key);
    if (item == null) {
      return null;
    }
    if (item.isExpired(clock.millis(), config.getCacheTtlMillis())) {
      cache.evict(key, item);
      logger.debug("Evicted expired entry; key={}, computedAt={}", key, item.getComputedAt());
      return null;
    }
    stats.recordHit();
    logger.debug("Cache hit; key={}", key);
    return item;
  }

  private void startComputation(
      String key,
      CompiledPipeline pipeline,
      DataRequest request,
      CompletableFuture<CacheItem> own) {
    stats.recordComputation();
    final long startedAt = clock.millis();
    logger.debug("Fetch started; key={}", key);
    fetch(request)
        .whenComplete(
            (source, fetchError) -> {
              try {
                if (fetchError != null) {
                  throw new FetchException("row source failed", unwrap(fetchError))
                      .setContext(request.getSpec());
                }
                final var item = compute(key, pipeline, source, startedAt);
                if (key != null) {
                  cache.put(item);
                }
                settle(key, own);
                own.complete(item);
              } catch (ChartDataException e) {
                fail(key, own, e);
              } catch (RuntimeException e) {
                logger.error("Unexpected error in computation; key={}", key, e);
                fail(
                    key,
                    own,
                    new ChartDataException(PipelineError.GENERIC_PIPELINE_ERROR, e.toString(), e)
                        .setStage(PipelineStage.CACHE)
                        .setContext(request.getSpec()));
              }
            });
  }

  private CompletableFuture<SourceData> fetch(DataRequest request) {
    if (request.getRows() != null) {
      return CompletableFuture.completedFuture(SourceData.of(request.getRows()));
    }
    try {
      final var future = request.getRowSource().fetch();
      if (future == null) {
        return CompletableFuture.failedFuture(
            new IllegalStateException("row source returned no future"));
      }
      return future;
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private CacheItem compute(
      String key, CompiledPipeline pipeline, SourceData source, long startedAt)
      throws ChartDataException {
    final List<? extends Map<String, ?>> rows =
        source != null && source.getRows() != null ? source.getRows() : List.of();
    final var diagnostics = new Diagnostics();
    try {
      final var output = executor.execute(pipeline, rows, diagnostics);
      final long now = clock.millis();
      final Long sourceRefreshedAt = source != null ? source.getRefreshedAt() : null;
      logger.debug("Computed key={}; input={}, output={}", key, rows.size(), output.size());
      return new CacheItem(
          key,
          output,
          startedAt,
          now,
          sourceRefreshedAt != null ? sourceRefreshedAt : now,
          sourceRefreshedAt != null);
    } finally {
      diagnostics.flush(diagnosticsListener);
    }
  }

  private void settle(String key, CompletableFuture<CacheItem> own) {
    if (key != null) {
      // a bypassing request may have replaced the entry
      inFlight.remove(key, own);
    }
  }

  private void fail(String key, CompletableFuture<CacheItem> own, ChartDataException e) {
    stats.recordFailure();
    logger.debug("Computation failed; key={}, error={}", key, e.toString());
    settle(key, own);
    own.completeExceptionally(e);
  }

  private static Throwable unwrap(Throwable t) {
    if (t instanceof CompletionException && t.getCause() != null) {
      return t.getCause();
    }
    if (t instanceof ExecutionException && t.getCause() != null) {
      return t.getCause();
    }
    return t;
  }

  private static PipelineResult toResult(CacheItem item, boolean cacheHit) {
    return new PipelineResult(
        item.getRows(),
        new ResultMetadata(item.getRefreshedAt(), cacheHit, item.isSourceWasCached()));
  }
}
