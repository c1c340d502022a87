package com.scholary.diarizer.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory job store backed by a Caffeine cache.
 *
 * <p>Each record expires a fixed time after it is created. Updates and reads do not extend that
 * window, so a job's record disappears on schedule whether it is still polled or not. Size is
 * bounded; the least recently used records are evicted first when full.
 */
@Repository
public class CaffeineJobRecordStore implements JobRecordStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaffeineJobRecordStore.class);

  private final Cache<String, JobRecord> cache;

  @Autowired
  public CaffeineJobRecordStore(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.retentionHours}") int retentionHours) {
    this(maxSize, Duration.ofHours(retentionHours), Ticker.systemTicker());
  }

  CaffeineJobRecordStore(int maxSize, Duration retention, Ticker ticker) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfter(new FixedRetention(retention))
            .ticker(ticker)
            .build();

    LOGGER.info("Initialized job store: maxSize={}, retention={}", maxSize, retention);
  }

  @Override
  public void create(JobRecord record) {
    JobRecord existing = cache.asMap().putIfAbsent(record.jobId(), record);
    if (existing != null) {
      throw new JobStoreException("Job already exists: " + record.jobId());
    }
    LOGGER.debug("Created job record: jobId={}", record.jobId());
  }

  @Override
  public Optional<JobRecord> find(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  @Override
  public JobRecord update(String jobId, JobUpdate update) {
    JobRecord updated =
        cache.asMap().computeIfPresent(jobId, (id, current) -> update.applyTo(current));
    if (updated == null) {
      throw new JobStoreException("Job not found or expired: " + jobId);
    }
    return updated;
  }

  @Override
  public boolean delete(String jobId) {
    return cache.asMap().remove(jobId) != null;
  }

  /** Expiry fixed at creation; later writes and reads keep the remaining time. */
  private static final class FixedRetention implements Expiry<String, JobRecord> {

    private final long retentionNanos;

    FixedRetention(Duration retention) {
      this.retentionNanos = retention.toNanos();
    }

    @Override
    public long expireAfterCreate(String key, JobRecord value, long currentTime) {
      return retentionNanos;
    }

    @Override
    public long expireAfterUpdate(
        String key, JobRecord value, long currentTime, long currentDuration) {
      return currentDuration;
    }

    @Override
    public long expireAfterRead(
        String key, JobRecord value, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
