package org.mark.capability.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

import org.mark.capability.exception.IntrospectionException;
import org.mark.capability.struct.ModelCapabilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 	按模型键缓存能力快照。
 * 	<p>
 * 	同一个键同时只有一个构建在执行，其他调用方等待同一个结果；不同的键互不影响。
 * 	过期在读取时判断，不使用后台线程；构建新快照前会顺带清理已经过期的条目。
 * 	构建失败或被中断时什么也不缓存，构建期间被清除的键也不会缓存这次的结果。
 */
public class CapabilityCache {
	
	private static final Logger logger = LoggerFactory.getLogger(CapabilityCache.class);
	
	public static final Duration DEFAULT_TTL = Duration.ofHours(1);
	
	public static final Duration DEFAULT_LOW_CONFIDENCE_TTL = Duration.ofSeconds(60);
	
	/**
	 * 	构建能力快照的过程，在调用方线程上执行。
	 */
	@FunctionalInterface
	public interface Loader {
		public ModelCapabilities load() throws InterruptedException, IntrospectionException;
	}
	
	private final Clock clock;
	
	private final Duration ttl;
	
	private final Duration lowConfidenceTtl;
	
	private final Map<String, Entry> entries = new ConcurrentHashMap<>();
	
	private final Map<String, Build> inFlight = new ConcurrentHashMap<>();
	
	
	public CapabilityCache(Clock clock) {
		this(clock, DEFAULT_TTL, DEFAULT_LOW_CONFIDENCE_TTL);
	}
	
	
	public CapabilityCache(Clock clock, Duration ttl, Duration lowConfidenceTtl) {
		this.clock = clock;
		this.ttl = ttl;
		this.lowConfidenceTtl = lowConfidenceTtl;
	}
	
	
	/**
	 * 	取缓存的快照，没有或已过期时用loader构建。
	 * @param key
	 * @param loader
	 * @return
	 * @throws InterruptedException 当前线程被中断
	 * @throws IntrospectionException 构建失败
	 */
	public ModelCapabilities get(String key, Loader loader) throws InterruptedException, IntrospectionException {
		Entry entry = this.entries.get(key);
		if (entry != null && !this.isStale(entry)) {
			logger.debug("命中缓存: {}", key);
			return entry.value;
		}
		
		Build mine = new Build();
		Build existing = this.inFlight.putIfAbsent(key, mine);
		if (existing != null) {
			logger.debug("等待正在进行的构建: {}", key);
			return await(existing.future);
		}
		try {
			// 拿到构建权之前，可能刚好有别的线程完成了构建
			entry = this.entries.get(key);
			if (entry != null && !this.isStale(entry)) {
				mine.future.complete(entry.value);
				return entry.value;
			}
			this.evictStale();
			ModelCapabilities value;
			try {
				value = loader.load();
			} catch (Throwable t) {
				mine.future.completeExceptionally(t);
				throw t;
			}
			synchronized (mine) {
				if (mine.invalidated) {
					logger.info("构建期间缓存已被清除，本次结果不缓存: {}", key);
				} else {
					this.entries.put(key, new Entry(value, this.clock.instant()));
					logger.info("已缓存模型能力: {}{}", key, value.isLowConfidence() ? " (低置信度)" : "");
				}
			}
			mine.future.complete(value);
			return value;
		} finally {
			this.inFlight.remove(key, mine);
		}
	}
	
	
	private static ModelCapabilities await(CompletableFuture<ModelCapabilities> future) throws InterruptedException, IntrospectionException {
		try {
			return future.get();
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof IntrospectionException) {
				throw (IntrospectionException) cause;
			}
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			if (cause instanceof Error) {
				throw (Error) cause;
			}
			if (cause instanceof InterruptedException) {
				throw new IntrospectionException("能力构建被取消", cause);
			}
			throw new IntrospectionException("能力构建失败", cause);
		}
	}
	
	
	public CacheState state(String key) {
		if (this.inFlight.containsKey(key)) {
			return CacheState.COMPUTING;
		}
		Entry entry = this.entries.get(key);
		if (entry == null) {
			return CacheState.ABSENT;
		}
		return this.isStale(entry) ? CacheState.STALE : CacheState.FRESH;
	}
	
	
	public void invalidate(String key) {
		Build build = this.inFlight.get(key);
		if (build != null) {
			build.invalidate();
		}
		if (this.entries.remove(key) != null) {
			logger.info("已清除缓存: {}", key);
		}
	}
	
	
	public void invalidateAll() {
		for (Build build : this.inFlight.values()) {
			build.invalidate();
		}
		this.entries.clear();
		logger.info("已清除全部能力缓存");
	}
	
	
	/**
	 * 	缓存的条目数，包括已过期但还没有清理的。
	 * @return
	 */
	public int size() {
		return this.entries.size();
	}
	
	
	private void evictStale() {
		this.entries.entrySet().removeIf(e -> {
			if (this.isStale(e.getValue())) {
				logger.debug("清理过期的缓存: {}", e.getKey());
				return true;
			}
			return false;
		});
	}
	
	
	private boolean isStale(Entry entry) {
		Duration window = entry.value.isLowConfidence() ? this.lowConfidenceTtl : this.ttl;
		return !this.clock.instant().isBefore(entry.storedAt.plus(window));
	}
	
	
	/**
	 * 	正在进行的构建。invalidated的读写都在自身的锁内，和写入缓存互斥。
	 */
	private static final class Build {
		private final CompletableFuture<ModelCapabilities> future = new CompletableFuture<>();
		private boolean invalidated;
		
		private synchronized void invalidate() {
			this.invalidated = true;
		}
	}
	
	
	private static final class Entry {
		private final ModelCapabilities value;
		private final Instant storedAt;
		
		private Entry(ModelCapabilities value, Instant storedAt) {
			this.value = value;
			this.storedAt = storedAt;
		}
	}
}
