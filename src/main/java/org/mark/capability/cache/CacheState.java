package org.mark.capability.cache;

/**
 * 	缓存中某个键的状态。
 */
public enum CacheState {
	/**
	 * 	没有缓存
	 */
	ABSENT,
	/**
	 * 	正在构建
	 */
	COMPUTING,
	FRESH,
	/**
	 * 	已过期，下次访问时重新构建
	 */
	STALE
}
