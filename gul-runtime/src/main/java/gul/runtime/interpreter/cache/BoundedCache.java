package gul.runtime.interpreter.cache;

import java.util.function.Function;

/**
 * 有界缓存
 *
 * <p>解释器用它缓存已解析的表达式，超过容量后由实现决定淘汰哪些条目。</p>
 */
public interface BoundedCache<K, V> {

    /**
     * @return 缓存值，不存在返回 null
     */
    V get(K key);

    void put(K key, V value);

    /**
     * 不存在时调用 loader 计算并缓存。loader 抛出的异常原样传播，且不缓存任何值。
     */
    V computeIfAbsent(K key, Function<? super K, ? extends V> loader);

    long size();

    void clear();

    CacheStats getStats();
}
