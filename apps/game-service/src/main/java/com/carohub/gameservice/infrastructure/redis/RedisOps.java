package com.carohub.gameservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 公用 Redis 工具类：
 * - 封装 String/Hash/Set/ZSet/Key/脚本 的原语操作
 * - 业务键名与字段名放在 Repo 层组织
 * - 对象值走 JSON 模板；集合成员与分数走字符串模板，便于 Lua 脚本直接比较
 */
@Component
@RequiredArgsConstructor
public class RedisOps {
    /** 通用对象模板：用于 JSON 存储与反序列化 */
    private final RedisTemplate<String, Object> redis;
    /** 字符串模板：用于集合成员、计数器 */
    private final StringRedisTemplate strRedis;

    // -------------- String --------------

    public boolean set(String key, Object val) {
        redis.opsForValue().set(key, val);
        return true;
    }

    public boolean setEx(String key, Object val, Duration ttl) {
        redis.opsForValue().set(key, val, ttl);
        return true;
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String key, Class<T> type) {
        Object v = redis.opsForValue().get(key);
        return (v == null) ? null : (T) v;
    }

    /**
     * 自增（字符串模板，值为十进制整数）
     * @return 新值
     */
    public Long incrBy(String key, long delta) {
        return strRedis.opsForValue().increment(key, delta);
    }

    public boolean setString(String key, String val, Duration ttl) {
        strRedis.opsForValue().set(key, val, ttl);
        return true;
    }

    // -------------- Hash（JSON 值） --------------

    public boolean hSet(String key, String field, Object val) {
        redis.opsForHash().put(key, field, val);
        return true;
    }

    @SuppressWarnings("unchecked")
    public <T> T hGet(String key, String field, Class<T> type) {
        Object v = redis.opsForHash().get(key, field);
        return (v == null) ? null : (T) v;
    }

    public Map<String, Object> hGetAll(String key) {
        Map<Object, Object> raw = redis.opsForHash().entries(key);
        Map<String, Object> out = new HashMap<>();
        raw.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }

    public Long hDel(String key, String... fields) {
        return redis.opsForHash().delete(key, (Object[]) fields);
    }

    /**
     * 按 Hash 值的序列化方式转成 JSON 文本，供 Lua 脚本 HSET 写入后仍能被 {@link #hGet} 读回
     */
    @SuppressWarnings("unchecked")
    public String toHashJson(Object val) {
        byte[] bytes = ((RedisSerializer<Object>) redis.getHashValueSerializer()).serialize(val);
        return bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
    }

    // -------------- Hash（字符串计数） --------------

    public Long hIncrBy(String key, String field, long delta) {
        return strRedis.opsForHash().increment(key, field, delta);
    }

    /** 字段不存在才写入（HSETNX） */
    public boolean hSetIfAbsent(String key, String field, String val) {
        return Boolean.TRUE.equals(strRedis.opsForHash().putIfAbsent(key, field, val));
    }

    public Map<String, String> hGetAllStrings(String key) {
        Map<Object, Object> raw = strRedis.opsForHash().entries(key);
        Map<String, String> out = new HashMap<>();
        raw.forEach((k, v) -> out.put(String.valueOf(k), String.valueOf(v)));
        return out;
    }

    // -------------- Set --------------

    public Long sRem(String key, Object... members) {
        return strRedis.opsForSet().remove(key, members);
    }

    /** 集合基数（SCARD） */
    public long sCard(String key) {
        Long n = strRedis.opsForSet().size(key);
        return n == null ? 0 : n;
    }

    // -------------- Sorted Set --------------

    public Boolean zAdd(String key, String member, double score) {
        return strRedis.opsForZSet().add(key, member, score);
    }

    public Long zRem(String key, Object... members) {
        return strRedis.opsForZSet().remove(key, members);
    }

    /** 按分数倒序的排名（0 起），不存在返回 null */
    public Long zRevRank(String key, String member) {
        return strRedis.opsForZSet().reverseRank(key, member);
    }

    public long zCard(String key) {
        Long n = strRedis.opsForZSet().zCard(key);
        return n == null ? 0 : n;
    }

    /** 分数在 [min, max] 的成员数 */
    public long zCount(String key, double min, double max) {
        Long n = strRedis.opsForZSet().count(key, min, max);
        return n == null ? 0 : n;
    }

    /** 按分数倒序取 [start, end] 名次的成员（ZREVRANGE） */
    public List<String> zRevRange(String key, long start, long end) {
        Set<String> s = strRedis.opsForZSet().reverseRange(key, start, end);
        return s == null ? List.of() : List.copyOf(s);
    }

    /** 按名次删除（ZREMRANGEBYRANK） */
    public Long zRemRangeByRank(String key, long start, long end) {
        return strRedis.opsForZSet().removeRange(key, start, end);
    }

    /** 分数在 [min, max] 的成员（升序） */
    public Set<String> zRangeByScore(String key, double min, double max) {
        Set<String> s = strRedis.opsForZSet().rangeByScore(key, min, max);
        return s == null ? Collections.emptySet() : new LinkedHashSet<>(s);
    }

    // -------------- Key & TTL --------------

    public Boolean exists(String key) {
        Boolean has = redis.hasKey(key);
        return Boolean.TRUE.equals(has);
    }

    public Long del(String... keys) {
        return redis.delete(Arrays.asList(keys));
    }

    // -------------- Script --------------

    /**
     * 执行 Lua 脚本（原子操作），走字符串模板，参数与返回均按字符串/整数处理。
     *
     * @param script     Lua 文本内容
     * @param keys       KEYS[...] 参数列表
     * @param args       ARGV[...] 参数列表
     * @param resultType 返回类型（Long / Boolean / String / List）
     */
    public <T> T eval(String script, List<String> keys, List<String> args, Class<T> resultType) {
        DefaultRedisScript<T> rs = new DefaultRedisScript<>();
        rs.setResultType(resultType);
        rs.setScriptText(script);
        return strRedis.execute(rs, keys, args.toArray());
    }
}
