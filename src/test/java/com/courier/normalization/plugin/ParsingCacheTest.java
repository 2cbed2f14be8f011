package com.courier.normalization.plugin;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ParsingCache Tests")
class ParsingCacheTest {

    @Test
    @DisplayName("Should return the identical object and compute once")
    void shouldComputeOnce() {
        ParsingCache cache = new ParsingCache();
        AtomicInteger calls = new AtomicInteger();
        Function<String, Map<String, String>> parser = msg -> {
            calls.incrementAndGet();
            return Map.of("k", msg);
        };

        Map<String, String> first = cache.getOrCompute("kv", "hello", parser);
        Map<String, String> second = cache.getOrCompute("kv", "hello", parser);

        assertThat(second).isSameAs(first);
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("Should cache a null result")
    void shouldCacheNull() {
        ParsingCache cache = new ParsingCache();
        AtomicInteger calls = new AtomicInteger();

        Object first = cache.getOrCompute("cef", "x", msg -> {
            calls.incrementAndGet();
            return null;
        });
        Object second = cache.getOrCompute("cef", "x", msg -> {
            calls.incrementAndGet();
            return "unexpected";
        });

        assertThat(first).isNull();
        assertThat(second).isNull();
        assertThat(calls).hasValue(1);
        assertThat(cache.contains("cef")).isTrue();
    }

    @Test
    @DisplayName("Should keep keys independent")
    void shouldKeepKeysIndependent() {
        ParsingCache cache = new ParsingCache();

        assertThat(cache.<String>getOrCompute("a", "m", msg -> "A")).isEqualTo("A");
        assertThat(cache.<String>getOrCompute("b", "m", msg -> "B")).isEqualTo("B");
        assertThat(cache.size()).isEqualTo(2);
    }
}
