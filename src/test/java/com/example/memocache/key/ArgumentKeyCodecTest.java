package com.example.memocache.key;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ArgumentKeyCodecTest {

    private enum Region { EU, US }

    private record Point(int x, int y) {
    }

    private record Tagged(String name, List<String> tags) {
    }

    private record Holder(Object payload) {
    }

    private final KeyCodec codec = new ArgumentKeyCodec();

    @Nested
    @DisplayName("determinism")
    class Determinism {

        @Test
        @DisplayName("equal arguments produce equal keys and fingerprints")
        void sameArgumentsSameKey() {
            UUID id = UUID.randomUUID();
            CacheKey first = codec.encode("user", 42, id, Region.EU, LocalDate.of(2024, 1, 1));
            CacheKey second = codec.encode("user", 42, id, Region.EU, LocalDate.of(2024, 1, 1));

            assertThat(first).isEqualTo(second);
            assertThat(first.hashCode()).isEqualTo(second.hashCode());
            assertThat(first.fingerprint()).isEqualTo(second.fingerprint());
        }

        @Test
        @DisplayName("arrays are compared by content")
        void arraysByContent() {
            assertThat(codec.encode((Object) new int[] {1, 2, 3}))
                .isEqualTo(codec.encode((Object) new int[] {1, 2, 3}));
            assertThat(codec.encode((Object) new String[] {"a", "b"}))
                .isEqualTo(codec.encode(List.of("a", "b")));
        }

        @Test
        @DisplayName("sets and maps ignore iteration order")
        void unorderedCollections() {
            Set<String> ab = new LinkedHashSet<>(List.of("a", "b"));
            Set<String> ba = new LinkedHashSet<>(List.of("b", "a"));
            Map<String, Integer> m1 = new LinkedHashMap<>();
            m1.put("x", 1);
            m1.put("y", 2);
            Map<String, Integer> m2 = new LinkedHashMap<>();
            m2.put("y", 2);
            m2.put("x", 1);

            assertThat(codec.encode(ab)).isEqualTo(codec.encode(ba));
            assertThat(codec.encode(m1)).isEqualTo(codec.encode(m2));
        }

        @Test
        @DisplayName("records are encoded by their components")
        void recordsByComponents() {
            assertThat(codec.encode(new Point(1, 2))).isEqualTo(codec.encode(new Point(1, 2)));
            assertThat(codec.encode(new Tagged("n", List.of("a")))).isEqualTo(codec.encode(new Tagged("n", List.of("a"))));
            assertThat(codec.encode(new Point(1, 2))).isNotEqualTo(codec.encode(List.of(1, 2)));
        }

        @Test
        @DisplayName("null arguments are allowed")
        void nullArguments() {
            assertThat(codec.encode("a", null)).isEqualTo(codec.encode("a", null));
            assertThat(codec.encode("a", null)).isNotEqualTo(codec.encode("a"));
        }

        @Test
        @DisplayName("the key does not change when the caller mutates its argument later")
        void defensiveCopy() {
            List<String> tags = new ArrayList<>(List.of("a"));
            CacheKey key = codec.encode(tags);
            tags.add("b");

            assertThat(key).isEqualTo(codec.encode(List.of("a")));
            assertThat(key.components()).containsExactly(List.of("a"));
        }
    }

    @Nested
    @DisplayName("distinctness")
    class Distinctness {

        @Test
        @DisplayName("argument order matters")
        void orderMatters() {
            assertThat(codec.encode("a", "b")).isNotEqualTo(codec.encode("b", "a"));
        }

        @Test
        @DisplayName("boxed types are not conflated")
        void typesMatter() {
            assertThat(codec.encode(1)).isNotEqualTo(codec.encode(1L));
            assertThat(codec.encode("1")).isNotEqualTo(codec.encode(1));
            assertThat(codec.encode(new BigDecimal("1.0"))).isNotEqualTo(codec.encode(1.0d));
        }

        @Test
        @DisplayName("nesting is preserved")
        void nestingMatters() {
            assertThat(codec.encode(List.of("a", "b"))).isNotEqualTo(codec.encode("a", "b"));
        }

        @Test
        @DisplayName("keys with colliding fingerprints are still different keys")
        void fingerprintCollisionIsNotEquality() {
            CacheKey a = new CacheKey(7L, List.of("a"));
            CacheKey b = new CacheKey(7L, List.of("b"));

            assertThat(a.hashCode()).isEqualTo(b.hashCode());
            assertThat(a).isNotEqualTo(b);
        }

        @Test
        @DisplayName("nested cache keys are accepted")
        void nestedKey() {
            CacheKey inner = codec.encode("inner", Duration.ofSeconds(1));

            assertThat(codec.encode("outer", inner)).isEqualTo(codec.encode("outer", codec.encode("inner", Duration.ofSeconds(1))));
        }
    }

    @Nested
    @DisplayName("unencodable arguments")
    class Unencodable {

        @Test
        @DisplayName("resource handles are rejected with their position")
        void rejectsStreams() {
            assertThatThrownBy(() -> codec.encode("ok", new ByteArrayInputStream(new byte[0])))
                .isInstanceOf(UnencodableArgumentException.class)
                .satisfies(e -> {
                    UnencodableArgumentException failure = (UnencodableArgumentException) e;
                    assertThat(failure.getPosition()).isEqualTo(1);
                    assertThat(failure.getArgumentType()).isEqualTo(ByteArrayInputStream.class);
                });
        }

        @Test
        @DisplayName("mutable numbers are rejected")
        void rejectsMutableNumbers() {
            assertThatThrownBy(() -> codec.encode(new AtomicLong(1)))
                .isInstanceOf(UnencodableArgumentException.class);
        }

        @Test
        @DisplayName("unencodable values nested in collections and records are rejected")
        void rejectsNested() {
            assertThatThrownBy(() -> codec.encode(Arrays.asList("a", new Object())))
                .isInstanceOf(UnencodableArgumentException.class);
            assertThatThrownBy(() -> codec.encode("a", new Holder(Thread.currentThread())))
                .isInstanceOf(UnencodableArgumentException.class)
                .hasMessageContaining("Argument 1");
        }
    }
}
