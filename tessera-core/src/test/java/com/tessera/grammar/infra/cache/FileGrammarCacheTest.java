/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.cache;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tessera.grammar.infra.serialization.GrammarJsonCodecs;
import com.tessera.grammar.infra.serialization.JsonSerializer;
import com.tessera.grammar.runtime.model.Grammar;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileGrammarCacheTest {

    @TempDir
    Path tempDir;

    private FileGrammarCache cache;

    @BeforeEach
    void setUp() {
        cache = new FileGrammarCache(tempDir.resolve("grammars"));
    }

    @Test
    @DisplayName("Should persist grammars across cache instances")
    void shouldPersistAcrossInstances() {
        Grammar grammar = TestGrammars.literalGrammar("json");
        cache.put("abc123", grammar);

        FileGrammarCache reopened = new FileGrammarCache(tempDir.resolve("grammars"));
        assertThat(reopened.get("abc123")).contains(grammar);
        assertThat(Files.exists(cache.fileFor("abc123"))).isTrue();
    }

    @Test
    @DisplayName("Should miss when nothing was stored")
    void shouldMissWhenAbsent() {
        assertThat(cache.get("nothing")).isEmpty();
        assertThat(cache.getMetrics().misses()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should discard a document that does not parse")
    void shouldDiscardMalformedDocument() throws IOException {
        Files.writeString(cache.fileFor("broken"), "{\"version\": 1, \"grammar\": ");

        assertThat(cache.get("broken")).isEmpty();
        assertThat(Files.exists(cache.fileFor("broken"))).isFalse();
        assertThat(cache.getMetrics().evictions()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should discard a document stored under another fingerprint")
    void shouldDiscardMismatchedFingerprint() throws IOException {
        Files.writeString(cache.fileFor("second"),
                JsonSerializer.toJson(GrammarJsonCodecs.writeCacheDocument("first", TestGrammars.literalGrammar("a")),
                        false));

        assertThat(cache.get("second")).isEmpty();
        assertThat(Files.exists(cache.fileFor("second"))).isFalse();
    }

    @Test
    @DisplayName("Should keep but ignore documents of another format version")
    void shouldIgnoreOtherFormatVersion() throws IOException {
        ObjectNode document = (ObjectNode) GrammarJsonCodecs.writeCacheDocument("old", TestGrammars.literalGrammar("a"));
        document.put("version", GrammarJsonCodecs.CACHE_FORMAT_VERSION + 1);
        Files.writeString(cache.fileFor("old"), JsonSerializer.toJson(document, false));

        assertThat(cache.get("old")).isEmpty();
        assertThat(Files.exists(cache.fileFor("old"))).isTrue();
    }

    @Test
    @DisplayName("Should remove files on invalidate and clear")
    void shouldRemoveFiles() {
        cache.put("one", TestGrammars.literalGrammar("1"));
        cache.put("two", TestGrammars.literalGrammar("2"));
        assertThat(cache.getMetrics().size()).isEqualTo(2);

        cache.invalidate("one");
        assertThat(cache.get("one")).isEmpty();

        cache.clear();
        assertThat(cache.getMetrics().size()).isZero();
    }

    @Test
    @DisplayName("Should reject fingerprints that are not safe file names")
    void shouldRejectUnsafeFingerprints() {
        assertThatThrownBy(() -> cache.get("../escape"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid grammar fingerprint");
    }
}
