/*
 * Copyright (c) 2025 Tessera Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.grammar.infra.cache;

import com.tessera.grammar.api.IGrammarCache;
import com.tessera.grammar.api.exceptions.MalformedPayloadException;
import com.tessera.grammar.infra.serialization.GrammarJsonCodecs;
import com.tessera.grammar.infra.serialization.GrammarJsonCodecs.CacheDocument;
import com.tessera.grammar.infra.serialization.JsonSerializer;
import com.tessera.grammar.runtime.model.Grammar;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Grammar cache persisting one JSON document per fingerprint under a directory.
 *
 * <p>Documents are written to a temporary file and moved into place, so readers never see
 * a half-written document. A document that cannot be read back is logged, deleted and
 * reported as a miss; a document written in another format version is a miss but is left
 * in place. Write failures are logged and otherwise ignored, as the cache is an
 * optimization only.
 */
public class FileGrammarCache implements IGrammarCache {
    private static final Logger logger = Logger.getLogger(FileGrammarCache.class.getName());

    private static final String SUFFIX = ".json";
    private static final Pattern FINGERPRINT = Pattern.compile("[A-Za-z0-9_-]{1,128}");

    private final Path directory;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();

    public FileGrammarCache(Path directory) {
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create grammar cache directory " + directory, e);
        }
        logger.info("FileGrammarCache initialized: directory=" + directory);
    }

    @Override
    public Optional<Grammar> get(String fingerprint) {
        Path file = fileFor(fingerprint);
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            misses.incrementAndGet();
            return Optional.empty();
        } catch (IOException e) {
            logger.log(Level.WARNING, "Cannot read cached grammar " + file, e);
            misses.incrementAndGet();
            return Optional.empty();
        }

        try {
            Optional<CacheDocument> document = GrammarJsonCodecs.readCacheDocument(JsonSerializer.parse(text));
            if (document.isEmpty()) {
                logger.fine("Cached grammar " + file + " has another format version, ignoring it");
                misses.incrementAndGet();
                return Optional.empty();
            }
            if (!fingerprint.equals(document.get().fingerprint())) {
                throw new MalformedPayloadException("$.fingerprint",
                        "document belongs to " + document.get().fingerprint());
            }
            hits.incrementAndGet();
            return Optional.of(document.get().grammar());
        } catch (MalformedPayloadException e) {
            logger.warning(String.format("Discarding unreadable cached grammar %s: %s", file, e.getMessage()));
            discard(file);
            misses.incrementAndGet();
            return Optional.empty();
        }
    }

    @Override
    public void put(String fingerprint, Grammar grammar) {
        Path target = fileFor(fingerprint);
        String json = JsonSerializer.toJson(GrammarJsonCodecs.writeCacheDocument(fingerprint, grammar), false);
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, fingerprint, ".tmp");
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Cannot write cached grammar " + target, e);
            if (temp != null) {
                discard(temp);
            }
        }
    }

    @Override
    public void invalidate(String fingerprint) {
        discard(fileFor(fingerprint));
    }

    @Override
    public void clear() {
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                discard(file);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list grammar cache directory " + directory, e);
        }
        logger.info("FileGrammarCache cleared: " + directory);
    }

    @Override
    public CacheMetrics getMetrics() {
        long size = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path ignored : files) {
                size++;
            }
        } catch (IOException e) {
            logger.log(Level.FINE, "Cannot list grammar cache directory " + directory, e);
        }
        return new CacheMetrics(size, hits.get(), misses.get(), discarded.get());
    }

    public Path getDirectory() {
        return directory;
    }

    Path fileFor(String fingerprint) {
        if (fingerprint == null || !FINGERPRINT.matcher(fingerprint).matches()) {
            throw new IllegalArgumentException("Invalid grammar fingerprint: " + fingerprint);
        }
        return directory.resolve(fingerprint + SUFFIX);
    }

    private void discard(Path file) {
        try {
            if (Files.deleteIfExists(file)) {
                discarded.incrementAndGet();
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Cannot delete " + file, e);
        }
    }
}
