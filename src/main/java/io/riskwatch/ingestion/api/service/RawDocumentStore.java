package io.riskwatch.ingestion.api.service;

import io.riskwatch.ingestion.api.model.DedupResult;
import io.riskwatch.ingestion.api.model.DocumentStatus;
import io.riskwatch.ingestion.api.model.RawDocument;
import io.riskwatch.ingestion.api.repository.RawDocumentRepository;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Content-addressed landing zone. Identity is the hash of payload and source, so re-fetching the same
 * item is a no-op and concurrent first inserts resolve on the primary key.
 */
@Service
public class RawDocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(RawDocumentStore.class);

    public static final int MAX_RETRIES = 5;

    private final RawDocumentRepository repository;
    private final Clock clock;

    public RawDocumentStore(RawDocumentRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * hex(SHA-256(payload || utf8(source)))
     */
    public static String generateId(byte[] payload, String source) {
        MessageDigest digest = DigestUtils.getSha256Digest();
        digest.update(payload);
        digest.update(source.getBytes(StandardCharsets.UTF_8));
        return Hex.encodeHexString(digest.digest());
    }

    public DedupResult createWithDedup(String source, byte[] payload, Map<String, Object> meta) {
        String rawId = generateId(payload, source);

        Optional<RawDocument> existing = repository.findById(rawId);
        if (existing.isPresent()) {
            logger.debug("Duplicate document {} from {}", rawId, source);
            return new DedupResult(existing.get(), false);
        }

        Instant now = clock.instant();
        RawDocument document = new RawDocument(rawId, source, payload,
                meta == null ? Map.of() : new LinkedHashMap<>(meta),
                0, DocumentStatus.PENDING, now, now, now);
        try {
            repository.insert(document);
            return new DedupResult(document, true);

        } catch (DuplicateKeyException e) {
            // lost the race against a concurrent insert of the same content
            logger.debug("Concurrent insert of {} from {} resolved as duplicate", rawId, source);
            RawDocument winner = repository.findById(rawId)
                    .orElseThrow(() -> new IllegalStateException("Document " + rawId + " vanished after key conflict", e));
            return new DedupResult(winner, false);
        }
    }

    public Optional<RawDocument> findById(String rawId) {
        return repository.findById(rawId);
    }

    /**
     * {@code pending|error -> parsed}. Repeating the call is a no-op; {@code dlq} is never revived.
     *
     * @return true when the document is parsed after the call
     */
    public boolean markParsed(String rawId) {
        if (repository.markParsed(rawId, clock.instant()) > 0) {
            return true;
        }
        return repository.findById(rawId)
                .map(document -> document.status() == DocumentStatus.PARSED)
                .orElse(false);
    }

    /**
     * Counts a failed attempt. Below {@link #MAX_RETRIES} the document becomes {@code error}, at the limit {@code dlq}.
     *
     * @return the document after the update, empty if unknown
     */
    public Optional<RawDocument> markError(String rawId) {
        int updated = repository.markError(rawId, MAX_RETRIES, clock.instant());
        Optional<RawDocument> document = repository.findById(rawId);

        if (updated > 0 && document.isPresent() && document.get().status() == DocumentStatus.DLQ) {
            logger.error("Document {} from {} moved to DLQ after {} attempts",
                    rawId, document.get().source(), document.get().retries());
        }
        return document;
    }

    public List<RawDocument> getUnparsed(int limit) {
        return repository.findByStatus(DocumentStatus.PENDING, limit);
    }

    public List<RawDocument> getRetryable(int limit) {
        return repository.findByStatus(DocumentStatus.ERROR, limit);
    }

    /**
     * Deletes parsed documents fetched more than {@code days} ago. Failed and dead-lettered ones are kept.
     */
    public int vacuumOld(int days) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(days));
        int deleted = repository.deleteParsedFetchedBefore(cutoff);
        logger.info("Vacuumed {} parsed documents fetched before {}", deleted, cutoff);
        return deleted;
    }

    public StoreStats getStats() {
        Map<DocumentStatus, Long> counts = repository.countByStatus();
        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        return new StoreStats(total,
                counts.get(DocumentStatus.PENDING),
                counts.get(DocumentStatus.PARSED),
                counts.get(DocumentStatus.ERROR),
                counts.get(DocumentStatus.DLQ));
    }

    public record StoreStats(long total, long pending, long parsed, long errors, long dlq) {}
}
