package com.strata.platform.application.ingest;

import com.strata.platform.domain.DatasetSchema;
import com.strata.platform.error.PlatformException;
import com.strata.platform.persistence.DatasetSchemaRepository;
import com.strata.security.TenantScope;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Per-tenant catalog of ingested datasets.
 *
 * <p>Schema names combine the sanitized file name with the upload time, so two uploads of the
 * same file within one second share a schema: the second one only adds to its row count. The
 * stored column list is never reconciled with later uploads.
 *
 * <p>{@link #registerOrMerge} must run inside the ingestion transaction. The count is
 * incremented first; a new schema is inserted under a savepoint, and an insert lost to a
 * concurrent upload of the same name falls back to the increment.
 */
@Component
public class SchemaRegistry {

    private static final Logger log = LoggerFactory.getLogger(SchemaRegistry.class);

    static final int RECENT_LIMIT = 10;

    /** Width of {@code dataset_schemas.name}. */
    public static final int MAX_NAME_LENGTH = 512;

    static final int MAX_MERGE_ATTEMPTS = 6;
    static final Duration MERGE_BACKOFF = Duration.ofMillis(25);

    private static final DateTimeFormatter NAME_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final DatasetSchemaRepository schemas;
    private final TransactionTemplate savepoint;
    private final Clock clock;

    public SchemaRegistry(DatasetSchemaRepository schemas, PlatformTransactionManager transactionManager, Clock clock) {
        this.schemas = schemas;
        this.savepoint = new TransactionTemplate(transactionManager);
        this.savepoint.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
        this.clock = clock;
    }

    /**
     * {@code sales.v2.csv} uploaded at 2026-03-01T10:00:00Z becomes
     * {@code sales_v2_csv_20260301_100000}.
     */
    public static String schemaName(String fileName, Instant uploadedAt) {
        return fileName.replace(".", "_") + "_" + NAME_TIMESTAMP.format(uploadedAt);
    }

    /**
     * Inserts the schema when {@code name} is new, otherwise adds {@code addedRows} to its count.
     * A name held by another tenant is rejected rather than merged.
     *
     * @return id of the inserted or merged schema
     */
    public UUID registerOrMerge(UUID tenantId, String name, List<String> headers, long addedRows) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        for (int attempt = 1; ; attempt++) {
            if (schemas.incrementRowCount(tenantId, name, addedRows, now) == 1) {
                return schemas.findByName(name).orElseThrow().id();
            }
            schemas.findByName(name).ifPresent(existing -> {
                throw PlatformException.badRequest("Schema name already in use: " + name);
            });

            UUID id = UUID.randomUUID();
            try {
                savepoint.executeWithoutResult(status ->
                        schemas.insert(new DatasetSchema(id, tenantId, name, headers, addedRows, now, now)));
                return id;
            } catch (DuplicateKeyException e) {
                if (attempt >= MAX_MERGE_ATTEMPTS) {
                    throw e;
                }
                log.debug("Schema {} was created concurrently, merging (attempt {})", name, attempt);
                backOff(attempt);
            }
        }
    }

    /**
     * The competing upload may not have committed yet when the conflict is reported.
     */
    private static void backOff(int attempt) {
        try {
            Thread.sleep(MERGE_BACKOFF.toMillis() << (attempt - 1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while merging schema", e);
        }
    }

    public List<DatasetSchema> list(TenantScope scope) {
        return schemas.findRecent(scope, RECENT_LIMIT);
    }

    public long aggregateRowCount(TenantScope scope) {
        return schemas.sumRowCount(scope);
    }

    public long countDistinctNames(TenantScope scope) {
        return schemas.countDistinctNames(scope);
    }
}
