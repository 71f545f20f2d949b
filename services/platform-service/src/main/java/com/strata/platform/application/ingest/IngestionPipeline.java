package com.strata.platform.application.ingest;

import com.strata.observability.MetricFactory;
import com.strata.observability.SpanHelper;
import com.strata.platform.error.PlatformException;
import com.strata.platform.persistence.DatasetRowRepository;
import com.strata.platform.persistence.TenantRepository;
import com.strata.security.AuthorizationPolicy;
import com.strata.security.Principal;
import com.strata.tabular.ParsedTable;
import com.strata.tabular.TabularFormat;
import com.strata.tabular.TabularParser;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Turns an uploaded file into a schema and its rows.
 *
 * <ol>
 *   <li>check that the principal may upload at all
 *   <li>require a file part
 *   <li>resolve the destination tenant (Root must choose one, everyone else gets their own)
 *   <li>derive the schema name and reject names too long to store
 *   <li>parse the file by extension and reject empty results
 *   <li>register or merge the schema and insert every row in one transaction
 * </ol>
 *
 * <p>The first failure ends the upload. Nothing is written unless every row is.
 */
@Service
public class IngestionPipeline {

    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    static final String METRIC_UPLOADS = "strata.ingest.uploads";
    static final String METRIC_ROWS = "strata.ingest.rows";
    static final String METRIC_DURATION = "strata.ingest.duration";

    private final TabularParser parser;
    private final SchemaRegistry schemaRegistry;
    private final DatasetRowRepository rows;
    private final TenantRepository tenants;
    private final TransactionTemplate transactionTemplate;
    private final MetricFactory metrics;
    private final SpanHelper spans;
    private final Clock clock;

    public IngestionPipeline(
            TabularParser parser,
            SchemaRegistry schemaRegistry,
            DatasetRowRepository rows,
            TenantRepository tenants,
            TransactionTemplate transactionTemplate,
            MetricFactory metrics,
            SpanHelper spans,
            Clock clock) {
        this.parser = parser;
        this.schemaRegistry = schemaRegistry;
        this.rows = rows;
        this.tenants = tenants;
        this.transactionTemplate = transactionTemplate;
        this.metrics = metrics;
        this.spans = spans;
        this.clock = clock;
    }

    public IngestionResult ingest(Principal principal, UploadRequest request) {
        String format = TabularFormat.fromFileName(request.fileName())
                .map(TabularFormat::extension)
                .orElse("unknown");
        long start = System.nanoTime();
        try {
            IngestionResult result = run(principal, request);
            record(format, "committed", start);
            metrics.distributionSummary(METRIC_ROWS, "Rows committed per upload", "format", format)
                    .record(result.rowsProcessed());
            return result;
        } catch (RuntimeException e) {
            record(format, "rejected", start);
            throw e;
        }
    }

    private IngestionResult run(Principal principal, UploadRequest request) {
        AuthorizationPolicy.enforce(AuthorizationPolicy.evaluateUploadEligibility(principal));

        if (!request.hasFile()) {
            throw PlatformException.badRequest("Missing file");
        }

        UUID tenantId = AuthorizationPolicy.enforce(
                        AuthorizationPolicy.evaluateUpload(principal, requestedTenant(principal, request)))
                .tenantId();
        if (principal.isRoot() && !tenants.exists(tenantId)) {
            throw PlatformException.badRequest("Unknown destination tenant: " + tenantId);
        }

        String schemaName = SchemaRegistry.schemaName(request.fileName(), clock.instant());
        if (schemaName.length() > SchemaRegistry.MAX_NAME_LENGTH) {
            throw PlatformException.badRequest(
                    "File name too long: schema names are limited to " + SchemaRegistry.MAX_NAME_LENGTH + " characters");
        }

        ParsedTable table = spans.inSpan(
                "ingest.parse",
                Map.of("file.name", request.fileName()),
                () -> parser.parse(request.fileName(), request.content()));
        if (table.isEmpty()) {
            throw PlatformException.badRequest("File is empty");
        }

        spans.inSpan(
                "ingest.commit",
                Map.of("schema.name", schemaName, "rows", String.valueOf(table.rowCount())),
                () -> commit(tenantId, schemaName, table));

        log.info("Ingested {} rows into schema {} for tenant {}", table.rowCount(), schemaName, tenantId);
        return new IngestionResult(IngestionResult.SUCCESS_MESSAGE, table.rowCount(), schemaName);
    }

    private UUID commit(UUID tenantId, String schemaName, ParsedTable table) {
        return transactionTemplate.execute(status -> {
            UUID schemaId = schemaRegistry.registerOrMerge(tenantId, schemaName, table.headers(), table.rowCount());
            for (Map<String, String> row : table.rows()) {
                rows.insert(schemaId, tenantId, row);
            }
            return schemaId;
        });
    }

    private void record(String format, String outcome, long startNanos) {
        metrics.counter(METRIC_UPLOADS, "Dataset uploads", "format", format, "outcome", outcome).increment();
        metrics.timer(METRIC_DURATION, "Upload handling time", "format", format, "outcome", outcome)
                .record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    /**
     * Only Root may pick the destination; anyone else's override is ignored.
     */
    private static UUID requestedTenant(Principal principal, UploadRequest request) {
        if (!principal.isRoot()) {
            return null;
        }
        Optional<String> target = request.target();
        if (target.isEmpty()) {
            return null;
        }
        try {
            return UUID.fromString(target.get().trim());
        } catch (IllegalArgumentException e) {
            throw PlatformException.badRequest("Invalid " + UploadRequest.TARGET_FIELD + ": " + target.get());
        }
    }
}
