package com.strata.platform.application.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.database.MigrationService;
import com.strata.observability.MetricFactory;
import com.strata.observability.SpanHelper;
import com.strata.platform.domain.DatasetSchema;
import com.strata.platform.domain.Tenant;
import com.strata.platform.domain.TenantType;
import com.strata.platform.error.ErrorKind;
import com.strata.platform.error.PlatformException;
import com.strata.platform.persistence.DatasetRowRepository;
import com.strata.platform.persistence.DatasetSchemaRepository;
import com.strata.platform.persistence.TenantRepository;
import com.strata.security.AccessDeniedException;
import com.strata.security.testing.TestPrincipalFactory;
import com.strata.tabular.TabularParseException;
import com.strata.tabular.TabularParser;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs the pipeline against an in-memory database migrated with the production scripts.
 */
@DisplayName("IngestionPipeline")
class IngestionPipelineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private static final String SIX_ROWS = "region,amount\nnorth,1\nsouth,2\neast,3\nwest,4\ncentre,5\nisles,6\n";

    private static final String SALES_SCHEMA = "sales_csv_20260301_100000";

    private JdbcTemplate jdbc;
    private DataSourceTransactionManager transactionManager;
    private TransactionTemplate transactionTemplate;
    private ObjectMapper objectMapper;
    private TenantRepository tenants;
    private DatasetSchemaRepository schemas;
    private SimpleMeterRegistry meterRegistry;
    private UUID tenantId;

    @BeforeEach
    void setUp() {
        var dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:ingest_" + UUID.randomUUID() + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1",
                "sa",
                "");
        new MigrationService(MigrationService.configure(dataSource, "classpath:db/migration")).migrate();

        jdbc = new JdbcTemplate(dataSource);
        transactionManager = new DataSourceTransactionManager(dataSource);
        transactionTemplate = new TransactionTemplate(transactionManager);
        objectMapper = new ObjectMapper();
        tenants = new TenantRepository(jdbc);
        schemas = new DatasetSchemaRepository(jdbc, objectMapper);
        meterRegistry = new SimpleMeterRegistry();

        tenantId = UUID.randomUUID();
        tenants.insert(new Tenant(tenantId, "Acme", TenantType.COMPANY, null, OffsetDateTime.now(CLOCK)));
    }

    private IngestionPipeline pipeline(DatasetRowRepository rows) {
        return pipeline(schemas, rows);
    }

    private IngestionPipeline pipeline(DatasetSchemaRepository schemaRepository, DatasetRowRepository rows) {
        return new IngestionPipeline(
                new TabularParser(),
                new SchemaRegistry(schemaRepository, transactionManager, CLOCK),
                rows,
                tenants,
                transactionTemplate,
                new MetricFactory(meterRegistry, "platform-service"),
                new SpanHelper(OpenTelemetry.noop().getTracer("ingest-test")),
                CLOCK);
    }

    private IngestionPipeline pipeline() {
        return pipeline(new DatasetRowRepository(jdbc, objectMapper));
    }

    private static UploadRequest csv(String fileName, String content, String target) {
        var builder = UploadRequest.builder().file(UploadRequest.FILE_FIELD, fileName, content.getBytes(StandardCharsets.UTF_8));
        if (target != null) {
            builder.field(UploadRequest.TARGET_FIELD, target);
        }
        return builder.build();
    }

    private long schemaCount() {
        return jdbc.queryForObject("SELECT COUNT(*) FROM dataset_schemas", Long.class);
    }

    private long storedRows() {
        return jdbc.queryForObject("SELECT COUNT(*) FROM dataset_rows", Long.class);
    }

    @Nested
    @DisplayName("committed uploads")
    class Committed {

        @Test
        @DisplayName("Root upload lands in the chosen tenant")
        void rootUpload() {
            var result = pipeline().ingest(
                    TestPrincipalFactory.root(), csv("sales.csv", "a,b\n1,2\n3,4\n5,6\n", tenantId.toString()));

            assertThat(result.message()).isEqualTo(IngestionResult.SUCCESS_MESSAGE);
            assertThat(result.rowsProcessed()).isEqualTo(3);
            assertThat(result.schemaName()).isEqualTo("sales_csv_20260301_100000");

            DatasetSchema schema = schemas.findByName(result.schemaName()).orElseThrow();
            assertThat(schema.tenantId()).isEqualTo(tenantId);
            assertThat(schema.columns()).containsExactly("a", "b");
            assertThat(schema.rowCount()).isEqualTo(3);
            assertThat(storedRows()).isEqualTo(3);
        }

        @Test
        @DisplayName("a non-Root override is ignored in favour of the caller's tenant")
        void overrideIgnored() {
            var result = pipeline().ingest(
                    TestPrincipalFactory.user(tenantId), csv("sales.csv", "a\n1\n", UUID.randomUUID().toString()));

            assertThat(schemas.findByName(result.schemaName()).orElseThrow().tenantId()).isEqualTo(tenantId);
        }

        @Test
        @DisplayName("a second upload with the same name merges its row count")
        void merge() {
            var pipeline = pipeline();
            var admin = TestPrincipalFactory.companyAdmin(tenantId);

            pipeline.ingest(admin, csv("sales.csv", "a\n1\n2\n", null));
            var second = pipeline.ingest(admin, csv("sales.csv", "a\n3\n4\n5\n", null));

            assertThat(schemas.findByName(second.schemaName()).orElseThrow().rowCount()).isEqualTo(5);
            assertThat(schemaCount()).isEqualTo(1);
            assertThat(storedRows()).isEqualTo(5);
        }

        @Test
        @DisplayName("records the committed outcome")
        void metrics() {
            pipeline().ingest(TestPrincipalFactory.user(tenantId), csv("sales.csv", "a\n1\n", null));

            assertThat(meterRegistry.get(IngestionPipeline.METRIC_UPLOADS).tag("outcome", "committed").counter().count())
                    .isEqualTo(1.0);
            assertThat(meterRegistry.get(IngestionPipeline.METRIC_DURATION).tag("format", "csv").timer().count())
                    .isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("rejected uploads")
    class Rejected {

        @Test
        @DisplayName("read-only users are forbidden before the file is looked at")
        void readOnly() {
            assertThatThrownBy(() -> pipeline().ingest(TestPrincipalFactory.readOnlyUser(tenantId), csv("a.csv", "a\n1\n", null)))
                    .isInstanceOf(AccessDeniedException.class);
            assertThat(storedRows()).isZero();
        }

        @Test
        @DisplayName("Root must name a destination")
        void rootWithoutTarget() {
            assertThatThrownBy(() -> pipeline().ingest(TestPrincipalFactory.root(), csv("a.csv", "a\n1\n", null)))
                    .isInstanceOf(AccessDeniedException.class)
                    .hasMessageContaining("destination");
        }

        @Test
        @DisplayName("Root destination must exist")
        void unknownTenant() {
            assertThatThrownBy(() -> pipeline().ingest(
                            TestPrincipalFactory.root(), csv("a.csv", "a\n1\n", UUID.randomUUID().toString())))
                    .isInstanceOf(PlatformException.class)
                    .hasMessageContaining("Unknown destination tenant");
        }

        @Test
        @DisplayName("malformed destination id")
        void invalidTarget() {
            assertThatThrownBy(() -> pipeline().ingest(TestPrincipalFactory.root(), csv("a.csv", "a\n1\n", "not-a-uuid")))
                    .isInstanceOf(PlatformException.class)
                    .satisfies(e -> assertThat(((PlatformException) e).kind()).isEqualTo(ErrorKind.BAD_REQUEST));
        }

        @Test
        @DisplayName("missing file part")
        void missingFile() {
            var request = UploadRequest.builder().field(UploadRequest.TARGET_FIELD, tenantId.toString()).build();

            assertThatThrownBy(() -> pipeline().ingest(TestPrincipalFactory.root(), request))
                    .isInstanceOf(PlatformException.class)
                    .hasMessage("Missing file");
        }

        @Test
        @DisplayName("header-only file is empty")
        void empty() {
            assertThatThrownBy(() -> pipeline().ingest(TestPrincipalFactory.user(tenantId), csv("a.csv", "a,b\n", null)))
                    .isInstanceOf(PlatformException.class)
                    .hasMessage("File is empty");
        }

        @Test
        @DisplayName("unsupported extension")
        void unsupported() {
            assertThatThrownBy(() -> pipeline().ingest(TestPrincipalFactory.user(tenantId), csv("notes.txt", "a\n1\n", null)))
                    .isInstanceOf(TabularParseException.class);

            assertThat(meterRegistry.get(IngestionPipeline.METRIC_UPLOADS).tag("outcome", "rejected").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("schema name held by another tenant is not merged")
        void foreignSchemaName() {
            UUID otherTenant = UUID.randomUUID();
            tenants.insert(new Tenant(otherTenant, "Globex", TenantType.COMPANY, null, OffsetDateTime.now(CLOCK)));
            var pipeline = pipeline();
            pipeline.ingest(TestPrincipalFactory.user(otherTenant), csv("sales.csv", "a\n1\n", null));

            assertThatThrownBy(() -> pipeline.ingest(TestPrincipalFactory.user(tenantId), csv("sales.csv", "a\n2\n", null)))
                    .isInstanceOf(PlatformException.class)
                    .hasMessageContaining("already in use");
            assertThat(storedRows()).isEqualTo(1);
        }

        @Test
        @DisplayName("a file name too long to become a schema name")
        void fileNameTooLong() {
            assertThatThrownBy(() -> pipeline().ingest(
                            TestPrincipalFactory.user(tenantId), csv("x".repeat(600) + ".csv", "a\n1\n", null)))
                    .isInstanceOf(PlatformException.class)
                    .hasMessageStartingWith("File name too long")
                    .satisfies(e -> assertThat(((PlatformException) e).kind()).isEqualTo(ErrorKind.BAD_REQUEST));

            assertThat(schemaCount()).isZero();
            assertThat(storedRows()).isZero();
        }

        @Test
        @DisplayName("a file name that fills the schema name column exactly is accepted")
        void fileNameAtLimit() {
            String fileName = "x".repeat(SchemaRegistry.MAX_NAME_LENGTH - 20) + ".csv";

            var result = pipeline().ingest(TestPrincipalFactory.user(tenantId), csv(fileName, "a\n1\n", null));

            assertThat(result.schemaName()).hasSize(SchemaRegistry.MAX_NAME_LENGTH);
            assertThat(schemas.findByName(result.schemaName())).isPresent();
        }
    }

    @Nested
    @DisplayName("concurrent uploads of the same name")
    class Concurrent {

        /**
         * Commits a same-name schema on its own connection just before the first insert, the
         * interleaving two simultaneous uploads produce.
         */
        private DatasetSchemaRepository createdConcurrentlyBy(UUID ownerTenant, long rowCount) {
            var competing = new TransactionTemplate(transactionManager);
            competing.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
            var raced = new AtomicBoolean();
            return new DatasetSchemaRepository(jdbc, objectMapper) {
                @Override
                public void insert(DatasetSchema schema) {
                    if (raced.compareAndSet(false, true)) {
                        competing.executeWithoutResult(status -> schemas.insert(new DatasetSchema(
                                UUID.randomUUID(),
                                ownerTenant,
                                schema.name(),
                                schema.columns(),
                                rowCount,
                                schema.createdAt(),
                                schema.updatedAt())));
                    }
                    super.insert(schema);
                }
            };
        }

        @Test
        @DisplayName("an insert lost to a committed upload merges into it")
        void lostInsertMerges() {
            var result = pipeline(createdConcurrentlyBy(tenantId, 3), new DatasetRowRepository(jdbc, objectMapper))
                    .ingest(TestPrincipalFactory.user(tenantId), csv("sales.csv", "a\n1\n2\n3\n", null));

            assertThat(result.rowsProcessed()).isEqualTo(3);
            assertThat(schemaCount()).isEqualTo(1);
            DatasetSchema schema = schemas.findByName(SALES_SCHEMA).orElseThrow();
            assertThat(schema.rowCount()).isEqualTo(6);
            assertThat(jdbc.queryForObject(
                            "SELECT COUNT(*) FROM dataset_rows WHERE schema_id = ?", Long.class, schema.id()))
                    .isEqualTo(3);
        }

        @Test
        @DisplayName("an insert lost to another tenant's upload is rejected, not merged")
        void lostInsertToOtherTenant() {
            UUID otherTenant = UUID.randomUUID();
            tenants.insert(new Tenant(otherTenant, "Globex", TenantType.COMPANY, null, OffsetDateTime.now(CLOCK)));

            assertThatThrownBy(() -> pipeline(createdConcurrentlyBy(otherTenant, 3), new DatasetRowRepository(jdbc, objectMapper))
                            .ingest(TestPrincipalFactory.user(tenantId), csv("sales.csv", "a\n1\n", null)))
                    .isInstanceOf(PlatformException.class)
                    .hasMessageContaining("already in use");

            assertThat(schemas.findByName(SALES_SCHEMA).orElseThrow().tenantId()).isEqualTo(otherTenant);
            assertThat(schemas.findByName(SALES_SCHEMA).orElseThrow().rowCount()).isEqualTo(3);
            assertThat(storedRows()).isZero();
        }

        @Test
        @DisplayName("an upload racing an uncommitted one waits for it and merges")
        void overlappingTransactions() throws Exception {
            var registered = new CountDownLatch(1);
            var first = CompletableFuture.runAsync(() -> transactionTemplate.executeWithoutResult(status -> {
                new SchemaRegistry(schemas, transactionManager, CLOCK)
                        .registerOrMerge(tenantId, SALES_SCHEMA, List.of("a"), 3);
                registered.countDown();
                try {
                    Thread.sleep(100);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            assertThat(registered.await(5, TimeUnit.SECONDS)).isTrue();

            var result = pipeline().ingest(TestPrincipalFactory.user(tenantId), csv("sales.csv", "a\n1\n2\n3\n", null));
            first.get(5, TimeUnit.SECONDS);

            assertThat(result.schemaName()).isEqualTo(SALES_SCHEMA);
            assertThat(schemaCount()).isEqualTo(1);
            assertThat(schemas.findByName(SALES_SCHEMA).orElseThrow().rowCount()).isEqualTo(6);
            assertThat(storedRows()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("atomicity")
    class Atomicity {

        private DatasetRowRepository failingOnFifthRow() {
            var inserted = new AtomicInteger();
            return new DatasetRowRepository(jdbc, objectMapper) {
                @Override
                public void insert(UUID schemaId, UUID rowTenantId, Map<String, String> row) {
                    if (inserted.incrementAndGet() == 5) {
                        throw new IllegalStateException("storage went away");
                    }
                    super.insert(schemaId, rowTenantId, row);
                }
            };
        }

        @Test
        @DisplayName("a failed row insert leaves neither schema nor rows behind")
        void newSchema() {
            assertThatThrownBy(() -> pipeline(failingOnFifthRow())
                            .ingest(TestPrincipalFactory.user(tenantId), csv("sales.csv", SIX_ROWS, null)))
                    .isInstanceOf(IllegalStateException.class);

            assertThat(storedRows()).isZero();
            assertThat(schemas.findByName("sales_csv_20260301_100000")).isEmpty();
        }

        @Test
        @DisplayName("a failed merge keeps the earlier row count")
        void mergedSchema() {
            var principal = TestPrincipalFactory.user(tenantId);
            pipeline().ingest(principal, csv("sales.csv", "region,amount\nnorth,1\nsouth,2\n", null));

            assertThatThrownBy(() -> pipeline(failingOnFifthRow()).ingest(principal, csv("sales.csv", SIX_ROWS, null)))
                    .isInstanceOf(IllegalStateException.class);

            assertThat(storedRows()).isEqualTo(2);
            assertThat(schemas.findByName("sales_csv_20260301_100000").orElseThrow().rowCount()).isEqualTo(2);
        }
    }
}
