package uz.greenwhite.servicegateway.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import uz.greenwhite.servicegateway.backend.DataStoreClient;
import uz.greenwhite.servicegateway.backend.MapsClient;
import uz.greenwhite.servicegateway.backend.WorkflowClient;
import uz.greenwhite.servicegateway.circuit.CircuitBreakerMetrics;
import uz.greenwhite.servicegateway.circuit.CircuitState;
import uz.greenwhite.servicegateway.config.BackendProperties;
import uz.greenwhite.servicegateway.config.BatchProperties;
import uz.greenwhite.servicegateway.config.CacheProperties;
import uz.greenwhite.servicegateway.error.ErrorCategory;
import uz.greenwhite.servicegateway.error.ErrorHandler;
import uz.greenwhite.servicegateway.gateway.ApiGateway;
import uz.greenwhite.servicegateway.gateway.GatewayError;
import uz.greenwhite.servicegateway.gateway.GatewayMeta;
import uz.greenwhite.servicegateway.gateway.GatewayRequest;
import uz.greenwhite.servicegateway.gateway.GatewayResponse;
import uz.greenwhite.servicegateway.metrics.GatewayMetrics;
import uz.greenwhite.servicegateway.notification.NoOpNotificationService;
import uz.greenwhite.servicegateway.orchestrator.dto.GeocodeRequest;
import uz.greenwhite.servicegateway.orchestrator.dto.SmsRequest;
import uz.greenwhite.servicegateway.orchestrator.dto.VoiceCallRequest;
import uz.greenwhite.servicegateway.orchestrator.dto.WorkflowTriggerRequest;
import uz.greenwhite.servicegateway.support.MutableClock;
import uz.greenwhite.servicegateway.support.TestFixtures;

import java.net.ConnectException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ServiceOrchestratorTest {

    private MutableClock clock;
    private ApiGateway gateway;
    private DataStoreClient dataStore;
    private MapsClient maps;
    private WorkflowClient workflows;
    private ErrorHandler errorHandler;
    private ValidatorFactory validatorFactory;
    private ThreadPoolTaskExecutor executor;
    private ServiceOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        gateway = mock(ApiGateway.class);
        dataStore = mock(DataStoreClient.class);
        maps = mock(MapsClient.class);
        workflows = mock(WorkflowClient.class);
        errorHandler = TestFixtures.errorHandler(clock, new NoOpNotificationService(),
                TestFixtures.breaker(2, Duration.ofHours(1).toMillis(), 2));
        validatorFactory = Validation.buildDefaultValidatorFactory();

        executor = executor(4);
        orchestrator = orchestrator(executor);
    }

    private static ThreadPoolTaskExecutor executor(int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("orchestrator-test-");
        executor.initialize();
        return executor;
    }

    private ServiceOrchestrator orchestrator(ThreadPoolTaskExecutor executor) {
        BackendProperties backends = new BackendProperties();
        backends.getVapi().setAssistantId("assistant-default");

        return new ServiceOrchestrator(gateway, dataStore, maps, workflows, errorHandler,
                new InMemoryFallbackCache(new CacheProperties(), clock),
                new GatewayMetrics(new SimpleMeterRegistry()),
                backends, new BatchProperties(), validatorFactory.getValidator(), executor,
                new ObjectMapper(), clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
        validatorFactory.close();
    }

    private static OrchestrationContext context() {
        return OrchestrationContext.builder()
                .correlationId("corr-" + System.nanoTime())
                .source("dashboard")
                .userId("user-1")
                .build();
    }

    private void openBreaker(String service) {
        errorHandler.getCircuitBreakers().circuitBreaker(service).recordFailure("down");
        errorHandler.getCircuitBreakers().circuitBreaker(service).recordFailure("down");
    }

    @Nested
    @DisplayName("fallback cache")
    class Fallback {

        @Test
        @DisplayName("open circuit serves a value cached less than five minutes ago")
        void servesFreshCache() {
            // given
            when(maps.geocode("Tashkent")).thenReturn(Map.of("lat", 41.3, "lng", 69.2));
            GeocodeRequest request = GeocodeRequest.builder().address("Tashkent").build();
            assertThat(orchestrator.geocodeAddress(request, context()).isSuccess()).isTrue();
            openBreaker("google-maps");
            clock.advance(Duration.ofMinutes(4));

            // when
            ServiceResponse<Object> response = orchestrator.geocodeAddress(request, context());

            // then
            assertThat(response.isSuccess()).isTrue();
            assertThat(response.getData()).isEqualTo(Map.of("lat", 41.3, "lng", 69.2));
            assertThat(response.getMetadata().getCached()).isTrue();
            verify(maps, times(1)).geocode("Tashkent");
            assertThat(orchestrator.getStats().cacheHits()).isEqualTo(1);
        }

        @Test
        @DisplayName("open circuit with a stale entry reports service unavailable")
        void staleCache() {
            // given
            when(maps.geocode("Samarkand")).thenReturn(Map.of("lat", 39.6));
            GeocodeRequest request = GeocodeRequest.builder().address("Samarkand").build();
            orchestrator.geocodeAddress(request, context());
            openBreaker("google-maps");
            clock.advance(Duration.ofMinutes(5).plusSeconds(1));

            // when
            ServiceResponse<Object> response = orchestrator.geocodeAddress(request, context());

            // then
            assertThat(response.isSuccess()).isFalse();
            assertThat(response.getError().getCode()).isEqualTo("SERVICE_UNAVAILABLE");
            assertThat(response.getError().getCategory()).isEqualTo(ErrorCategory.EXTERNAL_SERVICE_ERROR);
            assertThat(orchestrator.getStats().cacheMisses()).isEqualTo(1);
        }

        @Test
        @DisplayName("open circuit with nothing cached reports service unavailable without calling the backend")
        void noCache() {
            openBreaker("n8n");

            ServiceResponse<Object> response = orchestrator.triggerWorkflow(
                    WorkflowTriggerRequest.builder().event("lead_created").data(Map.of("id", 7)).build(), context());

            assertThat(response.getError().getCode()).isEqualTo("SERVICE_UNAVAILABLE");
            verifyNoInteractions(workflows);
        }

        @Test
        @DisplayName("a retryable failure on a closed circuit also falls back to the cache")
        void retryableFailureUsesCache() {
            when(workflows.trigger(eq("lead_created"), any(), anyString(), anyString()))
                    .thenReturn(Map.of("accepted", true))
                    .thenAnswer(inv -> {
                        throw new ConnectException("refused");
                    });
            WorkflowTriggerRequest request = WorkflowTriggerRequest.builder()
                    .event("lead_created").data(Map.of("id", 7)).build();
            orchestrator.triggerWorkflow(request, context());

            ServiceResponse<Object> response = orchestrator.triggerWorkflow(request, context());

            assertThat(response.isSuccess()).isTrue();
            assertThat(response.getData()).isEqualTo(Map.of("accepted", true));
            assertThat(response.getMetadata().getCached()).isTrue();
        }

        @Test
        @DisplayName("different parameters never share a cache entry")
        void keyIncludesParams() {
            OrchestrationContext ctx = context().withOperation("geocode");

            String a = orchestrator.cacheKey("google-maps", ctx, Map.of("address", "A"));
            String b = orchestrator.cacheKey("google-maps", ctx, Map.of("address", "B"));
            String again = orchestrator.cacheKey("google-maps",
                    ctx.toBuilder().correlationId("other").build(), Map.of("address", "A"));

            assertThat(a).isNotEqualTo(b).isEqualTo(again).startsWith("google-maps:geocode:");
        }
    }

    @Nested
    @DisplayName("routing")
    class Routing {

        @Test
        @DisplayName("voice calls go through the gateway as a trusted caller")
        void voiceCallViaGateway() {
            // given
            when(gateway.request(any())).thenReturn(
                    GatewayResponse.success(Map.of("id", "call-1"), GatewayMeta.builder().build(), Map.of()));
            VoiceCallRequest request = VoiceCallRequest.builder().phoneNumber("+998901234567").build();

            // when
            ServiceResponse<Object> response = orchestrator.startVoiceCall(request, context());

            // then
            assertThat(response.isSuccess()).isTrue();
            ArgumentCaptor<GatewayRequest> captor = ArgumentCaptor.forClass(GatewayRequest.class);
            verify(gateway).request(captor.capture());
            GatewayRequest sent = captor.getValue();
            assertThat(sent.getMethod()).isEqualTo("POST");
            assertThat(sent.getEndpoint()).isEqualTo(ServiceOrchestrator.VAPI_CALL_ENDPOINT);
            assertThat(sent.isSkipAuth()).isTrue();
            assertThat(sent.getHeaders()).containsEntry(ApiGateway.CLIENT_ID_HEADER, "orchestrator");
            @SuppressWarnings("unchecked")
            Map<String, Object> body = (Map<String, Object>) sent.getData();
            assertThat(body)
                    .containsEntry("phone_number", "+998901234567")
                    .containsEntry("assistant_id", "assistant-default");
        }

        @Test
        @DisplayName("a failed gateway envelope becomes a failed service response")
        void gatewayFailure() {
            GatewayError error = GatewayError.builder()
                    .code("HTTP_400")
                    .category(ErrorCategory.CLIENT_ERROR)
                    .message(ErrorCategory.CLIENT_ERROR.getUserMessage())
                    .retryable(false)
                    .httpStatus(400)
                    .build();
            when(gateway.request(any())).thenReturn(
                    GatewayResponse.failure(error, GatewayMeta.builder().build(), Map.of()));

            ServiceResponse<Object> response = orchestrator.getSmsStatus("SM123", context());

            assertThat(response.isSuccess()).isFalse();
            assertThat(response.getError().getCode()).isEqualTo("HTTP_400");
            assertThat(response.getError().isRetryable()).isFalse();
        }

        @Test
        @DisplayName("invalid DTOs fail validation before any backend is touched")
        void dtoValidation() {
            ServiceResponse<Object> response = orchestrator.sendSms(
                    SmsRequest.builder().to("not-a-phone").message("").priority("urgent").build(), context());

            assertThat(response.isSuccess()).isFalse();
            assertThat(response.getError().getCategory()).isEqualTo(ErrorCategory.VALIDATION_ERROR);
            assertThat(response.getError().isRetryable()).isFalse();
            verifyNoInteractions(gateway);
        }

        @Test
        @DisplayName("unknown services and operations are validation errors")
        void unknownTargets() {
            assertThat(orchestrator.executeOperation("fax", "send", Map.of(), context()).getError().getCategory())
                    .isEqualTo(ErrorCategory.VALIDATION_ERROR);
            assertThat(orchestrator.executeOperation("vapi", "hangUp", Map.of(), context()).getError().getCategory())
                    .isEqualTo(ErrorCategory.VALIDATION_ERROR);
            assertThat(errorHandler.getCircuitBreakers().find("vapi")).isEmpty();
        }

        @Test
        @DisplayName("a malformed resource id is rejected")
        void resourceIdFormat() {
            ServiceResponse<Object> response = orchestrator.getCallStatus("../secrets", context());

            assertThat(response.getError().getCategory()).isEqualTo(ErrorCategory.VALIDATION_ERROR);
            verifyNoInteractions(gateway);
        }

        @Test
        @DisplayName("data store operations are retried and report the attempts made")
        void internalRetry() {
            when(dataStore.fetch(eq("calls"), anyMap()))
                    .thenAnswer(inv -> {
                        throw new ConnectException("refused");
                    })
                    .thenReturn(List.of(Map.of("id", 1)));

            ServiceResponse<Object> response = orchestrator.fetchData("calls", Map.of("status", "done"), context());

            assertThat(response.isSuccess()).isTrue();
            assertThat(response.getData()).isEqualTo(List.of(Map.of("id", 1)));
            assertThat(response.getMetadata().getRetryAttempt()).isEqualTo(2);
            assertThat(response.getMetadata().getCached()).isNull();
        }

        @Test
        @DisplayName("data store validation failures are not retried")
        void internalNoRetry() {
            ServiceResponse<Object> response = orchestrator.updateData("calls", null, Map.of("a", 1), context());

            assertThat(response.getError().getCategory()).isEqualTo(ErrorCategory.VALIDATION_ERROR);
            verifyNoInteractions(dataStore);
        }
    }

    @Nested
    @DisplayName("batches")
    class Batches {

        @Test
        @DisplayName("never runs more than maxConcurrency operations at once and keeps input order")
        void boundedConcurrency() throws Exception {
            // given
            AtomicInteger inFlight = new AtomicInteger();
            AtomicInteger maxInFlight = new AtomicInteger();
            when(workflows.trigger(anyString(), any(), any(), any())).thenAnswer(inv -> {
                int now = inFlight.incrementAndGet();
                maxInFlight.accumulateAndGet(now, Math::max);
                Thread.sleep(50);
                inFlight.decrementAndGet();
                return Map.of("event", inv.getArgument(0));
            });
            List<BatchOperation> operations = List.of(
                    new BatchOperation("n8n", "e1", Map.of(), context()),
                    new BatchOperation("n8n", "e2", Map.of(), context()),
                    new BatchOperation("n8n", "e3", Map.of(), context()),
                    new BatchOperation("n8n", "e4", Map.of(), context()),
                    new BatchOperation("n8n", "e5", Map.of(), context()));

            // when
            List<ServiceResponse<Object>> results = orchestrator.executeBatchOperations(operations,
                    BatchOptions.builder().maxConcurrency(2).build());

            // then
            assertThat(maxInFlight.get()).isLessThanOrEqualTo(2);
            assertThat(results).hasSize(5).allMatch(ServiceResponse::isSuccess);
            assertThat(results).extracting(r -> (Object) ((Map<?, ?>) r.getData()).get("event"))
                    .containsExactly("e1", "e2", "e3", "e4", "e5");
        }

        @Test
        @DisplayName("failures are reported per operation without failFast")
        void partialFailure() throws Exception {
            when(workflows.trigger(anyString(), any(), any(), any())).thenReturn("ok");

            List<ServiceResponse<Object>> results = orchestrator.executeBatchOperations(List.of(
                    new BatchOperation("n8n", "e1", Map.of(), context()),
                    new BatchOperation("fax", "send", Map.of(), context()),
                    new BatchOperation("n8n", "e3", Map.of(), context())),
                    BatchOptions.builder().maxConcurrency(2).build());

            assertThat(results).extracting(ServiceResponse::isSuccess).containsExactly(true, false, true);
        }

        @Test
        @DisplayName("failFast stops scheduling later chunks after the first failure")
        void failFast() throws Exception {
            when(workflows.trigger(anyString(), any(), any(), any())).thenReturn("ok");
            List<BatchOperation> operations = List.of(
                    new BatchOperation("fax", "send", Map.of(), context()),
                    new BatchOperation("n8n", "e2", Map.of(), context()),
                    new BatchOperation("n8n", "e3", Map.of(), context()),
                    new BatchOperation("n8n", "e4", Map.of(), context()));

            BatchAbortedException aborted = assertThrows(BatchAbortedException.class,
                    () -> orchestrator.executeBatchOperations(operations,
                            BatchOptions.builder().maxConcurrency(2).failFast(true).build()));

            assertThat(aborted.getError().getCategory()).isEqualTo(ErrorCategory.VALIDATION_ERROR);
            assertThat(aborted.getCompleted()).hasSizeLessThanOrEqualTo(2);
            verify(workflows, never()).trigger(eq("e3"), any(), any(), any());
            verify(workflows, never()).trigger(eq("e4"), any(), any(), any());
        }

        @Test
        @DisplayName("operations over the timeout are cancelled and reported as TIMEOUT_ERROR")
        void timeout() throws Exception {
            when(workflows.trigger(eq("slow"), any(), any(), any())).thenAnswer(inv -> {
                Thread.sleep(5_000);
                return "late";
            });
            when(workflows.trigger(eq("fast"), any(), any(), any())).thenReturn("ok");

            List<ServiceResponse<Object>> results = orchestrator.executeBatchOperations(List.of(
                    new BatchOperation("n8n", "fast", Map.of(), context()),
                    new BatchOperation("n8n", "slow", Map.of(), context())),
                    BatchOptions.builder().maxConcurrency(2).timeout(Duration.ofMillis(200)).build());

            assertThat(results.get(0).isSuccess()).isTrue();
            assertThat(results.get(1).isSuccess()).isFalse();
            assertThat(results.get(1).getError().getCategory()).isEqualTo(ErrorCategory.TIMEOUT_ERROR);
        }

        @Test
        @DisplayName("time spent queued for a worker does not count against the operation timeout")
        void timeoutStartsWhenOperationRuns() throws Exception {
            // given: one worker thread for a chunk of four
            ThreadPoolTaskExecutor single = executor(1);
            try {
                ServiceOrchestrator queued = orchestrator(single);
                when(workflows.trigger(anyString(), any(), any(), any())).thenAnswer(inv -> {
                    Thread.sleep(150);
                    return "ok";
                });
                List<BatchOperation> operations = List.of(
                        new BatchOperation("n8n", "e1", Map.of(), context()),
                        new BatchOperation("n8n", "e2", Map.of(), context()),
                        new BatchOperation("n8n", "e3", Map.of(), context()),
                        new BatchOperation("n8n", "e4", Map.of(), context()));

                // when
                List<ServiceResponse<Object>> results = queued.executeBatchOperations(operations,
                        BatchOptions.builder().maxConcurrency(4).timeout(Duration.ofMillis(400)).build());

                // then
                assertThat(results).hasSize(4).allMatch(ServiceResponse::isSuccess);
                verify(workflows, times(4)).trigger(anyString(), any(), any(), any());
            } finally {
                single.shutdown();
            }
        }

        @Test
        @DisplayName("a timed-out operation reports TIMEOUT_ERROR and its cancellation is not a breaker failure")
        void cancellationIsNotABreakerFailure() throws Exception {
            // given
            when(workflows.trigger(eq("slow"), any(), any(), any())).thenAnswer(inv -> {
                Thread.sleep(5_000);
                return "late";
            });

            // when
            List<ServiceResponse<Object>> results = orchestrator.executeBatchOperations(List.of(
                    new BatchOperation("n8n", "slow", Map.of(), context())),
                    BatchOptions.builder().maxConcurrency(1).timeout(Duration.ofMillis(100)).build());
            executor.getThreadPoolExecutor().shutdown();
            assertThat(executor.getThreadPoolExecutor().awaitTermination(5, TimeUnit.SECONDS)).isTrue();

            // then
            assertThat(results.get(0).getError().getCategory()).isEqualTo(ErrorCategory.TIMEOUT_ERROR);
            assertThat(results.get(0).getMetadata().getDuration()).isEqualTo(100);
            CircuitBreakerMetrics n8n = errorHandler.getCircuitBreakers().circuitBreaker("n8n").getMetrics();
            assertThat(n8n.getFailureCount()).isZero();
            assertThat(n8n.getState()).isEqualTo(CircuitState.CLOSED);
        }
    }

    @Test
    @DisplayName("stats report cache usage and operation totals")
    void stats() {
        orchestrator.executeOperation("fax", "send", Map.of(), context());

        OrchestratorStats stats = orchestrator.getStats();

        assertThat(stats.totalOperations()).isEqualTo(1);
        assertThat(stats.hitRate()).isZero();
        assertThat(stats.services()).containsKeys("supabase", "vapi", "twilio", "google-maps", "n8n");
    }
}
