package uz.greenwhite.servicegateway.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;
import uz.greenwhite.servicegateway.backend.DataStoreClient;
import uz.greenwhite.servicegateway.backend.MapsClient;
import uz.greenwhite.servicegateway.backend.WorkflowClient;
import uz.greenwhite.servicegateway.config.BackendProperties;
import uz.greenwhite.servicegateway.config.BatchProperties;
import uz.greenwhite.servicegateway.error.ErrorContext;
import uz.greenwhite.servicegateway.error.ErrorHandler;
import uz.greenwhite.servicegateway.error.GatewayCallException;
import uz.greenwhite.servicegateway.error.RequestValidationException;
import uz.greenwhite.servicegateway.error.ServiceUnavailableException;
import uz.greenwhite.servicegateway.error.StandardError;
import uz.greenwhite.servicegateway.error.StandardErrorException;
import uz.greenwhite.servicegateway.gateway.ApiGateway;
import uz.greenwhite.servicegateway.gateway.GatewayRequest;
import uz.greenwhite.servicegateway.gateway.GatewayResponse;
import uz.greenwhite.servicegateway.metrics.GatewayMetrics;
import uz.greenwhite.servicegateway.orchestrator.dto.DistanceMatrixRequest;
import uz.greenwhite.servicegateway.orchestrator.dto.GeocodeRequest;
import uz.greenwhite.servicegateway.orchestrator.dto.SmsRequest;
import uz.greenwhite.servicegateway.orchestrator.dto.VoiceCallRequest;
import uz.greenwhite.servicegateway.orchestrator.dto.WorkflowTriggerRequest;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicLongArray;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Routes typed operations to named backends.
 * <p>
 * Internal operations (the data store) are retried through
 * {@link ErrorHandler#executeWithErrorHandling}. External operations run behind the
 * service's circuit breaker; when the circuit is open, or the call fails with a
 * retryable error, the last successful result of the same logical call is served
 * from the {@link FallbackCache}. Every entry point returns a {@link ServiceResponse}.
 */
@Slf4j
@Service
public class ServiceOrchestrator {

    static final String VAPI_CALL_ENDPOINT = "/functions/v1/vapi-call";
    static final String SEND_SMS_ENDPOINT = "/functions/v1/send-sms";
    static final String SMS_STATUS_ENDPOINT = "/functions/v1/sms-status";
    static final String VAPI_CALL_ROUTE = VAPI_CALL_ENDPOINT + "/{callId}";
    static final String SMS_STATUS_ROUTE = SMS_STATUS_ENDPOINT + "/{messageId}";

    private static final long NOT_STARTED = Long.MIN_VALUE;
    private static final Pattern RESOURCE_ID = Pattern.compile("^[a-zA-Z0-9_-]+$");

    private final ApiGateway gateway;
    private final DataStoreClient dataStore;
    private final MapsClient maps;
    private final WorkflowClient workflows;
    private final ErrorHandler errorHandler;
    private final FallbackCache cache;
    private final GatewayMetrics metrics;
    private final BackendProperties backends;
    private final BatchProperties batchProperties;
    private final Validator validator;
    private final AsyncTaskExecutor executor;
    private final ObjectWriter keyWriter;
    private final Clock clock;

    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final AtomicLong totalOperations = new AtomicLong();

    public ServiceOrchestrator(ApiGateway gateway,
                               DataStoreClient dataStore,
                               MapsClient maps,
                               WorkflowClient workflows,
                               ErrorHandler errorHandler,
                               FallbackCache cache,
                               GatewayMetrics metrics,
                               BackendProperties backends,
                               BatchProperties batchProperties,
                               Validator validator,
                               @Qualifier("orchestratorExecutor") AsyncTaskExecutor executor,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.gateway = gateway;
        this.dataStore = dataStore;
        this.maps = maps;
        this.workflows = workflows;
        this.errorHandler = errorHandler;
        this.cache = cache;
        this.metrics = metrics;
        this.backends = backends;
        this.batchProperties = batchProperties;
        this.validator = validator;
        this.executor = executor;
        this.keyWriter = objectMapper.writer().with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        this.clock = clock;
    }

    // ==================== Typed entry points ====================

    public ServiceResponse<Object> startVoiceCall(VoiceCallRequest request, OrchestrationContext context) {
        return validated(request, ServiceName.VAPI, "makeCall", context, () -> {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("phoneNumber", request.getPhoneNumber());
            params.put("assistantId", request.getAssistantId());
            params.put("context", request.getContext());
            return params;
        });
    }

    public ServiceResponse<Object> getCallStatus(String callId, OrchestrationContext context) {
        return executeOperation(ServiceName.VAPI.getId(), "getCallStatus", mapOf("callId", callId), context);
    }

    public ServiceResponse<Object> sendSms(SmsRequest request, OrchestrationContext context) {
        return validated(request, ServiceName.TWILIO, "sendSms", context, () -> {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("to", request.getTo());
            params.put("message", request.getMessage());
            params.put("priority", request.getPriority() != null ? request.getPriority() : "normal");
            return params;
        });
    }

    public ServiceResponse<Object> getSmsStatus(String messageId, OrchestrationContext context) {
        return executeOperation(ServiceName.TWILIO.getId(), "getSmsStatus", mapOf("messageId", messageId), context);
    }

    public ServiceResponse<Object> geocodeAddress(GeocodeRequest request, OrchestrationContext context) {
        return validated(request, ServiceName.GOOGLE_MAPS, "geocode", context,
                () -> mapOf("address", request.getAddress()));
    }

    public ServiceResponse<Object> distanceMatrix(DistanceMatrixRequest request, OrchestrationContext context) {
        return validated(request, ServiceName.GOOGLE_MAPS, "distanceMatrix", context, () -> {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("origins", request.getOrigins());
            params.put("destinations", request.getDestinations());
            return params;
        });
    }

    public ServiceResponse<Object> triggerWorkflow(WorkflowTriggerRequest request, OrchestrationContext context) {
        return validated(request, ServiceName.N8N, request.getEvent(), context,
                () -> request.getData() != null ? new LinkedHashMap<>(request.getData()) : new LinkedHashMap<>());
    }

    public ServiceResponse<Object> fetchData(String table, Map<String, Object> filters, OrchestrationContext context) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("table", table);
        params.put("filters", filters != null ? filters : Map.of());
        return executeOperation(ServiceName.SUPABASE.getId(), "fetchData", params, context);
    }

    public ServiceResponse<Object> insertData(String table, Map<String, Object> data, OrchestrationContext context) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("table", table);
        params.put("data", data);
        return executeOperation(ServiceName.SUPABASE.getId(), "insertData", params, context);
    }

    public ServiceResponse<Object> updateData(String table, String id, Map<String, Object> data,
                                              OrchestrationContext context) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("table", table);
        params.put("id", id);
        params.put("data", data);
        return executeOperation(ServiceName.SUPABASE.getId(), "updateData", params, context);
    }

    public ServiceResponse<Object> deleteData(String table, String id, OrchestrationContext context) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("table", table);
        params.put("id", id);
        return executeOperation(ServiceName.SUPABASE.getId(), "deleteData", params, context);
    }

    // ==================== Routing ====================

    /**
     * Generic router. Unknown services and operations yield a VALIDATION_ERROR response.
     */
    public ServiceResponse<Object> executeOperation(String service, String operation,
                                                    Map<String, Object> params, OrchestrationContext context) {
        long start = clock.millis();
        totalOperations.incrementAndGet();
        OrchestrationContext ctx = orDefault(context, operation);
        ErrorContext errorContext = errorContext(service, ctx);
        Map<String, Object> safeParams = params != null ? params : Map.of();

        ServiceName target = ServiceName.fromId(service).orElse(null);
        if (target == null) {
            return failure(new RequestValidationException(List.of("unknown service: " + service)),
                    errorContext, ctx, service, start);
        }
        if (!target.supports(operation)) {
            return failure(new RequestValidationException(List.of("unknown " + service + " operation: " + operation)),
                    errorContext, ctx, service, start);
        }

        Callable<Object> call;
        try {
            call = prepare(target, operation, safeParams, ctx);
        } catch (RuntimeException e) {
            return failure(e, errorContext, ctx, service, start);
        }

        return target.isInternal()
                ? executeInternal(call, errorContext, ctx, service, start)
                : executeExternal(call, safeParams, errorContext, ctx, service, start);
    }

    private ServiceResponse<Object> executeInternal(Callable<Object> call, ErrorContext errorContext,
                                                    OrchestrationContext ctx, String service, long start) {
        AtomicInteger attempts = new AtomicInteger();
        try {
            Object data = errorHandler.executeWithErrorHandling(() -> {
                attempts.incrementAndGet();
                return call.call();
            }, errorContext);

            ServiceResponseMetadata metadata = metadata(ctx, service, start, null,
                    attempts.get() > 1 ? attempts.get() : null);
            metrics.recordServiceCall(service, Duration.ofMillis(metadata.getDuration()), true);
            return ServiceResponse.success(data, metadata);

        } catch (StandardErrorException e) {
            ServiceResponseMetadata metadata = metadata(ctx, service, start, null,
                    attempts.get() > 1 ? attempts.get() : null);
            metrics.recordServiceCall(service, Duration.ofMillis(metadata.getDuration()), false);
            return ServiceResponse.failure(ServiceError.from(e.getError()), metadata);
        }
    }

    private ServiceResponse<Object> executeExternal(Callable<Object> call, Map<String, Object> params,
                                                    ErrorContext errorContext, OrchestrationContext ctx,
                                                    String service, long start) {
        String cacheKey = cacheKey(service, ctx, params);
        AtomicBoolean fromCache = new AtomicBoolean();

        try {
            Object data = errorHandler.executeWithCircuitBreaker(call, errorContext, service, () -> {
                fromCache.set(true);
                return cachedOrUnavailable(service, cacheKey, errorContext);
            });
            if (!fromCache.get()) {
                cache.put(cacheKey, data);
            }
            return success(data, ctx, service, start, fromCache.get());

        } catch (StandardErrorException e) {
            StandardError error = e.getError();
            if (!fromCache.get() && error.isRetryable() && !Thread.currentThread().isInterrupted()) {
                log.info("Service [{}] call failed with {}, trying fallback cache: correlationId={}",
                        service, error.getCode(), ctx.getCorrelationId());
                try {
                    return success(cachedOrUnavailable(service, cacheKey, errorContext), ctx, service, start, true);
                } catch (StandardErrorException miss) {
                    error = miss.getError();
                }
            }
            ServiceResponseMetadata metadata = metadata(ctx, service, start, null, null);
            metrics.recordServiceCall(service, Duration.ofMillis(metadata.getDuration()), false);
            return ServiceResponse.failure(ServiceError.from(error), metadata);
        }
    }

    private Object cachedOrUnavailable(String service, String cacheKey, ErrorContext errorContext) {
        return cache.get(cacheKey)
                .map(value -> {
                    cacheHits.incrementAndGet();
                    metrics.getFallbackHit().increment();
                    log.info("Serving [{}] from fallback cache", service);
                    return value;
                })
                .orElseThrow(() -> {
                    cacheMisses.incrementAndGet();
                    metrics.getFallbackMiss().increment();
                    StandardError error = errorHandler.handleError(new ServiceUnavailableException(service,
                            "Service " + service + " unavailable, no cached data"), errorContext);
                    return new StandardErrorException(error);
                });
    }

    /**
     * Parses parameters up front, so malformed input fails before any breaker is involved.
     */
    private Callable<Object> prepare(ServiceName service, String operation, Map<String, Object> params,
                                     OrchestrationContext ctx) {
        return switch (service) {
            case SUPABASE -> prepareDataStore(operation, params);
            case VAPI -> prepareVoice(operation, params, ctx);
            case TWILIO -> prepareSms(operation, params, ctx);
            case GOOGLE_MAPS -> prepareMaps(operation, params);
            case N8N -> () -> workflows.trigger(operation, params, ctx.getCorrelationId(), ctx.getSource());
        };
    }

    @SuppressWarnings("unchecked")
    private Callable<Object> prepareDataStore(String operation, Map<String, Object> params) {
        String table = requireString(params, "table");
        return switch (operation) {
            case "fetchData" -> {
                Map<String, Object> filters = params.get("filters") instanceof Map<?, ?> f
                        ? (Map<String, Object>) f : Map.of();
                yield () -> dataStore.fetch(table, filters);
            }
            case "insertData" -> {
                Map<String, Object> data = requireMap(params, "data");
                yield () -> dataStore.insert(table, data);
            }
            case "updateData" -> {
                String id = requireString(params, "id");
                Map<String, Object> data = requireMap(params, "data");
                yield () -> dataStore.update(table, id, data);
            }
            case "deleteData" -> {
                String id = requireString(params, "id");
                yield () -> {
                    dataStore.delete(table, id);
                    return Boolean.TRUE;
                };
            }
            default -> throw new RequestValidationException(List.of("unknown supabase operation: " + operation));
        };
    }

    private Callable<Object> prepareVoice(String operation, Map<String, Object> params, OrchestrationContext ctx) {
        if ("makeCall".equals(operation)) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("phone_number", requireString(params, "phoneNumber"));
            Object assistantId = params.get("assistantId") != null
                    ? params.get("assistantId") : backends.getVapi().getAssistantId();
            body.put("assistant_id", assistantId);
            body.put("context", params.get("context"));
            return () -> viaGateway("POST", VAPI_CALL_ENDPOINT, null, body, ctx);
        }
        String callId = requireResourceId(params, "callId");
        return () -> viaGateway("GET", VAPI_CALL_ENDPOINT + "/" + callId, VAPI_CALL_ROUTE, null, ctx);
    }

    private Callable<Object> prepareSms(String operation, Map<String, Object> params, OrchestrationContext ctx) {
        if ("sendSms".equals(operation)) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("to", requireString(params, "to"));
            body.put("message", requireString(params, "message"));
            body.put("priority", params.getOrDefault("priority", "normal"));
            return () -> viaGateway("POST", SEND_SMS_ENDPOINT, null, body, ctx);
        }
        String messageId = requireResourceId(params, "messageId");
        return () -> viaGateway("GET", SMS_STATUS_ENDPOINT + "/" + messageId, SMS_STATUS_ROUTE, null, ctx);
    }

    private Callable<Object> prepareMaps(String operation, Map<String, Object> params) {
        if ("geocode".equals(operation)) {
            String address = requireString(params, "address");
            return () -> maps.geocode(address);
        }
        List<String> origins = requireStringList(params, "origins");
        List<String> destinations = requireStringList(params, "destinations");
        return () -> maps.distanceMatrix(origins, destinations);
    }

    /**
     * Server-side call through the gateway pipeline. The orchestrator is a trusted
     * caller, so the CSRF stage is skipped; rate limiting applies per client id.
     * Endpoints carrying an id pass their template as {@code route} so that they share one breaker.
     */
    private Object viaGateway(String method, String endpoint, String route, Object body, OrchestrationContext ctx) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(ApiGateway.CLIENT_ID_HEADER, ctx.getClientId() != null ? ctx.getClientId() : "orchestrator");
        if (ctx.getCorrelationId() != null) {
            headers.put("X-Correlation-ID", ctx.getCorrelationId());
        }

        GatewayRequest.GatewayRequestBuilder request = GatewayRequest.builder()
                .method(method)
                .endpoint(endpoint)
                .route(route)
                .data(body)
                .headers(headers)
                .skipAuth(true);
        if (ctx.getTimeout() != null) {
            request.timeoutMs(ctx.getTimeout().toMillis());
        }

        GatewayResponse<Object> response = gateway.request(request.build());
        if (!response.isSuccess()) {
            throw response.getError().toException();
        }
        return response.getData();
    }

    // ==================== Batch ====================

    public List<ServiceResponse<Object>> executeBatchOperations(List<BatchOperation> operations) {
        return executeBatchOperations(operations, BatchOptions.builder()
                .maxConcurrency(batchProperties.getMaxConcurrency())
                .timeout(Duration.ofMillis(batchProperties.getTimeoutMs()))
                .build());
    }

    /**
     * Runs operations in chunks of {@code maxConcurrency}; a chunk finishes before the
     * next starts. Each operation gets {@code timeout}, counted from the moment a worker
     * starts it, after which it is reported as TIMEOUT_ERROR and cancelled.
     *
     * @return one response per operation, in input order
     * @throws BatchAbortedException with fail-fast, on the first failed or timed-out operation
     */
    public List<ServiceResponse<Object>> executeBatchOperations(List<BatchOperation> operations, BatchOptions options) {
        int chunkSize = Math.max(1, options.getMaxConcurrency());
        List<ServiceResponse<Object>> results = new ArrayList<>(operations.size());

        log.info("Executing batch: operations={}, maxConcurrency={}, failFast={}",
                operations.size(), chunkSize, options.isFailFast());

        for (int from = 0; from < operations.size(); from += chunkSize) {
            List<BatchOperation> chunk = operations.subList(from, Math.min(from + chunkSize, operations.size()));
            ChunkOutcome outcome = runChunk(chunk, options);

            for (ServiceResponse<Object> response : outcome.responses()) {
                if (response != null) {
                    results.add(response);
                }
            }
            if (outcome.abortError() != null) {
                metrics.recordBatch(results.size(), true);
                log.warn("Batch aborted by fail-fast after {} of {} operations: {}",
                        results.size(), operations.size(), outcome.abortError().getCode());
                throw new BatchAbortedException(outcome.abortError(), results);
            }
        }

        metrics.recordBatch(results.size(), false);
        return results;
    }

    private ChunkOutcome runChunk(List<BatchOperation> chunk, BatchOptions options) {
        ExecutorCompletionService<Integer> completion = new ExecutorCompletionService<>(executor);
        AtomicReferenceArray<ServiceResponse<Object>> responses = new AtomicReferenceArray<>(chunk.size());
        // the timeout of an operation runs from the moment a worker picks it up, not from submission
        AtomicLongArray startedAt = new AtomicLongArray(chunk.size());
        List<Future<Integer>> futures = new ArrayList<>(chunk.size());

        for (int i = 0; i < chunk.size(); i++) {
            int index = i;
            BatchOperation op = chunk.get(i);
            startedAt.set(index, NOT_STARTED);
            futures.add(completion.submit(() -> {
                startedAt.set(index, System.nanoTime());
                responses.compareAndSet(index, null,
                        executeOperation(op.service(), op.operation(), op.params(), contextOf(op)));
                return index;
            }));
        }

        long timeout = options.getTimeout().toNanos();
        boolean[] settled = new boolean[chunk.size()];
        int pending = chunk.size();

        try {
            while (pending > 0) {
                long now = System.nanoTime();
                // an operation that has not started yet cannot expire before now + timeout
                long nextDeadline = now + timeout;

                for (int i = 0; i < chunk.size(); i++) {
                    long started = startedAt.get(i);
                    if (settled[i] || started == NOT_STARTED) {
                        continue;
                    }
                    long deadline = started + timeout;
                    if (deadline - now > 0) {
                        nextDeadline = Math.min(nextDeadline, deadline);
                        continue;
                    }
                    ServiceResponse<Object> timedOut = timedOut(chunk.get(i), options);
                    if (!responses.compareAndSet(i, null, timedOut)) {
                        // finished right at the deadline, the completion queue has it
                        continue;
                    }
                    futures.get(i).cancel(true);
                    settled[i] = true;
                    pending--;
                    if (options.isFailFast()) {
                        cancelAll(futures);
                        return new ChunkOutcome(toList(responses), abortError(timedOut, chunk.get(i)));
                    }
                }
                if (pending == 0) {
                    break;
                }

                Future<Integer> done = completion.poll(Math.max(0, nextDeadline - now), TimeUnit.NANOSECONDS);
                if (done == null || done.isCancelled()) {
                    continue;
                }
                int index = done.get();
                if (settled[index]) {
                    continue;
                }
                settled[index] = true;
                pending--;
                ServiceResponse<Object> response = responses.get(index);
                if (options.isFailFast() && !response.isSuccess()) {
                    cancelAll(futures);
                    return new ChunkOutcome(toList(responses), abortError(response, chunk.get(index)));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(futures);
            return new ChunkOutcome(toList(responses),
                    errorHandler.handleError(e, ErrorContext.of("orchestrator", "batch", null)));
        } catch (ExecutionException e) {
            cancelAll(futures);
            return new ChunkOutcome(toList(responses),
                    errorHandler.handleError(e, ErrorContext.of("orchestrator", "batch", null)));
        }

        return new ChunkOutcome(toList(responses), null);
    }

    private ServiceResponse<Object> timedOut(BatchOperation op, BatchOptions options) {
        OrchestrationContext ctx = contextOf(op).withOperation(op.operation());
        StandardError error = errorHandler.handleError(
                new TimeoutException("Operation " + op.service() + ":" + op.operation()
                        + " timed out after " + options.getTimeout().toMillis() + "ms"),
                errorContext(op.service(), ctx));
        return ServiceResponse.failure(ServiceError.from(error),
                ServiceResponseMetadata.builder()
                        .correlationId(ctx.getCorrelationId())
                        .duration(options.getTimeout().toMillis())
                        .service(op.service())
                        .build());
    }

    private static List<ServiceResponse<Object>> toList(AtomicReferenceArray<ServiceResponse<Object>> responses) {
        List<ServiceResponse<Object>> list = new ArrayList<>(responses.length());
        for (int i = 0; i < responses.length(); i++) {
            list.add(responses.get(i));
        }
        return list;
    }

    private StandardError abortError(ServiceResponse<Object> failed, BatchOperation op) {
        ServiceError error = failed.getError();
        return errorHandler.standardize(
                new GatewayCallException(error.getCategory(), error.getCode(),
                        error.getMessage(), error.isRetryable(), null, Map.of("service", op.service(),
                        "operation", op.operation())),
                ErrorContext.of(op.service(), op.operation(), failed.getMetadata().getCorrelationId()));
    }

    private static void cancelAll(List<Future<Integer>> futures) {
        futures.forEach(f -> f.cancel(true));
    }

    private static OrchestrationContext orDefault(OrchestrationContext context, String operation) {
        return context != null ? context.withOperation(operation) : OrchestrationContext.create("orchestrator", operation);
    }

    private static OrchestrationContext contextOf(BatchOperation op) {
        return op.context() != null ? op.context() : OrchestrationContext.create("batch", op.operation());
    }

    // ==================== Stats ====================

    public OrchestratorStats getStats() {
        long hits = cacheHits.get();
        long misses = cacheMisses.get();
        long lookups = hits + misses;

        Map<String, Boolean> services = new LinkedHashMap<>();
        services.put(ServiceName.SUPABASE.getId(), backends.getSupabase().isEnabled());
        services.put(ServiceName.VAPI.getId(), backends.getVapi().isEnabled());
        services.put(ServiceName.TWILIO.getId(), backends.getTwilio().isEnabled());
        services.put(ServiceName.GOOGLE_MAPS.getId(), backends.getGoogleMaps().isEnabled()
                && backends.getGoogleMaps().hasApiKey());
        services.put(ServiceName.N8N.getId(), backends.getN8n().isEnabled()
                && backends.getN8n().getWebhookBaseUrl() != null);

        return new OrchestratorStats(services, cache.size(), hits, misses,
                lookups > 0 ? (double) hits / lookups : 0.0, totalOperations.get());
    }

    // ==================== Helpers ====================

    private <T> ServiceResponse<Object> validated(T request, ServiceName service, String operation,
                                                  OrchestrationContext context,
                                                  Supplier<Map<String, Object>> params) {
        Set<ConstraintViolation<T>> violations = request != null ? validator.validate(request) : Set.of();
        if (request == null || !violations.isEmpty()) {
            long start = clock.millis();
            totalOperations.incrementAndGet();
            OrchestrationContext ctx = orDefault(context, operation);
            RuntimeException error = request == null
                    ? new RequestValidationException(List.of("request is required"))
                    : new ConstraintViolationException(violations);
            return failure(error, errorContext(service.getId(), ctx), ctx, service.getId(), start);
        }
        return executeOperation(service.getId(), operation, params.get(), context);
    }

    private ServiceResponse<Object> failure(Exception error, ErrorContext errorContext,
                                            OrchestrationContext ctx, String service, long start) {
        StandardError standard = errorHandler.handleError(error, errorContext);
        return ServiceResponse.failure(ServiceError.from(standard), metadata(ctx, service, start, null, null));
    }

    private ServiceResponse<Object> success(Object data, OrchestrationContext ctx, String service,
                                            long start, boolean cached) {
        ServiceResponseMetadata metadata = metadata(ctx, service, start, cached ? Boolean.TRUE : null, null);
        metrics.recordServiceCall(service, Duration.ofMillis(metadata.getDuration()), true);
        return ServiceResponse.success(data, metadata);
    }

    private ServiceResponseMetadata metadata(OrchestrationContext ctx, String service, long start,
                                             Boolean cached, Integer retryAttempt) {
        return ServiceResponseMetadata.builder()
                .correlationId(ctx.getCorrelationId())
                .duration(clock.millis() - start)
                .service(service)
                .cached(cached)
                .retryAttempt(retryAttempt)
                .build();
    }

    private static ErrorContext errorContext(String service, OrchestrationContext ctx) {
        return ErrorContext.builder()
                .source(service)
                .operation(ctx.getOperation())
                .correlationId(ctx.getCorrelationId())
                .userId(ctx.getUserId())
                .build();
    }

    /**
     * {@code service:operation:} + JSON of the context without its correlation id, plus the parameters.
     * Repeated logical calls share a key.
     */
    String cacheKey(String service, OrchestrationContext ctx, Map<String, Object> params) {
        Map<String, Object> keyContext = new LinkedHashMap<>();
        keyContext.put("source", ctx.getSource());
        keyContext.put("operation", ctx.getOperation());
        keyContext.put("userId", ctx.getUserId());
        keyContext.put("clientId", ctx.getClientId());
        keyContext.put("priority", ctx.getPriority());
        keyContext.put("params", params);
        try {
            return service + ":" + ctx.getOperation() + ":" + keyWriter.writeValueAsString(keyContext);
        } catch (JsonProcessingException e) {
            log.warn("Cache key serialization failed for [{}], using toString: {}", service, e.getMessage());
            return service + ":" + ctx.getOperation() + ":" + keyContext;
        }
    }

    private static Map<String, Object> mapOf(String key, Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(key, value);
        return map;
    }

    private static String requireString(Map<String, Object> params, String name) {
        Object value = params.get(name);
        if (!(value instanceof String s) || s.isBlank()) {
            throw new RequestValidationException(List.of(name + " is required"));
        }
        return s;
    }

    private static String requireResourceId(Map<String, Object> params, String name) {
        String value = requireString(params, name);
        if (!RESOURCE_ID.matcher(value).matches()) {
            throw new RequestValidationException(List.of(name + " has an invalid format"));
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> requireMap(Map<String, Object> params, String name) {
        if (!(params.get(name) instanceof Map<?, ?> map)) {
            throw new RequestValidationException(List.of(name + " is required"));
        }
        return (Map<String, Object>) map;
    }

    private static List<String> requireStringList(Map<String, Object> params, String name) {
        Object value = params.get(name);
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            list.stream().filter(Objects::nonNull).map(String::valueOf).forEach(result::add);
        } else if (value instanceof String s) {
            result.addAll(Arrays.asList(s.split("\\|")));
        }
        if (result.isEmpty()) {
            throw new RequestValidationException(List.of(name + " is required"));
        }
        return result;
    }

    /**
     * @param responses slot per operation, null where the operation never completed
     */
    private record ChunkOutcome(List<ServiceResponse<Object>> responses, StandardError abortError) {
    }
}
