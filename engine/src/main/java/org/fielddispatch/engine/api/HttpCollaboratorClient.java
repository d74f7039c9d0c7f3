package org.fielddispatch.engine.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.OkHttpClient;
import org.fielddispatch.engine.api.dto.ExecutorDto;
import org.fielddispatch.engine.api.dto.TicketDto;
import org.fielddispatch.engine.domain.model.Executor;
import org.fielddispatch.engine.domain.model.Ticket;
import org.fielddispatch.engine.exception.DependencyUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retrofit2.Call;
import retrofit2.Response;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;
import retrofit2.http.Body;
import retrofit2.http.GET;
import retrofit2.http.POST;
import retrofit2.http.PUT;
import retrofit2.http.Path;
import retrofit2.http.Query;

import java.io.IOException;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Retrofit-based implementation of all four collaborator clients.
 * Every failure, including a non-2xx status, surfaces as
 * {@link DependencyUnavailableException} for the resilience layer to handle.
 */
public final class HttpCollaboratorClient
        implements TicketDataClient, ExecutorRosterClient, PermissionClient, NotificationClient {

    private static final Logger log = LoggerFactory.getLogger(HttpCollaboratorClient.class);

    static final String TICKET_DATA = "ticket-data";
    static final String EXECUTOR_ROSTER = "executor-roster";
    static final String PERMISSION_CHECK = "permission-check";
    static final String NOTIFICATION = "notification";

    private final CollaboratorApiService api;

    public HttpCollaboratorClient(String baseUrl, String serviceToken, Duration readTimeout) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        Objects.requireNonNull(readTimeout, "readTimeout must not be null");

        String normalizedUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";

        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(readTimeout)
                .readTimeout(readTimeout)
                .writeTimeout(readTimeout)
                .addInterceptor(new AuthInterceptor(serviceToken))
                .build();

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(normalizedUrl)
                .addConverterFactory(JacksonConverterFactory.create(createObjectMapper()))
                .client(client)
                .build();

        this.api = retrofit.create(CollaboratorApiService.class);
    }

    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public Ticket getTicket(String ticketId) {
        TicketDto dto = requireBody(execute(api.getTicket(ticketId), TICKET_DATA, "GET /v1/tickets/{id}"),
                TICKET_DATA, "GET /v1/tickets/{id}");
        try {
            return dto.toTicket();
        } catch (RuntimeException e) {
            throw new DependencyUnavailableException(TICKET_DATA, "Malformed ticket " + ticketId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void updateTicketAssignment(String ticketId, String executorId, Map<String, Object> metadata) {
        AssignmentUpdateRequest request = new AssignmentUpdateRequest(executorId,
                metadata != null ? metadata : Collections.emptyMap());
        execute(api.updateAssignment(ticketId, request), TICKET_DATA, "PUT /v1/tickets/{id}/assignment");
    }

    @Override
    public List<Executor> listAvailableExecutors(String skillFilter) {
        List<ExecutorDto> dtos = requireBody(
                execute(api.listAvailableExecutors(skillFilter), EXECUTOR_ROSTER, "GET /v1/executors/available"),
                EXECUTOR_ROSTER, "GET /v1/executors/available");
        try {
            return dtos.stream().map(ExecutorDto::toExecutor).collect(Collectors.toList());
        } catch (RuntimeException e) {
            throw new DependencyUnavailableException(EXECUTOR_ROSTER, "Malformed roster entry: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean canAssign(String userId, String ticketId) {
        PermissionResponse response = requireBody(
                execute(api.canAssign(userId, ticketId), PERMISSION_CHECK, "GET /v1/permissions/can-assign"),
                PERMISSION_CHECK, "GET /v1/permissions/can-assign");
        return response.isAllowed();
    }

    @Override
    public void notify(String userId, String message, NotificationPriority priority) {
        NotificationRequest request = new NotificationRequest(userId, message, priority.value());
        execute(api.sendNotification(request), NOTIFICATION, "POST /v1/notifications");
    }

    /**
     * Execute a Retrofit call and return the (possibly null) body.
     */
    private <T> T execute(Call<T> call, String dependency, String description) {
        Response<T> response;
        try {
            response = call.execute();
        } catch (IOException e) {
            log.warn("[API] {} error: {}", description, e.getMessage());
            throw new DependencyUnavailableException(dependency, description + " failed: " + e.getMessage(), e);
        }
        if (!response.isSuccessful()) {
            log.warn("[API] {} failed: {} {}", description, response.code(), response.message());
            throw new DependencyUnavailableException(dependency,
                    String.format("%s returned HTTP %d", description, response.code()));
        }
        return response.body();
    }

    private static <T> T requireBody(T body, String dependency, String description) {
        if (body == null) {
            throw new DependencyUnavailableException(dependency, description + " returned an empty body");
        }
        return body;
    }

    /**
     * Retrofit service interface for the collaborator endpoints.
     */
    interface CollaboratorApiService {
        @GET("v1/tickets/{ticketId}")
        Call<TicketDto> getTicket(@Path("ticketId") String ticketId);

        @PUT("v1/tickets/{ticketId}/assignment")
        Call<Void> updateAssignment(@Path("ticketId") String ticketId, @Body AssignmentUpdateRequest request);

        @GET("v1/executors/available")
        Call<List<ExecutorDto>> listAvailableExecutors(@Query("skill") String skill);

        @GET("v1/permissions/can-assign")
        Call<PermissionResponse> canAssign(@Query("user_id") String userId, @Query("ticket_id") String ticketId);

        @POST("v1/notifications")
        Call<Void> sendNotification(@Body NotificationRequest request);
    }

    /**
     * Request DTO for recording an assignment.
     */
    static final class AssignmentUpdateRequest {
        @JsonProperty("executor_id")
        private final String executorId;

        @JsonProperty("metadata")
        private final Map<String, Object> metadata;

        AssignmentUpdateRequest(String executorId, Map<String, Object> metadata) {
            this.executorId = executorId;
            this.metadata = metadata;
        }

        public String getExecutorId() {
            return executorId;
        }

        public Map<String, Object> getMetadata() {
            return metadata;
        }
    }

    /**
     * Request DTO for notifications.
     */
    static final class NotificationRequest {
        @JsonProperty("user_id")
        private final String userId;

        @JsonProperty("message")
        private final String message;

        @JsonProperty("priority")
        private final String priority;

        NotificationRequest(String userId, String message, String priority) {
            this.userId = userId;
            this.message = message;
            this.priority = priority;
        }

        public String getUserId() {
            return userId;
        }

        public String getMessage() {
            return message;
        }

        public String getPriority() {
            return priority;
        }
    }

    /**
     * Response DTO of the permission check.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class PermissionResponse {
        @JsonProperty("allowed")
        private boolean allowed;

        public boolean isAllowed() {
            return allowed;
        }

        public void setAllowed(boolean allowed) {
            this.allowed = allowed;
        }
    }
}
