package com.my.relay.adapter.out.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.CollectionType;
import com.my.relay.config.AppConfig;
import com.my.relay.domain.model.ConversationHandle;
import com.my.relay.domain.model.ConversationRef;
import com.my.relay.domain.model.MediaDescriptor;
import com.my.relay.domain.model.MessageContent;
import com.my.relay.domain.model.ProviderResult;
import com.my.relay.domain.model.RelayError;
import com.my.relay.domain.model.RelayErrorKind;
import com.my.relay.domain.port.out.ProviderPort;
import io.quarkus.arc.profile.UnlessBuildProfile;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * 왜: 이미 로그인된 프로바이더 세션을 감싼 브리지의 HTTP API 호출을 캡슐화하고,
 * 응답 오류를 도메인 실패 종류로 분류해 도메인이 전송 방식을 모르도록 하기 위함.
 *
 * <p>모든 응답은 {@code {"ok":true,"result":...}} 또는
 * {@code {"ok":false,"error_code":420,"description":"FLOOD_WAIT_35","parameters":{"retry_after":35}}} 형태다.
 */
@UnlessBuildProfile("dev")
@ApplicationScoped
public class HttpProviderGateway implements ProviderPort {

    private static final Logger log = Logger.getLogger(HttpProviderGateway.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiBase;
    private final Optional<String> apiToken;
    private final Duration timeout;
    private final Duration transferTimeout;

    @Inject
    public HttpProviderGateway(AppConfig appConfig, ObjectMapper objectMapper) {
        this(appConfig.provider(), objectMapper, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(appConfig.provider().connectTimeoutSeconds()))
                .build());
    }

    HttpProviderGateway(AppConfig.ProviderConfig providerConfig, ObjectMapper objectMapper, HttpClient httpClient) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.apiBase = providerConfig.baseUrl()
                .map(String::trim)
                .map(url -> url.endsWith("/") ? url.substring(0, url.length() - 1) : url)
                .orElse("");
        this.apiToken = providerConfig.apiToken().filter(token -> !token.isBlank());
        this.timeout = Duration.ofSeconds(providerConfig.timeoutSeconds());
        this.transferTimeout = Duration.ofSeconds(providerConfig.transferTimeoutSeconds());
    }

    @Override
    public ProviderResult<ConversationHandle> resolveConversation(ConversationRef ref) {
        return getJson("/conversations/resolve?ref=" + encode(ref.normalizedKey()), timeout)
                .map(node -> convert(node, ConversationPayload.class).toDomain());
    }

    @Override
    public ProviderResult<List<ConversationHandle>> listJoinedConversations(int limit) {
        CollectionType listType = objectMapper.getTypeFactory()
                .constructCollectionType(List.class, ConversationPayload.class);
        return getJson("/conversations?limit=" + limit, timeout)
                .map(node -> {
                    List<ConversationPayload> payloads = objectMapper.convertValue(node, listType);
                    return payloads.stream().map(ConversationPayload::toDomain).toList();
                });
    }

    @Override
    public ProviderResult<MessageContent> fetchMessage(long conversationId, long messageId) {
        return getJson("/conversations/" + conversationId + "/messages/" + messageId, timeout)
                .map(node -> convert(node, MessagePayload.class).toDomain());
    }

    @Override
    public ProviderResult<Void> relay(long conversationId, long messageId, long targetId) {
        return discard(postJson("/relay", new RelayPayload(conversationId, messageId, targetId), timeout));
    }

    @Override
    public ProviderResult<Void> republish(long targetId, MessageContent content) {
        MediaPayload media = content.hasMedia() ? MediaPayload.from(content.media()) : null;
        return discard(postJson("/republish",
                new RepublishPayload(targetId, content.text(), content.caption(), media), transferTimeout));
    }

    @Override
    public ProviderResult<Path> downloadToLocal(MediaDescriptor media, Path directory) {
        if (apiBase.isBlank()) {
            return notConfigured();
        }
        Path target = directory.resolve(UUID.randomUUID().toString().substring(0, 8) + "_" + safeFileName(media));
        try {
            HttpRequest request = requestBuilder("/media?reference=" + encode(media.reference()), transferTimeout)
                    .GET()
                    .build();
            HttpResponse<Path> response = httpClient.send(request, HttpResponse.BodyHandlers.ofFile(target));
            if (response.statusCode() >= 400) {
                String body = Files.readString(target, StandardCharsets.UTF_8);
                deleteQuietly(target);
                return ProviderResult.failure(classifyBody(response.statusCode(), body));
            }
            return ProviderResult.ok(response.body());
        } catch (IOException e) {
            deleteQuietly(target);
            return ProviderResult.failure(classifyIo(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            deleteQuietly(target);
            return ProviderResult.failure(RelayErrorKind.TRANSIENT, "다운로드가 중단되었습니다.");
        }
    }

    @Override
    public ProviderResult<Void> publishLocal(long targetId, Path localPath, String caption) {
        if (apiBase.isBlank()) {
            return notConfigured();
        }
        try {
            String query = "/publish-local?targetId=" + targetId
                    + "&fileName=" + encode(localPath.getFileName().toString())
                    + "&caption=" + encode(caption == null ? "" : caption);
            HttpRequest request = requestBuilder(query, transferTimeout)
                    .header("Content-Type", "application/octet-stream")
                    .POST(HttpRequest.BodyPublishers.ofFile(localPath))
                    .build();
            return discard(send(request));
        } catch (IOException e) {
            return ProviderResult.failure(classifyIo(e));
        }
    }

    @Override
    public ProviderResult<ConversationHandle> join(String inviteOrRef) {
        return postJson("/join", new JoinPayload(inviteOrRef), timeout)
                .map(node -> convert(node, ConversationPayload.class).toDomain());
    }

    /**
     * 프로바이더 오류 코드와 설명을 도메인 실패 종류로 분류한다. 알 수 없는 오류는 재시도하지 않는 FATAL이다.
     */
    static RelayError classify(int statusCode, String description, Integer retryAfterSeconds) {
        String detail = description == null || description.isBlank() ? "HTTP " + statusCode : description;
        String code = detail.toUpperCase(Locale.ROOT);
        if (retryAfterSeconds != null && retryAfterSeconds > 0) {
            return RelayError.throttled(Duration.ofSeconds(retryAfterSeconds), detail);
        }
        Optional<Duration> waitHint = waitFromCode(code);
        if (waitHint.isPresent()) {
            return RelayError.throttled(waitHint.get(), detail);
        }
        if (statusCode == 429) {
            return RelayError.of(RelayErrorKind.TRANSIENT, detail);
        }
        if (code.contains("FORWARDS_RESTRICTED") || code.contains("NOFORWARDS")) {
            return RelayError.of(RelayErrorKind.RESTRICTED, detail);
        }
        if (code.contains("MESSAGE_ID_INVALID") || code.contains("MESSAGE_NOT_FOUND") || code.contains("MESSAGE_EMPTY")) {
            return RelayError.of(RelayErrorKind.NOT_FOUND, detail);
        }
        if (code.contains("CHANNEL_PRIVATE") || code.contains("USER_NOT_PARTICIPANT")
                || code.contains("INVITE_REQUEST_SENT")) {
            return RelayError.of(RelayErrorKind.NEEDS_MEMBERSHIP, detail);
        }
        if (code.contains("PEER_ID_INVALID") || code.contains("CHANNEL_INVALID")
                || code.contains("USERNAME_NOT_OCCUPIED") || code.contains("USERNAME_INVALID")) {
            return RelayError.of(RelayErrorKind.RESOLUTION_FAILED, detail);
        }
        if (statusCode == 413 || code.contains("FILE_TOO_LARGE") || code.contains("FILE_PARTS_INVALID")) {
            return RelayError.of(RelayErrorKind.TOO_LARGE, detail);
        }
        if (statusCode == 404) {
            return RelayError.of(RelayErrorKind.NOT_FOUND, detail);
        }
        if (statusCode >= 500) {
            return RelayError.of(RelayErrorKind.TRANSIENT, detail);
        }
        return RelayError.of(RelayErrorKind.FATAL, detail);
    }

    private static Optional<Duration> waitFromCode(String code) {
        for (String prefix : List.of("FLOOD_WAIT_", "SLOWMODE_WAIT_", "FLOOD_PREMIUM_WAIT_")) {
            int index = code.indexOf(prefix);
            if (index < 0) {
                continue;
            }
            int start = index + prefix.length();
            int end = start;
            while (end < code.length() && Character.isDigit(code.charAt(end))) {
                end++;
            }
            if (end > start) {
                return Optional.of(Duration.ofSeconds(Long.parseLong(code.substring(start, end))));
            }
        }
        return Optional.empty();
    }

    static RelayError classifyIo(IOException e) {
        if (e instanceof HttpTimeoutException) {
            return RelayError.of(RelayErrorKind.TRANSIENT, "프로바이더 응답 시간 초과");
        }
        return RelayError.of(RelayErrorKind.TRANSIENT, "프로바이더 통신 오류: " + e.getMessage());
    }

    private ProviderResult<JsonNode> getJson(String path, Duration requestTimeout) {
        if (apiBase.isBlank()) {
            return notConfigured();
        }
        HttpRequest request = requestBuilder(path, requestTimeout).GET().build();
        return send(request);
    }

    private ProviderResult<JsonNode> postJson(String path, Object payload, Duration requestTimeout) {
        if (apiBase.isBlank()) {
            return notConfigured();
        }
        try {
            String body = objectMapper.writeValueAsString(payload);
            HttpRequest request = requestBuilder(path, requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            return send(request);
        } catch (IOException e) {
            return ProviderResult.failure(RelayErrorKind.FATAL, "요청 직렬화 실패: " + e.getMessage());
        }
    }

    private ProviderResult<JsonNode> send(HttpRequest request) {
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                log.warnf("프로바이더 호출 실패 uri=%s status=%d", request.uri().getPath(), response.statusCode());
                return ProviderResult.failure(classifyBody(response.statusCode(), response.body()));
            }
            ApiResponse apiResponse = objectMapper.readValue(response.body(), ApiResponse.class);
            if (!apiResponse.ok()) {
                return ProviderResult.failure(classify(
                        Optional.ofNullable(apiResponse.errorCode()).orElse(response.statusCode()),
                        apiResponse.description(), apiResponse.retryAfter()));
            }
            return ProviderResult.ok(Optional.ofNullable(apiResponse.result())
                    .orElseGet(() -> objectMapper.nullNode()));
        } catch (IOException e) {
            log.warnf("프로바이더 통신 중 예외 uri=%s: %s", request.uri().getPath(), e.getMessage());
            return ProviderResult.failure(classifyIo(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProviderResult.failure(RelayErrorKind.TRANSIENT, "프로바이더 호출이 중단되었습니다.");
        }
    }

    private RelayError classifyBody(int statusCode, String body) {
        try {
            ApiResponse apiResponse = objectMapper.readValue(body, ApiResponse.class);
            return classify(statusCode, apiResponse.description(), apiResponse.retryAfter());
        } catch (IOException | RuntimeException e) {
            return classify(statusCode, null, null);
        }
    }

    private HttpRequest.Builder requestBuilder(String pathAndQuery, Duration requestTimeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(apiBase + pathAndQuery))
                .timeout(requestTimeout);
        apiToken.ifPresent(token -> builder.header("Authorization", "Bearer " + token));
        return builder;
    }

    private <T> T convert(JsonNode node, Class<T> type) {
        return objectMapper.convertValue(node, type);
    }

    private <T> ProviderResult<T> notConfigured() {
        log.warn("프로바이더 주소가 설정되지 않아 호출을 건너뜁니다.");
        return ProviderResult.failure(RelayErrorKind.FATAL, "provider not configured");
    }

    private static ProviderResult<Void> discard(ProviderResult<JsonNode> result) {
        return result.isOk() ? ProviderResult.done() : ProviderResult.failure(result.error());
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    static String safeFileName(MediaDescriptor media) {
        String name = media.fileName();
        if (name == null || name.isBlank()) {
            name = "media";
        }
        String cleaned = Path.of(name.replace('\\', '/')).getFileName().toString()
                .replaceAll("[^A-Za-z0-9._-]", "_");
        return cleaned.isBlank() || cleaned.startsWith(".") ? "media" + cleaned : cleaned;
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warnf("부분 다운로드 파일 삭제 실패 path=%s: %s", path, e.getMessage());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ApiResponse(@JsonProperty("ok") boolean ok,
                               @JsonProperty("result") JsonNode result,
                               @JsonProperty("error_code") Integer errorCode,
                               @JsonProperty("description") String description,
                               @JsonProperty("parameters") ErrorParameters parameters) {

        Integer retryAfter() {
            return parameters == null ? null : parameters.retryAfter();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ErrorParameters(@JsonProperty("retry_after") Integer retryAfter) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ConversationPayload(@JsonProperty("id") long id,
                                       @JsonProperty("title") String title,
                                       @JsonProperty("username") String username,
                                       @JsonProperty("restricted") boolean restricted) {

        ConversationHandle toDomain() {
            return new ConversationHandle(id, title, username, restricted);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record MessagePayload(@JsonProperty("text") String text,
                                  @JsonProperty("caption") String caption,
                                  @JsonProperty("media") MediaPayload media) {

        MessageContent toDomain() {
            return new MessageContent(text, caption, media == null ? null : media.toDomain());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record MediaPayload(@JsonProperty("reference") String reference,
                                @JsonProperty("file_name") String fileName,
                                @JsonProperty("mime_type") String mimeType,
                                @JsonProperty("size") long size) {

        static MediaPayload from(MediaDescriptor media) {
            return new MediaPayload(media.reference(), media.fileName(), media.mimeType(), media.sizeBytes());
        }

        MediaDescriptor toDomain() {
            return new MediaDescriptor(reference, fileName, mimeType, size);
        }
    }

    private record RelayPayload(@JsonProperty("conversation_id") long conversationId,
                                @JsonProperty("message_id") long messageId,
                                @JsonProperty("target_id") long targetId) {
    }

    private record RepublishPayload(@JsonProperty("target_id") long targetId,
                                    @JsonProperty("text") String text,
                                    @JsonProperty("caption") String caption,
                                    @JsonProperty("media") MediaPayload media) {
    }

    private record JoinPayload(@JsonProperty("invite") String invite) {
    }
}
