package com.my.jamla.adapter.out.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.jamla.config.AppConfig;
import com.my.jamla.domain.model.ChannelHandle;
import com.my.jamla.domain.model.ChannelInfo;
import com.my.jamla.domain.model.DeliveryResult;
import com.my.jamla.domain.model.MessageRef;
import com.my.jamla.domain.model.ResolveResult;
import com.my.jamla.domain.port.out.ChannelTransportPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

/**
 * 왜: 텔레그램 Bot HTTP API 호출을 캡슐화해 전송 포트 구현을 단순화하기 위함.
 * 모든 실패는 예외 대신 {@link ResolveResult}/{@link DeliveryResult} 상태로 돌려준다.
 */
@ApplicationScoped
public class TelegramBotClient implements ChannelTransportPort {

    private static final Logger log = Logger.getLogger(TelegramBotClient.class);

    static final int TOO_MANY_REQUESTS = 429;
    static final int FORBIDDEN = 403;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiBase;
    private final Duration requestTimeout;

    @Inject
    public TelegramBotClient(AppConfig appConfig, ObjectMapper objectMapper) {
        this(appConfig, objectMapper, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build());
    }

    TelegramBotClient(AppConfig appConfig, ObjectMapper objectMapper, HttpClient httpClient) {
        AppConfig.TelegramConfig telegramConfig = appConfig.telegram();
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
        this.requestTimeout = Duration.ofSeconds(telegramConfig.requestTimeoutSeconds());
        this.apiBase = telegramConfig.botToken()
                .filter(token -> !token.isBlank())
                .map(token -> telegramConfig.apiBaseUrl() + "/bot" + token)
                .orElse("");
    }

    @Override
    public ResolveResult resolveChannel(ChannelHandle handle) {
        Optional<ApiResponse> response = call("getChat", new GetChatRequest("@" + handle.value()));
        if (response.isEmpty()) {
            return ResolveResult.notFound();
        }
        ApiResponse apiResponse = response.get();
        if (!apiResponse.ok()) {
            if (apiResponse.isRateLimited()) {
                return ResolveResult.rateLimited(apiResponse.retryAfterSeconds());
            }
            if (apiResponse.errorCode() == FORBIDDEN) {
                log.infof("비공개 채널입니다: %s", handle);
                return ResolveResult.privateChannel();
            }
            log.infof("채널을 찾지 못했습니다: %s (%s)", handle, apiResponse.description());
            return ResolveResult.notFound();
        }
        try {
            ChatResult chat = objectMapper.treeToValue(apiResponse.result(), ChatResult.class);
            if (chat == null || !"channel".equals(chat.type())) {
                log.infof("채널이 아닌 대화입니다: %s", handle);
                return ResolveResult.notFound();
            }
            return ResolveResult.found(new ChannelInfo(handle, chat.id(), chat.title()));
        } catch (IOException e) {
            log.warnf("getChat 응답 해석 실패: %s", e.getMessage());
            return ResolveResult.notFound();
        }
    }

    @Override
    public DeliveryResult notify(long userId, String text) {
        return toDeliveryResult("sendMessage", call("sendMessage", new SendMessageRequest(userId, text, "HTML", true)));
    }

    @Override
    public DeliveryResult forward(long userId, MessageRef messageRef) {
        return toDeliveryResult("forwardMessage", call("forwardMessage",
                new ForwardMessageRequest(userId, messageRef.externalChannelId(), messageRef.externalMessageId())));
    }

    private DeliveryResult toDeliveryResult(String method, Optional<ApiResponse> response) {
        if (response.isEmpty()) {
            return DeliveryResult.failed(method + " 호출 실패");
        }
        ApiResponse apiResponse = response.get();
        if (apiResponse.ok()) {
            return DeliveryResult.ok();
        }
        if (apiResponse.isRateLimited()) {
            return DeliveryResult.rateLimited(apiResponse.retryAfterSeconds());
        }
        return DeliveryResult.failed(apiResponse.description());
    }

    private Optional<ApiResponse> call(String method, Object payload) {
        if (apiBase.isBlank()) {
            log.warnf("텔레그램 봇 토큰이 설정되지 않아 %s 호출을 건너뜁니다.", method);
            return Optional.empty();
        }
        try {
            String body = objectMapper.writeValueAsString(payload);
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiBase + "/" + method))
                    .header("Content-Type", "application/json")
                    .timeout(requestTimeout)
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            ApiResponse apiResponse = objectMapper.readValue(response.body(), ApiResponse.class);
            if (response.statusCode() >= 400 && apiResponse.errorCode() != TOO_MANY_REQUESTS) {
                log.debugf("텔레그램 %s 실패 status=%d body=%s", method, response.statusCode(), response.body());
            }
            return Optional.of(apiResponse);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warnf("텔레그램 %s 호출 중 인터럽트", method);
            return Optional.empty();
        } catch (Exception e) {
            log.warnf("텔레그램 %s 호출 중 예외: %s", method, e.getMessage());
            return Optional.empty();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ApiResponse(@JsonProperty("ok") boolean ok,
                       @JsonProperty("result") JsonNode result,
                       @JsonProperty("error_code") int errorCode,
                       @JsonProperty("description") String description,
                       @JsonProperty("parameters") ResponseParameters parameters) {

        boolean isRateLimited() {
            return errorCode == TOO_MANY_REQUESTS;
        }

        long retryAfterSeconds() {
            return parameters == null || parameters.retryAfter() == null ? 1L : parameters.retryAfter();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ResponseParameters(@JsonProperty("retry_after") Long retryAfter) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatResult(@JsonProperty("id") long id,
                      @JsonProperty("type") String type,
                      @JsonProperty("title") String title,
                      @JsonProperty("username") String username) {
    }

    private record GetChatRequest(@JsonProperty("chat_id") String chatId) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record SendMessageRequest(@JsonProperty("chat_id") long chatId,
                                      @JsonProperty("text") String text,
                                      @JsonProperty("parse_mode") String parseMode,
                                      @JsonProperty("disable_web_page_preview") Boolean disableWebPagePreview) {
    }

    private record ForwardMessageRequest(@JsonProperty("chat_id") long chatId,
                                         @JsonProperty("from_chat_id") long fromChatId,
                                         @JsonProperty("message_id") long messageId) {
    }
}
