package io.herald.core.dispatch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.Base64;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends messages to a group-robot style webhook ({@code POST .../send?key=...}).
 *
 * <p>Files go out in two steps: the bytes are uploaded to the sibling {@code upload_media}
 * endpoint and the returned {@code media_id} is then sent as a {@code file} message.
 */
public final class WebhookMessageDispatcher implements MessageDispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(WebhookMessageDispatcher.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public WebhookMessageDispatcher(Duration connectTimeout, Duration readTimeout, Duration writeTimeout, Duration callTimeout) {
        this(new OkHttpClient.Builder()
            .connectTimeout(connectTimeout)
            .readTimeout(readTimeout)
            .writeTimeout(writeTimeout)
            .callTimeout(callTimeout)
            .build());
    }

    public WebhookMessageDispatcher(OkHttpClient client) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = new ObjectMapper();
    }

    @Override
    public DispatchResult dispatch(String webhookUrl, OutboundMessage message) {
        HttpUrl url = webhookUrl == null ? null : HttpUrl.parse(webhookUrl.trim());
        if (url == null) {
            return DispatchResult.failed(DispatchStatus.INVALID_MESSAGE, "invalid webhook url: " + webhookUrl);
        }
        if (message == null) {
            return DispatchResult.failed(DispatchStatus.INVALID_MESSAGE, "message must not be null");
        }

        MessageKind kind = message.kind();
        if (kind == null) {
            LOG.warn("Message without kind sent as text to {}", redact(url));
            kind = MessageKind.TEXT;
        }

        DispatchResult result = switch (kind) {
            case TEXT, MARKDOWN -> sendContent(url, kind, message.content());
            case IMAGE -> sendImage(url, message.filePath());
            case FILE -> sendFile(url, message.filePath());
        };

        if (result.success()) {
            LOG.info("Delivered {} message to {}", kind.wireName(), redact(url));
        } else {
            LOG.warn("Delivery of {} message to {} failed: {} {}", kind.wireName(), redact(url), result.status(), result.message());
        }
        return result;
    }

    private DispatchResult sendContent(HttpUrl url, MessageKind kind, String content) {
        if (content == null || content.isBlank()) {
            return DispatchResult.failed(DispatchStatus.INVALID_MESSAGE, kind.wireName() + " message requires content");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("content", content);
        return post(url, payload(kind.wireName(), body), DispatchStatus.DELIVERY_FAILED);
    }

    private DispatchResult sendImage(HttpUrl url, String filePath) {
        if (filePath == null || filePath.isBlank()) {
            return DispatchResult.failed(DispatchStatus.INVALID_MESSAGE, "image message requires a file path");
        }
        Path path = Path.of(filePath);
        if (!Files.isRegularFile(path)) {
            return DispatchResult.failed(DispatchStatus.FILE_NOT_FOUND, "file not found: " + filePath);
        }

        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            return DispatchResult.failed(DispatchStatus.FILE_NOT_FOUND, "cannot read " + filePath + ": " + e.getMessage());
        }

        Map<String, Object> image = new LinkedHashMap<>();
        image.put("base64", Base64.getEncoder().encodeToString(bytes));
        image.put("md5", md5(bytes));
        return post(url, payload("image", image), DispatchStatus.DELIVERY_FAILED);
    }

    private DispatchResult sendFile(HttpUrl url, String filePath) {
        if (filePath == null || filePath.isBlank()) {
            return DispatchResult.failed(DispatchStatus.INVALID_MESSAGE, "file message requires a file path");
        }
        Path path = Path.of(filePath);
        if (!Files.isRegularFile(path)) {
            return DispatchResult.failed(DispatchStatus.FILE_NOT_FOUND, "file not found: " + filePath);
        }

        RequestBody multipart = new MultipartBody.Builder()
            .setType(MultipartBody.FORM)
            .addFormDataPart("media", path.getFileName().toString(), RequestBody.create(path.toFile(), OCTET_STREAM))
            .build();
        Request upload = new Request.Builder().url(uploadUrlFor(url)).post(multipart).build();
        DispatchResult uploaded = execute(upload, DispatchStatus.UPLOAD_FAILED, WebhookMessageDispatcher::judgeUpload);
        if (!uploaded.success()) {
            return uploaded;
        }

        Map<String, Object> file = new LinkedHashMap<>();
        file.put("media_id", String.valueOf(uploaded.response().get("media_id")));
        return post(url, payload("file", file), DispatchStatus.DELIVERY_FAILED);
    }

    /** Replaces the terminal path segment ({@code send}) with {@code upload_media} and adds {@code type=file}. */
    static HttpUrl uploadUrlFor(HttpUrl webhookUrl) {
        List<String> segments = webhookUrl.pathSegments();
        return webhookUrl.newBuilder()
            .setPathSegment(segments.size() - 1, "upload_media")
            .addQueryParameter("type", "file")
            .build();
    }

    private Map<String, Object> payload(String msgtype, Map<String, Object> body) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("msgtype", msgtype);
        payload.put(msgtype, body);
        return payload;
    }

    private DispatchResult post(HttpUrl url, Map<String, Object> payload, DispatchStatus failureStatus) {
        RequestBody body;
        try {
            body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        } catch (IOException e) {
            return DispatchResult.failed(DispatchStatus.INVALID_MESSAGE, "cannot encode payload: " + e.getMessage());
        }
        return execute(new Request.Builder().url(url).post(body).build(), failureStatus, WebhookMessageDispatcher::judgeSend);
    }

    private DispatchResult execute(Request request, DispatchStatus failureStatus, ResponseCheck check) {
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String raw = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                return DispatchResult.failed(failureStatus, "HTTP " + response.code() + " " + raw);
            }

            Map<String, Object> parsed;
            try {
                parsed = raw.isBlank() ? Map.of() : mapper.readValue(raw, JSON_OBJECT);
            } catch (IOException e) {
                return DispatchResult.failed(failureStatus, "unparsable response: " + truncate(raw, 200));
            }

            return check.judge(parsed, failureStatus);
        } catch (IOException e) {
            return DispatchResult.failed(failureStatus, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    private static DispatchResult judgeSend(Map<String, Object> parsed, DispatchStatus failureStatus) {
        Object errcode = parsed.get("errcode");
        if (!(errcode instanceof Number number)) {
            return new DispatchResult(failureStatus, null, "response has no errcode", parsed);
        }
        if (number.intValue() != 0) {
            return new DispatchResult(failureStatus, number.intValue(), errmsg(parsed, number.intValue()), parsed);
        }
        return DispatchResult.sent(parsed);
    }

    // an upload succeeds on its media_id alone; errcode only explains a missing one
    private static DispatchResult judgeUpload(Map<String, Object> parsed, DispatchStatus failureStatus) {
        Object mediaId = parsed.get("media_id");
        if (mediaId != null && !String.valueOf(mediaId).isBlank()) {
            return DispatchResult.sent(parsed);
        }
        Integer code = parsed.get("errcode") instanceof Number number ? number.intValue() : null;
        String message = code != null && code != 0 ? errmsg(parsed, code) : "upload response has no media_id";
        return new DispatchResult(failureStatus, code, message, parsed);
    }

    private static String errmsg(Map<String, Object> parsed, int code) {
        return String.valueOf(parsed.getOrDefault("errmsg", "errcode " + code));
    }

    private static String md5(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("MD5").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    // the key query parameter is a credential
    private static String redact(HttpUrl url) {
        return url.newBuilder().query(null).build().toString();
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }

    @FunctionalInterface
    private interface ResponseCheck {
        DispatchResult judge(Map<String, Object> parsed, DispatchStatus failureStatus);
    }
}
