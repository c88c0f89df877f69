package com.threatintel.riskengine.infra.secondary;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.threatintel.riskengine.domain.model.SeverityTier;
import com.threatintel.riskengine.domain.port.SecondarySeveritySignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Looks up the secondary classifier's tier over HTTP.
 * <p>
 * 404 and an absent {@code tier} field mean the classifier has no opinion. Transport errors
 * and other non-2xx responses are raised as {@link SecondarySignalUnavailableException}.
 */
@Slf4j
@RequiredArgsConstructor
public class HttpSecondarySeveritySignal implements SecondarySeveritySignal {

    private final OkHttpClient okHttpClient;
    private final SecondarySignalProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<SeverityTier> tierFor(String recordId) {
        String url = properties.getBaseUrl()
                + properties.getTierPath().replace("{recordId}", URLEncoder.encode(recordId, StandardCharsets.UTF_8));

        Request request = new Request.Builder().url(url).get().build();

        try (Response response = okHttpClient.newCall(request).execute()) {
            if (response.code() == 404) {
                return Optional.empty();
            }
            if (!response.isSuccessful()) {
                throw new SecondarySignalUnavailableException(
                        "secondary tier lookup failed: recordId=" + recordId + ", code=" + response.code());
            }

            ResponseBody body = response.body();
            if (body == null) return Optional.empty();

            JsonNode tier = objectMapper.readTree(body.string()).path("tier");
            if (tier.isMissingNode() || tier.isNull() || tier.asText().isBlank()) {
                return Optional.empty();
            }

            SeverityTier parsed = SeverityTier.fromLabel(tier.asText());
            log.debug("[Secondary] tier received: recordId={}, tier={}", recordId, parsed);
            return Optional.ofNullable(parsed);

        } catch (IOException e) {
            throw new SecondarySignalUnavailableException("secondary tier lookup failed: recordId=" + recordId, e);
        }
    }
}
