package com.sashkomusic.catalogingest.infrastructure.client.ai;

import com.sashkomusic.catalogingest.domain.port.CoverArtGenerator;
import dev.langchain4j.data.image.Image;
import dev.langchain4j.model.image.ImageModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.util.Base64;
import java.util.Optional;

/**
 * Generates cover art through the configured langchain4j image model. Inactive when no image
 * model is configured.
 */
@Slf4j
@Component
public class AiCoverArtGenerator implements CoverArtGenerator {

    private final ObjectProvider<ImageModel> imageModelProvider;
    private final RestClient restClient;

    @Value("${cover-art.ai.enabled:true}")
    private boolean enabled;

    public AiCoverArtGenerator(ObjectProvider<ImageModel> imageModelProvider, RestClient.Builder restClientBuilder) {
        this.imageModelProvider = imageModelProvider;
        this.restClient = restClientBuilder.build();
    }

    @Override
    public Optional<byte[]> generate(String title, String artist, String genre) {
        ImageModel imageModel = imageModelProvider.getIfAvailable();
        if (!enabled || imageModel == null) {
            log.debug("AI cover art generation is not available");
            return Optional.empty();
        }

        String prompt = buildPrompt(title, artist, genre);
        try {
            log.info("Generating cover art for '{}' by '{}'", title, artist);
            Response<Image> response = imageModel.generate(prompt);
            Image image = response.content();
            if (image == null) {
                return Optional.empty();
            }
            if (image.base64Data() != null && !image.base64Data().isEmpty()) {
                return Optional.of(Base64.getDecoder().decode(image.base64Data()));
            }
            if (image.url() != null) {
                return Optional.ofNullable(download(image.url().toString()));
            }
        } catch (Exception ex) {
            log.warn("AI cover art generation failed for '{}': {}", title, ex.getMessage());
        }
        return Optional.empty();
    }

    String buildPrompt(String title, String artist, String genre) {
        StringBuilder prompt = new StringBuilder("Album cover artwork for the track \"")
                .append(title).append("\" by ").append(artist);
        if (genre != null && !genre.isBlank()) {
            prompt.append(", ").append(genre).append(" music");
        }
        return prompt.append(". Square format, no text, no lettering.").toString();
    }

    private byte[] download(String url) {
        byte[] imageData = restClient.get()
                .uri(url)
                .retrieve()
                .onStatus(status -> status.value() >= 400, (request, response) -> {
                    log.error("HTTP error downloading generated cover: {} {}", response.getStatusCode(), response.getStatusText());
                    throw new IOException("HTTP error: " + response.getStatusCode());
                })
                .body(byte[].class);

        if (imageData == null || imageData.length == 0) {
            log.warn("Empty response from generated cover URL");
            return null;
        }
        return imageData;
    }
}
