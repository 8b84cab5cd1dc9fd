package com.hyperfix.labels;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

@SpringBootTest(properties = {"app.pacing.enabled=false", "app.brands=CRF,SHARPIE"})
@AutoConfigureWebTestClient
public class LabelNormalizerApplicationTest {

    @Autowired
    private WebTestClient client;

    @Test
    public void healthReportsConfiguredCatalog() {
        client.get().uri("/healthz")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.ok").isEqualTo(true)
                .jsonPath("$.brands").isEqualTo(2)
                .jsonPath("$.runs").isEqualTo(0);
    }

    @Test
    public void crossOriginCallersCanReadTheExportFileName() {
        client.get().uri("/healthz")
                .header(HttpHeaders.ORIGIN, "http://backoffice.example")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "http://backoffice.example")
                .expectHeader().valueEquals(HttpHeaders.ACCESS_CONTROL_EXPOSE_HEADERS, HttpHeaders.CONTENT_DISPOSITION);
    }

    @Test
    public void normalizesThroughTheWiredPipeline() {
        client.post().uri("/labels/normalize")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("label", "marqueur sharpie noir 5 kg"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.corrected").isEqualTo("SHARPIE MARQUEUR NOIR 5KG");
    }

    @Test
    public void missingLabelIsABadRequest() {
        client.post().uri("/labels/normalize")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of())
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("bad_request");
    }
}
