package com.example.configserver.controller;

import com.example.configserver.model.UiMetadata;
import com.example.configserver.service.UiMetadataService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@WebFluxTest(UiController.class)
class UiControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private UiMetadataService uiMetadataService;

    @Test
    void testUi_InlinesMetadata() {
        when(uiMetadataService.snapshot()).thenReturn(UiMetadata.builder()
            .basePath("/")
            .authEnabled(false)
            .environments(List.of(UiMetadata.EnvironmentMetadata.builder()
                .name("prod")
                .repoUrl("https://git.example.com/</script><script>alert(1)")
                .branch("main")
                .workdir("/data/prod")
                .subpath("")
                .lastCommit("abc123")
                .lastCommitDate("2024-03-01T12:30:00+02:00")
                .build()))
            .build());

        String html = webTestClient.get()
            .uri("/ui")
            .exchange()
            .expectStatus().isOk()
            .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_HTML)
            .expectBody(String.class)
            .returnResult()
            .getResponseBody();

        assertThat(html)
            .doesNotContain(UiController.META_MARKER)
            .contains("\"base_path\":\"/\"")
            .contains("\"last_commit\":\"abc123\"")
            .contains("\"auth_enabled\":false")
            .contains("<\\/script><script>alert(1)")
            .doesNotContain("</script><script>alert(1)");
    }
}
