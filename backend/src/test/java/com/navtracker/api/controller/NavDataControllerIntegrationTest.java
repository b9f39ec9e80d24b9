package com.navtracker.api.controller;

import com.navtracker.ingestion.adapter.debank.DebankClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@AutoConfigureWebTestClient
@Testcontainers(disabledWithoutDocker = true)
class NavDataControllerIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    DebankClient debankClient;

    @Test
    @DisplayName("user and wallet net flows are totalled and survive a reload")
    void netFlowsTotalled() {
        post("/api/v1/nav-data/data-it-1/netflows", "{\"netFlows\":1000}")
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.netFlows").value(v -> assertThat(new BigDecimal(String.valueOf(v))).isEqualByComparingTo("1000"));

        post("/api/v1/nav-data/data-it-1/wallet-netflows", "{\"walletAddress\":\"0xa\",\"netFlows\":-200}")
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.walletAddress").isEqualTo("0xa")
                .jsonPath("$.totalNetFlows").value(v -> assertThat(new BigDecimal(String.valueOf(v))).isEqualByComparingTo("800"));

        webTestClient.get().uri("/api/v1/nav-data/data-it-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.walletNetFlows['0xa']").value(v -> assertThat(new BigDecimal(String.valueOf(v))).isEqualByComparingTo("-200"))
                .jsonPath("$.totalNetFlows").value(v -> assertThat(new BigDecimal(String.valueOf(v))).isEqualByComparingTo("800"));
    }

    @Test
    @DisplayName("monthly NAVs feed the volatility figures")
    void monthlyVolatility() {
        post("/api/v1/nav-data/data-it-2/monthly", "{\"date\":\"2025-01-31\",\"nav\":100}").expectStatus().isOk();
        post("/api/v1/nav-data/data-it-2/monthly", "{\"date\":\"2025-02-28\",\"nav\":110}").expectStatus().isOk();
        post("/api/v1/nav-data/data-it-2/monthly", "{\"date\":\"2025-03-31\",\"nav\":99}").expectStatus().isOk();

        webTestClient.get().uri("/api/v1/nav-data/data-it-2/volatility")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.monthsOfData").isEqualTo(3)
                .jsonPath("$.monthlyHistory[0].month").isEqualTo("2025-03")
                .jsonPath("$.volatilityMetrics.annualizedVolatility")
                .value(v -> assertThat(new BigDecimal(String.valueOf(v))).isEqualByComparingTo("48.989796"));
    }

    @Test
    @DisplayName("missing amounts are rejected and reset removes the data")
    void validationAndReset() {
        post("/api/v1/nav-data/data-it-3/netflows", "{}")
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_REQUEST");

        post("/api/v1/nav-data/data-it-3/netflows", "{\"netFlows\":5}").expectStatus().isOk();

        webTestClient.delete().uri("/api/v1/nav-data/data-it-3")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.deleted").isEqualTo(1);
    }

    private WebTestClient.ResponseSpec post(String uri, String body) {
        return webTestClient.post().uri(uri)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange();
    }
}
