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
class NavControllerIntegrationTest {

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
    @DisplayName("GET creates default settings; the first month has no prior NAV to load")
    void getCreatesDefaults() {
        webTestClient.get().uri("/api/v1/nav/nav-it-1/2025/3")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.year").isEqualTo(2025)
                .jsonPath("$.month").isEqualTo(3)
                .jsonPath("$.feeSettings.priorPreFeeNavSource").isEqualTo("FALLBACK_NEEDED")
                .jsonPath("$.feeSettings.annualExpense").value(v -> assertThat(new BigDecimal(String.valueOf(v))).isEqualByComparingTo("600"));

        webTestClient.get().uri("/api/v1/nav/nav-it-1/months")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].month").isEqualTo(3)
                .jsonPath("$[0].monthName").isEqualTo("March");
    }

    @Test
    @DisplayName("a saved month seeds the next month's prior NAV")
    void savedMonthSeedsNextMonth() {
        webTestClient.post().uri("/api/v1/nav/nav-it-2/2024/12")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"feeSettings":{"annualExpense":600,"monthlyExpense":50,"performanceFeeRate":0.25,
                                        "accruedPerformanceFeeRate":0.25,"priorPreFeeNav":9000},
                         "navCalculations":{"preFeeNav":10000,"performance":1000,"totalAssets":10000,"netAssets":9750}}
                        """)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.calculationDate").exists()
                .jsonPath("$.navCalculations.validationWarnings.length()").isEqualTo(0);

        webTestClient.get().uri("/api/v1/nav/nav-it-2/2025/1/prior")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.found").isEqualTo(true)
                .jsonPath("$.source").isEqualTo("AUTO_LOADED")
                .jsonPath("$.message").isEqualTo("Loaded from December 2024 NAV report")
                .jsonPath("$.priorPreFeeNav").value(v -> assertThat(new BigDecimal(String.valueOf(v))).isEqualByComparingTo("10000"));

        webTestClient.get().uri("/api/v1/nav/nav-it-2/2025/1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.feeSettings.priorPreFeeNavSource").isEqualTo("AUTO_LOADED");

        webTestClient.get().uri("/api/v1/nav/nav-it-2/history?limit=1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].year").isEqualTo(2025);
    }

    @Test
    @DisplayName("calculate with save stores the computed NAV; without a portfolio every figure is zero")
    void calculateAndSave() {
        webTestClient.post().uri("/api/v1/nav/nav-it-3/2025/2/calculate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"save":true}
                        """)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.portfolioData").exists()
                .jsonPath("$.navCalculations.investments").value(v -> assertThat(new BigDecimal(String.valueOf(v))).isEqualByComparingTo("0"));
    }

    @Test
    @DisplayName("month 13 is rejected with INVALID_PERIOD")
    void invalidPeriod() {
        webTestClient.get().uri("/api/v1/nav/nav-it-4/2025/13")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_PERIOD");
    }

    @Test
    @DisplayName("a fee rate above 1 is rejected with INVALID_FEE_SETTINGS")
    void invalidFeeSettings() {
        webTestClient.post().uri("/api/v1/nav/nav-it-5/2025/1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"feeSettings":{"performanceFeeRate":1.5}}
                        """)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_FEE_SETTINGS");
    }

    @Test
    @DisplayName("deleting a missing month returns 404; reset reports how many months were removed")
    void deleteAndReset() {
        webTestClient.delete().uri("/api/v1/nav/nav-it-6/2025/1")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("NAV_NOT_FOUND");

        webTestClient.get().uri("/api/v1/nav/nav-it-6/2025/1").exchange().expectStatus().isOk();
        webTestClient.get().uri("/api/v1/nav/nav-it-6/2025/2").exchange().expectStatus().isOk();

        webTestClient.delete().uri("/api/v1/nav/nav-it-6/2025/2")
                .exchange()
                .expectStatus().isNoContent();

        webTestClient.delete().uri("/api/v1/nav/nav-it-6")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.deleted").isEqualTo(1);
    }
}
